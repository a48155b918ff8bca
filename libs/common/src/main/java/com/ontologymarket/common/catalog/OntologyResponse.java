/*
 * どこで: Catalog 共通レスポンス
 * 何を: success/message/data 形式のエンベロープ
 * なぜ: 各関数エンドポイントの応答形式を揃え、フロントエンド側の分岐を共通化するため
 */
package com.ontologymarket.common.catalog;

import java.util.Map;

public record OntologyResponse(boolean success, String message, Map<String, Object> data) {

  public OntologyResponse {
    data = data == null ? null : Map.copyOf(data);
  }

  public static OntologyResponse ok(String message, Map<String, Object> data) {
    return new OntologyResponse(true, message, data);
  }

  public static OntologyResponse failure(String message, Map<String, Object> data) {
    return new OntologyResponse(false, message, data);
  }
}
