/*
 * どこで: search-ontologies 関数のエントリポイント
 * 何を: 検索エンドポイントを単独の Spring Boot アプリとして起動する
 * なぜ: 関数ごとに独立してデプロイ/スケールしつつ、認証境界は共通ライブラリから取り込むため
 */
package com.ontologymarket.search_ontologies;

import com.ontologymarket.auth.config.MarketplaceAuthConfig;
import com.ontologymarket.common.catalog.CatalogConfig;
import com.ontologymarket.common.config.MarketplaceCommonConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@Import({MarketplaceCommonConfig.class, MarketplaceAuthConfig.class, CatalogConfig.class})
public class SearchOntologiesApplication {

  public static void main(String[] args) {
    SpringApplication.run(SearchOntologiesApplication.class, args);
  }
}
