/*
 * どこで: libs/auth Web 層
 * 何を: 認証境界が返すエラー応答の標準フォーマットを定義する
 * なぜ: 各関数の例外ハンドラと認証境界でレスポンス形状を統一するため
 */
package com.ontologymarket.auth.web;

public record ApiErrorResponse(String code, String message) {}
