/*
 * どこで: libs/auth の認証モデル
 * 何を: 認証境界を通過した呼び出し元の識別情報
 * なぜ: 検証済みトークン由来か開発用バイパス由来かを下流処理や監査で区別するため
 */
package com.ontologymarket.auth.model;

import java.util.Objects;

/**
 * Identity of the caller of a single request. Built fresh for every request and attached only to
 * that request; never cached.
 */
public record CallerIdentity(
    String subject, String email, boolean emailVerified, IdentitySource source) {

  public static final String REQUEST_ATTRIBUTE = CallerIdentity.class.getName();

  public CallerIdentity {
    if (subject == null || subject.isBlank()) {
      throw new IllegalArgumentException("subject is required");
    }
    Objects.requireNonNull(source, "source is required");
  }

  public static CallerIdentity verifiedToken(String subject, String email, boolean emailVerified) {
    return new CallerIdentity(subject, email, emailVerified, IdentitySource.VERIFIED_TOKEN);
  }

  public static CallerIdentity devBypass(String email) {
    return new CallerIdentity(email, email, true, IdentitySource.DEV_BYPASS);
  }

  /** Key used to own marketplace data: the email when present, the subject otherwise. */
  public String ownerKey() {
    return email == null || email.isBlank() ? subject : email;
  }
}
