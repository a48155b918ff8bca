package com.ontologymarket.auth.model;

public enum IdentitySource {
  VERIFIED_TOKEN("verified-token"),
  DEV_BYPASS("dev-bypass");

  private final String code;

  IdentitySource(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }
}
