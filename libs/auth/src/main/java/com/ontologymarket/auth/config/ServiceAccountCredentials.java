package com.ontologymarket.auth.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Public parts of an identity-provider service-account document. The private key is never read
 * into this record.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ServiceAccountCredentials(
    @JsonProperty("type") String type,
    @JsonProperty("project_id") String projectId,
    @JsonProperty("private_key_id") String privateKeyId,
    @JsonProperty("client_email") String clientEmail,
    @JsonProperty("client_id") String clientId) {

  public static final String SERVICE_ACCOUNT_TYPE = "service_account";
}
