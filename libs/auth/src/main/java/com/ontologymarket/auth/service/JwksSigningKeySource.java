package com.ontologymarket.auth.service;

import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.RSAKey;
import java.net.URI;
import java.text.ParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/** Reads RSA signing keys from a JWKS document over HTTP. */
@RequiredArgsConstructor
public class JwksSigningKeySource implements SigningKeySource {

  private static final Logger logger = LoggerFactory.getLogger(JwksSigningKeySource.class);

  private final RestClient restClient;
  private final URI jwksUri;

  @Override
  public Map<String, RSAKey> fetch() {
    final String body;
    try {
      body =
          restClient
              .get()
              .uri(jwksUri)
              .accept(MediaType.APPLICATION_JSON)
              .retrieve()
              .body(String.class);
    } catch (RestClientException ex) {
      throw new SigningKeyUnavailableException("signing key fetch failed", ex);
    }
    if (body == null || body.isBlank()) {
      throw new SigningKeyUnavailableException("signing key response is empty");
    }

    final JWKSet jwkSet;
    try {
      jwkSet = JWKSet.parse(body);
    } catch (ParseException ex) {
      throw new SigningKeyUnavailableException("signing key response is not a JWK set", ex);
    }

    final Map<String, RSAKey> keys = new LinkedHashMap<>();
    for (JWK jwk : jwkSet.getKeys()) {
      if (jwk instanceof RSAKey rsaKey && rsaKey.getKeyID() != null) {
        keys.put(rsaKey.getKeyID(), rsaKey.toPublicJWK());
      }
    }
    logger.debug("signing keys fetched uri={} keys={}", jwksUri, keys.keySet());
    return Map.copyOf(keys);
  }
}
