package com.ontologymarket.auth.service;

import com.nimbusds.jose.jwk.RSAKey;
import java.util.Map;

/** Fetches the identity provider's current token signing keys. */
public interface SigningKeySource {

  /**
   * Fetches the published RSA signing keys.
   *
   * @return keys indexed by key id
   * @throws SigningKeyUnavailableException if the key set cannot be fetched or parsed
   */
  Map<String, RSAKey> fetch();
}
