package com.codeheadsystems.callback.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.callback.crypto.CredentialSet;
import com.codeheadsystems.callback.crypto.KeyMaterial;
import com.codeheadsystems.callback.exceptions.ConfigException;

/**
 * Health check that verifies the configured key derives to a usable AES-256 key.
 */
public class KeyMaterialHealthCheck extends HealthCheck {

  private final CredentialSet credentials;

  /**
   * Instantiates a new Key material health check.
   *
   * @param credentials the credentials
   */
  public KeyMaterialHealthCheck(CredentialSet credentials) {
    this.credentials = credentials;
  }

  @Override
  protected Result check() {
    KeyMaterial keyMaterial;
    try {
      keyMaterial = credentials.keyMaterial();
    } catch (ConfigException e) {
      return Result.unhealthy("Key material could not be derived");
    }
    if (keyMaterial.key().length != KeyMaterial.KEY_LENGTH) {
      return Result.unhealthy("Key material has the wrong length");
    }
    return Result.healthy("receiverCheck=%s", credentials.expectedReceiverId().isPresent());
  }
}
