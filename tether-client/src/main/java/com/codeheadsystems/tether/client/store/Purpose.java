package com.codeheadsystems.tether.client.store;

/**
 * What an ephemeral entry holds during an in-flight authorization.
 */
public enum Purpose {
  CODE_VERIFIER,
  OAUTH_STATE
}
