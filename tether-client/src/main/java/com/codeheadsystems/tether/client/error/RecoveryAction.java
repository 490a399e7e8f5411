package com.codeheadsystems.tether.client.error;

/**
 * What the user can do about a failure.
 */
public enum RecoveryAction {
  /** Start the same flow again. */
  RETRY,
  /** The stored grant is dead; connect the provider again. */
  REAUTHORIZE,
  /** Nothing on the device will fix it. */
  CONTACT_SUPPORT
}
