package io.b2mash.b2b.banklink.integration.banking.connection;

/**
 * Stored connection states. A tenant without a row is "not connected". {@code EXPIRED} is the
 * degraded state after a failed token refresh and prompts the user to reconnect.
 */
public enum BankConnectionStatus {
  ACTIVE,
  EXPIRED,
  REVOKED
}
