package io.b2mash.b2b.banklink.integration.banking.connection;

import java.util.Locale;

/** Why an OAuth callback did not produce a connection. The lower-case name is the redirect code. */
public enum CallbackFailure {
  OAUTH_DENIED,
  INVALID_CALLBACK,
  STATE_MISMATCH,
  SESSION_EXPIRED,
  STORAGE_FAILED,
  CALLBACK_FAILED;

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
