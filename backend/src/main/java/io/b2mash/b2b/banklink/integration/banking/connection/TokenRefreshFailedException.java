package io.b2mash.b2b.banklink.integration.banking.connection;

import io.b2mash.b2b.banklink.integration.banking.BankingException;
import org.springframework.http.HttpStatus;

/** The bank rejected the refresh token, or it has expired. The connection is now EXPIRED. */
public class TokenRefreshFailedException extends BankingException {

  public TokenRefreshFailedException(String detail, Throwable cause) {
    super(HttpStatus.BAD_GATEWAY, "REFRESH_FAILED", "Bank token refresh failed", detail, cause);
  }
}
