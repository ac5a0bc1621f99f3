package io.b2mash.b2b.banklink.integration.banking.sync;

import io.b2mash.b2b.banklink.integration.banking.BankingException;
import org.springframework.http.HttpStatus;

public class SyncFailedException extends BankingException {

  public SyncFailedException(String detail, Throwable cause) {
    super(HttpStatus.BAD_GATEWAY, "SYNC_FAILED", "Bank sync failed", detail, cause);
  }
}
