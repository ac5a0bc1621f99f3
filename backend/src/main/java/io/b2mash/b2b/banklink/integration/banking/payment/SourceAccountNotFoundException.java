package io.b2mash.b2b.banklink.integration.banking.payment;

import io.b2mash.b2b.banklink.integration.banking.BankingException;
import java.util.UUID;
import org.springframework.http.HttpStatus;

public class SourceAccountNotFoundException extends BankingException {

  public SourceAccountNotFoundException(UUID accountId) {
    super(
        HttpStatus.BAD_REQUEST,
        "ACCOUNT_NOT_FOUND",
        "Account not found",
        "No synced bank account with id " + accountId);
  }
}
