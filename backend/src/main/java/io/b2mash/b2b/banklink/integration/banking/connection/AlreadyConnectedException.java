package io.b2mash.b2b.banklink.integration.banking.connection;

import io.b2mash.b2b.banklink.integration.banking.BankingException;
import org.springframework.http.HttpStatus;

public class AlreadyConnectedException extends BankingException {

  public AlreadyConnectedException() {
    super(
        HttpStatus.CONFLICT,
        "ALREADY_CONNECTED",
        "Already connected",
        "An active bank connection already exists for this organization");
  }
}
