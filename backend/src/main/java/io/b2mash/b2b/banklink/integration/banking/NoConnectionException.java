package io.b2mash.b2b.banklink.integration.banking;

import org.springframework.http.HttpStatus;

public class NoConnectionException extends BankingException {

  public NoConnectionException() {
    super(
        HttpStatus.BAD_REQUEST,
        "NO_CONNECTION",
        "No bank connection",
        "No active bank connection for this organization");
  }
}
