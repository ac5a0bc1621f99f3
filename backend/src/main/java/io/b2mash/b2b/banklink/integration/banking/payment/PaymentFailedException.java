package io.b2mash.b2b.banklink.integration.banking.payment;

import io.b2mash.b2b.banklink.integration.banking.BankingException;
import org.springframework.http.HttpStatus;

/** The bank rejected or never acknowledged a payment submission. */
public class PaymentFailedException extends BankingException {

  public PaymentFailedException(String detail, Throwable cause) {
    super(HttpStatus.BAD_GATEWAY, "PAYMENT_FAILED", "Payment failed", detail, cause);
  }
}
