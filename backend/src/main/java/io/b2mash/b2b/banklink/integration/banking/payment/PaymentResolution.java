package io.b2mash.b2b.banklink.integration.banking.payment;

/** Outcome of resolving a webhook-supplied id to a payment. */
public record PaymentResolution(Match match, BankPayment payment) {

  public enum Match {
    FOUND_BY_EXTERNAL_ID,
    FOUND_BY_REQUEST_ID,
    NOT_FOUND
  }

  static PaymentResolution notFound() {
    return new PaymentResolution(Match.NOT_FOUND, null);
  }

  public boolean found() {
    return match != Match.NOT_FOUND;
  }
}
