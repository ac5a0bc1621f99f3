package io.b2mash.b2b.banklink.integration.banking.client;

/** A call to the bank API failed, timed out, or returned an error body. */
public class BankApiException extends RuntimeException {

  private final int statusCode;

  public BankApiException(String message, int statusCode, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
  }

  /** HTTP status returned by the provider, or 0 when no response was received. */
  public int getStatusCode() {
    return statusCode;
  }
}
