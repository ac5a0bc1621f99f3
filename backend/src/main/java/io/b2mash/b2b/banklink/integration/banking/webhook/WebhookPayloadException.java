package io.b2mash.b2b.banklink.integration.banking.webhook;

/** The webhook body could not be parsed into an event envelope. */
public class WebhookPayloadException extends RuntimeException {

  public WebhookPayloadException(String message, Throwable cause) {
    super(message, cause);
  }
}
