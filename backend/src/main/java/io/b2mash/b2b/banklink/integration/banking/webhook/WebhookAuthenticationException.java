package io.b2mash.b2b.banklink.integration.banking.webhook;

/** The webhook signature was missing or did not match the configured secret. */
public class WebhookAuthenticationException extends RuntimeException {

  public WebhookAuthenticationException(String message) {
    super(message);
  }
}
