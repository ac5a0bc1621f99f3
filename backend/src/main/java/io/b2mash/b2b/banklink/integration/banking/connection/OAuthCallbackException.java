package io.b2mash.b2b.banklink.integration.banking.connection;

/** OAuth protocol failure. Recoverable by restarting the authorization flow. */
public class OAuthCallbackException extends RuntimeException {

  private final CallbackFailure failure;

  public OAuthCallbackException(CallbackFailure failure, String message) {
    super(message);
    this.failure = failure;
  }

  public OAuthCallbackException(CallbackFailure failure, String message, Throwable cause) {
    super(message, cause);
    this.failure = failure;
  }

  public CallbackFailure getFailure() {
    return failure;
  }
}
