package io.b2mash.b2b.banklink.integration.secret;

/** Authentication-tag verification failed while decrypting a stored credential. */
public class IntegrityException extends RuntimeException {

  public IntegrityException(String message) {
    super(message);
  }

  public IntegrityException(String message, Throwable cause) {
    super(message, cause);
  }
}
