package io.b2mash.b2b.banklink.integration.banking.webhook;

import io.b2mash.b2b.banklink.integration.banking.BankingProperties;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Verifies the hex HMAC-SHA256 signature the bank sends over the raw request body. With no secret
 * configured every request passes; with one configured a missing signature is rejected.
 */
@Component
public class WebhookSignatureVerifier {

  private static final Logger log = LoggerFactory.getLogger(WebhookSignatureVerifier.class);

  static final String ALGORITHM = "HmacSHA256";

  private final BankingProperties properties;

  public WebhookSignatureVerifier(BankingProperties properties) {
    this.properties = properties;
    if (!properties.hasWebhookSecret()) {
      log.warn("No banking webhook secret configured; webhook signatures are not verified");
    }
  }

  /**
   * @throws WebhookAuthenticationException if a secret is configured and the signature is absent
   *     or does not match
   */
  public void verify(byte[] body, String signature) {
    if (!properties.hasWebhookSecret()) {
      return;
    }
    if (signature == null || signature.isBlank()) {
      throw new WebhookAuthenticationException("Missing webhook signature");
    }
    byte[] expected = sign(body, properties.webhookSecret());
    byte[] provided = decodeHex(signature.trim());
    if (provided == null || !MessageDigest.isEqual(expected, provided)) {
      throw new WebhookAuthenticationException("Invalid webhook signature");
    }
  }

  static byte[] sign(byte[] body, String secret) {
    try {
      var mac = Mac.getInstance(ALGORITHM);
      mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
      return mac.doFinal(body);
    } catch (NoSuchAlgorithmException | InvalidKeyException e) {
      throw new IllegalStateException("HMAC-SHA256 unavailable", e);
    }
  }

  private static byte[] decodeHex(String hex) {
    try {
      return HexFormat.of().parseHex(hex.toLowerCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return null;
    }
  }
}
