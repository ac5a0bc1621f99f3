package io.b2mash.b2b.banklink.integration.banking.webhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Inbound bank events. Only signature and parse failures are reported to the bank as errors;
 * everything else is acknowledged so the bank does not keep redelivering it.
 */
@RestController
@RequestMapping("/api/webhooks/banking")
public class BankWebhookController {

  private static final Logger log = LoggerFactory.getLogger(BankWebhookController.class);

  static final String SIGNATURE_HEADER = "revolut-signature";

  private final WebhookSignatureVerifier signatureVerifier;
  private final BankWebhookService webhookService;
  private final ObjectMapper objectMapper;

  public BankWebhookController(
      WebhookSignatureVerifier signatureVerifier,
      BankWebhookService webhookService,
      ObjectMapper objectMapper) {
    this.signatureVerifier = signatureVerifier;
    this.webhookService = webhookService;
    this.objectMapper = objectMapper;
  }

  @PostMapping
  public ResponseEntity<Map<String, Object>> receive(
      @RequestBody byte[] body,
      @RequestHeader(name = SIGNATURE_HEADER, required = false) String signature) {
    try {
      signatureVerifier.verify(body, signature);
      var event = parse(body);
      log.info("Received bank webhook {} for {}", event.event(), event.entityId());
      webhookService.handle(event);
    } catch (WebhookAuthenticationException e) {
      log.error("Rejected bank webhook: {}", e.getMessage());
      return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of("error", e.getMessage()));
    } catch (WebhookPayloadException e) {
      log.warn("Unparseable bank webhook: {}", e.getMessage());
      return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    } catch (RuntimeException e) {
      log.error("Bank webhook processing failed", e);
    }
    return ResponseEntity.ok(Map.of("received", true));
  }

  /** Liveness check the bank calls when the webhook is registered. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> ping() {
    return ResponseEntity.ok(Map.of("status", "ok", "message", "Bank webhook endpoint"));
  }

  private BankWebhookEvent parse(byte[] body) {
    BankWebhookEvent event;
    try {
      event = objectMapper.readValue(body, BankWebhookEvent.class);
    } catch (IOException e) {
      throw new WebhookPayloadException("Malformed webhook payload", e);
    }
    if (event == null || event.event() == null || event.event().isBlank()) {
      throw new WebhookPayloadException("Webhook payload has no event type", null);
    }
    return event;
  }
}
