package io.b2mash.b2b.banklink.integration.banking.webhook;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/** Envelope of a bank webhook delivery. Only the fields the reconciler reads are mapped. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BankWebhookEvent(String event, String timestamp, Data data) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Data(
      String id,
      String state,
      @JsonProperty("old_state") String oldState,
      @JsonProperty("reason_code") String reasonCode,
      @JsonProperty("completed_at") Instant completedAt) {}

  public String entityId() {
    return data != null ? data.id() : null;
  }
}
