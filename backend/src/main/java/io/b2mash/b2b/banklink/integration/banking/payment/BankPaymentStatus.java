package io.b2mash.b2b.banklink.integration.banking.payment;

import java.util.Locale;
import java.util.Optional;

/** Outbound payment status. COMPLETED, FAILED and CANCELLED are terminal. */
public enum BankPaymentStatus {
  PENDING,
  PROCESSING,
  COMPLETED,
  FAILED,
  CANCELLED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == CANCELLED;
  }

  /**
   * Maps a provider payment state. {@code declined} and {@code reverted} count as failures.
   * Unrecognized states map to empty and are not applied.
   */
  public static Optional<BankPaymentStatus> fromProvider(String state) {
    if (state == null) {
      return Optional.empty();
    }
    return switch (state.toLowerCase(Locale.ROOT)) {
      case "created", "pending" -> Optional.of(PENDING);
      case "processing" -> Optional.of(PROCESSING);
      case "completed" -> Optional.of(COMPLETED);
      case "failed", "declined", "reverted" -> Optional.of(FAILED);
      case "cancelled", "canceled" -> Optional.of(CANCELLED);
      default -> Optional.empty();
    };
  }
}
