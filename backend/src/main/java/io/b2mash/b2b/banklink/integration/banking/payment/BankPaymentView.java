package io.b2mash.b2b.banklink.integration.banking.payment;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record BankPaymentView(
    UUID id,
    UUID sourceAccountId,
    String externalPaymentId,
    String requestId,
    BigDecimal amount,
    String currency,
    String reference,
    String recipientName,
    String recipientIban,
    BankPaymentStatus status,
    String reasonCode,
    UUID documentId,
    Instant submittedAt,
    Instant completedAt,
    Instant createdAt) {

  static BankPaymentView from(BankPayment payment) {
    return new BankPaymentView(
        payment.getId(),
        payment.getSourceAccountId(),
        payment.getExternalPaymentId(),
        payment.getRequestId(),
        payment.getAmount(),
        payment.getCurrency(),
        payment.getReference(),
        payment.getRecipientName(),
        payment.getRecipientIban(),
        payment.getStatus(),
        payment.getReasonCode(),
        payment.getDocumentId(),
        payment.getSubmittedAt(),
        payment.getCompletedAt(),
        payment.getCreatedAt());
  }
}
