package io.b2mash.b2b.banklink.integration.banking.client;

import java.time.Instant;

/** The provider's acknowledgement of a submitted payment. */
public record PaymentReceipt(
    String externalPaymentId,
    String state,
    Instant createdAt,
    Instant completedAt,
    String reasonCode) {}
