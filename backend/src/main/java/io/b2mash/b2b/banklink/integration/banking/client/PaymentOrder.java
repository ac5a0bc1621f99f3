package io.b2mash.b2b.banklink.integration.banking.client;

import java.math.BigDecimal;

/**
 * An outbound transfer submitted to the bank.
 *
 * @param requestId locally assigned idempotency key, echoed back by the provider
 * @param amount major units; the client converts to minor units on the wire
 */
public record PaymentOrder(
    String requestId,
    String externalAccountId,
    String counterpartyId,
    BigDecimal amount,
    String currency,
    String reference) {}
