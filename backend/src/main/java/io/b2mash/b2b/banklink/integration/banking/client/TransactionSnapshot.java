package io.b2mash.b2b.banklink.integration.banking.client;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Provider transaction normalized to one leg. {@code externalAccountId} is the provider account of
 * that leg; it is null when the transaction carries no legs.
 */
public record TransactionSnapshot(
    String externalTransactionId,
    String externalAccountId,
    String legId,
    String type,
    String state,
    BigDecimal amount,
    String currency,
    BigDecimal balanceAfter,
    String counterpartyName,
    String counterpartyAccountId,
    String counterpartyAccountType,
    String reference,
    String description,
    String merchantName,
    String merchantCategoryCode,
    String merchantCity,
    String merchantCountry,
    String cardLastFour,
    String requestId,
    LocalDate transactionDate,
    Instant createdAtProvider,
    Instant completedAtProvider) {}
