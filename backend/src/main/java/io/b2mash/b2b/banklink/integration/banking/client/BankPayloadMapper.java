package io.b2mash.b2b.banklink.integration.banking.client;

import io.b2mash.b2b.banklink.integration.banking.client.BankApiModels.AccountPayload;
import io.b2mash.b2b.banklink.integration.banking.client.BankApiModels.LegPayload;
import io.b2mash.b2b.banklink.integration.banking.client.BankApiModels.TransactionPayload;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/** Normalizes bank payloads into snapshot records. */
final class BankPayloadMapper {

  private static final String DEFAULT_CURRENCY = "EUR";

  private BankPayloadMapper() {}

  static AccountSnapshot toAccount(AccountPayload account) {
    return new AccountSnapshot(
        account.id(),
        account.name(),
        account.balance() != null ? account.balance() : BigDecimal.ZERO,
        account.currency(),
        account.state());
  }

  /** Uses the first leg: the provider lists the leg of the queried business account first. */
  static TransactionSnapshot toTransaction(TransactionPayload tx) {
    LegPayload leg = tx.legs() != null && !tx.legs().isEmpty() ? tx.legs().get(0) : null;
    var counterparty = leg != null ? leg.counterparty() : null;
    var merchant = tx.merchant();
    String cardNumber = tx.card() != null ? tx.card().cardNumber() : null;
    Instant createdAt = tx.createdAt() != null ? tx.createdAt() : Instant.now();

    return new TransactionSnapshot(
        tx.id(),
        leg != null ? leg.accountId() : null,
        leg != null ? leg.legId() : null,
        tx.type() != null ? tx.type() : "unknown",
        tx.state() != null ? tx.state() : "unknown",
        leg != null && leg.amount() != null ? leg.amount() : BigDecimal.ZERO,
        leg != null && leg.currency() != null ? leg.currency() : DEFAULT_CURRENCY,
        leg != null ? leg.balance() : null,
        counterparty != null ? counterparty.name() : null,
        counterparty != null ? counterparty.accountId() : null,
        counterparty != null ? counterparty.accountType() : null,
        tx.reference(),
        leg != null ? leg.description() : null,
        merchant != null ? merchant.name() : null,
        merchant != null ? merchant.categoryCode() : null,
        merchant != null ? merchant.city() : null,
        merchant != null ? merchant.country() : null,
        lastFour(cardNumber),
        tx.requestId(),
        LocalDate.ofInstant(createdAt, ZoneOffset.UTC),
        tx.createdAt(),
        tx.completedAt());
  }

  private static String lastFour(String cardNumber) {
    if (cardNumber == null || cardNumber.length() < 4) {
      return null;
    }
    return cardNumber.substring(cardNumber.length() - 4);
  }
}
