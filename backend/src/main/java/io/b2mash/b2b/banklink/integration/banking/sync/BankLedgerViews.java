package io.b2mash.b2b.banklink.integration.banking.sync;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Read models for mirrored bank data. */
public final class BankLedgerViews {

  private BankLedgerViews() {}

  public record AccountView(
      UUID id,
      String externalAccountId,
      String name,
      String currency,
      BigDecimal balance,
      String state,
      Instant balanceUpdatedAt) {

    static AccountView from(BankAccount account) {
      return new AccountView(
          account.getId(),
          account.getExternalAccountId(),
          account.getName(),
          account.getCurrency(),
          account.getBalance(),
          account.getState(),
          account.getBalanceUpdatedAt());
    }
  }

  /** All accounts of a tenant plus balance totals per currency. */
  public record AccountsOverview(List<AccountView> accounts, Map<String, BigDecimal> totals) {}

  public record TransactionView(
      UUID id,
      UUID accountId,
      String externalTransactionId,
      String type,
      String state,
      BigDecimal amount,
      String currency,
      BigDecimal balanceAfter,
      String counterpartyName,
      String reference,
      String description,
      String merchantName,
      String cardLastFour,
      LocalDate transactionDate,
      Instant completedAtProvider,
      boolean reconciled,
      UUID documentId,
      Instant reconciledAt,
      UUID reconciledBy,
      String notes) {

    static TransactionView from(BankTransaction t) {
      return new TransactionView(
          t.getId(),
          t.getAccountId(),
          t.getExternalTransactionId(),
          t.getType(),
          t.getState(),
          t.getAmount(),
          t.getCurrency(),
          t.getBalanceAfter(),
          t.getCounterpartyName(),
          t.getReference(),
          t.getDescription(),
          t.getMerchantName(),
          t.getCardLastFour(),
          t.getTransactionDate(),
          t.getCompletedAtProvider(),
          t.isReconciled(),
          t.getDocumentId(),
          t.getReconciledAt(),
          t.getReconciledBy(),
          t.getNotes());
    }
  }

  public record SyncRunView(
      UUID id,
      SyncType syncType,
      SyncRunStatus status,
      int recordsFetched,
      int recordsWritten,
      int accountsSynced,
      int transactionsSynced,
      String errorMessage,
      Instant startedAt,
      Instant completedAt,
      Long durationMs) {

    static SyncRunView from(SyncRun run) {
      return new SyncRunView(
          run.getId(),
          run.getSyncType(),
          run.getStatus(),
          run.getRecordsFetched(),
          run.getRecordsWritten(),
          run.getAccountsSynced(),
          run.getTransactionsSynced(),
          run.getErrorMessage(),
          run.getStartedAt(),
          run.getCompletedAt(),
          run.getDurationMs());
    }
  }
}
