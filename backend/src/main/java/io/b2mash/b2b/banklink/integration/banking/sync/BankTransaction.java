package io.b2mash.b2b.banklink.integration.banking.sync;

import io.b2mash.b2b.banklink.exception.InvalidStateException;
import io.b2mash.b2b.banklink.integration.banking.client.TransactionSnapshot;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Set;
import java.util.UUID;

/**
 * Local mirror of a bank transaction, keyed by (tenant, external transaction id). Provider fields
 * are refreshed by sync and webhooks; the reconciliation fields are local and never touched by
 * either.
 */
@Entity
@Table(name = "bank_transactions")
public class BankTransaction {

  static final Set<String> TERMINAL_STATES = Set.of("completed", "declined", "reverted", "failed");

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tenant_id", nullable = false, length = 100)
  private String tenantId;

  @Column(name = "account_id", nullable = false)
  private UUID accountId;

  @Column(name = "external_transaction_id", nullable = false, length = 100)
  private String externalTransactionId;

  @Column(name = "external_leg_id", length = 100)
  private String externalLegId;

  @Column(name = "type", nullable = false, length = 50)
  private String type;

  @Column(name = "state", nullable = false, length = 50)
  private String state;

  @Column(name = "amount", nullable = false, precision = 18, scale = 2)
  private BigDecimal amount;

  @Column(name = "currency", nullable = false, length = 3)
  private String currency;

  @Column(name = "balance_after", precision = 18, scale = 2)
  private BigDecimal balanceAfter;

  @Column(name = "counterparty_name", length = 255)
  private String counterpartyName;

  @Column(name = "counterparty_account_id", length = 100)
  private String counterpartyAccountId;

  @Column(name = "counterparty_account_type", length = 50)
  private String counterpartyAccountType;

  @Column(name = "reference", length = 255)
  private String reference;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "merchant_name", length = 255)
  private String merchantName;

  @Column(name = "merchant_category_code", length = 10)
  private String merchantCategoryCode;

  @Column(name = "merchant_city", length = 100)
  private String merchantCity;

  @Column(name = "merchant_country", length = 2)
  private String merchantCountry;

  @Column(name = "card_last_four", length = 4)
  private String cardLastFour;

  @Column(name = "request_id", length = 100)
  private String requestId;

  @Column(name = "transaction_date", nullable = false)
  private LocalDate transactionDate;

  @Column(name = "created_at_provider")
  private Instant createdAtProvider;

  @Column(name = "completed_at_provider")
  private Instant completedAtProvider;

  @Column(name = "document_id")
  private UUID documentId;

  @Column(name = "reconciled", nullable = false)
  private boolean reconciled;

  @Column(name = "reconciled_at")
  private Instant reconciledAt;

  @Column(name = "reconciled_by")
  private UUID reconciledBy;

  @Column(name = "notes", columnDefinition = "TEXT")
  private String notes;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected BankTransaction() {}

  public BankTransaction(String tenantId, String externalTransactionId) {
    this.tenantId = tenantId;
    this.externalTransactionId = externalTransactionId;
  }

  @PrePersist
  void onPrePersist() {
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  @PreUpdate
  void onPreUpdate() {
    this.updatedAt = Instant.now();
  }

  /** Copies provider fields from a sync snapshot. The state goes through {@link #applyState}. */
  public void refreshFrom(TransactionSnapshot snapshot, UUID accountId) {
    this.accountId = accountId;
    this.externalLegId = snapshot.legId();
    this.type = snapshot.type();
    this.amount = snapshot.amount();
    this.currency = snapshot.currency();
    this.balanceAfter = snapshot.balanceAfter();
    this.counterpartyName = snapshot.counterpartyName();
    this.counterpartyAccountId = snapshot.counterpartyAccountId();
    this.counterpartyAccountType = snapshot.counterpartyAccountType();
    this.reference = snapshot.reference();
    this.description = snapshot.description();
    this.merchantName = snapshot.merchantName();
    this.merchantCategoryCode = snapshot.merchantCategoryCode();
    this.merchantCity = snapshot.merchantCity();
    this.merchantCountry = snapshot.merchantCountry();
    this.cardLastFour = snapshot.cardLastFour();
    this.requestId = snapshot.requestId();
    this.transactionDate = snapshot.transactionDate();
    this.createdAtProvider = snapshot.createdAtProvider();
    if (snapshot.completedAtProvider() != null) {
      this.completedAtProvider = snapshot.completedAtProvider();
    }
    applyState(snapshot.state());
  }

  /**
   * Moves to {@code newState} unless that would take a terminal state back to a non-terminal
   * one. Terminal-to-terminal moves (e.g. completed to reverted) are real provider transitions.
   *
   * @return true if the stored state changed
   */
  public boolean applyState(String newState) {
    if (newState == null || newState.equals(state)) {
      return false;
    }
    if (isTerminal() && !TERMINAL_STATES.contains(newState)) {
      return false;
    }
    this.state = newState;
    return true;
  }

  public boolean isTerminal() {
    return state != null && TERMINAL_STATES.contains(state);
  }

  public void reconcile(UUID documentId, String notes, UUID reconciledBy) {
    if (reconciled) {
      throw new InvalidStateException(
          "Already reconciled", "Transaction " + id + " is already reconciled");
    }
    this.reconciled = true;
    this.documentId = documentId;
    this.notes = notes;
    this.reconciledBy = reconciledBy;
    this.reconciledAt = Instant.now();
  }

  public void unreconcile() {
    if (!reconciled) {
      throw new InvalidStateException(
          "Not reconciled", "Transaction " + id + " is not reconciled");
    }
    this.reconciled = false;
    this.documentId = null;
    this.reconciledBy = null;
    this.reconciledAt = null;
  }

  public UUID getId() {
    return id;
  }

  public String getTenantId() {
    return tenantId;
  }

  public UUID getAccountId() {
    return accountId;
  }

  public String getExternalTransactionId() {
    return externalTransactionId;
  }

  public String getExternalLegId() {
    return externalLegId;
  }

  public String getType() {
    return type;
  }

  public String getState() {
    return state;
  }

  public BigDecimal getAmount() {
    return amount;
  }

  public String getCurrency() {
    return currency;
  }

  public BigDecimal getBalanceAfter() {
    return balanceAfter;
  }

  public String getCounterpartyName() {
    return counterpartyName;
  }

  public String getCounterpartyAccountId() {
    return counterpartyAccountId;
  }

  public String getCounterpartyAccountType() {
    return counterpartyAccountType;
  }

  public String getReference() {
    return reference;
  }

  public String getDescription() {
    return description;
  }

  public String getMerchantName() {
    return merchantName;
  }

  public String getMerchantCategoryCode() {
    return merchantCategoryCode;
  }

  public String getMerchantCity() {
    return merchantCity;
  }

  public String getMerchantCountry() {
    return merchantCountry;
  }

  public String getCardLastFour() {
    return cardLastFour;
  }

  public String getRequestId() {
    return requestId;
  }

  public LocalDate getTransactionDate() {
    return transactionDate;
  }

  public Instant getCreatedAtProvider() {
    return createdAtProvider;
  }

  public Instant getCompletedAtProvider() {
    return completedAtProvider;
  }

  public UUID getDocumentId() {
    return documentId;
  }

  public boolean isReconciled() {
    return reconciled;
  }

  public Instant getReconciledAt() {
    return reconciledAt;
  }

  public UUID getReconciledBy() {
    return reconciledBy;
  }

  public String getNotes() {
    return notes;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
