package io.b2mash.b2b.banklink.integration.banking.payment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * An outbound payment. Persisted with a local {@code requestId} before submission; the provider's
 * payment id is filled in once the bank acknowledges it. Webhooks may reference either id.
 */
@Entity
@Table(name = "bank_payments")
public class BankPayment {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tenant_id", nullable = false, length = 100)
  private String tenantId;

  @Column(name = "connection_id", nullable = false)
  private UUID connectionId;

  @Column(name = "source_account_id", nullable = false)
  private UUID sourceAccountId;

  @Column(name = "external_payment_id", length = 100)
  private String externalPaymentId;

  @Column(name = "request_id", nullable = false, unique = true, length = 100)
  private String requestId;

  @Column(name = "amount", nullable = false, precision = 18, scale = 2)
  private BigDecimal amount;

  @Column(name = "currency", nullable = false, length = 3)
  private String currency;

  @Column(name = "reference", length = 140)
  private String reference;

  @Column(name = "recipient_name", nullable = false, length = 255)
  private String recipientName;

  @Column(name = "recipient_iban", length = 50)
  private String recipientIban;

  @Column(name = "recipient_bic", length = 20)
  private String recipientBic;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private BankPaymentStatus status;

  @Column(name = "reason_code", length = 100)
  private String reasonCode;

  @Column(name = "error_message", columnDefinition = "TEXT")
  private String errorMessage;

  @Column(name = "document_id")
  private UUID documentId;

  @Column(name = "created_by", nullable = false)
  private UUID createdBy;

  @Column(name = "submitted_at")
  private Instant submittedAt;

  @Column(name = "completed_at")
  private Instant completedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected BankPayment() {}

  public BankPayment(
      String tenantId,
      UUID connectionId,
      UUID sourceAccountId,
      String requestId,
      BigDecimal amount,
      String currency,
      String reference,
      String recipientName,
      String recipientIban,
      String recipientBic,
      UUID documentId,
      UUID createdBy) {
    this.tenantId = tenantId;
    this.connectionId = connectionId;
    this.sourceAccountId = sourceAccountId;
    this.requestId = requestId;
    this.amount = amount;
    this.currency = currency;
    this.reference = reference;
    this.recipientName = recipientName;
    this.recipientIban = recipientIban;
    this.recipientBic = recipientBic;
    this.documentId = documentId;
    this.createdBy = createdBy;
    this.status = BankPaymentStatus.PENDING;
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

  /** Records the provider's acknowledgement of the submission. */
  public StateTransition markSubmitted(
      String externalPaymentId, BankPaymentStatus reportedStatus, Instant submittedAt) {
    this.externalPaymentId = externalPaymentId;
    this.submittedAt = submittedAt;
    return applyProviderState(reportedStatus, null, null);
  }

  public void markSubmissionFailed(String errorMessage) {
    this.status = BankPaymentStatus.FAILED;
    this.reasonCode = "submission_failed";
    this.errorMessage = errorMessage;
  }

  /**
   * Records a submission whose outcome is unknown (no response from the bank). The status is left
   * as is so a later webhook, matched by request id, can still settle the payment.
   */
  public void markSubmissionUnconfirmed(String errorMessage) {
    this.errorMessage = errorMessage;
  }

  /**
   * Applies a provider-reported status. Once terminal, the payment never changes status again: a
   * repeat of the same terminal status is {@link StateTransition#UNCHANGED}, a different terminal
   * status is an {@link StateTransition#ANOMALY}, and a non-terminal one is {@link
   * StateTransition#IGNORED}.
   */
  public StateTransition applyProviderState(
      BankPaymentStatus reported, String reasonCode, Instant completedAt) {
    if (status.isTerminal()) {
      if (reported == status) {
        return StateTransition.UNCHANGED;
      }
      return reported.isTerminal() ? StateTransition.ANOMALY : StateTransition.IGNORED;
    }
    this.status = reported;
    if (reasonCode != null) {
      this.reasonCode = reasonCode;
    }
    if (completedAt != null) {
      this.completedAt = completedAt;
    }
    return StateTransition.APPLIED;
  }

  /** Provider id if assigned, otherwise the local request id. */
  public String paymentReference() {
    return externalPaymentId != null ? externalPaymentId : requestId;
  }

  public UUID getId() {
    return id;
  }

  public String getTenantId() {
    return tenantId;
  }

  public UUID getConnectionId() {
    return connectionId;
  }

  public UUID getSourceAccountId() {
    return sourceAccountId;
  }

  public String getExternalPaymentId() {
    return externalPaymentId;
  }

  public String getRequestId() {
    return requestId;
  }

  public BigDecimal getAmount() {
    return amount;
  }

  public String getCurrency() {
    return currency;
  }

  public String getReference() {
    return reference;
  }

  public String getRecipientName() {
    return recipientName;
  }

  public String getRecipientIban() {
    return recipientIban;
  }

  public String getRecipientBic() {
    return recipientBic;
  }

  public BankPaymentStatus getStatus() {
    return status;
  }

  public String getReasonCode() {
    return reasonCode;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  public UUID getDocumentId() {
    return documentId;
  }

  public UUID getCreatedBy() {
    return createdBy;
  }

  public Instant getSubmittedAt() {
    return submittedAt;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
