package io.b2mash.b2b.banklink.invoice;

import io.b2mash.b2b.banklink.exception.InvalidStateException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "invoices")
public class Invoice {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tenant_id", nullable = false, length = 100)
  private String tenantId;

  @Column(name = "invoice_number", length = 50)
  private String invoiceNumber;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private InvoiceStatus status;

  @Column(name = "currency", nullable = false, length = 3)
  private String currency;

  @Column(name = "total", nullable = false, precision = 14, scale = 2)
  private BigDecimal total;

  @Column(name = "payment_reference", length = 255)
  private String paymentReference;

  @Column(name = "paid_at")
  private Instant paidAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Invoice() {}

  public Invoice(
      String tenantId,
      String invoiceNumber,
      InvoiceStatus status,
      String currency,
      BigDecimal total) {
    this.tenantId = tenantId;
    this.invoiceNumber = invoiceNumber;
    this.status = status;
    this.currency = currency;
    this.total = total;
  }

  @PrePersist
  void onPrePersist() {
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /**
   * Records payment, transitioning from SENT to PAID.
   *
   * @param paymentReference optional payment reference (e.g. the bank payment id)
   * @throws InvalidStateException if the invoice is not in SENT status
   */
  public void recordPayment(String paymentReference) {
    if (!status.canTransitionTo(InvoiceStatus.PAID)) {
      throw new InvalidStateException(
          "Invalid invoice status",
          "Cannot record payment for invoice in status " + status + ". Must be SENT.");
    }
    this.status = InvoiceStatus.PAID;
    this.paidAt = Instant.now();
    this.paymentReference = paymentReference;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getTenantId() {
    return tenantId;
  }

  public String getInvoiceNumber() {
    return invoiceNumber;
  }

  public InvoiceStatus getStatus() {
    return status;
  }

  public String getCurrency() {
    return currency;
  }

  public BigDecimal getTotal() {
    return total;
  }

  public String getPaymentReference() {
    return paymentReference;
  }

  public Instant getPaidAt() {
    return paidAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
