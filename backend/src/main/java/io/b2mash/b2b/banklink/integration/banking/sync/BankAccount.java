package io.b2mash.b2b.banklink.integration.banking.sync;

import io.b2mash.b2b.banklink.integration.banking.client.AccountSnapshot;
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
import java.util.UUID;

/** Local mirror of a bank account, keyed by (tenant, external account id). */
@Entity
@Table(name = "bank_accounts")
public class BankAccount {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tenant_id", nullable = false, length = 100)
  private String tenantId;

  @Column(name = "connection_id", nullable = false)
  private UUID connectionId;

  @Column(name = "external_account_id", nullable = false, length = 100)
  private String externalAccountId;

  @Column(name = "name", length = 255)
  private String name;

  @Column(name = "currency", nullable = false, length = 3)
  private String currency;

  @Column(name = "balance", nullable = false, precision = 18, scale = 2)
  private BigDecimal balance;

  @Column(name = "state", length = 50)
  private String state;

  @Column(name = "balance_updated_at")
  private Instant balanceUpdatedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected BankAccount() {}

  public BankAccount(String tenantId, UUID connectionId, String externalAccountId) {
    this.tenantId = tenantId;
    this.connectionId = connectionId;
    this.externalAccountId = externalAccountId;
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

  public void refreshFrom(AccountSnapshot snapshot, UUID connectionId, Instant refreshedAt) {
    this.connectionId = connectionId;
    this.name = snapshot.name();
    this.currency = snapshot.currency();
    this.balance = snapshot.balance();
    this.state = snapshot.state();
    this.balanceUpdatedAt = refreshedAt;
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

  public String getExternalAccountId() {
    return externalAccountId;
  }

  public String getName() {
    return name;
  }

  public String getCurrency() {
    return currency;
  }

  public BigDecimal getBalance() {
    return balance;
  }

  public String getState() {
    return state;
  }

  public Instant getBalanceUpdatedAt() {
    return balanceUpdatedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
