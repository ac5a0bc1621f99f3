package io.b2mash.b2b.banklink.integration.banking.connection;

import io.b2mash.b2b.banklink.integration.banking.sync.SyncRunStatus;
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
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.DynamicUpdate;

/**
 * One per tenant. Tokens are stored only as vault ciphertext. Updates write changed columns only,
 * so a sync-status update never overwrites tokens rotated by a concurrent refresh.
 */
@Entity
@DynamicUpdate
@Table(name = "bank_connections")
public class BankConnection {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tenant_id", nullable = false, unique = true, length = 100)
  private String tenantId;

  @Column(name = "access_token_encrypted", nullable = false, columnDefinition = "TEXT")
  private String accessTokenEncrypted;

  @Column(name = "refresh_token_encrypted", nullable = false, columnDefinition = "TEXT")
  private String refreshTokenEncrypted;

  @Column(name = "token_type", nullable = false, length = 50)
  private String tokenType;

  @Column(name = "access_token_expires_at", nullable = false)
  private Instant accessTokenExpiresAt;

  @Column(name = "refresh_token_expires_at")
  private Instant refreshTokenExpiresAt;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private BankConnectionStatus status;

  @Column(name = "last_sync_at")
  private Instant lastSyncAt;

  @Enumerated(EnumType.STRING)
  @Column(name = "last_sync_status", length = 20)
  private SyncRunStatus lastSyncStatus;

  @Column(name = "last_sync_error", columnDefinition = "TEXT")
  private String lastSyncError;

  @Column(name = "connected_at", nullable = false)
  private Instant connectedAt;

  @Column(name = "disconnected_at")
  private Instant disconnectedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected BankConnection() {}

  public BankConnection(String tenantId) {
    this.tenantId = tenantId;
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

  /** Stores a fresh token pair and (re)activates the connection. */
  public void activate(
      String accessTokenEncrypted,
      String refreshTokenEncrypted,
      String tokenType,
      Instant accessTokenExpiresAt,
      Instant refreshTokenExpiresAt) {
    this.accessTokenEncrypted = accessTokenEncrypted;
    this.refreshTokenEncrypted = refreshTokenEncrypted;
    this.tokenType = tokenType;
    this.accessTokenExpiresAt = accessTokenExpiresAt;
    this.refreshTokenExpiresAt = refreshTokenExpiresAt;
    this.status = BankConnectionStatus.ACTIVE;
    this.connectedAt = Instant.now();
    this.disconnectedAt = null;
    this.lastSyncError = null;
  }

  /**
   * Replaces the access token after a refresh. A null {@code refreshTokenEncrypted} keeps the
   * current refresh token and its expiry.
   */
  public void rotateTokens(
      String accessTokenEncrypted,
      Instant accessTokenExpiresAt,
      String refreshTokenEncrypted,
      Instant refreshTokenExpiresAt) {
    this.accessTokenEncrypted = accessTokenEncrypted;
    this.accessTokenExpiresAt = accessTokenExpiresAt;
    if (refreshTokenEncrypted != null) {
      this.refreshTokenEncrypted = refreshTokenEncrypted;
      this.refreshTokenExpiresAt = refreshTokenExpiresAt;
    }
  }

  public void markExpired() {
    this.status = BankConnectionStatus.EXPIRED;
  }

  /** Soft disconnect: credentials are wiped, the row and mirrored data stay for audit. */
  public void revoke() {
    this.status = BankConnectionStatus.REVOKED;
    this.accessTokenEncrypted = "";
    this.refreshTokenEncrypted = "";
    this.disconnectedAt = Instant.now();
  }

  public void recordSyncCompleted(Instant completedAt) {
    this.lastSyncAt = completedAt;
    this.lastSyncStatus = SyncRunStatus.COMPLETED;
    this.lastSyncError = null;
  }

  public void recordSyncFailed(String error) {
    this.lastSyncStatus = SyncRunStatus.FAILED;
    this.lastSyncError = error;
  }

  public boolean isActive() {
    return status == BankConnectionStatus.ACTIVE;
  }

  /** True if the access token is expired or expires within {@code skew}. */
  public boolean isAccessTokenExpired(Instant now, Duration skew) {
    return !accessTokenExpiresAt.isAfter(now.plus(skew));
  }

  public boolean isRefreshTokenExpired(Instant now) {
    return refreshTokenExpiresAt != null && !refreshTokenExpiresAt.isAfter(now);
  }

  public UUID getId() {
    return id;
  }

  public String getTenantId() {
    return tenantId;
  }

  public String getAccessTokenEncrypted() {
    return accessTokenEncrypted;
  }

  public String getRefreshTokenEncrypted() {
    return refreshTokenEncrypted;
  }

  public String getTokenType() {
    return tokenType;
  }

  public Instant getAccessTokenExpiresAt() {
    return accessTokenExpiresAt;
  }

  public Instant getRefreshTokenExpiresAt() {
    return refreshTokenExpiresAt;
  }

  public BankConnectionStatus getStatus() {
    return status;
  }

  public Instant getLastSyncAt() {
    return lastSyncAt;
  }

  public SyncRunStatus getLastSyncStatus() {
    return lastSyncStatus;
  }

  public String getLastSyncError() {
    return lastSyncError;
  }

  public Instant getConnectedAt() {
    return connectedAt;
  }

  public Instant getDisconnectedAt() {
    return disconnectedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
