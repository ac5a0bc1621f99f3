package io.b2mash.b2b.banklink.integration.banking.sync;

import io.b2mash.b2b.banklink.exception.InvalidStateException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * One execution of the sync engine. Created in SYNCING before any external call, so a crashed run
 * stays visible. Finalized exactly once; COMPLETED and FAILED rows are never modified again.
 */
@Entity
@Table(name = "bank_sync_runs")
public class SyncRun {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tenant_id", nullable = false, length = 100)
  private String tenantId;

  @Column(name = "connection_id", nullable = false)
  private UUID connectionId;

  @Enumerated(EnumType.STRING)
  @Column(name = "sync_type", nullable = false, length = 20)
  private SyncType syncType;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private SyncRunStatus status;

  @Column(name = "records_fetched", nullable = false)
  private int recordsFetched;

  @Column(name = "records_written", nullable = false)
  private int recordsWritten;

  @Column(name = "accounts_synced", nullable = false)
  private int accountsSynced;

  @Column(name = "transactions_synced", nullable = false)
  private int transactionsSynced;

  @Column(name = "error_message", columnDefinition = "TEXT")
  private String errorMessage;

  @Column(name = "started_at", nullable = false, updatable = false)
  private Instant startedAt;

  @Column(name = "completed_at")
  private Instant completedAt;

  @Column(name = "duration_ms")
  private Long durationMs;

  protected SyncRun() {}

  public SyncRun(String tenantId, UUID connectionId, SyncType syncType) {
    this.tenantId = tenantId;
    this.connectionId = connectionId;
    this.syncType = syncType;
    this.status = SyncRunStatus.SYNCING;
    this.startedAt = Instant.now();
  }

  public void complete(int recordsFetched, int accountsSynced, int transactionsSynced) {
    requireSyncing();
    this.status = SyncRunStatus.COMPLETED;
    this.recordsFetched = recordsFetched;
    this.accountsSynced = accountsSynced;
    this.transactionsSynced = transactionsSynced;
    this.recordsWritten = accountsSynced + transactionsSynced;
    finish();
  }

  /** Records the failure; counts reflect the upserts committed before it happened. */
  public void fail(
      String errorMessage, int recordsFetched, int accountsSynced, int transactionsSynced) {
    requireSyncing();
    this.status = SyncRunStatus.FAILED;
    this.errorMessage = errorMessage;
    this.recordsFetched = recordsFetched;
    this.accountsSynced = accountsSynced;
    this.transactionsSynced = transactionsSynced;
    this.recordsWritten = accountsSynced + transactionsSynced;
    finish();
  }

  private void requireSyncing() {
    if (status != SyncRunStatus.SYNCING) {
      throw new InvalidStateException(
          "Sync run already finished", "Sync run " + id + " is already " + status);
    }
  }

  private void finish() {
    this.completedAt = Instant.now();
    this.durationMs = Duration.between(startedAt, completedAt).toMillis();
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

  public SyncType getSyncType() {
    return syncType;
  }

  public SyncRunStatus getStatus() {
    return status;
  }

  public int getRecordsFetched() {
    return recordsFetched;
  }

  public int getRecordsWritten() {
    return recordsWritten;
  }

  public int getAccountsSynced() {
    return accountsSynced;
  }

  public int getTransactionsSynced() {
    return transactionsSynced;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public Long getDurationMs() {
    return durationMs;
  }
}
