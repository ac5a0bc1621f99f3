package io.b2mash.b2b.banklink.integration.banking.sync;

public enum SyncRunStatus {
  SYNCING,
  COMPLETED,
  FAILED
}
