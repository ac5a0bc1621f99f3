package io.b2mash.b2b.banklink.integration.banking.sync;

import java.util.UUID;

/**
 * Outcome of a sync invocation. {@code skipped} is set when another run for the same connection
 * was still in progress; no run is recorded in that case.
 */
public record SyncResult(
    UUID syncRunId, int accountsSynced, int transactionsSynced, boolean skipped) {

  static SyncResult skippedRun() {
    return new SyncResult(null, 0, 0, true);
  }
}
