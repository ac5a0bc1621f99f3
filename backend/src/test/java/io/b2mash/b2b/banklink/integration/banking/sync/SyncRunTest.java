package io.b2mash.b2b.banklink.integration.banking.sync;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.banklink.exception.InvalidStateException;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class SyncRunTest {

  @Test
  void newRunIsSyncing() {
    var run = new SyncRun("tenant_a", UUID.randomUUID(), SyncType.MANUAL);

    assertThat(run.getStatus()).isEqualTo(SyncRunStatus.SYNCING);
    assertThat(run.getStartedAt()).isNotNull();
    assertThat(run.getCompletedAt()).isNull();
  }

  @Test
  void completeRecordsCountsAndDuration() {
    var run = new SyncRun("tenant_a", UUID.randomUUID(), SyncType.SCHEDULED);

    run.complete(7, 2, 5);

    assertThat(run.getStatus()).isEqualTo(SyncRunStatus.COMPLETED);
    assertThat(run.getRecordsFetched()).isEqualTo(7);
    assertThat(run.getRecordsWritten()).isEqualTo(7);
    assertThat(run.getAccountsSynced()).isEqualTo(2);
    assertThat(run.getTransactionsSynced()).isEqualTo(5);
    assertThat(run.getDurationMs()).isNotNull().isGreaterThanOrEqualTo(0L);
  }

  @Test
  void failKeepsPartialCounts() {
    var run = new SyncRun("tenant_a", UUID.randomUUID(), SyncType.MANUAL);

    run.fail("Bank API error (503)", 2, 2, 0);

    assertThat(run.getStatus()).isEqualTo(SyncRunStatus.FAILED);
    assertThat(run.getErrorMessage()).isEqualTo("Bank API error (503)");
    assertThat(run.getAccountsSynced()).isEqualTo(2);
    assertThat(run.getCompletedAt()).isNotNull();
  }

  @Test
  void finishedRunCannotFinishAgain() {
    var run = new SyncRun("tenant_a", UUID.randomUUID(), SyncType.MANUAL);
    run.complete(0, 0, 0);

    assertThatThrownBy(() -> run.fail("late", 0, 0, 0))
        .isInstanceOf(InvalidStateException.class);
  }
}
