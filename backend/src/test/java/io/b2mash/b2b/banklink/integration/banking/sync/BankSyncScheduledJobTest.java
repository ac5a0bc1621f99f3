package io.b2mash.b2b.banklink.integration.banking.sync;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.banklink.integration.banking.NoConnectionException;
import io.b2mash.b2b.banklink.integration.banking.connection.BankConnection;
import io.b2mash.b2b.banklink.integration.banking.connection.BankConnectionRepository;
import io.b2mash.b2b.banklink.integration.banking.connection.BankConnectionStatus;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class BankSyncScheduledJobTest {

  @Mock private BankConnectionRepository connectionRepository;
  @Mock private BankSyncService syncService;

  private BankSyncScheduledJob job;

  @BeforeEach
  void setUp() {
    job = new BankSyncScheduledJob(connectionRepository, syncService);
  }

  @Test
  void oneTenantFailureDoesNotStopTheOthers() {
    when(connectionRepository.findByStatus(BankConnectionStatus.ACTIVE))
        .thenReturn(
            List.of(
                new BankConnection("tenant_a"),
                new BankConnection("tenant_b"),
                new BankConnection("tenant_c")));
    when(syncService.runSync("tenant_a", SyncType.SCHEDULED))
        .thenReturn(new SyncResult(UUID.randomUUID(), 1, 4, false));
    when(syncService.runSync("tenant_b", SyncType.SCHEDULED))
        .thenThrow(new NoConnectionException());
    when(syncService.runSync("tenant_c", SyncType.SCHEDULED))
        .thenReturn(new SyncResult(null, 0, 0, true));

    job.syncAllConnections();

    verify(syncService).runSync("tenant_a", SyncType.SCHEDULED);
    verify(syncService).runSync("tenant_b", SyncType.SCHEDULED);
    verify(syncService).runSync("tenant_c", SyncType.SCHEDULED);
  }

  @Test
  void noActiveConnectionsRunsNothing() {
    when(connectionRepository.findByStatus(BankConnectionStatus.ACTIVE)).thenReturn(List.of());

    job.syncAllConnections();

    verifyNoInteractions(syncService);
  }
}
