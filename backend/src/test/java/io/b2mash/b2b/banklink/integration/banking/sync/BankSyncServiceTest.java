package io.b2mash.b2b.banklink.integration.banking.sync;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.banklink.exception.ForbiddenException;
import io.b2mash.b2b.banklink.integration.banking.NoConnectionException;
import io.b2mash.b2b.banklink.integration.banking.TestBankingProperties;
import io.b2mash.b2b.banklink.integration.banking.client.AccountSnapshot;
import io.b2mash.b2b.banklink.integration.banking.client.BankApiClient;
import io.b2mash.b2b.banklink.integration.banking.client.BankApiException;
import io.b2mash.b2b.banklink.integration.banking.client.TransactionSnapshot;
import io.b2mash.b2b.banklink.integration.banking.connection.BankConnection;
import io.b2mash.b2b.banklink.integration.banking.connection.BankConnectionRepository;
import io.b2mash.b2b.banklink.integration.banking.connection.BankConnectionService;
import io.b2mash.b2b.banklink.integration.banking.connection.TokenRefreshFailedException;
import io.b2mash.b2b.banklink.multitenancy.RequestScopes;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.PlatformTransactionManager;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class BankSyncServiceTest {

  private static final String TENANT = "tenant_acme";

  @Mock private BankApiClient bankApiClient;
  @Mock private BankConnectionService connectionService;
  @Mock private BankConnectionRepository connectionRepository;
  @Mock private BankAccountRepository accountRepository;
  @Mock private SyncRunRepository syncRunRepository;
  @Mock private BankRecordWriter recordWriter;
  @Mock private PlatformTransactionManager txManager;

  private BankSyncService service;
  private BankConnection connection;
  private SyncRun savedRun;
  private final Map<String, UUID> localIds = new HashMap<>();

  @BeforeEach
  void setUp() {
    service =
        new BankSyncService(
            TestBankingProperties.defaults(),
            bankApiClient,
            connectionService,
            connectionRepository,
            accountRepository,
            syncRunRepository,
            recordWriter,
            txManager);

    connection = new BankConnection(TENANT);
    connection.activate(
        "enc:a",
        "enc:r",
        "Bearer",
        Instant.now().plusSeconds(3600),
        Instant.now().plusSeconds(9000));
    ReflectionTestUtils.setField(connection, "id", UUID.randomUUID());

    when(connectionRepository.findByTenantId(TENANT)).thenReturn(Optional.of(connection));
    when(connectionRepository.findById(connection.getId())).thenReturn(Optional.of(connection));
    when(syncRunRepository.save(any(SyncRun.class)))
        .thenAnswer(
            inv -> {
              savedRun = inv.getArgument(0);
              ReflectionTestUtils.setField(savedRun, "id", UUID.randomUUID());
              return savedRun;
            });
    when(syncRunRepository.findById(any())).thenAnswer(inv -> Optional.ofNullable(savedRun));
    when(connectionService.getValidToken(TENANT)).thenReturn("access");
    when(accountRepository.findByTenantIdOrderByNameAsc(TENANT))
        .thenReturn(List.of(localAccount("acc-1"), localAccount("acc-2")));
  }

  @AfterEach
  void clearScopes() {
    RequestScopes.clear();
  }

  @Test
  void syncMirrorsAccountsAndTransactions() {
    when(bankApiClient.listAccounts("access"))
        .thenReturn(List.of(account("acc-1"), account("acc-2")));
    when(bankApiClient.listTransactions(eq("access"), any(), eq(1000)))
        .thenReturn(
            List.of(
                transaction("tx-1", "acc-1"),
                transaction("tx-2", "acc-1"),
                transaction("tx-3", "acc-2"),
                transaction("tx-4", "acc-2"),
                transaction("tx-5", "acc-1")));

    var result = service.runSync(TENANT, SyncType.MANUAL);

    assertThat(result.skipped()).isFalse();
    assertThat(result.accountsSynced()).isEqualTo(2);
    assertThat(result.transactionsSynced()).isEqualTo(5);
    assertThat(result.syncRunId()).isEqualTo(savedRun.getId());
    assertThat(savedRun.getStatus()).isEqualTo(SyncRunStatus.COMPLETED);
    assertThat(savedRun.getRecordsFetched()).isEqualTo(7);
    assertThat(savedRun.getSyncType()).isEqualTo(SyncType.MANUAL);
    assertThat(connection.getLastSyncStatus()).isEqualTo(SyncRunStatus.COMPLETED);
    assertThat(connection.getLastSyncAt()).isNotNull();
    verify(recordWriter, times(5)).upsertTransaction(eq(TENANT), any(), any());
  }

  @Test
  void transactionsWindowStartsThirtyDaysBack() {
    when(bankApiClient.listAccounts("access")).thenReturn(List.of());
    when(bankApiClient.listTransactions(eq("access"), any(), anyInt())).thenReturn(List.of());

    service.runSync(TENANT, SyncType.SCHEDULED);

    var captor = ArgumentCaptor.forClass(Instant.class);
    verify(bankApiClient).listTransactions(eq("access"), captor.capture(), eq(1000));
    var expected = Instant.now().minus(Duration.ofDays(30));
    assertThat(captor.getValue()).isBetween(expected.minusSeconds(60), expected.plusSeconds(60));
  }

  @Test
  void transactionOfUnknownAccountIsSkipped() {
    when(bankApiClient.listAccounts("access")).thenReturn(List.of(account("acc-1")));
    when(bankApiClient.listTransactions(eq("access"), any(), anyInt()))
        .thenReturn(
            List.of(
                transaction("tx-1", "acc-1"),
                transaction("tx-orphan", "acc-unknown"),
                transaction("tx-noleg", null)));

    var result = service.runSync(TENANT, SyncType.MANUAL);

    assertThat(result.transactionsSynced()).isEqualTo(1);
    assertThat(savedRun.getStatus()).isEqualTo(SyncRunStatus.COMPLETED);
    verify(recordWriter, times(1)).upsertTransaction(eq(TENANT), any(), any());
  }

  @Test
  void failedRecordUpsertIsNotCounted() {
    when(bankApiClient.listAccounts("access")).thenReturn(List.of(account("acc-1")));
    var broken = transaction("tx-broken", "acc-1");
    when(bankApiClient.listTransactions(eq("access"), any(), anyInt()))
        .thenReturn(List.of(transaction("tx-1", "acc-1"), broken));
    when(recordWriter.upsertTransaction(TENANT, localAccountId("acc-1"), broken))
        .thenThrow(new IllegalStateException("constraint violation"));

    var result = service.runSync(TENANT, SyncType.MANUAL);

    assertThat(result.transactionsSynced()).isEqualTo(1);
    assertThat(savedRun.getStatus()).isEqualTo(SyncRunStatus.COMPLETED);
  }

  @Test
  void apiFailureMarksRunFailedAndKeepsAccountProgress() {
    when(bankApiClient.listAccounts("access"))
        .thenReturn(List.of(account("acc-1"), account("acc-2")));
    when(bankApiClient.listTransactions(eq("access"), any(), anyInt()))
        .thenThrow(new BankApiException("Bank API error (503): unavailable", 503, null));

    assertThatThrownBy(() -> service.runSync(TENANT, SyncType.MANUAL))
        .isInstanceOf(SyncFailedException.class)
        .hasMessageContaining("503");

    assertThat(savedRun.getStatus()).isEqualTo(SyncRunStatus.FAILED);
    assertThat(savedRun.getAccountsSynced()).isEqualTo(2);
    assertThat(savedRun.getErrorMessage()).contains("503");
    assertThat(connection.getLastSyncStatus()).isEqualTo(SyncRunStatus.FAILED);
    assertThat(connection.getLastSyncError()).contains("503");
  }

  @Test
  void refreshFailureIsRecordedAndRethrown() {
    when(connectionService.getValidToken(TENANT))
        .thenThrow(new TokenRefreshFailedException("Bank rejected the token refresh", null));

    assertThatThrownBy(() -> service.runSync(TENANT, SyncType.SCHEDULED))
        .isInstanceOf(TokenRefreshFailedException.class);

    assertThat(savedRun.getStatus()).isEqualTo(SyncRunStatus.FAILED);
    verifyNoInteractions(bankApiClient);
  }

  @Test
  void runInProgressSkipsNewRun() {
    when(syncRunRepository.existsByConnectionIdAndStatusAndStartedAtAfter(
            eq(connection.getId()), eq(SyncRunStatus.SYNCING), any()))
        .thenReturn(true);

    var result = service.runSync(TENANT, SyncType.MANUAL);

    assertThat(result.skipped()).isTrue();
    assertThat(result.syncRunId()).isNull();
    verify(syncRunRepository, never()).save(any());
    verify(bankApiClient, never()).listAccounts(anyString());
  }

  @Test
  void inactiveConnectionCannotSync() {
    connection.markExpired();

    assertThatThrownBy(() -> service.runSync(TENANT, SyncType.MANUAL))
        .isInstanceOf(NoConnectionException.class);
    verify(syncRunRepository, never()).save(any());
  }

  @Test
  void manualSyncRequiresOwner() {
    RequestScopes.bind(TENANT, UUID.randomUUID(), "admin");

    assertThatThrownBy(() -> service.syncCurrentTenant()).isInstanceOf(ForbiddenException.class);
  }

  @Test
  void manualSyncRunsForBoundTenant() {
    RequestScopes.bind(TENANT, UUID.randomUUID(), "owner");
    when(bankApiClient.listAccounts("access")).thenReturn(List.of());
    when(bankApiClient.listTransactions(eq("access"), any(), anyInt())).thenReturn(List.of());

    var result = service.syncCurrentTenant();

    assertThat(result.skipped()).isFalse();
    assertThat(savedRun.getSyncType()).isEqualTo(SyncType.MANUAL);
  }

  // --- fixtures ---

  private UUID localAccountId(String externalId) {
    return localIds.computeIfAbsent(externalId, k -> UUID.randomUUID());
  }

  private BankAccount localAccount(String externalId) {
    var account = new BankAccount(TENANT, UUID.randomUUID(), externalId);
    ReflectionTestUtils.setField(account, "id", localAccountId(externalId));
    return account;
  }

  private static AccountSnapshot account(String externalId) {
    return new AccountSnapshot(
        externalId, "Account " + externalId, new BigDecimal("100.00"), "EUR", "active");
  }

  private static TransactionSnapshot transaction(String id, String externalAccountId) {
    return new TransactionSnapshot(
        id,
        externalAccountId,
        id + "-leg",
        "transfer",
        "completed",
        new BigDecimal("-10.00"),
        "EUR",
        null,
        null,
        null,
        null,
        null,
        null,
        null,
        null,
        null,
        null,
        null,
        null,
        LocalDate.now(),
        Instant.now(),
        Instant.now());
  }
}
