package io.b2mash.b2b.banklink.integration.banking.sync;

import io.b2mash.b2b.banklink.integration.banking.BankingAccessPolicy;
import io.b2mash.b2b.banklink.integration.banking.BankingException;
import io.b2mash.b2b.banklink.integration.banking.BankingProperties;
import io.b2mash.b2b.banklink.integration.banking.NoConnectionException;
import io.b2mash.b2b.banklink.integration.banking.client.BankApiClient;
import io.b2mash.b2b.banklink.integration.banking.client.TransactionSnapshot;
import io.b2mash.b2b.banklink.integration.banking.connection.BankConnection;
import io.b2mash.b2b.banklink.integration.banking.connection.BankConnectionRepository;
import io.b2mash.b2b.banklink.integration.banking.connection.BankConnectionService;
import io.b2mash.b2b.banklink.multitenancy.RequestScopes;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Pulls accounts and a trailing window of transactions from the bank and upserts them locally.
 *
 * <p>Accounts are written (and committed) before transactions are fetched, because transactions
 * are linked through the local account rows. Each record commits individually: a failure midway
 * leaves earlier upserts in place and marks the run FAILED.
 */
@Service
public class BankSyncService {

  private static final Logger log = LoggerFactory.getLogger(BankSyncService.class);

  static final Duration RUNNING_WINDOW = Duration.ofMinutes(15);

  private final BankingProperties properties;
  private final BankApiClient bankApiClient;
  private final BankConnectionService connectionService;
  private final BankConnectionRepository connectionRepository;
  private final BankAccountRepository accountRepository;
  private final SyncRunRepository syncRunRepository;
  private final BankRecordWriter recordWriter;
  private final TransactionTemplate txTemplate;

  public BankSyncService(
      BankingProperties properties,
      BankApiClient bankApiClient,
      BankConnectionService connectionService,
      BankConnectionRepository connectionRepository,
      BankAccountRepository accountRepository,
      SyncRunRepository syncRunRepository,
      BankRecordWriter recordWriter,
      PlatformTransactionManager txManager) {
    this.properties = properties;
    this.bankApiClient = bankApiClient;
    this.connectionService = connectionService;
    this.connectionRepository = connectionRepository;
    this.accountRepository = accountRepository;
    this.syncRunRepository = syncRunRepository;
    this.recordWriter = recordWriter;
    this.txTemplate = new TransactionTemplate(txManager);
    this.txTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  /** Manual sync for the caller's tenant. Owner only. */
  public SyncResult syncCurrentTenant() {
    BankingAccessPolicy.requireOwner("sync bank data");
    return runSync(RequestScopes.requireTenantId(), SyncType.MANUAL);
  }

  /**
   * Runs one sync for {@code tenantId}.
   *
   * @throws NoConnectionException if the tenant has no active connection
   * @throws SyncFailedException if the bank or storage failed; the run is recorded as FAILED
   */
  public SyncResult runSync(String tenantId, SyncType syncType) {
    BankConnection connection =
        connectionRepository
            .findByTenantId(tenantId)
            .filter(BankConnection::isActive)
            .orElseThrow(NoConnectionException::new);

    if (syncRunRepository.existsByConnectionIdAndStatusAndStartedAtAfter(
        connection.getId(), SyncRunStatus.SYNCING, Instant.now().minus(RUNNING_WINDOW))) {
      log.info("Sync already in progress for tenant {}, skipping {} run", tenantId, syncType);
      return SyncResult.skippedRun();
    }

    SyncRun run =
        txTemplate.execute(
            tx -> syncRunRepository.save(new SyncRun(tenantId, connection.getId(), syncType)));
    log.info("Bank sync {} started for tenant {} ({})", run.getId(), tenantId, syncType);

    var progress = new Progress();
    try {
      String accessToken = connectionService.getValidToken(tenantId);

      var accounts = bankApiClient.listAccounts(accessToken);
      progress.fetched += accounts.size();
      for (var snapshot : accounts) {
        try {
          recordWriter.upsertAccount(tenantId, connection.getId(), snapshot);
          progress.accounts++;
        } catch (RuntimeException e) {
          log.warn(
              "Failed to upsert account {} for tenant {}: {}",
              snapshot.externalAccountId(),
              tenantId,
              e.getMessage());
        }
      }

      Map<String, UUID> accountIds = localAccountIds(tenantId);

      Instant from = Instant.now().minus(Duration.ofDays(properties.syncWindowDays()));
      var transactions =
          bankApiClient.listTransactions(accessToken, from, properties.transactionPageSize());
      progress.fetched += transactions.size();
      for (var snapshot : transactions) {
        UUID accountId =
            snapshot.externalAccountId() != null
                ? accountIds.get(snapshot.externalAccountId())
                : null;
        if (accountId == null) {
          log.debug(
              "Skipping transaction {}: account {} not mirrored",
              snapshot.externalTransactionId(),
              snapshot.externalAccountId());
          continue;
        }
        if (upsertTransaction(tenantId, accountId, snapshot)) {
          progress.transactions++;
        }
      }
    } catch (RuntimeException e) {
      String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
      recordFailure(run.getId(), connection.getId(), message, progress);
      log.error("Bank sync {} failed for tenant {}: {}", run.getId(), tenantId, message);
      if (e instanceof BankingException banking) {
        throw banking;
      }
      throw new SyncFailedException(message, e);
    }

    recordCompletion(run.getId(), connection.getId(), progress);
    log.info(
        "Bank sync {} completed for tenant {}: {} accounts, {} transactions",
        run.getId(),
        tenantId,
        progress.accounts,
        progress.transactions);
    return new SyncResult(run.getId(), progress.accounts, progress.transactions, false);
  }

  private boolean upsertTransaction(String tenantId, UUID accountId, TransactionSnapshot snapshot) {
    try {
      recordWriter.upsertTransaction(tenantId, accountId, snapshot);
      return true;
    } catch (RuntimeException e) {
      log.warn(
          "Failed to upsert transaction {} for tenant {}: {}",
          snapshot.externalTransactionId(),
          tenantId,
          e.getMessage());
      return false;
    }
  }

  // Built from stored rows so accounts mirrored by earlier runs resolve too.
  private Map<String, UUID> localAccountIds(String tenantId) {
    var ids = new HashMap<String, UUID>();
    for (var account : accountRepository.findByTenantIdOrderByNameAsc(tenantId)) {
      ids.put(account.getExternalAccountId(), account.getId());
    }
    return ids;
  }

  private void recordCompletion(UUID runId, UUID connectionId, Progress progress) {
    txTemplate.executeWithoutResult(
        tx -> {
          var run = syncRunRepository.findById(runId).orElseThrow();
          run.complete(progress.fetched, progress.accounts, progress.transactions);
          connectionRepository
              .findById(connectionId)
              .ifPresent(c -> c.recordSyncCompleted(run.getCompletedAt()));
        });
  }

  private void recordFailure(UUID runId, UUID connectionId, String message, Progress progress) {
    txTemplate.executeWithoutResult(
        tx -> {
          var run = syncRunRepository.findById(runId).orElseThrow();
          run.fail(message, progress.fetched, progress.accounts, progress.transactions);
          connectionRepository.findById(connectionId).ifPresent(c -> c.recordSyncFailed(message));
        });
  }

  private static final class Progress {
    int fetched;
    int accounts;
    int transactions;
  }
}
