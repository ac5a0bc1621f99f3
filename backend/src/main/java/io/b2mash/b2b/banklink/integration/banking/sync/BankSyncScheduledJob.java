package io.b2mash.b2b.banklink.integration.banking.sync;

import io.b2mash.b2b.banklink.integration.banking.connection.BankConnectionRepository;
import io.b2mash.b2b.banklink.integration.banking.connection.BankConnectionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodically syncs every active connection. Disabled unless explicitly switched on. */
@Component
@ConditionalOnProperty(
    prefix = "banking.scheduled-sync",
    name = "enabled",
    havingValue = "true")
public class BankSyncScheduledJob {

  private static final Logger log = LoggerFactory.getLogger(BankSyncScheduledJob.class);

  private final BankConnectionRepository connectionRepository;
  private final BankSyncService syncService;

  public BankSyncScheduledJob(
      BankConnectionRepository connectionRepository, BankSyncService syncService) {
    this.connectionRepository = connectionRepository;
    this.syncService = syncService;
  }

  @Scheduled(cron = "${banking.scheduled-sync.cron:0 0 */6 * * *}")
  public void syncAllConnections() {
    var connections = connectionRepository.findByStatus(BankConnectionStatus.ACTIVE);
    log.info("Scheduled bank sync starting for {} connection(s)", connections.size());
    int failed = 0;
    for (var connection : connections) {
      MDC.put("tenantId", connection.getTenantId());
      try {
        var result = syncService.runSync(connection.getTenantId(), SyncType.SCHEDULED);
        if (result.skipped()) {
          log.info("Scheduled sync skipped, another run is in progress");
        }
      } catch (RuntimeException e) {
        failed++;
        log.warn("Scheduled sync failed: {}", e.getMessage());
      } finally {
        MDC.remove("tenantId");
      }
    }
    log.info(
        "Scheduled bank sync finished: {} ok, {} failed", connections.size() - failed, failed);
  }
}
