package io.b2mash.b2b.banklink.integration.banking.connection;

import io.b2mash.b2b.banklink.integration.banking.payment.BankPaymentRepository;
import io.b2mash.b2b.banklink.integration.banking.sync.BankAccountRepository;
import io.b2mash.b2b.banklink.integration.banking.sync.BankTransactionRepository;
import io.b2mash.b2b.banklink.integration.banking.sync.SyncRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/** Deletes a tenant's connection and everything mirrored or initiated through it. */
@Component
public class BankDataPurger {

  private static final Logger log = LoggerFactory.getLogger(BankDataPurger.class);

  private final BankConnectionRepository connectionRepository;
  private final BankAccountRepository accountRepository;
  private final BankTransactionRepository transactionRepository;
  private final BankPaymentRepository paymentRepository;
  private final SyncRunRepository syncRunRepository;

  public BankDataPurger(
      BankConnectionRepository connectionRepository,
      BankAccountRepository accountRepository,
      BankTransactionRepository transactionRepository,
      BankPaymentRepository paymentRepository,
      SyncRunRepository syncRunRepository) {
    this.connectionRepository = connectionRepository;
    this.accountRepository = accountRepository;
    this.transactionRepository = transactionRepository;
    this.paymentRepository = paymentRepository;
    this.syncRunRepository = syncRunRepository;
  }

  /** Children first: transactions and payments reference accounts, all reference the connection. */
  @Transactional
  public void purge(BankConnection connection) {
    String tenantId = connection.getTenantId();
    int transactions = transactionRepository.deleteByTenantId(tenantId);
    int payments = paymentRepository.deleteByTenantId(tenantId);
    int accounts = accountRepository.deleteByTenantId(tenantId);
    int syncRuns = syncRunRepository.deleteByTenantId(tenantId);
    connectionRepository.deleteById(connection.getId());
    log.info(
        "Purged bank data for tenant {}: {} transactions, {} payments, {} accounts, {} sync runs",
        tenantId,
        transactions,
        payments,
        accounts,
        syncRuns);
  }
}
