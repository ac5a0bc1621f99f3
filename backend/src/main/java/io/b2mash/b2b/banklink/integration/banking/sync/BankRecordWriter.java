package io.b2mash.b2b.banklink.integration.banking.sync;

import io.b2mash.b2b.banklink.integration.banking.client.AccountSnapshot;
import io.b2mash.b2b.banklink.integration.banking.client.TransactionSnapshot;
import java.time.Instant;
import java.util.UUID;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Upserts mirrored records keyed by their natural external id. Each call commits on its own so a
 * failed record neither rolls back nor blocks the rest of a sync run.
 */
@Component
public class BankRecordWriter {

  private final BankAccountRepository accountRepository;
  private final BankTransactionRepository transactionRepository;

  public BankRecordWriter(
      BankAccountRepository accountRepository, BankTransactionRepository transactionRepository) {
    this.accountRepository = accountRepository;
    this.transactionRepository = transactionRepository;
  }

  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public BankAccount upsertAccount(String tenantId, UUID connectionId, AccountSnapshot snapshot) {
    var account =
        accountRepository
            .findByTenantIdAndExternalAccountId(tenantId, snapshot.externalAccountId())
            .orElseGet(() -> new BankAccount(tenantId, connectionId, snapshot.externalAccountId()));
    account.refreshFrom(snapshot, connectionId, Instant.now());
    return accountRepository.save(account);
  }

  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public BankTransaction upsertTransaction(
      String tenantId, UUID accountId, TransactionSnapshot snapshot) {
    var transaction =
        transactionRepository
            .findByTenantIdAndExternalTransactionId(tenantId, snapshot.externalTransactionId())
            .orElseGet(() -> new BankTransaction(tenantId, snapshot.externalTransactionId()));
    transaction.refreshFrom(snapshot, accountId);
    return transactionRepository.save(transaction);
  }
}
