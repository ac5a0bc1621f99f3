package io.b2mash.b2b.banklink.integration.banking.sync;

import io.b2mash.b2b.banklink.audit.AuditEventBuilder;
import io.b2mash.b2b.banklink.audit.AuditService;
import io.b2mash.b2b.banklink.exception.ResourceNotFoundException;
import io.b2mash.b2b.banklink.integration.banking.BankingAccessPolicy;
import io.b2mash.b2b.banklink.integration.banking.payment.DocumentPaymentRecorder;
import io.b2mash.b2b.banklink.integration.banking.sync.BankLedgerViews.AccountView;
import io.b2mash.b2b.banklink.integration.banking.sync.BankLedgerViews.AccountsOverview;
import io.b2mash.b2b.banklink.integration.banking.sync.BankLedgerViews.SyncRunView;
import io.b2mash.b2b.banklink.integration.banking.sync.BankLedgerViews.TransactionView;
import io.b2mash.b2b.banklink.multitenancy.RequestScopes;
import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Reads over mirrored bank data, and manual reconciliation of transactions. */
@Service
public class BankLedgerService {

  private static final int MAX_SYNC_RUNS = 100;

  private final BankAccountRepository accountRepository;
  private final BankTransactionRepository transactionRepository;
  private final SyncRunRepository syncRunRepository;
  private final DocumentPaymentRecorder documents;
  private final AuditService auditService;

  public BankLedgerService(
      BankAccountRepository accountRepository,
      BankTransactionRepository transactionRepository,
      SyncRunRepository syncRunRepository,
      DocumentPaymentRecorder documents,
      AuditService auditService) {
    this.accountRepository = accountRepository;
    this.transactionRepository = transactionRepository;
    this.syncRunRepository = syncRunRepository;
    this.documents = documents;
    this.auditService = auditService;
  }

  @Transactional(readOnly = true)
  public AccountsOverview listAccounts() {
    BankingAccessPolicy.requireAdminOrOwner();
    String tenantId = RequestScopes.requireTenantId();
    var accounts = accountRepository.findByTenantIdOrderByNameAsc(tenantId);
    Map<String, BigDecimal> totals = new TreeMap<>();
    for (var account : accounts) {
      totals.merge(account.getCurrency(), account.getBalance(), BigDecimal::add);
    }
    return new AccountsOverview(accounts.stream().map(AccountView::from).toList(), totals);
  }

  @Transactional(readOnly = true)
  public Page<TransactionView> listTransactions(
      UUID accountId, String state, Boolean reconciled, Pageable pageable) {
    BankingAccessPolicy.requireAdminOrOwner();
    String tenantId = RequestScopes.requireTenantId();
    return transactionRepository
        .search(tenantId, accountId, state, reconciled, pageable)
        .map(TransactionView::from);
  }

  @Transactional(readOnly = true)
  public List<SyncRunView> listSyncRuns(int limit) {
    BankingAccessPolicy.requireAdminOrOwner();
    String tenantId = RequestScopes.requireTenantId();
    int size = Math.max(1, Math.min(limit, MAX_SYNC_RUNS));
    return syncRunRepository
        .findByTenantIdOrderByStartedAtDesc(tenantId, PageRequest.of(0, size))
        .stream()
        .map(SyncRunView::from)
        .toList();
  }

  /** Marks a mirrored transaction as reconciled, optionally against an invoice. */
  @Transactional
  public TransactionView reconcile(UUID transactionId, UUID documentId, String notes) {
    BankingAccessPolicy.requireAdminOrOwner();
    String tenantId = RequestScopes.requireTenantId();
    var transaction = requireTransaction(tenantId, transactionId);
    if (documentId != null && !documents.documentExists(tenantId, documentId)) {
      throw new ResourceNotFoundException("Invoice", documentId);
    }

    transaction.reconcile(documentId, notes, RequestScopes.requireMemberId());
    transactionRepository.save(transaction);

    var details = new HashMap<String, Object>();
    details.put("external_transaction_id", transaction.getExternalTransactionId());
    details.put("amount", transaction.getAmount().toPlainString());
    details.put("currency", transaction.getCurrency());
    if (documentId != null) {
      details.put("document_id", documentId.toString());
    }
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("bank_transaction.reconciled")
            .entityType("bank_transaction")
            .entityId(transaction.getId())
            .details(details)
            .build());
    return TransactionView.from(transaction);
  }

  @Transactional
  public TransactionView unreconcile(UUID transactionId) {
    BankingAccessPolicy.requireAdminOrOwner();
    String tenantId = RequestScopes.requireTenantId();
    var transaction = requireTransaction(tenantId, transactionId);
    transaction.unreconcile();
    transactionRepository.save(transaction);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("bank_transaction.unreconciled")
            .entityType("bank_transaction")
            .entityId(transaction.getId())
            .details(Map.of("external_transaction_id", transaction.getExternalTransactionId()))
            .build());
    return TransactionView.from(transaction);
  }

  private BankTransaction requireTransaction(String tenantId, UUID transactionId) {
    return transactionRepository
        .findByIdAndTenantId(transactionId, tenantId)
        .orElseThrow(() -> new ResourceNotFoundException("BankTransaction", transactionId));
  }
}
