package io.b2mash.b2b.banklink.integration.banking.sync;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.b2mash.b2b.banklink.integration.banking.sync.BankLedgerViews.AccountsOverview;
import io.b2mash.b2b.banklink.integration.banking.sync.BankLedgerViews.SyncRunView;
import io.b2mash.b2b.banklink.integration.banking.sync.BankLedgerViews.TransactionView;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/integrations/banking")
public class BankSyncController {

  private final BankSyncService syncService;
  private final BankLedgerService ledgerService;

  public BankSyncController(BankSyncService syncService, BankLedgerService ledgerService) {
    this.syncService = syncService;
    this.ledgerService = ledgerService;
  }

  @PostMapping("/sync")
  public ResponseEntity<SyncResponse> sync() {
    return ResponseEntity.ok(SyncResponse.from(syncService.syncCurrentTenant()));
  }

  @GetMapping("/accounts")
  public ResponseEntity<AccountsOverview> accounts() {
    return ResponseEntity.ok(ledgerService.listAccounts());
  }

  @GetMapping("/transactions")
  public ResponseEntity<Page<TransactionView>> transactions(
      @RequestParam(required = false) UUID accountId,
      @RequestParam(required = false) String state,
      @RequestParam(required = false) Boolean reconciled,
      @PageableDefault(size = 50, sort = "transactionDate", direction = Sort.Direction.DESC)
          Pageable pageable) {
    return ResponseEntity.ok(
        ledgerService.listTransactions(accountId, state, reconciled, pageable));
  }

  @GetMapping("/sync-runs")
  public ResponseEntity<List<SyncRunView>> syncRuns(
      @RequestParam(defaultValue = "10") int limit) {
    return ResponseEntity.ok(ledgerService.listSyncRuns(limit));
  }

  @PostMapping("/transactions/{id}/reconcile")
  public ResponseEntity<TransactionView> reconcile(
      @PathVariable UUID id, @Valid @RequestBody(required = false) ReconcileRequest request) {
    UUID documentId = request != null ? request.documentId() : null;
    String notes = request != null ? request.notes() : null;
    return ResponseEntity.ok(ledgerService.reconcile(id, documentId, notes));
  }

  @DeleteMapping("/transactions/{id}/reconcile")
  public ResponseEntity<TransactionView> unreconcile(@PathVariable UUID id) {
    return ResponseEntity.ok(ledgerService.unreconcile(id));
  }

  // --- DTOs ---

  public record ReconcileRequest(UUID documentId, @Size(max = 2000) String notes) {}

  public record SyncResponse(
      boolean success,
      @JsonProperty("accounts_synced") int accountsSynced,
      @JsonProperty("transactions_synced") int transactionsSynced,
      boolean skipped,
      @JsonProperty("sync_run_id") UUID syncRunId) {

    static SyncResponse from(SyncResult result) {
      return new SyncResponse(
          true,
          result.accountsSynced(),
          result.transactionsSynced(),
          result.skipped(),
          result.syncRunId());
    }
  }
}
