package io.b2mash.b2b.banklink.integration.banking.payment;

import io.b2mash.b2b.banklink.audit.AuditEventBuilder;
import io.b2mash.b2b.banklink.audit.AuditService;
import io.b2mash.b2b.banklink.exception.ResourceNotFoundException;
import io.b2mash.b2b.banklink.integration.banking.BankingAccessPolicy;
import io.b2mash.b2b.banklink.integration.banking.NoConnectionException;
import io.b2mash.b2b.banklink.integration.banking.client.BankApiClient;
import io.b2mash.b2b.banklink.integration.banking.client.BankApiException;
import io.b2mash.b2b.banklink.integration.banking.client.CounterpartyDetails;
import io.b2mash.b2b.banklink.integration.banking.client.PaymentOrder;
import io.b2mash.b2b.banklink.integration.banking.client.PaymentReceipt;
import io.b2mash.b2b.banklink.integration.banking.connection.BankConnection;
import io.b2mash.b2b.banklink.integration.banking.connection.BankConnectionRepository;
import io.b2mash.b2b.banklink.integration.banking.connection.BankConnectionService;
import io.b2mash.b2b.banklink.integration.banking.sync.BankAccountRepository;
import io.b2mash.b2b.banklink.multitenancy.RequestScopes;
import java.time.Instant;
import java.util.HashMap;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Initiates outbound transfers. The payment row is committed as PENDING before the bank is
 * called, so a webhook can find it by request id even when the submit response is lost.
 */
@Service
public class BankPaymentService {

  private static final Logger log = LoggerFactory.getLogger(BankPaymentService.class);

  private final BankApiClient bankApiClient;
  private final BankConnectionService connectionService;
  private final BankConnectionRepository connectionRepository;
  private final BankAccountRepository accountRepository;
  private final BankPaymentRepository paymentRepository;
  private final DocumentPaymentRecorder documents;
  private final PaymentOutcomeRecorder outcomeRecorder;
  private final AuditService auditService;
  private final TransactionTemplate txTemplate;

  public BankPaymentService(
      BankApiClient bankApiClient,
      BankConnectionService connectionService,
      BankConnectionRepository connectionRepository,
      BankAccountRepository accountRepository,
      BankPaymentRepository paymentRepository,
      DocumentPaymentRecorder documents,
      PaymentOutcomeRecorder outcomeRecorder,
      AuditService auditService,
      PlatformTransactionManager txManager) {
    this.bankApiClient = bankApiClient;
    this.connectionService = connectionService;
    this.connectionRepository = connectionRepository;
    this.accountRepository = accountRepository;
    this.paymentRepository = paymentRepository;
    this.documents = documents;
    this.outcomeRecorder = outcomeRecorder;
    this.auditService = auditService;
    this.txTemplate = new TransactionTemplate(txManager);
    this.txTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  /**
   * Submits a transfer from one of the tenant's synced accounts.
   *
   * @throws NoConnectionException if the tenant has no active connection
   * @throws SourceAccountNotFoundException if the source account is not a synced account of the
   *     tenant
   * @throws PaymentFailedException if the bank rejected the counterparty or the payment (the
   *     payment is then FAILED) or did not answer the submission (the payment stays PENDING)
   */
  public BankPaymentView create(PaymentRequest request) {
    BankingAccessPolicy.requireOwner("initiate bank payments");
    String tenantId = RequestScopes.requireTenantId();
    UUID memberId = RequestScopes.requireMemberId();

    BankConnection connection =
        connectionRepository
            .findByTenantId(tenantId)
            .filter(BankConnection::isActive)
            .orElseThrow(NoConnectionException::new);
    var sourceAccount =
        accountRepository
            .findByIdAndTenantId(request.sourceAccountId(), tenantId)
            .orElseThrow(() -> new SourceAccountNotFoundException(request.sourceAccountId()));
    if (request.documentId() != null && !documents.documentExists(tenantId, request.documentId())) {
      throw new ResourceNotFoundException("Invoice", request.documentId());
    }

    String accessToken = connectionService.getValidToken(tenantId);

    var recipient = request.recipient();
    var payment =
        txTemplate.execute(
            tx ->
                paymentRepository.save(
                    new BankPayment(
                        tenantId,
                        connection.getId(),
                        sourceAccount.getId(),
                        UUID.randomUUID().toString(),
                        request.amount(),
                        request.currency(),
                        request.reference(),
                        recipient.name(),
                        recipient.iban(),
                        recipient.bic(),
                        request.documentId(),
                        memberId)));

    String counterpartyId;
    try {
      counterpartyId =
          bankApiClient.createCounterparty(
              accessToken,
              new CounterpartyDetails(
                  recipient.name(), recipient.iban(), recipient.bic(), request.currency()));
    } catch (BankApiException e) {
      log.warn("Counterparty for payment {} rejected: {}", payment.getRequestId(), e.getMessage());
      recordSubmissionFailure(payment.getId(), e.getMessage());
      throw new PaymentFailedException("The bank rejected the recipient: " + e.getMessage(), e);
    }

    PaymentReceipt receipt;
    try {
      receipt =
          bankApiClient.createPayment(
              accessToken,
              new PaymentOrder(
                  payment.getRequestId(),
                  sourceAccount.getExternalAccountId(),
                  counterpartyId,
                  request.amount(),
                  request.currency(),
                  request.reference()));
    } catch (BankApiException e) {
      if (e.getStatusCode() == 0) {
        // The bank may still have executed it; the webhook settles it by request id.
        log.warn(
            "Payment {} submitted without a response, left pending: {}",
            payment.getRequestId(),
            e.getMessage());
        recordSubmissionUnconfirmed(payment.getId(), e.getMessage());
        throw new PaymentFailedException(
            "No response from the bank; the payment stays pending until the bank confirms it", e);
      }
      log.warn("Payment {} rejected by bank: {}", payment.getRequestId(), e.getMessage());
      recordSubmissionFailure(payment.getId(), e.getMessage());
      throw new PaymentFailedException("The bank rejected the payment: " + e.getMessage(), e);
    }

    var saved = txTemplate.execute(tx -> recordSubmission(payment.getId(), receipt));
    log.info(
        "Payment {} submitted as {} with status {}",
        saved.getRequestId(),
        saved.getExternalPaymentId(),
        saved.getStatus());
    return BankPaymentView.from(saved);
  }

  @Transactional(readOnly = true)
  public Page<BankPaymentView> list(BankPaymentStatus status, Pageable pageable) {
    BankingAccessPolicy.requireAdminOrOwner();
    String tenantId = RequestScopes.requireTenantId();
    var page =
        status == null
            ? paymentRepository.findByTenantIdOrderByCreatedAtDesc(tenantId, pageable)
            : paymentRepository.findByTenantIdAndStatusOrderByCreatedAtDesc(
                tenantId, status, pageable);
    return page.map(BankPaymentView::from);
  }

  private BankPayment recordSubmission(UUID paymentId, PaymentReceipt receipt) {
    var payment = paymentRepository.findById(paymentId).orElseThrow();
    // A webhook may already have moved the payment; keep whatever it applied.
    var previous = payment.getStatus();
    var reported = BankPaymentStatus.fromProvider(receipt.state()).orElse(previous);
    var transition =
        payment.markSubmitted(
            receipt.externalPaymentId(),
            reported,
            receipt.createdAt() != null ? receipt.createdAt() : Instant.now());
    paymentRepository.save(payment);

    var details = new HashMap<String, Object>();
    details.put("request_id", payment.getRequestId());
    details.put("amount", payment.getAmount().toPlainString());
    details.put("currency", payment.getCurrency());
    if (payment.getExternalPaymentId() != null) {
      details.put("external_payment_id", payment.getExternalPaymentId());
    }
    if (payment.getDocumentId() != null) {
      details.put("document_id", payment.getDocumentId().toString());
    }
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("payment.created")
            .entityType("bank_payment")
            .entityId(payment.getId())
            .details(details)
            .build());

    if (reported.isTerminal()) {
      outcomeRecorder.record(payment, previous, reported, transition, "API");
    }
    return payment;
  }

  private void recordSubmissionUnconfirmed(UUID paymentId, String error) {
    txTemplate.executeWithoutResult(
        tx -> {
          var payment = paymentRepository.findById(paymentId).orElseThrow();
          payment.markSubmissionUnconfirmed(error);
          paymentRepository.save(payment);
        });
  }

  private void recordSubmissionFailure(UUID paymentId, String error) {
    txTemplate.executeWithoutResult(
        tx -> {
          var payment = paymentRepository.findById(paymentId).orElseThrow();
          if (payment.getStatus().isTerminal()) {
            return;
          }
          var previous = payment.getStatus();
          payment.markSubmissionFailed(error);
          paymentRepository.save(payment);
          outcomeRecorder.record(
              payment, previous, BankPaymentStatus.FAILED, StateTransition.APPLIED, "API");
        });
  }
}
