package io.b2mash.b2b.banklink.integration.banking.payment;

import io.b2mash.b2b.banklink.audit.AuditEventBuilder;
import io.b2mash.b2b.banklink.audit.AuditService;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Side effects of a payment status change: settles the linked document on completion and writes
 * the completion, failure or anomaly audit event. Callers pass the transition returned by the
 * entity so repeated terminal states produce no second side effect.
 */
@Component
public class PaymentOutcomeRecorder {

  private static final Logger log = LoggerFactory.getLogger(PaymentOutcomeRecorder.class);

  private final DocumentPaymentRecorder documents;
  private final AuditService auditService;

  public PaymentOutcomeRecorder(DocumentPaymentRecorder documents, AuditService auditService) {
    this.documents = documents;
    this.auditService = auditService;
  }

  public void record(
      BankPayment payment,
      BankPaymentStatus previousStatus,
      BankPaymentStatus reportedStatus,
      StateTransition transition,
      String source) {
    switch (transition) {
      case APPLIED -> onApplied(payment, source);
      case ANOMALY -> onAnomaly(payment, reportedStatus, source);
      case IGNORED ->
          log.info(
              "Ignored {} for payment {} already in terminal status {}",
              reportedStatus,
              payment.getId(),
              previousStatus);
      case UNCHANGED ->
          log.debug("Payment {} already in status {}", payment.getId(), payment.getStatus());
    }
  }

  private void onApplied(BankPayment payment, String source) {
    switch (payment.getStatus()) {
      case COMPLETED -> onCompleted(payment, source);
      case FAILED, CANCELLED -> onFailed(payment, source);
      default -> log.debug("Payment {} moved to {}", payment.getId(), payment.getStatus());
    }
  }

  private void onCompleted(BankPayment payment, String source) {
    var details = baseDetails(payment);
    if (payment.getDocumentId() != null) {
      boolean settled =
          documents.markPaid(
              payment.getTenantId(), payment.getDocumentId(), payment.paymentReference());
      details.put("document_id", payment.getDocumentId().toString());
      details.put("document_marked_paid", settled);
      if (!settled) {
        log.warn(
            "Payment {} completed but document {} could not be marked paid",
            payment.getId(),
            payment.getDocumentId());
      }
    }
    audit(payment, "payment.completed", source, details);
  }

  private void onFailed(BankPayment payment, String source) {
    var details = baseDetails(payment);
    details.put("status", payment.getStatus().name());
    if (payment.getReasonCode() != null) {
      details.put("reason_code", payment.getReasonCode());
    }
    audit(payment, "payment.failed", source, details);
  }

  private void onAnomaly(BankPayment payment, BankPaymentStatus reported, String source) {
    log.warn(
        "Payment {} is {} but provider reported {}; not applied",
        payment.getId(),
        payment.getStatus(),
        reported);
    var details = baseDetails(payment);
    details.put("current_status", payment.getStatus().name());
    details.put("reported_status", reported.name());
    audit(payment, "payment.state_anomaly", source, details);
  }

  private HashMap<String, Object> baseDetails(BankPayment payment) {
    var details = new HashMap<String, Object>();
    details.put("request_id", payment.getRequestId());
    if (payment.getExternalPaymentId() != null) {
      details.put("external_payment_id", payment.getExternalPaymentId());
    }
    details.put("amount", payment.getAmount().toPlainString());
    details.put("currency", payment.getCurrency());
    return details;
  }

  private void audit(
      BankPayment payment, String eventType, String source, Map<String, Object> details) {
    var builder =
        AuditEventBuilder.builder()
            .tenantId(payment.getTenantId())
            .eventType(eventType)
            .entityType("bank_payment")
            .entityId(payment.getId())
            .details(details);
    if ("WEBHOOK".equals(source)) {
      builder.actorType("SYSTEM").source("WEBHOOK");
    }
    auditService.log(builder.build());
  }
}
