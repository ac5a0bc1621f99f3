package io.b2mash.b2b.banklink.invoice;

import io.b2mash.b2b.banklink.exception.ResourceNotFoundException;
import io.b2mash.b2b.banklink.integration.banking.payment.DocumentPaymentRecorder;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Invoice operations driven by the banking integration: payment receipt and link validation. */
@Service
public class InvoiceService implements DocumentPaymentRecorder {

  private static final Logger log = LoggerFactory.getLogger(InvoiceService.class);

  private final InvoiceRepository invoiceRepository;

  public InvoiceService(InvoiceRepository invoiceRepository) {
    this.invoiceRepository = invoiceRepository;
  }

  @Transactional(readOnly = true)
  public Invoice requireInvoice(String tenantId, UUID invoiceId) {
    return invoiceRepository
        .findByIdAndTenantId(invoiceId, tenantId)
        .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
  }

  @Override
  @Transactional(readOnly = true)
  public boolean documentExists(String tenantId, UUID documentId) {
    return invoiceRepository.findByIdAndTenantId(documentId, tenantId).isPresent();
  }

  @Override
  @Transactional
  public boolean markPaid(String tenantId, UUID documentId, String paymentReference) {
    var invoice = invoiceRepository.findByIdAndTenantId(documentId, tenantId).orElse(null);
    if (invoice == null) {
      log.warn("Paid document {} not found for tenant {}", documentId, tenantId);
      return false;
    }

    // Idempotency: skip if already PAID
    if (invoice.getStatus() == InvoiceStatus.PAID) {
      log.info("Invoice {} already paid, skipping", documentId);
      return false;
    }

    if (!invoice.getStatus().canTransitionTo(InvoiceStatus.PAID)) {
      log.warn(
          "Invoice {} in status {} cannot be marked paid by bank payment {}",
          documentId,
          invoice.getStatus(),
          paymentReference);
      return false;
    }

    invoice.recordPayment(paymentReference);
    invoiceRepository.save(invoice);
    log.info("Invoice {} marked as paid by bank payment {}", documentId, paymentReference);
    return true;
  }
}
