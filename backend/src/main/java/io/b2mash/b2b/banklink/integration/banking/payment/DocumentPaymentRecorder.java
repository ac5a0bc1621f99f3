package io.b2mash.b2b.banklink.integration.banking.payment;

import java.util.UUID;

/** The invoice-like documents a bank payment can settle. */
public interface DocumentPaymentRecorder {

  boolean documentExists(String tenantId, UUID documentId);

  /**
   * @return {@code true} if the document transitioned to paid, {@code false} if it was missing,
   *     already paid, or not in a payable state
   */
  boolean markPaid(String tenantId, UUID documentId, String paymentReference);
}
