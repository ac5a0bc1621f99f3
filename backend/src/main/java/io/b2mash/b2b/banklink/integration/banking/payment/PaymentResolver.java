package io.b2mash.b2b.banklink.integration.banking.payment;

import org.springframework.stereotype.Component;

/**
 * Resolves the id carried by a payment event. The provider echoes either its own payment id or
 * our request id depending on the event; the provider id takes precedence.
 */
@Component
public class PaymentResolver {

  private final BankPaymentRepository paymentRepository;

  public PaymentResolver(BankPaymentRepository paymentRepository) {
    this.paymentRepository = paymentRepository;
  }

  public PaymentResolution resolve(String id) {
    if (id == null || id.isBlank()) {
      return PaymentResolution.notFound();
    }
    var byExternalId = paymentRepository.findByExternalPaymentId(id);
    if (byExternalId.isPresent()) {
      return new PaymentResolution(
          PaymentResolution.Match.FOUND_BY_EXTERNAL_ID, byExternalId.get());
    }
    return paymentRepository
        .findByRequestId(id)
        .map(p -> new PaymentResolution(PaymentResolution.Match.FOUND_BY_REQUEST_ID, p))
        .orElseGet(PaymentResolution::notFound);
  }
}
