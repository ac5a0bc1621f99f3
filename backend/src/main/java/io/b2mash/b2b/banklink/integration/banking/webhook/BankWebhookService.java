package io.b2mash.b2b.banklink.integration.banking.webhook;

import io.b2mash.b2b.banklink.integration.banking.payment.BankPaymentRepository;
import io.b2mash.b2b.banklink.integration.banking.payment.BankPaymentStatus;
import io.b2mash.b2b.banklink.integration.banking.payment.PaymentOutcomeRecorder;
import io.b2mash.b2b.banklink.integration.banking.payment.PaymentResolver;
import io.b2mash.b2b.banklink.integration.banking.sync.BankTransactionRepository;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Applies bank webhook events to mirrored transactions and outbound payments. Events that match
 * nothing locally are not errors: the record may not have been synced yet.
 */
@Service
public class BankWebhookService {

  private static final Logger log = LoggerFactory.getLogger(BankWebhookService.class);

  static final String SOURCE = "WEBHOOK";

  private final BankTransactionRepository transactionRepository;
  private final BankPaymentRepository paymentRepository;
  private final PaymentResolver paymentResolver;
  private final PaymentOutcomeRecorder outcomeRecorder;

  public BankWebhookService(
      BankTransactionRepository transactionRepository,
      BankPaymentRepository paymentRepository,
      PaymentResolver paymentResolver,
      PaymentOutcomeRecorder outcomeRecorder) {
    this.transactionRepository = transactionRepository;
    this.paymentRepository = paymentRepository;
    this.paymentResolver = paymentResolver;
    this.outcomeRecorder = outcomeRecorder;
  }

  @Transactional
  public void handle(BankWebhookEvent event) {
    String id = event.entityId();
    if (id == null || id.isBlank()) {
      log.info("Ignoring {} webhook without an entity id", event.event());
      return;
    }
    switch (event.event()) {
      case "TransactionCreated", "TransactionStateChanged" -> applyTransactionEvent(event);
      case "PaymentCreated", "PaymentStateChanged" -> applyPaymentEvent(event);
      default -> log.info("Unhandled bank webhook event type: {}", event.event());
    }
  }

  private void applyTransactionEvent(BankWebhookEvent event) {
    String id = event.data().id();
    String state = event.data().state();
    if (state == null) {
      log.debug("Transaction event for {} carries no state", id);
      return;
    }
    var transactions = transactionRepository.findByExternalTransactionId(id);
    if (transactions.isEmpty()) {
      log.debug("No mirrored transaction {} yet; it will arrive with the next sync", id);
      return;
    }
    for (var transaction : transactions) {
      String previous = transaction.getState();
      if (transaction.applyState(state.toLowerCase(Locale.ROOT))) {
        transactionRepository.save(transaction);
        log.info("Transaction {} moved from {} to {}", id, previous, transaction.getState());
      } else {
        log.debug("Transaction {} kept state {} (reported {})", id, previous, state);
      }
    }
  }

  private void applyPaymentEvent(BankWebhookEvent event) {
    var data = event.data();
    var resolution = paymentResolver.resolve(data.id());
    if (!resolution.found()) {
      log.info("No payment matches webhook id {}", data.id());
      return;
    }
    var reported = BankPaymentStatus.fromProvider(data.state());
    if (reported.isEmpty()) {
      log.info("Payment event for {} has unrecognized state {}", data.id(), data.state());
      return;
    }

    var payment = resolution.payment();
    var previous = payment.getStatus();
    String reasonCode = data.reasonCode();
    if (reasonCode == null && "declined".equalsIgnoreCase(data.state())) {
      reasonCode = "declined";
    }
    var transition = payment.applyProviderState(reported.get(), reasonCode, data.completedAt());
    paymentRepository.save(payment);
    log.info(
        "Payment {} ({}) event {}: {} -> {} [{}]",
        payment.getId(),
        resolution.match(),
        event.event(),
        previous,
        reported.get(),
        transition);
    outcomeRecorder.record(payment, previous, reported.get(), transition, SOURCE);
  }
}
