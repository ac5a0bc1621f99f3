package io.b2mash.b2b.banklink.invoice;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.banklink.exception.InvalidStateException;
import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class InvoiceServiceTest {

  private static final String TENANT = "tenant_acme";
  private static final UUID INVOICE_ID = UUID.randomUUID();

  @Mock private InvoiceRepository invoiceRepository;

  private InvoiceService service;

  @BeforeEach
  void setUp() {
    service = new InvoiceService(invoiceRepository);
  }

  @Test
  void sentInvoiceIsMarkedPaid() {
    var invoice = invoice(InvoiceStatus.SENT);
    when(invoiceRepository.findByIdAndTenantId(INVOICE_ID, TENANT))
        .thenReturn(Optional.of(invoice));

    assertThat(service.markPaid(TENANT, INVOICE_ID, "pay-1")).isTrue();

    assertThat(invoice.getStatus()).isEqualTo(InvoiceStatus.PAID);
    assertThat(invoice.getPaymentReference()).isEqualTo("pay-1");
    assertThat(invoice.getPaidAt()).isNotNull();
    verify(invoiceRepository).save(invoice);
  }

  @Test
  void alreadyPaidInvoiceIsLeftAlone() {
    var invoice = invoice(InvoiceStatus.SENT);
    invoice.recordPayment("pay-0");
    when(invoiceRepository.findByIdAndTenantId(INVOICE_ID, TENANT))
        .thenReturn(Optional.of(invoice));

    assertThat(service.markPaid(TENANT, INVOICE_ID, "pay-1")).isFalse();

    assertThat(invoice.getPaymentReference()).isEqualTo("pay-0");
    verify(invoiceRepository, never()).save(any());
  }

  @Test
  void draftInvoiceCannotBeMarkedPaid() {
    when(invoiceRepository.findByIdAndTenantId(INVOICE_ID, TENANT))
        .thenReturn(Optional.of(invoice(InvoiceStatus.DRAFT)));

    assertThat(service.markPaid(TENANT, INVOICE_ID, "pay-1")).isFalse();
    verify(invoiceRepository, never()).save(any());
  }

  @Test
  void missingInvoiceIsReportedNotThrown() {
    when(invoiceRepository.findByIdAndTenantId(INVOICE_ID, TENANT)).thenReturn(Optional.empty());

    assertThat(service.markPaid(TENANT, INVOICE_ID, "pay-1")).isFalse();
    assertThat(service.documentExists(TENANT, INVOICE_ID)).isFalse();
  }

  @Test
  void recordPaymentRequiresSentStatus() {
    var invoice = invoice(InvoiceStatus.VOID);

    assertThatThrownBy(() -> invoice.recordPayment("pay-1"))
        .isInstanceOf(InvalidStateException.class);
  }

  private static Invoice invoice(InvoiceStatus status) {
    return new Invoice(TENANT, "INV-42", status, "EUR", new BigDecimal("150.00"));
  }
}
