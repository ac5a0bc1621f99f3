package io.b2mash.b2b.banklink.integration.banking.payment;

import jakarta.validation.Valid;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/integrations/banking/payments")
public class BankPaymentController {

  private final BankPaymentService paymentService;

  public BankPaymentController(BankPaymentService paymentService) {
    this.paymentService = paymentService;
  }

  @PostMapping
  public ResponseEntity<BankPaymentView> create(@Valid @RequestBody PaymentRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED).body(paymentService.create(request));
  }

  @GetMapping
  public ResponseEntity<Page<BankPaymentView>> list(
      @RequestParam(required = false) BankPaymentStatus status,
      @PageableDefault(size = 20) Pageable pageable) {
    return ResponseEntity.ok(paymentService.list(status, pageable));
  }
}
