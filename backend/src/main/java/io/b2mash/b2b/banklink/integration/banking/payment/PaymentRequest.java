package io.b2mash.b2b.banklink.integration.banking.payment;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.util.UUID;

/** Body of an outbound payment request. {@code amount} is in major units. */
public record PaymentRequest(
    @NotNull UUID sourceAccountId,
    @NotNull @Valid Recipient recipient,
    @NotNull @DecimalMin(value = "0.01") @Digits(integer = 16, fraction = 2) BigDecimal amount,
    @NotBlank @Pattern(regexp = "[A-Z]{3}", message = "must be an ISO 4217 code") String currency,
    @NotBlank @Size(max = 140) String reference,
    UUID documentId) {

  public record Recipient(
      @NotBlank @Size(max = 255) String name,
      @NotBlank
          @Pattern(regexp = "[A-Z]{2}[0-9]{2}[A-Z0-9]{10,30}", message = "must be a valid IBAN")
          String iban,
      @Size(max = 11) String bic) {}
}
