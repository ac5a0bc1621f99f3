package io.b2mash.b2b.banklink.integration.banking.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/** Wire payloads of the bank API. Only the fields the integration consumes are mapped. */
final class BankApiModels {

  private BankApiModels() {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record TokenResponse(
      @JsonProperty("access_token") String accessToken,
      @JsonProperty("refresh_token") String refreshToken,
      @JsonProperty("token_type") String tokenType,
      @JsonProperty("expires_in") Long expiresIn) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record AccountPayload(
      String id, String name, BigDecimal balance, String currency, String state) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record CounterpartyRef(
      String id,
      String name,
      @JsonProperty("account_id") String accountId,
      @JsonProperty("account_type") String accountType) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record LegPayload(
      @JsonProperty("leg_id") String legId,
      @JsonProperty("account_id") String accountId,
      CounterpartyRef counterparty,
      BigDecimal amount,
      String currency,
      String description,
      BigDecimal balance) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record MerchantPayload(
      String name,
      String city,
      @JsonProperty("category_code") String categoryCode,
      String country) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record CardPayload(@JsonProperty("card_number") String cardNumber) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record TransactionPayload(
      String id,
      String type,
      String state,
      @JsonProperty("created_at") Instant createdAt,
      @JsonProperty("completed_at") Instant completedAt,
      @JsonProperty("request_id") String requestId,
      String reference,
      List<LegPayload> legs,
      MerchantPayload merchant,
      CardPayload card) {}

  @JsonInclude(JsonInclude.Include.NON_NULL)
  record CounterpartyRequest(
      @JsonProperty("company_name") String companyName,
      @JsonProperty("bank_country") String bankCountry,
      String currency,
      String iban,
      String bic) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record CounterpartyResponse(String id, String name) {}

  @JsonInclude(JsonInclude.Include.NON_NULL)
  record Receiver(
      @JsonProperty("counterparty_id") String counterpartyId,
      @JsonProperty("account_id") String accountId) {}

  @JsonInclude(JsonInclude.Include.NON_NULL)
  record PaymentRequest(
      @JsonProperty("request_id") String requestId,
      @JsonProperty("account_id") String accountId,
      Receiver receiver,
      long amount,
      String currency,
      String reference) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record PaymentResponse(
      String id,
      String state,
      @JsonProperty("created_at") Instant createdAt,
      @JsonProperty("completed_at") Instant completedAt,
      @JsonProperty("reason_code") String reasonCode) {}
}
