package io.b2mash.b2b.banklink.integration.banking.client;

import io.b2mash.b2b.banklink.integration.banking.BankingProperties;
import io.b2mash.b2b.banklink.integration.banking.client.BankApiModels.AccountPayload;
import io.b2mash.b2b.banklink.integration.banking.client.BankApiModels.CounterpartyRequest;
import io.b2mash.b2b.banklink.integration.banking.client.BankApiModels.CounterpartyResponse;
import io.b2mash.b2b.banklink.integration.banking.client.BankApiModels.PaymentRequest;
import io.b2mash.b2b.banklink.integration.banking.client.BankApiModels.PaymentResponse;
import io.b2mash.b2b.banklink.integration.banking.client.BankApiModels.Receiver;
import io.b2mash.b2b.banklink.integration.banking.client.BankApiModels.TokenResponse;
import io.b2mash.b2b.banklink.integration.banking.client.BankApiModels.TransactionPayload;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Revolut Business API adapter. Token-endpoint calls authenticate with a client assertion; data
 * calls carry the caller's bearer token. The {@link RestClient} is pre-configured with the API
 * base URL and bounded timeouts.
 */
@Component
public class RevolutBankApiClient implements BankApiClient {

  private static final Logger log = LoggerFactory.getLogger(RevolutBankApiClient.class);

  static final String SCOPE = "accounts:read transactions:read payments:write";

  /** Provider's standard access-token lifetime, used when a token response omits it. */
  static final Duration DEFAULT_ACCESS_TOKEN_TTL = Duration.ofMinutes(40);
  private static final String CLIENT_ASSERTION_TYPE =
      "urn:ietf:params:oauth:client-assertion-type:jwt-bearer";

  private final RestClient restClient;
  private final BankingProperties properties;
  private final ClientAssertionProvider clientAssertionProvider;

  public RevolutBankApiClient(
      @Qualifier("bankRestClient") RestClient restClient,
      BankingProperties properties,
      ClientAssertionProvider clientAssertionProvider) {
    this.restClient = restClient;
    this.properties = properties;
    this.clientAssertionProvider = clientAssertionProvider;
  }

  @Override
  public String authorizationUrl(String state) {
    return UriComponentsBuilder.fromUriString(properties.authorizationUrl())
        .queryParam("client_id", properties.clientId())
        .queryParam("redirect_uri", properties.redirectUri())
        .queryParam("response_type", "code")
        .queryParam("scope", SCOPE)
        .queryParam("state", state)
        .encode()
        .build()
        .toUriString();
  }

  @Override
  public TokenGrant exchangeCode(String code) {
    var form = tokenForm("authorization_code");
    form.add("code", code);
    return requestToken(form, "exchange authorization code");
  }

  @Override
  public TokenGrant refresh(String refreshToken) {
    var form = tokenForm("refresh_token");
    form.add("refresh_token", refreshToken);
    return requestToken(form, "refresh access token");
  }

  @Override
  public List<AccountSnapshot> listAccounts(String accessToken) {
    AccountPayload[] accounts =
        call(
            "list accounts",
            () ->
                restClient
                    .get()
                    .uri("/accounts")
                    .headers(h -> h.setBearerAuth(accessToken))
                    .retrieve()
                    .body(AccountPayload[].class));
    if (accounts == null) {
      return List.of();
    }
    return Arrays.stream(accounts).map(BankPayloadMapper::toAccount).toList();
  }

  @Override
  public List<TransactionSnapshot> listTransactions(String accessToken, Instant from, int count) {
    TransactionPayload[] transactions =
        call(
            "list transactions",
            () ->
                restClient
                    .get()
                    .uri(
                        uri ->
                            uri.path("/transactions")
                                .queryParam("from", from.toString())
                                .queryParam("count", count)
                                .build())
                    .headers(h -> h.setBearerAuth(accessToken))
                    .retrieve()
                    .body(TransactionPayload[].class));
    if (transactions == null) {
      return List.of();
    }
    return Arrays.stream(transactions).map(BankPayloadMapper::toTransaction).toList();
  }

  @Override
  public String createCounterparty(String accessToken, CounterpartyDetails counterparty) {
    var request =
        new CounterpartyRequest(
            counterparty.name(),
            counterparty.bankCountry(),
            counterparty.currency(),
            counterparty.iban(),
            counterparty.bic());
    CounterpartyResponse response =
        call(
            "create counterparty",
            () ->
                restClient
                    .post()
                    .uri("/counterparty")
                    .headers(h -> h.setBearerAuth(accessToken))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(CounterpartyResponse.class));
    if (response == null || response.id() == null) {
      throw new BankApiException("Bank API returned no counterparty id", 0, null);
    }
    return response.id();
  }

  @Override
  public PaymentReceipt createPayment(String accessToken, PaymentOrder order) {
    // For external transfers the receiver account id is the counterparty id.
    var request =
        new PaymentRequest(
            order.requestId(),
            order.externalAccountId(),
            new Receiver(order.counterpartyId(), order.counterpartyId()),
            order.amount().movePointRight(2).setScale(0, RoundingMode.HALF_UP).longValueExact(),
            order.currency(),
            order.reference());
    PaymentResponse response =
        call(
            "create payment",
            () ->
                restClient
                    .post()
                    .uri("/pay")
                    .headers(h -> h.setBearerAuth(accessToken))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(PaymentResponse.class));
    if (response == null || response.id() == null) {
      throw new BankApiException("Bank API returned no payment id", 0, null);
    }
    return new PaymentReceipt(
        response.id(),
        response.state(),
        response.createdAt(),
        response.completedAt(),
        response.reasonCode());
  }

  private MultiValueMap<String, String> tokenForm(String grantType) {
    var form = new LinkedMultiValueMap<String, String>();
    form.add("grant_type", grantType);
    form.add("client_id", properties.clientId());
    form.add("client_assertion_type", CLIENT_ASSERTION_TYPE);
    form.add("client_assertion", clientAssertionProvider.clientAssertion());
    return form;
  }

  private TokenGrant requestToken(MultiValueMap<String, String> form, String action) {
    TokenResponse response =
        call(
            action,
            () ->
                restClient
                    .post()
                    .uri("/auth/token")
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(form)
                    .retrieve()
                    .body(TokenResponse.class));
    if (response == null || response.accessToken() == null) {
      throw new BankApiException("Token endpoint returned no access token", 0, null);
    }
    Duration expiresIn =
        response.expiresIn() != null && response.expiresIn() > 0
            ? Duration.ofSeconds(response.expiresIn())
            : DEFAULT_ACCESS_TOKEN_TTL;
    return new TokenGrant(
        response.accessToken(),
        response.refreshToken(),
        response.tokenType() != null ? response.tokenType() : "Bearer",
        expiresIn);
  }

  private <T> T call(String action, Supplier<T> request) {
    try {
      return request.get();
    } catch (RestClientResponseException e) {
      log.warn("Bank API failed to {}: status={}", action, e.getStatusCode().value());
      throw new BankApiException(
          "Bank API error (" + e.getStatusCode().value() + "): " + e.getResponseBodyAsString(),
          e.getStatusCode().value(),
          e);
    } catch (ResourceAccessException e) {
      log.warn("Bank API unreachable while trying to {}: {}", action, e.getMessage());
      throw new BankApiException("Bank API unreachable: " + e.getMessage(), 0, e);
    } catch (RestClientException e) {
      log.warn("Bank API call failed to {}: {}", action, e.getMessage());
      throw new BankApiException("Bank API call failed: " + e.getMessage(), 0, e);
    }
  }
}
