package io.b2mash.b2b.banklink.integration.banking.client;

import java.time.Instant;
import java.util.List;

/**
 * Typed access to the bank's business API. Implementations translate wire payloads into the
 * snapshot records below and report every provider failure (error status, timeout, unreachable
 * host) as a {@link BankApiException}.
 */
public interface BankApiClient {

  /** Builds the consent URL the browser is sent to, embedding the opaque {@code state}. */
  String authorizationUrl(String state);

  TokenGrant exchangeCode(String code);

  TokenGrant refresh(String refreshToken);

  List<AccountSnapshot> listAccounts(String accessToken);

  List<TransactionSnapshot> listTransactions(String accessToken, Instant from, int count);

  /** Registers an external recipient and returns the provider's counterparty id. */
  String createCounterparty(String accessToken, CounterpartyDetails counterparty);

  PaymentReceipt createPayment(String accessToken, PaymentOrder order);
}
