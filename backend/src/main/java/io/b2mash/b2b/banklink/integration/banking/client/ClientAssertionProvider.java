package io.b2mash.b2b.banklink.integration.banking.client;

/** Supplies the {@code client_assertion} sent with every token-endpoint request. */
public interface ClientAssertionProvider {

  String clientAssertion();
}
