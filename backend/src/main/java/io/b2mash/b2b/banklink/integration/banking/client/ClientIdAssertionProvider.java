package io.b2mash.b2b.banklink.integration.banking.client;

import io.b2mash.b2b.banklink.integration.banking.BankingProperties;
import org.springframework.stereotype.Component;

/**
 * Sandbox assertion: the bank's sandbox accepts the bare client id. Production needs an RS256 JWT
 * signed with the certificate registered for the client.
 */
@Component
public class ClientIdAssertionProvider implements ClientAssertionProvider {

  private final BankingProperties properties;

  public ClientIdAssertionProvider(BankingProperties properties) {
    this.properties = properties;
  }

  @Override
  public String clientAssertion() {
    return properties.clientId();
  }
}
