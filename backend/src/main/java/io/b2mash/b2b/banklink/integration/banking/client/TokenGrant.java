package io.b2mash.b2b.banklink.integration.banking.client;

import java.time.Duration;

/**
 * Tokens issued by the bank's token endpoint.
 *
 * @param refreshToken may be null on a refresh grant, in which case the previous one stays valid
 * @param expiresIn access-token lifetime
 */
public record TokenGrant(
    String accessToken, String refreshToken, String tokenType, Duration expiresIn) {

  @Override
  public String toString() {
    return "TokenGrant[tokenType=" + tokenType + ", expiresIn=" + expiresIn + "]";
  }
}
