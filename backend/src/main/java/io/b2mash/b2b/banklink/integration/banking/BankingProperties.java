package io.b2mash.b2b.banklink.integration.banking;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration for the bank integration. An empty {@code clientId} disables the integration.
 *
 * @param clientId OAuth client id registered with the bank
 * @param sandbox whether to use the bank's sandbox hosts
 * @param redirectUri OAuth redirect URI registered with the bank
 * @param webhookSecret shared HMAC secret for webhook signatures; empty disables verification
 * @param settingsUrl where the browser lands after authorize/callback
 * @param syncWindowDays trailing transaction window per sync run
 * @param transactionPageSize provider-side cap on transactions per sync run
 * @param refreshTokenTtl refresh-token lifetime when the provider does not report one
 * @param accessTokenSkew access tokens expiring within this window are refreshed early
 * @param connectTimeout outbound connect timeout
 * @param readTimeout outbound read timeout
 * @param stateTtl lifetime of an OAuth state binding
 * @param scheduledSync periodic sync settings
 */
@ConfigurationProperties(prefix = "banking")
public record BankingProperties(
    String clientId,
    @DefaultValue("true") boolean sandbox,
    @DefaultValue("http://localhost:8080/api/integrations/banking/callback") String redirectUri,
    String webhookSecret,
    @DefaultValue("http://localhost:3000/settings?tab=integrations") String settingsUrl,
    @DefaultValue("30") int syncWindowDays,
    @DefaultValue("1000") int transactionPageSize,
    @DefaultValue("90d") Duration refreshTokenTtl,
    @DefaultValue("5m") Duration accessTokenSkew,
    @DefaultValue("5s") Duration connectTimeout,
    @DefaultValue("30s") Duration readTimeout,
    @DefaultValue("10m") Duration stateTtl,
    @DefaultValue ScheduledSync scheduledSync) {

  private static final String SANDBOX_API_URL = "https://sandbox-b2b.revolut.com/api/1.0";
  private static final String PRODUCTION_API_URL = "https://b2b.revolut.com/api/1.0";
  private static final String SANDBOX_AUTH_URL = "https://sandbox-business.revolut.com/app-confirm";
  private static final String PRODUCTION_AUTH_URL = "https://business.revolut.com/app-confirm";

  public record ScheduledSync(
      @DefaultValue("false") boolean enabled, @DefaultValue("0 0 */6 * * *") String cron) {}

  public boolean isConfigured() {
    return clientId != null && !clientId.isBlank();
  }

  public boolean hasWebhookSecret() {
    return webhookSecret != null && !webhookSecret.isBlank();
  }

  public String apiBaseUrl() {
    return sandbox ? SANDBOX_API_URL : PRODUCTION_API_URL;
  }

  public String authorizationUrl() {
    return sandbox ? SANDBOX_AUTH_URL : PRODUCTION_AUTH_URL;
  }
}
