package io.b2mash.b2b.banklink.integration.banking.connection;

import io.b2mash.b2b.banklink.audit.AuditEventBuilder;
import io.b2mash.b2b.banklink.audit.AuditService;
import io.b2mash.b2b.banklink.exception.IntegrationNotConfiguredException;
import io.b2mash.b2b.banklink.integration.banking.BankingAccessPolicy;
import io.b2mash.b2b.banklink.integration.banking.BankingException;
import io.b2mash.b2b.banklink.integration.banking.BankingProperties;
import io.b2mash.b2b.banklink.integration.banking.NoConnectionException;
import io.b2mash.b2b.banklink.integration.banking.client.BankApiClient;
import io.b2mash.b2b.banklink.integration.banking.client.BankApiException;
import io.b2mash.b2b.banklink.integration.banking.client.TokenGrant;
import io.b2mash.b2b.banklink.integration.secret.TokenVault;
import io.b2mash.b2b.banklink.member.MemberRepository;
import io.b2mash.b2b.banklink.multitenancy.RequestScopes;
import io.b2mash.b2b.banklink.security.Roles;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Owns the bank connection lifecycle: the OAuth authorization-code flow, disconnect, and handing
 * out valid access tokens to internal callers.
 *
 * <p>Each step commits on its own: the state binding is consumed before the code exchange so a
 * failed exchange cannot be replayed, and token refresh runs under a row lock on the connection so
 * concurrent callers never interleave their writes.
 */
@Service
public class BankConnectionService {

  private static final Logger log = LoggerFactory.getLogger(BankConnectionService.class);

  private static final int STATE_BYTES = 32;

  private final BankingProperties properties;
  private final BankApiClient bankApiClient;
  private final TokenVault tokenVault;
  private final BankConnectionRepository connectionRepository;
  private final OAuthStateBindingRepository stateBindingRepository;
  private final MemberRepository memberRepository;
  private final BankDataPurger dataPurger;
  private final AuditService auditService;
  private final TransactionTemplate txTemplate;
  private final SecureRandom secureRandom = new SecureRandom();

  public BankConnectionService(
      BankingProperties properties,
      BankApiClient bankApiClient,
      TokenVault tokenVault,
      BankConnectionRepository connectionRepository,
      OAuthStateBindingRepository stateBindingRepository,
      MemberRepository memberRepository,
      BankDataPurger dataPurger,
      AuditService auditService,
      PlatformTransactionManager txManager) {
    this.properties = properties;
    this.bankApiClient = bankApiClient;
    this.tokenVault = tokenVault;
    this.connectionRepository = connectionRepository;
    this.stateBindingRepository = stateBindingRepository;
    this.memberRepository = memberRepository;
    this.dataPurger = dataPurger;
    this.auditService = auditService;
    this.txTemplate = new TransactionTemplate(txManager);
    this.txTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  /**
   * Starts the authorization flow for the caller's tenant.
   *
   * @throws IntegrationNotConfiguredException if no client id is configured
   * @throws AlreadyConnectedException if the tenant already has an active connection
   */
  public AuthorizationRequest initiate() {
    requireConfigured();
    BankingAccessPolicy.requireOwner("connect a bank account");
    String tenantId = RequestScopes.requireTenantId();
    UUID memberId = RequestScopes.requireMemberId();

    var existing = connectionRepository.findByTenantId(tenantId);
    if (existing.isPresent() && existing.get().isActive()) {
      throw new AlreadyConnectedException();
    }

    String state = newState();
    Instant now = Instant.now();
    txTemplate.executeWithoutResult(
        tx -> {
          stateBindingRepository.deleteExpired(now);
          stateBindingRepository.save(
              new OAuthStateBinding(state, tenantId, memberId, now.plus(properties.stateTtl())));
        });

    log.info("Bank authorization started for tenant {} by member {}", tenantId, memberId);
    return new AuthorizationRequest(
        bankApiClient.authorizationUrl(state), state, properties.stateTtl());
  }

  /**
   * Completes the authorization flow from the bank's redirect. Runs without a bearer token: the
   * tenant and acting member come from the consumed state binding.
   *
   * @throws OAuthCallbackException with the reason the connection was not stored
   */
  public void completeAuthorization(CallbackRequest request) {
    String bindingKey = request.browserState() != null ? request.browserState() : request.state();
    Optional<OAuthStateBinding> binding =
        isBlank(bindingKey) ? Optional.empty() : consumeBinding(bindingKey);

    if (request.error() != null) {
      log.warn("Bank authorization denied: {}", request.error());
      throw new OAuthCallbackException(
          CallbackFailure.OAUTH_DENIED,
          request.errorDescription() != null ? request.errorDescription() : request.error());
    }
    if (isBlank(request.code()) || isBlank(request.state())) {
      throw new OAuthCallbackException(
          CallbackFailure.INVALID_CALLBACK, "Callback is missing code or state");
    }
    if (request.browserState() == null) {
      throw new OAuthCallbackException(
          CallbackFailure.SESSION_EXPIRED, "No authorization in progress for this browser");
    }
    if (!request.browserState().equals(request.state())) {
      log.warn("Bank authorization state mismatch");
      throw new OAuthCallbackException(
          CallbackFailure.STATE_MISMATCH, "Returned state does not match the bound state");
    }
    var bound =
        binding
            .filter(b -> !b.isExpired(Instant.now()))
            .orElseThrow(
                () ->
                    new OAuthCallbackException(
                        CallbackFailure.SESSION_EXPIRED,
                        "Authorization state expired or already used"));

    requireOwnerMember(bound);

    TokenGrant grant;
    try {
      grant = bankApiClient.exchangeCode(request.code());
    } catch (BankApiException e) {
      throw new OAuthCallbackException(
          CallbackFailure.CALLBACK_FAILED, "Code exchange failed: " + e.getMessage(), e);
    }
    if (grant.refreshToken() == null) {
      throw new OAuthCallbackException(
          CallbackFailure.CALLBACK_FAILED, "Token response did not include a refresh token");
    }

    UUID connectionId;
    try {
      connectionId = storeConnection(bound, grant);
    } catch (RuntimeException e) {
      log.error("Failed to store bank connection for tenant {}", bound.getTenantId(), e);
      throw new OAuthCallbackException(
          CallbackFailure.STORAGE_FAILED, "Connection could not be stored", e);
    }
    log.info("Bank connection {} active for tenant {}", connectionId, bound.getTenantId());
  }

  /**
   * Disconnects the caller's tenant. Revoke (the default) wipes credentials but keeps mirrored
   * data; purge deletes the connection and all data mirrored or initiated through it.
   */
  public DisconnectResult disconnect(boolean deleteData) {
    BankingAccessPolicy.requireOwner("disconnect the bank account");
    String tenantId = RequestScopes.requireTenantId();
    var connection =
        connectionRepository.findByTenantId(tenantId).orElseThrow(NoConnectionException::new);

    if (deleteData) {
      try {
        txTemplate.executeWithoutResult(
            tx -> {
              dataPurger.purge(connection);
              auditService.log(
                  AuditEventBuilder.builder()
                      .eventType("bank_connection.purged")
                      .entityType("bank_connection")
                      .entityId(connection.getId())
                      .details(Map.of("previous_status", connection.getStatus().name()))
                      .build());
            });
      } catch (DataAccessException | TransactionException e) {
        log.error("Failed to purge bank data for tenant {}", tenantId, e);
        throw new BankingException(
            HttpStatus.INTERNAL_SERVER_ERROR,
            "DELETE_FAILED",
            "Disconnect failed",
            "Bank data could not be deleted",
            e);
      }
      return new DisconnectResult(true, true);
    }

    try {
      txTemplate.executeWithoutResult(
          tx -> {
            var locked =
                connectionRepository
                    .findByTenantIdForUpdate(tenantId)
                    .orElseThrow(NoConnectionException::new);
            locked.revoke();
            connectionRepository.save(locked);
            auditService.log(
                AuditEventBuilder.builder()
                    .eventType("bank_connection.revoked")
                    .entityType("bank_connection")
                    .entityId(locked.getId())
                    .details(Map.of("data_retained", true))
                    .build());
          });
    } catch (DataAccessException | TransactionException e) {
      log.error("Failed to revoke bank connection for tenant {}", tenantId, e);
      throw new BankingException(
          HttpStatus.INTERNAL_SERVER_ERROR,
          "UPDATE_FAILED",
          "Disconnect failed",
          "Bank connection could not be updated",
          e);
    }
    return new DisconnectResult(true, false);
  }

  /** Current connection state for the caller's tenant. */
  public ConnectionStatusView getStatus() {
    BankingAccessPolicy.requireAdminOrOwner();
    String tenantId = RequestScopes.requireTenantId();
    return connectionRepository
        .findByTenantId(tenantId)
        .map(ConnectionStatusView::from)
        .orElseGet(ConnectionStatusView::notConnected);
  }

  /**
   * Returns a decrypted access token that is not expired, refreshing it first when needed.
   *
   * @throws NoConnectionException if the tenant has no active connection
   * @throws TokenRefreshFailedException if the refresh token expired or was rejected; the
   *     connection is then EXPIRED
   */
  public String getValidToken(String tenantId) {
    TokenOutcome outcome = txTemplate.execute(tx -> loadOrRefreshToken(tenantId));
    if (outcome.noConnection()) {
      throw new NoConnectionException();
    }
    if (outcome.failure() != null) {
      throw new TokenRefreshFailedException(outcome.failure(), outcome.cause());
    }
    return outcome.token();
  }

  private TokenOutcome loadOrRefreshToken(String tenantId) {
    var connection =
        connectionRepository
            .findByTenantIdForUpdate(tenantId)
            .filter(BankConnection::isActive)
            .orElse(null);
    if (connection == null) {
      return TokenOutcome.missing();
    }

    Instant now = Instant.now();
    if (!connection.isAccessTokenExpired(now, properties.accessTokenSkew())) {
      return TokenOutcome.valid(tokenVault.decrypt(connection.getAccessTokenEncrypted()));
    }

    if (connection.isRefreshTokenExpired(now)) {
      markRefreshFailed(connection, "refresh_token_expired");
      return TokenOutcome.failed("Refresh token expired; reconnect the bank account", null);
    }

    try {
      var grant = bankApiClient.refresh(tokenVault.decrypt(connection.getRefreshTokenEncrypted()));
      boolean rotated = grant.refreshToken() != null;
      connection.rotateTokens(
          tokenVault.encrypt(grant.accessToken()),
          now.plus(grant.expiresIn()),
          rotated ? tokenVault.encrypt(grant.refreshToken()) : null,
          rotated ? now.plus(properties.refreshTokenTtl()) : null);
      connectionRepository.save(connection);
      log.info("Refreshed bank access token for tenant {}", tenantId);
      return TokenOutcome.valid(grant.accessToken());
    } catch (BankApiException e) {
      log.warn("Bank token refresh rejected for tenant {}: {}", tenantId, e.getMessage());
      markRefreshFailed(connection, "refresh_rejected");
      return TokenOutcome.failed("Bank rejected the token refresh", e);
    }
  }

  private void markRefreshFailed(BankConnection connection, String reason) {
    connection.markExpired();
    connectionRepository.save(connection);
    auditService.log(
        AuditEventBuilder.builder()
            .tenantId(connection.getTenantId())
            .eventType("bank_connection.refresh_failed")
            .entityType("bank_connection")
            .entityId(connection.getId())
            .details(Map.of("reason", reason))
            .build());
  }

  private UUID storeConnection(OAuthStateBinding bound, TokenGrant grant) {
    Instant now = Instant.now();
    String accessEncrypted = tokenVault.encrypt(grant.accessToken());
    String refreshEncrypted = tokenVault.encrypt(grant.refreshToken());
    return txTemplate.execute(
        tx -> {
          // Reuses a revoked or expired row so the tenant keeps exactly one connection.
          var connection =
              connectionRepository
                  .findByTenantIdForUpdate(bound.getTenantId())
                  .orElseGet(() -> new BankConnection(bound.getTenantId()));
          connection.activate(
              accessEncrypted,
              refreshEncrypted,
              grant.tokenType(),
              now.plus(grant.expiresIn()),
              now.plus(properties.refreshTokenTtl()));
          var saved = connectionRepository.save(connection);
          auditService.log(
              AuditEventBuilder.builder()
                  .tenantId(bound.getTenantId())
                  .eventType("bank_connection.connected")
                  .entityType("bank_connection")
                  .entityId(saved.getId())
                  .actorId(bound.getMemberId())
                  .actorType("USER")
                  .details(Map.of("sandbox", properties.sandbox()))
                  .build());
          return saved.getId();
        });
  }

  private Optional<OAuthStateBinding> consumeBinding(String state) {
    return txTemplate.execute(
        tx -> {
          var binding = stateBindingRepository.findById(state);
          if (binding.isEmpty() || stateBindingRepository.deleteByState(state) == 0) {
            return Optional.empty();
          }
          return binding;
        });
  }

  private void requireOwnerMember(OAuthStateBinding bound) {
    boolean owner =
        memberRepository
            .findByIdAndTenantIdAndActiveTrue(bound.getMemberId(), bound.getTenantId())
            .map(m -> Roles.ORG_OWNER.equals(m.getOrgRole()))
            .orElse(false);
    if (!owner) {
      log.warn(
          "Member {} no longer owns tenant {}; rejecting bank callback",
          bound.getMemberId(),
          bound.getTenantId());
      throw new OAuthCallbackException(
          CallbackFailure.CALLBACK_FAILED, "Initiating member is no longer the owner");
    }
  }

  private void requireConfigured() {
    if (!properties.isConfigured()) {
      throw new IntegrationNotConfiguredException("Bank integration is not configured");
    }
  }

  private String newState() {
    byte[] bytes = new byte[STATE_BYTES];
    secureRandom.nextBytes(bytes);
    return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private record TokenOutcome(String token, boolean noConnection, String failure, Exception cause) {

    static TokenOutcome valid(String token) {
      return new TokenOutcome(token, false, null, null);
    }

    static TokenOutcome missing() {
      return new TokenOutcome(null, true, null, null);
    }

    static TokenOutcome failed(String failure, Exception cause) {
      return new TokenOutcome(null, false, failure, cause);
    }
  }
}
