package io.b2mash.b2b.banklink.integration.banking.connection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.banklink.audit.AuditEventRecord;
import io.b2mash.b2b.banklink.audit.AuditService;
import io.b2mash.b2b.banklink.exception.ForbiddenException;
import io.b2mash.b2b.banklink.exception.IntegrationNotConfiguredException;
import io.b2mash.b2b.banklink.integration.banking.BankingProperties;
import io.b2mash.b2b.banklink.integration.banking.NoConnectionException;
import io.b2mash.b2b.banklink.integration.banking.TestBankingProperties;
import io.b2mash.b2b.banklink.integration.banking.client.BankApiClient;
import io.b2mash.b2b.banklink.integration.banking.client.BankApiException;
import io.b2mash.b2b.banklink.integration.banking.client.TokenGrant;
import io.b2mash.b2b.banklink.integration.secret.TokenVault;
import io.b2mash.b2b.banklink.member.Member;
import io.b2mash.b2b.banklink.member.MemberRepository;
import io.b2mash.b2b.banklink.multitenancy.RequestScopes;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;

@ExtendWith(MockitoExtension.class)
class BankConnectionServiceTest {

  private static final String TENANT = "tenant_acme";
  private static final UUID MEMBER_ID = UUID.randomUUID();

  @Mock private BankApiClient bankApiClient;
  @Mock private TokenVault tokenVault;
  @Mock private BankConnectionRepository connectionRepository;
  @Mock private OAuthStateBindingRepository stateBindingRepository;
  @Mock private MemberRepository memberRepository;
  @Mock private BankDataPurger dataPurger;
  @Mock private AuditService auditService;
  @Mock private PlatformTransactionManager txManager;

  @AfterEach
  void clearScopes() {
    RequestScopes.clear();
  }

  // --- initiate ---

  @Test
  void initiateWithoutClientIdIsNotConfigured() {
    RequestScopes.bind(TENANT, MEMBER_ID, "owner");
    var service = service(TestBankingProperties.unconfigured());

    assertThatThrownBy(service::initiate).isInstanceOf(IntegrationNotConfiguredException.class);
  }

  @Test
  void initiateByAdminIsForbidden() {
    RequestScopes.bind(TENANT, MEMBER_ID, "admin");

    assertThatThrownBy(() -> service().initiate()).isInstanceOf(ForbiddenException.class);
    verify(stateBindingRepository, never()).save(any());
  }

  @Test
  void initiateWithActiveConnectionIsAlreadyConnected() {
    RequestScopes.bind(TENANT, MEMBER_ID, "owner");
    when(connectionRepository.findByTenantId(TENANT))
        .thenReturn(Optional.of(activeConnection(Instant.now().plusSeconds(3600))));

    assertThatThrownBy(() -> service().initiate()).isInstanceOf(AlreadyConnectedException.class);
  }

  @Test
  void initiateFromExpiredConnectionBindsStateToTenantAndMember() {
    RequestScopes.bind(TENANT, MEMBER_ID, "owner");
    var expired = activeConnection(Instant.now());
    expired.markExpired();
    when(connectionRepository.findByTenantId(TENANT)).thenReturn(Optional.of(expired));
    when(bankApiClient.authorizationUrl(anyString()))
        .thenAnswer(inv -> "https://bank.test/consent?state=" + inv.getArgument(0));

    var request = service().initiate();

    var captor = ArgumentCaptor.forClass(OAuthStateBinding.class);
    verify(stateBindingRepository).save(captor.capture());
    var binding = captor.getValue();
    assertThat(binding.getState()).isEqualTo(request.state());
    assertThat(binding.getTenantId()).isEqualTo(TENANT);
    assertThat(binding.getMemberId()).isEqualTo(MEMBER_ID);
    assertThat(binding.isExpired(Instant.now())).isFalse();
    assertThat(request.state()).hasSizeGreaterThanOrEqualTo(43);
    assertThat(request.authorizationUrl()).endsWith(request.state());
    verify(stateBindingRepository).deleteExpired(any());
  }

  // --- callback ---

  @Test
  void callbackWithProviderErrorIsOauthDenied() {
    var request = new CallbackRequest(null, null, "access_denied", "User declined", null);

    assertThatThrownBy(() -> service().completeAuthorization(request))
        .isInstanceOf(OAuthCallbackException.class)
        .hasMessage("User declined")
        .extracting(e -> ((OAuthCallbackException) e).getFailure())
        .isEqualTo(CallbackFailure.OAUTH_DENIED);
  }

  @Test
  void callbackWithoutCodeIsInvalid() {
    assertCallbackFails(null, "s1", "s1", CallbackFailure.INVALID_CALLBACK);
  }

  @Test
  void callbackWithoutBrowserStateIsSessionExpired() {
    assertCallbackFails("code", "s1", null, CallbackFailure.SESSION_EXPIRED);
  }

  @Test
  void callbackWithForeignStateIsMismatch() {
    assertCallbackFails("code", "s1", "s2", CallbackFailure.STATE_MISMATCH);
    verify(bankApiClient, never()).exchangeCode(anyString());
  }

  @Test
  void callbackWithExpiredBindingIsSessionExpired() {
    var binding = new OAuthStateBinding("s1", TENANT, MEMBER_ID, Instant.now().minusSeconds(1));
    when(stateBindingRepository.findById("s1")).thenReturn(Optional.of(binding));
    when(stateBindingRepository.deleteByState("s1")).thenReturn(1);

    assertCallbackFails("code", "s1", "s1", CallbackFailure.SESSION_EXPIRED);
  }

  @Test
  void replayedStateIsSessionExpired() {
    when(stateBindingRepository.findById("s1")).thenReturn(Optional.of(validBinding()));
    when(stateBindingRepository.deleteByState("s1")).thenReturn(0);

    assertCallbackFails("code", "s1", "s1", CallbackFailure.SESSION_EXPIRED);
    verify(bankApiClient, never()).exchangeCode(anyString());
  }

  @Test
  void callbackFromDemotedMemberFails() {
    stubConsumableBinding();
    when(memberRepository.findByIdAndTenantIdAndActiveTrue(MEMBER_ID, TENANT))
        .thenReturn(Optional.of(new Member(TENANT, "user_1", "a@acme.test", "A", "admin")));

    assertCallbackFails("code", "s1", "s1", CallbackFailure.CALLBACK_FAILED);
    verify(bankApiClient, never()).exchangeCode(anyString());
  }

  @Test
  void failedCodeExchangeStoresNothing() {
    stubConsumableBinding();
    stubOwner();
    when(bankApiClient.exchangeCode("code"))
        .thenThrow(new BankApiException("Bank API error (400)", 400, null));

    assertCallbackFails("code", "s1", "s1", CallbackFailure.CALLBACK_FAILED);
    verify(connectionRepository, never()).save(any());
  }

  @Test
  void grantWithoutRefreshTokenIsRejected() {
    stubConsumableBinding();
    stubOwner();
    when(bankApiClient.exchangeCode("code"))
        .thenReturn(new TokenGrant("access", null, "Bearer", Duration.ofMinutes(40)));

    assertCallbackFails("code", "s1", "s1", CallbackFailure.CALLBACK_FAILED);
  }

  @Test
  void successfulCallbackStoresEncryptedTokensAndAudits() {
    stubConsumableBinding();
    stubOwner();
    when(bankApiClient.exchangeCode("code"))
        .thenReturn(new TokenGrant("access", "refresh", "Bearer", Duration.ofMinutes(40)));
    when(tokenVault.encrypt(anyString())).thenAnswer(inv -> "enc:" + inv.getArgument(0));
    when(connectionRepository.findByTenantIdForUpdate(TENANT)).thenReturn(Optional.empty());
    when(connectionRepository.save(any())).thenAnswer(inv -> inv.getArgument(0));

    service().completeAuthorization(new CallbackRequest("code", "s1", null, null, "s1"));

    var connectionCaptor = ArgumentCaptor.forClass(BankConnection.class);
    verify(connectionRepository).save(connectionCaptor.capture());
    var stored = connectionCaptor.getValue();
    assertThat(stored.getTenantId()).isEqualTo(TENANT);
    assertThat(stored.isActive()).isTrue();
    assertThat(stored.getAccessTokenEncrypted()).isEqualTo("enc:access");
    assertThat(stored.getRefreshTokenEncrypted()).isEqualTo("enc:refresh");
    assertThat(stored.getRefreshTokenExpiresAt()).isAfter(Instant.now().plus(Duration.ofDays(89)));

    var auditCaptor = ArgumentCaptor.forClass(AuditEventRecord.class);
    verify(auditService).log(auditCaptor.capture());
    assertThat(auditCaptor.getValue().eventType()).isEqualTo("bank_connection.connected");
    assertThat(auditCaptor.getValue().actorId()).isEqualTo(MEMBER_ID);
    assertThat(auditCaptor.getValue().tenantId()).isEqualTo(TENANT);
  }

  // --- tokens ---

  @Test
  void freshAccessTokenIsDecryptedWithoutRefresh() {
    when(connectionRepository.findByTenantIdForUpdate(TENANT))
        .thenReturn(Optional.of(activeConnection(Instant.now().plusSeconds(3600))));
    when(tokenVault.decrypt("enc:access")).thenReturn("access");

    assertThat(service().getValidToken(TENANT)).isEqualTo("access");
    verify(bankApiClient, never()).refresh(anyString());
  }

  @Test
  void tokenInsideSkewWindowIsRefreshedAndKeepsRefreshToken() {
    var connection = activeConnection(Instant.now().plusSeconds(60));
    when(connectionRepository.findByTenantIdForUpdate(TENANT)).thenReturn(Optional.of(connection));
    when(tokenVault.decrypt("enc:refresh")).thenReturn("refresh");
    when(bankApiClient.refresh("refresh"))
        .thenReturn(new TokenGrant("access-2", null, "Bearer", Duration.ofMinutes(40)));
    when(tokenVault.encrypt("access-2")).thenReturn("enc:access-2");

    assertThat(service().getValidToken(TENANT)).isEqualTo("access-2");
    assertThat(connection.getAccessTokenEncrypted()).isEqualTo("enc:access-2");
    assertThat(connection.getRefreshTokenEncrypted()).isEqualTo("enc:refresh");
    assertThat(connection.getAccessTokenExpiresAt()).isAfter(Instant.now().plusSeconds(2000));
    verify(connectionRepository).save(connection);
  }

  @Test
  void expiredRefreshTokenMarksConnectionExpiredWithoutCallingBank() {
    var connection = new BankConnection(TENANT);
    connection.activate(
        "enc:access", "enc:refresh", "Bearer", Instant.now().minusSeconds(10), Instant.now());
    when(connectionRepository.findByTenantIdForUpdate(TENANT)).thenReturn(Optional.of(connection));

    assertThatThrownBy(() -> service().getValidToken(TENANT))
        .isInstanceOf(TokenRefreshFailedException.class);
    assertThat(connection.getStatus()).isEqualTo(BankConnectionStatus.EXPIRED);
    verify(bankApiClient, never()).refresh(anyString());
    verify(auditService).log(any());
  }

  @Test
  void rejectedRefreshMarksConnectionExpired() {
    var connection = activeConnection(Instant.now().minusSeconds(10));
    when(connectionRepository.findByTenantIdForUpdate(TENANT)).thenReturn(Optional.of(connection));
    when(tokenVault.decrypt("enc:refresh")).thenReturn("refresh");
    when(bankApiClient.refresh("refresh"))
        .thenThrow(new BankApiException("Bank API error (401)", 401, null));

    assertThatThrownBy(() -> service().getValidToken(TENANT))
        .isInstanceOf(TokenRefreshFailedException.class)
        .hasCauseInstanceOf(BankApiException.class);
    assertThat(connection.getStatus()).isEqualTo(BankConnectionStatus.EXPIRED);
  }

  @Test
  void tokenForTenantWithoutConnectionIsNoConnection() {
    when(connectionRepository.findByTenantIdForUpdate(TENANT)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service().getValidToken(TENANT))
        .isInstanceOf(NoConnectionException.class);
  }

  // --- disconnect ---

  @Test
  void defaultDisconnectRevokesAndKeepsData() {
    RequestScopes.bind(TENANT, MEMBER_ID, "owner");
    var connection = activeConnection(Instant.now().plusSeconds(3600));
    when(connectionRepository.findByTenantId(TENANT)).thenReturn(Optional.of(connection));
    when(connectionRepository.findByTenantIdForUpdate(TENANT)).thenReturn(Optional.of(connection));

    var result = service().disconnect(false);

    assertThat(result).isEqualTo(new DisconnectResult(true, false));
    assertThat(connection.getStatus()).isEqualTo(BankConnectionStatus.REVOKED);
    assertThat(connection.getAccessTokenEncrypted()).isEmpty();
    assertThat(connection.getRefreshTokenEncrypted()).isEmpty();
    verify(dataPurger, never()).purge(any());
  }

  @Test
  void purgeDisconnectDeletesData() {
    RequestScopes.bind(TENANT, MEMBER_ID, "owner");
    var connection = activeConnection(Instant.now().plusSeconds(3600));
    when(connectionRepository.findByTenantId(TENANT)).thenReturn(Optional.of(connection));

    var result = service().disconnect(true);

    assertThat(result).isEqualTo(new DisconnectResult(true, true));
    verify(dataPurger).purge(connection);
  }

  @Test
  void disconnectWithoutConnectionIsNoConnection() {
    RequestScopes.bind(TENANT, MEMBER_ID, "owner");
    when(connectionRepository.findByTenantId(TENANT)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service().disconnect(false))
        .isInstanceOf(NoConnectionException.class);
  }

  // --- helpers ---

  private BankConnectionService service() {
    return service(TestBankingProperties.defaults());
  }

  private BankConnectionService service(BankingProperties properties) {
    return new BankConnectionService(
        properties,
        bankApiClient,
        tokenVault,
        connectionRepository,
        stateBindingRepository,
        memberRepository,
        dataPurger,
        auditService,
        txManager);
  }

  private void assertCallbackFails(
      String code, String state, String browserState, CallbackFailure expected) {
    var request = new CallbackRequest(code, state, null, null, browserState);
    assertThatThrownBy(() -> service().completeAuthorization(request))
        .isInstanceOf(OAuthCallbackException.class)
        .extracting(e -> ((OAuthCallbackException) e).getFailure())
        .isEqualTo(expected);
  }

  private void stubConsumableBinding() {
    when(stateBindingRepository.findById("s1")).thenReturn(Optional.of(validBinding()));
    when(stateBindingRepository.deleteByState("s1")).thenReturn(1);
  }

  private void stubOwner() {
    when(memberRepository.findByIdAndTenantIdAndActiveTrue(MEMBER_ID, TENANT))
        .thenReturn(Optional.of(new Member(TENANT, "user_1", "o@acme.test", "Owner", "owner")));
  }

  private static OAuthStateBinding validBinding() {
    return new OAuthStateBinding("s1", TENANT, MEMBER_ID, Instant.now().plusSeconds(600));
  }

  private static BankConnection activeConnection(Instant accessTokenExpiresAt) {
    var connection = new BankConnection(TENANT);
    connection.activate(
        "enc:access",
        "enc:refresh",
        "Bearer",
        accessTokenExpiresAt,
        Instant.now().plus(Duration.ofDays(90)));
    return connection;
  }
}
