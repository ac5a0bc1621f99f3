package io.b2mash.b2b.banklink.integration.banking.sync;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import io.b2mash.b2b.banklink.TestcontainersConfiguration;
import io.b2mash.b2b.banklink.integration.banking.client.AccountSnapshot;
import io.b2mash.b2b.banklink.integration.banking.client.BankApiClient;
import io.b2mash.b2b.banklink.integration.banking.client.TransactionSnapshot;
import io.b2mash.b2b.banklink.integration.banking.connection.BankConnection;
import io.b2mash.b2b.banklink.integration.banking.connection.BankConnectionRepository;
import io.b2mash.b2b.banklink.integration.secret.TokenVault;
import io.b2mash.b2b.banklink.member.Member;
import io.b2mash.b2b.banklink.member.MemberRepository;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Order;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.api.TestMethodOrder;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@Testcontainers(disabledWithoutDocker = true)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class BankSyncControllerIntegrationTest {

  private static final String TENANT = "tenant_sync_it";
  private static final String BASE = "/api/integrations/banking";

  @Autowired private MockMvc mockMvc;
  @Autowired private MemberRepository memberRepository;
  @Autowired private BankConnectionRepository connectionRepository;
  @Autowired private TokenVault tokenVault;
  @Autowired private BankAccountRepository accountRepository;
  @Autowired private BankTransactionRepository transactionRepository;

  @MockitoBean private BankApiClient bankApiClient;

  @BeforeAll
  void seedTenant() {
    memberRepository.save(new Member(TENANT, "user_sync_owner", "o@acme.test", "Owner", "owner"));
    memberRepository.save(new Member(TENANT, "user_sync_admin", "a@acme.test", "Admin", "admin"));
    memberRepository.save(
        new Member(TENANT, "user_sync_member", "m@acme.test", "Member", "member"));

    var connection = new BankConnection(TENANT);
    connection.activate(
        tokenVault.encrypt("sync-access"),
        tokenVault.encrypt("sync-refresh"),
        "Bearer",
        Instant.now().plusSeconds(3600),
        Instant.now().plusSeconds(90 * 24 * 3600));
    connectionRepository.save(connection);
  }

  @Test
  @Order(1)
  void ownerSyncMirrorsAccountsAndTransactions() throws Exception {
    stubProviderData();

    mockMvc
        .perform(post(BASE + "/sync").with(userJwt("user_sync_owner")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.accounts_synced").value(2))
        .andExpect(jsonPath("$.transactions_synced").value(3))
        .andExpect(jsonPath("$.skipped").value(false));
  }

  @Test
  @Order(2)
  void resyncOfUnchangedDataCreatesNoDuplicates() throws Exception {
    long accountsBefore = accountRepository.countByTenantId(TENANT);
    long transactionsBefore = transactionRepository.countByTenantId(TENANT);
    stubProviderData();

    mockMvc
        .perform(post(BASE + "/sync").with(userJwt("user_sync_owner")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.skipped").value(false));

    assertThat(accountsBefore).isEqualTo(2);
    assertThat(transactionsBefore).isEqualTo(3);
    assertThat(accountRepository.countByTenantId(TENANT)).isEqualTo(accountsBefore);
    assertThat(transactionRepository.countByTenantId(TENANT)).isEqualTo(transactionsBefore);
  }

  @Test
  @Order(3)
  void adminReadsAccountsWithCurrencyTotals() throws Exception {
    mockMvc
        .perform(get(BASE + "/accounts").with(userJwt("user_sync_admin")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.accounts.length()").value(2))
        .andExpect(jsonPath("$.totals.EUR").value(1200.00))
        .andExpect(jsonPath("$.totals.GBP").value(300.00));
  }

  @Test
  @Order(4)
  void transactionsAreFilterableByState() throws Exception {
    mockMvc
        .perform(get(BASE + "/transactions").with(userJwt("user_sync_admin")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.content.length()").value(3));

    mockMvc
        .perform(
            get(BASE + "/transactions")
                .param("state", "pending")
                .with(userJwt("user_sync_admin")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.content.length()").value(1))
        .andExpect(jsonPath("$.content[0].externalTransactionId").value("tx-sync-2"));
  }

  @Test
  @Order(5)
  void reconcileAndUnreconcileTransaction() throws Exception {
    var page =
        mockMvc
            .perform(
                get(BASE + "/transactions")
                    .param("reconciled", "false")
                    .with(userJwt("user_sync_admin")))
            .andExpect(status().isOk())
            .andReturn();
    String id = JsonPath.read(page.getResponse().getContentAsString(), "$.content[0].id");

    mockMvc
        .perform(
            post(BASE + "/transactions/" + id + "/reconcile")
                .with(userJwt("user_sync_admin"))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"notes\": \"matched manually\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.reconciled").value(true))
        .andExpect(jsonPath("$.notes").value("matched manually"));

    mockMvc
        .perform(
            post(BASE + "/transactions/" + id + "/reconcile")
                .with(userJwt("user_sync_admin"))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
        .andExpect(status().isBadRequest());

    mockMvc
        .perform(
            delete(BASE + "/transactions/" + id + "/reconcile").with(userJwt("user_sync_admin")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.reconciled").value(false));
  }

  @Test
  @Order(6)
  void syncRunsAreListedNewestFirst() throws Exception {
    mockMvc
        .perform(get(BASE + "/sync-runs").param("limit", "5").with(userJwt("user_sync_admin")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].status").value("COMPLETED"))
        .andExpect(jsonPath("$[0].syncType").value("MANUAL"));
  }

  @Test
  void adminCannotTriggerSync() throws Exception {
    mockMvc
        .perform(post(BASE + "/sync").with(userJwt("user_sync_admin")))
        .andExpect(status().isForbidden());
  }

  @Test
  void memberCannotReadBankingData() throws Exception {
    mockMvc
        .perform(get(BASE + "/accounts").with(userJwt("user_sync_member")))
        .andExpect(status().isForbidden());
  }

  @Test
  void unauthenticatedRequestIsRejected() throws Exception {
    mockMvc.perform(get(BASE + "/accounts")).andExpect(status().isUnauthorized());
  }

  private void stubProviderData() {
    when(bankApiClient.listAccounts("sync-access"))
        .thenReturn(
            List.of(
                new AccountSnapshot(
                    "acc-sync-eur", "Main EUR", new BigDecimal("1200.00"), "EUR", "active"),
                new AccountSnapshot(
                    "acc-sync-gbp", "Main GBP", new BigDecimal("300.00"), "GBP", "active")));
    when(bankApiClient.listTransactions(eq("sync-access"), any(), anyInt()))
        .thenReturn(
            List.of(
                transaction("tx-sync-1", "acc-sync-eur", "completed"),
                transaction("tx-sync-2", "acc-sync-eur", "pending"),
                transaction("tx-sync-3", "acc-sync-gbp", "completed"),
                transaction("tx-sync-orphan", "acc-unknown", "completed")));
  }

  private static TransactionSnapshot transaction(String id, String accountId, String state) {
    return new TransactionSnapshot(
        id,
        accountId,
        id + "-leg",
        "transfer",
        state,
        new BigDecimal("-25.00"),
        "EUR",
        null,
        "Supplier Ltd",
        null,
        null,
        "Ref " + id,
        null,
        null,
        null,
        null,
        null,
        null,
        null,
        LocalDate.now().minusDays(1),
        Instant.now().minusSeconds(86_400),
        "completed".equals(state) ? Instant.now().minusSeconds(86_000) : null);
  }

  private JwtRequestPostProcessor userJwt(String subject) {
    return jwt().jwt(j -> j.subject(subject));
  }
}
