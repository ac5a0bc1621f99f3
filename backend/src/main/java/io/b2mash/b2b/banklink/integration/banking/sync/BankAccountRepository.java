package io.b2mash.b2b.banklink.integration.banking.sync;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface BankAccountRepository extends JpaRepository<BankAccount, UUID> {

  Optional<BankAccount> findByTenantIdAndExternalAccountId(
      String tenantId, String externalAccountId);

  Optional<BankAccount> findByIdAndTenantId(UUID id, String tenantId);

  List<BankAccount> findByTenantIdOrderByNameAsc(String tenantId);

  long countByTenantId(String tenantId);

  @Modifying
  @Query("DELETE FROM BankAccount a WHERE a.tenantId = :tenantId")
  int deleteByTenantId(@Param("tenantId") String tenantId);
}
