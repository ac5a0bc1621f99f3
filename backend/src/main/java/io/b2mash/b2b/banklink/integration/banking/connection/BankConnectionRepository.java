package io.b2mash.b2b.banklink.integration.banking.connection;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface BankConnectionRepository extends JpaRepository<BankConnection, UUID> {

  Optional<BankConnection> findByTenantId(String tenantId);

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT c FROM BankConnection c WHERE c.tenantId = :tenantId")
  Optional<BankConnection> findByTenantIdForUpdate(@Param("tenantId") String tenantId);

  List<BankConnection> findByStatus(BankConnectionStatus status);
}
