package io.b2mash.b2b.banklink.integration.banking.sync;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface BankTransactionRepository extends JpaRepository<BankTransaction, UUID> {

  Optional<BankTransaction> findByTenantIdAndExternalTransactionId(
      String tenantId, String externalTransactionId);

  Optional<BankTransaction> findByIdAndTenantId(UUID id, String tenantId);

  /** Webhook lookup: events carry no tenant, provider transaction ids are globally unique. */
  List<BankTransaction> findByExternalTransactionId(String externalTransactionId);

  long countByTenantId(String tenantId);

  @Query(
      """
      SELECT t FROM BankTransaction t
      WHERE t.tenantId = :tenantId
        AND (:accountId IS NULL OR t.accountId = :accountId)
        AND (:state IS NULL OR t.state = :state)
        AND (:reconciled IS NULL OR t.reconciled = :reconciled)
      ORDER BY t.transactionDate DESC, t.createdAtProvider DESC
      """)
  Page<BankTransaction> search(
      @Param("tenantId") String tenantId,
      @Param("accountId") UUID accountId,
      @Param("state") String state,
      @Param("reconciled") Boolean reconciled,
      Pageable pageable);

  @Modifying
  @Query("DELETE FROM BankTransaction t WHERE t.tenantId = :tenantId")
  int deleteByTenantId(@Param("tenantId") String tenantId);
}
