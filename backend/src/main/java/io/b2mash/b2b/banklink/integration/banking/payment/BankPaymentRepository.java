package io.b2mash.b2b.banklink.integration.banking.payment;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface BankPaymentRepository extends JpaRepository<BankPayment, UUID> {

  Optional<BankPayment> findByExternalPaymentId(String externalPaymentId);

  Optional<BankPayment> findByRequestId(String requestId);

  Page<BankPayment> findByTenantIdOrderByCreatedAtDesc(String tenantId, Pageable pageable);

  Page<BankPayment> findByTenantIdAndStatusOrderByCreatedAtDesc(
      String tenantId, BankPaymentStatus status, Pageable pageable);

  @Modifying
  @Query("DELETE FROM BankPayment p WHERE p.tenantId = :tenantId")
  int deleteByTenantId(@Param("tenantId") String tenantId);
}
