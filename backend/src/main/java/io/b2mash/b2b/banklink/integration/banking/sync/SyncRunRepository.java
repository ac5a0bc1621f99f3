package io.b2mash.b2b.banklink.integration.banking.sync;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SyncRunRepository extends JpaRepository<SyncRun, UUID> {

  List<SyncRun> findByTenantIdOrderByStartedAtDesc(String tenantId, Pageable pageable);

  boolean existsByConnectionIdAndStatusAndStartedAtAfter(
      UUID connectionId, SyncRunStatus status, Instant startedAfter);

  @Modifying
  @Query("DELETE FROM SyncRun r WHERE r.tenantId = :tenantId")
  int deleteByTenantId(@Param("tenantId") String tenantId);
}
