package io.b2mash.b2b.banklink.member;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface MemberRepository extends JpaRepository<Member, UUID> {

  Optional<Member> findByExternalUserIdAndActiveTrue(String externalUserId);

  Optional<Member> findByIdAndTenantIdAndActiveTrue(UUID id, String tenantId);
}
