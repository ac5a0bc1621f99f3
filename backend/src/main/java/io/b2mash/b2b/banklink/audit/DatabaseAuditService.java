package io.b2mash.b2b.banklink.audit;

import io.b2mash.b2b.banklink.member.MemberRepository;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Database-backed implementation of {@link AuditService}.
 *
 * <p>Transaction semantics: {@code log()} participates in the caller's transaction (no
 * REQUIRES_NEW). If the domain operation rolls back, the audit event rolls back too.
 */
@Service
public class DatabaseAuditService implements AuditService {

  private static final Logger log = LoggerFactory.getLogger(DatabaseAuditService.class);

  private final AuditEventRepository auditEventRepository;
  private final MemberRepository memberRepository;

  public DatabaseAuditService(
      AuditEventRepository auditEventRepository, MemberRepository memberRepository) {
    this.auditEventRepository = auditEventRepository;
    this.memberRepository = memberRepository;
  }

  @Override
  @Transactional
  public void log(AuditEventRecord record) {
    var event = new AuditEvent(enrichActorName(record));
    auditEventRepository.save(event);
    log.debug(
        "Recorded audit event: type={}, entity={}/{}, actor={}",
        record.eventType(),
        record.entityType(),
        record.entityId(),
        record.actorId());
  }

  @Override
  @Transactional(readOnly = true)
  public List<AuditEvent> findForEntity(String tenantId, String entityType, UUID entityId) {
    return auditEventRepository.findByTenantIdAndEntityTypeAndEntityIdOrderByOccurredAtDesc(
        tenantId, entityType, entityId);
  }

  /**
   * Ensures the {@code actor_name} key is present in the details map: the member's display name
   * for USER actors, "System" otherwise. A caller-supplied value is preserved.
   */
  private AuditEventRecord enrichActorName(AuditEventRecord record) {
    var details =
        new HashMap<String, Object>(record.details() != null ? record.details() : Map.of());
    if (!details.containsKey("actor_name")) {
      if (record.actorId() != null && "USER".equals(record.actorType())) {
        memberRepository
            .findById(record.actorId())
            .ifPresent(member -> details.put("actor_name", member.getName()));
      }
      if (!details.containsKey("actor_name")) {
        details.put("actor_name", "System");
      }
    }
    return new AuditEventRecord(
        record.tenantId(),
        record.eventType(),
        record.entityType(),
        record.entityId(),
        record.actorId(),
        record.actorType(),
        record.source(),
        record.ipAddress(),
        record.userAgent(),
        details);
  }
}
