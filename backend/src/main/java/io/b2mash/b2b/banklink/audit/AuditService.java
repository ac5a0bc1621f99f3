package io.b2mash.b2b.banklink.audit;

import java.util.List;
import java.util.UUID;

/** Append-only audit log. Events are never updated or deleted through this interface. */
public interface AuditService {

  /**
   * Records a single audit event within the current transaction. If the enclosing transaction rolls
   * back, the audit event is also rolled back (no REQUIRES_NEW).
   *
   * @param record the audit event data to persist
   */
  void log(AuditEventRecord record);

  /** Returns the events recorded for one entity, newest first. */
  List<AuditEvent> findForEntity(String tenantId, String entityType, UUID entityId);
}
