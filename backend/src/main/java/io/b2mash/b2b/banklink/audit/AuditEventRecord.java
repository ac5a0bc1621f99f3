package io.b2mash.b2b.banklink.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA DTO passed to {@link AuditService#log(AuditEventRecord)}. Constructed by {@link
 * AuditEventBuilder} which auto-populates tenant, actor, source and request metadata.
 *
 * @param tenantId tenant the event belongs to; webhook-driven events take it from the matched row
 * @param eventType free-form event type following {@code {entity}.{action}} convention
 * @param entityType the kind of entity being audited (e.g., "bank_payment", "bank_connection")
 * @param entityId ID of the affected entity (not a FK -- entity may be purged later)
 * @param actorId member ID of the acting user; null for system-initiated events
 * @param actorType USER or SYSTEM
 * @param source origin of the action: API, INTERNAL, WEBHOOK, SCHEDULED
 * @param ipAddress client IP; null for non-HTTP sources
 * @param userAgent truncated User-Agent header; null for non-HTTP sources
 * @param details structured payload stored as JSONB; nullable
 */
public record AuditEventRecord(
    String tenantId,
    String eventType,
    String entityType,
    UUID entityId,
    UUID actorId,
    String actorType,
    String source,
    String ipAddress,
    String userAgent,
    Map<String, Object> details) {}
