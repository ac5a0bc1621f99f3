package io.b2mash.b2b.banklink.audit;

import io.b2mash.b2b.banklink.multitenancy.RequestScopes;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import java.util.UUID;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Builder that constructs an {@link AuditEventRecord}. Auto-populates tenant, actor, source, IP
 * address, and user agent from the current request context when available.
 *
 * <p>Required fields: {@code eventType}, {@code entityType}, {@code entityId}, and a tenant (either
 * explicit or bound in {@link RequestScopes}).
 *
 * <pre>{@code
 * AuditEventRecord record = AuditEventBuilder.builder()
 *     .eventType("payment.completed")
 *     .entityType("bank_payment")
 *     .entityId(payment.getId())
 *     .tenantId(payment.getTenantId())
 *     .details(Map.of("external_payment_id", payment.getExternalPaymentId()))
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  private static final int MAX_USER_AGENT_LENGTH = 500;

  private String tenantId;
  private String eventType;
  private String entityType;
  private UUID entityId;
  private UUID actorId;
  private String actorType;
  private String source;
  private Map<String, Object> details;

  private boolean actorIdExplicitlySet;
  private boolean actorTypeExplicitlySet;
  private boolean sourceExplicitlySet;

  private AuditEventBuilder() {}

  /** Creates a new builder instance. */
  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder tenantId(String tenantId) {
    this.tenantId = tenantId;
    return this;
  }

  public AuditEventBuilder eventType(String eventType) {
    this.eventType = eventType;
    return this;
  }

  public AuditEventBuilder entityType(String entityType) {
    this.entityType = entityType;
    return this;
  }

  public AuditEventBuilder entityId(UUID entityId) {
    this.entityId = entityId;
    return this;
  }

  public AuditEventBuilder actorId(UUID actorId) {
    this.actorId = actorId;
    this.actorIdExplicitlySet = true;
    return this;
  }

  public AuditEventBuilder actorType(String actorType) {
    this.actorType = actorType;
    this.actorTypeExplicitlySet = true;
    return this;
  }

  public AuditEventBuilder source(String source) {
    this.source = source;
    this.sourceExplicitlySet = true;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  /**
   * Builds the {@link AuditEventRecord}, auto-populating fields from the current request context
   * where not explicitly set:
   *
   * <ul>
   *   <li>{@code tenantId} from {@link RequestScopes} if bound
   *   <li>{@code actorId} from the bound member id
   *   <li>{@code actorType} = "USER" if a member is bound, "SYSTEM" otherwise
   *   <li>{@code source} = "API" if in HTTP request context, "INTERNAL" otherwise
   *   <li>{@code ipAddress} and {@code userAgent} from the servlet request
   * </ul>
   */
  public AuditEventRecord build() {
    String resolvedTenantId = tenantId != null ? tenantId : RequestScopes.getTenantIdOrNull();
    if (resolvedTenantId == null) {
      throw new IllegalStateException("Audit event " + eventType + " has no tenant");
    }

    UUID boundMember = RequestScopes.getMemberIdOrNull();
    UUID resolvedActorId = actorIdExplicitlySet ? actorId : boundMember;

    String resolvedActorType = actorType;
    if (!actorTypeExplicitlySet) {
      resolvedActorType = resolvedActorId != null ? "USER" : "SYSTEM";
    }

    HttpServletRequest request = resolveHttpRequest();

    String resolvedSource = source;
    if (!sourceExplicitlySet) {
      resolvedSource = request != null ? "API" : "INTERNAL";
    }

    String resolvedIpAddress = null;
    String resolvedUserAgent = null;
    if (request != null) {
      resolvedIpAddress = request.getRemoteAddr();
      String ua = request.getHeader("User-Agent");
      if (ua != null && ua.length() > MAX_USER_AGENT_LENGTH) {
        ua = ua.substring(0, MAX_USER_AGENT_LENGTH);
      }
      resolvedUserAgent = ua;
    }

    return new AuditEventRecord(
        resolvedTenantId,
        eventType,
        entityType,
        entityId,
        resolvedActorId,
        resolvedActorType,
        resolvedSource,
        resolvedIpAddress,
        resolvedUserAgent,
        details);
  }

  private static HttpServletRequest resolveHttpRequest() {
    var attrs = RequestContextHolder.getRequestAttributes();
    if (attrs instanceof ServletRequestAttributes servletAttrs) {
      return servletAttrs.getRequest();
    }
    return null;
  }
}
