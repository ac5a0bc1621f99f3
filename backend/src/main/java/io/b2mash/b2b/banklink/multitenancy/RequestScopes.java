package io.b2mash.b2b.banklink.multitenancy;

import io.b2mash.b2b.banklink.exception.ForbiddenException;
import java.util.UUID;

/**
 * Request-bound values for tenant and member identity. Bound by {@code MemberFilter} for the
 * duration of a request and always cleared in a {@code finally} block, read by controllers and
 * services.
 */
public final class RequestScopes {

  private static final ThreadLocal<String> TENANT_ID = new ThreadLocal<>();
  private static final ThreadLocal<UUID> MEMBER_ID = new ThreadLocal<>();
  private static final ThreadLocal<String> ORG_ROLE = new ThreadLocal<>();

  private RequestScopes() {}

  public static void bind(String tenantId, UUID memberId, String orgRole) {
    TENANT_ID.set(tenantId);
    MEMBER_ID.set(memberId);
    ORG_ROLE.set(orgRole);
  }

  public static void clear() {
    TENANT_ID.remove();
    MEMBER_ID.remove();
    ORG_ROLE.remove();
  }

  /** Returns the tenant id. Throws 403 if no membership was resolved for the caller. */
  public static String requireTenantId() {
    String tenantId = TENANT_ID.get();
    if (tenantId == null) {
      throw new ForbiddenException("No active membership", "Caller has no active membership");
    }
    return tenantId;
  }

  /** Returns the current member's UUID. Throws 403 if not bound. */
  public static UUID requireMemberId() {
    UUID memberId = MEMBER_ID.get();
    if (memberId == null) {
      throw new ForbiddenException("No active membership", "Caller has no active membership");
    }
    return memberId;
  }

  public static String getTenantIdOrNull() {
    return TENANT_ID.get();
  }

  public static UUID getMemberIdOrNull() {
    return MEMBER_ID.get();
  }

  /** Returns the current member's org role ("owner", "admin", "member"), or null if not bound. */
  public static String getOrgRole() {
    return ORG_ROLE.get();
  }
}
