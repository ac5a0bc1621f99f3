package io.b2mash.b2b.banklink.integration.banking;

import io.b2mash.b2b.banklink.exception.ForbiddenException;
import io.b2mash.b2b.banklink.multitenancy.RequestScopes;
import io.b2mash.b2b.banklink.security.Roles;

/**
 * Role checks for the bank integration. Called by services before any state mutation so the rule
 * holds regardless of which endpoint reaches them.
 */
public final class BankingAccessPolicy {

  private BankingAccessPolicy() {}

  /** Connection changes, syncs and payments require the tenant's owner. */
  public static void requireOwner(String action) {
    RequestScopes.requireTenantId();
    if (!Roles.ORG_OWNER.equals(RequestScopes.getOrgRole())) {
      throw new ForbiddenException(
          "Insufficient role", "Only the organization owner can " + action);
    }
  }

  /** Banking reads require admin or owner. */
  public static void requireAdminOrOwner() {
    RequestScopes.requireTenantId();
    String role = RequestScopes.getOrgRole();
    if (!Roles.ORG_OWNER.equals(role) && !Roles.ORG_ADMIN.equals(role)) {
      throw new ForbiddenException(
          "Insufficient role", "Only admins and owners can view banking data");
    }
  }
}
