package io.b2mash.b2b.banklink.security;

/**
 * Centralized org role constants. Values are stored in {@code members.org_role}; {@code owner} is
 * the tenant's highest administrative role.
 */
public final class Roles {

  public static final String ORG_OWNER = "owner";
  public static final String ORG_ADMIN = "admin";
  public static final String ORG_MEMBER = "member";

  private Roles() {}
}
