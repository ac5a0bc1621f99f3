package io.b2mash.b2b.banklink.member;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * A user's membership in one tenant. The identity provider's subject maps to exactly one active
 * membership; its {@code orgRole} gates the banking integration.
 */
@Entity
@Table(name = "members")
public class Member {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tenant_id", nullable = false, length = 100)
  private String tenantId;

  @Column(name = "external_user_id", nullable = false, length = 255)
  private String externalUserId;

  @Column(name = "email", nullable = false, length = 255)
  private String email;

  @Column(name = "name", length = 255)
  private String name;

  @Column(name = "org_role", nullable = false, length = 50)
  private String orgRole;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Member() {}

  public Member(String tenantId, String externalUserId, String email, String name, String orgRole) {
    this.tenantId = tenantId;
    this.externalUserId = externalUserId;
    this.email = email;
    this.name = name;
    this.orgRole = orgRole;
    this.active = true;
  }

  @PrePersist
  void onPrePersist() {
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  @PreUpdate
  void onPreUpdate() {
    this.updatedAt = Instant.now();
  }

  public void changeRole(String orgRole) {
    this.orgRole = orgRole;
  }

  public void deactivate() {
    this.active = false;
  }

  public UUID getId() {
    return id;
  }

  public String getTenantId() {
    return tenantId;
  }

  public String getExternalUserId() {
    return externalUserId;
  }

  public String getEmail() {
    return email;
  }

  public String getName() {
    return name;
  }

  public String getOrgRole() {
    return orgRole;
  }

  public boolean isActive() {
    return active;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
