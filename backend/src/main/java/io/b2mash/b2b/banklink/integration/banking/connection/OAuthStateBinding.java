package io.b2mash.b2b.banklink.integration.banking.connection;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * Server-side half of an in-flight authorization: the opaque state handed to the bank, bound to
 * the tenant and the member who started the flow. Single use; deleted when the callback arrives.
 */
@Entity
@Table(name = "oauth_state_bindings")
public class OAuthStateBinding {

  @Id
  @Column(name = "state", nullable = false, length = 128)
  private String state;

  @Column(name = "tenant_id", nullable = false, length = 100)
  private String tenantId;

  @Column(name = "member_id", nullable = false)
  private UUID memberId;

  @Column(name = "expires_at", nullable = false)
  private Instant expiresAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected OAuthStateBinding() {}

  public OAuthStateBinding(String state, String tenantId, UUID memberId, Instant expiresAt) {
    this.state = state;
    this.tenantId = tenantId;
    this.memberId = memberId;
    this.expiresAt = expiresAt;
    this.createdAt = Instant.now();
  }

  public boolean isExpired(Instant now) {
    return !expiresAt.isAfter(now);
  }

  public String getState() {
    return state;
  }

  public String getTenantId() {
    return tenantId;
  }

  public UUID getMemberId() {
    return memberId;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
