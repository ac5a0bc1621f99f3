package io.b2mash.b2b.banklink.integration.banking.connection;

import java.time.Instant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface OAuthStateBindingRepository extends JpaRepository<OAuthStateBinding, String> {

  /** Returns 1 for the caller that consumed the binding, 0 for everyone else. */
  @Modifying
  @Query("DELETE FROM OAuthStateBinding b WHERE b.state = :state")
  int deleteByState(@Param("state") String state);

  @Modifying
  @Query("DELETE FROM OAuthStateBinding b WHERE b.expiresAt < :before")
  int deleteExpired(@Param("before") Instant before);
}
