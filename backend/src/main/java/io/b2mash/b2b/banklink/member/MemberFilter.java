package io.b2mash.b2b.banklink.member;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.b2b.banklink.multitenancy.RequestScopes;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Resolves the authenticated JWT subject to its active {@link Member} and binds tenant, member and
 * org role into {@link RequestScopes} for the rest of the request. Requests without a membership
 * continue unbound; services reject them where a tenant is required.
 */
@Component
public class MemberFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(MemberFilter.class);

  private final MemberRepository memberRepository;
  private final Cache<String, MemberInfo> memberCache =
      Caffeine.newBuilder().maximumSize(50_000).expireAfterWrite(Duration.ofMinutes(1)).build();

  public MemberFilter(MemberRepository memberRepository) {
    this.memberRepository = memberRepository;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {

    MemberInfo info = resolveMember();
    if (info == null) {
      filterChain.doFilter(request, response);
      return;
    }

    RequestScopes.bind(info.tenantId(), info.memberId(), info.orgRole());
    try {
      filterChain.doFilter(request, response);
    } finally {
      RequestScopes.clear();
    }
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String path = request.getRequestURI();
    return path.startsWith("/actuator/") || path.startsWith("/api/webhooks/");
  }

  public void evictFromCache(String externalUserId) {
    memberCache.invalidate(externalUserId);
  }

  record MemberInfo(String tenantId, UUID memberId, String orgRole) {}

  private MemberInfo resolveMember() {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (!(authentication instanceof JwtAuthenticationToken jwtAuth)) {
      return null;
    }

    String subject = jwtAuth.getToken().getSubject();
    if (subject == null) {
      return null;
    }

    try {
      return memberCache.get(subject, this::loadMember);
    } catch (RuntimeException e) {
      log.warn("Failed to resolve membership for user {}: {}", subject, e.getMessage());
      return null;
    }
  }

  private MemberInfo loadMember(String subject) {
    Optional<Member> member = memberRepository.findByExternalUserIdAndActiveTrue(subject);
    return member
        .map(m -> new MemberInfo(m.getTenantId(), m.getId(), m.getOrgRole()))
        .orElse(null);
  }
}
