package io.b2mash.b2b.banklink.security;

import io.b2mash.b2b.banklink.member.MemberFilter;
import io.b2mash.b2b.banklink.multitenancy.TenantLoggingFilter;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.oauth2.server.resource.web.authentication.BearerTokenAuthenticationFilter;
import org.springframework.security.web.SecurityFilterChain;

@Configuration
@EnableWebSecurity
public class SecurityConfig {

  private final MemberFilter memberFilter;
  private final TenantLoggingFilter tenantLoggingFilter;

  public SecurityConfig(MemberFilter memberFilter, TenantLoggingFilter tenantLoggingFilter) {
    this.memberFilter = memberFilter;
    this.tenantLoggingFilter = tenantLoggingFilter;
  }

  /**
   * Staff API ({@code /api/**}) uses JWT bearer authentication plus member resolution. The bank
   * webhook authenticates by HMAC signature and the OAuth callback by its one-time state binding,
   * so both are reachable without a bearer token.
   */
  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    http.csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers("/actuator/health/**", "/actuator/info")
                    .permitAll()
                    .requestMatchers("/api/webhooks/banking")
                    .permitAll()
                    .requestMatchers(HttpMethod.GET, "/api/integrations/banking/callback")
                    .permitAll()
                    .requestMatchers("/api/**")
                    .authenticated()
                    .anyRequest()
                    .denyAll())
        .oauth2ResourceServer(oauth2 -> oauth2.jwt(jwt -> {}))
        .addFilterAfter(memberFilter, BearerTokenAuthenticationFilter.class)
        .addFilterAfter(tenantLoggingFilter, MemberFilter.class);

    return http.build();
  }

  // Both filters run inside the security chain only.
  @Bean
  FilterRegistrationBean<MemberFilter> memberFilterRegistration(MemberFilter filter) {
    var registration = new FilterRegistrationBean<>(filter);
    registration.setEnabled(false);
    return registration;
  }

  @Bean
  FilterRegistrationBean<TenantLoggingFilter> tenantLoggingFilterRegistration(
      TenantLoggingFilter filter) {
    var registration = new FilterRegistrationBean<>(filter);
    registration.setEnabled(false);
    return registration;
  }
}
