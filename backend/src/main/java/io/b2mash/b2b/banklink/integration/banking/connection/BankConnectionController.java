package io.b2mash.b2b.banklink.integration.banking.connection;

import io.b2mash.b2b.banklink.exception.ForbiddenException;
import io.b2mash.b2b.banklink.exception.IntegrationNotConfiguredException;
import io.b2mash.b2b.banklink.integration.banking.BankingProperties;
import jakarta.servlet.http.HttpServletRequest;
import java.net.URI;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CookieValue;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriComponentsBuilder;

@RestController
@RequestMapping("/api/integrations/banking")
public class BankConnectionController {

  private static final Logger log = LoggerFactory.getLogger(BankConnectionController.class);

  static final String STATE_COOKIE = "banking_oauth_state";
  private static final String COOKIE_PATH = "/api/integrations/banking";

  private final BankConnectionService connectionService;
  private final BankingProperties properties;

  public BankConnectionController(
      BankConnectionService connectionService, BankingProperties properties) {
    this.connectionService = connectionService;
    this.properties = properties;
  }

  /**
   * Redirects to the bank's consent page. An existing active connection or an unexpected failure
   * redirects back to the settings page with an {@code error} code instead.
   */
  @GetMapping("/authorize")
  public ResponseEntity<Void> authorize(HttpServletRequest request) {
    AuthorizationRequest authorization;
    try {
      authorization = connectionService.initiate();
    } catch (AlreadyConnectedException e) {
      return redirect(settingsUrl("error", "already_connected"), null);
    } catch (IntegrationNotConfiguredException | ForbiddenException e) {
      throw e;
    } catch (RuntimeException e) {
      log.error("Bank authorization could not be started", e);
      return redirect(settingsUrl("error", "oauth_failed"), null);
    }

    var cookie =
        stateCookie(authorization.state(), authorization.stateTtl(), request.isSecure());
    return redirect(authorization.authorizationUrl(), cookie);
  }

  /** The bank's redirect target. Always answers with a redirect to the settings page. */
  @GetMapping("/callback")
  public ResponseEntity<Void> callback(
      @RequestParam(required = false) String code,
      @RequestParam(required = false) String state,
      @RequestParam(required = false) String error,
      @RequestParam(name = "error_description", required = false) String errorDescription,
      @CookieValue(name = STATE_COOKIE, required = false) String browserState,
      HttpServletRequest request) {
    var clearCookie = stateCookie("", Duration.ZERO, request.isSecure());
    try {
      connectionService.completeAuthorization(
          new CallbackRequest(code, state, error, errorDescription, browserState));
      return redirect(settingsUrl("success", "connected"), clearCookie);
    } catch (OAuthCallbackException e) {
      log.warn("Bank callback failed ({}): {}", e.getFailure().code(), e.getMessage());
      var target =
          UriComponentsBuilder.fromUriString(properties.settingsUrl())
              .queryParam("error", e.getFailure().code());
      if (e.getFailure() == CallbackFailure.OAUTH_DENIED && e.getMessage() != null) {
        target.queryParam("message", e.getMessage());
      }
      return redirect(target.encode().build().toUriString(), clearCookie);
    } catch (RuntimeException e) {
      log.error("Bank callback failed unexpectedly", e);
      return redirect(settingsUrl("error", CallbackFailure.CALLBACK_FAILED.code()), clearCookie);
    }
  }

  @PostMapping("/disconnect")
  public ResponseEntity<DisconnectResult> disconnect(
      @RequestBody(required = false) DisconnectRequest request) {
    boolean deleteData = request != null && Boolean.TRUE.equals(request.deleteData());
    return ResponseEntity.ok(connectionService.disconnect(deleteData));
  }

  @GetMapping("/connection")
  public ResponseEntity<ConnectionStatusView> connection() {
    return ResponseEntity.ok(connectionService.getStatus());
  }

  private String settingsUrl(String param, String value) {
    return UriComponentsBuilder.fromUriString(properties.settingsUrl())
        .queryParam(param, value)
        .encode()
        .build()
        .toUriString();
  }

  private static ResponseCookie stateCookie(String value, Duration maxAge, boolean secure) {
    return ResponseCookie.from(STATE_COOKIE, value)
        .httpOnly(true)
        .secure(secure)
        .sameSite("Lax")
        .path(COOKIE_PATH)
        .maxAge(maxAge)
        .build();
  }

  private static ResponseEntity<Void> redirect(String location, ResponseCookie cookie) {
    var response = ResponseEntity.status(HttpStatus.FOUND).location(URI.create(location));
    if (cookie != null) {
      response.header(HttpHeaders.SET_COOKIE, cookie.toString());
    }
    return response.build();
  }

  // --- DTOs ---

  public record DisconnectRequest(Boolean deleteData) {}
}
