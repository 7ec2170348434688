package com.example.auth_gateway.api;

import com.example.auth_gateway.config.AuthProperties;
import com.example.auth_gateway.service.AuthHandlerException;
import com.example.auth_gateway.service.AuthMetrics;
import com.example.auth_gateway.service.OidcIntegrationException;
import com.example.auth_gateway.service.ProtocolStateMissingException;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class AuthApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(AuthApiExceptionHandler.class);

  private final AuthMetrics authMetrics;
  private final String loginRoute;

  public AuthApiExceptionHandler(AuthMetrics authMetrics, AuthProperties properties) {
    this.authMetrics = authMetrics;
    this.loginRoute = properties.routes().login();
  }

  // 一時 Cookie の欠落や期限切れはユーザー操作で回復できるため、ログインからやり直させる。
  @ExceptionHandler(ProtocolStateMissingException.class)
  public ResponseEntity<Void> handleProtocolStateMissing(ProtocolStateMissingException ex) {
    logger.info("restarting login: {}", ex.getMessage());
    authMetrics.recordCallbackResult("restart");
    authMetrics.recordError("PROTOCOL_STATE_MISSING");
    return ResponseEntity.status(HttpStatus.FOUND).header(HttpHeaders.LOCATION, loginRoute).build();
  }

  @ExceptionHandler(AuthHandlerException.class)
  public ResponseEntity<ApiErrorResponse> handleAuthHandler(AuthHandlerException ex) {
    recordPhaseError(ex.phase());
    if (ex.getCause() instanceof OidcIntegrationException integration) {
      final String code = "IDP_" + integration.reason().name();
      final HttpStatus status =
          switch (integration.reason()) {
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case REJECTED, BAD_GATEWAY, INVALID_RESPONSE -> HttpStatus.BAD_GATEWAY;
          };
      authMetrics.recordError(code);
      return ResponseEntity.status(status).body(new ApiErrorResponse(code, ex.getMessage()));
    }
    final String code = ex.phase().name() + "_HANDLER_FAILED";
    logger.error("{} handler failed", ex.phase().label().toLowerCase(Locale.ROOT), ex);
    authMetrics.recordError(code);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse(code, ex.getMessage()));
  }

  private void recordPhaseError(AuthHandlerException.Phase phase) {
    switch (phase) {
      case LOGIN -> authMetrics.recordLoginResult("error");
      case CALLBACK -> authMetrics.recordCallbackResult("error");
      case LOGOUT -> authMetrics.recordLogoutResult("error");
    }
  }
}
