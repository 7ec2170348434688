/*
 * どこで: Auth-Gateway Web 層
 * 何を: リクエスト単位の相関情報と認証フローの段階を MDC に載せる
 * なぜ: ログイン開始からコールバック、ログアウトまでのログを request_id と auth_flow で追えるようにするため
 */
package com.example.auth_gateway.config;

import com.example.auth_gateway.api.AuthFlow;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

public class RequestMdcInterceptor implements HandlerInterceptor {

  static final String AUTH_FLOW = "auth_flow";

  private static final String ATTRIBUTE_KEYS = RequestMdcInterceptor.class.getName() + ".MDC_KEYS";

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final List<String> keys = new ArrayList<>();
    put(keys, "request_id", resolveRequestId(request));
    put(keys, "http_method", request.getMethod());
    put(keys, "http_path", request.getRequestURI());
    put(keys, "client_ip", resolveClientIp(request));
    put(keys, AUTH_FLOW, resolveAuthFlow(handler));
    request.setAttribute(ATTRIBUTE_KEYS, keys);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    if (!(request.getAttribute(ATTRIBUTE_KEYS) instanceof List<?> rawKeys)) {
      return;
    }
    for (Object rawKey : rawKeys) {
      if (rawKey instanceof String key) {
        MDC.remove(key);
      }
    }
  }

  @Nullable
  private String resolveAuthFlow(Object handler) {
    if (!(handler instanceof HandlerMethod handlerMethod)) {
      return null;
    }
    final AuthFlow flow = handlerMethod.getMethodAnnotation(AuthFlow.class);
    return flow == null ? null : flow.value();
  }

  private String resolveRequestId(HttpServletRequest request) {
    final String requestId = request.getHeader("X-Request-Id");
    return requestId == null || requestId.isBlank() ? UUID.randomUUID().toString() : requestId;
  }

  // プロキシ経由では X-Forwarded-For の先頭がクライアント。
  private String resolveClientIp(HttpServletRequest request) {
    final String forwarded = request.getHeader("X-Forwarded-For");
    if (forwarded == null || forwarded.isBlank()) {
      return request.getRemoteAddr();
    }
    final int comma = forwarded.indexOf(',');
    return (comma < 0 ? forwarded : forwarded.substring(0, comma)).trim();
  }

  private void put(List<String> keys, String key, @Nullable String value) {
    if (value == null || value.isBlank()) {
      return;
    }
    MDC.put(key, value);
    keys.add(key);
  }
}
