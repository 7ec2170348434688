/*
 * どこで: Auth-Gateway サービス層
 * 何を: login/callback/logout の結果とエラーコード別件数をメトリクスとして記録する
 * なぜ: ログイン成功率と IdP 連携エラーの増加を Prometheus から直接観測できるようにするため
 */
package com.example.auth_gateway.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class AuthMetrics {

  private static final String METRIC_LOGIN_TOTAL = "auth.login.total";
  private static final String METRIC_CALLBACK_TOTAL = "auth.callback.total";
  private static final String METRIC_LOGOUT_TOTAL = "auth.logout.total";
  private static final String METRIC_ERROR_TOTAL = "auth.error.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();

  public AuthMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordLoginResult(String result) {
    increment(METRIC_LOGIN_TOTAL, "Auth login endpoint outcomes", "result", result);
  }

  public void recordCallbackResult(String result) {
    increment(METRIC_CALLBACK_TOTAL, "Auth callback endpoint outcomes", "result", result);
  }

  public void recordLogoutResult(String result) {
    increment(METRIC_LOGOUT_TOTAL, "Auth logout endpoint outcomes", "result", result);
  }

  public void recordError(String code) {
    increment(METRIC_ERROR_TOTAL, "Auth errors by code", "code", code);
  }

  private void increment(String name, String description, String tagKey, String tagValue) {
    counters
        .computeIfAbsent(
            name + "|" + tagValue,
            ignored ->
                Counter.builder(name)
                    .description(description)
                    .tags(Tags.of(tagKey, tagValue))
                    .register(meterRegistry))
        .increment();
  }
}
