/*
 * どこで: Auth-Gateway API 層
 * 何を: ログイン開始/コールバック/ログアウトの HTTP 入口を提供する
 * なぜ: Servlet の request/response を認証ハンドラ用の抽象に包み、結果をメトリクスに残すため
 */
package com.example.auth_gateway.api;

import com.example.auth_gateway.config.AuthProperties;
import com.example.auth_gateway.http.ServletAuthRequest;
import com.example.auth_gateway.http.ServletAuthResponse;
import com.example.auth_gateway.model.LoginOptions;
import com.example.auth_gateway.model.LoginStateProvider;
import com.example.auth_gateway.model.LogoutOptions;
import com.example.auth_gateway.model.LogoutOutcome;
import com.example.auth_gateway.service.AuthMetrics;
import com.example.auth_gateway.service.OidcCallbackService;
import com.example.auth_gateway.service.OidcLoginService;
import com.example.auth_gateway.service.OidcLogoutService;
import com.example.auth_gateway.state.ReturnToUrls;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class AuthController {

  private final AuthProperties properties;
  private final OidcLoginService oidcLoginService;
  private final OidcCallbackService oidcCallbackService;
  private final OidcLogoutService oidcLogoutService;
  private final ObjectProvider<LoginStateProvider> loginStateProvider;
  private final AuthMetrics authMetrics;

  /**
   * 役割:
   * - IdP の authorize endpoint へ 302 で遷移させる。
   *
   * 期待動作:
   * - returnTo クエリは同一オリジンの相対パスだけを受け付ける。
   * - アプリが LoginStateProvider を登録していれば、その値を state に含める。
   */
  @AuthFlow("login")
  @GetMapping("${auth.routes.login:/api/auth/login}")
  public void login(HttpServletRequest request, HttpServletResponse response) {
    oidcLoginService.login(
        new ServletAuthRequest(request),
        new ServletAuthResponse(response),
        new LoginOptions(null, null, loginStateProvider.getIfAvailable()));
    authMetrics.recordLoginResult("redirect");
  }

  /**
   * 役割:
   * - IdP からの戻りを受けてセッションを発行する。
   *
   * 期待動作:
   * - response_mode=form_post の場合は POST で戻るため、GET/POST の両方を受け付ける。
   * - state 不一致は例外ハンドラ側でログインをやり直させる。
   */
  @AuthFlow("callback")
  @RequestMapping(
      path = "${auth.routes.callback:/api/auth/callback}",
      method = {RequestMethod.GET, RequestMethod.POST})
  public void callback(HttpServletRequest request, HttpServletResponse response) {
    oidcCallbackService.callback(
        new ServletAuthRequest(request), new ServletAuthResponse(response));
    authMetrics.recordCallbackResult("success");
  }

  /**
   * 役割:
   * - ローカルセッションを破棄し、設定に応じて IdP のログアウトへ遷移させる。
   *
   * 期待動作:
   * - returnTo クエリはログインと同じく同一オリジンの相対パスだけを受け付け、それ以外は無視する。
   */
  @AuthFlow("logout")
  @GetMapping("${auth.routes.logout:/api/auth/logout}")
  public void logout(
      @RequestParam(name = "returnTo", required = false) String returnTo,
      HttpServletRequest request,
      HttpServletResponse response) {
    final String safeReturnTo =
        ReturnToUrls.toSafeRedirect(returnTo, properties.baseUrl()).orElse(null);
    final LogoutOutcome outcome =
        oidcLogoutService.logout(
            new ServletAuthRequest(request),
            new ServletAuthResponse(response),
            new LogoutOptions(safeReturnTo, null));
    authMetrics.recordLogoutResult(outcome.name().toLowerCase(Locale.ROOT));
  }
}
