/*
 * どこで: Auth-Gateway 設定
 * 何を: Cookie 署名鍵リング、IdP 呼び出し用 RestClient、ログ用 MDC インターセプタを提供する
 * なぜ: 鍵導出を起動時の設定検証と同じタイミングで行い、プロセス内で 1 つの鍵キャッシュを共有するため
 */
package com.example.auth_gateway.config;

import com.example.common.crypto.SigningKeyRing;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.servlet.handler.MappedInterceptor;

@Configuration
@EnableConfigurationProperties(AuthProperties.class)
public class AuthConfig {

  @Bean
  SigningKeyRing cookieSigningKeyRing(AuthProperties properties) {
    final SigningKeyRing keyRing = SigningKeyRing.forCookieSigning(properties.secrets());
    // 不正な secret はリクエスト時ではなく起動時に検出する。
    keyRing.keys();
    return keyRing;
  }

  @Bean
  RestClient oidcRestClient(RestClient.Builder builder, AuthProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.httpTimeout());
    requestFactory.setReadTimeout(properties.httpTimeout());
    return builder.requestFactory(requestFactory).build();
  }

  // MappedInterceptor は全ハンドラマッピングに自動で適用される。
  @Bean
  MappedInterceptor requestMdcInterceptor() {
    return new MappedInterceptor(null, new RequestMdcInterceptor());
  }
}
