/*
 * どこで: Common 共通設定
 * 何を: Clock と SecureRandom を DI 可能にする
 * なぜ: 各アプリで同一の時刻注入と乱数源を使い、テストで差し替えられるようにするため
 */
package com.example.common.config;

import java.security.SecureRandom;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RuntimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public SecureRandom secureRandom() {
    return new SecureRandom();
  }
}
