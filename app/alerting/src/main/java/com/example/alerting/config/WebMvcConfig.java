/*
 * どこで: Alerting Web 設定
 * 何を: 全 API リクエストに RequestMdcInterceptor を適用する
 * なぜ: API のログ行に request_id/メソッド/パス/クライアントアドレスを載せるため
 */
package com.example.alerting.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private final RequestMdcInterceptor requestMdcInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(requestMdcInterceptor);
  }
}
