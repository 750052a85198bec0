/*
 * どこで: Alerting 設定
 * 何を: ClickSend トランスポート用の RestClient を組み立てる
 * なぜ: 送信が保留のまま残らないよう接続/読み取りタイムアウトを必ず有限にするため
 */
package com.example.alerting.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class SmsTransportConfig {

  @Bean
  @ConditionalOnProperty(name = "alerting.sms.transport", havingValue = "clicksend")
  RestClient clickSendRestClient(RestClient.Builder builder, SmsDeliveryProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder.baseUrl(properties.baseUrl()).requestFactory(requestFactory).build();
  }
}
