/*
 * どこで: Alerting 配信層
 * 何を: プロバイダを呼ばずにログだけ出す SmsTransport
 * なぜ: ローカル/テスト環境で実 SMS を送らずにクォータと台帳の経路を通すため
 */
package com.example.alerting.delivery;

import com.example.alerting.model.DeliveryResult;
import com.example.alerting.model.ProviderAccount;
import java.math.BigDecimal;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "alerting.sms.transport", havingValue = "local", matchIfMissing = true)
public class LocalSmsTransport implements SmsTransport {

  private static final Logger logger = LoggerFactory.getLogger(LocalSmsTransport.class);
  static final String LOCAL_STATUS = "SIMULATED";

  @Override
  public DeliveryResult send(ProviderAccount provider, String recipient, String body) {
    final String messageId = "local-" + UUID.randomUUID();
    logger.info(
        "sms simulated send provider={} sender={} recipient={} length={} messageId={}",
        provider.name(),
        provider.senderId(),
        recipient,
        body.length(),
        messageId);
    return new DeliveryResult(messageId, BigDecimal.ZERO, LOCAL_STATUS);
  }
}
