package com.example.alerting;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.alerting.delivery.LocalSmsTransport;
import com.example.alerting.delivery.SmsTransport;
import com.example.alerting.service.AlertScheduleWorker;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class AlertingApplicationTests extends AbstractPostgresContainerTest {

  @Autowired private ApplicationContext context;

  @Test
  void contextLoadsWithLocalTransportAndWorkerDisabled() {
    assertThat(context.getBean(SmsTransport.class)).isInstanceOf(LocalSmsTransport.class);
    assertThat(context.getBeansOfType(AlertScheduleWorker.class)).isEmpty();
  }
}
