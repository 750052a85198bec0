/*
 * どこで: Alerting 配信層
 * 何を: ClickSend REST API を使う SmsTransport
 * なぜ: HTTP とメッセージ単位のステータスを配信失敗理由へ対応付けるため
 */
package com.example.alerting.delivery;

import com.example.alerting.config.SmsDeliveryProperties;
import com.example.alerting.model.DeliveryResult;
import com.example.alerting.model.ProviderAccount;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.math.BigDecimal;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Component
@ConditionalOnProperty(name = "alerting.sms.transport", havingValue = "clicksend")
public class ClickSendSmsTransport implements SmsTransport {

  private static final Logger logger = LoggerFactory.getLogger(ClickSendSmsTransport.class);
  private static final String STATUS_SUCCESS = "SUCCESS";

  private final RestClient clickSendRestClient;
  private final SmsDeliveryProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient is a shared Spring-managed component and cannot be copied")
  public ClickSendSmsTransport(RestClient clickSendRestClient, SmsDeliveryProperties properties) {
    this.clickSendRestClient = clickSendRestClient;
    this.properties = properties;
  }

  @Override
  public DeliveryResult send(ProviderAccount provider, String recipient, String body) {
    final String authorization = basicAuthorization(provider);
    final ClickSendSendResponse response;
    try {
      response =
          clickSendRestClient
              .post()
              .uri(properties.sendPath())
              .header(HttpHeaders.AUTHORIZATION, authorization)
              .contentType(MediaType.APPLICATION_JSON)
              .body(ClickSendSendRequest.single(provider.senderId(), recipient, body))
              .retrieve()
              .body(ClickSendSendResponse.class);
    } catch (RestClientResponseException ex) {
      throw mapResponseException(provider, ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(provider, ex);
    }
    return toResult(provider, response);
  }

  private DeliveryResult toResult(ProviderAccount provider, ClickSendSendResponse response) {
    final ClickSendSendResponse.MessageResult message =
        response == null ? null : response.firstMessage();
    if (message == null || message.status() == null) {
      throw new SmsDeliveryException(
          SmsDeliveryException.Reason.PROVIDER_UNAVAILABLE,
          "clicksend response has no message result provider=" + provider.name());
    }
    if (STATUS_SUCCESS.equalsIgnoreCase(message.status())) {
      return new DeliveryResult(
          message.messageId(), parsePrice(message.messagePrice()), message.status());
    }
    throw mapMessageStatus(provider, message.status());
  }

  private SmsDeliveryException mapMessageStatus(ProviderAccount provider, String status) {
    logger.warn("clicksend rejected message provider={} status={}", provider.name(), status);
    final String upper = status.toUpperCase(Locale.ROOT);
    if (upper.contains("RECIPIENT") || upper.contains("NUMBER")) {
      return new SmsDeliveryException(
          SmsDeliveryException.Reason.INVALID_RECIPIENT, "clicksend rejected recipient: " + status);
    }
    if (upper.contains("CREDIT") || upper.contains("LIMIT") || upper.contains("QUOTA")) {
      return new SmsDeliveryException(
          SmsDeliveryException.Reason.QUOTA_EXCEEDED, "clicksend account exhausted: " + status);
    }
    if (upper.contains("CREDENTIAL") || upper.contains("UNAUTHORI")) {
      return new SmsDeliveryException(
          SmsDeliveryException.Reason.AUTHENTICATION, "clicksend rejected credentials: " + status);
    }
    return new SmsDeliveryException(
        SmsDeliveryException.Reason.PROVIDER_UNAVAILABLE, "clicksend message status: " + status);
  }

  private SmsDeliveryException mapResponseException(
      ProviderAccount provider, RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    logger.warn(
        "clicksend send failed provider={} httpStatus={} statusText={}",
        provider.name(),
        status,
        ex.getStatusText());
    if (status == 401 || status == 403) {
      return new SmsDeliveryException(
          SmsDeliveryException.Reason.AUTHENTICATION, "clicksend rejected credentials", ex);
    }
    if (status == 429) {
      return new SmsDeliveryException(
          SmsDeliveryException.Reason.QUOTA_EXCEEDED, "clicksend rate limit reached", ex);
    }
    if (status == 400 || status == 422) {
      return new SmsDeliveryException(
          SmsDeliveryException.Reason.INVALID_RECIPIENT, "clicksend rejected request", ex);
    }
    return new SmsDeliveryException(
        SmsDeliveryException.Reason.PROVIDER_UNAVAILABLE, "clicksend request failed", ex);
  }

  private SmsDeliveryException mapResourceException(
      ProviderAccount provider, ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("clicksend send timed out provider={}", provider.name());
      return new SmsDeliveryException(
          SmsDeliveryException.Reason.PROVIDER_UNAVAILABLE, "clicksend request timeout", ex);
    }
    logger.warn("clicksend connection failed provider={}", provider.name(), ex);
    return new SmsDeliveryException(
        SmsDeliveryException.Reason.PROVIDER_UNAVAILABLE, "clicksend connection failed", ex);
  }

  private String basicAuthorization(ProviderAccount provider) {
    final SmsDeliveryProperties.Credential credential =
        properties.credentials().get(provider.credentialsRef());
    if (credential == null || isBlank(credential.username()) || isBlank(credential.apiKey())) {
      throw new SmsDeliveryException(
          SmsDeliveryException.Reason.AUTHENTICATION,
          "credentials not configured ref=" + provider.credentialsRef());
    }
    final String token = credential.username() + ":" + credential.apiKey();
    return "Basic " + Base64.getEncoder().encodeToString(token.getBytes(StandardCharsets.UTF_8));
  }

  private BigDecimal parsePrice(String price) {
    if (isBlank(price)) {
      return BigDecimal.ZERO;
    }
    try {
      return new BigDecimal(price.trim());
    } catch (NumberFormatException ex) {
      logger.warn("clicksend returned unparseable message_price={}", price);
      return BigDecimal.ZERO;
    }
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
