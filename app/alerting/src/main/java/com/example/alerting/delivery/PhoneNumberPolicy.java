/*
 * どこで: Alerting 配信層
 * 何を: 宛先を E.164 に正規化し、有効国リストと照合する
 * なぜ: どちらもクォータ予約前に行い、不正な番号で送信枠を消費しないため
 */
package com.example.alerting.delivery;

import com.example.alerting.config.SmsDeliveryProperties;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

@Component
public class PhoneNumberPolicy {

  private static final Pattern E164 = Pattern.compile("^\\+[1-9]\\d{1,14}$");
  private static final Pattern SEPARATORS = Pattern.compile("[\\s().-]");

  // "1" が "1876" を覆い隠さないよう、長い国番号から照合する
  private final List<SmsDeliveryProperties.Country> countries;

  public PhoneNumberPolicy(SmsDeliveryProperties properties) {
    this.countries =
        properties.countries().stream()
            .sorted(
                Comparator.comparingInt(
                        (SmsDeliveryProperties.Country country) ->
                            digits(country.callingCode()).length())
                    .reversed())
            .toList();
  }

  /**
   * 区切り文字を除き、先頭の {@code 00} を {@code +} に置き換える。
   *
   * @throws SmsDeliveryException 結果が E.164 でなければ {@code INVALID_RECIPIENT} で投げる
   */
  public String normalize(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new SmsDeliveryException(
          SmsDeliveryException.Reason.INVALID_RECIPIENT, "recipient is blank");
    }
    String candidate = SEPARATORS.matcher(raw.trim()).replaceAll("");
    if (candidate.startsWith("00")) {
      candidate = "+" + candidate.substring(2);
    }
    if (!E164.matcher(candidate).matches()) {
      throw new SmsDeliveryException(
          SmsDeliveryException.Reason.INVALID_RECIPIENT,
          "recipient is not in E.164 format: " + raw);
    }
    return candidate;
  }

  /** {@link #normalize} と同じだが、例外を投げずに空を返す。 */
  public Optional<String> tryNormalize(String raw) {
    try {
      return Optional.of(normalize(raw));
    } catch (SmsDeliveryException ex) {
      return Optional.empty();
    }
  }

  public void requireEnabledCountry(String e164) {
    final Optional<SmsDeliveryProperties.Country> country = countryOf(e164);
    if (country.isEmpty()) {
      throw new SmsDeliveryException(
          SmsDeliveryException.Reason.COUNTRY_NOT_ENABLED,
          "no configured country matches recipient " + e164);
    }
    if (!country.get().enabled()) {
      throw new SmsDeliveryException(
          SmsDeliveryException.Reason.COUNTRY_NOT_ENABLED,
          "country " + country.get().name() + " (+" + digits(country.get().callingCode())
              + ") is not enabled");
    }
  }

  Optional<SmsDeliveryProperties.Country> countryOf(String e164) {
    final String number = e164.substring(1);
    return countries.stream()
        .filter(country -> !digits(country.callingCode()).isEmpty())
        .filter(country -> number.startsWith(digits(country.callingCode())))
        .findFirst();
  }

  private static String digits(String callingCode) {
    return callingCode == null ? "" : callingCode.replaceAll("\\D", "");
  }
}
