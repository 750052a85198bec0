/*
 * どこで: Alerting ドメインモデル
 * 何を: テンプレートのカテゴリと、カテゴリごとに使えるプレースホルダ
 * なぜ: 保存時にこの集合でテンプレートを検証するため
 */
package com.example.alerting.model;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

public enum TemplateCategory {
  LICENSE_EXPIRY(
      Set.of(
          "license_name",
          "station",
          "expiry_date",
          "days_remaining",
          "license_number",
          "renewal_url")),
  INVENTORY_ALERT(
      Set.of("product_name", "station", "current_stock", "minimum_stock", "reorder_date")),
  PAYMENT_REMINDER(
      Set.of("vendor_name", "amount", "due_date", "invoice_number", "days_overdue")),
  DELIVERY_NOTIFICATION(
      Set.of("delivery_date", "station", "product_type", "quantity", "bol_number")),
  EMERGENCY_ALERT(
      Set.of("alert_type", "station", "timestamp", "contact_info", "action_required")),
  GENERAL_NOTIFICATION(
      Set.of("recipient_name", "station", "date", "message_details", "contact_info"));

  private final Set<String> placeholders;

  TemplateCategory(Set<String> placeholders) {
    this.placeholders = placeholders;
  }

  public Set<String> placeholders() {
    return placeholders;
  }

  /** このカテゴリが認識しないトークンを、メッセージが安定するようソートして返す。 */
  public Set<String> unknownPlaceholders(Collection<String> tokens) {
    final Set<String> unknown = new TreeSet<>();
    for (String token : tokens) {
      if (!placeholders.contains(token)) {
        unknown.add(token);
      }
    }
    return unknown;
  }
}
