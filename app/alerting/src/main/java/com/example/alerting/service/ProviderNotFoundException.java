package com.example.alerting.service;

import java.util.UUID;

public class ProviderNotFoundException extends RuntimeException {

  public ProviderNotFoundException(UUID providerId) {
    super("sms provider not found: " + providerId);
  }
}
