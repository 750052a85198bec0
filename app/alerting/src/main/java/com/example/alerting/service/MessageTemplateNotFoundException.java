package com.example.alerting.service;

import java.util.UUID;

public class MessageTemplateNotFoundException extends RuntimeException {

  public MessageTemplateNotFoundException(UUID templateId) {
    super("message template not found: " + templateId);
  }
}
