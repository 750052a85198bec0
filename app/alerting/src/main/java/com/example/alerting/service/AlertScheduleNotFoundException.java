package com.example.alerting.service;

import java.util.UUID;

public class AlertScheduleNotFoundException extends RuntimeException {

  public AlertScheduleNotFoundException(UUID scheduleId) {
    super("alert schedule not found: " + scheduleId);
  }
}
