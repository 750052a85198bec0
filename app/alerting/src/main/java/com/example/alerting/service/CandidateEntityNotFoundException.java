package com.example.alerting.service;

import com.example.alerting.model.AlertType;

public class CandidateEntityNotFoundException extends RuntimeException {

  public CandidateEntityNotFoundException(AlertType alertType, String entityId) {
    super(alertType + " entity not found: " + entityId);
  }
}
