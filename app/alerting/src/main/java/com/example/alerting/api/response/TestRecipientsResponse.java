package com.example.alerting.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "response-only DTO record")
public record TestRecipientsResponse(String providerId, List<String> recipients) {

  public static TestRecipientsResponse of(UUID providerId, Set<String> recipients) {
    return new TestRecipientsResponse(providerId.toString(), recipients.stream().sorted().toList());
  }
}
