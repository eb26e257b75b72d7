package com.intentcluster.clustering.exception;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Body of every non-2xx response from the clustering API. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Error returned by the clustering API")
public class ErrorResponse {

  private LocalDateTime timestamp;

  @Schema(description = "HTTP status code", example = "400")
  private int status;

  @Schema(description = "HTTP reason phrase or error category", example = "Bad Request")
  private String error;

  private String message;

  private String path;

  @Schema(description = "Rejected field or parameter name to its message")
  private Map<String, String> validationErrors;

  @Schema(description = "Cause of an unexpected failure, only outside production")
  private String debugMessage;

  public Map<String, String> getValidationErrors() {
    return validationErrors == null ? null : Collections.unmodifiableMap(validationErrors);
  }
}
