package io.sitepull.api.models.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class ApiResponse {
  private boolean isFailure = false;
  private int statusCode = 200;
  private String errorCode = "";
  private String cause = "";

  public void setError(int statusCode, String errorCode, String cause) {
    this.isFailure = true;
    this.statusCode = statusCode;
    this.errorCode = errorCode;
    this.cause = cause;
  }
}
