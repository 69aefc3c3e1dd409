package io.sitepull.source.exceptions;

import lombok.Getter;

/** Failure of an endpoint action, carrying the HTTP status and error code reported to callers. */
@Getter
public class SourceException extends RuntimeException {
  private final int statusCode;
  private final String errorCode;

  public SourceException(int statusCode, String errorCode, String message) {
    super(message);
    this.statusCode = statusCode;
    this.errorCode = errorCode;
  }

  public SourceException(int statusCode, String errorCode, String message, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
    this.errorCode = errorCode;
  }
}
