package io.sitepull.exceptions;

import lombok.Getter;

/** Connection failure, timeout or non-2xx status. Retriable at the unit level. */
@Getter
public class TransportException extends SitePullException {
  /** HTTP status, or 0 when no response was received. */
  private final int statusCode;

  public TransportException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = 0;
  }

  public TransportException(int statusCode, String message) {
    super(message);
    this.statusCode = statusCode;
  }
}
