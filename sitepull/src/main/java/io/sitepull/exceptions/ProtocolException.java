package io.sitepull.exceptions;

import lombok.Getter;

/**
 * The endpoint answered, but with an error the client cannot fix by retrying: an invalid cursor, a
 * job that no longer exists, a malformed reply.
 */
@Getter
public class ProtocolException extends SitePullException {
  private final int statusCode;
  private final String errorCode;

  public ProtocolException(int statusCode, String errorCode, String message) {
    super(message);
    this.statusCode = statusCode;
    this.errorCode = errorCode;
  }

  public ProtocolException(String message) {
    this(0, "", message);
  }
}
