package io.sitepull.exceptions;

/** Base of every failure raised while pulling a site. */
public class SitePullException extends RuntimeException {
  public SitePullException(String message) {
    super(message);
  }

  public SitePullException(String message, Throwable cause) {
    super(message, cause);
  }
}
