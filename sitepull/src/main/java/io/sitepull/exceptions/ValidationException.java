package io.sitepull.exceptions;

public class ValidationException extends SitePullException {
  public ValidationException(String message) {
    super(message);
  }
}
