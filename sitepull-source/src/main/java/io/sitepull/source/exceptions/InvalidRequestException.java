package io.sitepull.source.exceptions;

public class InvalidRequestException extends SourceException {
  public InvalidRequestException(String message) {
    super(400, "sitepull_invalid_request", message);
  }
}
