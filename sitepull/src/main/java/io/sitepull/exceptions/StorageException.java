package io.sitepull.exceptions;

/** Local disk failure. Never retried. */
public class StorageException extends SitePullException {
  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
