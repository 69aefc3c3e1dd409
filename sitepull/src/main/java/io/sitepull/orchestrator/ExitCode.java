package io.sitepull.orchestrator;

import io.sitepull.exceptions.ProtocolException;
import io.sitepull.exceptions.TransportException;
import io.sitepull.exceptions.ValidationException;
import lombok.Getter;

@Getter
public enum ExitCode {
  SUCCESS(0),
  BAD_ARGUMENTS(2),
  NETWORK_FAILURE(3),
  INTERNAL_ERROR(4);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public static ExitCode forThrowable(Throwable throwable) {
    if (throwable instanceof ValidationException || throwable instanceof IllegalArgumentException) {
      return BAD_ARGUMENTS;
    }
    if (throwable instanceof TransportException || throwable instanceof ProtocolException) {
      return NETWORK_FAILURE;
    }
    return INTERNAL_ERROR;
  }
}
