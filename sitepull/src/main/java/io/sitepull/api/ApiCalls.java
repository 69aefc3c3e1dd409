package io.sitepull.api;

import io.sitepull.exceptions.SitePullException;
import io.sitepull.exceptions.TransportException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/** Blocking access to endpoint calls, translating async failures into the client's exceptions. */
public final class ApiCalls {

  private ApiCalls() {}

  public static <T> T await(CompletableFuture<T> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      throw translate(e.getCause() == null ? e : e.getCause());
    }
  }

  static RuntimeException translate(Throwable failure) {
    Throwable cause = failure;
    while ((cause instanceof CompletionException || cause instanceof ExecutionException)
        && cause.getCause() != null) {
      cause = cause.getCause();
    }
    if (cause instanceof SitePullException) {
      return (SitePullException) cause;
    }
    if (cause instanceof IOException) {
      return new TransportException("Request failed: " + cause.getMessage(), cause);
    }
    if (cause instanceof UncheckedIOException) {
      return new TransportException("Request failed: " + cause.getMessage(), cause.getCause());
    }
    if (cause instanceof RuntimeException) {
      return (RuntimeException) cause;
    }
    return new SitePullException("Request failed", cause);
  }
}
