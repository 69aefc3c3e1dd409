package io.sitepull.api;

import static io.sitepull.constants.ApiConstants.ACCEPTABLE_HTTP_FAILURE_STATUS_CODES;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.io.IOException;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

/**
 * Executes requests asynchronously, retrying connection failures and retriable statuses (5xx, 429)
 * with exponential backoff. Statuses in {@code ACCEPTABLE_HTTP_FAILURE_STATUS_CODES} are returned
 * to the caller as is. A failure after the body started streaming is not seen here; unit level
 * retries cover it.
 */
@Slf4j
public class AsyncHttpClientWithRetry {
  private static final long MAX_RETRY_DELAY_MILLIS = 10000;
  private static final Random random = new Random();

  private final ScheduledExecutorService scheduler;
  private final int maxAttempts;
  private final long retryDelayMillis;
  private final OkHttpClient okHttpClient;

  public AsyncHttpClientWithRetry(
      int maxAttempts, long retryDelayMillis, @Nonnull OkHttpClient okHttpClient) {
    this.maxAttempts = maxAttempts;
    this.retryDelayMillis = retryDelayMillis;
    this.okHttpClient = okHttpClient;
    this.scheduler = Executors.newSingleThreadScheduledExecutor(retryThreadFactory());
  }

  @VisibleForTesting
  static ThreadFactory retryThreadFactory() {
    return new ThreadFactoryBuilder()
        .setNameFormat("sitepull-http-retry-%d")
        .setDaemon(true)
        .build();
  }

  public CompletableFuture<Response> makeRequestWithRetry(Request request) {
    CompletableFuture<Response> future = new CompletableFuture<>();
    attemptRequest(request, 1, future);
    return future;
  }

  private void attemptRequest(Request request, int attempt, CompletableFuture<Response> future) {
    okHttpClient
        .newCall(request)
        .enqueue(
            new Callback() {
              @Override
              public void onFailure(@Nonnull Call call, @Nonnull IOException e) {
                if (attempt < maxAttempts) {
                  log.warn(
                      "Request to {} failed with error: {}, attempt: {}",
                      request.url(),
                      e.getMessage(),
                      attempt);
                  scheduleRetry(request, attempt, future);
                } else {
                  future.completeExceptionally(e);
                }
              }

              @Override
              public void onResponse(@Nonnull Call call, @Nonnull Response response) {
                if (isRetriable(response) && attempt < maxAttempts) {
                  log.warn(
                      "Request to {} failed with HTTP status: {}, attempt: {}",
                      request.url(),
                      response.code(),
                      attempt);
                  response.close();
                  scheduleRetry(request, attempt, future);
                } else {
                  future.complete(response);
                }
              }
            });
  }

  private static boolean isRetriable(Response response) {
    return !response.isSuccessful()
        && !ACCEPTABLE_HTTP_FAILURE_STATUS_CODES.contains(response.code());
  }

  private void scheduleRetry(Request request, int attempt, CompletableFuture<Response> future) {
    scheduler.schedule(
        () -> attemptRequest(request, attempt + 1, future),
        calculateDelay(attempt),
        TimeUnit.MILLISECONDS);
  }

  @VisibleForTesting
  long calculateDelay(int attempt) {
    // exponential backoff with jitter, bounded
    long delay = (long) (retryDelayMillis * Math.pow(2, attempt - 1));
    long jitter = (long) (random.nextDouble() * delay) - (delay / 2);
    return Math.min(Math.max(0, delay + jitter), MAX_RETRY_DELAY_MILLIS);
  }

  public void shutdown() {
    scheduler.shutdown();
    okHttpClient.connectionPool().evictAll();
    okHttpClient.dispatcher().executorService().shutdown();
  }

  @VisibleForTesting
  public long getRetryDelayMillis() {
    return retryDelayMillis;
  }

  @VisibleForTesting
  public int getMaxAttempts() {
    return maxAttempts;
  }
}
