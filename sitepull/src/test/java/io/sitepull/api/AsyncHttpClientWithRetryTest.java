package io.sitepull.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.concurrent.ExecutionException;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class AsyncHttpClientWithRetryTest {
  private MockWebServer mockWebServer;
  private OkHttpClient okHttpClient;
  private AsyncHttpClientWithRetry asyncHttpClientWithRetry;

  @BeforeEach
  void setUp() throws IOException {
    mockWebServer = new MockWebServer();
    mockWebServer.start();
    okHttpClient = new OkHttpClient.Builder().build();
    asyncHttpClientWithRetry = new AsyncHttpClientWithRetry(3, 10, okHttpClient);
  }

  @AfterEach
  void tearDown() throws IOException {
    mockWebServer.shutdown();
    asyncHttpClientWithRetry.shutdown();
    assertEquals(0, okHttpClient.connectionPool().connectionCount());
    assertTrue(okHttpClient.dispatcher().executorService().isShutdown());
  }

  @Test
  void testServerErrorsAreRetriedUntilSuccess() throws Exception {
    mockWebServer.enqueue(new MockResponse().setResponseCode(500));
    mockWebServer.enqueue(new MockResponse().setResponseCode(503));
    mockWebServer.enqueue(new MockResponse().setResponseCode(200).setBody("ok"));

    try (Response response = asyncHttpClientWithRetry.makeRequestWithRetry(get()).get()) {
      assertTrue(response.isSuccessful());
      assertEquals("ok", response.body().string());
    }
    assertEquals(3, mockWebServer.getRequestCount());
  }

  @Test
  void testLastFailureIsReturnedWhenAttemptsRunOut() throws Exception {
    for (int i = 0; i < 3; i++) {
      mockWebServer.enqueue(new MockResponse().setResponseCode(500));
    }

    try (Response response = asyncHttpClientWithRetry.makeRequestWithRetry(get()).get()) {
      assertFalse(response.isSuccessful());
      assertEquals(500, response.code());
    }
    assertEquals(3, mockWebServer.getRequestCount());
  }

  @ParameterizedTest
  @ValueSource(ints = {400, 401, 403, 404, 409})
  void testClientErrorsAreNotRetried(int statusCode) throws Exception {
    mockWebServer.enqueue(new MockResponse().setResponseCode(statusCode));

    try (Response response = asyncHttpClientWithRetry.makeRequestWithRetry(get()).get()) {
      assertEquals(statusCode, response.code());
    }
    assertEquals(1, mockWebServer.getRequestCount());
  }

  @Test
  void testConnectionFailureCompletesExceptionally() throws IOException {
    HttpUrl deadUrl = mockWebServer.url("/sitepull");
    mockWebServer.shutdown();

    Request request = new Request.Builder().url(deadUrl).get().build();
    ExecutionException exception =
        assertThrows(
            ExecutionException.class,
            () -> asyncHttpClientWithRetry.makeRequestWithRetry(request).get());
    assertInstanceOf(IOException.class, exception.getCause());
  }

  @Test
  void testRetryDelayIsBounded() {
    AsyncHttpClientWithRetry slowClient = new AsyncHttpClientWithRetry(10, 1000, okHttpClient);
    for (int attempt = 1; attempt < 10; attempt++) {
      long delay = slowClient.calculateDelay(attempt);
      assertTrue(delay >= 0 && delay <= 10000, "delay " + delay);
    }
  }

  @Test
  void testRetryThreadsAreNamedDaemons() {
    Thread thread = AsyncHttpClientWithRetry.retryThreadFactory().newThread(() -> {});

    assertTrue(thread.isDaemon());
    assertTrue(thread.getName().startsWith("sitepull-http-retry-"));
  }

  private Request get() {
    return new Request.Builder().url(mockWebServer.url("/sitepull")).get().build();
  }
}
