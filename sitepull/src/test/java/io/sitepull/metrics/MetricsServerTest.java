package io.sitepull.metrics;

import static io.sitepull.constants.MetricsConstants.PROMETHEUS_METRICS_SCRAPING_DISABLED;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.HTTPServer;
import java.io.IOException;
import lombok.SneakyThrows;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.MockedStatic;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MetricsServerTest {
  private static final int PORT = 9464;

  private CollectorRegistry registry;
  @Mock HTTPServer httpServer;

  @BeforeEach
  void setUp() {
    registry = new CollectorRegistry();
  }

  @Test
  @SneakyThrows
  void testStartFailureIsReported() {
    try (MockedStatic<MetricsServer> mocked = mockStatic(MetricsServer.class)) {
      mocked
          .when(() -> MetricsServer.initHttpServer(any(), any()))
          .thenThrow(new IOException("address in use"));

      RuntimeException exception =
          assertThrows(RuntimeException.class, () -> new MetricsServer(registry, PORT));

      assertEquals("Failed to start metrics server", exception.getMessage());
    }
  }

  @Test
  @SneakyThrows
  void testShutdownClosesServer() {
    try (MockedStatic<MetricsServer> mocked = mockStatic(MetricsServer.class)) {
      mocked.when(() -> MetricsServer.initHttpServer(any(), any())).thenReturn(httpServer);
      MetricsServer metricsServer = new MetricsServer(registry, PORT);

      assertTrue(metricsServer.isRunning());
      metricsServer.shutdown();

      verify(httpServer).close();
    }
  }

  @Test
  void testDisabledServer() {
    MetricsServer metricsServer = new MetricsServer(registry, PROMETHEUS_METRICS_SCRAPING_DISABLED);

    assertFalse(metricsServer.isRunning());
    metricsServer.shutdown();
  }
}
