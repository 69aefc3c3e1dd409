package io.sitepull.orchestrator;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.base.Ticker;
import io.sitepull.api.AsyncHttpClientWithRetry;
import io.sitepull.api.SourceApiClientFactory;
import io.sitepull.archive.ZipArchiveBuilder;
import io.sitepull.config.ConfigProvider;
import io.sitepull.config.models.configv1.ConfigV1;
import io.sitepull.config.models.configv1.DownloadConfig;
import io.sitepull.exceptions.TransportException;
import io.sitepull.metrics.SitePullMetrics;
import io.sitepull.retrieval.HttpUnitTransport;
import io.sitepull.retrieval.UnitTransport;
import io.sitepull.retrieval.UnitTransportFactory;
import io.sitepull.source.SourceApplication;
import io.sitepull.source.config.DatabaseConfig;
import io.sitepull.source.config.SourceConfig;
import io.sitepull.source.server.SourceHttpServer;
import java.io.IOException;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DownloadOrchestratorTest {
  private static final String ACCESS_KEY = "s3cret";
  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2026-03-04T05:06:07Z"), ZoneOffset.UTC);

  @Mock private SitePullMetrics metrics;
  @TempDir Path siteRoot;
  @TempDir Path sourceWorkspace;
  @TempDir Path output;

  private SourceHttpServer server;
  private AsyncHttpClientWithRetry asyncClient;
  private Map<String, byte[]> siteFiles;

  @BeforeEach
  void setUp() throws IOException {
    siteFiles = new HashMap<>();
    writeSiteFile("index.php", "<?php echo 'hello';");
    writeSiteFile("wp-config.php", "<?php define('DB_NAME', 'wp');");
    writeSiteFile("wp-content/themes/basic/style.css", "body { margin: 0; }");
    writeSiteFile("wp-content/uploads/2026/03/notes.txt", "notes");
    writeSiteFile("wp-content/uploads/2026/03/empty.txt", "");
    byte[] large = new byte[5000];
    Arrays.fill(large, (byte) 'x');
    Files.createDirectories(siteRoot.resolve("wp-content/uploads/video"));
    Files.write(siteRoot.resolve("wp-content/uploads/video/clip.mp4"), large);
    siteFiles.put("wp-content/uploads/video/clip.mp4", large);

    SourceConfig sourceConfig =
        SourceConfig.builder()
            .rootDirectory(siteRoot.toString())
            .workspaceDirectory(sourceWorkspace.toString())
            .accessKey(ACCESS_KEY)
            .database(DatabaseConfig.builder().jdbcUrl("jdbc:unused").user("wp").build())
            .build();
    server =
        new SourceHttpServer(
            SourceApplication.createDispatcher(
                sourceConfig, new StaticTableSource(250), Clock.systemUTC(), Ticker.systemTicker()),
            0,
            4);
    server.start();
    asyncClient = new AsyncHttpClientWithRetry(2, 0, new OkHttpClient());
  }

  @AfterEach
  void tearDown() {
    asyncClient.shutdown();
    server.stop();
  }

  @Test
  void testDownloadProducesArchiveWithFilesAndDatabase() throws Exception {
    DownloadOrchestrator orchestrator = orchestrator(HttpUnitTransport::new);

    ExitCode exitCode = orchestrator.handleDownload(request(3));

    assertEquals(ExitCode.SUCCESS, exitCode);
    assertEquals(DownloadState.DONE, orchestrator.getState());
    assertEquals(
        Arrays.asList(
            DownloadState.INIT,
            DownloadState.DB_EXPORT,
            DownloadState.DB_DOWNLOAD,
            DownloadState.MANIFEST_INIT,
            DownloadState.PARTITION,
            DownloadState.RETRIEVE,
            DownloadState.PACKAGE,
            DownloadState.DONE),
        orchestrator.getHistory());

    Path archive = output.resolve("archives/localhost-20260304-050607.zip");
    assertTrue(Files.exists(archive));
    try (ZipFile zip = new ZipFile(archive.toFile())) {
      for (Map.Entry<String, byte[]> file : siteFiles.entrySet()) {
        ZipEntry entry = zip.getEntry("files/" + file.getKey());
        assertTrue(entry != null, "missing " + file.getKey());
        assertArrayEquals(file.getValue(), zip.getInputStream(entry).readAllBytes());
      }
      ZipEntry dump = zip.getEntry("database/database.sql");
      String sql = new String(zip.getInputStream(dump).readAllBytes(), StandardCharsets.UTF_8);
      assertTrue(sql.contains("CREATE TABLE `posts`"));
      assertTrue(sql.contains("Post 250"));
    }
    assertEquals(Arrays.asList("archives"), listOutput());
  }

  @Test
  void testFailedUnitLeavesNoArchive() throws Exception {
    DownloadOrchestrator orchestrator =
        orchestrator(
            apiClient -> {
              UnitTransport delegate = new HttpUnitTransport(apiClient);
              return (unit, root, listener) -> {
                if (unit.getId() == 1) {
                  throw new TransportException(503, "unavailable");
                }
                return delegate.transfer(unit, root, listener);
              };
            });

    ExitCode exitCode = orchestrator.handleDownload(request(3));

    assertEquals(ExitCode.NETWORK_FAILURE, exitCode);
    assertEquals(DownloadState.FAILED, orchestrator.getState());
    assertFalse(orchestrator.getHistory().contains(DownloadState.PACKAGE));
    assertTrue(listOutput().isEmpty());
  }

  @Test
  void testWrongKeyIsNetworkFailure() {
    DownloadOrchestrator orchestrator = orchestrator(HttpUnitTransport::new);

    ExitCode exitCode =
        orchestrator.handleDownload(
            DownloadRequest.builder()
                .url(endpointUrl())
                .key("wrong")
                .outputDirectory(output.toString())
                .concurrency(2)
                .build());

    assertEquals(ExitCode.NETWORK_FAILURE, exitCode);
    assertEquals(
        Arrays.asList(DownloadState.INIT, DownloadState.DB_EXPORT, DownloadState.FAILED),
        orchestrator.getHistory());
    assertTrue(listOutput().isEmpty());
  }

  @Test
  void testUnreachableSourceIsNetworkFailure() throws IOException {
    int closedPort;
    try (ServerSocket socket = new ServerSocket(0)) {
      closedPort = socket.getLocalPort();
    }
    DownloadOrchestrator orchestrator = orchestrator(HttpUnitTransport::new);

    ExitCode exitCode =
        orchestrator.handleDownload(
            DownloadRequest.builder()
                .url("http://localhost:" + closedPort + SourceHttpServer.ENDPOINT_PATH)
                .key(ACCESS_KEY)
                .outputDirectory(output.toString())
                .concurrency(2)
                .build());

    assertEquals(ExitCode.NETWORK_FAILURE, exitCode);
    assertTrue(listOutput().isEmpty());
  }

  @Test
  void testInvalidArgumentsAreRejectedBeforeAnyRequest() {
    DownloadOrchestrator orchestrator = orchestrator(HttpUnitTransport::new);

    assertEquals(ExitCode.BAD_ARGUMENTS, orchestrator.handleDownload(request(0)));
    assertEquals(ExitCode.BAD_ARGUMENTS, orchestrator.handleDownload(request(33)));
    assertEquals(
        ExitCode.BAD_ARGUMENTS,
        orchestrator.handleDownload(
            DownloadRequest.builder()
                .url("not a url")
                .key(ACCESS_KEY)
                .outputDirectory(output.toString())
                .concurrency(2)
                .build()));
    assertEquals(
        Arrays.asList(DownloadState.INIT, DownloadState.FAILED), orchestrator.getHistory());
  }

  private DownloadOrchestrator orchestrator(UnitTransportFactory transportFactory) {
    ConfigV1 config =
        ConfigV1.builder()
            .version("V1")
            .downloadConfig(
                DownloadConfig.builder()
                    .largeFileThresholdBytes(1024)
                    .batchMaxFiles(2)
                    .unitRetryDelayMillis(0)
                    .dbProcessDelayMillis(0)
                    .manifestPageSize(2)
                    .progressLogIntervalSeconds(1)
                    .build())
            .build();
    return new DownloadOrchestrator(
        new ConfigProvider(config),
        new SourceApiClientFactory(asyncClient, metrics),
        transportFactory,
        new ZipArchiveBuilder(),
        metrics,
        CLOCK);
  }

  private DownloadRequest request(int concurrency) {
    return DownloadRequest.builder()
        .url(endpointUrl())
        .key(ACCESS_KEY)
        .outputDirectory(output.toString())
        .concurrency(concurrency)
        .build();
  }

  private String endpointUrl() {
    return "http://localhost:" + server.getPort() + SourceHttpServer.ENDPOINT_PATH;
  }

  private void writeSiteFile(String path, String content) throws IOException {
    Path file = siteRoot.resolve(path);
    Files.createDirectories(file.getParent());
    byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
    Files.write(file, bytes);
    siteFiles.put(path, bytes);
  }

  private List<String> listOutput() {
    try (Stream<Path> children = Files.list(output)) {
      return children
          .filter(path -> !Files.isDirectory(path) || !isEmptyDirectory(path))
          .map(path -> path.getFileName().toString())
          .sorted()
          .collect(Collectors.toList());
    } catch (IOException e) {
      throw new IllegalStateException(e);
    }
  }

  private static boolean isEmptyDirectory(Path directory) {
    try (Stream<Path> children = Files.list(directory)) {
      return children.findAny().isEmpty();
    } catch (IOException e) {
      throw new IllegalStateException(e);
    }
  }
}
