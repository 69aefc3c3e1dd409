package io.sitepull;

import com.google.common.annotations.VisibleForTesting;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.sitepull.api.AsyncHttpClientWithRetry;
import io.sitepull.cli_parser.CliParser;
import io.sitepull.config.Config;
import io.sitepull.config.ConfigLoader;
import io.sitepull.metrics.MetricsModule;
import io.sitepull.metrics.MetricsServer;
import io.sitepull.orchestrator.DownloadOrchestrator;
import io.sitepull.orchestrator.DownloadRequest;
import io.sitepull.orchestrator.ExitCode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.cli.ParseException;

@Slf4j
public class Main {
  private final CliParser parser;
  private final ConfigLoader configLoader;

  public Main(CliParser parser, ConfigLoader configLoader) {
    this.parser = parser;
    this.configLoader = configLoader;
  }

  public static void main(String[] args) {
    Main main = new Main(new CliParser(), new ConfigLoader());
    System.exit(main.run(args).getCode());
  }

  @VisibleForTesting
  ExitCode run(String[] args) {
    Config config;
    try {
      parser.parse(args);
      if (parser.isHelpRequested()) {
        return ExitCode.SUCCESS;
      }
      config =
          parser.getConfigFilePath() != null
              ? configLoader.loadConfigFromConfigFile(parser.getConfigFilePath())
              : configLoader.defaultConfig();
    } catch (ParseException | IllegalArgumentException e) {
      log.error("Invalid arguments: {}", e.getMessage());
      return ExitCode.BAD_ARGUMENTS;
    }

    Injector injector = Guice.createInjector(new RuntimeModule(config), new MetricsModule());
    MetricsServer metricsServer = injector.getInstance(MetricsServer.class);
    AsyncHttpClientWithRetry httpClient = injector.getInstance(AsyncHttpClientWithRetry.class);
    try {
      log.info("Starting download from {}", parser.getUrl());
      return injector
          .getInstance(DownloadOrchestrator.class)
          .handleDownload(
              DownloadRequest.builder()
                  .url(parser.getUrl())
                  .key(parser.getKey())
                  .outputDirectory(parser.getOutputDirectory())
                  .concurrency(parser.getConcurrency())
                  .build());
    } finally {
      httpClient.shutdown();
      metricsServer.shutdown();
    }
  }
}
