package io.sitepull.orchestrator;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import io.sitepull.api.SourceApiClient;
import io.sitepull.api.SourceApiClientFactory;
import io.sitepull.api.SourceEndpoint;
import io.sitepull.api.models.response.DatabaseJobInitResponse;
import io.sitepull.api.models.response.ManifestJobInitResponse;
import io.sitepull.archive.ArchiveBuilder;
import io.sitepull.archive.ArchiveNames;
import io.sitepull.config.ConfigProvider;
import io.sitepull.config.models.configv1.DownloadConfig;
import io.sitepull.constants.DownloadConstants;
import io.sitepull.database.DatabaseExportDriver;
import io.sitepull.exceptions.ValidationException;
import io.sitepull.manifest.ManifestCollector;
import io.sitepull.manifest.ManifestPartitioner;
import io.sitepull.manifest.models.ManifestEntry;
import io.sitepull.manifest.models.Partition;
import io.sitepull.metrics.SitePullMetrics;
import io.sitepull.retrieval.ConcurrentRetrievalEngine;
import io.sitepull.retrieval.ProgressAggregator;
import io.sitepull.retrieval.ProgressListener;
import io.sitepull.retrieval.UnitTransportFactory;
import io.sitepull.retrieval.models.TransferResult;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;

/**
 * Runs one download: database export, manifest, partition, concurrent retrieval, packaging. States
 * advance in that order; any failure moves to {@link DownloadState#FAILED}, removes the workspace
 * and any partly written archive, and maps the failure to an exit code. No archive is produced
 * when a single file failed.
 */
@Slf4j
public class DownloadOrchestrator {
  private final ConfigProvider configProvider;
  private final SourceApiClientFactory apiClientFactory;
  private final UnitTransportFactory transportFactory;
  private final ArchiveBuilder archiveBuilder;
  private final SitePullMetrics metrics;
  private final Clock clock;
  private final List<DownloadState> history = new ArrayList<>();
  private volatile DownloadState state = DownloadState.INIT;

  @Inject
  public DownloadOrchestrator(
      @Nonnull ConfigProvider configProvider,
      @Nonnull SourceApiClientFactory apiClientFactory,
      @Nonnull UnitTransportFactory transportFactory,
      @Nonnull ArchiveBuilder archiveBuilder,
      @Nonnull SitePullMetrics metrics,
      @Nonnull Clock clock) {
    this.configProvider = configProvider;
    this.apiClientFactory = apiClientFactory;
    this.transportFactory = transportFactory;
    this.archiveBuilder = archiveBuilder;
    this.metrics = metrics;
    this.clock = clock;
  }

  public ExitCode handleDownload(DownloadRequest request) {
    history.clear();
    transition(DownloadState.INIT);
    Workspace workspace = null;
    Path archive = null;
    try {
      SourceEndpoint endpoint = SourceEndpoint.of(request.getUrl(), request.getKey());
      if (request.getConcurrency() < 1 || request.getConcurrency() > DownloadConstants.MAX_CONCURRENCY) {
        throw new ValidationException("Concurrency out of range: " + request.getConcurrency());
      }
      Path outputDirectory = prepareOutputDirectory(request.getOutputDirectory());
      log.info("Output directory: {}", outputDirectory);

      DownloadConfig config = configProvider.getConfig().getDownloadConfig();
      SourceApiClient apiClient = apiClientFactory.create(endpoint);
      workspace = Workspace.create(outputDirectory);

      exportDatabase(new DatabaseExportDriver(apiClient, config, metrics), workspace);

      transition(DownloadState.MANIFEST_INIT);
      List<ManifestEntry> entries =
          collectManifest(new ManifestCollector(apiClient, config.getManifestPageSize()));

      transition(DownloadState.PARTITION);
      Partition partition =
          new ManifestPartitioner(
                  config.getLargeFileThresholdBytes(),
                  config.getBatchMaxBytes(),
                  config.getBatchMaxFiles())
              .partition(entries);
      metrics.setFilesTotal(partition.getTotalFiles());
      log.info(
          "Manifest ready: {} files ({}) -> {} large, {} batches",
          partition.getTotalFiles(),
          FileUtils.byteCountToDisplaySize(partition.getTotalBytes()),
          partition.getLargeFiles().size(),
          partition.getBatches().size());

      transition(DownloadState.RETRIEVE);
      TransferResult result =
          retrieve(apiClient, config, partition, workspace.getFilesRoot(), request.getConcurrency());
      log.info("Database: OK");
      log.info(
          "Files: {}/{} (failed {})",
          result.getFilesSucceeded(),
          partition.getTotalFiles(),
          result.getFilesFailed());
      if (result.getFilesFailed() > 0) {
        transition(DownloadState.FAILED);
        log.error("{} files failed, no archive was created", result.getFilesFailed());
        return ExitCode.NETWORK_FAILURE;
      }

      transition(DownloadState.PACKAGE);
      archive = ArchiveNames.archivePath(outputDirectory, endpoint.getHost(), clock);
      long archiveSize = archiveBuilder.build(workspace.getRoot(), archive);
      transition(DownloadState.DONE);
      log.info("Archive created: {} ({})", archive, FileUtils.byteCountToDisplaySize(archiveSize));
      return ExitCode.SUCCESS;
    } catch (RuntimeException e) {
      transition(DownloadState.FAILED);
      deleteArchive(archive);
      ExitCode exitCode = ExitCode.forThrowable(e);
      if (exitCode == ExitCode.INTERNAL_ERROR) {
        log.error("Download failed with an internal error", e);
      } else {
        log.error("Download failed: {}", e.getMessage());
      }
      return exitCode;
    } finally {
      if (workspace != null) {
        workspace.cleanup();
      }
    }
  }

  private void exportDatabase(DatabaseExportDriver driver, Workspace workspace) {
    transition(DownloadState.DB_EXPORT);
    DatabaseJobInitResponse job = driver.start();
    try {
      driver.runToCompletion(job.getJobId());
      transition(DownloadState.DB_DOWNLOAD);
      driver.download(job.getJobId(), workspace.getDatabaseFile());
    } finally {
      driver.finish(job.getJobId());
    }
  }

  private List<ManifestEntry> collectManifest(ManifestCollector collector) {
    ManifestJobInitResponse job = collector.start();
    try {
      return collector.collect(job.getJobId(), job.getTotalFiles());
    } finally {
      collector.finish(job.getJobId());
    }
  }

  private TransferResult retrieve(
      SourceApiClient apiClient,
      DownloadConfig config,
      Partition partition,
      Path filesRoot,
      int concurrency) {
    ConcurrentRetrievalEngine engine =
        new ConcurrentRetrievalEngine(
            transportFactory.create(apiClient),
            metrics,
            config.getUnitAttempts(),
            config.getUnitRetryDelayMillis());
    ProgressAggregator aggregator = new ProgressAggregator();
    aggregator.setTotals(partition.getTotalFiles(), partition.getTotalBytes());
    try (ProgressReporter reporter =
        new ProgressReporter(aggregator, config.getProgressLogIntervalSeconds())) {
      TransferResult result =
          engine.retrieve(
              partition.getUnits(), filesRoot, concurrency, ProgressListener.NONE, aggregator);
      reporter.report();
      return result;
    }
  }

  private static Path prepareOutputDirectory(String outputDirectory) {
    Path path;
    try {
      path = Paths.get(outputDirectory).toAbsolutePath().normalize();
    } catch (InvalidPathException e) {
      throw new ValidationException("Invalid output directory: " + outputDirectory);
    }
    try {
      Files.createDirectories(path);
    } catch (IOException e) {
      throw new ValidationException("Cannot create output directory " + path + ": " + e.getMessage());
    }
    return path;
  }

  private static void deleteArchive(Path archive) {
    if (archive == null) {
      return;
    }
    try {
      Files.deleteIfExists(archive);
    } catch (IOException e) {
      log.warn("Could not remove partial archive {}: {}", archive, e.getMessage());
    }
  }

  private void transition(DownloadState next) {
    log.debug("State {} -> {}", state, next);
    state = next;
    history.add(next);
  }

  public DownloadState getState() {
    return state;
  }

  @VisibleForTesting
  List<DownloadState> getHistory() {
    return ImmutableList.copyOf(history);
  }
}
