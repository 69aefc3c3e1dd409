package io.sitepull.source;

import static io.sitepull.source.constants.SourceConstants.MANIFEST_ENTRIES_PER_CHUNK;
import static io.sitepull.source.constants.SourceConstants.MAX_STORED_VALUE_BYTES;

import com.google.common.base.Ticker;
import io.sitepull.source.config.SourceConfig;
import io.sitepull.source.cursor.CursorCodec;
import io.sitepull.source.export.ExportPaginationEngine;
import io.sitepull.source.export.SqlDumpWriter;
import io.sitepull.source.export.TableSource;
import io.sitepull.source.server.AccessKeyValidator;
import io.sitepull.source.server.SourceActionDispatcher;
import io.sitepull.source.service.DatabaseExportJobService;
import io.sitepull.source.service.FileScanner;
import io.sitepull.source.service.JobIdGenerator;
import io.sitepull.source.service.ManifestJobService;
import io.sitepull.source.service.SourceFileService;
import io.sitepull.source.store.DatabaseJobStore;
import io.sitepull.source.store.InMemoryTransientStore;
import io.sitepull.source.store.ManifestJobStore;
import io.sitepull.source.store.TransientStore;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.Collections;

/** Wires the endpoint components for one site root and table source. */
public final class SourceApplication {

  private SourceApplication() {}

  public static SourceActionDispatcher createDispatcher(
      SourceConfig config, TableSource tableSource, Clock clock, Ticker ticker) {
    Path root = Paths.get(config.getRootDirectory());
    Path workspace = Paths.get(config.getWorkspaceDirectory());
    TransientStore store =
        new InMemoryTransientStore(
            Duration.ofMinutes(config.getJobTtlMinutes()), MAX_STORED_VALUE_BYTES, ticker);
    CursorCodec cursorCodec = new CursorCodec();
    JobIdGenerator jobIdGenerator = new JobIdGenerator();

    ExportPaginationEngine engine =
        new ExportPaginationEngine(tableSource, cursorCodec, new SqlDumpWriter(clock), ticker);
    DatabaseExportJobService databaseJobs =
        new DatabaseExportJobService(
            engine, cursorCodec, new DatabaseJobStore(store), jobIdGenerator, workspace, clock);
    ManifestJobService manifestJobs =
        new ManifestJobService(
            new FileScanner(root, Collections.singletonList(workspace)),
            new ManifestJobStore(store, MANIFEST_ENTRIES_PER_CHUNK, clock),
            jobIdGenerator);

    return new SourceActionDispatcher(
        new AccessKeyValidator(config.getAccessKey()),
        databaseJobs,
        manifestJobs,
        new SourceFileService(root),
        Duration.ofSeconds(config.getDefaultTimeBudgetSeconds()));
  }
}
