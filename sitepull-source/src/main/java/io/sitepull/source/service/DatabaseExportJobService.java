package io.sitepull.source.service;

import io.sitepull.source.cursor.CursorCodec;
import io.sitepull.source.cursor.ExportCursor;
import io.sitepull.source.exceptions.InvalidRequestException;
import io.sitepull.source.exceptions.JobNotFoundException;
import io.sitepull.source.export.ExportPaginationEngine;
import io.sitepull.source.export.models.ChunkResult;
import io.sitepull.source.export.models.Compression;
import io.sitepull.source.export.models.InitResult;
import io.sitepull.source.service.models.DatabaseJobInfo;
import io.sitepull.source.service.models.DatabaseJobProgress;
import io.sitepull.source.store.DatabaseJobStore;
import io.sitepull.source.store.models.DatabaseJobState;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Database export as a server-side job. The dump is assembled in a workspace file, one pagination
 * step per process call, and the cursor between calls lives in the {@link DatabaseJobStore}.
 * Callers must not run two process calls for the same job at once.
 */
@Slf4j
public class DatabaseExportJobService {
  private final ExportPaginationEngine engine;
  private final CursorCodec cursorCodec;
  private final DatabaseJobStore jobStore;
  private final JobIdGenerator jobIdGenerator;
  private final Path workspace;
  private final Clock clock;

  public DatabaseExportJobService(
      ExportPaginationEngine engine,
      CursorCodec cursorCodec,
      DatabaseJobStore jobStore,
      JobIdGenerator jobIdGenerator,
      Path workspace,
      Clock clock) {
    this.engine = engine;
    this.cursorCodec = cursorCodec;
    this.jobStore = jobStore;
    this.jobIdGenerator = jobIdGenerator;
    this.workspace = workspace;
    this.clock = clock;
  }

  public DatabaseJobInfo init() {
    InitResult init = engine.init(null);
    String jobId = jobIdGenerator.nextId();
    byte[] preamble = init.getPreamble().getBytes(StandardCharsets.UTF_8);
    Path dumpFile = dumpFile(jobId);
    try {
      Files.createDirectories(workspace);
      Files.write(dumpFile, preamble);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to create dump file for job " + jobId, e);
    }

    DatabaseJobState state =
        DatabaseJobState.builder()
            .cursor(init.getCursor())
            .createdAt(clock.instant().getEpochSecond())
            .totalTables(init.getMetadata().getTotalTables())
            .totalRows(init.getMetadata().getTotalRows())
            .completedTables(0)
            .bytesWritten(preamble.length)
            .done(false)
            .build();
    jobStore.save(jobId, state);
    log.info(
        "Created database job {}: {} tables, ~{} rows",
        jobId,
        state.getTotalTables(),
        state.getTotalRows());

    return DatabaseJobInfo.builder()
        .jobId(jobId)
        .tables(init.getMetadata().getTables())
        .totalTables(state.getTotalTables())
        .totalRows(state.getTotalRows())
        .bytesWritten(state.getBytesWritten())
        .build();
  }

  /**
   * Runs one pagination step and appends its slice to the dump file. When the step or the append
   * fails the stored cursor and the file are left as they were, so the call can be repeated.
   */
  public DatabaseJobProgress process(String jobId, Duration timeBudget) {
    requireJobId(jobId);
    DatabaseJobState state = jobStore.load(jobId);
    if (state.isDone()) {
      return progress(jobId, state, null, 0, 0);
    }

    ChunkResult chunk = engine.next(state.getCursor(), timeBudget, Compression.NONE);
    append(jobId, state.getBytesWritten(), chunk.getSlice());

    ExportCursor advanced = cursorCodec.decode(chunk.getCursor());
    DatabaseJobState updated =
        state.toBuilder()
            .cursor(chunk.getCursor())
            .completedTables(advanced.getTableIndex())
            .bytesWritten(state.getBytesWritten() + chunk.getSlice().length)
            .done(chunk.isComplete())
            .build();
    jobStore.save(jobId, updated);
    log.debug(
        "Database job {}: {} rows of {} ({} ms)",
        jobId,
        chunk.getProgress().getRowsInChunk(),
        chunk.getProgress().getCurrentTable(),
        chunk.getPerformance().getTotalTimeMs());
    if (updated.isDone()) {
      log.info("Database job {} complete, {} bytes", jobId, updated.getBytesWritten());
    }
    return progress(
        jobId,
        updated,
        chunk.getProgress().getCurrentTable(),
        chunk.getProgress().getRowsInChunk(),
        advanced.getChunkSize());
  }

  /** Location of the finished dump. */
  public Path download(String jobId) {
    requireJobId(jobId);
    DatabaseJobState state = jobStore.load(jobId);
    if (!state.isDone()) {
      throw new InvalidRequestException("Database export for job " + jobId + " is not finished.");
    }
    Path dumpFile = dumpFile(jobId);
    if (!Files.isRegularFile(dumpFile)) {
      throw new JobNotFoundException(jobId);
    }
    return dumpFile;
  }

  public void finish(String jobId) {
    requireJobId(jobId);
    jobStore.delete(jobId);
    try {
      Files.deleteIfExists(dumpFile(jobId));
    } catch (IOException e) {
      log.warn("Unable to delete dump file of job {}", jobId, e);
    }
    log.info("Finished database job {}", jobId);
  }

  private void append(String jobId, long expectedLength, byte[] slice) {
    Path dumpFile = dumpFile(jobId);
    if (!Files.isRegularFile(dumpFile)) {
      throw new JobNotFoundException(jobId);
    }
    try (FileChannel channel = FileChannel.open(dumpFile, StandardOpenOption.WRITE)) {
      // drop the tail of an earlier attempt whose state was never saved
      channel.truncate(expectedLength);
      channel.position(expectedLength);
      ByteBuffer buffer = ByteBuffer.wrap(slice);
      while (buffer.hasRemaining()) {
        channel.write(buffer);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to append to dump file of job " + jobId, e);
    }
  }

  private Path dumpFile(String jobId) {
    return workspace.resolve("db-" + jobId + ".sql");
  }

  private static DatabaseJobProgress progress(
      String jobId, DatabaseJobState state, String currentTable, int rows, int chunkSize) {
    return DatabaseJobProgress.builder()
        .jobId(jobId)
        .bytesWritten(state.getBytesWritten())
        .completedTables(state.getCompletedTables())
        .totalTables(state.getTotalTables())
        .currentTable(currentTable)
        .rowsInChunk(rows)
        .chunkSize(chunkSize)
        .done(state.isDone())
        .build();
  }

  private static void requireJobId(String jobId) {
    if (StringUtils.isBlank(jobId)) {
      throw new InvalidRequestException("Database job ID is required.");
    }
    if (!StringUtils.isAlphanumeric(jobId)) {
      throw new InvalidRequestException("Malformed database job ID.");
    }
  }
}
