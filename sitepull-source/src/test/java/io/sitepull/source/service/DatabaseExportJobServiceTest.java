package io.sitepull.source.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.sitepull.source.ManualTicker;
import io.sitepull.source.cursor.CursorCodec;
import io.sitepull.source.exceptions.InvalidRequestException;
import io.sitepull.source.exceptions.JobNotFoundException;
import io.sitepull.source.exceptions.TableSourceException;
import io.sitepull.source.export.ExportPaginationEngine;
import io.sitepull.source.export.InMemoryTableSource;
import io.sitepull.source.export.SqlDumpWriter;
import io.sitepull.source.service.models.DatabaseJobInfo;
import io.sitepull.source.service.models.DatabaseJobProgress;
import io.sitepull.source.store.DatabaseJobStore;
import io.sitepull.source.store.InMemoryTransientStore;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import lombok.SneakyThrows;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DatabaseExportJobServiceTest {
  private static final Duration BUDGET = Duration.ofSeconds(5);

  @TempDir Path workspace;
  private InMemoryTableSource tableSource;
  private DatabaseExportJobService service;

  @BeforeEach
  void setUp() {
    ManualTicker ticker = new ManualTicker();
    Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
    tableSource =
        new InMemoryTableSource(ticker, Duration.ofMillis(1500))
            .addTable("wp_options", 250, Collections.singletonList("id"))
            .addTable("wp_posts", 40, Collections.singletonList("id"));
    CursorCodec codec = new CursorCodec();
    service =
        new DatabaseExportJobService(
            new ExportPaginationEngine(tableSource, codec, new SqlDumpWriter(clock), ticker),
            codec,
            new DatabaseJobStore(
                new InMemoryTransientStore(Duration.ofMinutes(15), 1024 * 1024, ticker)),
            new JobIdGenerator(),
            workspace,
            clock);
  }

  @Test
  @SneakyThrows
  void testProcessUntilDoneThenDownloadAndFinish() {
    DatabaseJobInfo info = service.init();
    assertEquals(2, info.getTotalTables());
    assertEquals(290, info.getTotalRows());
    assertEquals(20, info.getJobId().length());

    DatabaseJobProgress progress;
    int calls = 0;
    do {
      progress = service.process(info.getJobId(), BUDGET);
      calls++;
    } while (!progress.isDone() && calls < 10);

    assertTrue(progress.isDone());
    assertEquals(2, progress.getCompletedTables());
    Path dump = service.download(info.getJobId());
    String sql = new String(Files.readAllBytes(dump), StandardCharsets.UTF_8);
    assertEquals(progress.getBytesWritten(), Files.size(dump));
    assertTrue(sql.startsWith("-- SitePull Database Export"));
    assertEquals(290, sql.split("\nINSERT INTO ", -1).length - 1);
    assertTrue(sql.endsWith("COLLATION_CONNECTION=@OLD_COLLATION_CONNECTION */;\n"));

    service.finish(info.getJobId());
    assertFalse(Files.exists(dump));
    assertThrows(JobNotFoundException.class, () -> service.process(info.getJobId(), BUDGET));
  }

  @Test
  @SneakyThrows
  void testFailedStepKeepsDumpAndCursor() {
    DatabaseJobInfo info = service.init();
    DatabaseJobProgress first = service.process(info.getJobId(), BUDGET);

    tableSource.failNextReads(1);
    assertThrows(TableSourceException.class, () -> service.process(info.getJobId(), BUDGET));

    DatabaseJobProgress retried = service.process(info.getJobId(), BUDGET);
    assertTrue(retried.getBytesWritten() > first.getBytesWritten());
    assertEquals(
        retried.getBytesWritten(),
        Files.size(workspace.resolve("db-" + info.getJobId() + ".sql")));
  }

  @Test
  void testDownloadBeforeDoneIsRejected() {
    DatabaseJobInfo info = service.init();
    assertThrows(InvalidRequestException.class, () -> service.download(info.getJobId()));
  }

  @Test
  void testMalformedJobIdIsRejected() {
    assertThrows(InvalidRequestException.class, () -> service.finish("../../etc"));
    assertThrows(InvalidRequestException.class, () -> service.process("", BUDGET));
  }
}
