package io.sitepull.source.export;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.primitives.UnsignedBytes;
import io.sitepull.source.ManualTicker;
import io.sitepull.source.cursor.CursorCodec;
import io.sitepull.source.cursor.ExportCursor;
import io.sitepull.source.exceptions.InvalidCursorException;
import io.sitepull.source.exceptions.TableSourceException;
import io.sitepull.source.export.models.ChunkResult;
import io.sitepull.source.export.models.Compression;
import io.sitepull.source.export.models.InitResult;
import io.sitepull.source.export.models.SourceRow;
import io.sitepull.source.export.models.TableStatus;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.zip.GZIPInputStream;
import javax.annotation.Nullable;
import lombok.SneakyThrows;
import org.apache.commons.io.IOUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ExportPaginationEngineTest {
  private static final Duration GENEROUS_BUDGET = Duration.ofSeconds(60);
  private static final Pattern INSERT =
      Pattern.compile(
          "^INSERT INTO `([^`]+)` \\(`id`, `name`\\) VALUES \\((\\d+), ", Pattern.MULTILINE);
  private static final List<String> ID_KEY = Collections.singletonList("id");

  private final CursorCodec cursorCodec = new CursorCodec();
  private final SqlDumpWriter dumpWriter =
      new SqlDumpWriter(Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));
  private ManualTicker ticker;

  @BeforeEach
  void setUp() {
    ticker = new ManualTicker();
  }

  private ExportPaginationEngine engine(TableSource source) {
    return new ExportPaginationEngine(source, cursorCodec, dumpWriter, ticker);
  }

  @Test
  void testScenarioMixedOffsetAndKeysetTables() {
    InMemoryTableSource source =
        new InMemoryTableSource(ticker, Duration.ofSeconds(2))
            .addTable("t1", 10, ID_KEY)
            .addTable("t2", 250_000, ID_KEY)
            .addTable("t3", 5, ID_KEY);
    ExportPaginationEngine engine = engine(source);

    InitResult init = engine.init(1000);
    assertEquals(3, init.getMetadata().getTotalTables());
    assertEquals(250_015, init.getMetadata().getTotalRows());

    Map<String, Set<Long>> emitted = new HashMap<>();
    Map<String, Boolean> keysetByTable = new HashMap<>();
    int schemaEmissions = 0;
    int dataChunks = 0;
    int calls = 0;
    String cursor = init.getCursor();
    boolean complete = false;
    StringBuilder tail = new StringBuilder();
    while (!complete) {
      ChunkResult chunk = engine.next(cursor, GENEROUS_BUDGET, Compression.NONE);
      calls++;
      String slice = new String(chunk.getSlice(), StandardCharsets.UTF_8);
      schemaEmissions += countOccurrences(slice, "DROP TABLE IF EXISTS");
      if (chunk.getProgress().getRowsInChunk() > 0) {
        dataChunks++;
        keysetByTable.put(
            chunk.getProgress().getCurrentTable(), chunk.getPerformance().isKeysetPagination());
      }
      Matcher matcher = INSERT.matcher(slice);
      while (matcher.find()) {
        assertTrue(
            emitted
                .computeIfAbsent(matcher.group(1), t -> new HashSet<>())
                .add(Long.parseLong(matcher.group(2))),
            "row emitted twice");
      }
      assertEquals(1000, chunk.getPerformance().getChunkSizeUsed());
      cursor = chunk.getCursor();
      complete = chunk.isComplete();
      if (complete) {
        tail.append(slice);
      }
      assertTrue(calls < 1000, "export does not terminate");
    }

    assertEquals(3, schemaEmissions);
    assertEquals(1 + 250 + 1, dataChunks);
    assertEquals(253, calls);
    assertEquals(10, emitted.get("t1").size());
    assertEquals(250_000, emitted.get("t2").size());
    assertEquals(5, emitted.get("t3").size());
    assertFalse(keysetByTable.get("t1"));
    assertTrue(keysetByTable.get("t2"));
    assertFalse(keysetByTable.get("t3"));
    assertTrue(tail.toString().contains("-- Export completed"));
  }

  @Test
  void testKeysetCursorAdvancesStrictly() {
    InMemoryTableSource source =
        new InMemoryTableSource(ticker, Duration.ofSeconds(2)).addTable("big", 120_000, ID_KEY);
    ExportPaginationEngine engine = engine(source);

    String cursor = engine.init(5000).getCursor();
    long previous = 0;
    boolean complete = false;
    while (!complete) {
      ChunkResult chunk = engine.next(cursor, GENEROUS_BUDGET, Compression.NONE);
      ExportCursor decoded = cursorCodec.decode(chunk.getCursor());
      if (!chunk.isComplete() && chunk.getProgress().getRowsInChunk() > 0) {
        long current = Long.parseLong(decoded.getLastPrimaryKey());
        assertTrue(current > previous);
        previous = current;
      }
      cursor = chunk.getCursor();
      complete = chunk.isComplete();
    }
    assertEquals(120_000, previous);
  }

  @Test
  void testTableWithoutSingleColumnKeyFallsBackToOffset() {
    InMemoryTableSource source =
        new InMemoryTableSource(ticker, Duration.ofSeconds(2))
            .addTable("composite", 150_000, Arrays.asList("a", "b"));
    ExportPaginationEngine engine = engine(source);

    ChunkResult chunk =
        engine.next(engine.init(1000).getCursor(), GENEROUS_BUDGET, Compression.NONE);

    assertFalse(chunk.getPerformance().isKeysetPagination());
    ExportCursor decoded = cursorCodec.decode(chunk.getCursor());
    assertEquals(1000, decoded.getOffset());
    assertNull(decoded.getLastPrimaryKey());
    assertTrue(decoded.getCurrentTableInfo().isPrimaryKeyResolved());
  }

  @Test
  void testTimeBudgetTruncatesAfterOneRowWithoutLosingRows() {
    InMemoryTableSource source =
        new InMemoryTableSource(ticker, Duration.ofSeconds(6)).addTable("slow", 3, ID_KEY);
    ExportPaginationEngine engine = engine(source);
    Duration budget = Duration.ofSeconds(5);

    String cursor = engine.init(null).getCursor();
    Set<Long> ids = new HashSet<>();
    boolean complete = false;
    int calls = 0;
    while (!complete) {
      ChunkResult chunk = engine.next(cursor, budget, Compression.NONE);
      calls++;
      if (!chunk.isComplete()) {
        assertEquals(1, chunk.getProgress().getRowsInChunk());
      }
      Matcher matcher = INSERT.matcher(new String(chunk.getSlice(), StandardCharsets.UTF_8));
      while (matcher.find()) {
        assertTrue(ids.add(Long.parseLong(matcher.group(2))));
      }
      cursor = chunk.getCursor();
      complete = chunk.isComplete();
    }
    assertEquals(new HashSet<>(Arrays.asList(1L, 2L, 3L)), ids);
    assertEquals(3, calls);
  }

  @Test
  void testSlowCallsShrinkAndFastCallsGrowChunkSize() {
    InMemoryTableSource slow =
        new InMemoryTableSource(ticker, Duration.ofSeconds(4)).addTable("t", 50_000, ID_KEY);
    ExportPaginationEngine slowEngine = engine(slow);
    ChunkResult shrunk =
        slowEngine.next(slowEngine.init(1000).getCursor(), GENEROUS_BUDGET, Compression.NONE);
    assertEquals(750, shrunk.getPerformance().getChunkSizeUsed());

    InMemoryTableSource fast =
        new InMemoryTableSource(ticker, Duration.ofMillis(10)).addTable("t", 50_000, ID_KEY);
    ExportPaginationEngine fastEngine = engine(fast);
    ChunkResult grown =
        fastEngine.next(fastEngine.init(1000).getCursor(), GENEROUS_BUDGET, Compression.NONE);
    assertEquals(1500, grown.getPerformance().getChunkSizeUsed());
  }

  @Test
  void testAdjustChunkSizeStaysInBounds() {
    int size = 1000;
    for (int i = 0; i < 50; i++) {
      size = ExportPaginationEngine.adjustChunkSize(size, 10);
      assertTrue(size <= 5000);
    }
    assertEquals(5000, size);
    for (int i = 0; i < 50; i++) {
      size = ExportPaginationEngine.adjustChunkSize(size, 10_000);
      assertTrue(size >= 100);
    }
    assertEquals(100, size);
    assertEquals(1000, ExportPaginationEngine.adjustChunkSize(1000, 2000));
    assertEquals(1500, ExportPaginationEngine.adjustChunkSize(1000, 999));
    assertEquals(750, ExportPaginationEngine.adjustChunkSize(1000, 3001));
  }

  @Test
  void testInitClampsChunkSizeHint() {
    InMemoryTableSource source =
        new InMemoryTableSource(ticker, Duration.ZERO).addTable("t", 1, ID_KEY);
    assertEquals(100, engine(source).init(5).getMetadata().getChunkSize());
    assertEquals(5000, engine(source).init(100_000).getMetadata().getChunkSize());
    assertEquals(1000, engine(source).init(null).getMetadata().getChunkSize());
  }

  @Test
  void testSourceFailureLeavesCursorRetryable() {
    InMemoryTableSource source =
        new InMemoryTableSource(ticker, Duration.ofSeconds(2)).addTable("t", 20, ID_KEY);
    ExportPaginationEngine engine = engine(source);
    String cursor = engine.init(1000).getCursor();

    source.failNextReads(1);
    assertThrows(
        TableSourceException.class, () -> engine.next(cursor, GENEROUS_BUDGET, Compression.NONE));

    ChunkResult retried = engine.next(cursor, GENEROUS_BUDGET, Compression.NONE);
    assertTrue(retried.isComplete());
    assertEquals(20, retried.getProgress().getRowsInChunk());
  }

  @Test
  void testInvalidCursorIsRejected() {
    InMemoryTableSource source = new InMemoryTableSource(ticker, Duration.ZERO);
    assertThrows(
        InvalidCursorException.class,
        () -> engine(source).next("not-a-cursor", GENEROUS_BUDGET, Compression.NONE));
  }

  @Test
  @SneakyThrows
  void testGzipAppliesToSliceOnly() {
    InMemoryTableSource source =
        new InMemoryTableSource(ticker, Duration.ofSeconds(2)).addTable("t", 3, ID_KEY);
    ExportPaginationEngine engine = engine(source);
    String cursor = engine.init(1000).getCursor();

    ChunkResult plain = engine.next(cursor, GENEROUS_BUDGET, Compression.NONE);
    ChunkResult gzipped = engine.next(cursor, GENEROUS_BUDGET, Compression.GZIP);

    byte[] inflated =
        IOUtils.toByteArray(new GZIPInputStream(new ByteArrayInputStream(gzipped.getSlice())));
    assertArrayEquals(plain.getSlice(), inflated);
    assertEquals(plain.getCursor(), gzipped.getCursor());
  }

  @Test
  void testEmptyDatabaseIsCompleteAtInit() {
    ExportPaginationEngine engine = engine(new InMemoryTableSource(ticker, Duration.ZERO));
    InitResult init = engine.init(null);

    assertTrue(cursorCodec.decode(init.getCursor()).isComplete());
    ChunkResult chunk = engine.next(init.getCursor(), GENEROUS_BUDGET, Compression.NONE);
    assertTrue(chunk.isComplete());
    assertEquals(0, chunk.getProgress().getRowsInChunk());
  }

  @Test
  void testBinaryKeysAreCarriedAsBytes() {
    BinaryKeyTableSource source = new BinaryKeyTableSource(250);
    ExportPaginationEngine engine = engine(source);

    String cursor = engine.init(100).getCursor();
    ChunkResult first = engine.next(cursor, GENEROUS_BUDGET, Compression.NONE);
    assertTrue(first.getPerformance().isKeysetPagination());
    ExportCursor decoded = cursorCodec.decode(first.getCursor());
    assertEquals("0063", decoded.getLastPrimaryKey());
    assertTrue(decoded.getCurrentTableInfo().isPrimaryKeyBinary());

    cursor = first.getCursor();
    boolean complete = false;
    while (!complete) {
      ChunkResult chunk = engine.next(cursor, GENEROUS_BUDGET, Compression.NONE);
      cursor = chunk.getCursor();
      complete = chunk.isComplete();
    }

    assertNull(source.keysRequested.get(0));
    assertArrayEquals(new byte[] {0x00, 0x63}, (byte[]) source.keysRequested.get(1));
    assertEquals(250, source.rowsReturned.size());
    assertEquals(250, new HashSet<>(source.rowsReturned).size());
  }

  /** One large table {@code blobs} keyed by two-byte big-endian ids 0..n-1. */
  private static class BinaryKeyTableSource implements TableSource {
    private final int rows;
    final List<Object> keysRequested = new ArrayList<>();
    final List<Integer> rowsReturned = new ArrayList<>();

    BinaryKeyTableSource(int rows) {
      this.rows = rows;
    }

    @Override
    public List<String> listTables() {
      return Collections.singletonList("blobs");
    }

    @Override
    public TableStatus getTableStatus(String table) {
      return TableStatus.builder().rowCount(200_000).byteSize(0).build();
    }

    @Override
    public String getCreateStatement(String table) {
      return "CREATE TABLE `blobs` (`id` binary(2) NOT NULL, `name` varchar(32))";
    }

    @Override
    public List<String> getPrimaryKeyColumns(String table) {
      return ID_KEY;
    }

    @Override
    public List<SourceRow> readRowsByOffset(String table, long offset, int limit) {
      throw new AssertionError("binary keyed table must be paged by key");
    }

    @Override
    public List<SourceRow> readRowsAfterKey(
        String table, String keyColumn, @Nullable Object lastKey, int limit) {
      keysRequested.add(lastKey);
      List<SourceRow> result = new ArrayList<>();
      for (int id = 0; id < rows && result.size() < limit; id++) {
        byte[] key = {(byte) (id >> 8), (byte) id};
        if (lastKey != null
            && UnsignedBytes.lexicographicalComparator().compare(key, (byte[]) lastKey) <= 0) {
          continue;
        }
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("id", key);
        columns.put("name", "blob-" + id);
        result.add(new SourceRow(columns));
        rowsReturned.add(id);
      }
      return result;
    }

    @Override
    public String describe() {
      return "binary";
    }
  }

  private static int countOccurrences(String text, String needle) {
    int count = 0;
    int index = text.indexOf(needle);
    while (index >= 0) {
      count++;
      index = text.indexOf(needle, index + needle.length());
    }
    return count;
  }
}
