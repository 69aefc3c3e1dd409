package io.sitepull.source.export;

import static io.sitepull.source.constants.ExportConstants.CHUNK_GROWTH_FACTOR;
import static io.sitepull.source.constants.ExportConstants.CHUNK_SHRINK_FACTOR;
import static io.sitepull.source.constants.ExportConstants.DEFAULT_CHUNK_ROWS;
import static io.sitepull.source.constants.ExportConstants.FAST_CHUNK_MILLIS;
import static io.sitepull.source.constants.ExportConstants.GZIP_LEVEL;
import static io.sitepull.source.constants.ExportConstants.KEYSET_THRESHOLD_BYTES;
import static io.sitepull.source.constants.ExportConstants.KEYSET_THRESHOLD_ROWS;
import static io.sitepull.source.constants.ExportConstants.MAX_CHUNK_ROWS;
import static io.sitepull.source.constants.ExportConstants.MIN_CHUNK_ROWS;
import static io.sitepull.source.constants.ExportConstants.SLOW_CHUNK_MILLIS;
import static io.sitepull.source.constants.ExportConstants.STREAM_VERSION;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import com.google.common.io.BaseEncoding;
import io.sitepull.source.cursor.CursorCodec;
import io.sitepull.source.cursor.ExportCursor;
import io.sitepull.source.cursor.TableInfo;
import io.sitepull.source.export.models.ChunkPerformance;
import io.sitepull.source.export.models.ChunkProgress;
import io.sitepull.source.export.models.ChunkResult;
import io.sitepull.source.export.models.Compression;
import io.sitepull.source.export.models.ExportMetadata;
import io.sitepull.source.export.models.InitResult;
import io.sitepull.source.export.models.SourceRow;
import io.sitepull.source.export.models.TableStatus;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.zip.GZIPOutputStream;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/**
 * Exports a table set in bounded time slices. Each call to {@link #next} takes the cursor token of
 * the previous call and returns the next slice of the dump together with the advanced cursor.
 *
 * <p>Tables above {@link io.sitepull.source.constants.ExportConstants#KEYSET_THRESHOLD_ROWS} rows
 * or {@link io.sitepull.source.constants.ExportConstants#KEYSET_THRESHOLD_BYTES} bytes that have a
 * single-column primary key are paged by key ({@code WHERE pk > last ORDER BY pk}), all other
 * tables by offset. The chunk size grows after fast calls and shrinks after slow ones.
 */
@Slf4j
public class ExportPaginationEngine {
  private final TableSource tableSource;
  private final CursorCodec cursorCodec;
  private final SqlDumpWriter dumpWriter;
  private final Ticker ticker;

  public ExportPaginationEngine(
      @Nonnull TableSource tableSource,
      @Nonnull CursorCodec cursorCodec,
      @Nonnull SqlDumpWriter dumpWriter,
      @Nonnull Ticker ticker) {
    this.tableSource = tableSource;
    this.cursorCodec = cursorCodec;
    this.dumpWriter = dumpWriter;
    this.ticker = ticker;
  }

  public InitResult init(@Nullable Integer chunkSizeHint) {
    int chunkSize =
        chunkSizeHint == null ? DEFAULT_CHUNK_ROWS : clampChunkSize(chunkSizeHint.longValue());

    List<String> tables = tableSource.listTables();
    long totalRows = 0;
    long totalBytes = 0;
    Map<String, TableInfo> tableInfo = new LinkedHashMap<>();
    for (String table : tables) {
      TableStatus status = tableSource.getTableStatus(table);
      totalRows += status.getRowCount();
      totalBytes += status.getByteSize();
      tableInfo.put(
          table,
          TableInfo.builder()
              .rowCountEstimate(status.getRowCount())
              .byteSizeEstimate(status.getByteSize())
              .useKeyset(
                  status.getRowCount() > KEYSET_THRESHOLD_ROWS
                      || status.getByteSize() > KEYSET_THRESHOLD_BYTES)
              .build());
    }

    ExportCursor cursor =
        ExportCursor.builder()
            .version(STREAM_VERSION)
            .sessionId("exp_" + UUID.randomUUID().toString().replace("-", ""))
            .tables(Collections.unmodifiableList(tables))
            .tableIndex(0)
            .tableName(tables.isEmpty() ? "" : tables.get(0))
            .offset(0)
            .schemaSent(false)
            .chunkSize(chunkSize)
            .complete(tables.isEmpty())
            .tableInfo(tableInfo)
            .build();

    log.info(
        "Initialized export session {}: {} tables, ~{} rows, ~{} bytes, chunk size {}",
        cursor.getSessionId(),
        tables.size(),
        totalRows,
        totalBytes,
        chunkSize);

    return InitResult.builder()
        .cursor(cursorCodec.encode(cursor))
        .preamble(dumpWriter.preamble(tableSource.describe()))
        .metadata(
            ExportMetadata.builder()
                .tables(tables)
                .totalTables(tables.size())
                .totalRows(totalRows)
                .totalBytes(totalBytes)
                .chunkSize(chunkSize)
                .build())
        .build();
  }

  /**
   * Produces the next slice. The time budget is checked before each row, after the first one, so
   * every call on an unfinished table emits at least one row. A failed source read propagates and
   * leaves the caller's cursor valid for a retry of the same slice.
   */
  public ChunkResult next(String cursorToken, Duration timeBudget, Compression compression) {
    Stopwatch stopwatch = Stopwatch.createStarted(ticker);
    ExportCursor cursor = cursorCodec.decode(cursorToken);
    ExportCursor.ExportCursorBuilder nextCursor = cursor.toBuilder();

    StringBuilder buffer = new StringBuilder();
    String progressTable = cursor.getTableName();
    int progressTableIndex = cursor.getTableIndex();
    int rowsSent = 0;
    long queryMillis = 0;
    boolean schemaEmitted = false;
    boolean keyset = false;

    if (cursor.hasCurrentTable()) {
      String table = cursor.getTableName();

      if (!cursor.isSchemaSent()) {
        buffer.append(dumpWriter.tableHeader(table, tableSource.getCreateStatement(table)));
        nextCursor.schemaSent(true);
        schemaEmitted = true;
      }

      TableInfo info = resolvePrimaryKey(table, cursor.getCurrentTableInfo());
      keyset = info.isKeysetPaginated();

      Stopwatch queryStopwatch = Stopwatch.createStarted(ticker);
      List<SourceRow> rows =
          keyset
              ? tableSource.readRowsAfterKey(
                  table,
                  info.getPrimaryKeyColumn(),
                  decodeKey(cursor.getLastPrimaryKey(), info.isPrimaryKeyBinary()),
                  cursor.getChunkSize())
              : tableSource.readRowsByOffset(table, cursor.getOffset(), cursor.getChunkSize());
      queryMillis = queryStopwatch.elapsed(TimeUnit.MILLISECONDS);

      String lastKey = cursor.getLastPrimaryKey();
      for (SourceRow row : rows) {
        if (rowsSent > 0 && stopwatch.elapsed(TimeUnit.NANOSECONDS) > timeBudget.toNanos()) {
          log.debug("Time budget exhausted on {} after {} rows", table, rowsSent);
          break;
        }
        buffer.append(dumpWriter.insert(table, row));
        rowsSent++;
        if (keyset) {
          Object key = row.get(info.getPrimaryKeyColumn());
          if (key instanceof byte[] && !info.isPrimaryKeyBinary()) {
            info = info.toBuilder().primaryKeyBinary(true).build();
          }
          lastKey = encodeKey(key);
        }
      }

      if (info != cursor.getCurrentTableInfo()) {
        Map<String, TableInfo> updated = new LinkedHashMap<>(cursor.getTableInfo());
        updated.put(table, info);
        nextCursor.tableInfo(updated);
      }

      if (keyset) {
        nextCursor.lastPrimaryKey(lastKey);
      } else {
        nextCursor.offset(cursor.getOffset() + rowsSent);
      }

      // a short page that was emitted in full means the table has no rows left
      if (rows.size() < cursor.getChunkSize() && rowsSent == rows.size()) {
        buffer.append(dumpWriter.tableFooter(table));
        int nextIndex = cursor.getTableIndex() + 1;
        nextCursor.tableIndex(nextIndex);
        if (nextIndex < cursor.getTables().size()) {
          nextCursor
              .tableName(cursor.getTables().get(nextIndex))
              .offset(0)
              .lastPrimaryKey(null)
              .schemaSent(false);
        } else {
          nextCursor.complete(true);
          buffer.append(dumpWriter.trailer());
          log.info("Export session {} complete", cursor.getSessionId());
        }
      }
    }

    long totalMillis = stopwatch.elapsed(TimeUnit.MILLISECONDS);
    int chunkSize = adjustChunkSize(cursor.getChunkSize(), totalMillis);
    nextCursor.chunkSize(chunkSize);
    ExportCursor advanced = nextCursor.build();

    byte[] plain = buffer.toString().getBytes(StandardCharsets.UTF_8);
    byte[] slice = compression == Compression.GZIP ? gzip(plain) : plain;

    return ChunkResult.builder()
        .slice(slice)
        .cursor(cursorCodec.encode(advanced))
        .complete(advanced.isComplete())
        .progress(
            ChunkProgress.builder()
                .currentTable(progressTable)
                .currentTableIndex(progressTableIndex)
                .tablesCompleted(advanced.getTableIndex())
                .rowsInChunk(rowsSent)
                .bytesInChunk(plain.length)
                .schemaEmitted(schemaEmitted)
                .build())
        .performance(
            ChunkPerformance.builder()
                .queryTimeMs(queryMillis)
                .totalTimeMs(totalMillis)
                .compression(compression)
                .chunkSizeUsed(chunkSize)
                .keysetPagination(keyset)
                .build())
        .build();
  }

  private TableInfo resolvePrimaryKey(String table, TableInfo info) {
    if (!info.isUseKeyset() || info.isPrimaryKeyResolved()) {
      return info;
    }
    List<String> keyColumns = tableSource.getPrimaryKeyColumns(table);
    String keyColumn = keyColumns.size() == 1 ? keyColumns.get(0) : null;
    if (keyColumn == null) {
      log.info("Table {} has no single-column primary key, using offset pagination", table);
    }
    return info.toBuilder().primaryKeyResolved(true).primaryKeyColumn(keyColumn).build();
  }

  @Nullable
  private static Object decodeKey(@Nullable String lastKey, boolean binary) {
    if (lastKey == null || !binary) {
      return lastKey;
    }
    return BaseEncoding.base16().decode(lastKey);
  }

  private static String encodeKey(Object key) {
    if (key instanceof byte[]) {
      return BaseEncoding.base16().encode((byte[]) key);
    }
    return String.valueOf(key);
  }

  @VisibleForTesting
  static int adjustChunkSize(int chunkSize, long elapsedMillis) {
    if (elapsedMillis < FAST_CHUNK_MILLIS && chunkSize < MAX_CHUNK_ROWS) {
      return clampChunkSize((long) (chunkSize * CHUNK_GROWTH_FACTOR));
    }
    if (elapsedMillis > SLOW_CHUNK_MILLIS && chunkSize > MIN_CHUNK_ROWS) {
      return clampChunkSize((long) (chunkSize * CHUNK_SHRINK_FACTOR));
    }
    return chunkSize;
  }

  private static int clampChunkSize(long chunkSize) {
    return (int) Math.max(MIN_CHUNK_ROWS, Math.min(chunkSize, MAX_CHUNK_ROWS));
  }

  private static byte[] gzip(byte[] data) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (GZIPOutputStream gzip =
        new GZIPOutputStream(out) {
          {
            def.setLevel(GZIP_LEVEL);
          }
        }) {
      gzip.write(data);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to compress slice", e);
    }
    return out.toByteArray();
  }
}
