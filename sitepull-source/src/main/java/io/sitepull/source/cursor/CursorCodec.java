package io.sitepull.source.cursor;

import static io.sitepull.source.constants.ExportConstants.MAX_CHUNK_ROWS;
import static io.sitepull.source.constants.ExportConstants.MIN_CHUNK_ROWS;
import static io.sitepull.source.constants.ExportConstants.STREAM_VERSION;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.io.BaseEncoding;
import io.sitepull.source.exceptions.InvalidCursorException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.apache.commons.lang3.StringUtils;

/**
 * Converts {@link ExportCursor} to and from its token form: URL-safe Base64 over canonical JSON
 * (fixed property order, table info sorted by table name), so that re-encoding a decoded token
 * yields the same bytes.
 */
public class CursorCodec {
  private final ObjectMapper mapper;

  public CursorCodec() {
    this.mapper = new ObjectMapper();
    mapper.configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
  }

  public String encode(ExportCursor cursor) {
    try {
      byte[] json = mapper.writeValueAsBytes(cursor);
      return Base64.getUrlEncoder().encodeToString(json);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException("Failed to serialize cursor", e);
    }
  }

  public ExportCursor decode(String token) {
    if (StringUtils.isBlank(token)) {
      throw new InvalidCursorException("Cursor is required.");
    }
    byte[] json;
    try {
      json = Base64.getUrlDecoder().decode(token.trim());
    } catch (IllegalArgumentException e) {
      throw new InvalidCursorException("Invalid cursor encoding.", e);
    }
    ExportCursor cursor;
    try {
      cursor = mapper.readValue(new String(json, StandardCharsets.UTF_8), ExportCursor.class);
    } catch (IOException | NullPointerException e) {
      throw new InvalidCursorException("Invalid cursor.", e);
    }
    validate(cursor);
    return cursor;
  }

  private void validate(ExportCursor cursor) {
    if (!STREAM_VERSION.equals(cursor.getVersion())) {
      throw new InvalidCursorException("Unsupported cursor version: " + cursor.getVersion());
    }
    int tableCount = cursor.getTables().size();
    if (cursor.getTableIndex() < 0 || cursor.getTableIndex() > tableCount) {
      throw new InvalidCursorException("Cursor table index out of range.");
    }
    if (cursor.isComplete() != (cursor.getTableIndex() == tableCount)) {
      throw new InvalidCursorException("Cursor completion flag does not match table index.");
    }
    if (cursor.getTableIndex() < tableCount
        && !cursor.getTables().get(cursor.getTableIndex()).equals(cursor.getTableName())) {
      throw new InvalidCursorException("Cursor table name does not match table index.");
    }
    if (cursor.getChunkSize() < MIN_CHUNK_ROWS || cursor.getChunkSize() > MAX_CHUNK_ROWS) {
      throw new InvalidCursorException("Cursor chunk size out of range.");
    }
    if (cursor.getOffset() < 0) {
      throw new InvalidCursorException("Cursor offset is negative.");
    }
    for (String table : cursor.getTables()) {
      if (!cursor.getTableInfo().containsKey(table)) {
        throw new InvalidCursorException("Cursor has no table info for " + table);
      }
    }
    if (cursor.hasCurrentTable()
        && cursor.getCurrentTableInfo().isPrimaryKeyBinary()
        && cursor.getLastPrimaryKey() != null
        && !BaseEncoding.base16().canDecode(cursor.getLastPrimaryKey())) {
      throw new InvalidCursorException("Cursor binary key is not hex encoded.");
    }
  }
}
