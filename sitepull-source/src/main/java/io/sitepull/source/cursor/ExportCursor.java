package io.sitepull.source.cursor;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Resume state of a database export. Travels between requests as an opaque token produced by
 * {@link CursorCodec}; the endpoint holds no export state in memory between calls.
 */
@Builder(toBuilder = true)
@Value
@Jacksonized
@JsonPropertyOrder({
  "version",
  "session_id",
  "tables",
  "table_index",
  "table_name",
  "offset",
  "last_primary_key",
  "schema_sent",
  "chunk_size",
  "is_complete",
  "table_info"
})
public class ExportCursor {
  @NonNull
  @JsonProperty("version")
  String version;

  @NonNull
  @JsonProperty("session_id")
  String sessionId;

  @NonNull
  @JsonProperty("tables")
  List<String> tables;

  @JsonProperty("table_index")
  int tableIndex;

  @NonNull
  @JsonProperty("table_name")
  String tableName;

  @JsonProperty("offset")
  long offset;

  @Nullable
  @JsonProperty("last_primary_key")
  String lastPrimaryKey;

  @JsonProperty("schema_sent")
  boolean schemaSent;

  @JsonProperty("chunk_size")
  int chunkSize;

  @JsonProperty("is_complete")
  boolean complete;

  @NonNull
  @JsonProperty("table_info")
  Map<String, TableInfo> tableInfo;

  @JsonIgnore
  public boolean hasCurrentTable() {
    return !complete && tableIndex < tables.size();
  }

  @JsonIgnore
  public TableInfo getCurrentTableInfo() {
    return tableInfo.get(tableName);
  }
}
