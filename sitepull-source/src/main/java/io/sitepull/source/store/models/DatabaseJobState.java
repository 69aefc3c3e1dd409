package io.sitepull.source.store.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Server-side record of a database export job between process calls. */
@Builder(toBuilder = true)
@Value
@Jacksonized
public class DatabaseJobState {
  @NonNull
  @JsonProperty("cursor")
  String cursor;

  @JsonProperty("created_at")
  long createdAt;

  @JsonProperty("total_tables")
  int totalTables;

  @JsonProperty("total_rows")
  long totalRows;

  @JsonProperty("completed_tables")
  int completedTables;

  @JsonProperty("bytes_written")
  long bytesWritten;

  @JsonProperty("done")
  boolean done;
}
