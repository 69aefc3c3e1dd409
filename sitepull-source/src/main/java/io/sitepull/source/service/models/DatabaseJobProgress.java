package io.sitepull.source.service.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/** Reply to one process call of a database export job. */
@Builder
@Value
public class DatabaseJobProgress {
  @JsonProperty("job_id")
  String jobId;

  @JsonProperty("bytes_written")
  long bytesWritten;

  @JsonProperty("completed_tables")
  int completedTables;

  @JsonProperty("total_tables")
  int totalTables;

  @JsonProperty("current_table")
  String currentTable;

  @JsonProperty("rows_in_chunk")
  int rowsInChunk;

  @JsonProperty("chunk_size")
  int chunkSize;

  @JsonProperty("done")
  boolean done;
}
