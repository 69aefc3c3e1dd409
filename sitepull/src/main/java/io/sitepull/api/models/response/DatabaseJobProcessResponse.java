package io.sitepull.api.models.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Builder
@Getter
@AllArgsConstructor
@NoArgsConstructor
@ToString
public class DatabaseJobProcessResponse extends ApiResponse {
  @JsonProperty("job_id")
  private String jobId;

  @JsonProperty("bytes_written")
  private long bytesWritten;

  @JsonProperty("completed_tables")
  private int completedTables;

  @JsonProperty("total_tables")
  private int totalTables;

  @JsonProperty("current_table")
  private String currentTable;

  @JsonProperty("rows_in_chunk")
  private int rowsInChunk;

  @JsonProperty("chunk_size")
  private int chunkSize;

  @JsonProperty("done")
  private boolean done;
}
