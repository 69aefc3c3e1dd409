package io.sitepull.api.models.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
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
public class DatabaseJobInitResponse extends ApiResponse {
  @JsonProperty("job_id")
  private String jobId;

  @JsonProperty("tables")
  private List<String> tables;

  @JsonProperty("total_tables")
  private int totalTables;

  @JsonProperty("total_rows")
  private long totalRows;

  @JsonProperty("bytes_written")
  private long bytesWritten;
}
