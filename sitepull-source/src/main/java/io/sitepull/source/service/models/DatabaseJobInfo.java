package io.sitepull.source.service.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.Builder;
import lombok.Value;

@Builder
@Value
public class DatabaseJobInfo {
  @JsonProperty("job_id")
  String jobId;

  @JsonProperty("tables")
  List<String> tables;

  @JsonProperty("total_tables")
  int totalTables;

  @JsonProperty("total_rows")
  long totalRows;

  @JsonProperty("bytes_written")
  long bytesWritten;
}
