package io.sitepull.source.cursor;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Size estimates and the pagination strategy chosen for one table. */
@Builder(toBuilder = true)
@Value
@Jacksonized
@JsonPropertyOrder({
  "row_count_estimate",
  "byte_size_estimate",
  "use_keyset",
  "primary_key_resolved",
  "primary_key_column",
  "primary_key_binary"
})
public class TableInfo {
  @JsonProperty("row_count_estimate")
  long rowCountEstimate;

  @JsonProperty("byte_size_estimate")
  long byteSizeEstimate;

  // candidate for keyset pagination; the key still has to be a single column
  @JsonProperty("use_keyset")
  boolean useKeyset;

  @JsonProperty("primary_key_resolved")
  boolean primaryKeyResolved;

  @Nullable
  @JsonProperty("primary_key_column")
  String primaryKeyColumn;

  // binary keys are carried in the cursor as hex
  @JsonProperty("primary_key_binary")
  boolean primaryKeyBinary;

  @JsonIgnore
  public boolean isKeysetPaginated() {
    return useKeyset && primaryKeyColumn != null;
  }
}
