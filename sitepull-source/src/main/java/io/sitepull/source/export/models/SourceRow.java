package io.sitepull.source.export.models;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.NonNull;
import lombok.Value;

/** One row read from a table, columns in table order. */
@Value
public class SourceRow {
  @NonNull Map<String, Object> columns;

  public Object get(String column) {
    return columns.get(column);
  }

  public List<String> getColumnNames() {
    return new ArrayList<>(columns.keySet());
  }
}
