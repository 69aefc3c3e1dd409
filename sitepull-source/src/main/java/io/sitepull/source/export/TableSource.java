package io.sitepull.source.export;

import io.sitepull.source.export.models.SourceRow;
import io.sitepull.source.export.models.TableStatus;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Read-only view of the database being exported. Implementations throw {@link
 * io.sitepull.source.exceptions.TableSourceException} on read failures.
 */
public interface TableSource {
  List<String> listTables();

  /** Row and byte estimates, used only to pick a pagination strategy. */
  TableStatus getTableStatus(String table);

  String getCreateStatement(String table);

  List<String> getPrimaryKeyColumns(String table);

  List<SourceRow> readRowsByOffset(String table, long offset, int limit);

  /**
   * Reads rows ordered by {@code keyColumn} whose key is greater than {@code lastKey}, or the first
   * rows in key order when {@code lastKey} is null. The key is a {@code byte[]} for binary key
   * columns and a {@code String} otherwise.
   */
  List<SourceRow> readRowsAfterKey(
      String table, String keyColumn, @Nullable Object lastKey, int limit);

  /** Short description of the source for dump headers. */
  String describe();
}
