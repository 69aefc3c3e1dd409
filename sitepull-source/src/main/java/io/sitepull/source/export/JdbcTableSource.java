package io.sitepull.source.export;

import io.sitepull.source.exceptions.TableSourceException;
import io.sitepull.source.export.models.SourceRow;
import io.sitepull.source.export.models.TableStatus;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link TableSource} over a MySQL-compatible database. Each call opens its own connection, so the
 * source keeps no state between export requests.
 */
@Slf4j
public class JdbcTableSource implements TableSource {

  @FunctionalInterface
  public interface ConnectionFactory {
    Connection open() throws SQLException;
  }

  private final ConnectionFactory connectionFactory;

  public JdbcTableSource(ConnectionFactory connectionFactory) {
    this.connectionFactory = connectionFactory;
  }

  public static JdbcTableSource forUrl(String jdbcUrl, String user, String password) {
    return new JdbcTableSource(() -> DriverManager.getConnection(jdbcUrl, user, password));
  }

  @Override
  public List<String> listTables() {
    try (Connection connection = connectionFactory.open();
        Statement statement = connection.createStatement();
        ResultSet rs = statement.executeQuery("SHOW TABLES")) {
      List<String> tables = new ArrayList<>();
      while (rs.next()) {
        tables.add(rs.getString(1));
      }
      return tables;
    } catch (SQLException e) {
      throw new TableSourceException("Unable to list database tables.", e);
    }
  }

  @Override
  public TableStatus getTableStatus(String table) {
    try (Connection connection = connectionFactory.open();
        PreparedStatement statement = connection.prepareStatement("SHOW TABLE STATUS LIKE ?")) {
      statement.setString(1, table);
      try (ResultSet rs = statement.executeQuery()) {
        if (!rs.next()) {
          return TableStatus.builder().rowCount(0).byteSize(0).build();
        }
        return TableStatus.builder()
            .rowCount(rs.getLong("Rows"))
            .byteSize(rs.getLong("Data_length") + rs.getLong("Index_length"))
            .build();
      }
    } catch (SQLException e) {
      throw new TableSourceException("Unable to read table status for " + table, e);
    }
  }

  @Override
  public String getCreateStatement(String table) {
    try (Connection connection = connectionFactory.open();
        Statement statement = connection.createStatement();
        ResultSet rs =
            statement.executeQuery("SHOW CREATE TABLE " + SqlDumpWriter.quoteIdentifier(table))) {
      if (!rs.next()) {
        throw new TableSourceException("No CREATE TABLE statement returned for " + table);
      }
      return rs.getString(2);
    } catch (SQLException e) {
      throw new TableSourceException("Unable to fetch CREATE TABLE for " + table, e);
    }
  }

  @Override
  public List<String> getPrimaryKeyColumns(String table) {
    try (Connection connection = connectionFactory.open()) {
      DatabaseMetaData metaData = connection.getMetaData();
      List<String> columns = new ArrayList<>();
      try (ResultSet rs = metaData.getPrimaryKeys(connection.getCatalog(), null, table)) {
        while (rs.next()) {
          columns.add(rs.getString("COLUMN_NAME"));
        }
      }
      return columns;
    } catch (SQLException e) {
      throw new TableSourceException("Unable to read primary key of " + table, e);
    }
  }

  @Override
  public List<SourceRow> readRowsByOffset(String table, long offset, int limit) {
    String sql = "SELECT * FROM " + SqlDumpWriter.quoteIdentifier(table) + " LIMIT ? OFFSET ?";
    try (Connection connection = connectionFactory.open();
        PreparedStatement statement = connection.prepareStatement(sql)) {
      statement.setInt(1, limit);
      statement.setLong(2, offset);
      return readRows(statement);
    } catch (SQLException e) {
      throw new TableSourceException("Unable to select rows for " + table, e);
    }
  }

  @Override
  public List<SourceRow> readRowsAfterKey(
      String table, String keyColumn, @Nullable Object lastKey, int limit) {
    String quotedKey = SqlDumpWriter.quoteIdentifier(keyColumn);
    String sql =
        "SELECT * FROM "
            + SqlDumpWriter.quoteIdentifier(table)
            + (lastKey == null ? "" : " WHERE " + quotedKey + " > ?")
            + " ORDER BY "
            + quotedKey
            + " LIMIT ?";
    try (Connection connection = connectionFactory.open();
        PreparedStatement statement = connection.prepareStatement(sql)) {
      int index = 1;
      if (lastKey instanceof byte[]) {
        statement.setBytes(index++, (byte[]) lastKey);
      } else if (lastKey != null) {
        statement.setString(index++, lastKey.toString());
      }
      statement.setInt(index, limit);
      return readRows(statement);
    } catch (SQLException e) {
      throw new TableSourceException("Unable to select rows for " + table, e);
    }
  }

  @Override
  public String describe() {
    try (Connection connection = connectionFactory.open()) {
      DatabaseMetaData metaData = connection.getMetaData();
      return metaData.getDatabaseProductName() + " " + metaData.getDatabaseProductVersion();
    } catch (SQLException e) {
      log.warn("Unable to read database product information", e);
      return "unknown";
    }
  }

  private static List<SourceRow> readRows(PreparedStatement statement) throws SQLException {
    List<SourceRow> rows = new ArrayList<>();
    try (ResultSet rs = statement.executeQuery()) {
      ResultSetMetaData metaData = rs.getMetaData();
      int columnCount = metaData.getColumnCount();
      while (rs.next()) {
        Map<String, Object> columns = new LinkedHashMap<>();
        for (int i = 1; i <= columnCount; i++) {
          columns.put(metaData.getColumnLabel(i), rs.getObject(i));
        }
        rows.add(new SourceRow(columns));
      }
    }
    return rows;
  }
}
