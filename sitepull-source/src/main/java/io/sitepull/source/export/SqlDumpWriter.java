package io.sitepull.source.export;

import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;
import com.google.common.io.BaseEncoding;
import io.sitepull.source.export.models.SourceRow;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;

/** Renders the statements of a MySQL-compatible dump, one fragment at a time. */
public class SqlDumpWriter {
  private static final DateTimeFormatter HEADER_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  private static final Escaper STRING_ESCAPER =
      Escapers.builder()
          .addEscape('\\', "\\\\")
          .addEscape('\'', "\\'")
          .addEscape('\0', "\\0")
          .addEscape('\n', "\\n")
          .addEscape('\r', "\\r")
          .addEscape('\u001a', "\\Z")
          .build();

  private final Clock clock;

  public SqlDumpWriter(Clock clock) {
    this.clock = clock;
  }

  public String preamble(String sourceDescription) {
    StringBuilder sb = new StringBuilder();
    sb.append("-- SitePull Database Export\n");
    sb.append("-- Generated: ").append(LocalDateTime.now(clock).format(HEADER_TIMESTAMP)).append('\n');
    sb.append("-- Source: ").append(sourceDescription).append("\n\n");
    sb.append("SET SQL_MODE = 'NO_AUTO_VALUE_ON_ZERO';\n");
    sb.append("SET time_zone = '+00:00';\n");
    sb.append("SET foreign_key_checks = 0;\n\n");
    sb.append("/*!40101 SET @OLD_CHARACTER_SET_CLIENT=@@CHARACTER_SET_CLIENT */;\n");
    sb.append("/*!40101 SET @OLD_CHARACTER_SET_RESULTS=@@CHARACTER_SET_RESULTS */;\n");
    sb.append("/*!40101 SET @OLD_COLLATION_CONNECTION=@@COLLATION_CONNECTION */;\n");
    sb.append("/*!40101 SET NAMES utf8mb4 */;\n\n");
    return sb.toString();
  }

  public String tableHeader(String table, String createStatement) {
    String quoted = quoteIdentifier(table);
    return "\n-- Table: "
        + table
        + "\n"
        + "DROP TABLE IF EXISTS "
        + quoted
        + ";\n"
        + createStatement
        + ";\n\n"
        + "LOCK TABLES "
        + quoted
        + " WRITE;\n"
        + "/*!40000 ALTER TABLE "
        + quoted
        + " DISABLE KEYS */;\n\n";
  }

  public String insert(String table, SourceRow row) {
    List<String> columns = row.getColumnNames();
    String columnList =
        columns.stream().map(SqlDumpWriter::quoteIdentifier).collect(Collectors.joining(", "));
    String values =
        columns.stream().map(c -> literal(row.get(c))).collect(Collectors.joining(", "));
    return "INSERT INTO " + quoteIdentifier(table) + " (" + columnList + ") VALUES (" + values + ");\n";
  }

  public String tableFooter(String table) {
    String quoted = quoteIdentifier(table);
    return "\n/*!40000 ALTER TABLE " + quoted + " ENABLE KEYS */;\n" + "UNLOCK TABLES;\n\n";
  }

  public String trailer() {
    return "\n-- Export completed\n"
        + "/*!40101 SET CHARACTER_SET_CLIENT=@OLD_CHARACTER_SET_CLIENT */;\n"
        + "/*!40101 SET CHARACTER_SET_RESULTS=@OLD_CHARACTER_SET_RESULTS */;\n"
        + "/*!40101 SET COLLATION_CONNECTION=@OLD_COLLATION_CONNECTION */;\n";
  }

  static String quoteIdentifier(String identifier) {
    return "`" + identifier.replace("`", "``") + "`";
  }

  static String literal(Object value) {
    if (value == null) {
      return "NULL";
    }
    if (value instanceof Boolean) {
      return ((Boolean) value) ? "1" : "0";
    }
    if (value instanceof BigDecimal) {
      return ((BigDecimal) value).toPlainString();
    }
    if (value instanceof Number) {
      return value.toString();
    }
    if (value instanceof byte[]) {
      byte[] bytes = (byte[]) value;
      return bytes.length == 0 ? "''" : "0x" + BaseEncoding.base16().encode(bytes);
    }
    return "'" + STRING_ESCAPER.escape(value.toString()) + "'";
  }
}
