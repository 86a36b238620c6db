package cal.restore.impls;

import cal.restore.types.Execution;
import cal.restore.types.ExecutionMetadata;
import cal.restore.types.ExecutionStatus;
import cal.restore.types.LogEntry;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.checkerframework.checker.calledmethods.qual.EnsuresCalledMethods;
import org.checkerframework.checker.mustcall.qual.Owning;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * An {@link ExecutionStore} in a local SQLite file.  Logs and metadata are
 * stored as JSON text, in the same shape the records are exposed in.
 */
public class SQLiteExecutionStore implements ExecutionStore, Closeable {

  private static final TypeReference<List<LogEntry>> LOG_LIST = new TypeReference<>() { };

  private final ObjectMapper mapper = new ObjectMapper()
      .registerModule(new JavaTimeModule())
      .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

  @Owning
  private final Connection conn;

  public SQLiteExecutionStore(Path filename) throws SQLException, IOException {
    Path parent = filename.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }

    Connection conn = DriverManager.getConnection("jdbc:sqlite:" + filename.toAbsolutePath());
    try {
      conn.setAutoCommit(false);
      try (Statement stmt = conn.createStatement()) {
        stmt.executeUpdate("CREATE TABLE IF NOT EXISTS executions ("
            + "id TEXT PRIMARY KEY, type TEXT NOT NULL, status TEXT NOT NULL, path TEXT NOT NULL, "
            + "logs TEXT NOT NULL, metadata TEXT NOT NULL, started_at TEXT NOT NULL, ended_at TEXT)");
      }
      conn.commit();
    } catch (Exception e) {
      try {
        conn.close();
      } catch (Exception onClose) {
        e.addSuppressed(onClose);
      }
      throw e;
    }

    this.conn = conn;
  }

  @Override
  public synchronized void save(Execution execution) throws IOException {
    String logs = mapper.writeValueAsString(execution.logs());
    String metadata = mapper.writeValueAsString(execution.metadata());
    try (PreparedStatement stmt = conn.prepareStatement(
        "INSERT OR REPLACE INTO executions (id, type, status, path, logs, metadata, started_at, ended_at) "
            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?)")) {
      stmt.setString(1, execution.id());
      stmt.setString(2, execution.type());
      stmt.setString(3, execution.status().label());
      stmt.setString(4, execution.path());
      stmt.setString(5, logs);
      stmt.setString(6, metadata);
      stmt.setString(7, execution.startedAt().toString());
      stmt.setString(8, execution.endedAt() != null ? execution.endedAt().toString() : null);
      stmt.executeUpdate();
      conn.commit();
    } catch (SQLException e) {
      throw new IOException(e);
    }
  }

  @Override
  public synchronized Optional<Execution> find(String id) throws IOException {
    try (PreparedStatement stmt = conn.prepareStatement(
        "SELECT type, status, path, logs, metadata, started_at, ended_at FROM executions WHERE id=?")) {
      stmt.setString(1, id);
      try (ResultSet rs = stmt.executeQuery()) {
        if (!rs.next()) {
          return Optional.empty();
        }
        String endedAt = rs.getString(7);
        return Optional.of(new Execution(
            id,
            rs.getString(1),
            ExecutionStatus.fromLabel(rs.getString(2)),
            rs.getString(3),
            mapper.readValue(rs.getString(4), LOG_LIST),
            mapper.readValue(rs.getString(5), ExecutionMetadata.class),
            Instant.parse(rs.getString(6)),
            endedAt != null ? Instant.parse(endedAt) : null));
      }
    } catch (SQLException e) {
      throw new IOException(e);
    }
  }

  @Override
  @EnsuresCalledMethods(value = "conn", methods = {"close"})
  public synchronized void close() throws IOException {
    try {
      conn.close();
    } catch (SQLException e) {
      throw new IOException(e);
    }
  }

}
