package cal.restore.database;

import cal.restore.adapters.DatabaseAdapter;
import cal.restore.adapters.RestoreListener;
import cal.restore.adapters.RestorePreparation;
import cal.restore.adapters.SingleDatabaseRestore;
import cal.restore.errors.ConfigurationMissing;
import cal.restore.errors.PreflightFailed;
import cal.restore.types.AdapterResult;
import cal.restore.types.AdapterSettings;
import cal.restore.types.ConnectionTest;
import cal.restore.types.RestoreOverrides;
import cal.restore.types.RestoreTarget;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * SQLite databases, through the sqlite-jdbc driver.
 *
 * <p>A restore accepts either a binary database file or a SQL script such as
 * the output of <code>sqlite3 .dump</code>.  An existing database is copied to
 * <code>path.bak-&lt;millis&gt;</code> first.
 *
 * <p>Each database of a multi-database archive becomes a file next to the
 * configured one, named after its target name.
 */
public class SqliteDatabaseAdapter implements DatabaseAdapter {

  public static final String ID = "sqlite";

  private static final byte[] FILE_HEADER = "SQLite format 3\0".getBytes(StandardCharsets.US_ASCII);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Settings(String path) {
    static Settings from(AdapterSettings settings) {
      Settings s = MAPPER.convertValue(settings.asMap(), Settings.class);
      if (s.path() == null || s.path().isEmpty()) {
        throw new IllegalArgumentException("sqlite needs a 'path'");
      }
      return s;
    }
  }

  @Override
  public String id() {
    return ID;
  }

  @Override
  public String displayName() {
    return "SQLite";
  }

  /**
   * The file a restore writes.  <code>targetDatabaseName</code>, if given,
   * names a sibling file of the configured one.
   */
  static Path databaseFile(RestoreTarget target) {
    Path configured = Paths.get(Settings.from(target.settings()).path());
    String rename = target.overrides().targetDatabaseName();
    if (rename == null || rename.isEmpty()) {
      return configured;
    }
    return configured.resolveSibling(rename);
  }

  private static Connection connect(Path file) throws SQLException {
    return DriverManager.getConnection("jdbc:sqlite:" + file.toAbsolutePath());
  }

  @Override
  public void checkSettings(AdapterSettings settings) throws ConfigurationMissing {
    try {
      Settings.from(settings);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationMissing("Invalid settings: " + e.getMessage(), e);
    }
  }

  @Override
  public ConnectionTest test(AdapterSettings settings) throws IOException {
    Path file = Paths.get(Settings.from(settings).path());
    Path parent = file.toAbsolutePath().getParent();
    if (!Files.exists(file) && (parent == null || !Files.isDirectory(parent))) {
      return ConnectionTest.failed("Neither " + file + " nor its directory exists");
    }
    try (Connection conn = connect(file);
         Statement stmt = conn.createStatement();
         ResultSet rs = stmt.executeQuery("SELECT sqlite_version()")) {
      String version = rs.next() ? rs.getString(1) : null;
      return ConnectionTest.ok("Connected to " + file, version, null);
    } catch (SQLException e) {
      return ConnectionTest.failed("Cannot open " + file + ": " + e.getMessage());
    }
  }

  @Override
  public AdapterResult dump(AdapterSettings settings, Path destination, RestoreListener listener) throws IOException {
    Path file = Paths.get(Settings.from(settings).path());
    List<String> logs = new ArrayList<>();
    try (Connection conn = connect(file);
         Statement stmt = conn.createStatement()) {
      stmt.executeUpdate("backup to " + quote(destination.toAbsolutePath().toString()));
    } catch (SQLException e) {
      return AdapterResult.failed("Backup of " + file + " failed: " + e.getMessage(), logs);
    }
    String line = "Backed up " + file + " to " + destination;
    logs.add(line);
    listener.onLog(line);
    return AdapterResult.succeeded(logs);
  }

  @Override
  public AdapterResult restore(RestoreTarget target, Path sourcePath, RestoreListener listener) throws IOException {
    Path file = databaseFile(target);
    List<String> logs = new ArrayList<>();

    if (Files.exists(file)) {
      Path safety = file.resolveSibling(file.getFileName() + ".bak-" + System.currentTimeMillis());
      Files.copy(file, safety, StandardCopyOption.COPY_ATTRIBUTES);
      note(listener, logs, "Existing database saved as " + safety.getFileName());
    }

    boolean binary = isDatabaseFile(sourcePath);
    listener.onProgress(10);
    try (Connection conn = connect(file);
         Statement stmt = conn.createStatement()) {
      if (binary) {
        note(listener, logs, "Restoring database file into " + file);
        stmt.executeUpdate("restore from " + quote(sourcePath.toAbsolutePath().toString()));
      } else {
        note(listener, logs, "Executing SQL script against " + file);
        // the driver hands scripts to sqlite3_exec, which runs every statement in turn
        stmt.executeUpdate(Files.readString(sourcePath, StandardCharsets.UTF_8));
      }
    } catch (SQLException e) {
      String error = "sqlite restore failed: " + e.getMessage();
      note(listener, logs, error);
      return AdapterResult.failed(error, logs);
    }
    listener.onProgress(100);
    note(listener, logs, "Restore of " + file + " finished");
    return AdapterResult.succeeded(logs);
  }

  @Override
  public Optional<RestorePreparation> restorePreparation() {
    return Optional.of(this::checkWritable);
  }

  @Override
  public Optional<SingleDatabaseRestore> singleDatabaseRestore() {
    return Optional.of((target, dumpFile, sourceName, targetName, listener) -> {
      RestoreOverrides o = target.overrides();
      RestoreOverrides renamed = new RestoreOverrides(targetName, null, o.privilegedAuth(), o.targetVersion());
      return restore(new RestoreTarget(target.settings(), renamed), dumpFile, listener);
    });
  }

  private void checkWritable(RestoreTarget target, List<String> databaseNames) throws PreflightFailed {
    Path configured = databaseFile(target);
    List<Path> files = new ArrayList<>();
    if (databaseNames.isEmpty()) {
      files.add(configured);
    }
    for (String name : databaseNames) {
      files.add(configured.resolveSibling(name));
    }
    for (Path file : files) {
      Path dir = file.toAbsolutePath().getParent();
      if (Files.exists(file) && !Files.isWritable(file)) {
        throw new PreflightFailed("Permission denied: database file " + file + " is not writable");
      }
      if (dir == null || !Files.isDirectory(dir) || !Files.isWritable(dir)) {
        throw new PreflightFailed("Permission denied: cannot create files in " + dir);
      }
    }
  }

  static boolean isDatabaseFile(Path file) throws IOException {
    byte[] header = new byte[FILE_HEADER.length];
    int n;
    try (InputStream in = Files.newInputStream(file)) {
      n = in.readNBytes(header, 0, header.length);
    }
    return n == FILE_HEADER.length && Arrays.equals(header, FILE_HEADER);
  }

  private static String quote(String path) {
    return "'" + path.replace("'", "''") + "'";
  }

  private static void note(RestoreListener listener, List<String> logs, String line) {
    logs.add(line);
    listener.onLog(line);
  }

}
