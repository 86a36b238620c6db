package cal.restore;

import cal.restore.adapters.AdapterRegistry;
import cal.restore.adapters.StorageAdapter;
import cal.restore.config.CatalogFile;
import cal.restore.config.SecretBox;
import cal.restore.errors.RestoreFailed;
import cal.restore.impls.ExecutionStore;
import cal.restore.impls.InMemoryExecutionStore;
import cal.restore.impls.RestoreHandle;
import cal.restore.impls.RestoreOrchestrator;
import cal.restore.impls.SQLiteExecutionStore;
import cal.restore.types.AdapterConfig;
import cal.restore.types.AdapterKind;
import cal.restore.types.AdapterSettings;
import cal.restore.types.DatabaseMapping;
import cal.restore.types.Execution;
import cal.restore.types.ExecutionStatus;
import cal.restore.types.FileInfo;
import cal.restore.types.LogEntry;
import cal.restore.types.PrivilegedAuth;
import cal.restore.types.RestoreRequest;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

public class Main {

  private static final Duration MAX_WAIT = Duration.ofDays(1);
  private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

  private static void showHelp(Options options) {
    new HelpFormatter().printHelp("db-restore --config FILE (--list STORAGE | --restore ...)", options);
  }

  public static void main(String[] args) throws Exception {
    Options options = new Options();
    options.addOption("h", "help", false, "Show help and quit");
    options.addOption(Option.builder("c").longOpt("config").hasArg().argName("FILE").desc("Configuration file").build());
    options.addOption(Option.builder("l").longOpt("list").hasArg().argName("STORAGE").desc("List the artifacts in a storage configuration").build());
    options.addOption("r", "restore", false, "Restore an artifact");
    options.addOption(Option.builder("s").longOpt("storage").hasArg().argName("ID").desc("Storage configuration holding the artifact").build());
    options.addOption(Option.builder("f").longOpt("file").hasArg().argName("PATH").desc("Artifact path within the storage").build());
    options.addOption(Option.builder("t").longOpt("target").hasArg().argName("ID").desc("Database configuration to restore into").build());
    options.addOption(Option.builder("d").longOpt("database").hasArg().argName("NAME").desc("Restore under this database name").build());
    options.addOption(Option.builder("m").longOpt("map").hasArgs().argName("ORIG=TARGET").desc("Restore only the mapped databases of a multi-database archive; repeatable").build());
    options.addOption(Option.builder().longOpt("privileged-user").hasArg().argName("USER").desc("User to restore as, instead of the configured one").build());
    options.addOption(Option.builder().longOpt("privileged-password").hasArg().argName("PASSWORD").desc("Password for --privileged-user").build());

    CommandLine cmd;
    try {
      cmd = new DefaultParser().parse(options, args);
    } catch (ParseException e) {
      System.err.println("Failed to parse options: " + e.getMessage());
      showHelp(options);
      System.exit(1);
      return;
    }

    if (cmd.hasOption('h')) {
      showHelp(options);
      return;
    }
    if (!cmd.hasOption('c') || cmd.hasOption('l') == cmd.hasOption('r')) {
      showHelp(options);
      System.exit(1);
      return;
    }

    CatalogFile catalog;
    try {
      catalog = CatalogFile.load(Paths.get(cmd.getOptionValue('c')));
    } catch (NoSuchFileException e) {
      System.err.println("Config file '" + cmd.getOptionValue('c') + "' not found");
      System.exit(1);
      return;
    }

    AdapterRegistry registry = AdapterRegistry.discover();
    int status;
    try {
      SecretBox secrets = SecretBox.fromEnvironment();
      if (cmd.hasOption('l')) {
        status = list(catalog, registry, secrets, cmd.getOptionValue('l'));
      } else {
        status = restore(catalog, registry, secrets, cmd);
      }
    } catch (RestoreFailed e) {
      System.err.println("Restore rejected: " + e.getMessage());
      status = 1;
    }
    System.exit(status);
  }

  private static int list(CatalogFile catalog, AdapterRegistry registry, SecretBox secrets, String storageId) throws RestoreFailed, IOException {
    AdapterConfig config = catalog.findAdapterConfig(storageId)
        .filter(c -> c.kind() == AdapterKind.STORAGE)
        .orElse(null);
    if (config == null) {
      System.err.println("No storage configuration '" + storageId + "'");
      return 1;
    }
    StorageAdapter storage = registry.storage(config.adapterId());
    AdapterSettings settings = secrets.openSettings(config.parameters());
    storage.checkSettings(settings);
    List<FileInfo> files = storage.list(settings, "");
    for (FileInfo f : files) {
      System.out.println(String.format("%-60s %10s  %s", f.path(), Util.formatSize(f.size()), f.lastModified()));
    }
    return 0;
  }

  private static int restore(CatalogFile catalog, AdapterRegistry registry, SecretBox secrets, CommandLine cmd)
      throws RestoreFailed, IOException, InterruptedException, SQLException {
    RestoreRequest.RestoreRequestBuilder request = RestoreRequest.builder()
        .storageConfigId(cmd.getOptionValue('s'))
        .file(cmd.getOptionValue('f'))
        .targetSourceId(cmd.getOptionValue('t'))
        .targetDatabaseName(cmd.getOptionValue('d'));

    String[] maps = cmd.getOptionValues('m');
    if (maps != null) {
      List<DatabaseMapping> mapping = new ArrayList<>();
      for (String m : maps) {
        int eq = m.indexOf('=');
        String original = eq >= 0 ? m.substring(0, eq) : m;
        String target = eq >= 0 ? m.substring(eq + 1) : "";
        mapping.add(new DatabaseMapping(original, target, true));
      }
      request.databaseMapping(mapping);
    }

    if (cmd.hasOption("privileged-user")) {
      String password = cmd.getOptionValue("privileged-password", "");
      request.privilegedAuth(new PrivilegedAuth(cmd.getOptionValue("privileged-user"), password));
    }

    ExecutionStore store = openStore(catalog.executionsDatabase().orElse(null));
    RestoreOrchestrator orchestrator = new RestoreOrchestrator(registry, catalog, catalog, secrets, store, catalog.settings());
    try {
      RestoreHandle handle = orchestrator.startRestore(request.build());
      System.out.println("Execution " + handle.executionId());
      Execution result;
      try {
        result = handle.await(MAX_WAIT);
      } catch (TimeoutException e) {
        System.err.println("Gave up waiting for execution " + handle.executionId() + " after " + MAX_WAIT + "; stopping it");
        return 1;
      }
      for (LogEntry entry : result.logs()) {
        System.out.println(String.format("%s [%-7s] %-18s %s", entry.timestamp(), entry.level().name(), entry.stage(), entry.message()));
      }
      return result.status() == ExecutionStatus.SUCCESS ? 0 : 1;
    } finally {
      // waits at most SHUTDOWN_GRACE for a restore that outlived MAX_WAIT
      if (!orchestrator.close(SHUTDOWN_GRACE)) {
        System.err.println("Interrupted a restore that was still running");
      }
      if (store instanceof Closeable c) {
        c.close();
      }
    }
  }

  private static ExecutionStore openStore(@Nullable Path database) throws SQLException, IOException {
    return database == null ? new InMemoryExecutionStore() : new SQLiteExecutionStore(database);
  }

}
