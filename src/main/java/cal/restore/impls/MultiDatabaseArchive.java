package cal.restore.impls;

import cal.restore.Util;
import cal.restore.adapters.DatabaseAdapter;
import cal.restore.adapters.RestoreListener;
import cal.restore.adapters.RestorePreparation;
import cal.restore.adapters.SingleDatabaseRestore;
import cal.restore.errors.AdapterRestoreFailed;
import cal.restore.errors.RestoreFailed;
import cal.restore.types.AdapterResult;
import cal.restore.types.DatabaseMapping;
import cal.restore.types.Manifest;
import cal.restore.types.RestoreTarget;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Restores a composite backup: a TAR archive whose first member is
 * <code>manifest.json</code>, followed by one dump per database.
 *
 * <p>The archive is unpacked into its own scratch directory, which is removed
 * afterwards whatever the outcome.  Each database is restored through the
 * adapter's {@link SingleDatabaseRestore}, possibly under a new name.
 */
@Slf4j
public class MultiDatabaseArchive {

  private static final ObjectMapper MAPPER = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private static final int TAR_MAGIC_OFFSET = 257;
  private static final byte[] TAR_MAGIC = "ustar".getBytes(StandardCharsets.US_ASCII);

  /**
   * True if <code>file</code> is a TAR archive that starts with a manifest.
   */
  public static boolean isArchive(Path file) throws IOException {
    byte[] header = new byte[512];
    int n;
    try (InputStream in = Files.newInputStream(file)) {
      n = Util.readChunk(in, header);
    }
    if (n < TAR_MAGIC_OFFSET + TAR_MAGIC.length) {
      return false;
    }
    byte[] magic = Arrays.copyOfRange(header, TAR_MAGIC_OFFSET, TAR_MAGIC_OFFSET + TAR_MAGIC.length);
    if (!Arrays.equals(magic, TAR_MAGIC)) {
      return false;
    }
    try (TarArchiveInputStream tar = new TarArchiveInputStream(Util.buffered(Files.newInputStream(file)))) {
      TarArchiveEntry first = tar.getNextEntry();
      return first != null && Manifest.FILE_NAME.equals(stripDotSlash(first.getName()));
    }
  }

  /**
   * Whether a database is part of the restore.  Without a mapping everything
   * is; with one, only databases it lists as selected.
   */
  public static boolean shouldRestore(String databaseName, @Nullable List<DatabaseMapping> mapping) {
    if (mapping == null || mapping.isEmpty()) {
      return true;
    }
    return find(databaseName, mapping).map(DatabaseMapping::selected).orElse(false);
  }

  /**
   * The name a database is restored under: its mapped name, else its own.
   */
  public static String targetName(String databaseName, @Nullable List<DatabaseMapping> mapping) {
    if (mapping == null) {
      return databaseName;
    }
    return find(databaseName, mapping).map(DatabaseMapping::effectiveTargetName).orElse(databaseName);
  }

  private static Optional<DatabaseMapping> find(String databaseName, List<DatabaseMapping> mapping) {
    return mapping.stream().filter(m -> m.originalName().equals(databaseName)).findFirst();
  }

  private record Planned(Manifest.Entry entry, String targetName) {
  }

  public AdapterResult restore(Path archive, RestoreTarget target, DatabaseAdapter adapter, ScratchSpace scratch, RestoreListener listener) throws RestoreFailed, IOException {
    SingleDatabaseRestore primitive = adapter.singleDatabaseRestore().orElseThrow(() ->
        new AdapterRestoreFailed("Adapter '" + adapter.id() + "' cannot restore multi-database archives"));

    List<String> logs = new ArrayList<>();
    Path dir = scratch.newDirectory("archive-");
    try {
      extract(archive, dir);
      Manifest manifest = readManifest(dir);
      note(listener, logs, "Archive contains " + manifest.databases().size() + " database(s)");

      List<DatabaseMapping> mapping = target.overrides().databaseMapping();
      List<Planned> plan = new ArrayList<>();
      for (Manifest.Entry entry : manifest.databases()) {
        if (shouldRestore(entry.name(), mapping)) {
          plan.add(new Planned(entry, targetName(entry.name(), mapping)));
        } else {
          note(listener, logs, "Skipping database '" + entry.name() + "' (not selected)");
        }
      }
      if (plan.isEmpty()) {
        note(listener, logs, "No databases selected; nothing to restore");
        return AdapterResult.succeeded(logs);
      }

      Optional<RestorePreparation> preparation = adapter.restorePreparation();
      if (preparation.isPresent()) {
        preparation.get().prepare(target, plan.stream().map(Planned::targetName).toList());
      }

      int total = plan.size();
      for (int i = 0; i < total; ++i) {
        Planned p = plan.get(i);
        Path dump = member(dir, p.entry().archiveFilename());
        String source = p.entry().name();
        note(listener, logs, source.equals(p.targetName())
            ? "Restoring database '" + source + "'"
            : "Restoring database '" + source + "' as '" + p.targetName() + "'");

        int done = i;
        RestoreListener perDatabase = new RestoreListener() {
          @Override
          public void onLog(String line) {
            listener.onLog(line);
          }

          @Override
          public void onProgress(int percent) {
            listener.onProgress((done * 100 + Math.max(0, Math.min(100, percent))) / total);
          }
        };
        AdapterResult result = primitive.restoreDatabase(target, dump, source, p.targetName(), perDatabase);
        logs.addAll(result.logs());
        if (!result.success()) {
          String error = result.error() != null ? result.error() : "restore of database '" + source + "' failed";
          return AdapterResult.failed(error, logs);
        }
        listener.onProgress(Util.percentOf(i + 1, total));
      }
      return AdapterResult.succeeded(logs);
    } finally {
      ScratchSpace.deleteTree(dir);
    }
  }

  private static void note(RestoreListener listener, List<String> logs, String line) {
    logs.add(line);
    listener.onLog(line);
  }

  static void extract(Path archive, Path dir) throws IOException {
    Path root = dir.toAbsolutePath().normalize();
    try (TarArchiveInputStream tar = new TarArchiveInputStream(Util.buffered(Files.newInputStream(archive)))) {
      TarArchiveEntry entry;
      while ((entry = tar.getNextEntry()) != null) {
        Path out = root.resolve(entry.getName()).normalize();
        if (!out.startsWith(root) || out.equals(root)) {
          throw new IOException("Archive entry '" + entry.getName() + "' points outside the extraction directory");
        }
        if (entry.isDirectory()) {
          Files.createDirectories(out);
          continue;
        }
        if (!entry.isFile()) {
          log.debug("Ignoring non-regular archive entry {}", entry.getName());
          continue;
        }
        Path parent = out.getParent();
        if (parent != null) {
          Files.createDirectories(parent);
        }
        try (OutputStream o = Files.newOutputStream(out)) {
          Util.copyStream(tar, o);
        }
      }
    }
  }

  private static Manifest readManifest(Path dir) throws IOException, AdapterRestoreFailed {
    Path file = dir.resolve(Manifest.FILE_NAME);
    if (!Files.isRegularFile(file)) {
      throw new AdapterRestoreFailed("Archive has no " + Manifest.FILE_NAME);
    }
    try (InputStream in = Files.newInputStream(file)) {
      return MAPPER.readValue(in, Manifest.class);
    }
  }

  private static Path member(Path dir, @Nullable String name) throws AdapterRestoreFailed {
    if (name == null || name.isEmpty()) {
      throw new AdapterRestoreFailed("Manifest entry has no file name");
    }
    Path root = dir.toAbsolutePath().normalize();
    Path file = root.resolve(name).normalize();
    if (!file.startsWith(root) || !Files.isRegularFile(file)) {
      throw new AdapterRestoreFailed("Archive member '" + name + "' listed in the manifest is missing");
    }
    return file;
  }

  private static String stripDotSlash(String name) {
    return name.startsWith("./") ? name.substring(2) : name;
  }

}
