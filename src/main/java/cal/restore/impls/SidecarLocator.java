package cal.restore.impls;

import cal.prim.ProgressListener;
import cal.restore.adapters.StorageAdapter;
import cal.restore.adapters.TextReader;
import cal.restore.types.AdapterSettings;
import cal.restore.types.BackupMetadata;
import lombok.extern.slf4j.Slf4j;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Fetches the sidecar metadata of a stored artifact.  A missing or
 * unreadable sidecar is not an error; callers fall back to guessing from the
 * file name.
 */
@Slf4j
public class SidecarLocator {

  private final StorageAdapter storage;
  private final AdapterSettings settings;

  public SidecarLocator(StorageAdapter storage, AdapterSettings settings) {
    this.storage = storage;
    this.settings = settings;
  }

  /**
   * Read the sidecar if the backend can read files directly.  Does not touch
   * the local disk.
   */
  public Optional<BackupMetadata> readDirect(String artifactPath) {
    Optional<TextReader> reader = storage.reading();
    if (reader.isEmpty()) {
      return Optional.empty();
    }
    String sidecar = SidecarFormat.sidecarPath(artifactPath);
    try {
      return parse(sidecar, reader.get().read(settings, sidecar));
    } catch (IOException e) {
      log.warn("Could not read sidecar {}", sidecar, e);
      return Optional.empty();
    }
  }

  /**
   * Read the sidecar directly if possible, otherwise download it alone into a
   * temporary directory under <code>scratchRoot</code>.  The artifact itself
   * is never transferred.
   */
  public Optional<BackupMetadata> fetch(String artifactPath, Path scratchRoot) throws IOException {
    if (storage.reading().isPresent()) {
      return readDirect(artifactPath);
    }
    Files.createDirectories(scratchRoot);
    Path dir = Files.createTempDirectory(scratchRoot, "sidecar-");
    try {
      return download(artifactPath, dir.resolve("artifact" + SidecarFormat.SUFFIX));
    } finally {
      ScratchSpace.deleteTree(dir);
    }
  }

  private Optional<BackupMetadata> download(String artifactPath, Path local) {
    String sidecar = SidecarFormat.sidecarPath(artifactPath);
    try {
      if (!storage.download(settings, sidecar, local, ProgressListener.IGNORE)) {
        return Optional.empty();
      }
      return parse(sidecar, Files.readString(local, StandardCharsets.UTF_8));
    } catch (IOException e) {
      log.info("No usable sidecar at {}: {}", sidecar, e.toString());
      return Optional.empty();
    }
  }

  private static Optional<BackupMetadata> parse(String sidecar, @Nullable String json) {
    if (json == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(SidecarFormat.parse(json));
    } catch (IOException e) {
      log.warn("Ignoring malformed sidecar {}", sidecar, e);
      return Optional.empty();
    }
  }

}
