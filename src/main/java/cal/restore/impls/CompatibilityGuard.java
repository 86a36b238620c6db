package cal.restore.impls;

import cal.restore.adapters.DatabaseAdapter;
import cal.restore.errors.PreflightFailed;
import cal.restore.types.AdapterSettings;
import cal.restore.types.BackupMetadata;
import cal.restore.types.ConnectionTest;
import lombok.extern.slf4j.Slf4j;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.util.Optional;

/**
 * Refuses restores that would put a backup into an engine that cannot take
 * it.  Runs before anything is transferred and changes nothing.
 *
 * <p>Checks, in order: the backup's engine is the target's engine; the backup
 * is not from a newer version than the target runs; for engines whose
 * editions write different formats, the editions belong to the same family.
 * A backup without sidecar metadata cannot be checked and passes.
 */
@Slf4j
public class CompatibilityGuard {

  public void check(@Nullable BackupMetadata metadata, String targetAdapterId, DatabaseAdapter target, AdapterSettings targetSettings) throws PreflightFailed {
    if (metadata == null) {
      log.info("No sidecar metadata; skipping compatibility checks");
      return;
    }

    String sourceType = metadata.getSourceType();
    if (sourceType != null && !sourceType.equals(targetAdapterId)) {
      throw new PreflightFailed("Incompatible database type: backup was taken from '" + sourceType
          + "' but the target is '" + targetAdapterId + "'");
    }

    String backupVersion = metadata.getEngineVersion();
    String backupEdition = metadata.getEngineEdition();
    boolean editionMatters = backupEdition != null && target.editionFamily(backupEdition).isPresent();
    if (backupVersion == null && !editionMatters) {
      return;
    }

    ConnectionTest live;
    try {
      live = target.test(targetSettings);
    } catch (IOException e) {
      log.warn("Could not probe target version; skipping version checks", e);
      return;
    }
    if (!live.success()) {
      log.warn("Could not probe target version ({}); skipping version checks", live.message());
      return;
    }

    if (backupVersion != null && live.version() != null) {
      checkVersion(backupVersion, live.version());
    }
    if (editionMatters && live.edition() != null) {
      checkEdition(target, backupEdition, live.edition());
    }
  }

  private static void checkVersion(String backupVersion, String targetVersion) throws PreflightFailed {
    Optional<EngineVersion> backup = EngineVersion.parse(backupVersion);
    Optional<EngineVersion> live = EngineVersion.parse(targetVersion);
    if (backup.isEmpty() || live.isEmpty()) {
      log.warn("Cannot compare versions '{}' and '{}'; skipping version check", backupVersion, targetVersion);
      return;
    }
    if (backup.get().compareTo(live.get()) > 0) {
      throw new PreflightFailed("Cannot restore backup from a newer database version (backup: " + backup.get()
          + ", target: " + live.get() + "); restoring into an older version is not supported");
    }
  }

  private static void checkEdition(DatabaseAdapter target, String backupEdition, String targetEdition) throws PreflightFailed {
    Optional<String> backupFamily = target.editionFamily(backupEdition);
    Optional<String> targetFamily = target.editionFamily(targetEdition);
    if (backupFamily.isPresent() && targetFamily.isPresent() && !backupFamily.equals(targetFamily)) {
      throw new PreflightFailed("Incompatible edition: backup was taken from '" + backupEdition
          + "' but the target runs '" + targetEdition + "'; their backup formats differ");
    }
  }

}
