package cal.restore.types;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * Per-restore values layered over an adapter's configured settings.
 *
 * @param targetDatabaseName rename for a single-database restore
 * @param databaseMapping selection and renames for a multi-database restore, or null for "everything, same names"
 * @param privilegedAuth credentials that replace the configured ones
 * @param targetVersion the target's live engine version, as probed just before the restore
 */
public record RestoreOverrides(
    @Nullable String targetDatabaseName,
    @Nullable List<DatabaseMapping> databaseMapping,
    @Nullable PrivilegedAuth privilegedAuth,
    @Nullable String targetVersion) {

  public static final RestoreOverrides NONE = new RestoreOverrides(null, null, null, null);

  public RestoreOverrides {
    databaseMapping = databaseMapping == null ? null : List.copyOf(databaseMapping);
  }

  public RestoreOverrides withTargetVersion(@Nullable String version) {
    return new RestoreOverrides(targetDatabaseName, databaseMapping, privilegedAuth, version);
  }

}
