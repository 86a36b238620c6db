package cal.restore.adapters;

import cal.restore.types.AdapterKind;
import cal.restore.types.AdapterResult;
import cal.restore.types.AdapterSettings;
import cal.restore.types.RestoreTarget;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

public interface DatabaseAdapter extends Adapter {

  @Override
  default AdapterKind kind() {
    return AdapterKind.DATABASE;
  }

  /**
   * Write a backup of the configured database to <code>destination</code>.
   */
  AdapterResult dump(AdapterSettings settings, Path destination, RestoreListener listener) throws IOException;

  /**
   * Restore the dump at <code>sourcePath</code> into the target.  Failures of
   * the engine's tooling are reported in the result, with the tool's error
   * text, rather than thrown.
   */
  AdapterResult restore(RestoreTarget target, Path sourcePath, RestoreListener listener) throws IOException;

  default Optional<RestorePreparation> restorePreparation() {
    return Optional.empty();
  }

  default Optional<SingleDatabaseRestore> singleDatabaseRestore() {
    return Optional.empty();
  }

  /**
   * For engines whose editions write incompatible backups, the family an
   * edition string belongs to.  Backups only restore within a family.
   * Empty for engines where the edition does not matter.
   */
  default Optional<String> editionFamily(String edition) {
    return Optional.empty();
  }

}
