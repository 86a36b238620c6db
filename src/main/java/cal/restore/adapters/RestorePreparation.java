package cal.restore.adapters;

import cal.restore.errors.PreflightFailed;
import cal.restore.types.RestoreTarget;

import java.io.IOException;
import java.util.List;

/**
 * Optional database capability: check, without changing anything, that the
 * restore would be allowed to write the given databases.
 */
@FunctionalInterface
public interface RestorePreparation {

  /**
   * @throws PreflightFailed with a message naming the missing privilege
   */
  void prepare(RestoreTarget target, List<String> databaseNames) throws PreflightFailed, IOException;

}
