package cal.restore.adapters;

import cal.restore.types.AdapterResult;
import cal.restore.types.RestoreTarget;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Optional database capability: restore one database's dump under a
 * possibly different name.  Multi-database archives need it.
 */
@FunctionalInterface
public interface SingleDatabaseRestore {

  AdapterResult restoreDatabase(RestoreTarget target, Path dumpFile, String sourceName, String targetName, RestoreListener listener) throws IOException;

}
