package cal.restore.types;

import lombok.Builder;
import lombok.Value;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

@Value
@Builder
public class RestoreRequest {
  /** Adapter configuration id of the storage holding the artifact. */
  String storageConfigId;
  /** Path of the artifact within that storage. */
  String file;
  /** Adapter configuration id of the database to restore into. */
  String targetSourceId;
  @Nullable String targetDatabaseName;
  @Nullable List<DatabaseMapping> databaseMapping;
  @Nullable PrivilegedAuth privilegedAuth;

  public RestoreOverrides overrides() {
    return new RestoreOverrides(targetDatabaseName, databaseMapping, privilegedAuth, null);
  }
}
