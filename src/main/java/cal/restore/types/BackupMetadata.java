package cal.restore.types;

import cal.prim.transforms.Compression;
import lombok.Builder;
import lombok.Value;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Optional;

/**
 * Sidecar metadata written next to a backup artifact at backup time.
 */
@Value
@Builder
public class BackupMetadata {
  @Nullable String sourceType;
  @Nullable String sourceName;
  @Nullable String jobName;
  @Nullable String engineVersion;
  @Nullable String engineEdition;
  @Nullable Integer databaseCount;
  @Builder.Default List<String> databaseNames = List.of();
  /** Null when the sidecar does not say. */
  @Nullable Compression compression;
  @Nullable EncryptionInfo encryption;
  boolean locked;

  public boolean isEncrypted() {
    return encryption != null && encryption.enabled();
  }

  public Optional<Compression> declaredCompression() {
    return Optional.ofNullable(compression);
  }
}
