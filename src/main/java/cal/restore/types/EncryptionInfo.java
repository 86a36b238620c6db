package cal.restore.types;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The encryption block of a backup's sidecar.  <code>iv</code> and
 * <code>authTag</code> are hex strings.
 */
public record EncryptionInfo(boolean enabled, @Nullable String profileId, @Nullable String iv, @Nullable String authTag) {

  public boolean hasParameters() {
    return iv != null && !iv.isEmpty() && authTag != null && !authTag.isEmpty();
  }

}
