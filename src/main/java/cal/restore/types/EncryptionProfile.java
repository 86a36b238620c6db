package cal.restore.types;

/**
 * Named key material for backup encryption.
 *
 * @param secretKey the profile's master key, sealed under the system key
 */
public record EncryptionProfile(String id, String name, String secretKey) {
  @Override
  public String toString() {
    return "EncryptionProfile[id=" + id + ", name=" + name + "]";
  }
}
