package cal.restore.impls;

import cal.prim.transforms.AesGcmDecryption;
import cal.restore.Util;
import cal.restore.config.SecretBox;
import cal.restore.errors.DecryptionFailed;
import cal.restore.types.EncryptionProfile;

import java.security.GeneralSecurityException;

/**
 * Turns an encryption profile into the AES key backups were written with.
 * The profile's secret is sealed under the system key; its plaintext is the
 * master key as 64 hex digits.
 */
public class ProfileKeys {

  private final SecretBox secrets;

  public ProfileKeys(SecretBox secrets) {
    this.secrets = secrets;
  }

  public byte[] keyFor(EncryptionProfile profile) throws DecryptionFailed {
    String hex;
    try {
      hex = secrets.open(profile.secretKey()).trim();
    } catch (GeneralSecurityException | IllegalArgumentException e) {
      throw new DecryptionFailed("Cannot unlock encryption profile '" + profile.name() + "'", e);
    }
    if (hex.length() != AesGcmDecryption.KEY_LENGTH * 2) {
      throw new DecryptionFailed("Integrity error: master key of profile '" + profile.name()
          + "' is not " + AesGcmDecryption.KEY_LENGTH * 2 + " hex digits");
    }
    try {
      return Util.fromHex(hex);
    } catch (IllegalArgumentException e) {
      throw new DecryptionFailed("Integrity error: master key of profile '" + profile.name() + "' is not hex", e);
    }
  }

}
