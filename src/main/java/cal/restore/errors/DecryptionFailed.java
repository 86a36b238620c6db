package cal.restore.errors;

/**
 * The artifact could not be decrypted: encryption parameters are missing, no key fits, or the ciphertext does not authenticate.
 */
public class DecryptionFailed extends RestoreFailed {

  public DecryptionFailed(String message) {
    super(message);
  }

  public DecryptionFailed(String message, Throwable cause) {
    super(message, cause);
  }

}
