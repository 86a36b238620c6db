package cal.restore.errors;

/**
 * The decrypted artifact is not valid data for its declared compression.
 */
public class DecompressionFailed extends RestoreFailed {

  public DecompressionFailed(String message) {
    super(message);
  }

  public DecompressionFailed(String message, Throwable cause) {
    super(message, cause);
  }

}
