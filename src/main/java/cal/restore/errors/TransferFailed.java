package cal.restore.errors;

/**
 * The storage backend could not deliver the artifact.
 */
public class TransferFailed extends RestoreFailed {

  public TransferFailed(String message) {
    super(message);
  }

  public TransferFailed(String message, Throwable cause) {
    super(message, cause);
  }

}
