package cal.restore.errors;

/**
 * A check that runs before any data moves rejected the restore: vendor, version or edition mismatch, or insufficient privileges on the target.
 */
public class PreflightFailed extends RestoreFailed {

  public PreflightFailed(String message) {
    super(message);
  }

  public PreflightFailed(String message, Throwable cause) {
    super(message, cause);
  }

}
