package cal.restore.errors;

/**
 * The database engine's restore tooling reported a failure.  The message is the adapter's error text, unmodified.
 */
public class AdapterRestoreFailed extends RestoreFailed {

  public AdapterRestoreFailed(String message) {
    super(message);
  }

  public AdapterRestoreFailed(String message, Throwable cause) {
    super(message, cause);
  }

}
