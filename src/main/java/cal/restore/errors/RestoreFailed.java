package cal.restore.errors;

/**
 * Root of the failures a restore can end in.  Each subclass names the phase
 * that failed; the message is meant for the operator and is copied into the
 * execution log as-is.
 */
public class RestoreFailed extends Exception {

  public RestoreFailed(String message) {
    super(message);
  }

  public RestoreFailed(String message, Throwable cause) {
    super(message, cause);
  }

}
