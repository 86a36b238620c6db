package cal.restore.errors;

/**
 * An adapter, adapter configuration or encryption profile that the request refers to does not exist.
 */
public class ConfigurationMissing extends RestoreFailed {

  public ConfigurationMissing(String message) {
    super(message);
  }

  public ConfigurationMissing(String message, Throwable cause) {
    super(message, cause);
  }

}
