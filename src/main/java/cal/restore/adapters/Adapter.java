package cal.restore.adapters;

import cal.restore.errors.ConfigurationMissing;
import cal.restore.types.AdapterKind;
import cal.restore.types.AdapterSettings;
import cal.restore.types.ConnectionTest;

import java.io.IOException;

/**
 * An implementation of one kind of storage backend or database engine.
 * Adapters are stateless; everything they need per call arrives as
 * {@link AdapterSettings}.
 */
public interface Adapter {

  /**
   * The identifier that configurations name in their <code>adapterId</code>
   * field and that backups record as their <code>sourceType</code>.
   */
  String id();

  String displayName();

  AdapterKind kind();

  /**
   * Reject settings this adapter cannot work with, before any other method
   * is handed them.
   */
  default void checkSettings(AdapterSettings settings) throws ConfigurationMissing {
  }

  /**
   * Check that the endpoint is reachable and usable.  A negative result is
   * reported in the returned value, not thrown.
   */
  ConnectionTest test(AdapterSettings settings) throws IOException;

}
