package cal.restore.config;

import cal.restore.types.EncryptionProfile;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the configured encryption profiles.
 */
public interface EncryptionProfileRepository {

  Optional<EncryptionProfile> findProfile(String id);

  /**
   * All profiles, in a stable order.  Key recovery tries them in this order.
   */
  List<EncryptionProfile> profiles();

}
