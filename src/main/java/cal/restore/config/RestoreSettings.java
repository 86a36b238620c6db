package cal.restore.config;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Tunables of the restore engine.
 */
@Value
@Builder(toBuilder = true)
public class RestoreSettings {

  public static final RestoreSettings DEFAULTS = RestoreSettings.builder().build();

  /** Parent of every restore's private scratch directory. */
  @Builder.Default Path scratchRoot = Paths.get(System.getProperty("java.io.tmpdir"), "db-restore");

  /** Minimum time between two persists of a running execution. */
  @Builder.Default Duration flushInterval = Duration.ofSeconds(1);

  /** How much ciphertext key recovery decrypts per candidate profile. */
  @Builder.Default int keyProbeBytes = 1024;

  /**
   * For uncompressed artifacts, the share of printable bytes a candidate
   * plaintext needs to exceed to be accepted.
   */
  @Builder.Default double printableThreshold = 0.70;

  @Builder.Default int workerThreads = 4;

}
