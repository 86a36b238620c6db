package cal.restore.adapters;

import cal.restore.types.AdapterSettings;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;

/**
 * Optional storage capability: read a small remote file without staging it
 * on disk.  Used for sidecar metadata.
 */
@FunctionalInterface
public interface TextReader {

  /**
   * @return the file's content as UTF-8 text, or null if the file does not exist
   */
  @Nullable String read(AdapterSettings settings, String remotePath) throws IOException;

}
