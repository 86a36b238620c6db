package cal.restore.adapters;

import cal.prim.ProgressListener;
import cal.restore.types.AdapterKind;
import cal.restore.types.AdapterSettings;
import cal.restore.types.FileInfo;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

public interface StorageAdapter extends Adapter {

  @Override
  default AdapterKind kind() {
    return AdapterKind.STORAGE;
  }

  /**
   * List the files under <code>dir</code>, recursively.
   */
  List<FileInfo> list(AdapterSettings settings, String dir) throws IOException;

  /**
   * @return true if the file now exists at <code>localPath</code>; false if the
   *         backend reported that it could not deliver it
   */
  boolean download(AdapterSettings settings, String remotePath, Path localPath, ProgressListener progress) throws IOException;

  boolean upload(AdapterSettings settings, Path localPath, String remotePath) throws IOException;

  /**
   * Delete a remote file.  Deleting a file that does not exist succeeds.
   */
  boolean delete(AdapterSettings settings, String remotePath) throws IOException;

  /**
   * Present if this backend can read small files directly.
   */
  default Optional<TextReader> reading() {
    return Optional.empty();
  }

}
