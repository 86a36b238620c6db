package cal.restore.impls;

import cal.restore.Util;
import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * One restore's private working directory, <code>root/executionId</code>.
 * Files are named after the artifact's basename, so concurrent restores
 * never collide.  Closing deletes the directory and everything in it.
 */
@Slf4j
public class ScratchSpace implements AutoCloseable {

  private final Path dir;

  private ScratchSpace(Path dir) {
    this.dir = dir;
  }

  public static ScratchSpace create(Path root, String executionId) throws IOException {
    Path dir = root.resolve(executionId);
    Files.createDirectories(dir);
    return new ScratchSpace(dir);
  }

  public Path directory() {
    return dir;
  }

  /**
   * A location in this space for the remote file <code>remotePath</code>.
   */
  public Path file(String remotePath) {
    String name = Util.basename(remotePath);
    if (name.isEmpty() || name.equals(".") || name.equals("..")) {
      throw new IllegalArgumentException("not a file name: '" + remotePath + "'");
    }
    return dir.resolve(name);
  }

  public Path newDirectory(String prefix) throws IOException {
    return Files.createTempDirectory(dir, prefix);
  }

  /**
   * Delete a file, tolerating its absence.  Failures are logged, not thrown;
   * a leftover scratch file must not turn a finished restore into a failed one.
   */
  public static void deleteQuietly(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      log.warn("Could not delete scratch file {}", file, e);
    }
  }

  public static void deleteTree(Path path) {
    try {
      MoreFiles.deleteRecursively(path, RecursiveDeleteOption.ALLOW_INSECURE);
    } catch (NoSuchFileException e) {
      log.debug("Scratch directory {} already gone", path);
    } catch (IOException e) {
      log.warn("Could not delete scratch directory {}", path, e);
    }
  }

  @Override
  public void close() {
    deleteTree(dir);
  }

}
