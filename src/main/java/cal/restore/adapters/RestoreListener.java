package cal.restore.adapters;

import cal.prim.ProgressListener;

/**
 * Receives a database adapter's output while a restore runs.
 */
public interface RestoreListener extends ProgressListener {

  RestoreListener IGNORE = new RestoreListener() {
    @Override
    public void onLog(String line) {
    }

    @Override
    public void onProgress(int percent) {
    }
  };

  /**
   * One line of output from the engine's tooling, or a status line of the adapter's own.
   */
  void onLog(String line);

}
