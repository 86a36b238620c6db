package cal.restore.impls;

import cal.restore.types.Execution;

import java.io.IOException;
import java.util.Optional;

/**
 * Where execution records live.  Each record is written by exactly one
 * restore task, so implementations only need to make individual saves atomic.
 */
public interface ExecutionStore {

  /**
   * Insert the record, or replace the stored one with the same id.
   */
  void save(Execution execution) throws IOException;

  Optional<Execution> find(String id) throws IOException;

}
