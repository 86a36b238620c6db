package cal.restore.impls;

import cal.restore.types.Execution;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A restore that has been accepted and is running in the background.
 * There is no way to cancel it.
 */
public final class RestoreHandle {

  private final String executionId;
  private final Future<?> completion;
  private final ExecutionStore store;

  RestoreHandle(String executionId, Future<?> completion, ExecutionStore store) {
    this.executionId = executionId;
    this.completion = completion;
    this.store = store;
  }

  public String executionId() {
    return executionId;
  }

  public boolean isDone() {
    return completion.isDone();
  }

  /**
   * Wait for the restore to finish and return its final record.
   */
  public Execution await(Duration timeout) throws InterruptedException, TimeoutException, IOException {
    try {
      completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (ExecutionException e) {
      throw new IllegalStateException("restore task for execution " + executionId + " crashed", e.getCause());
    }
    return store.find(executionId)
        .orElseThrow(() -> new IOException("execution " + executionId + " vanished from the store"));
  }

}
