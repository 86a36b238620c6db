package cal.restore.impls;

import cal.restore.types.Execution;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryExecutionStore implements ExecutionStore {

  private final Map<String, Execution> executions = new ConcurrentHashMap<>();

  @Override
  public void save(Execution execution) {
    executions.put(execution.id(), execution);
  }

  @Override
  public Optional<Execution> find(String id) {
    return Optional.ofNullable(executions.get(id));
  }

}
