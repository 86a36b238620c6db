package cal.restore.types;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

public record AdapterResult(boolean success, List<String> logs, @Nullable String error) {

  public AdapterResult {
    logs = List.copyOf(logs);
  }

  public static AdapterResult succeeded(List<String> logs) {
    return new AdapterResult(true, logs, null);
  }

  public static AdapterResult failed(String error, List<String> logs) {
    return new AdapterResult(false, logs, error);
  }

}
