package cal.restore.types;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ExecutionStatus {
  RUNNING("Running"),
  SUCCESS("Success"),
  FAILED("Failed");

  private final String label;

  ExecutionStatus(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }

  public boolean isTerminal() {
    return this != RUNNING;
  }

  @JsonCreator
  public static ExecutionStatus fromLabel(String label) {
    for (ExecutionStatus s : values()) {
      if (s.label.equals(label)) {
        return s;
      }
    }
    throw new IllegalArgumentException("unknown execution status " + label);
  }
}
