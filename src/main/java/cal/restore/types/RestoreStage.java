package cal.restore.types;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The stages of a restore, in pipeline order.  Decrypting and Decompressing
 * are skipped when the artifact is not encrypted or not compressed.
 */
public enum RestoreStage {
  INITIALIZING("Initializing"),
  DOWNLOADING("Downloading"),
  DECRYPTING("Decrypting"),
  DECOMPRESSING("Decompressing"),
  RESTORING_DATABASE("Restoring Database"),
  COMPLETED("Completed"),
  FAILED("Failed");

  private final String label;

  RestoreStage(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  /**
   * Stages only move forward.  Completed is reachable only from
   * Restoring Database; Failed from any stage that is not terminal.
   */
  public boolean canAdvanceTo(RestoreStage next) {
    if (isTerminal()) {
      return false;
    }
    switch (next) {
      case FAILED:
        return true;
      case COMPLETED:
        return this == RESTORING_DATABASE;
      default:
        return next.ordinal() > ordinal();
    }
  }

  @JsonCreator
  public static RestoreStage fromLabel(String label) {
    for (RestoreStage s : values()) {
      if (s.label.equals(label)) {
        return s;
      }
    }
    throw new IllegalArgumentException("unknown stage " + label);
  }
}
