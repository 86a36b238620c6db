package cal.restore.types;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * A point-in-time copy of one long-running operation's record.
 */
public record Execution(
    String id,
    String type,
    ExecutionStatus status,
    String path,
    List<LogEntry> logs,
    ExecutionMetadata metadata,
    Instant startedAt,
    @Nullable Instant endedAt) {

  public static final String TYPE_RESTORE = "Restore";

  public Execution {
    logs = List.copyOf(logs);
  }

}
