package cal.restore.types;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LogEntry(Instant timestamp, String message, LogLevel level, LogType type, String stage, @Nullable String details) {
}
