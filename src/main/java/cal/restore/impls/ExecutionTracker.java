package cal.restore.impls;

import cal.prim.concurrency.ThrottledFlusher;
import cal.restore.adapters.RestoreListener;
import cal.restore.types.Execution;
import cal.restore.types.ExecutionMetadata;
import cal.restore.types.ExecutionStatus;
import cal.restore.types.LogEntry;
import cal.restore.types.LogLevel;
import cal.restore.types.LogType;
import cal.restore.types.RestoreStage;
import lombok.extern.slf4j.Slf4j;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;

/**
 * The live state of one execution, owned by the task running it.
 *
 * <p>Logs only grow.  The stage only moves forward, and the status leaves
 * Running exactly once.  Changes are persisted through a
 * {@link ThrottledFlusher}; error entries, stage transitions and the terminal
 * state are persisted immediately.
 */
@Slf4j
public class ExecutionTracker {

  private final String id;
  private final String type;
  private final String path;
  private final Instant startedAt;
  private final Clock clock;
  private final ExecutionStore store;
  private final ThrottledFlusher flusher;

  // guarded by this
  private final List<LogEntry> logs = new ArrayList<>();
  private ExecutionStatus status = ExecutionStatus.RUNNING;
  private RestoreStage stage = RestoreStage.INITIALIZING;
  private int progress = 0;
  private @Nullable Instant endedAt = null;

  private ExecutionTracker(String id, String type, String path, Clock clock, ExecutionStore store,
                           Duration flushInterval, ScheduledExecutorService scheduler) {
    this.id = id;
    this.type = type;
    this.path = path;
    this.clock = clock;
    this.startedAt = clock.instant();
    this.store = store;
    this.flusher = new ThrottledFlusher(flushInterval, scheduler, this::persist);
  }

  /**
   * Create the execution and save it before returning, so the id is valid
   * as soon as the caller has it.
   */
  public static ExecutionTracker start(String id, String type, String path, Clock clock, ExecutionStore store,
                                       Duration flushInterval, ScheduledExecutorService scheduler) throws IOException {
    ExecutionTracker tracker = new ExecutionTracker(id, type, path, clock, store, flushInterval, scheduler);
    store.save(tracker.snapshot());
    return tracker;
  }

  public String id() {
    return id;
  }

  public synchronized Execution snapshot() {
    return new Execution(id, type, status, path, logs, new ExecutionMetadata(progress, stage), startedAt, endedAt);
  }

  public synchronized RestoreStage stage() {
    return stage;
  }

  public void log(String message, LogLevel level, LogType type, @Nullable String details) {
    synchronized (this) {
      requireRunning();
      logs.add(new LogEntry(clock.instant(), message, level, type, stage.label(), details));
    }
    if (level == LogLevel.ERROR) {
      flusher.flushNow();
    } else {
      flusher.request();
    }
  }

  public void info(String message) {
    log(message, LogLevel.INFO, LogType.GENERAL, null);
  }

  public void warn(String message) {
    log(message, LogLevel.WARNING, LogType.GENERAL, null);
  }

  /**
   * A relay for a database adapter's output: lines are classified by their
   * wording and recorded as command output, and progress updates this
   * execution's progress.
   */
  public RestoreListener commandListener() {
    return new RestoreListener() {
      @Override
      public void onLog(String line) {
        log(line, LogClassifier.classify(line), LogType.COMMAND, null);
      }

      @Override
      public void onProgress(int percent) {
        progress(percent);
      }
    };
  }

  public void advance(RestoreStage next) {
    synchronized (this) {
      requireRunning();
      if (!stage.canAdvanceTo(next) || next.isTerminal()) {
        throw new IllegalStateException("execution " + id + " cannot move from " + stage + " to " + next);
      }
      stage = next;
      progress = 0;
    }
    log.debug("Execution {} entered stage {}", id, next.label());
    flusher.flushNow();
  }

  public void progress(int percent) {
    int clamped = Math.max(0, Math.min(100, percent));
    synchronized (this) {
      if (status.isTerminal() || clamped == progress) {
        return;
      }
      progress = clamped;
    }
    flusher.request();
  }

  public void succeed(String message) {
    finish(ExecutionStatus.SUCCESS, RestoreStage.COMPLETED, LogLevel.SUCCESS, message, null);
  }

  public void fail(String error, @Nullable String details) {
    finish(ExecutionStatus.FAILED, RestoreStage.FAILED, LogLevel.ERROR, error, details);
  }

  private void finish(ExecutionStatus terminal, RestoreStage finalStage, LogLevel level, String message, @Nullable String details) {
    synchronized (this) {
      requireRunning();
      logs.add(new LogEntry(clock.instant(), message, level, LogType.GENERAL, stage.label(), details));
      status = terminal;
      stage = finalStage;
      if (terminal == ExecutionStatus.SUCCESS) {
        progress = 100;
      }
      endedAt = clock.instant();
    }
    flusher.flushNow();
    flusher.close();
  }

  public synchronized boolean isTerminal() {
    return status.isTerminal();
  }

  private void requireRunning() {
    if (status.isTerminal()) {
      throw new IllegalStateException("execution " + id + " is already " + status.label());
    }
  }

  private void persist() {
    Execution snapshot = snapshot();
    try {
      store.save(snapshot);
    } catch (IOException e) {
      log.warn("Could not persist execution {}", id, e);
    }
  }

}
