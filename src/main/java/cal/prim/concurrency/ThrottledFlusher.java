package cal.prim.concurrency;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Wraps a flush action so that it runs at most once per interval, without
 * losing the last request.
 *
 * <p>A {@link #request()} made when the interval has elapsed flushes right
 * away on the calling thread.  A request made inside the interval schedules
 * one trailing flush for the end of the interval; further requests before then
 * are absorbed by it.  {@link #flushNow()} bypasses the limit.
 *
 * <p>Callers must not hold locks that the flush action itself acquires, since
 * the trailing flush runs on the scheduler's thread.
 */
public class ThrottledFlusher implements AutoCloseable {

  private final Duration interval;
  private final ScheduledExecutorService scheduler;
  private final Runnable flush;
  private final LongSupplier nanoTime;

  private boolean flushedOnce = false;
  private long lastFlushNanos;
  private ScheduledFuture<?> pending = null;
  private boolean closed = false;

  public ThrottledFlusher(Duration interval, ScheduledExecutorService scheduler, Runnable flush) {
    this(interval, scheduler, flush, System::nanoTime);
  }

  public ThrottledFlusher(Duration interval, ScheduledExecutorService scheduler, Runnable flush, LongSupplier nanoTime) {
    this.interval = interval;
    this.scheduler = scheduler;
    this.flush = flush;
    this.nanoTime = nanoTime;
  }

  public synchronized void request() {
    if (closed || pending != null) {
      return;
    }
    long wait = flushedOnce ? interval.toNanos() - (nanoTime.getAsLong() - lastFlushNanos) : 0;
    if (wait <= 0) {
      runFlush();
    } else {
      pending = scheduler.schedule(this::trailingFlush, wait, TimeUnit.NANOSECONDS);
    }
  }

  /**
   * Flush synchronously, cancelling any scheduled trailing flush.
   */
  public synchronized void flushNow() {
    cancelPending();
    runFlush();
  }

  private synchronized void trailingFlush() {
    pending = null;
    if (!closed) {
      runFlush();
    }
  }

  private void runFlush() {
    lastFlushNanos = nanoTime.getAsLong();
    flushedOnce = true;
    flush.run();
  }

  private void cancelPending() {
    if (pending != null) {
      pending.cancel(false);
      pending = null;
    }
  }

  public synchronized boolean hasPendingFlush() {
    return pending != null;
  }

  /**
   * Drop any scheduled flush and ignore later requests.  Does not flush.
   */
  @Override
  public synchronized void close() {
    closed = true;
    cancelPending();
  }

}
