package cal.restore.impls;

import cal.restore.types.Execution;
import cal.restore.types.ExecutionStatus;
import cal.restore.types.LogLevel;
import cal.restore.types.LogType;
import cal.restore.types.RestoreStage;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Test
public class ExecutionTrackerTests {

  private static class RecordingStore extends InMemoryExecutionStore {
    final List<Execution> saves = new CopyOnWriteArrayList<>();

    @Override
    public void save(Execution execution) {
      saves.add(execution);
      super.save(execution);
    }

    Execution last() {
      return saves.get(saves.size() - 1);
    }
  }

  private ScheduledExecutorService scheduler;
  private RecordingStore store;

  @BeforeMethod
  public void setUp() {
    scheduler = Executors.newSingleThreadScheduledExecutor();
    store = new RecordingStore();
  }

  @AfterMethod
  public void tearDown() {
    scheduler.shutdownNow();
  }

  private ExecutionTracker start(Duration interval) throws Exception {
    return ExecutionTracker.start("exec-1", Execution.TYPE_RESTORE, "backups/db.sql", Clock.systemUTC(), store, interval, scheduler);
  }

  @Test
  public void testStartSavesRunningRecord() throws Exception {
    start(Duration.ofHours(1));
    Assert.assertEquals(store.saves.size(), 1);
    Execution e = store.find("exec-1").orElseThrow();
    Assert.assertEquals(e.status(), ExecutionStatus.RUNNING);
    Assert.assertEquals(e.metadata().stage(), RestoreStage.INITIALIZING);
    Assert.assertEquals(e.metadata().progress(), 0);
    Assert.assertNull(e.endedAt());
  }

  @Test
  public void testInfoIsThrottledButErrorFlushes() throws Exception {
    ExecutionTracker tracker = start(Duration.ofHours(1));
    tracker.info("first");
    int afterFirst = store.saves.size();
    tracker.info("second");
    Assert.assertEquals(store.saves.size(), afterFirst);

    tracker.log("boom", LogLevel.ERROR, LogType.GENERAL, "stack");
    Assert.assertEquals(store.saves.size(), afterFirst + 1);
    List<String> messages = store.last().logs().stream().map(l -> l.message()).toList();
    Assert.assertEquals(messages, List.of("first", "second", "boom"));
  }

  @Test
  public void testLogsOnlyGrow() throws Exception {
    ExecutionTracker tracker = start(Duration.ZERO);
    tracker.info("a");
    tracker.advance(RestoreStage.DOWNLOADING);
    tracker.progress(40);
    tracker.warn("b");
    tracker.advance(RestoreStage.RESTORING_DATABASE);
    tracker.succeed("done");

    int previous = 0;
    for (Execution e : store.saves) {
      Assert.assertTrue(e.logs().size() >= previous);
      previous = e.logs().size();
    }
  }

  @Test
  public void testAdvanceResetsProgressAndTagsLogs() throws Exception {
    ExecutionTracker tracker = start(Duration.ofHours(1));
    tracker.advance(RestoreStage.DOWNLOADING);
    tracker.progress(70);
    Assert.assertEquals(tracker.snapshot().metadata().progress(), 70);
    tracker.advance(RestoreStage.DECRYPTING);
    Assert.assertEquals(tracker.snapshot().metadata().progress(), 0);
    Assert.assertEquals(store.last().metadata().stage(), RestoreStage.DECRYPTING);

    tracker.info("decrypting now");
    Assert.assertEquals(tracker.snapshot().logs().get(0).stage(), "Decrypting");
  }

  @Test
  public void testStagesOnlyMoveForward() throws Exception {
    ExecutionTracker tracker = start(Duration.ofHours(1));
    tracker.advance(RestoreStage.DECOMPRESSING);
    Assert.expectThrows(IllegalStateException.class, () -> tracker.advance(RestoreStage.DOWNLOADING));
    Assert.expectThrows(IllegalStateException.class, () -> tracker.advance(RestoreStage.COMPLETED));
  }

  @Test
  public void testSuccessIsTerminal() throws Exception {
    ExecutionTracker tracker = start(Duration.ofHours(1));
    tracker.advance(RestoreStage.RESTORING_DATABASE);
    tracker.succeed("Restore completed successfully");

    Execution e = store.last();
    Assert.assertEquals(e.status(), ExecutionStatus.SUCCESS);
    Assert.assertEquals(e.metadata().stage(), RestoreStage.COMPLETED);
    Assert.assertEquals(e.metadata().progress(), 100);
    Assert.assertNotNull(e.endedAt());
    Assert.assertEquals(e.logs().get(e.logs().size() - 1).level(), LogLevel.SUCCESS);

    Assert.expectThrows(IllegalStateException.class, () -> tracker.fail("late", null));
    Assert.expectThrows(IllegalStateException.class, () -> tracker.info("late"));
    Assert.assertEquals(store.last().status(), ExecutionStatus.SUCCESS);
  }

  @Test
  public void testFailureFromAnyStage() throws Exception {
    ExecutionTracker tracker = start(Duration.ofHours(1));
    tracker.advance(RestoreStage.DOWNLOADING);
    tracker.fail("Download failed", "connection reset");

    Execution e = store.last();
    Assert.assertEquals(e.status(), ExecutionStatus.FAILED);
    Assert.assertEquals(e.metadata().stage(), RestoreStage.FAILED);
    Assert.assertEquals(e.logs().get(e.logs().size() - 1).details(), "connection reset");
    Assert.assertTrue(tracker.isTerminal());
  }

  @Test
  public void testCommandListenerClassifiesLines() throws Exception {
    ExecutionTracker tracker = start(Duration.ofHours(1));
    tracker.commandListener().onLog("ERROR: duplicate key");
    tracker.commandListener().onLog("COPY 42");
    tracker.commandListener().onProgress(150);

    Execution e = tracker.snapshot();
    Assert.assertEquals(e.logs().get(0).level(), LogLevel.ERROR);
    Assert.assertEquals(e.logs().get(0).type(), LogType.COMMAND);
    Assert.assertEquals(e.logs().get(1).level(), LogLevel.INFO);
    Assert.assertEquals(e.metadata().progress(), 100);
  }

}
