package cal.restore.impls;

import cal.prim.concurrency.NamedThreadFactory;
import cal.restore.adapters.AdapterRegistry;
import cal.restore.adapters.DatabaseAdapter;
import cal.restore.adapters.RestorePreparation;
import cal.restore.adapters.StorageAdapter;
import cal.restore.config.AdapterConfigRepository;
import cal.restore.config.EncryptionProfileRepository;
import cal.restore.config.RestoreSettings;
import cal.restore.config.SecretBox;
import cal.restore.errors.ConfigurationMissing;
import cal.restore.errors.PreflightFailed;
import cal.restore.errors.RestoreFailed;
import cal.restore.types.AdapterConfig;
import cal.restore.types.AdapterKind;
import cal.restore.types.AdapterSettings;
import cal.restore.types.BackupMetadata;
import cal.restore.types.DatabaseMapping;
import cal.restore.types.Execution;
import cal.restore.types.RestoreRequest;
import cal.restore.types.RestoreTarget;
import lombok.extern.slf4j.Slf4j;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Accepts restore requests.
 *
 * <p>{@link #startRestore(RestoreRequest)} resolves the adapters, runs the
 * preflight checks and creates the execution record on the caller's thread,
 * then hands the rest to a worker pool and returns.  Preflight problems are
 * thrown to the caller; anything that goes wrong later is recorded in the
 * execution.
 */
@Slf4j
public class RestoreOrchestrator implements AutoCloseable {

  private final AdapterRegistry registry;
  private final AdapterConfigRepository configs;
  private final SecretBox secrets;
  private final ExecutionStore store;
  private final RestoreSettings settings;
  private final Clock clock;
  private final CompatibilityGuard guard = new CompatibilityGuard();
  private final SmartKeyRecovery keyRecovery;
  private final MultiDatabaseArchive archives = new MultiDatabaseArchive();
  private final ExecutorService workers;
  private final ScheduledExecutorService flushScheduler;

  public RestoreOrchestrator(AdapterRegistry registry, AdapterConfigRepository configs, EncryptionProfileRepository profiles,
                             SecretBox secrets, ExecutionStore store, RestoreSettings settings) {
    this(registry, configs, profiles, secrets, store, settings, Clock.systemUTC());
  }

  public RestoreOrchestrator(AdapterRegistry registry, AdapterConfigRepository configs, EncryptionProfileRepository profiles,
                             SecretBox secrets, ExecutionStore store, RestoreSettings settings, Clock clock) {
    this.registry = registry;
    this.configs = configs;
    this.secrets = secrets;
    this.store = store;
    this.settings = settings;
    this.clock = clock;
    this.keyRecovery = new SmartKeyRecovery(profiles, new ProfileKeys(secrets), settings.getKeyProbeBytes(), settings.getPrintableThreshold());
    this.workers = Executors.newFixedThreadPool(settings.getWorkerThreads(), new NamedThreadFactory("restore", false));
    this.flushScheduler = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("restore-flush", true));
  }

  public RestoreHandle startRestore(RestoreRequest request) throws RestoreFailed, IOException {
    requireField("storageConfigId", request.getStorageConfigId());
    requireField("file", request.getFile());
    requireField("targetSourceId", request.getTargetSourceId());

    AdapterConfig storageConfig = config(request.getStorageConfigId(), AdapterKind.STORAGE, "Storage");
    AdapterConfig targetConfig = config(request.getTargetSourceId(), AdapterKind.DATABASE, "Target source");
    StorageAdapter storage = registry.storage(storageConfig.adapterId());
    DatabaseAdapter database = registry.database(targetConfig.adapterId());
    AdapterSettings storageSettings = secrets.openSettings(storageConfig.parameters());
    AdapterSettings databaseSettings = secrets.openSettings(targetConfig.parameters());
    storage.checkSettings(storageSettings);
    database.checkSettings(databaseSettings);

    // preflight
    BackupMetadata metadata = new SidecarLocator(storage, storageSettings).fetch(request.getFile(), settings.getScratchRoot()).orElse(null);
    guard.check(metadata, targetConfig.adapterId(), database, databaseSettings);
    Optional<RestorePreparation> preparation = database.restorePreparation();
    if (preparation.isPresent()) {
      List<String> names = preflightDatabaseNames(request, metadata);
      if (!names.isEmpty()) {
        preparation.get().prepare(new RestoreTarget(databaseSettings, request.overrides()), names);
      }
    }

    String executionId = UUID.randomUUID().toString();
    ExecutionTracker tracker = ExecutionTracker.start(executionId, Execution.TYPE_RESTORE, request.getFile(), clock, store,
        settings.getFlushInterval(), flushScheduler);
    tracker.info("Restore requested from '" + storageConfig.name() + "' into '" + targetConfig.name() + "'");

    RestoreRun run = new RestoreRun(request, storage, storageSettings, database, databaseSettings, metadata,
        keyRecovery, archives, settings.getScratchRoot(), tracker);
    Future<?> completion;
    try {
      completion = workers.submit(run);
    } catch (RejectedExecutionException e) {
      tracker.fail("Restore service is shutting down", null);
      throw new IllegalStateException("restore service is shut down", e);
    }
    log.info("Accepted restore {} of '{}' into '{}'", executionId, request.getFile(), targetConfig.name());
    return new RestoreHandle(executionId, completion, store);
  }

  public Optional<Execution> execution(String id) throws IOException {
    return store.find(id);
  }

  private static void requireField(String name, @Nullable String value) throws PreflightFailed {
    if (value == null || value.isBlank()) {
      throw new PreflightFailed("Missing required field '" + name + "'");
    }
  }

  private AdapterConfig config(String id, AdapterKind kind, String what) throws ConfigurationMissing {
    AdapterConfig config = configs.findAdapterConfig(id)
        .orElseThrow(() -> new ConfigurationMissing(what + " not found: '" + id + "'"));
    if (config.kind() != kind) {
      throw new ConfigurationMissing(what + " '" + id + "' is not a " + kind.name().toLowerCase(Locale.ROOT) + " configuration");
    }
    return config;
  }

  /**
   * The databases a restore will write, as far as they are known before the
   * artifact is downloaded.
   */
  static List<String> preflightDatabaseNames(RestoreRequest request, @Nullable BackupMetadata metadata) {
    if (request.getTargetDatabaseName() != null && !request.getTargetDatabaseName().isEmpty()) {
      return List.of(request.getTargetDatabaseName());
    }
    List<DatabaseMapping> mapping = request.getDatabaseMapping();
    if (mapping != null && !mapping.isEmpty()) {
      return mapping.stream().filter(DatabaseMapping::selected).map(DatabaseMapping::effectiveTargetName).toList();
    }
    if (metadata != null) {
      return metadata.getDatabaseNames();
    }
    return List.of();
  }

  /**
   * Stop accepting restores and wait for the running ones to finish.
   */
  @Override
  public void close() throws InterruptedException {
    workers.shutdown();
    while (!workers.awaitTermination(1, TimeUnit.MINUTES)) {
      log.info("Waiting for running restores to finish");
    }
    flushScheduler.shutdown();
  }

  /**
   * Stop accepting restores and give the running ones <code>grace</code> to
   * finish.  Restores still running after that are interrupted, which records
   * them as failed.
   *
   * @return false if some restore had to be interrupted
   */
  public boolean close(Duration grace) throws InterruptedException {
    workers.shutdown();
    boolean finished = workers.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS);
    if (!finished) {
      log.warn("Interrupting restores still running after {}", grace);
      workers.shutdownNow();
      if (!workers.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Restore workers ignored the interrupt");
      }
    }
    flushScheduler.shutdown();
    return finished;
  }

}
