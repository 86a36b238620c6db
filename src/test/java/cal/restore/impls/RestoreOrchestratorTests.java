package cal.restore.impls;

import cal.restore.TestCrypto;
import cal.restore.adapters.AdapterRegistry;
import cal.restore.config.RestoreSettings;
import cal.restore.database.SqliteDatabaseAdapter;
import cal.restore.errors.ConfigurationMissing;
import cal.restore.errors.PreflightFailed;
import cal.restore.types.AdapterConfig;
import cal.restore.types.AdapterKind;
import cal.restore.types.DatabaseMapping;
import cal.restore.types.Execution;
import cal.restore.types.ExecutionStatus;
import cal.restore.types.LogEntry;
import cal.restore.types.LogLevel;
import cal.restore.types.RestoreRequest;
import cal.restore.types.RestoreStage;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.stream.Stream;

@Test
public class RestoreOrchestratorTests {

  private static final String DUMP = "[{\"_id\": 1, \"name\": \"alpha\"}, {\"_id\": 2, \"name\": \"beta\"}]\n".repeat(20);
  private static final Duration WAIT = Duration.ofSeconds(30);

  private Path scratchRoot;
  private InMemoryStorage storage;
  private RecordingDatabase database;
  private InMemoryCatalog catalog;
  private InMemoryExecutionStore store;
  private RestoreOrchestrator orchestrator;

  @BeforeMethod
  public void setUp() throws Exception {
    scratchRoot = Files.createTempDirectory("restore-scratch");
    storage = new InMemoryStorage("memory", true);
    database = new RecordingDatabase("mongodb");
    catalog = new InMemoryCatalog()
        .add(new AdapterConfig("store-1", AdapterKind.STORAGE, "memory", "Backups", Map.of()))
        .add(new AdapterConfig("db-1", AdapterKind.DATABASE, "mongodb", "Staging Mongo", Map.of("uri", "mongodb://localhost")));
    store = new InMemoryExecutionStore();
    orchestrator = orchestrator(AdapterRegistry.builder().add(storage).add(database).build());
  }

  private RestoreOrchestrator orchestrator(AdapterRegistry registry) {
    RestoreSettings settings = RestoreSettings.DEFAULTS.toBuilder()
        .scratchRoot(scratchRoot)
        .flushInterval(Duration.ofMillis(10))
        .workerThreads(2)
        .build();
    return new RestoreOrchestrator(registry, catalog, catalog, TestCrypto.SYSTEM, store, settings);
  }

  /** Replace the orchestrator with one that reads from <code>replacement</code>. */
  private void useStorage(InMemoryStorage replacement) throws Exception {
    orchestrator.close();
    storage = replacement;
    orchestrator = orchestrator(AdapterRegistry.builder().add(storage).add(database).build());
  }

  @AfterMethod
  public void tearDown() throws Exception {
    orchestrator.close();
  }

  private static RestoreRequest request(String file) {
    return RestoreRequest.builder().storageConfigId("store-1").file(file).targetSourceId("db-1").build();
  }

  private static String sidecar(String sourceType, String version, String compression, String encryption) {
    return "{ \"sourceType\": \"" + sourceType + "\", \"engineVersion\": \"" + version + "\", "
        + "\"compression\": \"" + compression + "\"" + (encryption == null ? "" : ", \"encryption\": " + encryption) + " }";
  }

  private static String encryptionBlock(String profileId, TestCrypto.Sealed sealed) {
    return "{ \"enabled\": true, \"profileId\": \"" + profileId + "\", \"iv\": \"" + sealed.ivHex()
        + "\", \"authTag\": \"" + sealed.tagHex() + "\" }";
  }

  private static boolean hasLog(Execution e, String fragment) {
    return e.logs().stream().anyMatch(l -> l.message().contains(fragment));
  }

  private void assertScratchEmpty() throws Exception {
    try (Stream<Path> left = Files.list(scratchRoot)) {
      Assert.assertEquals(left.count(), 0L, "scratch directories should be removed");
    }
  }

  @Test
  public void testPlainRestore() throws Exception {
    storage.put("backups/plain.json", DUMP);
    RestoreHandle handle = orchestrator.startRestore(request("backups/plain.json"));

    Execution e = handle.await(WAIT);
    Assert.assertEquals(e.status(), ExecutionStatus.SUCCESS, e.logs().toString());
    Assert.assertEquals(e.metadata().stage(), RestoreStage.COMPLETED);
    Assert.assertEquals(e.metadata().progress(), 100);
    Assert.assertEquals(e.type(), Execution.TYPE_RESTORE);
    Assert.assertEquals(e.path(), "backups/plain.json");
    Assert.assertEquals(database.restores.size(), 1);
    Assert.assertEquals(new String(database.restores.get(0).content(), StandardCharsets.UTF_8), DUMP);
    Assert.assertEquals(database.restores.get(0).target().overrides().targetVersion(), "8.0.36");
    assertScratchEmpty();
  }

  @Test
  public void testEncryptedCompressedRestoreWithSidecar() throws Exception {
    byte[] key = TestCrypto.randomKey();
    catalog.add(TestCrypto.profile("p1", "Production", key));
    TestCrypto.Sealed sealed = TestCrypto.encrypt(key, TestCrypto.gzip(DUMP.getBytes(StandardCharsets.UTF_8)));
    storage.put("jobs/nightly/x.json.gz.enc", sealed.ciphertext());
    storage.put("jobs/nightly/x.json.gz.enc.meta.json", sidecar("mongodb", "6.0.1", "gzip", encryptionBlock("p1", sealed)));
    database.version = "7.0.2";

    Execution e = orchestrator.startRestore(request("jobs/nightly/x.json.gz.enc")).await(WAIT);

    Assert.assertEquals(e.status(), ExecutionStatus.SUCCESS, e.logs().toString());
    Assert.assertEquals(new String(database.restores.get(0).content(), StandardCharsets.UTF_8), DUMP);
    Assert.assertFalse(hasLog(e, "Smart Recovery"));
    List<String> stages = e.logs().stream().map(LogEntry::stage).distinct().toList();
    Assert.assertTrue(stages.contains("Decrypting"), stages.toString());
    Assert.assertTrue(stages.contains("Decompressing"), stages.toString());
    assertScratchEmpty();
  }

  @Test
  public void testStaleProfileIsRecovered() throws Exception {
    byte[] key = TestCrypto.randomKey();
    catalog.add(TestCrypto.profile("wrong", "Old", TestCrypto.randomKey()));
    catalog.add(TestCrypto.profile("rotated", "Rotated key", key));
    TestCrypto.Sealed sealed = TestCrypto.encrypt(key, DUMP.getBytes(StandardCharsets.UTF_8));
    storage.put("x.json.enc", sealed.ciphertext());
    storage.put("x.json.enc.meta.json", sidecar("mongodb", "6.0", "none", encryptionBlock("deleted", sealed)));

    Execution e = orchestrator.startRestore(request("x.json.enc")).await(WAIT);

    Assert.assertEquals(e.status(), ExecutionStatus.SUCCESS, e.logs().toString());
    LogEntry recovery = e.logs().stream()
        .filter(l -> l.message().equals("Smart Recovery: Unlocked using profile 'Rotated key'"))
        .findFirst().orElseThrow();
    Assert.assertEquals(recovery.level(), LogLevel.SUCCESS);
    Assert.assertEquals(new String(database.restores.get(0).content(), StandardCharsets.UTF_8), DUMP);
  }

  @Test
  public void testEncryptedWithoutSidecarFails() throws Exception {
    storage.put("x.sql.enc", new byte[] { 1, 2, 3, 4 });

    Execution e = orchestrator.startRestore(request("x.sql.enc")).await(WAIT);

    Assert.assertEquals(e.status(), ExecutionStatus.FAILED);
    Assert.assertEquals(e.metadata().stage(), RestoreStage.FAILED);
    Assert.assertTrue(hasLog(e, "Encryption metadata missing (IV/AuthTag)"), e.logs().toString());
    Assert.assertTrue(database.restores.isEmpty());
    Assert.assertNotNull(e.endedAt());
    assertScratchEmpty();
  }

  @Test
  public void testVendorMismatchRejectedBeforeDownload() {
    storage.put("pg.sql", "SELECT 1;");
    storage.put("pg.sql.meta.json", sidecar("postgres", "16.2", "none", null));

    PreflightFailed e = Assert.expectThrows(PreflightFailed.class, () -> orchestrator.startRestore(request("pg.sql")));
    Assert.assertTrue(e.getMessage().contains("Incompatible database type"), e.getMessage());
    Assert.assertTrue(storage.downloads.isEmpty());
    Assert.assertTrue(database.events.isEmpty());
  }

  @Test
  public void testVendorMismatchRejectedWhenSidecarMustBeDownloaded() throws Exception {
    useStorage(new InMemoryStorage("memory", false));
    storage.put("pg.sql", "SELECT 1;");
    storage.put("pg.sql.meta.json", sidecar("postgres", "16.2", "none", null));

    PreflightFailed e = Assert.expectThrows(PreflightFailed.class, () -> orchestrator.startRestore(request("pg.sql")));
    Assert.assertTrue(e.getMessage().contains("Incompatible database type"), e.getMessage());
    Assert.assertEquals(storage.downloads, List.of("pg.sql.meta.json"));
    Assert.assertTrue(database.events.isEmpty());
    assertScratchEmpty();
  }

  @Test
  public void testDownloadedSidecarIsUsedForTheRun() throws Exception {
    useStorage(new InMemoryStorage("memory", false));
    byte[] key = TestCrypto.randomKey();
    catalog.add(TestCrypto.profile("p1", "Production", key));
    TestCrypto.Sealed sealed = TestCrypto.encrypt(key, TestCrypto.gzip(DUMP.getBytes(StandardCharsets.UTF_8)));
    storage.put("x.json.gz.enc", sealed.ciphertext());
    storage.put("x.json.gz.enc.meta.json", sidecar("mongodb", "6.0.1", "gzip", encryptionBlock("p1", sealed)));

    Execution e = orchestrator.startRestore(request("x.json.gz.enc")).await(WAIT);

    Assert.assertEquals(e.status(), ExecutionStatus.SUCCESS, e.logs().toString());
    Assert.assertEquals(new String(database.restores.get(0).content(), StandardCharsets.UTF_8), DUMP);
    Assert.assertEquals(storage.downloads, List.of("x.json.gz.enc.meta.json", "x.json.gz.enc"));
    assertScratchEmpty();
  }

  @Test
  public void testIncompleteTargetSettingsRejected() throws Exception {
    orchestrator.close();
    orchestrator = orchestrator(AdapterRegistry.builder().add(storage).add(new SqliteDatabaseAdapter()).build());
    catalog.add(new AdapterConfig("db-2", AdapterKind.DATABASE, SqliteDatabaseAdapter.ID, "Broken sqlite", Map.of()));
    storage.put("app.sql", "CREATE TABLE t (id INTEGER);");
    RestoreRequest request = RestoreRequest.builder().storageConfigId("store-1").file("app.sql").targetSourceId("db-2").build();

    ConfigurationMissing e = Assert.expectThrows(ConfigurationMissing.class, () -> orchestrator.startRestore(request));
    Assert.assertTrue(e.getMessage().contains("'path'"), e.getMessage());
    Assert.assertTrue(storage.downloads.isEmpty());
  }

  @Test
  public void testMultiDatabaseArchiveHonoursMapping() throws Exception {
    storage.put("multi.tar", Files.readAllBytes(MultiDatabaseArchiveTests.twoDatabaseArchive()));
    RestoreRequest request = RestoreRequest.builder()
        .storageConfigId("store-1").file("multi.tar").targetSourceId("db-1")
        .databaseMapping(List.of(new DatabaseMapping("a", "a2", true), new DatabaseMapping("b", "", false)))
        .build();

    Execution e = orchestrator.startRestore(request).await(WAIT);

    Assert.assertEquals(e.status(), ExecutionStatus.SUCCESS, e.logs().toString());
    Assert.assertEquals(database.singleRestores.size(), 1);
    Assert.assertEquals(database.singleRestores.get(0).sourceName(), "a");
    Assert.assertEquals(database.singleRestores.get(0).targetName(), "a2");
    Assert.assertEquals(new String(database.singleRestores.get(0).content(), StandardCharsets.UTF_8), "-- dump of a");
    Assert.assertTrue(database.restores.isEmpty());
    Assert.assertTrue(hasLog(e, "Multi-database archive detected"), e.logs().toString());
    Assert.assertTrue(hasLog(e, "Skipping database 'b' (not selected)"), e.logs().toString());
    Assert.assertEquals(database.preparations.get(0), List.of("a2"));
    assertScratchEmpty();
  }

  @Test
  public void testCloseWithGraceInterruptsStuckRestore() throws Exception {
    storage.put("m.json", DUMP);
    database.hold = new CountDownLatch(1);
    RestoreHandle handle = orchestrator.startRestore(request("m.json"));
    long deadline = System.nanoTime() + WAIT.toNanos();
    while (database.restores.isEmpty()) {
      Assert.assertTrue(System.nanoTime() < deadline, "restore never reached the database");
      Thread.sleep(10);
    }

    Assert.assertFalse(orchestrator.close(Duration.ofMillis(200)));

    Execution e = handle.await(WAIT);
    Assert.assertEquals(e.status(), ExecutionStatus.FAILED, e.logs().toString());
    Assert.assertNotNull(e.endedAt());
    assertScratchEmpty();
  }

  @Test
  public void testCloseWithGraceWhenIdle() throws Exception {
    storage.put("m.json", DUMP);
    orchestrator.startRestore(request("m.json")).await(WAIT);
    Assert.assertTrue(orchestrator.close(Duration.ofSeconds(5)));
  }

  @Test
  public void testVersionDowngradeRejected() {
    storage.put("m.json", DUMP);
    storage.put("m.json.meta.json", sidecar("mongodb", "6.0", "none", null));
    database.version = "5.0";

    Assert.expectThrows(PreflightFailed.class, () -> orchestrator.startRestore(request("m.json")));
    Assert.assertTrue(storage.downloads.isEmpty());
    Assert.assertTrue(database.restores.isEmpty());
  }

  @Test
  public void testDeniedPreparationRejected() {
    storage.put("m.json", DUMP);
    database.denyPreparation = "Permission denied: cannot create database 'copy'";
    RestoreRequest request = RestoreRequest.builder()
        .storageConfigId("store-1").file("m.json").targetSourceId("db-1").targetDatabaseName("copy").build();

    PreflightFailed e = Assert.expectThrows(PreflightFailed.class, () -> orchestrator.startRestore(request));
    Assert.assertTrue(e.getMessage().startsWith("Permission denied"), e.getMessage());
    Assert.assertEquals(database.preparations, List.of(List.of("copy")));
    Assert.assertTrue(storage.downloads.isEmpty());
  }

  @Test
  public void testUnknownConfiguration() {
    RestoreRequest unknownStorage = RestoreRequest.builder().storageConfigId("nope").file("a").targetSourceId("db-1").build();
    ConfigurationMissing e = Assert.expectThrows(ConfigurationMissing.class, () -> orchestrator.startRestore(unknownStorage));
    Assert.assertTrue(e.getMessage().startsWith("Storage not found"), e.getMessage());

    RestoreRequest unknownTarget = RestoreRequest.builder().storageConfigId("store-1").file("a").targetSourceId("nope").build();
    e = Assert.expectThrows(ConfigurationMissing.class, () -> orchestrator.startRestore(unknownTarget));
    Assert.assertTrue(e.getMessage().startsWith("Target source not found"), e.getMessage());
  }

  @Test
  public void testMissingField() {
    RestoreRequest noFile = RestoreRequest.builder().storageConfigId("store-1").targetSourceId("db-1").build();
    Assert.expectThrows(PreflightFailed.class, () -> orchestrator.startRestore(noFile));
  }

  @Test
  public void testDownloadFailure() throws Exception {
    storage.put("m.json", DUMP);
    storage.failDownloads = true;

    Execution e = orchestrator.startRestore(request("m.json")).await(WAIT);

    Assert.assertEquals(e.status(), ExecutionStatus.FAILED);
    Assert.assertTrue(hasLog(e, "connection reset"), e.logs().toString());
    Assert.assertTrue(database.restores.isEmpty());
    assertScratchEmpty();
  }

  @Test
  public void testMissingArtifact() throws Exception {
    Execution e = orchestrator.startRestore(request("does/not/exist.sql")).await(WAIT);
    Assert.assertEquals(e.status(), ExecutionStatus.FAILED);
    Assert.assertTrue(hasLog(e, "Download of 'does/not/exist.sql' failed"), e.logs().toString());
  }

  @Test
  public void testAdapterFailureIsRecorded() throws Exception {
    storage.put("m.json", DUMP);
    database.outputLines = List.of("restoring collection users", "ERROR: duplicate key");
    database.failWith = "mongorestore exited with code 1";

    Execution e = orchestrator.startRestore(request("m.json")).await(WAIT);

    Assert.assertEquals(e.status(), ExecutionStatus.FAILED);
    LogEntry last = e.logs().get(e.logs().size() - 1);
    Assert.assertEquals(last.level(), LogLevel.ERROR);
    Assert.assertEquals(last.message(), "mongorestore exited with code 1");
    Assert.assertTrue(hasLog(e, "ERROR: duplicate key"));
    assertScratchEmpty();
  }

  @Test
  public void testCompressionGuessedFromFileName() throws Exception {
    storage.put("old/backup.json.gz", TestCrypto.gzip(DUMP.getBytes(StandardCharsets.UTF_8)));

    Execution e = orchestrator.startRestore(request("old/backup.json.gz")).await(WAIT);

    Assert.assertEquals(e.status(), ExecutionStatus.SUCCESS, e.logs().toString());
    Assert.assertEquals(new String(database.restores.get(0).content(), StandardCharsets.UTF_8), DUMP);
  }

  @Test
  public void testExecutionLookup() throws Exception {
    storage.put("m.json", DUMP);
    RestoreHandle handle = orchestrator.startRestore(request("m.json"));
    Assert.assertTrue(orchestrator.execution(handle.executionId()).isPresent());
    handle.await(WAIT);
    Assert.assertEquals(orchestrator.execution(handle.executionId()).orElseThrow().status(), ExecutionStatus.SUCCESS);
    Assert.assertFalse(orchestrator.execution("missing").isPresent());
  }

}
