package cal.restore.impls;

import cal.prim.transforms.AesGcmDecryption;
import cal.prim.transforms.Compression;
import cal.prim.transforms.StreamDecoder;
import cal.restore.Util;
import cal.restore.adapters.DatabaseAdapter;
import cal.restore.adapters.StorageAdapter;
import cal.restore.errors.AdapterRestoreFailed;
import cal.restore.errors.DecompressionFailed;
import cal.restore.errors.DecryptionFailed;
import cal.restore.errors.RestoreFailed;
import cal.restore.errors.TransferFailed;
import cal.restore.types.AdapterResult;
import cal.restore.types.AdapterSettings;
import cal.restore.types.BackupMetadata;
import cal.restore.types.ConnectionTest;
import cal.restore.types.EncryptionInfo;
import cal.restore.types.LogLevel;
import cal.restore.types.LogType;
import cal.restore.types.RestoreOverrides;
import cal.restore.types.RestoreRequest;
import cal.restore.types.RestoreStage;
import cal.restore.types.RestoreTarget;
import com.google.common.io.CountingInputStream;
import lombok.extern.slf4j.Slf4j;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * The background half of one restore: download, decrypt, decompress, restore.
 * Every failure ends up in the execution record; nothing is thrown out of
 * {@link #run()}.
 */
@Slf4j
class RestoreRun implements Runnable {

  private static final String ENCRYPTED_SUFFIX = ".enc";

  private final RestoreRequest request;
  private final StorageAdapter storage;
  private final AdapterSettings storageSettings;
  private final DatabaseAdapter database;
  private final AdapterSettings databaseSettings;
  private final @Nullable BackupMetadata preflightMetadata;
  private final SmartKeyRecovery keyRecovery;
  private final MultiDatabaseArchive archives;
  private final Path scratchRoot;
  private final ExecutionTracker tracker;

  RestoreRun(RestoreRequest request,
             StorageAdapter storage, AdapterSettings storageSettings,
             DatabaseAdapter database, AdapterSettings databaseSettings,
             @Nullable BackupMetadata preflightMetadata,
             SmartKeyRecovery keyRecovery, MultiDatabaseArchive archives,
             Path scratchRoot, ExecutionTracker tracker) {
    this.request = request;
    this.storage = storage;
    this.storageSettings = storageSettings;
    this.database = database;
    this.databaseSettings = databaseSettings;
    this.preflightMetadata = preflightMetadata;
    this.keyRecovery = keyRecovery;
    this.archives = archives;
    this.scratchRoot = scratchRoot;
    this.tracker = tracker;
  }

  @Override
  public void run() {
    ScratchSpace scratch = null;
    try {
      scratch = ScratchSpace.create(scratchRoot, tracker.id());
      execute(scratch);
    } catch (RestoreFailed e) {
      log.info("Restore {} failed: {}", tracker.id(), e.getMessage());
      tracker.fail(e.getMessage(), causeOf(e));
    } catch (IOException e) {
      log.warn("Restore {} failed with an I/O error", tracker.id(), e);
      tracker.fail("I/O error: " + e.getMessage(), null);
    } catch (RuntimeException e) {
      log.error("Restore {} failed unexpectedly", tracker.id(), e);
      tracker.fail("Unexpected error: " + e, null);
    } finally {
      if (scratch != null) {
        scratch.close();
      }
    }
  }

  private static @Nullable String causeOf(Throwable e) {
    Throwable cause = e.getCause();
    return cause == null ? null : cause.toString();
  }

  private void execute(ScratchSpace scratch) throws RestoreFailed, IOException {
    String file = request.getFile();
    tracker.info("Starting restore of '" + file + "'");

    // 1. download
    tracker.advance(RestoreStage.DOWNLOADING);
    Path artifact = scratch.file(file);
    boolean downloaded;
    try {
      downloaded = storage.download(storageSettings, file, artifact, tracker::progress);
    } catch (IOException e) {
      throw new TransferFailed("Download of '" + file + "' failed: " + e.getMessage(), e);
    }
    if (!downloaded || !Files.exists(artifact)) {
      throw new TransferFailed("Download of '" + file + "' failed");
    }
    tracker.log("Downloaded " + Util.formatSize(Files.size(artifact)), LogLevel.INFO, LogType.STORAGE, null);

    BackupMetadata metadata = preflightMetadata;
    if (metadata == null) {
      tracker.info("No metadata sidecar; detecting format from the file name");
    }

    String name = Util.basename(file).toLowerCase(Locale.ROOT);
    String withoutEnc = name.endsWith(ENCRYPTED_SUFFIX) ? name.substring(0, name.length() - ENCRYPTED_SUFFIX.length()) : name;

    EncryptionInfo encryption;
    Compression compression;
    if (metadata != null) {
      encryption = metadata.isEncrypted() ? metadata.getEncryption() : null;
      compression = metadata.declaredCompression().orElseGet(() -> Compression.fromFileName(withoutEnc));
    } else {
      encryption = name.endsWith(ENCRYPTED_SUFFIX) ? new EncryptionInfo(true, null, null, null) : null;
      compression = Compression.fromFileName(withoutEnc);
    }

    Path current = artifact;

    // 2. decrypt
    if (encryption != null) {
      if (!encryption.hasParameters()) {
        throw new DecryptionFailed("Encryption metadata missing (IV/AuthTag); cannot decrypt '" + file + "'");
      }
      tracker.advance(RestoreStage.DECRYPTING);
      SmartKeyRecovery.ResolvedKey key = keyRecovery.resolve(encryption, current, compression);
      if (key.recovered()) {
        tracker.log("Smart Recovery: Unlocked using profile '" + key.profile().name() + "'", LogLevel.SUCCESS, LogType.GENERAL, null);
      }
      AesGcmDecryption decryption = new AesGcmDecryption(key.key(), Util.fromHex(encryption.iv()), Util.fromHex(encryption.authTag()));
      Path plaintext = Util.withoutSuffix(current, ENCRYPTED_SUFFIX);
      try {
        decode(current, plaintext, decryption);
      } catch (IOException e) {
        ScratchSpace.deleteQuietly(plaintext);
        throw new DecryptionFailed("Decryption failed: " + e.getMessage(), e);
      }
      ScratchSpace.deleteQuietly(current);
      current = plaintext;
      tracker.info("Decrypted with profile '" + key.profile().name() + "'");
    }

    // 3. decompress
    if (compression != Compression.NONE) {
      tracker.advance(RestoreStage.DECOMPRESSING);
      Path decompressed = Util.withoutSuffix(current, compression.extension());
      try {
        decode(current, decompressed, compression);
      } catch (IOException e) {
        ScratchSpace.deleteQuietly(decompressed);
        throw new DecompressionFailed("Decompression (" + compression + ") failed: " + e.getMessage(), e);
      }
      ScratchSpace.deleteQuietly(current);
      current = decompressed;
      tracker.info("Decompressed " + compression + " to " + Util.formatSize(Files.size(current)));
    }

    // 4. target settings, with the live version and request overrides applied once
    tracker.advance(RestoreStage.RESTORING_DATABASE);
    RestoreOverrides overrides = request.overrides().withTargetVersion(probeVersion());
    RestoreTarget target = new RestoreTarget(databaseSettings, overrides);

    // 5. restore
    AdapterResult result;
    try {
      if (MultiDatabaseArchive.isArchive(current)) {
        tracker.info("Multi-database archive detected");
        result = archives.restore(current, target, database, scratch, tracker.commandListener());
      } else {
        result = database.restore(target, current, tracker.commandListener());
      }
    } catch (IOException e) {
      throw new AdapterRestoreFailed(e.getMessage() != null ? e.getMessage() : e.toString(), e);
    }
    if (!result.success()) {
      throw new AdapterRestoreFailed(result.error() != null ? result.error() : "Restore failed");
    }

    // 6. scratch cleanup happens in run()
    tracker.succeed("Restore completed successfully");
  }

  private @Nullable String probeVersion() {
    try {
      ConnectionTest live = database.test(databaseSettings);
      if (live.success()) {
        return live.version();
      }
      tracker.warn("Could not determine target version: " + live.message());
    } catch (IOException e) {
      tracker.warn("Could not determine target version: " + e.getMessage());
    }
    return null;
  }

  private void decode(Path in, Path out, StreamDecoder decoder) throws IOException {
    long total = Files.size(in);
    byte[] buf = new byte[Util.SUGGESTED_BUFFER_SIZE];
    try (CountingInputStream counted = new CountingInputStream(Util.buffered(Files.newInputStream(in)));
         InputStream decoded = decoder.decode(counted);
         OutputStream o = Files.newOutputStream(out)) {
      int n;
      while ((n = decoded.read(buf)) >= 0) {
        o.write(buf, 0, n);
        tracker.progress(Util.percentOf(counted.getCount(), total));
      }
    }
  }

}
