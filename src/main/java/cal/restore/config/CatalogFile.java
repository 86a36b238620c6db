package cal.restore.config;

import cal.restore.types.AdapterConfig;
import cal.restore.types.AdapterKind;
import cal.restore.types.EncryptionProfile;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Configuration loaded from a JSON file (comments allowed):
 *
 * <pre>
 * {
 *   "executionsDatabase": "/var/lib/db-restore/executions.db",
 *   "settings": { "scratchRoot": "/tmp/db-restore", "flushIntervalMillis": 1000 },
 *   "adapters": [
 *     { "id": "nas", "kind": "storage", "adapterId": "local-filesystem",
 *       "name": "NAS", "config": { "basePath": "/mnt/backups" } }
 *   ],
 *   "profiles": [ { "id": "p1", "name": "Production", "secretKey": "iv:tag:ciphertext" } ]
 * }
 * </pre>
 */
public class CatalogFile implements AdapterConfigRepository, EncryptionProfileRepository {

  private static class RawSettings {
    public @Nullable String scratchRoot;
    public @Nullable Long flushIntervalMillis;
    public @Nullable Integer keyProbeBytes;
    public @Nullable Double printableThreshold;
    public @Nullable Integer workerThreads;
  }

  private static class RawAdapter {
    public @Nullable String id;
    public @Nullable AdapterKind kind;
    public @Nullable String adapterId;
    public @Nullable String name;
    public @Nullable Map<String, Object> config;
  }

  private static class RawProfile {
    public @Nullable String id;
    public @Nullable String name;
    public @Nullable String secretKey;
  }

  private static class RawCatalog {
    public @Nullable String executionsDatabase;
    public @Nullable RawSettings settings;
    public @Nullable List<RawAdapter> adapters;
    public @Nullable List<RawProfile> profiles;
  }

  private final RestoreSettings settings;
  private final @Nullable Path executionsDatabase;
  private final ImmutableList<AdapterConfig> adapters;
  private final ImmutableList<EncryptionProfile> profiles;

  private CatalogFile(RestoreSettings settings, @Nullable Path executionsDatabase, ImmutableList<AdapterConfig> adapters, ImmutableList<EncryptionProfile> profiles) {
    this.settings = settings;
    this.executionsDatabase = executionsDatabase;
    this.adapters = adapters;
    this.profiles = profiles;
  }

  public static CatalogFile load(Path file) throws IOException {
    try (InputStream in = Files.newInputStream(file)) {
      return load(in);
    }
  }

  public static CatalogFile load(InputStream in) throws IOException {
    JsonFactory f = new JsonFactory();
    f.enable(JsonParser.Feature.ALLOW_COMMENTS);
    ObjectMapper mapper = new ObjectMapper(f)
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    RawCatalog r = mapper.readValue(in, RawCatalog.class);
    if (r == null) {
      throw new IOException("configuration is empty");
    }

    RestoreSettings.RestoreSettingsBuilder settings = RestoreSettings.DEFAULTS.toBuilder();
    if (r.settings != null) {
      RawSettings s = r.settings;
      if (s.scratchRoot != null) settings.scratchRoot(Paths.get(s.scratchRoot));
      if (s.flushIntervalMillis != null) settings.flushInterval(Duration.ofMillis(s.flushIntervalMillis));
      if (s.keyProbeBytes != null) settings.keyProbeBytes(s.keyProbeBytes);
      if (s.printableThreshold != null) settings.printableThreshold(s.printableThreshold);
      if (s.workerThreads != null) settings.workerThreads(s.workerThreads);
    }

    ImmutableList.Builder<AdapterConfig> adapters = ImmutableList.builder();
    if (r.adapters != null) {
      for (RawAdapter a : r.adapters) {
        if (a.id == null || a.kind == null || a.adapterId == null) {
          throw new IOException("adapter configuration needs 'id', 'kind' and 'adapterId'");
        }
        adapters.add(new AdapterConfig(a.id, a.kind, a.adapterId, a.name != null ? a.name : a.id,
            a.config != null ? a.config : Map.of()));
      }
    }

    ImmutableList.Builder<EncryptionProfile> profiles = ImmutableList.builder();
    if (r.profiles != null) {
      for (RawProfile p : r.profiles) {
        if (p.id == null || p.secretKey == null) {
          throw new IOException("encryption profile needs 'id' and 'secretKey'");
        }
        profiles.add(new EncryptionProfile(p.id, p.name != null ? p.name : p.id, p.secretKey));
      }
    }

    return new CatalogFile(
        settings.build(),
        r.executionsDatabase != null ? Paths.get(r.executionsDatabase) : null,
        adapters.build(),
        profiles.build());
  }

  public RestoreSettings settings() {
    return settings;
  }

  /**
   * Where executions are persisted; empty to keep them in memory only.
   */
  public Optional<Path> executionsDatabase() {
    return Optional.ofNullable(executionsDatabase);
  }

  @Override
  public Optional<AdapterConfig> findAdapterConfig(String id) {
    return adapters.stream().filter(a -> a.id().equals(id)).findFirst();
  }

  @Override
  public List<AdapterConfig> adapterConfigs() {
    return adapters;
  }

  @Override
  public Optional<EncryptionProfile> findProfile(String id) {
    return profiles.stream().filter(p -> p.id().equals(id)).findFirst();
  }

  @Override
  public List<EncryptionProfile> profiles() {
    return profiles;
  }

}
