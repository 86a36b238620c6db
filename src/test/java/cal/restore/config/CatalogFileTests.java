package cal.restore.config;

import cal.restore.types.AdapterConfig;
import cal.restore.types.AdapterKind;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.time.Duration;

@Test
public class CatalogFileTests {

  private static InputStream json(String s) {
    return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  public void testLoad() throws IOException {
    CatalogFile catalog = CatalogFile.load(json("""
        {
          // where executions are kept
          "executionsDatabase": "/var/lib/db-restore/executions.db",
          "settings": { "scratchRoot": "/scratch", "flushIntervalMillis": 250, "workerThreads": 2 },
          "adapters": [
            { "id": "nas", "kind": "storage", "adapterId": "local-filesystem", "name": "NAS",
              "config": { "basePath": "/mnt/backups", "unused": null } },
            { "id": "prod", "kind": "database", "adapterId": "sqlite", "config": { "path": "/data/app.db" } }
          ],
          "profiles": [ { "id": "p1", "name": "Production", "secretKey": "00:11:22" } ],
          "somethingNew": true
        }
        """));

    Assert.assertEquals(catalog.executionsDatabase().orElseThrow(), Paths.get("/var/lib/db-restore/executions.db"));
    Assert.assertEquals(catalog.settings().getScratchRoot(), Paths.get("/scratch"));
    Assert.assertEquals(catalog.settings().getFlushInterval(), Duration.ofMillis(250));
    Assert.assertEquals(catalog.settings().getWorkerThreads(), 2);
    Assert.assertEquals(catalog.settings().getKeyProbeBytes(), RestoreSettings.DEFAULTS.getKeyProbeBytes());

    AdapterConfig nas = catalog.findAdapterConfig("nas").orElseThrow();
    Assert.assertEquals(nas.kind(), AdapterKind.STORAGE);
    Assert.assertEquals(nas.parameters().get("basePath"), "/mnt/backups");
    AdapterConfig prod = catalog.findAdapterConfig("prod").orElseThrow();
    Assert.assertEquals(prod.kind(), AdapterKind.DATABASE);
    Assert.assertEquals(prod.name(), "prod");
    Assert.assertFalse(catalog.findAdapterConfig("other").isPresent());

    Assert.assertEquals(catalog.profiles().size(), 1);
    Assert.assertEquals(catalog.findProfile("p1").orElseThrow().name(), "Production");
  }

  @Test
  public void testDefaults() throws IOException {
    CatalogFile catalog = CatalogFile.load(json("{}"));
    Assert.assertFalse(catalog.executionsDatabase().isPresent());
    Assert.assertEquals(catalog.settings(), RestoreSettings.DEFAULTS);
    Assert.assertTrue(catalog.adapterConfigs().isEmpty());
  }

  @Test
  public void testIncompleteAdapterRejected() {
    Assert.expectThrows(IOException.class, () -> CatalogFile.load(json(
        "{ \"adapters\": [ { \"id\": \"x\", \"kind\": \"storage\" } ] }")));
  }

}
