package cal.restore.storage;

import cal.prim.ProgressListener;
import cal.restore.adapters.TextReader;
import cal.restore.errors.ConfigurationMissing;
import cal.restore.types.AdapterSettings;
import cal.restore.types.FileInfo;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Test
public class LocalStorageAdapterTests {

  private final LocalStorageAdapter adapter = new LocalStorageAdapter();
  private Path base;
  private AdapterSettings settings;

  @BeforeMethod
  public void setUp() throws Exception {
    base = Files.createTempDirectory("local-storage");
    Files.createDirectories(base.resolve("jobs/nightly"));
    Files.writeString(base.resolve("jobs/nightly/a.sql"), "SELECT 1;");
    Files.writeString(base.resolve("jobs/nightly/a.sql.meta.json"), "{}");
    Files.writeString(base.resolve("top.sql"), "SELECT 2;");
    settings = new AdapterSettings(Map.of("basePath", base.toString()));
  }

  @Test
  public void testCheckSettingsReportsMissingBasePath() throws Exception {
    ConfigurationMissing e = Assert.expectThrows(ConfigurationMissing.class,
        () -> adapter.checkSettings(new AdapterSettings(Map.of())));
    Assert.assertTrue(e.getMessage().contains("'basePath'"), e.getMessage());
    adapter.checkSettings(settings);
  }

  @Test
  public void testList() throws Exception {
    List<String> paths = new ArrayList<>();
    for (FileInfo f : adapter.list(settings, "jobs")) {
      paths.add(f.path());
    }
    paths.sort(null);
    Assert.assertEquals(paths, List.of("jobs/nightly/a.sql", "jobs/nightly/a.sql.meta.json"));
    Assert.assertEquals(adapter.list(settings, "").size(), 3);
    Assert.assertTrue(adapter.list(settings, "missing").isEmpty());
  }

  @Test
  public void testDownload() throws Exception {
    Path local = Files.createTempFile("download", ".sql");
    List<Integer> progress = new ArrayList<>();
    ProgressListener listener = progress::add;

    Assert.assertTrue(adapter.download(settings, "/jobs/nightly/a.sql", local, listener));
    Assert.assertEquals(Files.readString(local), "SELECT 1;");
    Assert.assertEquals((int) progress.get(progress.size() - 1), 100);

    Assert.assertFalse(adapter.download(settings, "jobs/none.sql", local, ProgressListener.IGNORE));
  }

  @Test
  public void testReading() throws Exception {
    TextReader reader = adapter.reading().orElseThrow();
    Assert.assertEquals(reader.read(settings, "jobs/nightly/a.sql.meta.json"), "{}");
    Assert.assertNull(reader.read(settings, "jobs/nightly/b.sql.meta.json"));
  }

  @Test
  public void testTraversalDenied() {
    AccessDeniedException e = Assert.expectThrows(AccessDeniedException.class,
        () -> adapter.download(settings, "../../etc/passwd", base.resolve("x"), ProgressListener.IGNORE));
    Assert.assertTrue(e.getMessage().contains("Access denied"), e.getMessage());
    Assert.expectThrows(AccessDeniedException.class, () -> adapter.reading().orElseThrow().read(settings, "jobs/../../x"));
  }

  @Test
  public void testUploadAndDelete() throws Exception {
    Path local = Files.createTempFile("upload", ".sql");
    Files.write(local, "INSERT".getBytes(StandardCharsets.UTF_8));

    Assert.assertTrue(adapter.upload(settings, local, "new/dir/b.sql"));
    Assert.assertEquals(Files.readString(base.resolve("new/dir/b.sql")), "INSERT");
    Assert.assertFalse(Files.exists(base.resolve("new/dir/b.sql.part")));

    Assert.assertTrue(adapter.delete(settings, "new/dir/b.sql"));
    Assert.assertFalse(Files.exists(base.resolve("new/dir/b.sql")));
    Assert.assertTrue(adapter.delete(settings, "new/dir/b.sql"));
  }

  @Test
  public void testConnection() {
    Assert.assertTrue(adapter.test(settings).success());
    AdapterSettings missing = new AdapterSettings(Map.of("basePath", base.resolve("nope").toString()));
    Assert.assertFalse(adapter.test(missing).success());
  }

}
