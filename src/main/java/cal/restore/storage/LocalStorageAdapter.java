package cal.restore.storage;

import cal.prim.ProgressListener;
import cal.restore.Util;
import cal.restore.adapters.StorageAdapter;
import cal.restore.adapters.TextReader;
import cal.restore.errors.ConfigurationMissing;
import cal.restore.types.AdapterSettings;
import cal.restore.types.ConnectionTest;
import cal.restore.types.FileInfo;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Backups kept in a directory of the local filesystem (or a mounted share).
 * Remote paths are relative to <code>basePath</code> and may not leave it.
 */
@Slf4j
public class LocalStorageAdapter implements StorageAdapter {

  public static final String ID = "local-filesystem";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Settings(String basePath) {
    static Settings from(AdapterSettings settings) {
      Settings s = MAPPER.convertValue(settings.asMap(), Settings.class);
      if (s.basePath() == null || s.basePath().isEmpty()) {
        throw new IllegalArgumentException("local storage needs a 'basePath'");
      }
      return s;
    }
  }

  @Override
  public String id() {
    return ID;
  }

  @Override
  public String displayName() {
    return "Local Filesystem";
  }

  static Path resolve(AdapterSettings settings, String remotePath) throws AccessDeniedException {
    Path base = Paths.get(Settings.from(settings).basePath()).toAbsolutePath().normalize();
    String relative = remotePath;
    while (relative.startsWith("/") || relative.startsWith("\\")) {
      relative = relative.substring(1);
    }
    Path resolved = base.resolve(relative).normalize();
    if (!resolved.startsWith(base)) {
      throw new AccessDeniedException(remotePath, null, "Access denied: path is outside the storage directory");
    }
    return resolved;
  }

  @Override
  public List<FileInfo> list(AdapterSettings settings, String dir) throws IOException {
    Path base = resolve(settings, "");
    Path start = resolve(settings, dir);
    if (!Files.isDirectory(start)) {
      return List.of();
    }
    List<FileInfo> result = new ArrayList<>();
    try (Stream<Path> files = Files.walk(start)) {
      for (Path p : (Iterable<Path>) files::iterator) {
        BasicFileAttributes attrs = Files.readAttributes(p, BasicFileAttributes.class);
        if (attrs.isRegularFile()) {
          String relative = base.relativize(p).toString().replace('\\', '/');
          result.add(new FileInfo(p.getFileName().toString(), relative, attrs.size(), attrs.lastModifiedTime().toInstant()));
        }
      }
    }
    return result;
  }

  @Override
  public boolean download(AdapterSettings settings, String remotePath, Path localPath, ProgressListener progress) throws IOException {
    Path source = resolve(settings, remotePath);
    if (!Files.isRegularFile(source)) {
      log.debug("No file at {}", source);
      return false;
    }
    long size = Files.size(source);
    try (InputStream in = Files.newInputStream(source);
         OutputStream out = Files.newOutputStream(localPath)) {
      Util.copyStream(in, out, size, progress);
    }
    return true;
  }

  @Override
  public boolean upload(AdapterSettings settings, Path localPath, String remotePath) throws IOException {
    Path target = resolve(settings, remotePath);
    Path parent = target.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Path tmp = target.resolveSibling(target.getFileName() + ".part");
    Files.copy(localPath, tmp, StandardCopyOption.REPLACE_EXISTING);
    Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    return true;
  }

  @Override
  public boolean delete(AdapterSettings settings, String remotePath) throws IOException {
    Files.deleteIfExists(resolve(settings, remotePath));
    return true;
  }

  @Override
  public Optional<TextReader> reading() {
    return Optional.of((settings, remotePath) -> {
      Path file = resolve(settings, remotePath);
      if (!Files.isRegularFile(file)) {
        return null;
      }
      return Files.readString(file, StandardCharsets.UTF_8);
    });
  }

  @Override
  public void checkSettings(AdapterSettings settings) throws ConfigurationMissing {
    try {
      Settings.from(settings);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationMissing("Invalid settings: " + e.getMessage(), e);
    }
  }

  @Override
  public ConnectionTest test(AdapterSettings settings) {
    Path base = Paths.get(Settings.from(settings).basePath());
    if (!Files.isDirectory(base)) {
      return ConnectionTest.failed("Directory " + base + " does not exist");
    }
    if (!Files.isWritable(base)) {
      return ConnectionTest.failed("Directory " + base + " is not writable");
    }
    return ConnectionTest.ok("Directory " + base + " is accessible");
  }

}
