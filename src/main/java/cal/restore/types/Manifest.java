package cal.restore.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * Table of contents of a multi-database archive, stored as its first entry
 * <code>manifest.json</code>.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Manifest(
    int version,
    @Nullable String createdAt,
    @Nullable String sourceType,
    @Nullable String engineVersion,
    List<Entry> databases,
    long totalSize) {

  public static final String FILE_NAME = "manifest.json";

  public Manifest {
    databases = databases == null ? List.of() : List.copyOf(databases);
  }

  /**
   * @param archiveFilename the archive member holding this database's dump
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Entry(
      String name,
      @JsonProperty("filename") String archiveFilename,
      long size,
      @Nullable String format) {
  }

}
