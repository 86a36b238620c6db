package cal.prim.transforms;

import org.apache.commons.compress.compressors.brotli.BrotliCompressorInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Optional;

/**
 * Compression algorithms a backup artifact may carry.
 */
public enum Compression implements StreamDecoder {

  NONE("") {
    @Override
    public InputStream decode(InputStream data) {
      return data;
    }
  },

  GZIP(".gz") {
    @Override
    public InputStream decode(InputStream data) throws IOException {
      // concatenated members are legal gzip
      return new GzipCompressorInputStream(data, true);
    }
  },

  BROTLI(".br") {
    @Override
    public InputStream decode(InputStream data) throws IOException {
      return new BrotliCompressorInputStream(data);
    }
  };

  private final String extension;

  Compression(String extension) {
    this.extension = extension;
  }

  public String extension() {
    return extension;
  }

  /**
   * Parse a sidecar compression name.  Names are matched case-insensitively.
   */
  public static Optional<Compression> parse(String name) {
    String normalized = name.trim().toUpperCase(Locale.ROOT);
    for (Compression c : values()) {
      if (c.name().equals(normalized)) {
        return Optional.of(c);
      }
    }
    return Optional.empty();
  }

  /**
   * Guess the compression of a file from its name alone.
   */
  public static Compression fromFileName(String fileName) {
    String lower = fileName.toLowerCase(Locale.ROOT);
    if (lower.endsWith(GZIP.extension)) {
      return GZIP;
    }
    if (lower.endsWith(BROTLI.extension)) {
      return BROTLI;
    }
    return NONE;
  }

}
