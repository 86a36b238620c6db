package cal.restore;

import cal.prim.ProgressListener;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;

public abstract class Util {

  public static final long ONE_BYTE = 1;
  public static final long ONE_KB = ONE_BYTE * 1024;
  public static final long ONE_MB = ONE_KB * 1024;
  public static final long ONE_GB = ONE_MB * 1024;

  /**
   * The suggested size of in-memory byte buffers for I/O.
   * The value is 8192, which is currently the size used by {@link BufferedInputStream}
   * on desktop JVMs.
   */
  public static final int SUGGESTED_BUFFER_SIZE = 8192;

  /**
   * A thread-local byte array of {@link #SUGGESTED_BUFFER_SIZE} bytes.
   */
  private static final ThreadLocal<byte[]> MEM_BUFFER = ThreadLocal.withInitial(() -> new byte[SUGGESTED_BUFFER_SIZE]);

  public static long copyStream(InputStream in, OutputStream out) throws IOException {
    return copyStream(in, out, -1, ProgressListener.IGNORE);
  }

  /**
   * Copy <code>in</code> to <code>out</code>, reporting whole-number percentages
   * of <code>expectedSize</code> to <code>progress</code> as they change.
   * If <code>expectedSize</code> is not positive, no progress is reported.
   *
   * @return the number of bytes copied
   */
  public static long copyStream(InputStream in, OutputStream out, long expectedSize, ProgressListener progress) throws IOException {
    byte[] buf = MEM_BUFFER.get();
    long count = 0;
    int lastPercent = -1;
    int n;
    while ((n = in.read(buf)) >= 0) {
      out.write(buf, 0, n);
      count += n;
      if (expectedSize > 0) {
        int percent = percentOf(count, expectedSize);
        if (percent != lastPercent) {
          lastPercent = percent;
          progress.onProgress(percent);
        }
      }
    }
    return count;
  }

  public static int percentOf(long done, long total) {
    if (total <= 0) {
      return 0;
    }
    return (int) Math.min(100, done * 100 / total);
  }

  public static BufferedInputStream buffered(InputStream in) {
    return new BufferedInputStream(in, SUGGESTED_BUFFER_SIZE);
  }

  public static byte[] read(InputStream in) throws IOException {
    try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
      copyStream(in, out);
      return out.toByteArray();
    }
  }

  /**
   * Read as many bytes as possible into <code>buffer</code>, stopping early only
   * at end of stream.
   *
   * @return the number of bytes read
   */
  public static int readChunk(InputStream in, byte[] buffer) throws IOException {
    int total = 0;
    while (total < buffer.length) {
      int n = in.read(buffer, total, buffer.length - total);
      if (n < 0) {
        break;
      }
      total += n;
    }
    return total;
  }

  public static long divideAndRoundUp(long numerator, long denominator) {
    return (numerator + denominator - 1) / denominator;
  }

  public static String formatSize(long l) {
    if (l > ONE_GB) return divideAndRoundUp(l, ONE_GB) + " Gb";
    if (l > ONE_MB) return divideAndRoundUp(l, ONE_MB) + " Mb";
    if (l > ONE_KB) return divideAndRoundUp(l, ONE_KB) + " Kb";
    return l + " bytes";
  }

  private static final String HEX_CHARS = "0123456789abcdef";

  public static String toHex(byte[] bytes) {
    StringBuilder builder = new StringBuilder(bytes.length * 2);
    for (byte b : bytes) {
      int i = Byte.toUnsignedInt(b);
      builder.append(HEX_CHARS.charAt((i >> 4) & 0xF));
      builder.append(HEX_CHARS.charAt(i & 0xF));
    }
    return builder.toString();
  }

  /**
   * Convert a single hexadecimal digit to its integer value.
   * @param c a character
   * @return an int in the range [0, 15]
   */
  private static int hexValue(char c) {
    int value = Character.digit(c, 16);
    if (value < 0) {
      throw new IllegalArgumentException("character " + c + " is not a hex digit");
    }
    return value;
  }

  /**
   * Inverse of {@link #toHex(byte[])}.  Accepts upper- and lower-case digits.
   *
   * @throws IllegalArgumentException if the string has odd length or contains a non-hex character
   */
  public static byte[] fromHex(CharSequence hex) {
    int len = hex.length();
    if (len % 2 != 0) {
      throw new IllegalArgumentException("hex string has odd length " + len);
    }
    byte[] result = new byte[len / 2];
    for (int i = 0; i < result.length; ++i) {
      int val1 = hexValue(hex.charAt(i * 2));
      int val2 = hexValue(hex.charAt(i * 2 + 1));
      result[i] = (byte)(val1 << 4 | val2);
    }
    return result;
  }

  /**
   * The last segment of a slash-separated remote path.
   */
  public static String basename(String remotePath) {
    String trimmed = remotePath;
    while (trimmed.endsWith("/") && trimmed.length() > 1) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    int slash = trimmed.lastIndexOf('/');
    String name = slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
    int backslash = name.lastIndexOf('\\');
    return backslash >= 0 ? name.substring(backslash + 1) : name;
  }

  public static Path withoutSuffix(Path file, String suffix) {
    String name = file.getFileName().toString();
    if (name.endsWith(suffix) && name.length() > suffix.length()) {
      return file.resolveSibling(name.substring(0, name.length() - suffix.length()));
    }
    return file.resolveSibling(name + ".out");
  }

  public static <T extends Comparable<T>> boolean gt(T x, T y) {
    return x.compareTo(y) > 0;
  }

  public static <T extends Comparable<T>> boolean ge(T x, T y) {
    return x.compareTo(y) >= 0;
  }

}
