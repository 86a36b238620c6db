package cal.restore.impls;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A dotted numeric engine version such as <code>8.0.36</code>, extracted
 * from whatever string the engine reports ("PostgreSQL 16.2 on x86_64...",
 * "15.0.4153.1").  Missing trailing segments compare as zero, so 8.0 equals
 * 8.0.0.
 */
public final class EngineVersion implements Comparable<EngineVersion> {

  private static final Pattern VERSION = Pattern.compile("\\d+(?:\\.\\d+)*");

  private final List<Long> segments;
  private final String text;

  private EngineVersion(List<Long> segments, String text) {
    this.segments = segments;
    this.text = text;
  }

  /**
   * @return the first dotted number in <code>s</code>, or empty if there is none
   */
  public static Optional<EngineVersion> parse(String s) {
    Matcher m = VERSION.matcher(s);
    if (!m.find()) {
      return Optional.empty();
    }
    List<Long> segments = new ArrayList<>();
    for (String part : m.group().split("\\.")) {
      try {
        segments.add(Long.parseLong(part));
      } catch (NumberFormatException e) {
        // absurdly long digit run
        return Optional.empty();
      }
    }
    return Optional.of(new EngineVersion(Collections.unmodifiableList(segments), m.group()));
  }

  @Override
  public int compareTo(EngineVersion other) {
    int n = Math.max(segments.size(), other.segments.size());
    for (int i = 0; i < n; ++i) {
      long a = i < segments.size() ? segments.get(i) : 0;
      long b = i < other.segments.size() ? other.segments.get(i) : 0;
      int c = Long.compare(a, b);
      if (c != 0) {
        return c;
      }
    }
    return 0;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof EngineVersion v && compareTo(v) == 0;
  }

  @Override
  public int hashCode() {
    int end = segments.size();
    while (end > 0 && segments.get(end - 1) == 0) {
      --end;
    }
    return segments.subList(0, end).hashCode();
  }

  @Override
  public String toString() {
    return text;
  }

}
