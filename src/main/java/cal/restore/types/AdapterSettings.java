package cal.restore.types;

import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Map;

/**
 * Decrypted connection parameters for one adapter configuration.  Adapters
 * convert these into their own typed settings once, on use.
 */
public final class AdapterSettings {

  public static final AdapterSettings EMPTY = new AdapterSettings(Map.of());

  private final ImmutableMap<String, Object> values;

  public AdapterSettings(Map<String, ?> values) {
    this.values = ImmutableMap.copyOf(values);
  }

  public ImmutableMap<String, Object> asMap() {
    return values;
  }

  public @Nullable String getString(String key) {
    Object value = values.get(key);
    return value == null ? null : value.toString();
  }

  public String requireString(String key) {
    String value = getString(key);
    if (value == null || value.isEmpty()) {
      throw new IllegalArgumentException("missing connection parameter '" + key + "'");
    }
    return value;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof AdapterSettings other && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    // values may hold secrets
    return "AdapterSettings" + values.keySet();
  }

}
