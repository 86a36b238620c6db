package cal.restore.adapters;

import cal.restore.errors.ConfigurationMissing;
import com.google.common.collect.ImmutableMap;

import java.util.ServiceLoader;
import java.util.Set;

/**
 * Lookup from adapter id to implementation.  Built once, then read-only.
 */
public final class AdapterRegistry {

  private final ImmutableMap<String, Adapter> adapters;

  private AdapterRegistry(ImmutableMap<String, Adapter> adapters) {
    this.adapters = adapters;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * A registry of every adapter listed under <code>META-INF/services</code>.
   */
  public static AdapterRegistry discover() {
    Builder b = builder();
    for (Adapter adapter : ServiceLoader.load(Adapter.class)) {
      b.add(adapter);
    }
    return b.build();
  }

  public StorageAdapter storage(String id) throws ConfigurationMissing {
    Adapter adapter = lookup(id);
    if (adapter instanceof StorageAdapter s) {
      return s;
    }
    throw new ConfigurationMissing("Adapter '" + id + "' is not a storage adapter");
  }

  public DatabaseAdapter database(String id) throws ConfigurationMissing {
    Adapter adapter = lookup(id);
    if (adapter instanceof DatabaseAdapter d) {
      return d;
    }
    throw new ConfigurationMissing("Adapter '" + id + "' is not a database adapter");
  }

  private Adapter lookup(String id) throws ConfigurationMissing {
    Adapter adapter = adapters.get(id);
    if (adapter == null) {
      throw new ConfigurationMissing("No adapter registered with id '" + id + "'");
    }
    return adapter;
  }

  public boolean contains(String id) {
    return adapters.containsKey(id);
  }

  public Set<String> ids() {
    return adapters.keySet();
  }

  public static final class Builder {
    private final ImmutableMap.Builder<String, Adapter> adapters = ImmutableMap.builder();

    private Builder() {
    }

    public Builder add(Adapter adapter) {
      adapters.put(adapter.id(), adapter);
      return this;
    }

    /**
     * @throws IllegalArgumentException if two adapters share an id
     */
    public AdapterRegistry build() {
      return new AdapterRegistry(adapters.buildOrThrow());
    }
  }

}
