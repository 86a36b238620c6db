package cal.restore.types;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A configured storage or database endpoint.
 *
 * @param id the configuration's own identifier, as referenced by restore requests
 * @param kind whether this endpoint is a storage backend or a database
 * @param adapterId which adapter implementation serves it (e.g. <code>sqlite</code>)
 * @param name display name
 * @param parameters connection parameters; sensitive values are sealed
 */
public record AdapterConfig(String id, AdapterKind kind, String adapterId, String name, Map<String, Object> parameters) {
  public AdapterConfig {
    // JSON configurations may carry explicit nulls
    parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
  }
}
