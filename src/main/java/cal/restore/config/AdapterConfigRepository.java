package cal.restore.config;

import cal.restore.types.AdapterConfig;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the configured storage and database endpoints.
 */
public interface AdapterConfigRepository {

  Optional<AdapterConfig> findAdapterConfig(String id);

  List<AdapterConfig> adapterConfigs();

}
