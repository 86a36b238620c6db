package cal.restore.types;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum AdapterKind {
  @JsonProperty("storage") STORAGE,
  @JsonProperty("database") DATABASE
}
