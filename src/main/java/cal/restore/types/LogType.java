package cal.restore.types;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum LogType {
  @JsonProperty("general") GENERAL,
  /** Output relayed from a database engine's tooling. */
  @JsonProperty("command") COMMAND,
  @JsonProperty("storage") STORAGE
}
