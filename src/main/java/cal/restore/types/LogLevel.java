package cal.restore.types;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum LogLevel {
  @JsonProperty("info") INFO,
  @JsonProperty("success") SUCCESS,
  @JsonProperty("warning") WARNING,
  @JsonProperty("error") ERROR
}
