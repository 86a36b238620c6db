package cal.restore.types;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * One row of a caller-supplied database mapping.  An empty
 * <code>targetName</code> means "keep the original name".
 */
public record DatabaseMapping(String originalName, @Nullable String targetName, boolean selected) {

  public String effectiveTargetName() {
    return targetName == null || targetName.isEmpty() ? originalName : targetName;
  }

}
