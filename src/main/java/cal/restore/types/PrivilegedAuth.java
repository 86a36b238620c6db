package cal.restore.types;

/**
 * Credentials that replace the configured ones for one restore, typically
 * to get past a permission failure found during preflight.
 */
public record PrivilegedAuth(String user, String password) {
  @Override
  public String toString() {
    return "PrivilegedAuth[user=" + user + ", password=***]";
  }
}
