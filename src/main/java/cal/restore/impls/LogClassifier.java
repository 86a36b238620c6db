package cal.restore.impls;

import cal.restore.types.LogLevel;

import java.util.Locale;

/**
 * Guesses the severity of a line of database tool output.  Tools do not
 * agree on a format, so this looks for telltale words anywhere in the line.
 */
public abstract class LogClassifier {

  public static LogLevel classify(String line) {
    String lower = line.toLowerCase(Locale.ROOT);
    if (lower.contains("error") || lower.contains("fail") || lower.contains("fatal")) {
      return LogLevel.ERROR;
    }
    if (lower.contains("warn")) {
      return LogLevel.WARNING;
    }
    return LogLevel.INFO;
  }

}
