package cal.prim;

/**
 * Receives whole-number completion percentages in the range [0, 100].
 */
@FunctionalInterface
public interface ProgressListener {

  ProgressListener IGNORE = percent -> { };

  void onProgress(int percent);

}
