package dev.flagkit.engine.interfaces;

/**
 * Receives warnings about flag entries that a lenient snapshot load did not take verbatim from the
 * input.
 *
 * @see dev.flagkit.engine.SnapshotLoadOptions
 */
public interface SnapshotWarningListener {
  /**
   * Called once for each flag entry that was skipped, or for each declared flag that was filled in
   * because the snapshot did not contain it.
   *
   * @param key the encoded flag key
   * @param message what happened to the entry
   */
  void onWarning(String key, String message);
}
