package dev.flagkit.engine.interfaces;

import dev.flagkit.engine.ShadowMismatch;

/**
 * Receives notifications when a shadow evaluation disagrees with the baseline evaluation.
 *
 * @see dev.flagkit.engine.Namespace#evaluateWithShadow
 */
public interface ShadowMismatchListener {
  /**
   * Called on the evaluating thread after a mismatch is detected. Exceptions thrown from here are
   * logged and otherwise ignored.
   *
   * @param mismatch details of the two evaluations
   */
  void onMismatch(ShadowMismatch<?> mismatch);
}
