package dev.flagkit.engine.interfaces;

import dev.flagkit.engine.Context;

/**
 * An application-supplied matching condition that can be attached to a rule in addition to the
 * built-in locale, platform, version and axis criteria.
 * <p>
 * The engine does not interpret the condition; it only calls {@link #matches(Context)} and adds
 * {@link #specificity()} to the rule's specificity. Implementations must be side-effect free and
 * deterministic for a given context, and must be safe to call from many threads at once.
 */
public interface TargetingExtension {
  /**
   * Tests whether the condition holds for a context.
   *
   * @param context the evaluation context
   * @return true if the rule may apply
   */
  boolean matches(Context context);

  /**
   * Returns how much this condition narrows the rule. Most conditions should return 1.
   *
   * @return a non-negative specificity contribution
   */
  default int specificity() {
    return 1;
  }
}
