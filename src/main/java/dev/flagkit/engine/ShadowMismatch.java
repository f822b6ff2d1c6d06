package dev.flagkit.engine;

import com.google.common.collect.ImmutableSet;

import java.util.Set;

/**
 * Describes a disagreement between a baseline evaluation and a shadow evaluation of the same flag
 * for the same context.
 *
 * @param <T> the flag's value type
 * @see dev.flagkit.engine.interfaces.ShadowMismatchListener
 */
public final class ShadowMismatch<T> {
  /**
   * The ways in which two evaluations can differ.
   */
  public enum Kind {
    /**
     * The evaluations produced different values.
     */
    VALUE,

    /**
     * The evaluations reached their values through different kinds of decision.
     */
    DECISION
  }

  private final String featureKey;
  private final EvaluationDiagnostics<T> baseline;
  private final EvaluationDiagnostics<T> candidate;
  private final ImmutableSet<Kind> kinds;

  ShadowMismatch(String featureKey, EvaluationDiagnostics<T> baseline, EvaluationDiagnostics<T> candidate,
      Set<Kind> kinds) {
    this.featureKey = featureKey;
    this.baseline = baseline;
    this.candidate = candidate;
    this.kinds = ImmutableSet.copyOf(kinds);
  }

  public String getFeatureKey() {
    return featureKey;
  }

  /**
   * @return the evaluation whose value was returned to the caller
   */
  public EvaluationDiagnostics<T> getBaseline() {
    return baseline;
  }

  /**
   * @return the evaluation against the candidate registry
   */
  public EvaluationDiagnostics<T> getCandidate() {
    return candidate;
  }

  /**
   * @return the ways the evaluations differ; never empty
   */
  public ImmutableSet<Kind> getKinds() {
    return kinds;
  }

  @Override
  public String toString() {
    return "ShadowMismatch(" + featureKey + "," + kinds + ",baseline=" + baseline.getValue() + "/" +
        baseline.getDecision().getKind() + ",candidate=" + candidate.getValue() + "/" +
        candidate.getDecision().getKind() + ")";
  }
}
