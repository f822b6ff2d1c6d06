package dev.flagkit.engine;

/**
 * Options for {@link Namespace#evaluateWithShadow}.
 * <p>
 * Instances are immutable; each setter returns a modified copy.
 */
public final class ShadowOptions {
  private static final ShadowOptions DEFAULTS = new ShadowOptions(false, false);

  private final boolean evaluateCandidateWhenBaselineDisabled;
  private final boolean reportDecisionMismatches;

  private ShadowOptions(boolean evaluateCandidateWhenBaselineDisabled, boolean reportDecisionMismatches) {
    this.evaluateCandidateWhenBaselineDisabled = evaluateCandidateWhenBaselineDisabled;
    this.reportDecisionMismatches = reportDecisionMismatches;
  }

  /**
   * Returns the default options: the candidate is skipped while the baseline kill-switch is on, and
   * only value mismatches are reported.
   *
   * @return the default options
   */
  public static ShadowOptions defaults() {
    return DEFAULTS;
  }

  /**
   * @param value true to evaluate the candidate even when the baseline namespace is disabled
   * @return a modified copy
   */
  public ShadowOptions evaluateCandidateWhenBaselineDisabled(boolean value) {
    return new ShadowOptions(value, reportDecisionMismatches);
  }

  /**
   * @param value true to also report evaluations that produced the same value by a different kind
   *   of decision
   * @return a modified copy
   */
  public ShadowOptions reportDecisionMismatches(boolean value) {
    return new ShadowOptions(evaluateCandidateWhenBaselineDisabled, value);
  }

  public boolean isEvaluateCandidateWhenBaselineDisabled() {
    return evaluateCandidateWhenBaselineDisabled;
  }

  public boolean isReportDecisionMismatches() {
    return reportDecisionMismatches;
  }

  @Override
  public String toString() {
    return "ShadowOptions(evaluateCandidateWhenBaselineDisabled=" + evaluateCandidateWhenBaselineDisabled +
        ",reportDecisionMismatches=" + reportDecisionMismatches + ")";
  }
}
