package dev.flagkit.engine.integrations;

import dev.flagkit.engine.DecisionKind;
import dev.flagkit.engine.EvaluationMode;

import javax.annotation.Nullable;

/**
 * A read-only description of one flag evaluation, passed to {@link Hook#afterEvaluation(EvaluationRecord)}.
 */
public final class EvaluationRecord {
  private final String namespaceId;
  private final String featureKey;
  private final EvaluationMode mode;
  private final DecisionKind decision;
  private final long durationNanos;
  private final Integer matchedRuleSpecificity;
  private final Integer bucket;
  private final String configVersion;

  /**
   * Creates an instance.
   *
   * @param namespaceId the namespace id
   * @param featureKey the flag key
   * @param mode why the evaluation was performed
   * @param decision the kind of outcome
   * @param durationNanos how long the evaluation took
   * @param matchedRuleSpecificity the specificity of the matched rule, or null
   * @param bucket the context's rollout bucket, or null if no rule's targeting matched
   * @param configVersion the configuration version, or null
   */
  public EvaluationRecord(String namespaceId, String featureKey, EvaluationMode mode, DecisionKind decision,
      long durationNanos, @Nullable Integer matchedRuleSpecificity, @Nullable Integer bucket,
      @Nullable String configVersion) {
    this.namespaceId = namespaceId;
    this.featureKey = featureKey;
    this.mode = mode;
    this.decision = decision;
    this.durationNanos = durationNanos;
    this.matchedRuleSpecificity = matchedRuleSpecificity;
    this.bucket = bucket;
    this.configVersion = configVersion;
  }

  public String getNamespaceId() {
    return namespaceId;
  }

  public String getFeatureKey() {
    return featureKey;
  }

  public EvaluationMode getMode() {
    return mode;
  }

  public DecisionKind getDecision() {
    return decision;
  }

  public long getDurationNanos() {
    return durationNanos;
  }

  @Nullable
  public Integer getMatchedRuleSpecificity() {
    return matchedRuleSpecificity;
  }

  @Nullable
  public Integer getBucket() {
    return bucket;
  }

  @Nullable
  public String getConfigVersion() {
    return configVersion;
  }

  @Override
  public String toString() {
    return "EvaluationRecord(" + namespaceId + "/" + featureKey + "," + mode + "," + decision +
        ",nanos=" + durationNanos + ",specificity=" + matchedRuleSpecificity + ",bucket=" + bucket +
        ",version=" + configVersion + ")";
  }
}
