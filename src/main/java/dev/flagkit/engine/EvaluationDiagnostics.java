package dev.flagkit.engine;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import java.util.Objects;

import javax.annotation.Nullable;

/**
 * The result of one evaluation together with an explanation of how it was reached.
 * <p>
 * Diagnostics are produced fresh for each call and are not retained by the engine.
 *
 * @param <T> the flag's value type
 */
public final class EvaluationDiagnostics<T> {
  private final String namespaceId;
  private final String featureKey;
  private final String configVersion;
  private final EvaluationMode mode;
  private final long durationNanos;
  private final T value;
  private final Decision decision;

  EvaluationDiagnostics(String namespaceId, String featureKey, String configVersion, EvaluationMode mode,
      long durationNanos, T value, Decision decision) {
    this.namespaceId = namespaceId;
    this.featureKey = featureKey;
    this.configVersion = configVersion;
    this.mode = mode;
    this.durationNanos = durationNanos;
    this.value = value;
    this.decision = decision;
  }

  /**
   * @return the namespace id
   */
  public String getNamespaceId() {
    return namespaceId;
  }

  /**
   * @return the flag key
   */
  public String getFeatureKey() {
    return featureKey;
  }

  /**
   * @return the version of the configuration that was evaluated, or null
   */
  @Nullable
  public String getConfigVersion() {
    return configVersion;
  }

  /**
   * @return why the evaluation was performed
   */
  public EvaluationMode getMode() {
    return mode;
  }

  /**
   * @return how long the evaluation took
   */
  public long getDurationNanos() {
    return durationNanos;
  }

  /**
   * @return the resulting value; never null
   */
  public T getValue() {
    return value;
  }

  /**
   * @return how the value was chosen
   */
  public Decision getDecision() {
    return decision;
  }

  @Override
  public String toString() {
    return "EvaluationDiagnostics(" + namespaceId + "/" + featureKey + ",version=" + configVersion + "," + mode +
        ",value=" + value + "," + decision + ")";
  }

  /**
   * How an evaluation chose its value. There are exactly four kinds, identified by {@link #getKind()}.
   */
  public abstract static class Decision {
    private Decision() {}

    /**
     * @return the kind of decision
     */
    public abstract DecisionKind getKind();
  }

  /**
   * The namespace kill-switch was on, so the default was returned.
   */
  public static final class RegistryDisabled extends Decision {
    static final RegistryDisabled INSTANCE = new RegistryDisabled();

    private RegistryDisabled() {}

    @Override
    public DecisionKind getKind() {
      return DecisionKind.REGISTRY_DISABLED;
    }

    @Override
    public String toString() {
      return "RegistryDisabled";
    }
  }

  /**
   * The flag was inactive, so the default was returned.
   */
  public static final class Inactive extends Decision {
    static final Inactive INSTANCE = new Inactive();

    private Inactive() {}

    @Override
    public DecisionKind getKind() {
      return DecisionKind.INACTIVE;
    }

    @Override
    public String toString() {
      return "Inactive";
    }
  }

  /**
   * A rule matched and was inside its rollout, so its value was returned.
   */
  public static final class RuleMatched extends Decision {
    private final RuleMatch matched;
    private final RuleMatch skippedByRollout;

    RuleMatched(RuleMatch matched, RuleMatch skippedByRollout) {
      this.matched = matched;
      this.skippedByRollout = skippedByRollout;
    }

    @Override
    public DecisionKind getKind() {
      return DecisionKind.RULE;
    }

    /**
     * @return the rule whose value was returned
     */
    public RuleMatch getMatched() {
      return matched;
    }

    /**
     * @return the first, more specific rule whose targeting matched but whose rollout excluded the
     *   context, or null
     */
    @Nullable
    public RuleMatch getSkippedByRollout() {
      return skippedByRollout;
    }

    @Override
    public String toString() {
      return "RuleMatched(" + matched + (skippedByRollout == null ? "" : (",skipped=" + skippedByRollout)) + ")";
    }
  }

  /**
   * No rule applied, so the default was returned.
   */
  public static final class DefaultValue extends Decision {
    private final RuleMatch skippedByRollout;

    DefaultValue(RuleMatch skippedByRollout) {
      this.skippedByRollout = skippedByRollout;
    }

    @Override
    public DecisionKind getKind() {
      return DecisionKind.DEFAULT;
    }

    /**
     * @return the first rule whose targeting matched but whose rollout excluded the context, or null
     */
    @Nullable
    public RuleMatch getSkippedByRollout() {
      return skippedByRollout;
    }

    @Override
    public String toString() {
      return "DefaultValue(" + (skippedByRollout == null ? "" : ("skipped=" + skippedByRollout)) + ")";
    }
  }

  /**
   * A rule considered during evaluation, with its bucketing details.
   */
  public static final class RuleMatch {
    private final RuleExplanation rule;
    private final BucketInfo bucket;
    private final boolean allowlisted;

    RuleMatch(RuleExplanation rule, BucketInfo bucket, boolean allowlisted) {
      this.rule = rule;
      this.bucket = bucket;
      this.allowlisted = allowlisted;
    }

    /**
     * @return a description of the rule
     */
    public RuleExplanation getRule() {
      return rule;
    }

    /**
     * @return how the context was bucketed for this rule
     */
    public BucketInfo getBucket() {
      return bucket;
    }

    /**
     * @return true if the context was included only because of an allowlist
     */
    public boolean isAllowlisted() {
      return allowlisted;
    }

    @Override
    public String toString() {
      return "RuleMatch(" + rule + "," + bucket + (allowlisted ? ",allowlisted" : "") + ")";
    }
  }

  /**
   * A read-only description of a rule.
   */
  public static final class RuleExplanation {
    private final String note;
    private final double rollout;
    private final ImmutableSet<String> locales;
    private final ImmutableSet<String> platforms;
    private final VersionRange versionRange;
    private final ImmutableMap<String, ImmutableSet<String>> axes;
    private final int baseSpecificity;
    private final int extensionSpecificity;
    private final String extensionClassName;

    RuleExplanation(Rule<?> rule) {
      Targeting t = rule.getTargeting();
      this.note = rule.getNote();
      this.rollout = rule.getRollout();
      this.locales = t.getLocales();
      this.platforms = t.getPlatforms();
      this.versionRange = t.getVersionRange();
      this.axes = t.getAxisConstraints();
      this.baseSpecificity = t.getBaseSpecificity();
      this.extensionSpecificity = t.getExtensionSpecificity();
      this.extensionClassName = t.getExtension() == null ? null : t.getExtension().getClass().getName();
    }

    @Nullable
    public String getNote() {
      return note;
    }

    public double getRollout() {
      return rollout;
    }

    public ImmutableSet<String> getLocales() {
      return locales;
    }

    public ImmutableSet<String> getPlatforms() {
      return platforms;
    }

    public VersionRange getVersionRange() {
      return versionRange;
    }

    public ImmutableMap<String, ImmutableSet<String>> getAxes() {
      return axes;
    }

    public int getBaseSpecificity() {
      return baseSpecificity;
    }

    public int getExtensionSpecificity() {
      return extensionSpecificity;
    }

    public int getTotalSpecificity() {
      return baseSpecificity + extensionSpecificity;
    }

    /**
     * @return the class name of the rule's custom condition, or null if it has none
     */
    @Nullable
    public String getExtensionClassName() {
      return extensionClassName;
    }

    @Override
    public String toString() {
      return "Rule(" + (note == null ? "" : (note + ",")) + "specificity=" + getTotalSpecificity() +
          ",rollout=" + rollout + ")";
    }
  }

  /**
   * The bucketing inputs and outcome for one rule.
   */
  public static final class BucketInfo {
    private final String featureKey;
    private final String salt;
    private final int bucket;
    private final double rollout;
    private final int thresholdBasisPoints;
    private final boolean inRollout;

    BucketInfo(String featureKey, String salt, int bucket, double rollout) {
      this.featureKey = featureKey;
      this.salt = salt;
      this.bucket = bucket;
      this.rollout = rollout;
      this.thresholdBasisPoints = EvaluatorBucketing.thresholdBasisPoints(rollout);
      this.inRollout = EvaluatorBucketing.isInRampUp(rollout, bucket);
    }

    public String getFeatureKey() {
      return featureKey;
    }

    public String getSalt() {
      return salt;
    }

    /**
     * @return the context's bucket, in [0, 9999]
     */
    public int getBucket() {
      return bucket;
    }

    public double getRollout() {
      return rollout;
    }

    public int getThresholdBasisPoints() {
      return thresholdBasisPoints;
    }

    /**
     * @return true if the bucket alone places the context inside the rollout, ignoring allowlists
     */
    public boolean isInRollout() {
      return inRollout;
    }

    @Override
    public boolean equals(Object other) {
      if (other instanceof BucketInfo) {
        BucketInfo o = (BucketInfo)other;
        return featureKey.equals(o.featureKey) && salt.equals(o.salt) && bucket == o.bucket &&
            Double.compare(rollout, o.rollout) == 0;
      }
      return false;
    }

    @Override
    public int hashCode() {
      return Objects.hash(featureKey, salt, bucket, rollout);
    }

    @Override
    public String toString() {
      return "Bucket(" + bucket + "<" + thresholdBasisPoints + "=" + inRollout + ")";
    }
  }
}
