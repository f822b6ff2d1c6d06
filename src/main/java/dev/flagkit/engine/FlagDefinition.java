package dev.flagkit.engine;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * The complete behavior of one feature flag: its default, whether it is active, the salt used for
 * bucketing, and its rules.
 * <p>
 * Rules are kept in declaration order, which is also the order they are serialized in. They are
 * evaluated in order of descending specificity; rules with equal specificity keep their declaration
 * order relative to each other.
 * <p>
 * Definitions are immutable. A changed flag is represented by a new definition in a new
 * {@link Configuration}.
 *
 * @param <T> the flag's value type
 */
public final class FlagDefinition<T> {
  /**
   * The salt used when a definition does not declare one.
   */
  public static final String DEFAULT_SALT = "v1";

  private static final Comparator<Rule<?>> BY_SPECIFICITY_DESCENDING =
      Comparator.comparingInt((Rule<?> r) -> r.getSpecificity()).reversed();

  private final Feature<T> feature;
  private final T defaultValue;
  private final boolean active;
  private final String salt;
  private final ImmutableList<Rule<T>> rules;
  private final ImmutableSet<StableId> allowlist;
  private final ImmutableList<Rule<T>> rulesByPrecedence;

  private FlagDefinition(Builder<T> b) {
    this.feature = b.feature;
    this.defaultValue = b.defaultValue;
    this.active = b.active;
    this.salt = b.salt;
    this.rules = ImmutableList.copyOf(b.rules);
    this.allowlist = b.allowlist.build();
    List<Rule<T>> sorted = new ArrayList<>(rules);
    sorted.sort(BY_SPECIFICITY_DESCENDING); // List.sort is stable, so ties keep declaration order
    this.rulesByPrecedence = ImmutableList.copyOf(sorted);
  }

  /**
   * Starts building a definition.
   *
   * @param <T> the value type
   * @param feature the flag
   * @param defaultValue the value returned when no rule applies
   * @return a builder
   */
  public static <T> Builder<T> builder(Feature<T> feature, T defaultValue) {
    return new Builder<>(feature, defaultValue);
  }

  /**
   * @return the flag
   */
  public Feature<T> getFeature() {
    return feature;
  }

  /**
   * @return the value returned when no rule applies
   */
  public T getDefaultValue() {
    return defaultValue;
  }

  /**
   * @return false if the flag always returns its default
   */
  public boolean isActive() {
    return active;
  }

  /**
   * @return the bucketing salt
   */
  public String getSalt() {
    return salt;
  }

  /**
   * @return the rules in declaration order
   */
  public ImmutableList<Rule<T>> getRules() {
    return rules;
  }

  /**
   * @return the rules in evaluation order
   */
  public ImmutableList<Rule<T>> getRulesByPrecedence() {
    return rulesByPrecedence;
  }

  /**
   * @return stable ids that are inside the rollout of every matching rule
   */
  public ImmutableSet<StableId> getAllowlist() {
    return allowlist;
  }

  /**
   * Returns a builder initialized with this definition's properties.
   *
   * @return a builder
   */
  public Builder<T> toBuilder() {
    Builder<T> b = new Builder<>(feature, defaultValue);
    b.active = active;
    b.salt = salt;
    b.rules.addAll(rules);
    b.allowlist.addAll(allowlist);
    return b;
  }

  // Used for test overrides: an active definition whose only rule returns the given value to everyone.
  FlagDefinition<T> overriddenWith(T value) {
    return builder(feature, defaultValue)
        .salt(salt)
        .rule(Rule.builder(value).note("override").build())
        .build();
  }

  /**
   * Walks the rules for a context without checking the registry kill-switch. Inactive flags
   * produce the default with nothing matched.
   */
  Trace<T> evaluateTrace(Context context) {
    if (!active) {
      return new Trace<>(defaultValue, null, null, null, false);
    }
    StableId stableId = context.getStableId();
    boolean flagAllowlisted = stableId != null && allowlist.contains(stableId);
    Integer bucket = null;
    Rule<T> skippedByRollout = null;
    for (int i = 0; i < rulesByPrecedence.size(); i++) {
      Rule<T> rule = rulesByPrecedence.get(i);
      if (!rule.getTargeting().matches(context)) {
        continue;
      }
      if (bucket == null) {
        bucket = EvaluatorBucketing.bucket(salt, feature.getKey(), stableId);
      }
      boolean allowlisted = flagAllowlisted || (stableId != null && rule.getAllowlist().contains(stableId));
      if (allowlisted || EvaluatorBucketing.isInRampUp(rule.getRollout(), bucket)) {
        return new Trace<>(rule.getValue(), bucket, rule, skippedByRollout,
            allowlisted && !EvaluatorBucketing.isInRampUp(rule.getRollout(), bucket));
      }
      if (skippedByRollout == null) {
        skippedByRollout = rule;
      }
    }
    return new Trace<>(defaultValue, bucket, null, skippedByRollout, false);
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof FlagDefinition) {
      FlagDefinition<?> o = (FlagDefinition<?>)other;
      return feature.equals(o.feature) && defaultValue.equals(o.defaultValue) && active == o.active &&
          salt.equals(o.salt) && rules.equals(o.rules) && allowlist.equals(o.allowlist);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hash(feature, defaultValue, active, salt, rules, allowlist);
  }

  @Override
  public String toString() {
    return "FlagDefinition(" + feature.getId() + ",default=" + defaultValue + ",active=" + active +
        ",salt=" + salt + ",rules=" + rules + ")";
  }

  static final class Trace<T> {
    final T value;
    final Integer bucket;
    final Rule<T> matched;
    final Rule<T> skippedByRollout;
    final boolean matchedByAllowlist;

    Trace(T value, Integer bucket, Rule<T> matched, Rule<T> skippedByRollout, boolean matchedByAllowlist) {
      this.value = value;
      this.bucket = bucket;
      this.matched = matched;
      this.skippedByRollout = skippedByRollout;
      this.matchedByAllowlist = matchedByAllowlist;
    }
  }

  /**
   * Builder for {@link FlagDefinition}.
   *
   * @param <T> the value type
   */
  public static final class Builder<T> {
    private final Feature<T> feature;
    private final T defaultValue;
    private boolean active = true;
    private String salt = DEFAULT_SALT;
    private final List<Rule<T>> rules = new ArrayList<>();
    private final ImmutableSet.Builder<StableId> allowlist = ImmutableSet.builder();

    private Builder(Feature<T> feature, T defaultValue) {
      this.feature = Objects.requireNonNull(feature, "feature");
      this.defaultValue = feature.checkValue(defaultValue);
    }

    /**
     * @param active false to make the flag always return its default
     * @return the builder
     */
    public Builder<T> active(boolean active) {
      this.active = active;
      return this;
    }

    /**
     * @param salt the bucketing salt; changing it reshuffles every rollout of the flag
     * @return the builder
     */
    public Builder<T> salt(String salt) {
      if (salt == null || salt.isEmpty()) {
        throw new IllegalArgumentException("salt must not be empty");
      }
      this.salt = salt;
      return this;
    }

    /**
     * Appends a rule.
     *
     * @param rule the rule
     * @return the builder
     */
    public Builder<T> rule(Rule<T> rule) {
      feature.checkValue(rule.getValue());
      rules.add(rule);
      return this;
    }

    /**
     * Appends a rule built from targeting and a value, with a full rollout.
     *
     * @param targeting the match criteria
     * @param value the value
     * @return the builder
     */
    public Builder<T> rule(Targeting targeting, T value) {
      return rule(Rule.builder(value).targeting(targeting).build());
    }

    /**
     * Removes all rules.
     *
     * @return the builder
     */
    public Builder<T> clearRules() {
      rules.clear();
      return this;
    }

    /**
     * @param ids stable ids that are inside the rollout of every matching rule
     * @return the builder
     */
    public Builder<T> allowlist(StableId... ids) {
      return allowlist(Arrays.asList(ids));
    }

    /**
     * @param ids stable ids that are inside the rollout of every matching rule
     * @return the builder
     */
    public Builder<T> allowlist(Collection<StableId> ids) {
      allowlist.addAll(ids);
      return this;
    }

    /**
     * @return the definition
     */
    public FlagDefinition<T> build() {
      return new FlagDefinition<>(this);
    }
  }
}
