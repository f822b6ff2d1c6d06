package dev.flagkit.engine;

import com.google.common.collect.ImmutableSet;

import java.util.Arrays;
import java.util.Collection;
import java.util.Objects;

import javax.annotation.Nullable;

/**
 * A targeting rule and the value it produces.
 * <p>
 * A rule applies to a context when its {@link Targeting} matches and the context is inside the
 * rollout: either its stable id is on the rule's allowlist, or its bucket falls below the rollout
 * threshold.
 *
 * @param <T> the flag's value type
 */
public final class Rule<T> {
  /**
   * The rollout percentage of a rule that does not declare one.
   */
  public static final double FULL_ROLLOUT = 100.0;

  private final Targeting targeting;
  private final double rollout;
  private final ImmutableSet<StableId> allowlist;
  private final String note;
  private final T value;

  private Rule(Builder<T> b) {
    this.targeting = b.targeting;
    this.rollout = b.rollout;
    this.allowlist = b.allowlist.build();
    this.note = b.note;
    this.value = b.value;
  }

  /**
   * Starts building a rule that produces a value.
   *
   * @param <T> the value type
   * @param value the value produced when the rule applies
   * @return a builder
   */
  public static <T> Builder<T> builder(T value) {
    return new Builder<>(Objects.requireNonNull(value, "value"));
  }

  /**
   * Checks that a rollout percentage is usable.
   *
   * @param rollout a percentage
   * @return true if it is a number in [0, 100]
   */
  public static boolean isValidRollout(double rollout) {
    return !Double.isNaN(rollout) && rollout >= 0.0 && rollout <= 100.0;
  }

  /**
   * @return the match criteria
   */
  public Targeting getTargeting() {
    return targeting;
  }

  /**
   * @return the rollout percentage in [0, 100]
   */
  public double getRollout() {
    return rollout;
  }

  /**
   * @return stable ids that are always inside the rollout
   */
  public ImmutableSet<StableId> getAllowlist() {
    return allowlist;
  }

  /**
   * @return a free-text description, or null
   */
  @Nullable
  public String getNote() {
    return note;
  }

  /**
   * @return the value produced by this rule
   */
  public T getValue() {
    return value;
  }

  /**
   * @return the rule's specificity
   */
  public int getSpecificity() {
    return targeting.getSpecificity();
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof Rule) {
      Rule<?> o = (Rule<?>)other;
      return targeting.equals(o.targeting) && Double.compare(rollout, o.rollout) == 0 &&
          allowlist.equals(o.allowlist) && Objects.equals(note, o.note) && value.equals(o.value);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hash(targeting, rollout, allowlist, note, value);
  }

  @Override
  public String toString() {
    return "Rule(" + targeting + ",rollout=" + rollout + ",allowlist=" + allowlist.size() +
        (note == null ? "" : (",note=" + note)) + ",value=" + value + ")";
  }

  /**
   * Builder for {@link Rule}.
   *
   * @param <T> the value type
   */
  public static final class Builder<T> {
    private final T value;
    private Targeting targeting = Targeting.CATCH_ALL;
    private double rollout = FULL_ROLLOUT;
    private final ImmutableSet.Builder<StableId> allowlist = ImmutableSet.builder();
    private String note;

    private Builder(T value) {
      this.value = value;
    }

    /**
     * @param targeting the match criteria
     * @return the builder
     */
    public Builder<T> targeting(Targeting targeting) {
      this.targeting = Objects.requireNonNull(targeting, "targeting");
      return this;
    }

    /**
     * @param rollout the rollout percentage
     * @return the builder
     * @throws IllegalArgumentException if the percentage is not in [0, 100]
     */
    public Builder<T> rollout(double rollout) {
      if (!isValidRollout(rollout)) {
        throw new IllegalArgumentException("rollout must be between 0 and 100, was " + rollout);
      }
      this.rollout = rollout;
      return this;
    }

    /**
     * @param ids stable ids that are always inside the rollout
     * @return the builder
     */
    public Builder<T> allowlist(StableId... ids) {
      return allowlist(Arrays.asList(ids));
    }

    /**
     * @param ids stable ids that are always inside the rollout
     * @return the builder
     */
    public Builder<T> allowlist(Collection<StableId> ids) {
      allowlist.addAll(ids);
      return this;
    }

    /**
     * @param note a free-text description
     * @return the builder
     */
    public Builder<T> note(String note) {
      this.note = note;
      return this;
    }

    /**
     * @return the rule
     */
    public Rule<T> build() {
      return new Rule<>(this);
    }
  }
}
