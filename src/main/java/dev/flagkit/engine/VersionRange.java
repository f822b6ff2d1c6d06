package dev.flagkit.engine;

import java.util.Objects;

import javax.annotation.Nullable;

/**
 * A set of application versions that a rule applies to. Bounds are inclusive.
 * <p>
 * There are exactly four shapes, identified by {@link Kind}: {@link Unbounded}, {@link LeftBound},
 * {@link RightBound} and {@link FullyBound}. Code that needs to treat them differently should switch
 * on {@link #getKind()}.
 */
public abstract class VersionRange {
  /**
   * The shape of a range. The names are also the discriminators used in serialized configuration.
   */
  public enum Kind {
    /** Every version. */
    UNBOUNDED,
    /** Versions greater than or equal to a minimum. */
    MIN_BOUND,
    /** Versions less than or equal to a maximum. */
    MAX_BOUND,
    /** Versions between a minimum and a maximum. */
    MIN_AND_MAX_BOUND
  }

  private static final Unbounded UNBOUNDED = new Unbounded();

  private VersionRange() {}

  /**
   * @return the range containing every version
   */
  public static VersionRange unbounded() {
    return UNBOUNDED;
  }

  /**
   * @param min the inclusive minimum
   * @return a range with only a lower bound
   */
  public static VersionRange atLeast(Version min) {
    return new LeftBound(Objects.requireNonNull(min, "min"));
  }

  /**
   * @param max the inclusive maximum
   * @return a range with only an upper bound
   */
  public static VersionRange atMost(Version max) {
    return new RightBound(Objects.requireNonNull(max, "max"));
  }

  /**
   * @param min the inclusive minimum
   * @param max the inclusive maximum
   * @return a range with both bounds
   * @throws IllegalArgumentException if {@code min} is greater than {@code max}
   */
  public static VersionRange between(Version min, Version max) {
    Objects.requireNonNull(min, "min");
    Objects.requireNonNull(max, "max");
    if (min.compareTo(max) > 0) {
      throw new IllegalArgumentException("version range minimum " + min + " is greater than maximum " + max);
    }
    return new FullyBound(min, max);
  }

  /**
   * @return the shape of this range
   */
  public abstract Kind getKind();

  /**
   * @return the inclusive minimum, or null if there is none
   */
  @Nullable
  public Version getMin() {
    return null;
  }

  /**
   * @return the inclusive maximum, or null if there is none
   */
  @Nullable
  public Version getMax() {
    return null;
  }

  /**
   * Returns false only for {@link Unbounded}. A range with bounds adds one point of specificity
   * to the targeting that declares it.
   *
   * @return true if the range has at least one bound
   */
  public boolean hasBounds() {
    return getKind() != Kind.UNBOUNDED;
  }

  /**
   * Tests whether a version is inside this range.
   *
   * @param version the version to test
   * @return true if the version is within the bounds
   */
  public boolean contains(Version version) {
    Version min = getMin(), max = getMax();
    return (min == null || version.compareTo(min) >= 0) && (max == null || version.compareTo(max) <= 0);
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof VersionRange) {
      VersionRange o = (VersionRange)other;
      return getKind() == o.getKind() && Objects.equals(getMin(), o.getMin()) && Objects.equals(getMax(), o.getMax());
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hash(getKind(), getMin(), getMax());
  }

  @Override
  public String toString() {
    switch (getKind()) {
    case MIN_BOUND:
      return "[" + getMin() + ",)";
    case MAX_BOUND:
      return "(," + getMax() + "]";
    case MIN_AND_MAX_BOUND:
      return "[" + getMin() + "," + getMax() + "]";
    default:
      return "(,)";
    }
  }

  /**
   * A range with no bounds.
   */
  public static final class Unbounded extends VersionRange {
    private Unbounded() {}

    @Override
    public Kind getKind() {
      return Kind.UNBOUNDED;
    }

    @Override
    public boolean contains(Version version) {
      return true;
    }
  }

  /**
   * A range with only a lower bound.
   */
  public static final class LeftBound extends VersionRange {
    private final Version min;

    private LeftBound(Version min) {
      this.min = min;
    }

    @Override
    public Kind getKind() {
      return Kind.MIN_BOUND;
    }

    @Override
    public Version getMin() {
      return min;
    }
  }

  /**
   * A range with only an upper bound.
   */
  public static final class RightBound extends VersionRange {
    private final Version max;

    private RightBound(Version max) {
      this.max = max;
    }

    @Override
    public Kind getKind() {
      return Kind.MAX_BOUND;
    }

    @Override
    public Version getMax() {
      return max;
    }
  }

  /**
   * A range with both bounds.
   */
  public static final class FullyBound extends VersionRange {
    private final Version min;
    private final Version max;

    private FullyBound(Version min, Version max) {
      this.min = min;
      this.max = max;
    }

    @Override
    public Kind getKind() {
      return Kind.MIN_AND_MAX_BOUND;
    }

    @Override
    public Version getMin() {
      return min;
    }

    @Override
    public Version getMax() {
      return max;
    }
  }
}
