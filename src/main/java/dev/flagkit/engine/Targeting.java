package dev.flagkit.engine;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import dev.flagkit.engine.interfaces.AxisValue;
import dev.flagkit.engine.interfaces.TargetingExtension;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import javax.annotation.Nullable;

/**
 * The match criteria of a rule.
 * <p>
 * Every declared criterion must hold; within one criterion, any listed value is enough. An empty
 * locale or platform set and an unbounded version range place no constraint on the context.
 */
public final class Targeting {
  /**
   * Targeting with no criteria, which matches every context.
   */
  public static final Targeting CATCH_ALL = builder().build();

  private final ImmutableSet<String> locales;
  private final ImmutableSet<String> platforms;
  private final VersionRange versionRange;
  private final ImmutableMap<String, ImmutableSet<String>> axisConstraints;
  private final TargetingExtension extension;

  private Targeting(Builder b) {
    this.locales = b.locales.build();
    this.platforms = b.platforms.build();
    this.versionRange = b.versionRange;
    ImmutableMap.Builder<String, ImmutableSet<String>> axes = ImmutableMap.builder();
    for (Map.Entry<String, ImmutableSet.Builder<String>> e: b.axisConstraints.entrySet()) {
      axes.put(e.getKey(), e.getValue().build());
    }
    this.axisConstraints = axes.build();
    this.extension = b.extension;
  }

  /**
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * @return the accepted locale ids; empty means any
   */
  public ImmutableSet<String> getLocales() {
    return locales;
  }

  /**
   * @return the accepted platform ids; empty means any
   */
  public ImmutableSet<String> getPlatforms() {
    return platforms;
  }

  /**
   * @return the accepted application versions
   */
  public VersionRange getVersionRange() {
    return versionRange;
  }

  /**
   * @return for each constrained axis id, the accepted value ids
   */
  public ImmutableMap<String, ImmutableSet<String>> getAxisConstraints() {
    return axisConstraints;
  }

  /**
   * @return the custom condition, or null
   */
  @Nullable
  public TargetingExtension getExtension() {
    return extension;
  }

  /**
   * Tests every criterion against a context.
   *
   * @param context the evaluation context
   * @return true if all criteria hold
   */
  public boolean matches(Context context) {
    if (!locales.isEmpty() && (context.getLocale() == null || !locales.contains(context.getLocale()))) {
      return false;
    }
    if (!platforms.isEmpty() && (context.getPlatform() == null || !platforms.contains(context.getPlatform()))) {
      return false;
    }
    if (versionRange.hasBounds() &&
        (context.getAppVersion() == null || !versionRange.contains(context.getAppVersion()))) {
      return false;
    }
    for (Map.Entry<String, ImmutableSet<String>> c: axisConstraints.entrySet()) {
      if (!context.getAxisValues().containsAny(c.getKey(), c.getValue())) {
        return false;
      }
    }
    return extension == null || extension.matches(context);
  }

  /**
   * The specificity contributed by the built-in criteria: one point each for a non-empty locale
   * set, a non-empty platform set, and a bounded version range, plus one per constrained axis.
   * An explicitly declared unbounded range counts the same as no range.
   *
   * @return the built-in specificity
   */
  public int getBaseSpecificity() {
    return (locales.isEmpty() ? 0 : 1) +
        (platforms.isEmpty() ? 0 : 1) +
        (versionRange.hasBounds() ? 1 : 0) +
        axisConstraints.size();
  }

  /**
   * @return the specificity reported by the custom condition, or 0 if there is none
   */
  public int getExtensionSpecificity() {
    return extension == null ? 0 : extension.specificity();
  }

  /**
   * @return the total specificity used to order rules
   */
  public int getSpecificity() {
    return getBaseSpecificity() + getExtensionSpecificity();
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof Targeting) {
      Targeting o = (Targeting)other;
      return locales.equals(o.locales) && platforms.equals(o.platforms) && versionRange.equals(o.versionRange) &&
          axisConstraints.equals(o.axisConstraints) && Objects.equals(extension, o.extension);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hash(locales, platforms, versionRange, axisConstraints, extension);
  }

  @Override
  public String toString() {
    return "Targeting(locales=" + locales + ",platforms=" + platforms + ",versions=" + versionRange +
        ",axes=" + axisConstraints + (extension == null ? "" : (",extension=" + extension.getClass().getName())) + ")";
  }

  /**
   * Builder for {@link Targeting}.
   */
  public static final class Builder {
    private final ImmutableSet.Builder<String> locales = ImmutableSet.builder();
    private final ImmutableSet.Builder<String> platforms = ImmutableSet.builder();
    private VersionRange versionRange = VersionRange.unbounded();
    private final Map<String, ImmutableSet.Builder<String>> axisConstraints = new LinkedHashMap<>();
    private TargetingExtension extension;

    private Builder() {}

    /**
     * @param localeIds accepted locale ids
     * @return the builder
     */
    public Builder locales(String... localeIds) {
      return locales(Arrays.asList(localeIds));
    }

    /**
     * @param localeIds accepted locale ids
     * @return the builder
     */
    public Builder locales(Collection<String> localeIds) {
      locales.addAll(localeIds);
      return this;
    }

    /**
     * @param platformIds accepted platform ids
     * @return the builder
     */
    public Builder platforms(String... platformIds) {
      return platforms(Arrays.asList(platformIds));
    }

    /**
     * @param platformIds accepted platform ids
     * @return the builder
     */
    public Builder platforms(Collection<String> platformIds) {
      platforms.addAll(platformIds);
      return this;
    }

    /**
     * @param range accepted application versions
     * @return the builder
     */
    public Builder versions(VersionRange range) {
      this.versionRange = Objects.requireNonNull(range, "range");
      return this;
    }

    /**
     * Adds accepted values for an axis by id. Calling this more than once for the same axis widens
     * the accepted set.
     *
     * @param axisId the axis id
     * @param valueIds accepted value ids; must not be empty
     * @return the builder
     */
    public Builder axis(String axisId, Collection<String> valueIds) {
      if (valueIds.isEmpty()) {
        throw new IllegalArgumentException("axis constraint \"" + axisId + "\" must allow at least one value");
      }
      axisConstraints.computeIfAbsent(axisId, k -> ImmutableSet.builder()).addAll(valueIds);
      return this;
    }

    /**
     * Adds accepted values for an axis.
     *
     * @param <E> the backing enum type
     * @param axis the axis
     * @param values accepted values
     * @return the builder
     */
    @SafeVarargs
    public final <E extends Enum<E> & AxisValue> Builder axis(Axis<E> axis, E... values) {
      ImmutableSet.Builder<String> ids = ImmutableSet.builder();
      for (E v: values) {
        ids.add(v.getId());
      }
      return axis(axis.getId(), ids.build());
    }

    /**
     * @param extension a custom condition, or null for none
     * @return the builder
     */
    public Builder extension(TargetingExtension extension) {
      this.extension = extension;
      return this;
    }

    /**
     * @return the targeting
     */
    public Targeting build() {
      return new Targeting(this);
    }
  }
}
