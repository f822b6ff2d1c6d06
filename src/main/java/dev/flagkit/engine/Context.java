package dev.flagkit.engine;

import dev.flagkit.engine.interfaces.AxisValue;

import java.util.Objects;

import javax.annotation.Nullable;

/**
 * The attributes of a single evaluation request.
 * <p>
 * Every attribute is optional. A rule that constrains an attribute the context does not have
 * (for instance, a platform rule evaluated against a context with no platform) does not match. A
 * context without a {@link StableId} is never in an allowlist and is always placed in the last
 * rollout bucket.
 * <p>
 * Applications that need extra attributes for a {@link dev.flagkit.engine.interfaces.TargetingExtension}
 * may subclass this class.
 */
public class Context {
  private final String locale;
  private final String platform;
  private final Version appVersion;
  private final StableId stableId;
  private final AxisValues axisValues;

  /**
   * Creates an instance from a builder.
   *
   * @param builder the builder
   */
  protected Context(Builder builder) {
    this.locale = builder.locale;
    this.platform = builder.platform;
    this.appVersion = builder.appVersion;
    this.stableId = builder.stableId;
    this.axisValues = builder.axisValues == null ? AxisValues.EMPTY : builder.axisValues;
  }

  /**
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Shortcut for a context with the four standard attributes.
   *
   * @param locale the locale id, such as {@code "en_US"}
   * @param platform the platform id, such as {@code "IOS"}
   * @param appVersion the application version
   * @param stableId the stable identifier
   * @return a context
   */
  public static Context of(String locale, String platform, Version appVersion, StableId stableId) {
    return builder().locale(locale).platform(platform).appVersion(appVersion).stableId(stableId).build();
  }

  /**
   * @return the locale id, or null
   */
  @Nullable
  public String getLocale() {
    return locale;
  }

  /**
   * @return the platform id, or null
   */
  @Nullable
  public String getPlatform() {
    return platform;
  }

  /**
   * @return the application version, or null
   */
  @Nullable
  public Version getAppVersion() {
    return appVersion;
  }

  /**
   * @return the stable identifier, or null
   */
  @Nullable
  public StableId getStableId() {
    return stableId;
  }

  /**
   * @return the custom axis values; never null
   */
  public AxisValues getAxisValues() {
    return axisValues;
  }

  @Override
  public boolean equals(Object other) {
    if (other != null && other.getClass() == getClass()) {
      Context o = (Context)other;
      return Objects.equals(locale, o.locale) && Objects.equals(platform, o.platform) &&
          Objects.equals(appVersion, o.appVersion) && Objects.equals(stableId, o.stableId) &&
          axisValues.equals(o.axisValues);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hash(locale, platform, appVersion, stableId, axisValues);
  }

  @Override
  public String toString() {
    return "Context(locale=" + locale + ",platform=" + platform + ",appVersion=" + appVersion +
        ",stableId=" + stableId + ",axes=" + axisValues + ")";
  }

  /**
   * Builder for {@link Context}.
   */
  public static class Builder {
    private String locale;
    private String platform;
    private Version appVersion;
    private StableId stableId;
    private AxisValues axisValues;
    private AxisValues.Builder axisBuilder;

    /**
     * Creates an empty builder.
     */
    protected Builder() {}

    /**
     * @param locale the locale id
     * @return the builder
     */
    public Builder locale(String locale) {
      this.locale = locale;
      return this;
    }

    /**
     * @param platform the platform id
     * @return the builder
     */
    public Builder platform(String platform) {
      this.platform = platform;
      return this;
    }

    /**
     * @param appVersion the application version
     * @return the builder
     */
    public Builder appVersion(Version appVersion) {
      this.appVersion = appVersion;
      return this;
    }

    /**
     * @param stableId the stable identifier
     * @return the builder
     */
    public Builder stableId(StableId stableId) {
      this.stableId = stableId;
      return this;
    }

    /**
     * Replaces all axis values. This discards values added with {@link #axis(Axis, Enum[])}.
     *
     * @param axisValues the axis values
     * @return the builder
     */
    public Builder axisValues(AxisValues axisValues) {
      this.axisValues = axisValues;
      this.axisBuilder = null;
      return this;
    }

    /**
     * Adds values for one axis. Values set earlier with {@link #axisValues(AxisValues)} are kept.
     *
     * @param <E> the backing enum type
     * @param axis the axis
     * @param values the values
     * @return the builder
     */
    @SafeVarargs
    public final <E extends Enum<E> & AxisValue> Builder axis(Axis<E> axis, E... values) {
      if (axisBuilder == null) {
        axisBuilder = AxisValues.builder(new AxisCatalog());
        if (axisValues != null) {
          axisBuilder.putAll(axisValues);
        }
        this.axisValues = null;
      }
      axisBuilder.put(axis, values);
      return this;
    }

    /**
     * @return the context
     */
    public Context build() {
      if (axisBuilder != null) {
        axisValues = axisBuilder.build();
      }
      return new Context(this);
    }
  }
}
