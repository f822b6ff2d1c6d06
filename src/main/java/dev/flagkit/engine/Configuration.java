package dev.flagkit.engine;

import com.google.common.collect.ImmutableSortedMap;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * An immutable set of flag definitions for one namespace, plus metadata. This is the unit that a
 * registry activates atomically.
 * <p>
 * Definitions are keyed and iterated in {@link FeatureId} order.
 */
public final class Configuration {
  /**
   * A configuration with no flags and no metadata.
   */
  public static final Configuration EMPTY = new Configuration(ImmutableSortedMap.of(), ConfigurationMetadata.EMPTY);

  private final ImmutableSortedMap<FeatureId, FlagDefinition<?>> flags;
  private final ConfigurationMetadata metadata;

  private Configuration(ImmutableSortedMap<FeatureId, FlagDefinition<?>> flags, ConfigurationMetadata metadata) {
    this.flags = flags;
    this.metadata = metadata;
  }

  /**
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * @return the definitions, keyed by identity
   */
  public ImmutableSortedMap<FeatureId, FlagDefinition<?>> getFlags() {
    return flags;
  }

  /**
   * @return the metadata
   */
  public ConfigurationMetadata getMetadata() {
    return metadata;
  }

  /**
   * @param id a flag identity
   * @return the definition, or null if the flag is absent
   */
  public FlagDefinition<?> get(FeatureId id) {
    return flags.get(id);
  }

  /**
   * Returns the definition for a feature, checking that the stored definition has the feature's
   * value type.
   *
   * @param <T> the value type
   * @param feature the flag
   * @return the definition, or null if the flag is absent
   * @throws IllegalStateException if the stored definition was declared with a different value type
   */
  @SuppressWarnings("unchecked")
  public <T> FlagDefinition<T> get(Feature<T> feature) {
    FlagDefinition<?> def = flags.get(feature.getId());
    if (def == null) {
      return null;
    }
    if (!def.getFeature().equals(feature)) {
      throw new IllegalStateException("flag \"" + feature.getId() + "\" is stored as " + def.getFeature().getType()
          + " (" + def.getFeature().getValueClass().getName() + ") but was requested as " + feature.getType()
          + " (" + feature.getValueClass().getName() + ")");
    }
    return (FlagDefinition<T>)def;
  }

  /**
   * @param definition a definition to add or replace
   * @return a new configuration with the same metadata
   */
  public Configuration withDefinition(FlagDefinition<?> definition) {
    return toBuilder().put(definition).build();
  }

  /**
   * @param metadata new metadata
   * @return a new configuration with the same definitions
   */
  public Configuration withMetadata(ConfigurationMetadata metadata) {
    return new Configuration(flags, Objects.requireNonNull(metadata, "metadata"));
  }

  /**
   * @return a builder initialized with this configuration's contents
   */
  public Builder toBuilder() {
    Builder b = new Builder();
    b.flags.putAll(flags);
    b.metadata = metadata;
    return b;
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof Configuration) {
      Configuration o = (Configuration)other;
      return flags.equals(o.flags) && metadata.equals(o.metadata);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hash(flags, metadata);
  }

  @Override
  public String toString() {
    return "Configuration(" + metadata + ",flags=" + flags.keySet() + ")";
  }

  /**
   * Builder for {@link Configuration}.
   */
  public static final class Builder {
    private final Map<FeatureId, FlagDefinition<?>> flags = new TreeMap<>();
    private ConfigurationMetadata metadata = ConfigurationMetadata.EMPTY;

    private Builder() {}

    /**
     * Adds a definition, replacing any existing definition for the same flag.
     *
     * @param definition the definition
     * @return the builder
     */
    public Builder put(FlagDefinition<?> definition) {
      flags.put(definition.getFeature().getId(), definition);
      return this;
    }

    /**
     * @param definitions definitions to add
     * @return the builder
     */
    public Builder putAll(Collection<? extends FlagDefinition<?>> definitions) {
      for (FlagDefinition<?> d: definitions) {
        put(d);
      }
      return this;
    }

    /**
     * @param id the flag to remove
     * @return the builder
     */
    public Builder remove(FeatureId id) {
      flags.remove(id);
      return this;
    }

    /**
     * @param metadata the metadata
     * @return the builder
     */
    public Builder metadata(ConfigurationMetadata metadata) {
      this.metadata = Objects.requireNonNull(metadata, "metadata");
      return this;
    }

    /**
     * @return the configuration
     */
    public Configuration build() {
      return new Configuration(ImmutableSortedMap.copyOf(flags), metadata);
    }
  }
}
