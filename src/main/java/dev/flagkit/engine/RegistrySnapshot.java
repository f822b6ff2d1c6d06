package dev.flagkit.engine;

import com.google.common.collect.ImmutableMap;

/**
 * The state of a namespace registry as seen by one evaluation: the active configuration, the
 * kill-switch, and any test overrides.
 * <p>
 * A snapshot is immutable, so an evaluation that uses one sees a single consistent state even if
 * the registry is changed while it runs.
 */
public final class RegistrySnapshot {
  private final String namespaceId;
  private final Configuration configuration;
  private final boolean allDisabled;
  private final ImmutableMap<FeatureId, Object> overrides;

  /**
   * Creates an instance with no overrides.
   *
   * @param namespaceId the namespace id
   * @param configuration the active configuration
   * @param allDisabled the kill-switch state
   */
  public RegistrySnapshot(String namespaceId, Configuration configuration, boolean allDisabled) {
    this(namespaceId, configuration, allDisabled, ImmutableMap.of());
  }

  RegistrySnapshot(String namespaceId, Configuration configuration, boolean allDisabled,
      ImmutableMap<FeatureId, Object> overrides) {
    this.namespaceId = namespaceId;
    this.configuration = configuration;
    this.allDisabled = allDisabled;
    this.overrides = overrides;
  }

  /**
   * @return the namespace id
   */
  public String getNamespaceId() {
    return namespaceId;
  }

  /**
   * @return the active configuration
   */
  public Configuration getConfiguration() {
    return configuration;
  }

  /**
   * @return true if every flag in the namespace is forced to its default
   */
  public boolean isAllDisabled() {
    return allDisabled;
  }

  /**
   * Returns the definition used to evaluate a feature in this snapshot. If the feature has a test
   * override, the result is an active definition that returns the override value to every context.
   *
   * @param <T> the value type
   * @param feature the flag
   * @return the definition
   * @throws FlagNotFoundException if the configuration does not contain the flag
   * @throws IllegalStateException if the stored definition has a different value type
   */
  public <T> FlagDefinition<T> flag(Feature<T> feature) {
    FlagDefinition<T> def = configuration.get(feature);
    if (def == null) {
      throw new FlagNotFoundException(feature.getId(), namespaceId);
    }
    Object override = overrides.get(feature.getId());
    if (override != null) {
      return def.overriddenWith(feature.getValueClass().cast(override));
    }
    return def;
  }
}
