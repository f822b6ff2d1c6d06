package dev.flagkit.engine;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import javax.annotation.Nullable;

/**
 * An incremental change to a configuration: definitions to add or replace, flags to remove, and
 * optionally new metadata.
 * <p>
 * Applying a patch produces a new {@link Configuration}; it never modifies the one it was applied to.
 * Removals are applied before upserts, so a patch that both removes and upserts a flag keeps the
 * upserted definition.
 */
public final class ConfigurationPatch {
  private final ImmutableList<FlagDefinition<?>> upserts;
  private final ImmutableSet<FeatureId> removals;
  private final ConfigurationMetadata metadata;

  private ConfigurationPatch(Builder b) {
    this.upserts = ImmutableList.copyOf(b.upserts);
    this.removals = ImmutableSet.copyOf(b.removals);
    this.metadata = b.metadata;
  }

  /**
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * @return definitions to add or replace
   */
  public ImmutableList<FlagDefinition<?>> getUpserts() {
    return upserts;
  }

  /**
   * @return flags to remove
   */
  public ImmutableSet<FeatureId> getRemovals() {
    return removals;
  }

  /**
   * @return replacement metadata, or null to keep the current metadata
   */
  @Nullable
  public ConfigurationMetadata getMetadata() {
    return metadata;
  }

  /**
   * @param current the configuration to start from
   * @return the patched configuration
   */
  public Configuration applyTo(Configuration current) {
    Configuration.Builder b = current.toBuilder();
    for (FeatureId id: removals) {
      b.remove(id);
    }
    b.putAll(upserts);
    if (metadata != null) {
      b.metadata(metadata);
    }
    return b.build();
  }

  /**
   * Builder for {@link ConfigurationPatch}.
   */
  public static final class Builder {
    private final List<FlagDefinition<?>> upserts = new ArrayList<>();
    private final Set<FeatureId> removals = new LinkedHashSet<>();
    private ConfigurationMetadata metadata;

    private Builder() {}

    /**
     * @param definition a definition to add or replace
     * @return the builder
     */
    public Builder upsert(FlagDefinition<?> definition) {
      upserts.add(definition);
      return this;
    }

    /**
     * @param id a flag to remove
     * @return the builder
     */
    public Builder remove(FeatureId id) {
      removals.add(id);
      return this;
    }

    /**
     * @param metadata replacement metadata
     * @return the builder
     */
    public Builder metadata(ConfigurationMetadata metadata) {
      this.metadata = metadata;
      return this;
    }

    /**
     * @return the patch
     */
    public ConfigurationPatch build() {
      return new ConfigurationPatch(this);
    }
  }
}
