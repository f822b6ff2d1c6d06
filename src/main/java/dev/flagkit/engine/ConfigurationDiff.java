package dev.flagkit.engine;

import com.google.common.collect.ImmutableList;

import java.util.Map;
import java.util.Objects;

/**
 * The differences between two configurations of the same namespace.
 * <p>
 * A flag is "changed" when it is present in both configurations but its definition differs in any
 * property: default, active state, salt, allowlist or rules. All lists are ordered by {@link FeatureId}.
 */
public final class ConfigurationDiff {
  private final ConfigurationMetadata before;
  private final ConfigurationMetadata after;
  private final ImmutableList<FlagDefinition<?>> added;
  private final ImmutableList<FlagDefinition<?>> removed;
  private final ImmutableList<FlagChange> changed;

  private ConfigurationDiff(ConfigurationMetadata before, ConfigurationMetadata after,
      ImmutableList<FlagDefinition<?>> added, ImmutableList<FlagDefinition<?>> removed,
      ImmutableList<FlagChange> changed) {
    this.before = before;
    this.after = after;
    this.added = added;
    this.removed = removed;
    this.changed = changed;
  }

  /**
   * Compares two configurations.
   *
   * @param before the older configuration
   * @param after the newer configuration
   * @return the differences
   */
  public static ConfigurationDiff between(Configuration before, Configuration after) {
    ImmutableList.Builder<FlagDefinition<?>> added = ImmutableList.builder();
    ImmutableList.Builder<FlagDefinition<?>> removed = ImmutableList.builder();
    ImmutableList.Builder<FlagChange> changed = ImmutableList.builder();
    // both maps iterate in FeatureId order, so each list comes out sorted
    for (Map.Entry<FeatureId, FlagDefinition<?>> e: after.getFlags().entrySet()) {
      FlagDefinition<?> old = before.get(e.getKey());
      if (old == null) {
        added.add(e.getValue());
      } else if (!old.equals(e.getValue())) {
        changed.add(new FlagChange(e.getKey(), old, e.getValue()));
      }
    }
    for (Map.Entry<FeatureId, FlagDefinition<?>> e: before.getFlags().entrySet()) {
      if (after.get(e.getKey()) == null) {
        removed.add(e.getValue());
      }
    }
    return new ConfigurationDiff(before.getMetadata(), after.getMetadata(),
        added.build(), removed.build(), changed.build());
  }

  /**
   * @return metadata of the older configuration
   */
  public ConfigurationMetadata getBefore() {
    return before;
  }

  /**
   * @return metadata of the newer configuration
   */
  public ConfigurationMetadata getAfter() {
    return after;
  }

  /**
   * @return definitions only in the newer configuration
   */
  public ImmutableList<FlagDefinition<?>> getAdded() {
    return added;
  }

  /**
   * @return definitions only in the older configuration
   */
  public ImmutableList<FlagDefinition<?>> getRemoved() {
    return removed;
  }

  /**
   * @return flags whose definitions differ
   */
  public ImmutableList<FlagChange> getChanged() {
    return changed;
  }

  /**
   * @return true if the flag sets and definitions are identical
   */
  public boolean isEmpty() {
    return added.isEmpty() && removed.isEmpty() && changed.isEmpty();
  }

  @Override
  public String toString() {
    return "ConfigurationDiff(added=" + added.size() + ",removed=" + removed.size() + ",changed=" + changed.size() + ")";
  }

  /**
   * One flag whose definition differs between two configurations.
   */
  public static final class FlagChange {
    private final FeatureId id;
    private final FlagDefinition<?> before;
    private final FlagDefinition<?> after;

    FlagChange(FeatureId id, FlagDefinition<?> before, FlagDefinition<?> after) {
      this.id = id;
      this.before = before;
      this.after = after;
    }

    /**
     * @return the flag identity
     */
    public FeatureId getId() {
      return id;
    }

    /**
     * @return the older definition
     */
    public FlagDefinition<?> getBefore() {
      return before;
    }

    /**
     * @return the newer definition
     */
    public FlagDefinition<?> getAfter() {
      return after;
    }

    @Override
    public boolean equals(Object other) {
      if (other instanceof FlagChange) {
        FlagChange o = (FlagChange)other;
        return id.equals(o.id) && before.equals(o.before) && after.equals(o.after);
      }
      return false;
    }

    @Override
    public int hashCode() {
      return Objects.hash(id, before, after);
    }
  }
}
