package dev.flagkit.engine.subsystems;

import dev.flagkit.engine.Configuration;
import dev.flagkit.engine.Feature;
import dev.flagkit.engine.FlagDefinition;
import dev.flagkit.engine.FlagNotFoundException;
import dev.flagkit.engine.RegistrySnapshot;

import java.util.List;

/**
 * Holds the active configuration of one namespace, a bounded history of previous configurations,
 * and the namespace's kill-switch.
 * <p>
 * All methods are thread-safe. Reads never block: {@link #getConfiguration()} always returns a
 * complete configuration, either the one before or the one after any concurrent write. Writes
 * ({@link #load(Configuration)}, {@link #rollback(int)}, {@link #updateDefinition(FlagDefinition)})
 * are serialized with respect to each other.
 * <p>
 * The built-in implementation is obtained from {@link dev.flagkit.engine.Components#inMemoryRegistry(String)},
 * and each {@link dev.flagkit.engine.Namespace} owns one.
 */
public interface NamespaceRegistry {
  /**
   * The number of previous configurations kept when no limit is configured.
   */
  int DEFAULT_HISTORY_LIMIT = 10;

  /**
   * @return the id of the namespace this registry belongs to
   */
  String getNamespaceId();

  /**
   * @return the active configuration
   */
  Configuration getConfiguration();

  /**
   * Returns the active configuration together with the kill-switch state, for use by a single evaluation.
   *
   * @return a snapshot
   */
  RegistrySnapshot snapshot();

  /**
   * Makes a configuration active, pushing the previously active one onto the history. When the
   * history is full, its oldest entry is dropped.
   *
   * @param configuration the new configuration
   */
  void load(Configuration configuration);

  /**
   * Restores the configuration that was active {@code steps} loads ago and discards the history
   * entries after it.
   *
   * @param steps how many loads to undo; must be at least 1
   * @return true if the rollback happened, false if the history holds fewer than {@code steps} entries
   * @throws IllegalArgumentException if {@code steps} is less than 1
   */
  boolean rollback(int steps);

  /**
   * Undoes the most recent load.
   *
   * @return true if the rollback happened
   */
  default boolean rollback() {
    return rollback(1);
  }

  /**
   * @return previous configurations, oldest first
   */
  List<Configuration> getHistory();

  /**
   * Turns on the kill-switch: every flag in this namespace evaluates to its default.
   */
  void disableAll();

  /**
   * Turns off the kill-switch.
   */
  void enableAll();

  /**
   * @return true if the kill-switch is on
   */
  boolean isAllDisabled();

  /**
   * Returns the definition used to evaluate a feature, taking test overrides into account.
   *
   * @param <T> the value type
   * @param feature the flag
   * @return the definition
   * @throws FlagNotFoundException if the active configuration does not contain the flag
   */
  <T> FlagDefinition<T> flag(Feature<T> feature);

  /**
   * Replaces a single definition in the active configuration without adding a history entry.
   *
   * @param definition the new definition
   */
  void updateDefinition(FlagDefinition<?> definition);

  /**
   * Forces a flag to a value for every context, until the override is cleared. Overrides stack: a
   * second override hides the first until it is cleared. Overrides are meant for tests and do not
   * change the active configuration.
   *
   * @param <T> the value type
   * @param feature the flag
   * @param value the forced value
   */
  <T> void setOverride(Feature<T> feature, T value);

  /**
   * Removes the most recent override of a flag, if any.
   *
   * @param feature the flag
   */
  void clearOverride(Feature<?> feature);

  /**
   * Removes all overrides of all flags.
   */
  void clearAllOverrides();

  /**
   * @param feature the flag
   * @return true if the flag currently has an override
   */
  boolean hasOverride(Feature<?> feature);
}
