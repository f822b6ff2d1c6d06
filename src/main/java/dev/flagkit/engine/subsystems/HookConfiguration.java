package dev.flagkit.engine.subsystems;

import dev.flagkit.engine.integrations.Hook;
import dev.flagkit.engine.integrations.HooksConfigurationBuilder;

import java.util.Collections;
import java.util.List;

/**
 * Encapsulates the engine's hooks configuration.
 * <p>
 * Use {@link HooksConfigurationBuilder} to construct an instance.
 */
public class HookConfiguration {
  private final List<Hook> hooks;

  /**
   * @param hooks the list of {@link Hook} that will be registered.
   */
  public HookConfiguration(List<Hook> hooks) {
    this.hooks = Collections.unmodifiableList(hooks);
  }

  /**
   * @return an immutable list of hooks
   */
  public List<Hook> getHooks() {
    return hooks;
  }
}
