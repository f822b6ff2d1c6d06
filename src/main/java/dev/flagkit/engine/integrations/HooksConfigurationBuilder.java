package dev.flagkit.engine.integrations;

import dev.flagkit.engine.Components;
import dev.flagkit.engine.subsystems.HookConfiguration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Contains methods for configuring the engine's hooks.
 * <p>
 * If you want to add hooks, use {@link Components#hooks()}, configure accordingly, and pass it
 * to {@link dev.flagkit.engine.EngineConfig.Builder#hooks(HooksConfigurationBuilder)}.
 *
 * <pre><code>
 *     EngineConfig config = new EngineConfig.Builder()
 *         .hooks(
 *             Components.hooks()
 *                 .setHooks(Arrays.asList(new MetricsHook()))
 *         )
 *         .build();
 * </code></pre>
 * <p>
 * Note that this class is abstract; the actual implementation is created by calling {@link Components#hooks()}.
 */
public abstract class HooksConfigurationBuilder {
  /**
   * The current set of hooks the builder has.
   */
  protected List<Hook> hooks = Collections.emptyList();

  /**
   * Sets the hooks. The order of the list is the order in which hooks are called.
   *
   * @param hooks the hooks
   * @return the builder
   */
  public HooksConfigurationBuilder setHooks(List<Hook> hooks) {
    // copy so later changes to the caller's list have no effect
    this.hooks = Collections.unmodifiableList(new ArrayList<>(hooks));
    return this;
  }

  /**
   * @return the hooks configuration
   */
  public abstract HookConfiguration build();
}
