package dev.flagkit.engine;

import dev.flagkit.engine.integrations.HooksConfigurationBuilder;
import dev.flagkit.engine.integrations.LoggingConfigurationBuilder;
import dev.flagkit.engine.subsystems.HookConfiguration;
import dev.flagkit.engine.subsystems.LoggingConfiguration;
import dev.flagkit.engine.subsystems.NamespaceRegistry;

/**
 * This class exposes configuration options for a {@link Namespace}. Instances of this class must be
 * constructed with a {@link EngineConfig.Builder}.
 */
public final class EngineConfig {
  static final EngineConfig DEFAULT = new Builder().build();

  final HookConfiguration hooks;
  final LoggingConfiguration logging;
  final int historyLimit;

  EngineConfig(Builder builder) {
    this.hooks = (builder.hooksConfigurationBuilder == null ? Components.hooks() :
      builder.hooksConfigurationBuilder).build();
    this.logging = (builder.loggingConfigurationBuilder == null ? Components.logging() :
      builder.loggingConfigurationBuilder).build();
    this.historyLimit = builder.historyLimit;
  }

  /**
   * A <a href="http://en.wikipedia.org/wiki/Builder_pattern">builder</a> that helps construct
   * {@link EngineConfig} objects. Builder calls can be chained, enabling the following pattern:
   * <pre>
   * EngineConfig config = new EngineConfig.Builder()
   *      .historyLimit(20)
   *      .logging(Components.logging().level(LDLogLevel.DEBUG))
   *      .build()
   * </pre>
   */
  public static class Builder {
    private HooksConfigurationBuilder hooksConfigurationBuilder = null;
    private LoggingConfigurationBuilder loggingConfigurationBuilder = null;
    private int historyLimit = NamespaceRegistry.DEFAULT_HISTORY_LIMIT;

    /**
     * Creates a builder with all configuration parameters set to the default.
     */
    public Builder() {
    }

    /**
     * Sets the hooks configuration, using a builder obtained from {@link Components#hooks()}.
     *
     * @param hooksConfiguration the hooks configuration builder
     * @return the builder
     */
    public Builder hooks(HooksConfigurationBuilder hooksConfiguration) {
      this.hooksConfigurationBuilder = hooksConfiguration;
      return this;
    }

    /**
     * Sets the logging configuration, using a builder obtained from {@link Components#logging()},
     * {@link Components#logging(com.launchdarkly.logging.LDLogAdapter)} or {@link Components#noLogging()}.
     *
     * @param loggingConfiguration the logging configuration builder
     * @return the builder
     */
    public Builder logging(LoggingConfigurationBuilder loggingConfiguration) {
      this.loggingConfigurationBuilder = loggingConfiguration;
      return this;
    }

    /**
     * Sets how many previous configurations each registry keeps for rollback. The default is
     * {@link NamespaceRegistry#DEFAULT_HISTORY_LIMIT}.
     *
     * @param historyLimit the history capacity; must be at least 1
     * @return the builder
     * @throws IllegalArgumentException if the limit is less than 1
     */
    public Builder historyLimit(int historyLimit) {
      if (historyLimit < 1) {
        throw new IllegalArgumentException("history limit must be at least 1, was " + historyLimit);
      }
      this.historyLimit = historyLimit;
      return this;
    }

    /**
     * Builds the configured {@link EngineConfig} object.
     *
     * @return the {@link EngineConfig} configured by this builder
     */
    public EngineConfig build() {
      return new EngineConfig(this);
    }
  }
}
