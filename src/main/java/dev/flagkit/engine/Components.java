package dev.flagkit.engine;

import com.launchdarkly.logging.LDLogAdapter;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.Logs;
import dev.flagkit.engine.ComponentsImpl.HooksConfigurationBuilderImpl;
import dev.flagkit.engine.ComponentsImpl.LoggingConfigurationBuilderImpl;
import dev.flagkit.engine.integrations.HooksConfigurationBuilder;
import dev.flagkit.engine.integrations.LoggingConfigurationBuilder;
import dev.flagkit.engine.subsystems.NamespaceRegistry;

/**
 * Provides configurable factories for the standard implementations of engine components.
 * <p>
 * Some of the configuration options in {@link EngineConfig.Builder} affect the entire engine, while
 * others are grouped by area of functionality; those are configured with a builder obtained from
 * one of the methods here.
 */
public abstract class Components {
  private Components() {}

  /**
   * Returns a configuration builder for the engine's logging configuration.
   * <p>
   * Passing this to {@link EngineConfig.Builder#logging(LoggingConfigurationBuilder)},
   * after setting any desired properties on the builder, applies this configuration to the engine.
   * <pre><code>
   *     EngineConfig config = new EngineConfig.Builder()
   *         .logging(
   *              Components.logging()
   *                  .level(LDLogLevel.WARN)
   *         )
   *         .build();
   * </code></pre>
   *
   * @return a configuration object
   * @see EngineConfig.Builder#logging(LoggingConfigurationBuilder)
   */
  public static LoggingConfigurationBuilder logging() {
    return new LoggingConfigurationBuilderImpl();
  }

  /**
   * Returns a configuration builder for the engine's logging configuration, specifying the
   * implementation of logging to use.
   * <p>
   * This is a shortcut for <code>Components.logging().adapter(logAdapter)</code>.
   *
   * @param logAdapter an {@link LDLogAdapter} for the desired logging implementation
   * @return a configuration builder
   */
  public static LoggingConfigurationBuilder logging(LDLogAdapter logAdapter) {
    return logging().adapter(logAdapter);
  }

  /**
   * Returns a configuration builder that turns off logging.
   * <p>
   * This is a shortcut for <code>Components.logging(Logs.none())</code>.
   *
   * @return a configuration builder
   */
  public static LoggingConfigurationBuilder noLogging() {
    return logging().adapter(Logs.none());
  }

  /**
   * Returns a builder for configuring hooks.
   * <p>
   * Passing this to {@link EngineConfig.Builder#hooks(HooksConfigurationBuilder)},
   * after setting any desired hooks on the builder, applies this configuration to the engine.
   *
   * @return a {@link HooksConfigurationBuilder} that can be used for customization
   */
  public static HooksConfigurationBuilder hooks() {
    return new HooksConfigurationBuilderImpl();
  }

  /**
   * Returns a new, standalone in-memory registry with default settings and an empty configuration.
   * <p>
   * Every {@link Namespace} creates its own registry; a standalone registry is useful as the
   * candidate in {@link Namespace#evaluateWithShadow}.
   *
   * @param namespaceId the id of the namespace the registry belongs to
   * @return a registry
   */
  public static NamespaceRegistry inMemoryRegistry(String namespaceId) {
    return inMemoryRegistry(namespaceId, EngineConfig.DEFAULT);
  }

  /**
   * Returns a new, standalone in-memory registry using the history limit, hooks and logging of a
   * configuration.
   *
   * @param namespaceId the id of the namespace the registry belongs to
   * @param config the engine configuration
   * @return a registry
   */
  public static NamespaceRegistry inMemoryRegistry(String namespaceId, EngineConfig config) {
    LDLogger baseLogger = LDLogger.withAdapter(config.logging.getLogAdapter(), config.logging.getBaseLoggerName());
    HookDispatcher hooks = new HookDispatcher(config.hooks.getHooks(),
        baseLogger.subLogger(Loggers.HOOKS_LOGGER_NAME));
    return new InMemoryNamespaceRegistry(namespaceId, Configuration.EMPTY, config.historyLimit, hooks,
        baseLogger.subLogger(Loggers.REGISTRY_LOGGER_NAME));
  }
}
