package dev.flagkit.engine.integrations;

import com.launchdarkly.logging.LDLogAdapter;
import com.launchdarkly.logging.LDLogLevel;
import com.launchdarkly.logging.Logs;
import dev.flagkit.engine.Components;
import dev.flagkit.engine.subsystems.LoggingConfiguration;

/**
 * Contains methods for configuring the engine's logging behavior.
 * <p>
 * If you want to set non-default values for any of these properties, create a builder with
 * {@link Components#logging()}, change its properties with the methods of this class, and pass it
 * to {@link dev.flagkit.engine.EngineConfig.Builder#logging(LoggingConfigurationBuilder)}:
 * <pre><code>
 *     EngineConfig config = new EngineConfig.Builder()
 *         .logging(
 *           Components.logging()
 *             .level(LDLogLevel.DEBUG)
 *          )
 *         .build();
 * </code></pre>
 * <p>
 * Note that this class is abstract; the actual implementation is created by calling {@link Components#logging()}.
 */
public abstract class LoggingConfigurationBuilder {
  protected String baseName = null;
  protected LDLogAdapter logAdapter = null;
  protected LDLogLevel minimumLevel = null;

  /**
   * Specifies the implementation of logging to use.
   * <p>
   * The default destination, if no adapter is specified, depends on whether
   * <a href="https://www.slf4j.org/">SLF4J</a> is present in the classpath. If it is, the engine uses
   * {@link com.launchdarkly.logging.LDSLF4J#adapter()}; otherwise it uses {@link Logs#toConsole()},
   * which writes to {@code System.err}.
   * <p>
   * If you don't need to customize any options other than the adapter, you can call
   * {@link Components#logging(LDLogAdapter)} as a shortcut.
   *
   * @param logAdapter an {@link LDLogAdapter} for the desired logging implementation
   * @return the builder
   */
  public LoggingConfigurationBuilder adapter(LDLogAdapter logAdapter) {
    this.logAdapter = logAdapter;
    return this;
  }

  /**
   * Specifies a custom base logger name.
   * <p>
   * By default the base name is {@code dev.flagkit.engine.Namespace}. Messages are logged under this
   * name with a suffix for the area of functionality:
   * <ul>
   * <li> <code>.Evaluation</code>: explain-mode decisions and shadow mismatches. </li>
   * <li> <code>.Registry</code>: configuration loads, rollbacks and kill-switch changes. </li>
   * <li> <code>.Hooks</code>: errors thrown by application hooks. </li>
   * <li> <code>.Serialization</code>: rejected or partially skipped configuration snapshots. </li>
   * <li> <code>.Axes</code>: axis registrations. </li>
   * </ul>
   *
   * @param name the base logger name
   * @return the builder
   */
  public LoggingConfigurationBuilder baseLoggerName(String name) {
    this.baseName = name;
    return this;
  }

  /**
   * Specifies the lowest level of logging to enable.
   * <p>
   * This is only applicable when using an implementation of logging that does not have its own
   * external configuration mechanism, such as {@link Logs#toConsole()}. If not specified, the default
   * minimum level is {@link LDLogLevel#INFO}.
   *
   * @param minimumLevel the lowest level of logging to enable
   * @return the builder
   */
  public LoggingConfigurationBuilder level(LDLogLevel minimumLevel) {
    this.minimumLevel = minimumLevel;
    return this;
  }

  /**
   * @return the logging configuration
   */
  public abstract LoggingConfiguration build();
}
