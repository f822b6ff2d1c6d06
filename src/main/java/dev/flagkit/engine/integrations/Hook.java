package dev.flagkit.engine.integrations;

/**
 * A Hook is a set of user-defined callbacks that the engine executes after evaluations and after
 * configuration changes, typically to feed metrics or tracing systems. To create your own hook,
 * extend this class and override the callbacks you need.
 * <p>
 * Hooks are observers only. They run synchronously on the thread that performed the operation,
 * in the order they were configured. An exception thrown by a hook is logged and does not affect
 * the result of the operation or the execution of other hooks.
 */
public abstract class Hook {
  private final HookMetadata metadata;

  /**
   * Creates an instance of {@link Hook} with the given name which will be put into its metadata.
   *
   * @param name a friendly name for the hook
   */
  public Hook(String name) {
    metadata = new HookMetadata(name) {};
  }

  /**
   * @return the hook's metadata
   */
  public HookMetadata getMetadata() {
    return metadata;
  }

  /**
   * Called after every flag evaluation, including shadow and explain evaluations.
   *
   * @param record what was evaluated and how it was decided
   */
  public void afterEvaluation(EvaluationRecord record) {
    // default implementation is no-op
  }

  /**
   * Called after a configuration has been loaded into a namespace registry.
   *
   * @param record describes the load
   */
  public void afterConfigLoad(ConfigLoadRecord record) {
    // default implementation is no-op
  }

  /**
   * Called after a successful rollback of a namespace registry.
   *
   * @param record describes the rollback
   */
  public void afterConfigRollback(ConfigRollbackRecord record) {
    // default implementation is no-op
  }
}
