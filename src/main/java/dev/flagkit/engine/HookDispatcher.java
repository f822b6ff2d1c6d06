package dev.flagkit.engine;

import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;
import dev.flagkit.engine.integrations.ConfigLoadRecord;
import dev.flagkit.engine.integrations.ConfigRollbackRecord;
import dev.flagkit.engine.integrations.EvaluationRecord;
import dev.flagkit.engine.integrations.Hook;

import java.util.List;

/**
 * Delivers records to the configured {@link Hook}s, isolating the engine from hook failures: an
 * exception from one hook is logged and the remaining hooks are still called.
 */
final class HookDispatcher {

  private final List<Hook> hooks;
  private final LDLogger logger;

  HookDispatcher(List<Hook> hooks, LDLogger hooksLogger) {
    this.hooks = hooks;
    this.logger = hooksLogger;
  }

  boolean hasHooks() {
    return !hooks.isEmpty();
  }

  void afterEvaluation(EvaluationRecord record) {
    for (int i = 0; i < hooks.size(); i++) {
      Hook hook = hooks.get(i);
      try {
        hook.afterEvaluation(record);
      } catch (Exception e) {
        reportError(hook, "afterEvaluation", record.getFeatureKey(), e);
      }
    }
  }

  void afterConfigLoad(ConfigLoadRecord record) {
    for (int i = 0; i < hooks.size(); i++) {
      Hook hook = hooks.get(i);
      try {
        hook.afterConfigLoad(record);
      } catch (Exception e) {
        reportError(hook, "afterConfigLoad", record.getNamespaceId(), e);
      }
    }
  }

  void afterConfigRollback(ConfigRollbackRecord record) {
    for (int i = 0; i < hooks.size(); i++) {
      Hook hook = hooks.get(i);
      try {
        hook.afterConfigRollback(record);
      } catch (Exception e) {
        reportError(hook, "afterConfigRollback", record.getNamespaceId(), e);
      }
    }
  }

  private void reportError(Hook hook, String stage, String subject, Exception e) {
    logger.error("Stage \"{}\" of hook \"{}\" reported error for \"{}\": {}", stage,
        hook.getMetadata().getName(), subject, LogValues.exceptionSummary(e));
    logger.debug("{}", LogValues.exceptionTrace(e));
  }
}
