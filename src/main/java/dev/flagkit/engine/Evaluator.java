package dev.flagkit.engine;

import com.launchdarkly.logging.LDLogger;
import dev.flagkit.engine.EvaluationDiagnostics.BucketInfo;
import dev.flagkit.engine.EvaluationDiagnostics.Decision;
import dev.flagkit.engine.EvaluationDiagnostics.RuleExplanation;
import dev.flagkit.engine.EvaluationDiagnostics.RuleMatch;
import dev.flagkit.engine.integrations.EvaluationRecord;

/**
 * Encapsulates the flag evaluation logic. The Evaluator has no knowledge of where configurations
 * come from; every call is given an immutable {@link RegistrySnapshot}, so an evaluation is a pure
 * function of the snapshot and the context apart from the hook notification at the end.
 */
final class Evaluator {
  //
  // IMPLEMENTATION NOTES
  //
  // The decision states are checked in a fixed order and the first one that applies is terminal:
  // kill-switch, inactive flag, first applicable rule in precedence order, default. A rule whose
  // targeting matched but whose rollout excluded the context does not stop the scan; the first such
  // rule is reported in the decision so that "why did I get the default" can be answered.
  //
  // Evaluation never fails because of the context. The only exception that can escape is
  // FlagNotFoundException (or IllegalStateException for a type mismatch), which indicates that the
  // feature was never declared in this namespace.
  //

  private final HookDispatcher hooks;
  private final LDLogger logger;

  Evaluator(HookDispatcher hooks, LDLogger evaluationLogger) {
    this.hooks = hooks;
    this.logger = evaluationLogger;
  }

  <T> EvaluationDiagnostics<T> evaluate(Feature<T> feature, Context context, RegistrySnapshot snapshot,
      EvaluationMode mode) {
    long startNanos = System.nanoTime();
    FlagDefinition<T> definition = snapshot.flag(feature);
    String configVersion = snapshot.getConfiguration().getMetadata().getVersion();

    T value;
    Decision decision;
    Integer bucket = null;
    if (snapshot.isAllDisabled()) {
      value = definition.getDefaultValue();
      decision = EvaluationDiagnostics.RegistryDisabled.INSTANCE;
    } else if (!definition.isActive()) {
      value = definition.getDefaultValue();
      decision = EvaluationDiagnostics.Inactive.INSTANCE;
    } else {
      FlagDefinition.Trace<T> trace = definition.evaluateTrace(context);
      value = trace.value;
      bucket = trace.bucket;
      RuleMatch skipped = trace.skippedByRollout == null ? null :
          toRuleMatch(trace.skippedByRollout, trace.bucket, feature.getKey(), definition.getSalt(), false);
      if (trace.matched != null) {
        decision = new EvaluationDiagnostics.RuleMatched(
            toRuleMatch(trace.matched, trace.bucket, feature.getKey(), definition.getSalt(), trace.matchedByAllowlist),
            skipped);
      } else {
        decision = new EvaluationDiagnostics.DefaultValue(skipped);
      }
    }
    long durationNanos = System.nanoTime() - startNanos;

    EvaluationDiagnostics<T> result = new EvaluationDiagnostics<>(snapshot.getNamespaceId(), feature.getKey(),
        configVersion, mode, durationNanos, value, decision);

    if (mode == EvaluationMode.EXPLAIN) {
      logger.debug("Explained flag \"{}\" in namespace \"{}\": {} (configuration version {})",
          feature.getKey(), snapshot.getNamespaceId(), decision, configVersion);
    }
    if (hooks.hasHooks()) {
      Integer specificity = decision instanceof EvaluationDiagnostics.RuleMatched ?
          ((EvaluationDiagnostics.RuleMatched)decision).getMatched().getRule().getTotalSpecificity() : null;
      hooks.afterEvaluation(new EvaluationRecord(snapshot.getNamespaceId(), feature.getKey(), mode,
          decision.getKind(), durationNanos, specificity, bucket, configVersion));
    }
    return result;
  }

  private static RuleMatch toRuleMatch(Rule<?> rule, Integer bucket, String featureKey, String salt,
      boolean allowlisted) {
    // a trace only records a rule after computing the bucket for it
    return new RuleMatch(new RuleExplanation(rule), new BucketInfo(featureKey, salt, bucket, rule.getRollout()),
        allowlisted);
  }
}
