package dev.flagkit.engine;

/**
 * The kind of outcome of an evaluation, without its details.
 *
 * @see EvaluationDiagnostics.Decision
 */
public enum DecisionKind {
  /** The namespace kill-switch was on. */
  REGISTRY_DISABLED,
  /** The flag was inactive. */
  INACTIVE,
  /** A rule matched and its value was returned. */
  RULE,
  /** No rule applied and the default was returned. */
  DEFAULT
}
