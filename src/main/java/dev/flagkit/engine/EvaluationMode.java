package dev.flagkit.engine;

/**
 * Why an evaluation was performed.
 */
public enum EvaluationMode {
  /** An ordinary evaluation whose value is used by the application. */
  NORMAL,
  /** An evaluation requested for its diagnostics, as by {@link Namespace#explain(Feature, Context)}. */
  EXPLAIN,
  /** A comparison evaluation against a candidate registry, whose value is not used. */
  SHADOW
}
