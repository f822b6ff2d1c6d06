package dev.flagkit.engine;

/**
 * The kinds of value a flag can produce. The names are also the discriminators used for flag values
 * in serialized configuration.
 */
public enum FlagValueType {
  /** {@link Boolean} values. */
  BOOLEAN,
  /** {@link String} values. */
  STRING,
  /** {@link Integer} values. */
  INT,
  /** {@link Double} values. */
  DOUBLE,
  /** Constants of an application enum. */
  ENUM
}
