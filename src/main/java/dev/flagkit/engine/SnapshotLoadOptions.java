package dev.flagkit.engine;

import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;
import dev.flagkit.engine.interfaces.SnapshotWarningListener;

/**
 * Controls how tolerant {@link ConfigurationCodec} is when a snapshot does not line up exactly with
 * the flags declared in a namespace.
 * <p>
 * The default, {@link #strict()}, rejects a snapshot that mentions a flag the namespace does not
 * declare or that leaves out a declared flag.
 */
public final class SnapshotLoadOptions {
  private static final SnapshotLoadOptions STRICT = new SnapshotLoadOptions(false, false, null, LDLogger.none());

  private final boolean skipUnknownKeys;
  private final boolean fillMissingDeclaredFlags;
  private final SnapshotWarningListener warningListener;
  private final LDLogger logger;

  private SnapshotLoadOptions(boolean skipUnknownKeys, boolean fillMissingDeclaredFlags,
      SnapshotWarningListener warningListener, LDLogger logger) {
    this.skipUnknownKeys = skipUnknownKeys;
    this.fillMissingDeclaredFlags = fillMissingDeclaredFlags;
    this.warningListener = warningListener;
    this.logger = logger;
  }

  /**
   * Returns options that fail on unknown flag keys and on missing declared flags.
   *
   * @return the strict options
   */
  public static SnapshotLoadOptions strict() {
    return STRICT;
  }

  /**
   * Returns options that skip flag entries whose keys are not declared in the namespace, reporting
   * each one. Missing declared flags still fail the load.
   *
   * @param warningListener receives a warning per skipped entry; may be null
   * @return the options
   */
  public static SnapshotLoadOptions skipUnknownKeys(SnapshotWarningListener warningListener) {
    return new SnapshotLoadOptions(true, false, warningListener, LDLogger.none());
  }

  /**
   * Returns options under which a declared flag that the snapshot leaves out keeps the definition it
   * was declared with. Unknown flag keys still fail the load.
   *
   * @return the options
   */
  public static SnapshotLoadOptions fillMissingDeclaredFlags() {
    return fillMissingDeclaredFlags(null);
  }

  /**
   * Same as {@link #fillMissingDeclaredFlags()}, reporting each filled flag.
   *
   * @param warningListener receives a warning per filled flag; may be null
   * @return the options
   */
  public static SnapshotLoadOptions fillMissingDeclaredFlags(SnapshotWarningListener warningListener) {
    return new SnapshotLoadOptions(false, true, warningListener, LDLogger.none());
  }

  /**
   * @return true if flag entries with undeclared keys are skipped rather than rejected
   */
  public boolean isSkipUnknownKeys() {
    return skipUnknownKeys;
  }

  /**
   * @return true if declared flags absent from a snapshot keep their declared definitions
   */
  public boolean isFillMissingDeclaredFlags() {
    return fillMissingDeclaredFlags;
  }

  // same options, with listener failures logged to the given logger
  SnapshotLoadOptions withLogger(LDLogger logger) {
    return new SnapshotLoadOptions(skipUnknownKeys, fillMissingDeclaredFlags, warningListener, logger);
  }

  void warn(String key, String message) {
    if (warningListener == null) {
      return;
    }
    try {
      warningListener.onWarning(key, message);
    } catch (Exception e) {
      logger.warn("Unexpected error from snapshot warning listener for \"{}\": {}", key,
          LogValues.exceptionSummary(e));
      logger.debug("{}", LogValues.exceptionTrace(e));
    }
  }

  @Override
  public String toString() {
    return "SnapshotLoadOptions(skipUnknownKeys=" + skipUnknownKeys + ",fillMissingDeclaredFlags=" +
        fillMissingDeclaredFlags + ")";
  }
}
