package dev.flagkit.engine;

import com.launchdarkly.logging.LDLogger;
import dev.flagkit.engine.ConfigurationSerialization.InvalidSnapshotException;
import dev.flagkit.engine.ConfigurationSerialization.RawDocument;
import dev.flagkit.engine.subsystems.SerializationException;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Converts configurations and patches to and from JSON.
 * <p>
 * Decoding is always done against a namespace's declared configuration: flag keys are resolved to
 * the declared features, and every value is checked against its feature's type. Decoding never
 * throws for bad input; problems are returned as a {@link ParseResult.Failure} whose
 * {@link ParseError} carries the JSON path of the offending field where there is one.
 * <p>
 * Custom targeting conditions ({@link dev.flagkit.engine.interfaces.TargetingExtension}) are code
 * rather than data, so they are not written and a decoded rule never has one.
 */
public final class ConfigurationCodec {
  private static final LDLogger DEFAULT_LOGGER = LDLogger.withAdapter(EngineConfig.DEFAULT.logging.getLogAdapter(),
      EngineConfig.DEFAULT.logging.getBaseLoggerName()).subLogger(Loggers.SERIALIZATION_LOGGER_NAME);

  private ConfigurationCodec() {}

  /**
   * Encodes a configuration. Flags are written in identity order and rules in declaration order.
   *
   * @param configuration the configuration
   * @return the JSON representation
   */
  public static String encode(Configuration configuration) {
    checkNotNull(configuration, "configuration must not be null");
    return ConfigurationSerialization.writeConfiguration(configuration);
  }

  /**
   * Encodes a patch.
   *
   * @param patch the patch
   * @return the JSON representation
   */
  public static String encodePatch(ConfigurationPatch patch) {
    checkNotNull(patch, "patch must not be null");
    return ConfigurationSerialization.writePatch(patch);
  }

  /**
   * Decodes a configuration for a namespace using {@link SnapshotLoadOptions#strict()}.
   *
   * @param json the JSON representation
   * @param namespace the namespace whose declared flags the snapshot describes
   * @return the configuration or an error
   */
  public static ParseResult<Configuration> decode(String json, Namespace namespace) {
    return decode(json, namespace, SnapshotLoadOptions.strict());
  }

  /**
   * Decodes a configuration for a namespace.
   *
   * @param json the JSON representation
   * @param namespace the namespace whose declared flags the snapshot describes
   * @param options how to treat unknown and missing flags
   * @return the configuration or an error
   */
  public static ParseResult<Configuration> decode(String json, Namespace namespace, SnapshotLoadOptions options) {
    checkNotNull(namespace, "namespace must not be null");
    return decode(json, namespace.getDeclaredConfiguration(), options, namespace.getSerializationLogger());
  }

  /**
   * Decodes a configuration.
   *
   * @param json the JSON representation
   * @param declared the declared definitions; these determine which keys are known and their types,
   *   and supply the definitions used by {@link SnapshotLoadOptions#fillMissingDeclaredFlags()}
   * @param options how to treat unknown and missing flags; null means strict
   * @return the configuration or an error
   */
  public static ParseResult<Configuration> decode(String json, Configuration declared, SnapshotLoadOptions options) {
    return decode(json, declared, options, DEFAULT_LOGGER);
  }

  static ParseResult<Configuration> decode(String json, Configuration declared, SnapshotLoadOptions options,
      LDLogger logger) {
    checkNotNull(declared, "declared must not be null");
    SnapshotLoadOptions opts = (options == null ? SnapshotLoadOptions.strict() : options).withLogger(logger);
    try {
      RawDocument doc = ConfigurationSerialization.parseDocument(json);
      return ParseResult.success(ConfigurationSerialization.toConfiguration(doc, declared, opts));
    } catch (SerializationException e) {
      return ParseResult.failure(ConfigurationSerialization.toParseError(e));
    } catch (InvalidSnapshotException e) {
      return ParseResult.failure(e.error);
    }
  }

  /**
   * Decodes a patch of the form {@code {"meta": ..., "flags": [...], "removeKeys": [...]}}, where
   * every part is optional.
   *
   * @param json the JSON representation
   * @param declared the declared definitions
   * @param options how to treat unknown flags; null means strict
   * @return the patch or an error
   */
  public static ParseResult<ConfigurationPatch> decodePatch(String json, Configuration declared,
      SnapshotLoadOptions options) {
    return decodePatch(json, declared, options, DEFAULT_LOGGER);
  }

  static ParseResult<ConfigurationPatch> decodePatch(String json, Configuration declared,
      SnapshotLoadOptions options, LDLogger logger) {
    checkNotNull(declared, "declared must not be null");
    SnapshotLoadOptions opts = (options == null ? SnapshotLoadOptions.strict() : options).withLogger(logger);
    try {
      RawDocument doc = ConfigurationSerialization.parseDocument(json);
      return ParseResult.success(ConfigurationSerialization.toPatch(doc, declared, opts));
    } catch (SerializationException e) {
      return ParseResult.failure(ConfigurationSerialization.toParseError(e));
    } catch (InvalidSnapshotException e) {
      return ParseResult.failure(e.error);
    }
  }

  /**
   * Decodes a patch and applies it to a configuration. Removals are applied before upserts.
   *
   * @param current the configuration to patch
   * @param patchJson the JSON representation of the patch
   * @param declared the declared definitions
   * @param options how to treat unknown flags; null means strict
   * @return the patched configuration or an error; {@code current} is never modified
   */
  public static ParseResult<Configuration> applyPatch(Configuration current, String patchJson,
      Configuration declared, SnapshotLoadOptions options) {
    return applyPatch(current, patchJson, declared, options, DEFAULT_LOGGER);
  }

  static ParseResult<Configuration> applyPatch(Configuration current, String patchJson,
      Configuration declared, SnapshotLoadOptions options, LDLogger logger) {
    checkNotNull(current, "current must not be null");
    return decodePatch(patchJson, declared, options, logger).map(patch -> patch.applyTo(current));
  }
}
