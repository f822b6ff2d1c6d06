package dev.flagkit.engine;

import com.launchdarkly.logging.LDLogger;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Decodes JSON snapshots for one namespace and loads them into its registry.
 * <p>
 * A snapshot is loaded only if it decodes completely; on any error the registry keeps its current
 * configuration, the failure is logged at warn level, and the returned error's message is prefixed
 * with the namespace id.
 */
public final class NamespaceSnapshotLoader {
  private final Namespace namespace;
  private final LDLogger logger;

  private NamespaceSnapshotLoader(Namespace namespace) {
    this.namespace = namespace;
    this.logger = namespace.getSerializationLogger();
  }

  /**
   * Creates a loader for a namespace.
   *
   * @param namespace the namespace
   * @return a loader
   */
  public static NamespaceSnapshotLoader forNamespace(Namespace namespace) {
    return new NamespaceSnapshotLoader(checkNotNull(namespace, "namespace must not be null"));
  }

  /**
   * Decodes and loads a snapshot using {@link SnapshotLoadOptions#strict()}.
   *
   * @param json the snapshot
   * @return the loaded configuration or an error
   */
  public ParseResult<Configuration> load(String json) {
    return load(json, SnapshotLoadOptions.strict());
  }

  /**
   * Decodes and loads a snapshot.
   *
   * @param json the snapshot
   * @param options how to treat unknown and missing flags
   * @return the loaded configuration or an error
   */
  public ParseResult<Configuration> load(String json, SnapshotLoadOptions options) {
    ParseResult<Configuration> result = ConfigurationCodec.decode(json, namespace, options);
    if (!result.isSuccess()) {
      return reportFailure(result.getError(), "snapshot");
    }
    namespace.getRegistry().load(result.getValue());
    return result;
  }

  /**
   * Decodes a patch, applies it to the registry's current configuration, and loads the result.
   * Reading the current configuration and loading the result are separate steps, so patches for one
   * namespace should come from a single thread.
   *
   * @param patchJson the patch
   * @param options how to treat unknown flags
   * @return the loaded configuration or an error
   */
  public ParseResult<Configuration> applyPatch(String patchJson, SnapshotLoadOptions options) {
    ParseResult<Configuration> result = ConfigurationCodec.applyPatch(namespace.getRegistry().getConfiguration(),
        patchJson, namespace.getDeclaredConfiguration(), options, logger);
    if (!result.isSuccess()) {
      return reportFailure(result.getError(), "patch");
    }
    namespace.getRegistry().load(result.getValue());
    return result;
  }

  private ParseResult<Configuration> reportFailure(ParseError error, String what) {
    ParseError withNamespace = error.withContext("namespace \"" + namespace.getId() + "\"");
    logger.warn("Rejected {} for namespace \"{}\": {} {}{}", what, namespace.getId(), error.getKind(),
        error.getMessage(), error.getPath() == null ? "" : (" at " + error.getPath()));
    return ParseResult.failure(withNamespace);
  }
}
