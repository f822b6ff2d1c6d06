package dev.flagkit.engine;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;
import dev.flagkit.engine.interfaces.AxisValue;
import dev.flagkit.engine.interfaces.ShadowMismatchListener;
import dev.flagkit.engine.subsystems.NamespaceRegistry;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An isolated group of feature flags with its own registry, axis catalog and kill-switch.
 * <p>
 * Every flag that a namespace can evaluate is declared when the namespace is built, so the set of
 * flags is fixed from then on; only their definitions change, through {@link #getRegistry()}.
 * Namespaces are thread-safe. Applications usually create one namespace per team or domain for the
 * lifetime of the process.
 * <pre><code>
 *     Feature&lt;Boolean&gt; darkMode = Feature.booleanFeature("ui", "dark-mode");
 *     Namespace ui = Namespace.builder("ui")
 *         .declare(FlagDefinition.builder(darkMode, false)
 *             .rule(Rule.builder(true).targeting(Targeting.builder().platforms("ios").build()).rollout(25).build())
 *             .build())
 *         .build();
 *     boolean enabled = ui.evaluate(darkMode, context);
 * </code></pre>
 */
public final class Namespace {
  private final String id;
  private final String identifierSeed;
  private final ImmutableList<Feature<?>> declaredFeatures;
  private final Configuration declaredConfiguration;
  private final AxisCatalog axisCatalog;
  private final NamespaceRegistry registry;
  private final Evaluator evaluator;
  private final LDLogger evaluationLogger;
  private final LDLogger serializationLogger;

  private Namespace(Builder builder) {
    EngineConfig config = builder.config == null ? EngineConfig.DEFAULT : builder.config;
    this.id = builder.id;
    this.identifierSeed = builder.identifierSeed == null ? builder.id : builder.identifierSeed;

    LDLogger baseLogger = LDLogger.withAdapter(config.logging.getLogAdapter(), config.logging.getBaseLoggerName());
    this.evaluationLogger = baseLogger.subLogger(Loggers.EVALUATION_LOGGER_NAME);
    this.serializationLogger = baseLogger.subLogger(Loggers.SERIALIZATION_LOGGER_NAME);

    this.axisCatalog = new AxisCatalog(baseLogger.subLogger(Loggers.AXES_LOGGER_NAME));
    for (Consumer<AxisCatalog> registration: builder.axisRegistrations.values()) {
      registration.accept(axisCatalog);
    }

    Configuration.Builder initial = Configuration.builder()
        .metadata(ConfigurationMetadata.of(null, null, "declared"));
    ImmutableList.Builder<Feature<?>> features = ImmutableList.builder();
    Set<FeatureId> seen = new HashSet<>();
    for (FlagDefinition<?> definition: builder.definitions) {
      FeatureId featureId = definition.getFeature().getId();
      if (!featureId.getNamespaceSeed().equals(identifierSeed)) {
        throw new IllegalArgumentException("flag \"" + featureId + "\" does not belong to namespace \"" + id +
            "\" (identifier seed \"" + identifierSeed + "\")");
      }
      if (!seen.add(featureId)) {
        throw new IllegalArgumentException("flag \"" + featureId + "\" is declared more than once in namespace \"" +
            id + "\"");
      }
      checkAxes(definition);
      initial.put(definition);
      features.add(definition.getFeature());
    }
    this.declaredFeatures = features.build();
    this.declaredConfiguration = initial.build();

    HookDispatcher hooks = new HookDispatcher(config.hooks.getHooks(),
        baseLogger.subLogger(Loggers.HOOKS_LOGGER_NAME));
    this.registry = new InMemoryNamespaceRegistry(id, declaredConfiguration, config.historyLimit, hooks,
        baseLogger.subLogger(Loggers.REGISTRY_LOGGER_NAME));
    this.evaluator = new Evaluator(hooks, evaluationLogger);

    baseLogger.debug("Created namespace \"{}\" with {} flags and {} axes", id, declaredFeatures.size(),
        axisCatalog.getAxes().size());
  }

  /**
   * Starts building a namespace.
   *
   * @param id the namespace id; must not be blank
   * @return a builder
   */
  public static Builder builder(String id) {
    return new Builder(id);
  }

  /**
   * @return the namespace id
   */
  public String getId() {
    return id;
  }

  /**
   * @return the seed that the identities of this namespace's flags are derived from
   */
  public String getIdentifierSeed() {
    return identifierSeed;
  }

  /**
   * Returns the registry holding this namespace's active configuration. Use it to load new
   * configurations, roll back, toggle the kill-switch or set test overrides.
   *
   * @return the registry
   */
  public NamespaceRegistry getRegistry() {
    return registry;
  }

  /**
   * @return the custom axes registered for this namespace
   */
  public AxisCatalog getAxisCatalog() {
    return axisCatalog;
  }

  /**
   * @return every declared flag, in declaration order
   */
  public List<Feature<?>> getDeclaredFeatures() {
    return declaredFeatures;
  }

  /**
   * Returns the configuration the namespace was built with. Snapshots are decoded against it, and it
   * supplies the definitions used by {@link SnapshotLoadOptions#fillMissingDeclaredFlags()}.
   *
   * @return the declared configuration
   */
  public Configuration getDeclaredConfiguration() {
    return declaredConfiguration;
  }

  LDLogger getSerializationLogger() {
    return serializationLogger;
  }

  /**
   * Evaluates a flag for a context.
   *
   * @param <T> the value type
   * @param feature the flag
   * @param context the evaluation context
   * @return the flag value; never null
   * @throws FlagNotFoundException if the registry's configuration does not contain the flag
   * @throws IllegalStateException if the configuration stores the flag with a different value type
   */
  public <T> T evaluate(Feature<T> feature, Context context) {
    return evaluate(feature, context, EvaluationMode.NORMAL).getValue();
  }

  /**
   * Evaluates a flag for a context and explains the result. The explanation is also logged at debug
   * level.
   *
   * @param <T> the value type
   * @param feature the flag
   * @param context the evaluation context
   * @return the value with its diagnostics
   * @throws FlagNotFoundException if the registry's configuration does not contain the flag
   * @throws IllegalStateException if the configuration stores the flag with a different value type
   */
  public <T> EvaluationDiagnostics<T> explain(Feature<T> feature, Context context) {
    return evaluate(feature, context, EvaluationMode.EXPLAIN);
  }

  /**
   * Evaluates a flag against this namespace and, for comparison, against a candidate registry.
   * <p>
   * The value from this namespace is always the one returned. The candidate is evaluated in
   * {@link EvaluationMode#SHADOW} mode; if it disagrees, the mismatch is logged at warn level and
   * passed to the listener. Nothing that goes wrong with the candidate affects the returned value.
   *
   * @param <T> the value type
   * @param feature the flag
   * @param context the evaluation context
   * @param candidateRegistry the registry to compare against
   * @param options shadow options, or null for {@link ShadowOptions#defaults()}
   * @param listener receives mismatches; may be null
   * @return the baseline value
   * @throws FlagNotFoundException if this namespace's configuration does not contain the flag
   */
  public <T> T evaluateWithShadow(Feature<T> feature, Context context, NamespaceRegistry candidateRegistry,
      ShadowOptions options, ShadowMismatchListener listener) {
    checkNotNull(feature, "feature must not be null");
    checkNotNull(context, "context must not be null");
    checkNotNull(candidateRegistry, "candidateRegistry must not be null");
    ShadowOptions opts = options == null ? ShadowOptions.defaults() : options;
    RegistrySnapshot baselineSnapshot = registry.snapshot();
    EvaluationDiagnostics<T> baseline = evaluator.evaluate(feature, context, baselineSnapshot, EvaluationMode.NORMAL);
    if (baselineSnapshot.isAllDisabled() && !opts.isEvaluateCandidateWhenBaselineDisabled()) {
      return baseline.getValue();
    }

    EvaluationDiagnostics<T> candidate;
    try {
      candidate = evaluator.evaluate(feature, context, candidateRegistry.snapshot(), EvaluationMode.SHADOW);
    } catch (RuntimeException e) {
      evaluationLogger.warn("Shadow evaluation of flag \"{}\" against registry \"{}\" failed: {}",
          feature.getKey(), candidateRegistry.getNamespaceId(), LogValues.exceptionSummary(e));
      evaluationLogger.debug("{}", LogValues.exceptionTrace(e));
      return baseline.getValue();
    }

    Set<ShadowMismatch.Kind> kinds = EnumSet.noneOf(ShadowMismatch.Kind.class);
    if (!baseline.getValue().equals(candidate.getValue())) {
      kinds.add(ShadowMismatch.Kind.VALUE);
    }
    if (opts.isReportDecisionMismatches() &&
        baseline.getDecision().getKind() != candidate.getDecision().getKind()) {
      kinds.add(ShadowMismatch.Kind.DECISION);
    }
    if (!kinds.isEmpty()) {
      ShadowMismatch<T> mismatch = new ShadowMismatch<>(feature.getKey(), baseline, candidate, kinds);
      evaluationLogger.warn("Shadow mismatch in namespace \"{}\": {}", id, mismatch);
      if (listener != null) {
        try {
          listener.onMismatch(mismatch);
        } catch (Exception e) {
          evaluationLogger.warn("Unexpected error from shadow mismatch listener: {}", LogValues.exceptionSummary(e));
          evaluationLogger.debug("{}", LogValues.exceptionTrace(e));
        }
      }
    }
    return baseline.getValue();
  }

  private <T> EvaluationDiagnostics<T> evaluate(Feature<T> feature, Context context, EvaluationMode mode) {
    checkNotNull(feature, "feature must not be null");
    checkNotNull(context, "context must not be null");
    return evaluator.evaluate(feature, context, registry.snapshot(), mode);
  }

  private void checkAxes(FlagDefinition<?> definition) {
    for (Rule<?> rule: definition.getRules()) {
      for (Map.Entry<String, ImmutableSet<String>> c: rule.getTargeting().getAxisConstraints().entrySet()) {
        Axis<?> axis = axisCatalog.axisById(c.getKey());
        if (axis == null) {
          throw new IllegalArgumentException("flag \"" + definition.getFeature().getId() + "\" targets axis \"" +
              c.getKey() + "\", which is not registered in namespace \"" + id + "\"");
        }
        for (String valueId: c.getValue()) {
          if (axis.valueForId(valueId) == null) {
            throw new IllegalArgumentException("flag \"" + definition.getFeature().getId() + "\" targets unknown value \"" +
                valueId + "\" of axis \"" + c.getKey() + "\"");
          }
        }
      }
    }
  }

  @Override
  public String toString() {
    return "Namespace(" + id + ")";
  }

  /**
   * Builder for {@link Namespace}.
   */
  public static final class Builder {
    private final String id;
    private String identifierSeed;
    private EngineConfig config;
    private final Map<String, Class<?>> axes = new LinkedHashMap<>();
    private final Map<String, Consumer<AxisCatalog>> axisRegistrations = new LinkedHashMap<>();
    private final List<FlagDefinition<?>> definitions = new ArrayList<>();

    private Builder(String id) {
      if (id == null || id.trim().isEmpty()) {
        throw new IllegalArgumentException("namespace id must not be blank");
      }
      this.id = id;
    }

    /**
     * Sets the seed that flag identities are derived from. The default is the namespace id.
     *
     * @param identifierSeed the seed
     * @return the builder
     */
    public Builder identifierSeed(String identifierSeed) {
      if (identifierSeed == null || identifierSeed.trim().isEmpty()) {
        throw new IllegalArgumentException("identifier seed must not be blank");
      }
      this.identifierSeed = identifierSeed;
      return this;
    }

    /**
     * @param config the engine configuration; null means the default configuration
     * @return the builder
     */
    public Builder config(EngineConfig config) {
      this.config = config;
      return this;
    }

    /**
     * Registers a custom axis in the namespace's catalog.
     *
     * @param <E> the backing enum type
     * @param axisId the axis id
     * @param valueType the backing enum type
     * @return the builder
     */
    public <E extends Enum<E> & AxisValue> Builder axis(String axisId, Class<E> valueType) {
      Class<?> existing = axes.get(axisId);
      if (existing != null && !existing.equals(valueType)) {
        throw new IllegalArgumentException("axis \"" + axisId + "\" is already registered with type " +
            existing.getName());
      }
      axes.put(axisId, Objects.requireNonNull(valueType, "valueType"));
      axisRegistrations.put(axisId, catalog -> catalog.register(axisId, valueType));
      return this;
    }

    /**
     * Declares a flag with its initial definition.
     *
     * @param definition the definition
     * @return the builder
     */
    public Builder declare(FlagDefinition<?> definition) {
      definitions.add(Objects.requireNonNull(definition, "definition"));
      return this;
    }

    /**
     * Builds the namespace.
     *
     * @return the namespace
     * @throws IllegalArgumentException if a flag belongs to another identifier seed, is declared twice,
     *   or targets an axis or axis value that is not registered
     */
    public Namespace build() {
      return new Namespace(this);
    }
  }
}
