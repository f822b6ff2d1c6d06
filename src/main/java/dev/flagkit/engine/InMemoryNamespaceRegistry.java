package dev.flagkit.engine;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.launchdarkly.logging.LDLogger;
import dev.flagkit.engine.integrations.ConfigLoadRecord;
import dev.flagkit.engine.integrations.ConfigRollbackRecord;
import dev.flagkit.engine.subsystems.NamespaceRegistry;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A thread-safe registry holding one namespace's configuration in memory. This is the default
 * implementation of {@link NamespaceRegistry}.
 * <p>
 * Readers only dereference atomic references, so they never wait for writers. Writers that touch
 * the configuration or its history hold {@code writeLock}, so a load can never interleave with a
 * rollback: the configuration and history always move together.
 */
final class InMemoryNamespaceRegistry implements NamespaceRegistry {
  private final String namespaceId;
  private final int historyLimit;
  private final HookDispatcher hooks;
  private final LDLogger logger;

  private final AtomicReference<Configuration> current;
  private final AtomicBoolean allDisabled = new AtomicBoolean(false);
  private final AtomicReference<ImmutableList<Configuration>> history = new AtomicReference<>(ImmutableList.of());
  private final Object writeLock = new Object();

  // each value is a stack of override values, most recent last
  private volatile ImmutableMap<FeatureId, ImmutableList<Object>> overrides = ImmutableMap.of();
  private final Object overridesLock = new Object();

  InMemoryNamespaceRegistry(String namespaceId, Configuration initial, int historyLimit,
      HookDispatcher hooks, LDLogger logger) {
    if (historyLimit < 1) {
      throw new IllegalArgumentException("history limit must be at least 1, was " + historyLimit);
    }
    this.namespaceId = Objects.requireNonNull(namespaceId, "namespaceId");
    this.current = new AtomicReference<>(Objects.requireNonNull(initial, "initial"));
    this.historyLimit = historyLimit;
    this.hooks = hooks;
    this.logger = logger;
  }

  @Override
  public String getNamespaceId() {
    return namespaceId;
  }

  @Override
  public Configuration getConfiguration() {
    return current.get();
  }

  @Override
  public RegistrySnapshot snapshot() {
    return new RegistrySnapshot(namespaceId, current.get(), allDisabled.get(), topOverrides());
  }

  @Override
  public void load(Configuration configuration) {
    Objects.requireNonNull(configuration, "configuration");
    synchronized (writeLock) {
      Configuration previous = current.getAndSet(configuration);
      ImmutableList<Configuration> h = history.get();
      int keepFrom = Math.max(0, h.size() + 1 - historyLimit);
      history.set(ImmutableList.<Configuration>builder()
          .addAll(h.subList(keepFrom, h.size()))
          .add(previous)
          .build());
    }
    logger.debug("Namespace \"{}\" loaded configuration version {} with {} flags", namespaceId,
        configuration.getMetadata().getVersion(), configuration.getFlags().size());
    hooks.afterConfigLoad(new ConfigLoadRecord(namespaceId, configuration.getFlags().size(),
        configuration.getMetadata().getVersion()));
  }

  @Override
  public boolean rollback(int steps) {
    if (steps < 1) {
      throw new IllegalArgumentException("rollback steps must be at least 1, was " + steps);
    }
    Configuration restored;
    synchronized (writeLock) {
      ImmutableList<Configuration> h = history.get();
      if (h.size() < steps) {
        logger.warn("Namespace \"{}\" cannot roll back {} steps; only {} available", namespaceId, steps, h.size());
        return false;
      }
      int target = h.size() - steps;
      restored = h.get(target);
      current.set(restored);
      history.set(h.subList(0, target));
    }
    logger.info("Namespace \"{}\" rolled back {} step(s) to configuration version {}", namespaceId, steps,
        restored.getMetadata().getVersion());
    hooks.afterConfigRollback(new ConfigRollbackRecord(namespaceId, steps, restored.getMetadata().getVersion()));
    return true;
  }

  @Override
  public List<Configuration> getHistory() {
    return history.get();
  }

  @Override
  public void disableAll() {
    if (!allDisabled.getAndSet(true)) {
      logger.warn("All flags in namespace \"{}\" are disabled", namespaceId);
    }
  }

  @Override
  public void enableAll() {
    if (allDisabled.getAndSet(false)) {
      logger.info("Flags in namespace \"{}\" are enabled again", namespaceId);
    }
  }

  @Override
  public boolean isAllDisabled() {
    return allDisabled.get();
  }

  @Override
  public <T> FlagDefinition<T> flag(Feature<T> feature) {
    return snapshot().flag(feature);
  }

  @Override
  public void updateDefinition(FlagDefinition<?> definition) {
    synchronized (writeLock) {
      current.set(current.get().withDefinition(definition));
    }
  }

  @Override
  public <T> void setOverride(Feature<T> feature, T value) {
    Object checked = feature.checkValue(value);
    synchronized (overridesLock) {
      ImmutableList<Object> stack = overrides.get(feature.getId());
      ImmutableList<Object> newStack = ImmutableList.builder()
          .addAll(stack == null ? ImmutableList.of() : stack)
          .add(checked)
          .build();
      overrides = replaceOverride(feature.getId(), newStack);
    }
  }

  @Override
  public void clearOverride(Feature<?> feature) {
    synchronized (overridesLock) {
      ImmutableList<Object> stack = overrides.get(feature.getId());
      if (stack == null) {
        return;
      }
      overrides = replaceOverride(feature.getId(), stack.size() == 1 ? null : stack.subList(0, stack.size() - 1));
    }
  }

  @Override
  public void clearAllOverrides() {
    synchronized (overridesLock) {
      overrides = ImmutableMap.of();
    }
  }

  @Override
  public boolean hasOverride(Feature<?> feature) {
    return overrides.containsKey(feature.getId());
  }

  private ImmutableMap<FeatureId, ImmutableList<Object>> replaceOverride(FeatureId id, ImmutableList<Object> stack) {
    // ImmutableMap.Builder doesn't support overwriting an existing key
    ImmutableMap.Builder<FeatureId, ImmutableList<Object>> b = ImmutableMap.builder();
    for (Map.Entry<FeatureId, ImmutableList<Object>> e: overrides.entrySet()) {
      if (!e.getKey().equals(id)) {
        b.put(e.getKey(), e.getValue());
      }
    }
    if (stack != null) {
      b.put(id, stack);
    }
    return b.build();
  }

  private ImmutableMap<FeatureId, Object> topOverrides() {
    ImmutableMap<FeatureId, ImmutableList<Object>> o = overrides;
    if (o.isEmpty()) {
      return ImmutableMap.of();
    }
    ImmutableMap.Builder<FeatureId, Object> b = ImmutableMap.builder();
    for (Map.Entry<FeatureId, ImmutableList<Object>> e: o.entrySet()) {
      b.put(e.getKey(), e.getValue().get(e.getValue().size() - 1));
    }
    return b.build();
  }
}
