package dev.flagkit.engine;

import com.google.common.collect.ImmutableList;
import com.launchdarkly.logging.LDLogLevel;
import com.launchdarkly.logging.LogCapture;
import com.launchdarkly.logging.Logs;
import dev.flagkit.engine.integrations.Hook;
import dev.flagkit.engine.subsystems.NamespaceRegistry;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

@SuppressWarnings("javadoc")
public class EngineConfigTest {
  @Test
  public void defaults() {
    EngineConfig config = new EngineConfig.Builder().build();
    assertEquals(NamespaceRegistry.DEFAULT_HISTORY_LIMIT, config.historyLimit);
    assertTrue(config.hooks.getHooks().isEmpty());
    assertEquals(Loggers.BASE_LOGGER_NAME, config.logging.getBaseLoggerName());
  }

  @Test
  public void historyLimit() {
    assertEquals(3, new EngineConfig.Builder().historyLimit(3).build().historyLimit);
  }

  @Test(expected = IllegalArgumentException.class)
  public void historyLimitBelowOneIsRejected() {
    new EngineConfig.Builder().historyLimit(0);
  }

  @Test
  public void hooks() {
    Hook hook = new Hook("h") {};
    EngineConfig config = new EngineConfig.Builder()
        .hooks(Components.hooks().setHooks(ImmutableList.of(hook)))
        .build();
    assertSame(hook, config.hooks.getHooks().get(0));
  }

  @Test
  public void inMemoryRegistryUsesConfiguredLogging() {
    LogCapture logSink = Logs.capture();
    EngineConfig config = new EngineConfig.Builder()
        .logging(Components.logging(logSink).level(LDLogLevel.DEBUG))
        .historyLimit(1)
        .build();
    NamespaceRegistry registry = Components.inMemoryRegistry("standalone", config);
    assertEquals("standalone", registry.getNamespaceId());
    assertSame(Configuration.EMPTY, registry.getConfiguration());
    registry.disableAll();
    assertTrue(BaseTest.hasMessageMatching(logSink, LDLogLevel.WARN, "All flags in namespace \"standalone\" are disabled"));
  }
}
