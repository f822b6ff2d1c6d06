package dev.flagkit.engine;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.launchdarkly.logging.LDLogLevel;
import dev.flagkit.engine.ModelBuilders.Region;
import dev.flagkit.engine.ModelBuilders.Tier;
import dev.flagkit.engine.TestHooks.FailingHook;
import dev.flagkit.engine.TestHooks.RecordingHook;
import dev.flagkit.engine.interfaces.ShadowMismatchListener;
import dev.flagkit.engine.subsystems.NamespaceRegistry;

import org.easymock.Capture;
import org.easymock.EasyMockSupport;
import org.junit.Test;

import java.util.List;

import static dev.flagkit.engine.ModelBuilders.BOOL_FLAG;
import static dev.flagkit.engine.ModelBuilders.SEED;
import static dev.flagkit.engine.ModelBuilders.STRING_FLAG;
import static dev.flagkit.engine.ModelBuilders.androidUser;
import static dev.flagkit.engine.ModelBuilders.context;
import static dev.flagkit.engine.ModelBuilders.iosUser;
import static dev.flagkit.engine.ModelBuilders.platforms;
import static dev.flagkit.engine.ModelBuilders.targeting;
import static org.easymock.EasyMock.capture;
import static org.easymock.EasyMock.expectLastCall;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

@SuppressWarnings("javadoc")
public class NamespaceTest extends BaseTest {
  private final EasyMockSupport mocks = new EasyMockSupport();

  private Namespace.Builder baseNamespace() {
    return Namespace.builder("mobile").identifierSeed(SEED).config(baseConfig().build());
  }

  private static FlagDefinition<Boolean> platformRollout() {
    return FlagDefinition.builder(BOOL_FLAG, false)
        .rule(Rule.builder(true).targeting(platforms("ios")).build())
        .rule(Rule.builder(true).targeting(platforms("android")).rollout(50).build())
        .build();
  }

  @Test
  public void iosAlwaysOnAndroidHalfRollout() {
    Namespace ns = baseNamespace().declare(platformRollout()).build();
    int androidOn = 0;
    for (int i = 0; i < 1000; i++) {
      assertTrue(ns.evaluate(BOOL_FLAG, iosUser("user-" + i)));
      if (ns.evaluate(BOOL_FLAG, androidUser("user-" + i))) {
        androidOn++;
      }
    }
    assertThat(androidOn, allOf(greaterThanOrEqualTo(470), lessThanOrEqualTo(530)));
  }

  @Test
  public void evaluationIsDeterministic() {
    Namespace ns = baseNamespace().declare(platformRollout()).build();
    Context ctx = androidUser("user-7");
    boolean first = ns.evaluate(BOOL_FLAG, ctx);
    for (int i = 0; i < 100; i++) {
      assertEquals(first, ns.evaluate(BOOL_FLAG, ctx));
    }
  }

  @Test
  public void identifierSeedDefaultsToNamespaceId() {
    Namespace ns = Namespace.builder(SEED).build();
    assertEquals(SEED, ns.getIdentifierSeed());
    assertEquals(SEED, ns.getId());
  }

  @Test
  public void declaredFlagsAreLoadedInitially() {
    Namespace ns = baseNamespace().declare(platformRollout())
        .declare(FlagDefinition.builder(STRING_FLAG, "x").build()).build();
    assertEquals(ImmutableList.of(BOOL_FLAG, STRING_FLAG), ns.getDeclaredFeatures());
    assertEquals(ns.getDeclaredConfiguration(), ns.getRegistry().getConfiguration());
    assertEquals("declared", ns.getDeclaredConfiguration().getMetadata().getSource());
    assertEquals("mobile", ns.getRegistry().getNamespaceId());
  }

  @Test(expected = IllegalArgumentException.class)
  public void flagFromAnotherSeedIsRejected() {
    Namespace.builder("other").declare(platformRollout()).build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void duplicateDeclarationIsRejected() {
    baseNamespace().declare(platformRollout()).declare(FlagDefinition.builder(BOOL_FLAG, true).build()).build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void blankNamespaceIdIsRejected() {
    Namespace.builder("  ");
  }

  @Test(expected = IllegalArgumentException.class)
  public void unregisteredAxisIsRejected() {
    baseNamespace()
        .declare(FlagDefinition.builder(BOOL_FLAG, false)
            .rule(targeting().axis("tier", ImmutableSet.of("pro")).build(), true)
            .build())
        .build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void unknownAxisValueIsRejected() {
    baseNamespace()
        .axis("tier", Tier.class)
        .declare(FlagDefinition.builder(BOOL_FLAG, false)
            .rule(targeting().axis("tier", ImmutableSet.of("gold")).build(), true)
            .build())
        .build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void axisIdCannotChangeType() {
    baseNamespace().axis("tier", Tier.class).axis("tier", Region.class);
  }

  @Test
  public void axesAreRegisteredOnceInDeclarationOrder() {
    Namespace ns = baseNamespace()
        .axis("tier", Tier.class)
        .axis("region", Region.class)
        .axis("tier", Tier.class)
        .build();
    List<Axis<?>> axes = ns.getAxisCatalog().getAxes();
    assertEquals(2, axes.size());
    assertEquals("tier", axes.get(0).getId());
    assertEquals(Tier.class, axes.get(0).getValueType());
    assertEquals("region", axes.get(1).getId());
    assertEquals(Region.class, ns.getAxisCatalog().axisById("region").getValueType());
  }

  @Test
  public void customAxisTargeting() {
    Namespace ns = baseNamespace()
        .axis("tier", Tier.class)
        .declare(FlagDefinition.builder(STRING_FLAG, "basic")
            .rule(targeting().axis("tier", ImmutableSet.of("pro", "enterprise")).build(), "premium")
            .build())
        .build();
    Axis<Tier> tier = ns.getAxisCatalog().axisFor(Tier.class);
    assertEquals("premium", ns.evaluate(STRING_FLAG, context("u").axis(tier, Tier.PRO).build()));
    assertEquals("basic", ns.evaluate(STRING_FLAG, context("u").axis(tier, Tier.FREE).build()));
    assertEquals("premium", ns.evaluate(STRING_FLAG, context("u")
        .axisValues(AxisValues.builder(ns.getAxisCatalog()).put(Tier.ENTERPRISE).build()).build()));
  }

  @Test(expected = FlagNotFoundException.class)
  public void undeclaredFlagThrows() {
    baseNamespace().declare(platformRollout()).build().evaluate(STRING_FLAG, iosUser("u"));
  }

  @Test
  public void killSwitchAppliesOnlyToItsNamespace() {
    Namespace a = baseNamespace().declare(platformRollout()).build();
    Namespace b = baseNamespace().declare(platformRollout()).build();
    a.getRegistry().disableAll();
    assertFalse(a.evaluate(BOOL_FLAG, iosUser("u")));
    assertTrue(b.evaluate(BOOL_FLAG, iosUser("u")));
    assertEquals(DecisionKind.REGISTRY_DISABLED, a.explain(BOOL_FLAG, iosUser("u")).getDecision().getKind());
  }

  @Test
  public void overrideTakesEffectImmediately() {
    Namespace ns = baseNamespace().declare(platformRollout()).build();
    ns.getRegistry().setOverride(BOOL_FLAG, true);
    assertTrue(ns.evaluate(BOOL_FLAG, context("u").platform("web").build()));
    ns.getRegistry().clearOverride(BOOL_FLAG);
    assertFalse(ns.evaluate(BOOL_FLAG, context("u").platform("web").build()));
  }

  @Test
  public void explainLogsAtDebugLevel() {
    Namespace ns = baseNamespace().declare(platformRollout()).build();
    EvaluationDiagnostics<Boolean> d = ns.explain(BOOL_FLAG, iosUser("u"));
    assertEquals(EvaluationMode.EXPLAIN, d.getMode());
    assertEquals(DecisionKind.RULE, d.getDecision().getKind());
    assertTrue(hasLogMessage(LDLogLevel.DEBUG, "Explained flag \"bool-flag\" in namespace \"mobile\".*"));
  }

  @Test
  public void hooksSeeEvaluationsAndFailuresAreIsolated() {
    RecordingHook recorder = new RecordingHook();
    Namespace ns = Namespace.builder("mobile").identifierSeed(SEED)
        .config(baseConfig().hooks(Components.hooks().setHooks(ImmutableList.of(new FailingHook(), recorder))).build())
        .declare(platformRollout())
        .build();
    assertTrue(ns.evaluate(BOOL_FLAG, iosUser("u")));
    assertEquals(1, recorder.evaluations.size());
    assertEquals(EvaluationMode.NORMAL, recorder.evaluations.get(0).getMode());
    assertTrue(hasLogMessage(LDLogLevel.ERROR, ".*afterEvaluation.*failing.*"));
  }

  @Test
  public void historyLimitComesFromConfig() {
    Namespace ns = Namespace.builder("mobile").identifierSeed(SEED)
        .config(baseConfig().historyLimit(1).build())
        .declare(platformRollout())
        .build();
    Configuration v1 = ns.getDeclaredConfiguration().withMetadata(ConfigurationMetadata.of("1", null, null));
    Configuration v2 = ns.getDeclaredConfiguration().withMetadata(ConfigurationMetadata.of("2", null, null));
    ns.getRegistry().load(v1);
    ns.getRegistry().load(v2);
    assertEquals(ImmutableList.of(v1), ns.getRegistry().getHistory());
  }

  // shadow evaluation

  private Namespace candidateNamespace(FlagDefinition<Boolean> definition) {
    return Namespace.builder("mobile-candidate").identifierSeed(SEED).config(baseConfig().build())
        .declare(definition).build();
  }

  @Test
  public void shadowReportsValueMismatchAndReturnsBaseline() {
    Namespace baseline = baseNamespace().declare(platformRollout()).build();
    NamespaceRegistry candidate = candidateNamespace(FlagDefinition.builder(BOOL_FLAG, false).build()).getRegistry();
    ShadowMismatchListener listener = mocks.createStrictMock(ShadowMismatchListener.class);
    Capture<ShadowMismatch<?>> captured = Capture.newInstance();
    listener.onMismatch(capture(captured));
    expectLastCall();
    mocks.replayAll();

    assertTrue(baseline.evaluateWithShadow(BOOL_FLAG, iosUser("u"), candidate, null, listener));

    mocks.verifyAll();
    ShadowMismatch<?> mismatch = captured.getValue();
    assertEquals(ImmutableSet.of(ShadowMismatch.Kind.VALUE), mismatch.getKinds());
    assertEquals(BOOL_FLAG.getKey(), mismatch.getFeatureKey());
    assertEquals(true, mismatch.getBaseline().getValue());
    assertEquals(false, mismatch.getCandidate().getValue());
    assertEquals(EvaluationMode.NORMAL, mismatch.getBaseline().getMode());
    assertEquals(EvaluationMode.SHADOW, mismatch.getCandidate().getMode());
    assertTrue(hasLogMessage(LDLogLevel.WARN, "Shadow mismatch in namespace \"mobile\".*"));
  }

  @Test
  public void shadowWithMatchingValuesDoesNotNotify() {
    Namespace baseline = baseNamespace().declare(platformRollout()).build();
    NamespaceRegistry candidate = candidateNamespace(platformRollout()).getRegistry();
    ShadowMismatchListener listener = mocks.createStrictMock(ShadowMismatchListener.class);
    mocks.replayAll();

    assertTrue(baseline.evaluateWithShadow(BOOL_FLAG, iosUser("u"), candidate, ShadowOptions.defaults(), listener));

    mocks.verifyAll();
  }

  @Test
  public void decisionMismatchIsReportedOnlyWhenRequested() {
    Namespace baseline = baseNamespace().declare(platformRollout()).build();
    // same value for web users, but from a rule instead of the default
    NamespaceRegistry candidate = candidateNamespace(FlagDefinition.builder(BOOL_FLAG, false)
        .rule(platforms("web"), false).build()).getRegistry();
    Context web = context("u").platform("web").build();

    ShadowMismatchListener silent = mocks.createStrictMock(ShadowMismatchListener.class);
    mocks.replayAll();
    assertFalse(baseline.evaluateWithShadow(BOOL_FLAG, web, candidate, ShadowOptions.defaults(), silent));
    mocks.verifyAll();

    Capture<ShadowMismatch<?>> captured = Capture.newInstance();
    mocks.resetAll();
    silent.onMismatch(capture(captured));
    expectLastCall();
    mocks.replayAll();
    assertFalse(baseline.evaluateWithShadow(BOOL_FLAG, web, candidate,
        ShadowOptions.defaults().reportDecisionMismatches(true), silent));
    mocks.verifyAll();
    assertEquals(ImmutableSet.of(ShadowMismatch.Kind.DECISION), captured.getValue().getKinds());
  }

  @Test
  public void candidateIsSkippedWhenBaselineIsDisabled() {
    Namespace baseline = baseNamespace().declare(platformRollout()).build();
    baseline.getRegistry().disableAll();
    NamespaceRegistry candidate = candidateNamespace(FlagDefinition.builder(BOOL_FLAG, true).build()).getRegistry();
    ShadowMismatchListener listener = mocks.createStrictMock(ShadowMismatchListener.class);
    mocks.replayAll();

    assertFalse(baseline.evaluateWithShadow(BOOL_FLAG, iosUser("u"), candidate, null, listener));

    mocks.verifyAll();
  }

  @Test
  public void candidateCanBeEvaluatedWhenBaselineIsDisabled() {
    Namespace baseline = baseNamespace().declare(platformRollout()).build();
    baseline.getRegistry().disableAll();
    NamespaceRegistry candidate = candidateNamespace(FlagDefinition.builder(BOOL_FLAG, true).build()).getRegistry();
    Capture<ShadowMismatch<?>> captured = Capture.newInstance();
    ShadowMismatchListener listener = mocks.createStrictMock(ShadowMismatchListener.class);
    listener.onMismatch(capture(captured));
    expectLastCall();
    mocks.replayAll();

    assertFalse(baseline.evaluateWithShadow(BOOL_FLAG, iosUser("u"), candidate,
        ShadowOptions.defaults().evaluateCandidateWhenBaselineDisabled(true), listener));

    mocks.verifyAll();
    assertEquals(DecisionKind.REGISTRY_DISABLED, captured.getValue().getBaseline().getDecision().getKind());
  }

  @Test
  public void failingCandidateDoesNotAffectResult() {
    Namespace baseline = baseNamespace().declare(platformRollout()).build();
    NamespaceRegistry empty = Components.inMemoryRegistry("empty");
    ShadowMismatchListener listener = mocks.createStrictMock(ShadowMismatchListener.class);
    mocks.replayAll();

    assertTrue(baseline.evaluateWithShadow(BOOL_FLAG, iosUser("u"), empty, null, listener));

    mocks.verifyAll();
    assertTrue(hasLogMessage(LDLogLevel.WARN, "Shadow evaluation of flag \"bool-flag\".*failed.*"));
  }

  @Test
  public void failingListenerDoesNotAffectResult() {
    Namespace baseline = baseNamespace().declare(platformRollout()).build();
    NamespaceRegistry candidate = candidateNamespace(FlagDefinition.builder(BOOL_FLAG, false).build()).getRegistry();
    assertTrue(baseline.evaluateWithShadow(BOOL_FLAG, iosUser("u"), candidate, null, m -> {
      throw new RuntimeException("listener broke");
    }));
    assertTrue(hasLogMessage(LDLogLevel.WARN, ".*shadow mismatch listener.*listener broke.*"));
  }

  @Test
  public void shadowWithoutListenerStillLogs() {
    Namespace baseline = baseNamespace().declare(platformRollout()).build();
    NamespaceRegistry candidate = candidateNamespace(FlagDefinition.builder(BOOL_FLAG, false).build()).getRegistry();
    assertTrue(baseline.evaluateWithShadow(BOOL_FLAG, iosUser("u"), candidate, null, null));
    assertTrue(hasLogMessage(LDLogLevel.WARN, "Shadow mismatch.*"));
  }

  @Test
  public void candidateOverridesAreHonored() {
    Namespace baseline = baseNamespace().declare(platformRollout()).build();
    NamespaceRegistry candidate = candidateNamespace(platformRollout()).getRegistry();
    candidate.setOverride(BOOL_FLAG, false);
    Capture<ShadowMismatch<?>> captured = Capture.newInstance();
    ShadowMismatchListener listener = mocks.createStrictMock(ShadowMismatchListener.class);
    listener.onMismatch(capture(captured));
    expectLastCall();
    mocks.replayAll();

    baseline.evaluateWithShadow(BOOL_FLAG, iosUser("u"), candidate, null, listener);

    mocks.verifyAll();
    assertEquals(false, captured.getValue().getCandidate().getValue());
  }
}
