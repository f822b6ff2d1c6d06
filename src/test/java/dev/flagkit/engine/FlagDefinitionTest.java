package dev.flagkit.engine;

import org.junit.Test;

import static dev.flagkit.engine.ModelBuilders.BOOL_FLAG;
import static dev.flagkit.engine.ModelBuilders.DOUBLE_FLAG;
import static dev.flagkit.engine.ModelBuilders.STRING_FLAG;
import static dev.flagkit.engine.ModelBuilders.context;
import static dev.flagkit.engine.ModelBuilders.iosUser;
import static dev.flagkit.engine.ModelBuilders.locales;
import static dev.flagkit.engine.ModelBuilders.platforms;
import static dev.flagkit.engine.ModelBuilders.stableIdWithBucket;
import static dev.flagkit.engine.ModelBuilders.targeting;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

@SuppressWarnings("javadoc")
public class FlagDefinitionTest {
  @Test
  public void noRulesGivesDefault() {
    FlagDefinition<String> def = FlagDefinition.builder(STRING_FLAG, "off").build();
    FlagDefinition.Trace<String> trace = def.evaluateTrace(iosUser("u"));
    assertEquals("off", trace.value);
    assertNull(trace.matched);
    assertNull(trace.bucket);
  }

  @Test
  public void inactiveFlagGivesDefaultEvenWithMatchingRule() {
    FlagDefinition<String> def = FlagDefinition.builder(STRING_FLAG, "off")
        .active(false)
        .rule(Targeting.CATCH_ALL, "on")
        .build();
    assertEquals("off", def.evaluateTrace(iosUser("u")).value);
  }

  @Test
  public void moreSpecificRuleWinsRegardlessOfDeclarationOrder() {
    FlagDefinition<String> def = FlagDefinition.builder(STRING_FLAG, "default")
        .rule(platforms("ios"), "ios")
        .rule(targeting().platforms("ios").locales("en-US").build(), "ios-en")
        .build();
    assertEquals("ios-en", def.evaluateTrace(iosUser("u")).value);
    assertEquals("ios", def.getRulesByPrecedence().get(1).getValue());
    assertEquals("ios", def.getRules().get(0).getValue());
  }

  @Test
  public void equallySpecificRulesKeepDeclarationOrder() {
    FlagDefinition<String> def = FlagDefinition.builder(STRING_FLAG, "default")
        .rule(locales("en-US"), "by-locale")
        .rule(platforms("ios"), "by-platform")
        .build();
    assertEquals("by-locale", def.evaluateTrace(iosUser("u")).value);

    FlagDefinition<String> reversed = FlagDefinition.builder(STRING_FLAG, "default")
        .rule(platforms("ios"), "by-platform")
        .rule(locales("en-US"), "by-locale")
        .build();
    assertEquals("by-platform", reversed.evaluateTrace(iosUser("u")).value);
  }

  @Test
  public void ruleOutsideRolloutFallsThroughToNextRule() {
    StableId outside = stableIdWithBucket(FlagDefinition.DEFAULT_SALT, STRING_FLAG.getKey(), false, 1000);
    Rule<String> narrow = Rule.builder("narrow").targeting(platforms("ios")).rollout(10).build();
    FlagDefinition<String> def = FlagDefinition.builder(STRING_FLAG, "default")
        .rule(narrow)
        .rule(Targeting.CATCH_ALL, "everyone")
        .build();
    FlagDefinition.Trace<String> trace = def.evaluateTrace(context("x").stableId(outside).platform("ios").build());
    assertEquals("everyone", trace.value);
    assertSame(narrow, trace.skippedByRollout);
  }

  @Test
  public void ruleInsideRolloutApplies() {
    StableId inside = stableIdWithBucket(FlagDefinition.DEFAULT_SALT, STRING_FLAG.getKey(), true, 1000);
    FlagDefinition<String> def = FlagDefinition.builder(STRING_FLAG, "default")
        .rule(Rule.builder("narrow").targeting(platforms("ios")).rollout(10).build())
        .build();
    FlagDefinition.Trace<String> trace = def.evaluateTrace(context("x").stableId(inside).platform("ios").build());
    assertEquals("narrow", trace.value);
    assertNull(trace.skippedByRollout);
  }

  @Test
  public void zeroRolloutExcludesEveryoneExceptAllowlist() {
    StableId vip = StableId.of("vip");
    FlagDefinition<Boolean> def = FlagDefinition.builder(BOOL_FLAG, false)
        .rule(Rule.builder(true).rollout(0).allowlist(vip).build())
        .build();
    FlagDefinition.Trace<Boolean> forVip = def.evaluateTrace(context("vip").build());
    assertEquals(true, forVip.value);
    assertTrue(forVip.matchedByAllowlist);
    assertEquals(false, def.evaluateTrace(context("someone-else").build()).value);
  }

  @Test
  public void allowlistDoesNotBypassTargeting() {
    StableId vip = StableId.of("vip");
    FlagDefinition<Boolean> def = FlagDefinition.builder(BOOL_FLAG, false)
        .rule(Rule.builder(true).targeting(platforms("android")).rollout(0).allowlist(vip).build())
        .build();
    assertEquals(false, def.evaluateTrace(iosUser("vip")).value);
  }

  @Test
  public void flagLevelAllowlistAppliesToEveryMatchingRule() {
    StableId vip = StableId.of("vip");
    FlagDefinition<String> def = FlagDefinition.builder(STRING_FLAG, "default")
        .allowlist(vip)
        .rule(Rule.builder("ios").targeting(platforms("ios")).rollout(0).build())
        .rule(Rule.builder("all").rollout(0).build())
        .build();
    assertEquals("ios", def.evaluateTrace(iosUser("vip")).value);
    assertEquals("all", def.evaluateTrace(context("vip").platform("web").build()).value);
    assertEquals("default", def.evaluateTrace(iosUser("other")).value);
  }

  @Test
  public void contextWithoutStableIdIsOnlyInFullRollouts() {
    FlagDefinition<String> def = FlagDefinition.builder(STRING_FLAG, "default")
        .rule(Rule.builder("partial").rollout(99.99).build())
        .rule(Rule.builder("full").targeting(Targeting.CATCH_ALL).build())
        .build();
    FlagDefinition.Trace<String> trace = def.evaluateTrace(Context.builder().build());
    assertEquals("partial", def.getRulesByPrecedence().get(0).getValue());
    assertEquals("full", trace.value);
    assertEquals(Integer.valueOf(9999), trace.bucket);
  }

  @Test
  public void saltChangesBuckets() {
    FlagDefinition<String> a = FlagDefinition.builder(STRING_FLAG, "default").salt("a").build();
    FlagDefinition<String> b = a.toBuilder().salt("b").build();
    assertNotEquals(a, b);
    assertEquals("a", a.getSalt());
  }

  @Test
  public void toBuilderCopiesEverything() {
    FlagDefinition<String> def = FlagDefinition.builder(STRING_FLAG, "default")
        .active(false)
        .salt("s")
        .allowlist(StableId.of("vip"))
        .rule(platforms("ios"), "ios")
        .build();
    assertEquals(def, def.toBuilder().build());
  }

  @Test(expected = IllegalArgumentException.class)
  public void emptySaltIsRejected() {
    FlagDefinition.builder(STRING_FLAG, "default").salt("");
  }

  @Test(expected = IllegalArgumentException.class)
  public void nonFiniteDoubleIsRejected() {
    FlagDefinition.builder(DOUBLE_FLAG, Double.NaN);
  }

  @Test(expected = IllegalArgumentException.class)
  public void rolloutOutOfRangeIsRejected() {
    Rule.builder("x").rollout(100.5);
  }

  @Test
  public void overrideReturnsValueToEveryone() {
    FlagDefinition<String> def = FlagDefinition.builder(STRING_FLAG, "default")
        .active(false)
        .rule(platforms("android"), "android")
        .build();
    FlagDefinition<String> overridden = def.overriddenWith("forced");
    assertEquals("forced", overridden.evaluateTrace(iosUser("u")).value);
    assertEquals("forced", overridden.evaluateTrace(Context.builder().build()).value);
  }
}
