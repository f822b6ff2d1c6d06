package dev.flagkit.engine;

import com.google.common.collect.ImmutableSet;
import dev.flagkit.engine.ModelBuilders.Region;
import dev.flagkit.engine.ModelBuilders.Tier;

import org.junit.Test;

import java.util.Collections;

import static dev.flagkit.engine.ModelBuilders.context;
import static dev.flagkit.engine.ModelBuilders.iosUser;
import static dev.flagkit.engine.ModelBuilders.targeting;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

@SuppressWarnings("javadoc")
public class TargetingTest {
  private static final Axis<Tier> TIER = new Axis<>("tier", Tier.class);
  private static final Axis<Region> REGION = new Axis<>("region", Region.class);

  @Test
  public void catchAllMatchesEverything() {
    assertTrue(Targeting.CATCH_ALL.matches(Context.builder().build()));
    assertTrue(Targeting.CATCH_ALL.matches(iosUser("u")));
    assertEquals(0, Targeting.CATCH_ALL.getSpecificity());
  }

  @Test
  public void specificityCountsEachConstrainedCriterion() {
    Targeting t = targeting()
        .locales("en-US")
        .platforms("ios", "android")
        .versions(VersionRange.atLeast(Version.of(2, 0, 0)))
        .axis(TIER, Tier.PRO)
        .axis(REGION, Region.EU)
        .build();
    assertEquals(5, t.getBaseSpecificity());
    assertEquals(5, t.getSpecificity());
  }

  @Test
  public void explicitUnboundedRangeDoesNotCount() {
    Targeting t = targeting().versions(VersionRange.unbounded()).build();
    assertEquals(0, t.getSpecificity());
    assertEquals(Targeting.CATCH_ALL, t);
  }

  @Test
  public void multipleValuesForOneAxisCountOnce() {
    Targeting t = targeting().axis(TIER, Tier.PRO, Tier.ENTERPRISE).build();
    assertEquals(1, t.getSpecificity());
  }

  @Test
  public void extensionAddsItsSpecificity() {
    Targeting t = targeting().platforms("ios").extension(ctx -> true).build();
    assertEquals(1, t.getBaseSpecificity());
    assertEquals(1, t.getExtensionSpecificity());
    assertEquals(2, t.getSpecificity());
  }

  @Test
  public void extensionMustAlsoMatch() {
    Targeting t = targeting().platforms("ios").extension(ctx -> false).build();
    assertFalse(t.matches(iosUser("u")));
  }

  @Test
  public void localeAndPlatformMustBeInSets() {
    Targeting t = targeting().locales("en-US", "en-GB").platforms("ios").build();
    assertTrue(t.matches(iosUser("u")));
    assertFalse(t.matches(context("u").locale("de-DE").platform("ios").build()));
    assertFalse(t.matches(context("u").locale("en-US").platform("android").build()));
  }

  @Test
  public void missingContextFieldsDoNotMatchConstrainedCriteria() {
    Context empty = Context.builder().build();
    assertFalse(targeting().locales("en-US").build().matches(empty));
    assertFalse(targeting().platforms("ios").build().matches(empty));
    assertFalse(targeting().versions(VersionRange.atMost(Version.of(9, 0, 0))).build().matches(empty));
    assertFalse(targeting().axis(TIER, Tier.FREE).build().matches(empty));
  }

  @Test
  public void versionRangeIsChecked() {
    Targeting t = targeting().versions(VersionRange.between(Version.of(1, 0, 0), Version.of(1, 9, 9))).build();
    assertTrue(t.matches(context("u").appVersion(Version.of(1, 5, 0)).build()));
    assertFalse(t.matches(context("u").appVersion(Version.of(2, 0, 0)).build()));
  }

  @Test
  public void axisMatchesWhenAnyContextValueIsAllowed() {
    Targeting t = targeting().axis(TIER, Tier.PRO, Tier.ENTERPRISE).build();
    assertTrue(t.matches(context("u").axis(TIER, Tier.ENTERPRISE).build()));
    assertTrue(t.matches(context("u").axis(TIER, Tier.FREE, Tier.PRO).build()));
    assertFalse(t.matches(context("u").axis(TIER, Tier.FREE).build()));
    assertFalse(t.matches(context("u").axis(REGION, Region.US).build()));
  }

  @Test
  public void everyAxisConstraintMustHold() {
    Targeting t = targeting().axis(TIER, Tier.PRO).axis(REGION, Region.EU).build();
    assertTrue(t.matches(context("u").axis(TIER, Tier.PRO).axis(REGION, Region.EU).build()));
    assertFalse(t.matches(context("u").axis(TIER, Tier.PRO).axis(REGION, Region.US).build()));
  }

  @Test
  public void axisByIdWidensAcceptedSet() {
    Targeting t = targeting().axis("tier", ImmutableSet.of("free")).axis("tier", ImmutableSet.of("pro")).build();
    assertEquals(ImmutableSet.of("free", "pro"), t.getAxisConstraints().get("tier"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void emptyAxisConstraintIsRejected() {
    targeting().axis("tier", Collections.<String>emptySet());
  }
}
