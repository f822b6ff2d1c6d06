package dev.flagkit.engine;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

@SuppressWarnings("javadoc")
public class VersionRangeTest {
  private static final Version V1 = Version.of(1, 0, 0);
  private static final Version V2 = Version.of(2, 0, 0);
  private static final Version V3 = Version.of(3, 0, 0);

  @Test
  public void unboundedContainsEverything() {
    VersionRange r = VersionRange.unbounded();
    assertTrue(r.contains(Version.MIN));
    assertTrue(r.contains(Version.of(999, 0, 0)));
    assertFalse(r.hasBounds());
    assertEquals(VersionRange.Kind.UNBOUNDED, r.getKind());
    assertNull(r.getMin());
    assertNull(r.getMax());
  }

  @Test
  public void leftBoundIsInclusive() {
    VersionRange r = VersionRange.atLeast(V2);
    assertFalse(r.contains(V1));
    assertTrue(r.contains(V2));
    assertTrue(r.contains(V3));
    assertTrue(r.hasBounds());
    assertEquals(VersionRange.Kind.MIN_BOUND, r.getKind());
  }

  @Test
  public void rightBoundIsInclusive() {
    VersionRange r = VersionRange.atMost(V2);
    assertTrue(r.contains(V1));
    assertTrue(r.contains(V2));
    assertFalse(r.contains(V3));
    assertEquals(VersionRange.Kind.MAX_BOUND, r.getKind());
  }

  @Test
  public void fullyBoundIsInclusiveAtBothEnds() {
    VersionRange r = VersionRange.between(V1, V2);
    assertTrue(r.contains(V1));
    assertTrue(r.contains(Version.of(1, 5, 0)));
    assertTrue(r.contains(V2));
    assertFalse(r.contains(Version.of(2, 0, 1)));
    assertFalse(r.contains(Version.of(0, 9, 9)));
  }

  @Test
  public void singleVersionRange() {
    VersionRange r = VersionRange.between(V2, V2);
    assertTrue(r.contains(V2));
    assertFalse(r.contains(V1));
  }

  @Test(expected = IllegalArgumentException.class)
  public void invertedBoundsAreRejected() {
    VersionRange.between(V2, V1);
  }

  @Test
  public void rangesWithSameBoundsAreEqual() {
    assertEquals(VersionRange.between(V1, V2), VersionRange.between(V1, V2));
    assertEquals(VersionRange.unbounded(), VersionRange.unbounded());
  }
}
