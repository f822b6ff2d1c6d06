package dev.flagkit.engine;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

@SuppressWarnings("javadoc")
public class FeatureIdTest {
  @Test
  public void encodedFormHasPrefixSeedAndKey() {
    FeatureId id = FeatureId.of("payments", "new-checkout");
    assertEquals("feature::payments::new-checkout", id.encode());
    assertEquals("payments", id.getNamespaceSeed());
    assertEquals("new-checkout", id.getKey());
  }

  @Test
  public void parseIsInverseOfEncode() {
    FeatureId id = FeatureId.of("payments", "new-checkout");
    assertThat(FeatureId.parse(id.encode()), equalTo(id));
  }

  @Test
  public void sameKeyInDifferentSeedsIsDifferentFlag() {
    assertNotEquals(FeatureId.of("a", "flag"), FeatureId.of("b", "flag"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void blankSeedIsRejected() {
    FeatureId.of(" ", "flag");
  }

  @Test(expected = IllegalArgumentException.class)
  public void blankKeyIsRejected() {
    FeatureId.of("seed", "");
  }

  @Test(expected = IllegalArgumentException.class)
  public void keyContainingSeparatorIsRejected() {
    FeatureId.of("seed", "a::b");
  }

  @Test(expected = IllegalArgumentException.class)
  public void parseRejectsWrongPrefix() {
    FeatureId.parse("flag::seed::key");
  }

  @Test(expected = IllegalArgumentException.class)
  public void parseRejectsMissingPart() {
    FeatureId.parse("feature::seed");
  }

  @Test(expected = IllegalArgumentException.class)
  public void parseRejectsExtraPart() {
    FeatureId.parse("feature::seed::key::more");
  }

  @Test
  public void idsAreOrderedByEncodedForm() {
    assertThat(FeatureId.of("a", "x").compareTo(FeatureId.of("b", "a")), lessThan(0));
    assertThat(FeatureId.of("a", "y").compareTo(FeatureId.of("a", "x")), greaterThan(0));
  }
}
