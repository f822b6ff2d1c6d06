package dev.flagkit.engine;

import com.google.common.collect.ImmutableList;

import org.junit.Test;

import static dev.flagkit.engine.ModelBuilders.BOOL_FLAG;
import static dev.flagkit.engine.ModelBuilders.INT_FLAG;
import static dev.flagkit.engine.ModelBuilders.STRING_FLAG;
import static dev.flagkit.engine.ModelBuilders.platforms;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

@SuppressWarnings("javadoc")
public class ConfigurationDiffTest {
  private static final FlagDefinition<Boolean> BOOL_DEF = FlagDefinition.builder(BOOL_FLAG, false).build();
  private static final FlagDefinition<String> STRING_DEF = FlagDefinition.builder(STRING_FLAG, "a").build();
  private static final FlagDefinition<Integer> INT_DEF = FlagDefinition.builder(INT_FLAG, 1).build();

  @Test
  public void identicalConfigurationsHaveEmptyDiff() {
    Configuration c = Configuration.builder().put(BOOL_DEF).put(STRING_DEF).build();
    assertTrue(ConfigurationDiff.between(c, c.toBuilder().build()).isEmpty());
  }

  @Test
  public void metadataDoesNotMakeDiffNonEmpty() {
    Configuration c = Configuration.builder().put(BOOL_DEF).build();
    ConfigurationDiff diff = ConfigurationDiff.between(c, c.withMetadata(ConfigurationMetadata.of("2", null, null)));
    assertTrue(diff.isEmpty());
    assertEquals("2", diff.getAfter().getVersion());
  }

  @Test
  public void addedRemovedAndChangedFlagsAreReported() {
    FlagDefinition<String> changedString = STRING_DEF.toBuilder().rule(platforms("ios"), "ios").build();
    Configuration before = Configuration.builder().put(BOOL_DEF).put(STRING_DEF).build();
    Configuration after = Configuration.builder().put(changedString).put(INT_DEF).build();

    ConfigurationDiff diff = ConfigurationDiff.between(before, after);
    assertFalse(diff.isEmpty());
    assertEquals(ImmutableList.of(INT_DEF), diff.getAdded());
    assertEquals(ImmutableList.of(BOOL_DEF), diff.getRemoved());
    assertEquals(1, diff.getChanged().size());
    assertEquals(STRING_FLAG.getId(), diff.getChanged().get(0).getId());
    assertEquals(STRING_DEF, diff.getChanged().get(0).getBefore());
    assertEquals(changedString, diff.getChanged().get(0).getAfter());
  }

  @Test
  public void diffAgainstEmpty() {
    Configuration c = Configuration.builder().put(BOOL_DEF).build();
    assertEquals(ImmutableList.of(BOOL_DEF), ConfigurationDiff.between(Configuration.EMPTY, c).getAdded());
    assertTrue(ConfigurationDiff.between(Configuration.EMPTY, c).getRemoved().isEmpty());
  }
}
