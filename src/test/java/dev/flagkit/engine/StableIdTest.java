package dev.flagkit.engine;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;

@SuppressWarnings("javadoc")
public class StableIdTest {
  @Test
  public void rawIdIsLowercasedAndHexEncoded() {
    assertEquals("757365722d31", StableId.of("User-1").getHexId());
  }

  @Test
  public void caseDoesNotChangeIdentity() {
    assertEquals(StableId.of("ABC"), StableId.of("abc"));
  }

  @Test
  public void fromHexNormalizesCase() {
    assertEquals(StableId.fromHex("757365722d31"), StableId.fromHex("757365722D31"));
    assertEquals(StableId.of("user-1"), StableId.fromHex("757365722D31"));
  }

  @Test
  public void differentUsersAreDifferent() {
    assertNotEquals(StableId.of("user-1"), StableId.of("user-2"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void blankRawIdIsRejected() {
    StableId.of("  ");
  }

  @Test(expected = IllegalArgumentException.class)
  public void nonHexIsRejected() {
    StableId.fromHex("xyz");
  }

  @Test
  public void parseHexReportsInvalidHexKind() {
    ParseResult<StableId> result = StableId.parseHex("12g4");
    assertFalse(result.isSuccess());
    assertEquals(ParseError.Kind.INVALID_HEX_ID, result.getError().getKind());
  }

  @Test
  public void parseHexRejectsNonAsciiDigits() {
    // Arabic-Indic digit one
    assertFalse(StableId.parseHex("١٢").isSuccess());
  }

  @Test
  public void parseHexRejectsEmpty() {
    assertFalse(StableId.parseHex("").isSuccess());
  }
}
