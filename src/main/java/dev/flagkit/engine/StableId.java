package dev.flagkit.engine;

import org.apache.commons.codec.binary.Hex;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * A persistent per-user or per-device identifier used as the input to rollout bucketing and
 * allowlists. Its canonical form is lowercase hexadecimal.
 */
public final class StableId {
  private final String hexId;

  private StableId(String hexId) {
    this.hexId = hexId;
  }

  /**
   * Creates a stable identifier from an application-supplied string such as a user id. The input is
   * lowercased and its UTF-8 bytes are hex-encoded, so {@code "User-1"} and {@code "user-1"} are the
   * same identifier.
   *
   * @param raw the application identifier
   * @return a stable identifier
   * @throws IllegalArgumentException if the input is null or blank
   */
  public static StableId of(String raw) {
    if (raw == null || raw.trim().isEmpty()) {
      throw new IllegalArgumentException("stable id must not be blank");
    }
    byte[] bytes = raw.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8);
    return new StableId(Hex.encodeHexString(bytes));
  }

  /**
   * Creates a stable identifier from its canonical hex form. Uppercase digits are accepted and
   * normalized to lowercase.
   *
   * @param hex a hexadecimal string
   * @return a stable identifier
   * @throws IllegalArgumentException if the string is empty or not hexadecimal
   */
  public static StableId fromHex(String hex) {
    ParseResult<StableId> result = parseHex(hex);
    if (!result.isSuccess()) {
      throw new IllegalArgumentException(result.getError().getMessage());
    }
    return result.getValue();
  }

  /**
   * Parses a hex identifier from untrusted input.
   *
   * @param hex a hexadecimal string
   * @return the identifier, or an {@link ParseError.Kind#INVALID_HEX_ID} failure
   */
  public static ParseResult<StableId> parseHex(String hex) {
    if (hex == null || hex.isEmpty()) {
      return ParseResult.failure(ParseError.of(ParseError.Kind.INVALID_HEX_ID, "hex id is empty"));
    }
    for (int i = 0; i < hex.length(); i++) {
      char ch = hex.charAt(i);
      if (!((ch >= '0' && ch <= '9') || (ch >= 'a' && ch <= 'f') || (ch >= 'A' && ch <= 'F'))) {
        return ParseResult.failure(ParseError.of(ParseError.Kind.INVALID_HEX_ID,
            "\"" + hex + "\" is not a hexadecimal string"));
      }
    }
    return ParseResult.success(new StableId(hex.toLowerCase(Locale.ROOT)));
  }

  /**
   * @return the canonical lowercase hex form
   */
  public String getHexId() {
    return hexId;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof StableId && hexId.equals(((StableId)other).hexId);
  }

  @Override
  public int hashCode() {
    return hexId.hashCode();
  }

  @Override
  public String toString() {
    return "StableId(" + hexId + ")";
  }
}
