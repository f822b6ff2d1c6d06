package dev.flagkit.engine;

import java.util.Objects;

/**
 * An application version made of three non-negative components, ordered component by component.
 */
public final class Version implements Comparable<Version> {
  /**
   * The lowest possible version, {@code 0.0.0}.
   */
  public static final Version MIN = new Version(0, 0, 0);

  private final int major;
  private final int minor;
  private final int patch;

  private Version(int major, int minor, int patch) {
    this.major = major;
    this.minor = minor;
    this.patch = patch;
  }

  /**
   * Creates a version.
   *
   * @param major the major component
   * @param minor the minor component
   * @param patch the patch component
   * @return a version
   * @throws IllegalArgumentException if any component is negative
   */
  public static Version of(int major, int minor, int patch) {
    if (major < 0 || minor < 0 || patch < 0) {
      throw new IllegalArgumentException("version components must be non-negative: "
          + major + "." + minor + "." + patch);
    }
    return new Version(major, minor, patch);
  }

  /**
   * Parses a dotted version string such as {@code "2.4.1"}. One to three components are accepted;
   * missing components are zero, so {@code "2"} is {@code 2.0.0}. Anything else, including negative
   * numbers, empty components and surrounding whitespace, is a failure.
   *
   * @param s the string to parse
   * @return the parsed version, or an {@link ParseError.Kind#INVALID_VERSION} failure
   */
  public static ParseResult<Version> parse(String s) {
    if (s == null || s.isEmpty()) {
      return ParseResult.failure(ParseError.of(ParseError.Kind.INVALID_VERSION, "version string is empty"));
    }
    String[] parts = s.split("\\.", -1);
    if (parts.length > 3) {
      return ParseResult.failure(ParseError.of(ParseError.Kind.INVALID_VERSION,
          "version \"" + s + "\" has more than three components"));
    }
    int[] values = new int[3];
    for (int i = 0; i < parts.length; i++) {
      String p = parts[i];
      if (p.isEmpty() || !isAllDigits(p)) {
        return ParseResult.failure(ParseError.of(ParseError.Kind.INVALID_VERSION,
            "version \"" + s + "\" has a non-numeric component \"" + p + "\""));
      }
      try {
        values[i] = Integer.parseInt(p);
      } catch (NumberFormatException e) {
        return ParseResult.failure(ParseError.of(ParseError.Kind.INVALID_VERSION,
            "version \"" + s + "\" has an out-of-range component \"" + p + "\""));
      }
    }
    return ParseResult.success(new Version(values[0], values[1], values[2]));
  }

  private static boolean isAllDigits(String s) {
    for (int i = 0; i < s.length(); i++) {
      char ch = s.charAt(i);
      if (ch < '0' || ch > '9') {
        return false;
      }
    }
    return true;
  }

  /**
   * @return the major component
   */
  public int getMajor() {
    return major;
  }

  /**
   * @return the minor component
   */
  public int getMinor() {
    return minor;
  }

  /**
   * @return the patch component
   */
  public int getPatch() {
    return patch;
  }

  @Override
  public int compareTo(Version other) {
    if (major != other.major) {
      return Integer.compare(major, other.major);
    }
    if (minor != other.minor) {
      return Integer.compare(minor, other.minor);
    }
    return Integer.compare(patch, other.patch);
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof Version) {
      Version o = (Version)other;
      return major == o.major && minor == o.minor && patch == o.patch;
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hash(major, minor, patch);
  }

  @Override
  public String toString() {
    return major + "." + minor + "." + patch;
  }
}
