package dev.flagkit.engine;

import java.util.Objects;

/**
 * The canonical identity of a feature flag within a namespace.
 * <p>
 * A {@code FeatureId} is encoded as {@code feature::<namespaceSeed>::<key>}. Both the namespace seed
 * and the key must be non-blank and must not contain the {@code ::} separator. Instances are ordered
 * lexicographically by their encoded form.
 */
public final class FeatureId implements Comparable<FeatureId> {
  /**
   * The fixed domain tag that begins every encoded identifier.
   */
  public static final String PREFIX = "feature";

  /**
   * The separator between the parts of an encoded identifier.
   */
  public static final String SEPARATOR = "::";

  private final String namespaceSeed;
  private final String key;
  private final String encoded;

  private FeatureId(String namespaceSeed, String key) {
    this.namespaceSeed = namespaceSeed;
    this.key = key;
    this.encoded = PREFIX + SEPARATOR + namespaceSeed + SEPARATOR + key;
  }

  /**
   * Creates an identifier from its parts.
   *
   * @param namespaceSeed the identifier seed of the owning namespace
   * @param key the flag key
   * @return the identifier
   * @throws IllegalArgumentException if either part is blank or contains the separator
   */
  public static FeatureId of(String namespaceSeed, String key) {
    checkPart("namespace seed", namespaceSeed);
    checkPart("feature key", key);
    return new FeatureId(namespaceSeed, key);
  }

  /**
   * Parses an encoded identifier.
   *
   * @param encoded a string of the form {@code feature::<namespaceSeed>::<key>}
   * @return the identifier
   * @throws IllegalArgumentException if the string is not a well-formed identifier
   */
  public static FeatureId parse(String encoded) {
    if (encoded == null) {
      throw new IllegalArgumentException("feature id must not be null");
    }
    String[] parts = encoded.split(SEPARATOR, -1);
    if (parts.length != 3 || !PREFIX.equals(parts[0])) {
      throw new IllegalArgumentException("malformed feature id \"" + encoded
          + "\"; expected " + PREFIX + SEPARATOR + "<namespaceSeed>" + SEPARATOR + "<key>");
    }
    return of(parts[1], parts[2]);
  }

  private static void checkPart(String name, String value) {
    if (value == null || value.trim().isEmpty()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
    if (value.contains(SEPARATOR)) {
      throw new IllegalArgumentException(name + " \"" + value + "\" must not contain \"" + SEPARATOR + "\"");
    }
  }

  /**
   * Returns the namespace seed part.
   *
   * @return the namespace seed
   */
  public String getNamespaceSeed() {
    return namespaceSeed;
  }

  /**
   * Returns the flag key part. This is also the key used for bucketing.
   *
   * @return the flag key
   */
  public String getKey() {
    return key;
  }

  /**
   * Returns the canonical encoded form.
   *
   * @return the encoded identifier
   */
  public String encode() {
    return encoded;
  }

  @Override
  public int compareTo(FeatureId other) {
    return encoded.compareTo(other.encoded);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof FeatureId && encoded.equals(((FeatureId)other).encoded);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(encoded);
  }

  @Override
  public String toString() {
    return encoded;
  }
}
