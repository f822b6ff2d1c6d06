package dev.flagkit.engine;

import java.util.Objects;

import javax.annotation.Nullable;

/**
 * Describes why some untrusted input could not be turned into a model object.
 * <p>
 * Parse errors are returned inside a {@link ParseResult} rather than thrown, so that a caller loading
 * remote configuration is forced to deal with them and can keep its last known good configuration.
 */
public final class ParseError {
  /**
   * The category of a parse error.
   */
  public enum Kind {
    /** The input was not syntactically valid JSON, or had the wrong JSON type somewhere. */
    INVALID_JSON,
    /** The input was valid JSON but did not describe a usable snapshot. */
    INVALID_SNAPSHOT,
    /** A flag key did not correspond to any feature declared in the namespace. */
    FEATURE_NOT_FOUND,
    /** A version string or version object was malformed. */
    INVALID_VERSION,
    /** A rollout percentage was outside of [0, 100]. */
    INVALID_ROLLOUT,
    /** A stable identifier was not valid hexadecimal. */
    INVALID_HEX_ID,
    /** A flag value did not have the type declared by its feature. */
    TYPE_MISMATCH
  }

  private final Kind kind;
  private final String message;
  private final String path;

  private ParseError(Kind kind, String message, String path) {
    this.kind = kind;
    this.message = message;
    this.path = path;
  }

  /**
   * Creates an error.
   *
   * @param kind the error category
   * @param message a description of what was expected
   * @return an error
   */
  public static ParseError of(Kind kind, String message) {
    return new ParseError(kind, message, null);
  }

  /**
   * Creates an error that refers to a specific location in the input.
   *
   * @param kind the error category
   * @param message a description of what was expected
   * @param path the JSON path of the offending field, or null
   * @return an error
   */
  public static ParseError at(Kind kind, String message, @Nullable String path) {
    return new ParseError(kind, message, path);
  }

  /**
   * Returns a copy of this error whose message is prefixed with some context, such as a namespace id.
   *
   * @param context the text to prepend
   * @return a new error
   */
  public ParseError withContext(String context) {
    return new ParseError(kind, context + ": " + message, path);
  }

  /**
   * @return the error category
   */
  public Kind getKind() {
    return kind;
  }

  /**
   * @return a description of the problem
   */
  public String getMessage() {
    return message;
  }

  /**
   * @return the JSON path of the offending field, or null if not applicable
   */
  @Nullable
  public String getPath() {
    return path;
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof ParseError) {
      ParseError o = (ParseError)other;
      return kind == o.kind && message.equals(o.message) && Objects.equals(path, o.path);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, message, path);
  }

  @Override
  public String toString() {
    return kind + "(" + message + (path == null ? "" : (" at " + path)) + ")";
  }
}
