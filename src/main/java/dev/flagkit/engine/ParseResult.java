package dev.flagkit.engine;

import java.util.Objects;
import java.util.function.Function;

/**
 * The outcome of parsing untrusted input: either a value or a {@link ParseError}.
 *
 * @param <T> the type of the parsed value
 */
public abstract class ParseResult<T> {
  private ParseResult() {}

  /**
   * Creates a successful result.
   *
   * @param <T> the value type
   * @param value the parsed value
   * @return a result
   */
  public static <T> ParseResult<T> success(T value) {
    return new Success<>(Objects.requireNonNull(value));
  }

  /**
   * Creates a failed result.
   *
   * @param <T> the value type
   * @param error the error
   * @return a result
   */
  public static <T> ParseResult<T> failure(ParseError error) {
    return new Failure<>(Objects.requireNonNull(error));
  }

  /**
   * @return true if this is a success
   */
  public abstract boolean isSuccess();

  /**
   * Returns the parsed value.
   *
   * @return the value
   * @throws IllegalStateException if this is a failure
   */
  public abstract T getValue();

  /**
   * Returns the error.
   *
   * @return the error, or null if this is a success
   */
  public abstract ParseError getError();

  /**
   * Transforms the value of a successful result; failures are passed through unchanged.
   *
   * @param <U> the new value type
   * @param fn the transformation
   * @return a new result
   */
  public abstract <U> ParseResult<U> map(Function<? super T, ? extends U> fn);

  /**
   * Chains another parse step onto a successful result; failures are passed through unchanged.
   *
   * @param <U> the new value type
   * @param fn the next step
   * @return the result of the next step, or this failure
   */
  public abstract <U> ParseResult<U> flatMap(Function<? super T, ParseResult<U>> fn);

  /**
   * Returns the value, or a fallback if this is a failure.
   *
   * @param fallback the value to use on failure
   * @return the value or the fallback
   */
  public T orElse(T fallback) {
    return isSuccess() ? getValue() : fallback;
  }

  /**
   * A successful result.
   *
   * @param <T> the value type
   */
  public static final class Success<T> extends ParseResult<T> {
    private final T value;

    private Success(T value) {
      this.value = value;
    }

    @Override
    public boolean isSuccess() {
      return true;
    }

    @Override
    public T getValue() {
      return value;
    }

    @Override
    public ParseError getError() {
      return null;
    }

    @Override
    public <U> ParseResult<U> map(Function<? super T, ? extends U> fn) {
      return success(fn.apply(value));
    }

    @Override
    public <U> ParseResult<U> flatMap(Function<? super T, ParseResult<U>> fn) {
      return fn.apply(value);
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Success && value.equals(((Success<?>)other).value);
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public String toString() {
      return "Success(" + value + ")";
    }
  }

  /**
   * A failed result.
   *
   * @param <T> the value type
   */
  public static final class Failure<T> extends ParseResult<T> {
    private final ParseError error;

    private Failure(ParseError error) {
      this.error = error;
    }

    @Override
    public boolean isSuccess() {
      return false;
    }

    @Override
    public T getValue() {
      throw new IllegalStateException("no value present: " + error);
    }

    @Override
    public ParseError getError() {
      return error;
    }

    @Override
    public <U> ParseResult<U> map(Function<? super T, ? extends U> fn) {
      return failure(error);
    }

    @Override
    public <U> ParseResult<U> flatMap(Function<? super T, ParseResult<U>> fn) {
      return failure(error);
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Failure && error.equals(((Failure<?>)other).error);
    }

    @Override
    public int hashCode() {
      return error.hashCode();
    }

    @Override
    public String toString() {
      return "Failure(" + error + ")";
    }
  }
}
