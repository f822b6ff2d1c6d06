package dev.flagkit.engine.subsystems;

/**
 * General exception class for all errors in serializing or deserializing JSON.
 * <p>
 * The engine uses this class to avoid depending on exception types from the underlying JSON framework
 * that it uses (currently Gson). It never escapes the public parsing methods, which report problems as
 * {@link dev.flagkit.engine.ParseResult} failures; it is only relevant when implementing custom components
 * that build on the internal serialization helpers.
 */
@SuppressWarnings("serial")
public class SerializationException extends RuntimeException {
  /**
   * Creates an instance.
   * @param cause the underlying exception
   */
  public SerializationException(Throwable cause) {
    super(cause);
  }

  /**
   * Creates an instance with a message.
   * @param message a description of the problem
   */
  public SerializationException(String message) {
    super(message);
  }
}
