package cal.prim;

/**
 * Serialized bytes or text could not be decoded into the expected shape.
 */
public class MalformedDataException extends Exception {
  public MalformedDataException(String message) {
    super(message);
  }

  public MalformedDataException(String message, Throwable cause) {
    super(message, cause);
  }
}
