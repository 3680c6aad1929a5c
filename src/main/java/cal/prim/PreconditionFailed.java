package cal.prim;

/**
 * A compare-and-swap operation observed a value other than the one the caller
 * expected, and did nothing.
 */
public class PreconditionFailed extends Exception {
  public PreconditionFailed(String message) {
    super(message);
  }

  public PreconditionFailed(String message, Throwable cause) {
    super(message, cause);
  }
}
