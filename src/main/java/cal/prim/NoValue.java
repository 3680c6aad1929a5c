package cal.prim;

/**
 * An exception indicating that no value existed: an unknown record id, or an
 * empty chain.  This class is similar to {@link java.util.NoSuchElementException},
 * but is a checked exception instead of a runtime exception.
 */
public class NoValue extends Exception {
  public NoValue(String message) {
    super(message);
  }
}
