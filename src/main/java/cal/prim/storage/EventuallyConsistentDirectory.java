package cal.prim.storage;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.NoSuchFileException;
import java.util.stream.Stream;

/**
 * An eventually consistent directory.  Often called an "object store", implementations of this
 * interface associate short string names with byte arrays.  To avoid confusion with the Java
 * term "Object", this interface has the name "directory" instead of "object store".
 *
 * <p>Writes may take some time to become visible: a {@link #list()} or {@link #open(String)}
 * that immediately follows a {@link #createOrReplace(String, InputStream)} may not see it.
 * Every write does eventually become visible.  Clients that only ever create an entry once,
 * with contents that never change afterwards, can treat a missing entry as "not yet" and try
 * again later.  The record relay works this way: every record lives in its own entry, named
 * after the record, and entries are never rewritten.
 *
 * <p>Names are listed in ascending lexicographic (UTF-16 code unit) order.  Object stores such
 * as S3 list keys in this order natively, and the relay relies on it for pagination.
 */
public interface EventuallyConsistentDirectory {

  /**
   * List the entries in the directory, in ascending lexicographic order.  The list includes all
   * settled writes and may include any subset of pending ones.
   *
   * <p>Because the list may be streamed from external storage, it may throw runtime exceptions
   * during iteration.
   *
   * @return a stream of entry names
   * @throws IOException if the external storage could not be reached
   */
  Stream<String> list() throws IOException;

  /**
   * List the entries whose names sort strictly after <code>startAfter</code>.  Implementations
   * backed by a remote store should override this to avoid listing the whole directory.
   *
   * @param startAfter an exclusive lower bound for the names
   * @return a stream of entry names, in ascending order
   * @throws IOException if the external storage could not be reached
   */
  default Stream<String> listAfter(String startAfter) throws IOException {
    return list().filter(name -> name.compareTo(startAfter) > 0);
  }

  /**
   * Create an entry, or replace its contents.
   *
   * @param name the name of the entry
   * @param stream the data to write
   * @throws IOException if the outcome of the write cannot be determined, or if the given
   *   <code>stream</code> throws an <code>IOException</code> while reading
   */
  void createOrReplace(String name, InputStream stream) throws IOException;

  /**
   * Open an entry for reading.
   *
   * @param name the entry to read
   * @return an unbuffered stream to read from
   * @throws NoSuchFileException if the entry does not exist (or is not visible yet)
   * @throws IOException if the stream cannot be opened
   */
  InputStream open(String name) throws IOException;

}
