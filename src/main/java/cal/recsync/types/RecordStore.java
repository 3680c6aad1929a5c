package cal.recsync.types;

import cal.prim.NoValue;
import cal.prim.PreconditionFailed;
import cal.recsync.crypto.EncryptedData;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Durable storage for encrypted records.  The store holds every chain this
 * host knows about: its own, and the ones it has downloaded from other hosts.
 *
 * <p>A chain is the set of records with one (host, tag) pair.  The store does
 * not check that the records of a chain form a line.  Two writers that both
 * read the same tail and then {@link #push(Record) push} will fork the chain.
 * Writers that may race should use {@link #pushIfTail(Record)}, which refuses
 * to append to anything but the current tail.
 *
 * <p>All implementations are thread-safe.  Failures of the backing storage
 * are reported as {@link IOException}.
 */
public interface RecordStore {

  /**
   * Count the records in one chain.
   */
  long len(HostId host, String tag) throws IOException;

  /**
   * Get the tail (newest record) of a chain: the record that no other record
   * of the chain names as its parent.  If the chain has forked there are
   * several; the one with the latest timestamp wins.
   *
   * @throws NoValue if the chain is empty
   */
  Record<EncryptedData> last(HostId host, String tag) throws IOException, NoValue;

  /**
   * @throws NoValue if no record has the given id
   */
  Record<EncryptedData> get(String id) throws IOException, NoValue;

  /**
   * Append a record.  The caller is responsible for setting its parent to the
   * current tail of its chain.
   *
   * @throws IllegalArgumentException if a record with the same id already exists
   */
  void push(Record<EncryptedData> record) throws IOException;

  /**
   * Append a record if and only if its parent is the current tail of its
   * chain, or it has no parent and the chain is empty.  The check and the
   * append happen atomically.
   *
   * @throws PreconditionFailed if the chain's tail is not the record's parent;
   *   nothing is stored in that case
   * @throws IllegalArgumentException if a record with the same id already exists
   */
  void pushIfTail(Record<EncryptedData> record) throws IOException, PreconditionFailed;

  /**
   * Count every record in the store, across all chains.
   */
  long count() throws IOException;

  /**
   * @return every host that has at least one record in this store, in order
   */
  List<HostId> hosts() throws IOException;

  /**
   * Get up to <code>limit</code> records that sort strictly before the cursor
   * <code>(cursor, cursorId)</code>, newest first.  Records are ordered by
   * timestamp and then by id, so records with equal timestamps still have a
   * definite place in the order and a caller paging through them never
   * skips one.
   *
   * @param cursor the timestamp of the cursor
   * @param cursorId the id of the cursor, or null for a cursor that sorts
   *   before every record with timestamp <code>cursor</code>
   */
  List<Record<EncryptedData>> before(Instant cursor, @Nullable String cursorId, int limit) throws IOException;

  /**
   * Store records that came from elsewhere.  Records whose ids are already
   * present are skipped, which makes re-delivery harmless.
   *
   * @return the number of records that were new
   */
  int saveBulk(Collection<Record<EncryptedData>> records) throws IOException;

  /**
   * Get up to <code>limit</code> records in ascending id order, starting
   * after the given id.
   *
   * @param afterId an exclusive lower bound, or null to start from the beginning
   */
  List<Record<EncryptedData>> scan(@Nullable String afterId, int limit) throws IOException;

  /**
   * Replace the wrapped content key of a record.  This is the only change a
   * stored record may undergo, and it exists for master key rotation.
   *
   * @param id the record to change
   * @param expected the encrypted data the record currently holds
   * @param replacement the new encrypted data; it must carry the same
   *   ciphertext token as <code>expected</code>
   * @throws NoValue if no record has the given id
   * @throws PreconditionFailed if the record does not currently hold <code>expected</code>
   * @throws IllegalArgumentException if the tokens differ
   */
  void rewrap(String id, EncryptedData expected, EncryptedData replacement) throws IOException, NoValue, PreconditionFailed;

}
