package cal.recsync.types;

import cal.recsync.crypto.EncryptedData;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

/**
 * The untrusted relay that hosts exchange records through.  The relay only
 * ever sees encrypted records.  Transport failures are {@link IOException}s.
 */
public interface RelayClient {

  /**
   * Count the records the relay holds.
   */
  long count() throws IOException;

  /**
   * Fetch one page of records that sort strictly after the cursor
   * <code>(after, afterId)</code>, oldest first.  Records are ordered by
   * timestamp and then by id.  Relays may also leave out records they
   * received before <code>lastSync</code>, since the caller saw those on an
   * earlier sync.  An empty page means the relay has nothing more to offer.
   *
   * @param afterId the id of the cursor, or null for a cursor that sorts
   *   before every record with timestamp <code>after</code>
   */
  List<Record<EncryptedData>> fetchPage(Instant lastSync, Instant after, @Nullable String afterId) throws IOException;

  /**
   * Upload a batch of records.  Posting a record whose id the relay already
   * holds has no effect, so a partially-failed batch can simply be posted
   * again.
   */
  void postBatch(List<Record<EncryptedData>> batch) throws IOException;

}
