package cal.recsync.impls;

import cal.prim.NoValue;
import cal.recsync.crypto.EncryptedData;
import cal.recsync.types.HostId;
import cal.recsync.types.Record;
import cal.recsync.types.RecordStore;

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

/**
 * Checks the structure of a chain without decrypting anything.
 */
public class ChainVerifier {

  private final RecordStore store;

  public ChainVerifier(RecordStore store) {
    this.store = store;
  }

  /**
   * Walk a chain from its tail to its first record.  The walk must visit
   * every record of the chain exactly once.  If it visits fewer, the chain
   * has forked or has records that no longer connect to the tail.
   *
   * @return the length of the chain
   * @throws ChainCorrupted on a cycle, a parent that is missing or belongs to
   *   another chain, or records the walk does not reach
   */
  public long verify(HostId host, String tag) throws IOException, ChainCorrupted {
    long expected = store.len(host, tag);

    Record<EncryptedData> current;
    try {
      current = store.last(host, tag);
    } catch (NoValue e) {
      if (expected != 0) {
        throw new ChainCorrupted(host, tag, "chain has " + expected + " records but no tail");
      }
      return 0;
    }

    Set<String> visited = new HashSet<>();
    while (true) {
      if (!current.host().equals(host) || !current.tag().equals(tag)) {
        throw new ChainCorrupted(host, tag, "record " + current.id() + " belongs to " + current.host() + '/' + current.tag());
      }
      if (!visited.add(current.id())) {
        throw new ChainCorrupted(host, tag, "cycle at record " + current.id());
      }
      String parent = current.parent();
      if (parent == null) {
        break;
      }
      try {
        current = store.get(parent);
      } catch (NoValue e) {
        throw new ChainCorrupted(host, tag, "record " + current.id() + " names missing parent " + parent);
      }
    }

    if (visited.size() != expected) {
      throw new ChainCorrupted(host, tag, "chain has " + expected + " records but only " + visited.size() + " are reachable from the tail");
    }
    return expected;
  }

}
