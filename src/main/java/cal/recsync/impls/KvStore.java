package cal.recsync.impls;

import cal.prim.MalformedDataException;
import cal.prim.NoValue;
import cal.prim.PreconditionFailed;
import cal.prim.time.UnreliableWallClock;
import cal.recsync.crypto.DecryptedData;
import cal.recsync.crypto.DecryptionFailed;
import cal.recsync.crypto.EncryptedData;
import cal.recsync.crypto.MasterKey;
import cal.recsync.crypto.RecordEncryption;
import cal.recsync.types.HostId;
import cal.recsync.types.KvRecord;
import cal.recsync.types.Record;
import cal.recsync.types.RecordStore;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * A key-value map stored as this host's "kv" chain.  Setting a key appends a
 * record; getting a key walks the chain from newest to oldest until it finds
 * that key.
 *
 * <p>Lookups are linear in the length of the chain.  An index of the latest
 * record per key would make them constant-time.
 */
public class KvStore {

  private static final int MAX_APPEND_ATTEMPTS = 5;

  private final RecordStore store;
  private final RecordEncryption encryption;
  private final MasterKey key;
  private final HostId host;
  private final UnreliableWallClock clock;

  public KvStore(RecordStore store, RecordEncryption encryption, MasterKey key, HostId host, UnreliableWallClock clock) {
    this.store = store;
    this.encryption = encryption;
    this.key = key;
    this.host = host;
    this.clock = clock;
  }

  /**
   * Set a key.  The new record is appended to the tail of this host's chain.
   * If another writer appends first, the tail is re-read and the append is
   * retried a few times.
   *
   * @return the stored record
   * @throws PreconditionFailed if other writers kept winning the race for the tail
   */
  public Record<EncryptedData> set(String k, String value) throws IOException, PreconditionFailed {
    DecryptedData payload = new DecryptedData(new KvRecord(k, value).serialize());
    @Nullable PreconditionFailed lastFailure = null;
    for (int attempt = 0; attempt < MAX_APPEND_ATTEMPTS; ++attempt) {
      Record<DecryptedData> record = Record.create(host, KvRecord.TAG, KvRecord.VERSION, currentTail(), clock, payload);
      Record<EncryptedData> encrypted = Record.encrypt(record, encryption, key);
      try {
        store.pushIfTail(encrypted);
        return encrypted;
      } catch (PreconditionFailed e) {
        lastFailure = e;
      }
    }
    throw new PreconditionFailed("could not append to " + host + '/' + KvRecord.TAG + " after " + MAX_APPEND_ATTEMPTS + " attempts", lastFailure);
  }

  private @Nullable String currentTail() throws IOException {
    try {
      return store.last(host, KvRecord.TAG).id();
    } catch (NoValue e) {
      return null;
    }
  }

  /**
   * Get the latest value of a key.
   *
   * @return the value, or empty if the key was never set
   * @throws DecryptionFailed if a record in the chain does not decrypt with this store's key
   * @throws MalformedDataException if a record does not decode, or the chain is broken
   */
  public Optional<String> get(String k) throws IOException, DecryptionFailed, MalformedDataException {
    Record<EncryptedData> current;
    try {
      current = store.last(host, KvRecord.TAG);
    } catch (NoValue e) {
      return Optional.empty();
    }

    Set<String> seen = new HashSet<>();
    while (true) {
      if (!seen.add(current.id())) {
        throw new MalformedDataException("kv chain of " + host + " loops at " + current.id());
      }
      if (!KvRecord.VERSION.equals(current.version())) {
        throw new MalformedDataException("record " + current.id() + " has unsupported kv version " + current.version());
      }

      KvRecord kv = KvRecord.deserialize(Record.decrypt(current, encryption, key).data().bytes());
      if (kv.key().equals(k)) {
        return Optional.of(kv.value());
      }

      String parent = current.parent();
      if (parent == null) {
        return Optional.empty();
      }
      try {
        current = store.get(parent);
      } catch (NoValue e) {
        throw new MalformedDataException("kv chain of " + host + " is broken: record " + current.id() + " names missing parent " + parent, e);
      }
    }
  }

}
