package cal.recsync.impls;

import cal.prim.NoValue;
import cal.prim.PreconditionFailed;
import cal.recsync.crypto.DecryptionFailed;
import cal.recsync.crypto.EncryptedData;
import cal.recsync.crypto.MasterKey;
import cal.recsync.crypto.RecordEncryption;
import cal.recsync.types.Record;
import cal.recsync.types.RecordStore;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.util.List;

/**
 * Moves every record in a local store from one master key to another.  Only
 * the wrapped content keys change; ciphertexts stay as they are.
 *
 * <p>Records already wrapped by the new key are skipped, so a rotation that
 * was interrupted can simply be run again.  Copies of the records on the
 * relay keep their old wrapped keys.
 */
public class KeyRotation {

  private static final int PAGE_SIZE = 100;

  private final RecordStore store;
  private final RecordEncryption encryption;

  public KeyRotation(RecordStore store, RecordEncryption encryption) {
    this.store = store;
    this.encryption = encryption;
  }

  /**
   * @return the number of records that were re-wrapped
   * @throws DecryptionFailed if a record is wrapped by neither key
   */
  public long rotate(MasterKey oldKey, MasterKey newKey) throws IOException, DecryptionFailed {
    long rewrapped = 0;
    @Nullable String afterId = null;
    while (true) {
      List<Record<EncryptedData>> page = store.scan(afterId, PAGE_SIZE);
      if (page.isEmpty()) {
        break;
      }
      for (var record : page) {
        if (rewrap(record, oldKey, newKey)) {
          ++rewrapped;
        }
      }
      afterId = page.get(page.size() - 1).id();
      System.out.println("Re-wrapped " + rewrapped + " records so far...");
    }
    return rewrapped;
  }

  private boolean rewrap(Record<EncryptedData> record, MasterKey oldKey, MasterKey newKey) throws IOException, DecryptionFailed {
    if (encryption.isWrappedBy(record.data(), newKey)) {
      return false;
    }
    Record<EncryptedData> replacement = Record.reEncrypt(record, encryption, oldKey, newKey);
    try {
      store.rewrap(record.id(), record.data(), replacement.data());
      return true;
    } catch (NoValue e) {
      throw new IOException("record " + record.id() + " disappeared during key rotation", e);
    } catch (PreconditionFailed e) {
      // A concurrent rotation may have got there first.
      Record<EncryptedData> current = get(record.id());
      if (encryption.isWrappedBy(current.data(), newKey)) {
        return false;
      }
      throw new IOException("record " + record.id() + " changed during key rotation", e);
    }
  }

  private Record<EncryptedData> get(String id) throws IOException {
    try {
      return store.get(id);
    } catch (NoValue e) {
      throw new IOException("record " + id + " disappeared during key rotation", e);
    }
  }

}
