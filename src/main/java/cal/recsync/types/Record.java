package cal.recsync.types;

import cal.prim.time.UnreliableWallClock;
import cal.recsync.crypto.AdditionalData;
import cal.recsync.crypto.DecryptedData;
import cal.recsync.crypto.DecryptionFailed;
import cal.recsync.crypto.EncryptedData;
import cal.recsync.crypto.MasterKey;
import cal.recsync.crypto.RecordEncryption;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One entry in a chain.  Records are immutable: a host never edits a record
 * it has written, it appends a new one instead.
 *
 * <p>The records a host writes under one tag form a chain, linked from newest
 * to oldest through {@link #parent()}.  The oldest record has no parent.
 * Timestamps are for display and sync cursors only; the parent links are what
 * define the order of a chain.
 *
 * @param id a globally unique id, assigned at creation
 * @param host the host that created the record
 * @param parent the id of the previous record in the same (host, tag) chain,
 *   or null for the first record of the chain
 * @param tag the kind of data the record carries, e.g. "kv" or "history"
 * @param version the schema version of the payload encoding
 * @param timestamp the creation time
 * @param data the payload: {@link DecryptedData} in memory, {@link EncryptedData}
 *   at rest and on the wire
 * @param <D> the payload representation
 */
public record Record<D>(
    String id,
    HostId host,
    @Nullable String parent,
    String tag,
    String version,
    Instant timestamp,
    D data) {

  private static final SecureRandom ID_RANDOM = new SecureRandom();

  public Record {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(host, "host");
    Objects.requireNonNull(tag, "tag");
    Objects.requireNonNull(version, "version");
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(data, "data");
    if (id.equals(parent)) {
      throw new IllegalArgumentException("record " + id + " cannot be its own parent");
    }
  }

  /**
   * Create a brand-new record with a fresh id, stamped with the current time.
   */
  public static <D> Record<D> create(HostId host, String tag, String version, @Nullable String parent, UnreliableWallClock clock, D data) {
    Instant now = clock.now();
    return new Record<>(newId(now), host, parent, tag, version, now, data);
  }

  /**
   * Generate a time-ordered UUID (the version 7 layout): 48 bits of
   * milliseconds since the epoch, then version and variant bits, then random
   * bits.  Ids created later usually sort later, which keeps database indexes
   * compact.
   */
  static String newId(Instant now) {
    long millis = now.toEpochMilli();
    long randA = ID_RANDOM.nextInt(1 << 12);
    long randB = ID_RANDOM.nextLong();
    long msb = (millis << 16) | (0x7L << 12) | randA;
    long lsb = (randB & 0x3FFFFFFFFFFFFFFFL) | 0x8000000000000000L;
    return new UUID(msb, lsb).toString();
  }

  /**
   * Compare this record's position in (timestamp, id) order against a sync
   * cursor.  A null <code>cursorId</code> sorts before every id.
   *
   * @return negative, zero, or positive as this record sorts before, at, or
   *   after the cursor
   */
  public int compareToCursor(Instant cursor, @Nullable String cursorId) {
    int byTime = timestamp.compareTo(cursor);
    if (byTime != 0) {
      return byTime;
    }
    return cursorId == null ? 1 : id.compareTo(cursorId);
  }

  public AdditionalData additionalData() {
    return new AdditionalData(id, version, tag, host.value());
  }

  public <E> Record<E> withData(E newData) {
    return new Record<>(id, host, parent, tag, version, timestamp, newData);
  }

  public static Record<EncryptedData> encrypt(Record<DecryptedData> record, RecordEncryption encryption, MasterKey key) {
    return record.withData(encryption.encrypt(record.data(), record.additionalData(), key));
  }

  public static Record<DecryptedData> decrypt(Record<EncryptedData> record, RecordEncryption encryption, MasterKey key) throws DecryptionFailed {
    return record.withData(encryption.decrypt(record.data(), record.additionalData(), key));
  }

  public static Record<EncryptedData> reEncrypt(Record<EncryptedData> record, RecordEncryption encryption, MasterKey oldKey, MasterKey newKey) throws DecryptionFailed {
    return record.withData(encryption.reEncrypt(record.data(), record.additionalData(), oldKey, newKey));
  }

}
