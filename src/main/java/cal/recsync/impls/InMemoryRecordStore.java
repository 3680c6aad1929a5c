package cal.recsync.impls;

import cal.prim.NoValue;
import cal.prim.PreconditionFailed;
import cal.recsync.crypto.EncryptedData;
import cal.recsync.types.HostId;
import cal.recsync.types.Record;
import cal.recsync.types.RecordStore;
import cal.recsync.types.SyncCheckpoint;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A record store that lives entirely in memory.  Mainly useful for tests.
 */
public class InMemoryRecordStore implements RecordStore, SyncCheckpoint {

  private static final Comparator<Record<EncryptedData>> NEWEST_LAST =
          Comparator.comparing((Record<EncryptedData> r) -> r.timestamp()).thenComparing(r -> r.id());

  private final Map<String, Record<EncryptedData>> records = new HashMap<>();
  private Instant lastSync = Instant.EPOCH;

  private List<Record<EncryptedData>> chain(HostId host, String tag) {
    return records.values().stream()
            .filter(r -> r.host().equals(host) && r.tag().equals(tag))
            .collect(Collectors.toList());
  }

  private @Nullable Record<EncryptedData> tail(HostId host, String tag) {
    List<Record<EncryptedData>> chain = chain(host, tag);
    Set<String> parents = new HashSet<>();
    for (var r : chain) {
      if (r.parent() != null) {
        parents.add(r.parent());
      }
    }
    return chain.stream()
            .filter(r -> !parents.contains(r.id()))
            .max(NEWEST_LAST)
            .orElse(null);
  }

  @Override
  public synchronized long len(HostId host, String tag) {
    return chain(host, tag).size();
  }

  @Override
  public synchronized Record<EncryptedData> last(HostId host, String tag) throws NoValue {
    Record<EncryptedData> tail = tail(host, tag);
    if (tail == null) {
      throw new NoValue("no records for " + host + '/' + tag);
    }
    return tail;
  }

  @Override
  public synchronized Record<EncryptedData> get(String id) throws NoValue {
    Record<EncryptedData> r = records.get(id);
    if (r == null) {
      throw new NoValue("no record " + id);
    }
    return r;
  }

  @Override
  public synchronized void push(Record<EncryptedData> record) {
    if (records.containsKey(record.id())) {
      throw new IllegalArgumentException("record " + record.id() + " already exists");
    }
    records.put(record.id(), record);
  }

  @Override
  public synchronized void pushIfTail(Record<EncryptedData> record) throws PreconditionFailed {
    Record<EncryptedData> tail = tail(record.host(), record.tag());
    String tailId = tail == null ? null : tail.id();
    if (!Objects.equals(tailId, record.parent())) {
      throw new PreconditionFailed("expected tail " + record.parent() + " but tail is currently " + tailId);
    }
    push(record);
  }

  @Override
  public synchronized long count() {
    return records.size();
  }

  @Override
  public synchronized List<HostId> hosts() {
    return records.values().stream()
            .map(Record::host)
            .distinct()
            .sorted(Comparator.comparing(HostId::value))
            .collect(Collectors.toList());
  }

  @Override
  public synchronized List<Record<EncryptedData>> before(Instant cursor, @Nullable String cursorId, int limit) {
    return records.values().stream()
            .filter(r -> r.compareToCursor(cursor, cursorId) < 0)
            .sorted(NEWEST_LAST.reversed())
            .limit(limit)
            .collect(Collectors.toList());
  }

  @Override
  public synchronized int saveBulk(Collection<Record<EncryptedData>> batch) {
    int added = 0;
    for (var r : batch) {
      if (records.putIfAbsent(r.id(), r) == null) {
        ++added;
      }
    }
    return added;
  }

  @Override
  public synchronized List<Record<EncryptedData>> scan(@Nullable String afterId, int limit) {
    return records.values().stream()
            .filter(r -> afterId == null || r.id().compareTo(afterId) > 0)
            .sorted(Comparator.comparing((Record<EncryptedData> r) -> r.id()))
            .limit(limit)
            .collect(Collectors.toList());
  }

  @Override
  public synchronized void rewrap(String id, EncryptedData expected, EncryptedData replacement) throws NoValue, PreconditionFailed {
    if (!expected.data().equals(replacement.data())) {
      throw new IllegalArgumentException("rewrap may not change the ciphertext of " + id);
    }
    Record<EncryptedData> current = get(id);
    if (!current.data().equals(expected)) {
      throw new PreconditionFailed("record " + id + " changed concurrently");
    }
    records.put(id, current.withData(replacement));
  }

  @Override
  public synchronized Instant lastSync() {
    return lastSync;
  }

  @Override
  public synchronized void recordSync(Instant expected, Instant next) throws PreconditionFailed {
    if (!lastSync.equals(expected)) {
      throw new PreconditionFailed("expected last sync " + expected + " but it is currently " + lastSync);
    }
    lastSync = next;
  }

}
