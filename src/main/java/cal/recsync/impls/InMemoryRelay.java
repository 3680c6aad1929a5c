package cal.recsync.impls;

import cal.prim.time.UnreliableWallClock;
import cal.recsync.crypto.EncryptedData;
import cal.recsync.types.Record;
import cal.recsync.types.RelayClient;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A relay that lives in memory, for tests and for syncing two stores in one
 * process.
 */
public class InMemoryRelay implements RelayClient {

  private static final Comparator<Received> OLDEST_FIRST =
          Comparator.comparing((Received r) -> r.record.timestamp()).thenComparing(r -> r.record.id());

  private static class Received {
    final Record<EncryptedData> record;
    final Instant receivedAt;

    Received(Record<EncryptedData> record, Instant receivedAt) {
      this.record = record;
      this.receivedAt = receivedAt;
    }
  }

  private final Map<String, Received> records = new HashMap<>();
  private final UnreliableWallClock clock;
  private final int pageSize;

  public InMemoryRelay(UnreliableWallClock clock, int pageSize) {
    if (pageSize <= 0) {
      throw new IllegalArgumentException("page size must be positive, not " + pageSize);
    }
    this.clock = clock;
    this.pageSize = pageSize;
  }

  @Override
  public synchronized long count() {
    return records.size();
  }

  @Override
  public synchronized List<Record<EncryptedData>> fetchPage(Instant lastSync, Instant after, @Nullable String afterId) {
    return records.values().stream()
            .filter(r -> r.record.compareToCursor(after, afterId) > 0)
            .filter(r -> !r.receivedAt.isBefore(lastSync))
            .sorted(OLDEST_FIRST)
            .limit(pageSize)
            .map(r -> r.record)
            .collect(Collectors.toList());
  }

  @Override
  public synchronized void postBatch(List<Record<EncryptedData>> batch) {
    Instant now = clock.now();
    for (var record : batch) {
      records.putIfAbsent(record.id(), new Received(record, now));
    }
  }

  /**
   * @return every record the relay holds, oldest first
   */
  public synchronized List<Record<EncryptedData>> all() {
    List<Received> sorted = new ArrayList<>(records.values());
    sorted.sort(OLDEST_FIRST);
    return sorted.stream().map(r -> r.record).collect(Collectors.toList());
  }

}
