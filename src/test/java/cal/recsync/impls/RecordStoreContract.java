package cal.recsync.impls;

import cal.prim.NoValue;
import cal.prim.PreconditionFailed;
import cal.prim.time.UnreliableWallClock;
import cal.recsync.crypto.EncryptedData;
import cal.recsync.types.HostId;
import cal.recsync.types.Record;
import cal.recsync.types.RecordStore;
import cal.recsync.types.SyncCheckpoint;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Behavior every {@link RecordStore} must have.  Subclasses supply a fresh,
 * empty store for each test.
 */
public abstract class RecordStoreContract {

  protected static final HostId LAPTOP = new HostId("laptop");
  protected static final HostId DESKTOP = new HostId("desktop");

  private final UnreliableWallClock clock = UnreliableWallClock.ticking(Instant.parse("2023-11-14T12:00:00Z"), Duration.ofSeconds(1));

  private static final Instant FAR_FUTURE = Instant.parse("2100-01-01T00:00:00Z");

  protected abstract RecordStore newStore() throws Exception;

  /**
   * @return a fresh checkpoint, in its own empty store
   */
  protected abstract SyncCheckpoint newCheckpoint() throws Exception;

  protected Record<EncryptedData> record(HostId host, String tag, @Nullable String parent) {
    return Record.create(host, tag, "v0", parent, clock, new EncryptedData("token-" + tag, "footer"));
  }

  private static List<String> ids(List<Record<EncryptedData>> records) {
    return records.stream().map(Record::id).collect(Collectors.toList());
  }

  @Test
  public void testEmpty() throws Exception {
    RecordStore store = newStore();
    Assert.assertEquals(store.count(), 0L);
    Assert.assertEquals(store.len(LAPTOP, "kv"), 0L);
    Assert.expectThrows(NoValue.class, () -> store.last(LAPTOP, "kv"));
    Assert.expectThrows(NoValue.class, () -> store.get("nope"));
    Assert.assertEquals(store.before(FAR_FUTURE, null, 10), List.of());
    Assert.assertEquals(store.scan(null, 10), List.of());
    Assert.assertEquals(store.hosts(), List.of());
  }

  @Test
  public void testPushAndGet() throws Exception {
    RecordStore store = newStore();
    Record<EncryptedData> a = record(LAPTOP, "kv", null);
    store.push(a);
    Assert.assertEquals(store.get(a.id()), a);
    Assert.assertEquals(store.last(LAPTOP, "kv"), a);
    Assert.assertEquals(store.len(LAPTOP, "kv"), 1L);
    Assert.assertEquals(store.count(), 1L);
  }

  @Test
  public void testChainsAreSeparate() throws Exception {
    RecordStore store = newStore();
    Record<EncryptedData> a1 = record(LAPTOP, "kv", null);
    Record<EncryptedData> b1 = record(DESKTOP, "kv", null);
    Record<EncryptedData> a2 = record(LAPTOP, "kv", a1.id());
    Record<EncryptedData> h1 = record(LAPTOP, "history", null);
    store.push(a1);
    store.push(b1);
    store.push(a2);
    store.push(h1);

    Assert.assertEquals(store.last(LAPTOP, "kv"), a2);
    Assert.assertEquals(store.last(DESKTOP, "kv"), b1);
    Assert.assertEquals(store.last(LAPTOP, "history"), h1);
    Assert.assertEquals(store.len(LAPTOP, "kv"), 2L);
    Assert.assertEquals(store.count(), 4L);
    Assert.assertEquals(store.hosts(), List.of(DESKTOP, LAPTOP));
  }

  @Test
  public void testTailIsNotTheNewestTimestamp() throws Exception {
    RecordStore store = newStore();
    Record<EncryptedData> first = record(LAPTOP, "kv", null);
    Record<EncryptedData> second = record(LAPTOP, "kv", first.id());
    // The child carries an older timestamp than its parent (clock went backwards).
    Record<EncryptedData> child = new Record<>("child", LAPTOP, second.id(), "kv", "v0", Instant.EPOCH, second.data());
    store.push(first);
    store.push(second);
    store.push(child);
    Assert.assertEquals(store.last(LAPTOP, "kv").id(), "child");
  }

  @Test
  public void testForkPicksLatest() throws Exception {
    RecordStore store = newStore();
    Record<EncryptedData> root = record(LAPTOP, "kv", null);
    Record<EncryptedData> left = record(LAPTOP, "kv", root.id());
    Record<EncryptedData> right = record(LAPTOP, "kv", root.id());
    store.push(root);
    store.push(right);
    store.push(left);
    Assert.assertEquals(store.last(LAPTOP, "kv"), right);
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testDuplicatePush() throws Exception {
    RecordStore store = newStore();
    Record<EncryptedData> a = record(LAPTOP, "kv", null);
    store.push(a);
    store.push(a);
  }

  @Test
  public void testPushIfTail() throws Exception {
    RecordStore store = newStore();
    Record<EncryptedData> a = record(LAPTOP, "kv", null);
    store.pushIfTail(a);

    Record<EncryptedData> b = record(LAPTOP, "kv", a.id());
    Record<EncryptedData> stale = record(LAPTOP, "kv", a.id());
    store.pushIfTail(b);
    Assert.expectThrows(PreconditionFailed.class, () -> store.pushIfTail(stale));
    Assert.expectThrows(NoValue.class, () -> store.get(stale.id()));

    Record<EncryptedData> secondRoot = record(LAPTOP, "kv", null);
    Assert.expectThrows(PreconditionFailed.class, () -> store.pushIfTail(secondRoot));

    Assert.assertEquals(store.last(LAPTOP, "kv"), b);
    Assert.assertEquals(store.len(LAPTOP, "kv"), 2L);
  }

  @Test
  public void testBefore() throws Exception {
    RecordStore store = newStore();
    Record<EncryptedData> a = record(LAPTOP, "kv", null);
    Record<EncryptedData> b = record(DESKTOP, "kv", null);
    Record<EncryptedData> c = record(LAPTOP, "kv", a.id());
    store.saveBulk(List.of(a, b, c));

    Assert.assertEquals(ids(store.before(FAR_FUTURE, null, 10)), List.of(c.id(), b.id(), a.id()));
    Assert.assertEquals(ids(store.before(FAR_FUTURE, null, 2)), List.of(c.id(), b.id()));
    Assert.assertEquals(ids(store.before(c.timestamp(), null, 10)), List.of(b.id(), a.id()));
    Assert.assertEquals(ids(store.before(c.timestamp(), c.id(), 10)), List.of(b.id(), a.id()));
    Assert.assertEquals(ids(store.before(a.timestamp(), null, 10)), List.of());
  }

  @Test
  public void testBeforeBreaksTimestampTiesById() throws Exception {
    RecordStore store = newStore();
    Instant t = Instant.parse("2023-11-14T12:00:00Z");
    Record<EncryptedData> a = record(LAPTOP, "kv", null);
    Record<EncryptedData> b = record(DESKTOP, "kv", null);
    Record<EncryptedData> c = record(LAPTOP, "history", null);
    List<Record<EncryptedData>> sameTime = Stream.of(a, b, c)
            .map(r -> new Record<>(r.id(), r.host(), r.parent(), r.tag(), r.version(), t, r.data()))
            .sorted(Comparator.comparing((Record<EncryptedData> r) -> r.id()).reversed())
            .collect(Collectors.toList());
    store.saveBulk(sameTime);

    List<Record<EncryptedData>> firstPage = store.before(t.plusSeconds(1), null, 2);
    Assert.assertEquals(ids(firstPage), ids(sameTime.subList(0, 2)));
    Record<EncryptedData> end = firstPage.get(1);
    Assert.assertEquals(ids(store.before(end.timestamp(), end.id(), 2)), ids(sameTime.subList(2, 3)));
    Assert.assertEquals(store.before(t, null, 2), List.of());
  }

  @Test
  public void testSaveBulkIsIdempotent() throws Exception {
    RecordStore store = newStore();
    Record<EncryptedData> a = record(LAPTOP, "kv", null);
    Record<EncryptedData> b = record(DESKTOP, "kv", null);
    Assert.assertEquals(store.saveBulk(List.of(a)), 1);
    Assert.assertEquals(store.saveBulk(List.of(a, b)), 1);
    Assert.assertEquals(store.saveBulk(List.of(a, b)), 0);
    Assert.assertEquals(store.count(), 2L);
  }

  @Test
  public void testScan() throws Exception {
    RecordStore store = newStore();
    Record<EncryptedData> a = new Record<>("a", LAPTOP, null, "kv", "v0", Instant.EPOCH, new EncryptedData("t", "f"));
    Record<EncryptedData> b = new Record<>("b", DESKTOP, null, "kv", "v0", Instant.EPOCH, new EncryptedData("t", "f"));
    Record<EncryptedData> c = new Record<>("c", LAPTOP, "a", "kv", "v0", Instant.EPOCH, new EncryptedData("t", "f"));
    store.saveBulk(List.of(c, a, b));
    Assert.assertEquals(ids(store.scan(null, 2)), List.of("a", "b"));
    Assert.assertEquals(ids(store.scan("b", 2)), List.of("c"));
    Assert.assertEquals(ids(store.scan("c", 2)), List.of());
  }

  @Test
  public void testRewrap() throws Exception {
    RecordStore store = newStore();
    Record<EncryptedData> a = record(LAPTOP, "kv", null);
    store.push(a);

    EncryptedData replacement = new EncryptedData(a.data().data(), "new footer");
    store.rewrap(a.id(), a.data(), replacement);
    Assert.assertEquals(store.get(a.id()).data(), replacement);

    // the expected value is now stale
    Assert.expectThrows(PreconditionFailed.class, () -> store.rewrap(a.id(), a.data(), new EncryptedData(a.data().data(), "other")));
    Assert.expectThrows(IllegalArgumentException.class, () -> store.rewrap(a.id(), replacement, new EncryptedData("different", "x")));
    Assert.expectThrows(NoValue.class, () -> store.rewrap("nope", a.data(), replacement));
    Assert.assertEquals(store.get(a.id()).data(), replacement);
  }

  @Test
  public void testCheckpoint() throws Exception {
    SyncCheckpoint checkpoint = newCheckpoint();
    Instant t = Instant.parse("2023-11-14T12:00:00.123456789Z");
    Assert.assertEquals(checkpoint.lastSync(), Instant.EPOCH);
    checkpoint.recordSync(Instant.EPOCH, t);
    Assert.assertEquals(checkpoint.lastSync(), t);
    Assert.expectThrows(PreconditionFailed.class, () -> checkpoint.recordSync(Instant.EPOCH, t.plusSeconds(1)));
    Assert.assertEquals(checkpoint.lastSync(), t);
  }

}
