package cal.recsync.impls;

import cal.prim.storage.ConsistentInMemoryDir;
import cal.prim.storage.EventuallyConsistentDirectory;
import cal.prim.storage.LocalDirectory;
import cal.prim.time.UnreliableWallClock;
import cal.recsync.crypto.EncryptedData;
import cal.recsync.types.HostId;
import cal.recsync.types.Record;
import cal.recsync.types.SyncReport;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Test
public class DirectoryRelayTests {

  private final HostId host = new HostId("laptop");
  private final UnreliableWallClock clock = UnreliableWallClock.ticking(Instant.parse("2023-11-14T12:00:00Z"), Duration.ofSeconds(1));

  private Record<EncryptedData> record(Instant timestamp) {
    String id = Record.create(host, "kv", "v0", null, clock, "").id();
    return new Record<>(id, host, null, "kv", "v0", timestamp, new EncryptedData("rs1.local.token", "{\"key_id\":\"k\"}"));
  }

  private static List<String> ids(List<Record<EncryptedData>> records) {
    return records.stream().map(Record::id).collect(Collectors.toList());
  }

  @Test
  public void testEntryNamesSortByTimestamp() {
    Record<EncryptedData> early = record(Instant.ofEpochSecond(9));
    Record<EncryptedData> late = record(Instant.ofEpochSecond(10));
    Assert.assertEquals(DirectoryRelay.entryName(early), "00000000009000000000-" + early.id());
    Assert.assertTrue(DirectoryRelay.entryName(early).compareTo(DirectoryRelay.entryName(late)) < 0);
  }

  @Test
  public void testPostAndFetch() throws Exception {
    ConsistentInMemoryDir dir = new ConsistentInMemoryDir();
    DirectoryRelay relay = new DirectoryRelay(dir, clock, 2);
    Record<EncryptedData> a = record(Instant.ofEpochSecond(100));
    Record<EncryptedData> b = record(Instant.ofEpochSecond(200));
    Record<EncryptedData> c = record(Instant.ofEpochSecond(300));

    relay.postBatch(List.of(c, a, b));
    Assert.assertEquals(relay.count(), 3L);

    List<Record<EncryptedData>> first = relay.fetchPage(Instant.EPOCH, Instant.EPOCH, null);
    Assert.assertEquals(first, List.of(a, b));
    Assert.assertEquals(ids(relay.fetchPage(Instant.EPOCH, b.timestamp(), b.id())), List.of(c.id()));
    Assert.assertEquals(relay.fetchPage(Instant.EPOCH, c.timestamp(), c.id()), List.of());
    Assert.assertEquals(ids(relay.fetchPage(Instant.EPOCH, Instant.ofEpochSecond(150), null)), List.of(b.id(), c.id()));
    Assert.assertEquals(ids(relay.fetchPage(Instant.EPOCH, b.timestamp(), null)), List.of(b.id(), c.id()));
  }

  @Test
  public void testPageBoundaryInsideTimestampTie() throws Exception {
    ConsistentInMemoryDir dir = new ConsistentInMemoryDir();
    DirectoryRelay relay = new DirectoryRelay(dir, clock, 2);
    Record<EncryptedData> a = record(Instant.ofEpochSecond(100));
    Record<EncryptedData> b = record(Instant.ofEpochSecond(200));
    Record<EncryptedData> c = record(Instant.ofEpochSecond(200));
    relay.postBatch(List.of(a, b, c));

    // the first page ends between the two records stamped 200s
    InMemoryRecordStore dest = new InMemoryRecordStore();
    SyncReport report = new Syncer(dest, dest, relay, clock).sync();
    Assert.assertEquals(report.downloaded(), 3L);
    Assert.assertEquals(dest.count(), 3L);
    Assert.assertTrue(dest.lastSync().isAfter(Instant.EPOCH));
  }

  @Test
  public void testPostIsIdempotent() throws Exception {
    ConsistentInMemoryDir dir = new ConsistentInMemoryDir();
    DirectoryRelay relay = new DirectoryRelay(dir, clock, 10);
    Record<EncryptedData> a = record(Instant.ofEpochSecond(100));
    Record<EncryptedData> b = record(Instant.ofEpochSecond(200));
    relay.postBatch(List.of(a));
    relay.postBatch(List.of(a, b));
    relay.postBatch(List.of(b, a));
    Assert.assertEquals(relay.count(), 2L);
    Assert.assertEquals(dir.size(), 2);
  }

  @Test
  public void testRepostKeepsOriginalUploadTime() throws Exception {
    ConsistentInMemoryDir dir = new ConsistentInMemoryDir();
    DirectoryRelay relay = new DirectoryRelay(dir, clock, 10);
    Record<EncryptedData> a = record(Instant.ofEpochSecond(100));
    relay.postBatch(List.of(a));
    Instant afterFirstUpload = clock.now();
    relay.postBatch(List.of(a));

    // a sync that started after the upload does not see it again
    Assert.assertEquals(relay.fetchPage(afterFirstUpload, Instant.EPOCH, null), List.of());
    Assert.assertEquals(relay.fetchPage(Instant.EPOCH, Instant.EPOCH, null), List.of(a));
  }

  @Test
  public void testIgnoresForeignEntries() throws Exception {
    ConsistentInMemoryDir dir = new ConsistentInMemoryDir();
    DirectoryRelay relay = new DirectoryRelay(dir, clock, 10);
    dir.createOrReplace("README", new ByteArrayInputStream("hi".getBytes(StandardCharsets.UTF_8)));
    Record<EncryptedData> a = record(Instant.ofEpochSecond(100));
    relay.postBatch(List.of(a));
    Assert.assertEquals(relay.count(), 1L);
    Assert.assertEquals(relay.fetchPage(Instant.EPOCH, Instant.EPOCH, null), List.of(a));
  }

  @Test(expectedExceptions = IOException.class)
  public void testCorruptEntry() throws Exception {
    ConsistentInMemoryDir dir = new ConsistentInMemoryDir();
    DirectoryRelay relay = new DirectoryRelay(dir, clock, 10);
    dir.createOrReplace("00000000100000000000-x", new ByteArrayInputStream("{".getBytes(StandardCharsets.UTF_8)));
    relay.fetchPage(Instant.EPOCH, Instant.EPOCH, null);
  }

  @Test
  public void testPageStopsAtInvisibleEntry() throws Exception {
    ConsistentInMemoryDir backing = new ConsistentInMemoryDir();
    Record<EncryptedData> a = record(Instant.ofEpochSecond(100));
    Record<EncryptedData> b = record(Instant.ofEpochSecond(200));
    Record<EncryptedData> c = record(Instant.ofEpochSecond(300));
    new DirectoryRelay(backing, clock, 10).postBatch(List.of(a, b, c));

    // b is listed but cannot be read yet
    String hidden = DirectoryRelay.entryName(b);
    EventuallyConsistentDirectory lagging = new EventuallyConsistentDirectory() {
      @Override
      public Stream<String> list() {
        return backing.list();
      }

      @Override
      public Stream<String> listAfter(String startAfter) {
        return backing.listAfter(startAfter);
      }

      @Override
      public void createOrReplace(String name, InputStream stream) throws IOException {
        backing.createOrReplace(name, stream);
      }

      @Override
      public InputStream open(String name) throws IOException {
        if (name.equals(hidden)) {
          throw new NoSuchFileException(name);
        }
        return backing.open(name);
      }
    };

    Assert.assertEquals(new DirectoryRelay(lagging, clock, 10).fetchPage(Instant.EPOCH, Instant.EPOCH, null), List.of(a));
  }

  @Test
  public void testLocalDirectory() throws Exception {
    LocalDirectory dir = new LocalDirectory(Files.createTempDirectory("recsync-relay").resolve("relay"));
    DirectoryRelay relay = new DirectoryRelay(dir, clock, 10);
    Record<EncryptedData> a = record(Instant.ofEpochSecond(100));
    Record<EncryptedData> b = record(Instant.ofEpochSecond(200));
    relay.postBatch(List.of(b, a));
    relay.postBatch(List.of(a));
    Assert.assertEquals(relay.count(), 2L);
    Assert.assertEquals(relay.fetchPage(Instant.EPOCH, Instant.EPOCH, null), List.of(a, b));
    Assert.expectThrows(NoSuchFileException.class, () -> dir.open("missing"));
  }

  @Test
  public void testSyncThroughDirectory() throws Exception {
    ConsistentInMemoryDir dir = new ConsistentInMemoryDir();
    InMemoryRecordStore source = new InMemoryRecordStore();
    InMemoryRecordStore dest = new InMemoryRecordStore();
    for (int i = 1; i <= 5; ++i) {
      source.push(record(Instant.ofEpochSecond(i * 100L)));
    }
    new Syncer(source, source, new DirectoryRelay(dir, clock, 2), clock).sync();
    SyncReport report = new Syncer(dest, dest, new DirectoryRelay(dir, clock, 2), clock).sync();
    Assert.assertEquals(report.downloaded(), 5L);
    Assert.assertEquals(dest.scan(null, 10), source.scan(null, 10));
  }

}
