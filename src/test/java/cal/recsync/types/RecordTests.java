package cal.recsync.types;

import cal.prim.time.UnreliableWallClock;
import cal.recsync.crypto.AesGcmEnvelope;
import cal.recsync.crypto.DecryptedData;
import cal.recsync.crypto.DecryptionFailed;
import cal.recsync.crypto.EncryptedData;
import cal.recsync.crypto.MasterKey;
import cal.recsync.crypto.RecordEncryption;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

@Test
public class RecordTests {

  private final RecordEncryption encryption = new AesGcmEnvelope();
  private final MasterKey key = MasterKey.generate(new SecureRandom());
  private final HostId host = new HostId("laptop");
  private final UnreliableWallClock clock = UnreliableWallClock.ticking(Instant.parse("2023-11-14T12:00:00Z"), Duration.ofSeconds(1));

  private Record<DecryptedData> kv(String k, String v) {
    return Record.create(host, KvRecord.TAG, KvRecord.VERSION, null, clock, new DecryptedData(new KvRecord(k, v).serialize()));
  }

  @Test
  public void testIdsAreTimeOrderedUuids() {
    Instant t = Instant.parse("2023-11-14T12:00:00Z");
    UUID id = UUID.fromString(Record.newId(t));
    Assert.assertEquals(id.version(), 7);
    Assert.assertEquals(id.variant(), 2);
    Assert.assertEquals(id.getMostSignificantBits() >>> 16, t.toEpochMilli());
    Assert.assertTrue(Record.newId(t).compareTo(Record.newId(t.plusSeconds(1))) < 0);
  }

  @Test
  public void testCreate() {
    // other tests advance the shared clock
    UnreliableWallClock fresh = UnreliableWallClock.ticking(Instant.parse("2023-11-14T12:00:00Z"), Duration.ofSeconds(1));
    Record<DecryptedData> r = Record.create(host, KvRecord.TAG, KvRecord.VERSION, null, fresh, new DecryptedData(new KvRecord("a", "1").serialize()));
    Assert.assertEquals(r.host(), host);
    Assert.assertNull(r.parent());
    Assert.assertEquals(r.timestamp(), Instant.parse("2023-11-14T12:00:00Z"));
    Assert.assertEquals(r.additionalData().host(), "laptop");
    Assert.assertEquals(r.additionalData().tag(), KvRecord.TAG);
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testOwnParent() {
    new Record<>("x", host, "x", "kv", "v0", Instant.EPOCH, "data");
  }

  @Test
  public void testEncryptDecrypt() throws Exception {
    Record<DecryptedData> r = kv("a", "1");
    Record<EncryptedData> e = Record.encrypt(r, encryption, key);
    Assert.assertEquals(e.id(), r.id());
    Assert.assertEquals(e.timestamp(), r.timestamp());
    Assert.assertEquals(Record.decrypt(e, encryption, key), r);
  }

  @Test(expectedExceptions = DecryptionFailed.class)
  public void testChangedHostIsDetected() throws Exception {
    Record<EncryptedData> e = Record.encrypt(kv("a", "1"), encryption, key);
    Record<EncryptedData> moved = new Record<>(e.id(), new HostId("desktop"), e.parent(), e.tag(), e.version(), e.timestamp(), e.data());
    Record.decrypt(moved, encryption, key);
  }

  @Test(expectedExceptions = DecryptionFailed.class)
  public void testChangedIdIsDetected() throws Exception {
    Record<EncryptedData> e = Record.encrypt(kv("a", "1"), encryption, key);
    Record<EncryptedData> other = Record.encrypt(kv("b", "2"), encryption, key);
    Record<EncryptedData> swapped = new Record<>(other.id(), e.host(), e.parent(), e.tag(), e.version(), e.timestamp(), e.data());
    Record.decrypt(swapped, encryption, key);
  }

  @Test
  public void testTimestampAndParentAreNotBound() throws Exception {
    // only id, version, tag, and host are authenticated
    Record<DecryptedData> r = kv("a", "1");
    Record<EncryptedData> e = Record.encrypt(r, encryption, key);
    Record<EncryptedData> moved = new Record<>(e.id(), e.host(), "some-parent", e.tag(), e.version(), Instant.EPOCH, e.data());
    Assert.assertEquals(Record.decrypt(moved, encryption, key).data(), r.data());
  }

  @Test
  public void testReEncrypt() throws Exception {
    MasterKey newKey = MasterKey.generate(new SecureRandom());
    Record<DecryptedData> r = kv("a", "1");
    Record<EncryptedData> e = Record.encrypt(r, encryption, key);
    Record<EncryptedData> rotated = Record.reEncrypt(e, encryption, key, newKey);
    Assert.assertEquals(rotated.data().data(), e.data().data());
    Assert.assertEquals(Record.decrypt(rotated, encryption, newKey), r);
  }

}
