package cal.recsync.crypto;

import cal.prim.MalformedDataException;
import cal.recsync.Util;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;

@Test
public class MasterKeyTests {

  private final SecureRandom random = new SecureRandom();

  @Test
  public void testEncodeDecode() throws Exception {
    MasterKey key = MasterKey.generate(random);
    MasterKey decoded = MasterKey.decode(key.encode());
    Assert.assertEquals(decoded.id(), key.id());
  }

  @Test
  public void testIdDependsOnKeyMaterial() {
    byte[] bytes = new byte[MasterKey.KEY_BYTES];
    String zeroes = MasterKey.fromBytes(bytes).id();
    Assert.assertEquals(MasterKey.fromBytes(bytes).id(), zeroes);
    Assert.assertTrue(zeroes.startsWith("k1.lid."));
    // the whole SHA-256 digest
    Assert.assertEquals(Util.unbase64(zeroes.substring("k1.lid.".length())).length, 32);
    bytes[0] = 1;
    Assert.assertNotEquals(MasterKey.fromBytes(bytes).id(), zeroes);
  }

  @Test
  public void testToStringHidesKey() {
    MasterKey key = MasterKey.generate(random);
    Assert.assertFalse(key.toString().contains(key.encode()));
    Assert.assertTrue(key.toString().contains(key.id()));
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testWrongLength() {
    MasterKey.fromBytes(new byte[16]);
  }

  @Test(expectedExceptions = MalformedDataException.class)
  public void testDecodeGarbage() throws Exception {
    MasterKey.decode("this is not a key!");
  }

  @Test(expectedExceptions = MalformedDataException.class)
  public void testDecodeShortKey() throws Exception {
    MasterKey.decode("AAAA");
  }

  @Test
  public void testFileRoundTrip() throws Exception {
    Path dir = Files.createTempDirectory("recsync-key");
    Path file = dir.resolve("sub").resolve("key");
    MasterKey key = MasterKey.generate(random);
    key.write(file);
    Assert.assertEquals(MasterKey.read(file).id(), key.id());
    Assert.expectThrows(FileAlreadyExistsException.class, () -> MasterKey.generate(random).write(file));
    Assert.assertEquals(MasterKey.read(file).id(), key.id());
  }

}
