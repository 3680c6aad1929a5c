package cal.recsync.crypto;

import cal.prim.MalformedDataException;
import cal.recsync.Util;
import com.google.common.hash.Hashing;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.SecureRandom;

/**
 * The long-lived key-encryption key (KEK).  A master key never touches record
 * payloads; it only wraps and unwraps the random per-record content keys.
 *
 * <p>Every master key has a public {@link #id() id} derived from the key
 * material.  Wrapped-key footers carry the id of the key that wrapped them, so
 * that decryption with the wrong master key fails before any unwrapping.
 */
public final class MasterKey {

  public static final int KEY_BYTES = 32;

  private static final String ID_PREFIX = "k1.lid.";
  private static final byte[] ID_DOMAIN = "recsync-key-id".getBytes(StandardCharsets.US_ASCII);

  private final byte[] key;
  private final String id;

  private MasterKey(byte[] key) {
    if (key.length != KEY_BYTES) {
      throw new IllegalArgumentException("master keys are " + KEY_BYTES + " bytes, not " + key.length);
    }
    this.key = key.clone();
    this.id = ID_PREFIX + Util.base64(Hashing.sha256().newHasher()
            .putBytes(ID_DOMAIN)
            .putBytes(this.key)
            .hash()
            .asBytes());
  }

  public static MasterKey generate(SecureRandom random) {
    byte[] bytes = new byte[KEY_BYTES];
    random.nextBytes(bytes);
    return new MasterKey(bytes);
  }

  public static MasterKey fromBytes(byte[] bytes) {
    return new MasterKey(bytes);
  }

  public static MasterKey decode(String text) throws MalformedDataException {
    byte[] bytes;
    try {
      bytes = Util.unbase64(text.trim());
    } catch (IllegalArgumentException e) {
      throw new MalformedDataException("master key is not valid base64", e);
    }
    if (bytes.length != KEY_BYTES) {
      throw new MalformedDataException("master key has " + bytes.length + " bytes; expected " + KEY_BYTES);
    }
    return new MasterKey(bytes);
  }

  public String encode() {
    return Util.base64(key);
  }

  /**
   * The public identifier of this key.  Two keys have the same id exactly
   * when they have the same key material (barring SHA-256 collisions).
   *
   * @return the key id
   */
  public String id() {
    return id;
  }

  SecretKey secretKey() {
    return new SecretKeySpec(key, "AES");
  }

  public static MasterKey read(Path file) throws IOException, MalformedDataException {
    return decode(Files.readString(file, StandardCharsets.US_ASCII));
  }

  /**
   * Write this key to a new file.  Where the filesystem supports it, the file
   * is readable by its owner only.
   *
   * @param file the file to create
   * @throws java.nio.file.FileAlreadyExistsException if the file already exists
   * @throws IOException if the file could not be written
   */
  public void write(Path file) throws IOException {
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
      Files.createFile(file, PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rw-------")));
    } else {
      Files.createFile(file);
    }
    Files.writeString(file, encode() + '\n', StandardCharsets.US_ASCII);
  }

  @Override
  public String toString() {
    return "MasterKey(" + id + ')';
  }

}
