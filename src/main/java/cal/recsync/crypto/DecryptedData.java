package cal.recsync.crypto;

import java.util.Arrays;

/**
 * Plaintext record payload: the serialized domain object, before encryption
 * or after decryption.
 */
public final class DecryptedData {

  private final byte[] bytes;

  public DecryptedData(byte[] bytes) {
    this.bytes = bytes.clone();
  }

  public byte[] bytes() {
    return bytes.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return Arrays.equals(bytes, ((DecryptedData) o).bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return "DecryptedData(" + bytes.length + " bytes)";
  }

}
