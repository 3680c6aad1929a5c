package cal.recsync.crypto;

import java.util.Objects;

/**
 * The at-rest and on-the-wire form of a record payload.
 *
 * @param data the ciphertext token
 * @param contentEncryptionKey the wrapped-key footer: a small JSON object naming the
 *   wrapped content key and the id of the master key that wrapped it
 */
public record EncryptedData(String data, String contentEncryptionKey) {
  public EncryptedData {
    Objects.requireNonNull(data, "data");
    Objects.requireNonNull(contentEncryptionKey, "contentEncryptionKey");
  }
}
