package cal.recsync.crypto;

/**
 * A record could not be decrypted.
 *
 * <p>There is exactly one message and never a cause.  Whether the master key
 * was wrong, the wrapped key was damaged, the ciphertext was altered, or the
 * record was moved to a different id, host, tag, or version, callers see the
 * same exception.
 */
public class DecryptionFailed extends Exception {
  public DecryptionFailed() {
    super("could not decrypt record");
  }
}
