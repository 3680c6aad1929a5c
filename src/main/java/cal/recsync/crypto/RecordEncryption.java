package cal.recsync.crypto;

/**
 * An envelope encryption scheme for record payloads.
 *
 * <p>Each payload is encrypted under a fresh random content-encryption key
 * (CEK), and the CEK is wrapped by a {@link MasterKey}.  The record's
 * {@link AdditionalData} is authenticated together with the payload, so a
 * ciphertext only decrypts under the exact id, version, tag, and host it was
 * created with.
 *
 * <p>Implementations are stateless apart from a source of randomness and are
 * safe to share between threads.
 *
 * @see AesGcmEnvelope
 */
public interface RecordEncryption {

  EncryptedData encrypt(DecryptedData data, AdditionalData ad, MasterKey key);

  /**
   * Decrypt a payload.
   *
   * @throws DecryptionFailed if the key is wrong, the data was tampered with,
   *   or <code>ad</code> differs from the additional data used to encrypt.
   *   These cases are deliberately indistinguishable.
   */
  DecryptedData decrypt(EncryptedData data, AdditionalData ad, MasterKey key) throws DecryptionFailed;

  /**
   * Re-wrap the content key of a payload under a new master key.  The
   * ciphertext is not touched, so this costs the same for every record
   * regardless of its size.
   *
   * @throws DecryptionFailed if <code>oldKey</code> cannot unwrap the content key
   */
  EncryptedData reEncrypt(EncryptedData data, AdditionalData ad, MasterKey oldKey, MasterKey newKey) throws DecryptionFailed;

  /**
   * Determine whether the content key of <code>data</code> claims to be wrapped
   * by <code>key</code>.  This only inspects the public key id; it does not
   * prove that decryption will succeed.
   */
  boolean isWrappedBy(EncryptedData data, MasterKey key);

}
