package cal.recsync.crypto;

import cal.recsync.Util;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.checkerframework.checker.nullness.qual.Nullable;

import javax.crypto.BadPaddingException;
import javax.crypto.Cipher;
import javax.crypto.IllegalBlockSizeException;
import javax.crypto.NoSuchPaddingException;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.InvalidAlgorithmParameterException;
import java.security.InvalidKeyException;
import java.security.Key;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;

/**
 * Envelope encryption with AES-256-GCM for payloads and AES Key Wrap
 * (RFC 3394) for content keys.
 *
 * <p>Token layout:
 * <pre>
 *   rs1.local.BASE64URL(nonce[12] || ciphertext || tag[16])
 * </pre>
 * The GCM associated data is the pre-authentication encoding (PAE) of the
 * header <code>rs1.local.</code> and the assertion JSON
 * <code>{"id":..,"version":..,"category":..,"host_id":..}</code>, in exactly
 * that field order.  The plaintext handed to GCM is the URL-safe, unpadded
 * base64 encoding of the payload bytes.
 *
 * <p>Footer layout (stored next to the token, never inside it):
 * <pre>
 *   {"wrapped_key":"BASE64URL(AESWrap(kek, cek))","key_id":"k1.lid...."}
 * </pre>
 *
 * <p>Changing either encoding makes every existing record undecryptable.  A
 * new layout needs a new header and a new implementation of
 * {@link RecordEncryption}; this one must stay as it is.
 */
public class AesGcmEnvelope implements RecordEncryption {

  static final String HEADER = "rs1.local.";

  private static final String PAYLOAD_CIPHER = "AES/GCM/NoPadding";
  private static final String WRAP_CIPHER = "AESWrap";
  private static final int CEK_BYTES = 32;
  private static final int WRAPPED_CEK_BYTES = CEK_BYTES + 8;
  private static final int NONCE_BYTES = 12;
  private static final int TAG_BITS = 128;

  @JsonPropertyOrder({"id", "version", "category", "host_id"})
  private static class Assertions {
    public String id;
    public String version;
    public String category;
    @JsonProperty("host_id")
    public String host;

    Assertions(AdditionalData ad) {
      this.id = ad.id();
      this.version = ad.version();
      this.category = ad.tag();
      this.host = ad.host();
    }
  }

  @JsonPropertyOrder({"wrapped_key", "key_id"})
  private static class Footer {
    @JsonProperty("wrapped_key")
    public @Nullable String wrappedKey;
    @JsonProperty("key_id")
    public @Nullable String keyId;
  }

  private final SecureRandom random;
  private final ObjectMapper mapper = new ObjectMapper();

  public AesGcmEnvelope() {
    this(new SecureRandom());
  }

  public AesGcmEnvelope(SecureRandom random) {
    this.random = random;
  }

  @Override
  public EncryptedData encrypt(DecryptedData data, AdditionalData ad, MasterKey key) {
    byte[] cekBytes = new byte[CEK_BYTES];
    random.nextBytes(cekBytes);
    SecretKey cek = new SecretKeySpec(cekBytes, "AES");

    byte[] nonce = new byte[NONCE_BYTES];
    random.nextBytes(nonce);

    byte[] payload = Util.base64(data.bytes()).getBytes(StandardCharsets.US_ASCII);
    byte[] sealed;
    try {
      Cipher cipher = newCipher(PAYLOAD_CIPHER);
      cipher.init(Cipher.ENCRYPT_MODE, cek, new GCMParameterSpec(TAG_BITS, nonce));
      cipher.updateAAD(associatedData(ad));
      byte[] ciphertext = cipher.doFinal(payload);
      sealed = ByteBuffer.allocate(nonce.length + ciphertext.length).put(nonce).put(ciphertext).array();
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("AES-GCM encryption failed", e);
    }

    return new EncryptedData(HEADER + Util.base64(sealed), wrap(cek, key));
  }

  @Override
  public DecryptedData decrypt(EncryptedData data, AdditionalData ad, MasterKey key) throws DecryptionFailed {
    SecretKey cek = unwrap(data.contentEncryptionKey(), key);

    String token = data.data();
    if (!token.startsWith(HEADER)) {
      throw new DecryptionFailed();
    }
    byte[] sealed;
    try {
      sealed = Util.unbase64(token.substring(HEADER.length()));
    } catch (IllegalArgumentException e) {
      throw new DecryptionFailed();
    }
    if (sealed.length < NONCE_BYTES + TAG_BITS / 8) {
      throw new DecryptionFailed();
    }

    byte[] payload;
    try {
      Cipher cipher = newCipher(PAYLOAD_CIPHER);
      cipher.init(Cipher.DECRYPT_MODE, cek, new GCMParameterSpec(TAG_BITS, sealed, 0, NONCE_BYTES));
      cipher.updateAAD(associatedData(ad));
      payload = cipher.doFinal(sealed, NONCE_BYTES, sealed.length - NONCE_BYTES);
    } catch (BadPaddingException | IllegalBlockSizeException e) {
      // AEADBadTagException is a BadPaddingException
      throw new DecryptionFailed();
    } catch (InvalidKeyException | InvalidAlgorithmParameterException e) {
      throw new IllegalStateException("AES-GCM rejected its own parameters", e);
    }

    try {
      return new DecryptedData(Util.unbase64(new String(payload, StandardCharsets.US_ASCII)));
    } catch (IllegalArgumentException e) {
      throw new DecryptionFailed();
    }
  }

  @Override
  public EncryptedData reEncrypt(EncryptedData data, AdditionalData ad, MasterKey oldKey, MasterKey newKey) throws DecryptionFailed {
    SecretKey cek = unwrap(data.contentEncryptionKey(), oldKey);
    return new EncryptedData(data.data(), wrap(cek, newKey));
  }

  @Override
  public boolean isWrappedBy(EncryptedData data, MasterKey key) {
    Footer footer;
    try {
      footer = readFooter(data.contentEncryptionKey());
    } catch (DecryptionFailed e) {
      return false;
    }
    return sameKeyId(footer.keyId, key);
  }

  private String wrap(SecretKey cek, MasterKey kek) {
    Footer footer = new Footer();
    try {
      Cipher cipher = newCipher(WRAP_CIPHER);
      cipher.init(Cipher.WRAP_MODE, kek.secretKey());
      footer.wrappedKey = Util.base64(cipher.wrap(cek));
    } catch (InvalidKeyException | IllegalBlockSizeException e) {
      throw new IllegalStateException("AES key wrap failed", e);
    }
    footer.keyId = kek.id();
    try {
      return mapper.writeValueAsString(footer);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("could not serialize wrapped key", e);
    }
  }

  private SecretKey unwrap(String footerText, MasterKey kek) throws DecryptionFailed {
    Footer footer = readFooter(footerText);

    // Key ids are public, so comparing them first reveals nothing, and it
    // saves an unwrap when the master key is simply the wrong one.
    if (!sameKeyId(footer.keyId, kek)) {
      throw new DecryptionFailed();
    }

    String wrappedKey = footer.wrappedKey;
    if (wrappedKey == null) {
      throw new DecryptionFailed();
    }
    byte[] wrapped;
    try {
      wrapped = Util.unbase64(wrappedKey);
    } catch (IllegalArgumentException e) {
      throw new DecryptionFailed();
    }
    if (wrapped.length != WRAPPED_CEK_BYTES) {
      throw new DecryptionFailed();
    }

    Key cek;
    try {
      Cipher cipher = newCipher(WRAP_CIPHER);
      cipher.init(Cipher.UNWRAP_MODE, kek.secretKey());
      cek = cipher.unwrap(wrapped, "AES", Cipher.SECRET_KEY);
    } catch (InvalidKeyException e) {
      // thrown by unwrap() when the RFC 3394 integrity check fails
      throw new DecryptionFailed();
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException(e);
    }
    return (SecretKey) cek;
  }

  private Footer readFooter(String footerText) throws DecryptionFailed {
    Footer footer;
    try {
      footer = mapper.readValue(footerText, Footer.class);
    } catch (JsonProcessingException e) {
      throw new DecryptionFailed();
    }
    if (footer == null) {
      throw new DecryptionFailed();
    }
    return footer;
  }

  private static boolean sameKeyId(@Nullable String keyId, MasterKey key) {
    return keyId != null && MessageDigest.isEqual(
            keyId.getBytes(StandardCharsets.UTF_8),
            key.id().getBytes(StandardCharsets.UTF_8));
  }

  private byte[] associatedData(AdditionalData ad) {
    String assertions;
    try {
      assertions = mapper.writeValueAsString(new Assertions(ad));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("could not serialize implicit assertions", e);
    }
    return preAuthEncode(
            HEADER.getBytes(StandardCharsets.US_ASCII),
            assertions.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Length-prefix every piece so that no two different lists of pieces
   * produce the same bytes: a 64-bit little-endian count, then each piece as
   * a 64-bit little-endian length followed by its bytes.
   */
  static byte[] preAuthEncode(byte[]... pieces) {
    int size = 8;
    for (byte[] piece : pieces) {
      size += 8 + piece.length;
    }
    ByteBuffer out = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
    out.putLong(pieces.length);
    for (byte[] piece : pieces) {
      out.putLong(piece.length);
      out.put(piece);
    }
    return out.array();
  }

  private static Cipher newCipher(String transformation) {
    try {
      return Cipher.getInstance(transformation);
    } catch (NoSuchAlgorithmException | NoSuchPaddingException e) {
      // Every Java SE platform ships AES/GCM and AESWrap.
      throw new IllegalStateException(transformation + " is not available", e);
    }
  }

}
