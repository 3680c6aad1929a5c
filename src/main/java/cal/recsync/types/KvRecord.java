package cal.recsync.types;

import cal.prim.MalformedDataException;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * The payload of a record in the "kv" chain: one key set to one value.
 *
 * <p>Binary layout (version {@code v0}), all integers big-endian:
 * <pre>
 *   keyLength   (4B)
 *   key         (keyLength bytes, UTF-8)
 *   valueLength (4B)
 *   value       (valueLength bytes, UTF-8)
 * </pre>
 * Nothing may follow the value.
 */
public record KvRecord(String key, String value) {

  public static final String TAG = "kv";
  public static final String VERSION = "v0";

  public KvRecord {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
  }

  public byte[] serialize() {
    byte[] k = key.getBytes(StandardCharsets.UTF_8);
    byte[] v = value.getBytes(StandardCharsets.UTF_8);
    return ByteBuffer.allocate(4 + k.length + 4 + v.length)
            .putInt(k.length).put(k)
            .putInt(v.length).put(v)
            .array();
  }

  public static KvRecord deserialize(byte[] bytes) throws MalformedDataException {
    ByteBuffer b = ByteBuffer.wrap(bytes);
    try {
      String key = readString(b);
      String value = readString(b);
      if (b.hasRemaining()) {
        throw new MalformedDataException(b.remaining() + " unexpected bytes after kv record");
      }
      return new KvRecord(key, value);
    } catch (BufferUnderflowException e) {
      throw new MalformedDataException("kv record is truncated", e);
    }
  }

  private static String readString(ByteBuffer b) throws MalformedDataException {
    int len = b.getInt();
    if (len < 0 || len > b.remaining()) {
      throw new MalformedDataException("bad string length " + len);
    }
    ByteBuffer slice = b.slice().limit(len);
    b.position(b.position() + len);
    try {
      return StandardCharsets.UTF_8.newDecoder()
              .onMalformedInput(CodingErrorAction.REPORT)
              .onUnmappableCharacter(CodingErrorAction.REPORT)
              .decode(slice)
              .toString();
    } catch (CharacterCodingException e) {
      throw new MalformedDataException("kv record is not valid UTF-8", e);
    }
  }

}
