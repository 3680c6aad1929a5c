package cal.recsync;

import com.google.common.io.BaseEncoding;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Instant;

public abstract class Util {

  /**
   * The suggested size of in-memory byte buffers for I/O.
   */
  public static final int SUGGESTED_BUFFER_SIZE = 8192;

  /**
   * A thread-local byte array of {@link #SUGGESTED_BUFFER_SIZE} bytes.
   */
  private static final ThreadLocal<byte[]> MEM_BUFFER = ThreadLocal.withInitial(() -> new byte[SUGGESTED_BUFFER_SIZE]);

  /**
   * URL-safe base64 without padding.  Every base64 string this project writes
   * (tokens, wrapped keys, key ids, key files) uses this alphabet.
   */
  private static final BaseEncoding BASE64_URL = BaseEncoding.base64Url().omitPadding();

  private static final long NANOS_PER_SECOND = 1_000_000_000L;

  public static long copyStream(InputStream in, OutputStream out) throws IOException {
    byte[] buf = MEM_BUFFER.get();
    long count = 0;
    int n;
    while ((n = in.read(buf)) >= 0) {
      out.write(buf, 0, n);
      count += n;
    }
    return count;
  }

  public static byte[] read(InputStream in) throws IOException {
    try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
      copyStream(in, out);
      return out.toByteArray();
    }
  }

  public static String base64(byte[] bytes) {
    return BASE64_URL.encode(bytes);
  }

  /**
   * Decode URL-safe unpadded base64.
   *
   * @param text the encoded text
   * @return the decoded bytes
   * @throws IllegalArgumentException if <code>text</code> is not valid base64
   */
  public static byte[] unbase64(String text) {
    return BASE64_URL.decode(text);
  }

  /**
   * Convert an instant to nanoseconds since the Unix epoch, the representation
   * used in the database and on the wire.
   *
   * @throws ArithmeticException if the instant does not fit in a <code>long</code>
   */
  public static long toEpochNanos(Instant instant) {
    return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), NANOS_PER_SECOND), instant.getNano());
  }

  public static Instant fromEpochNanos(long nanos) {
    return Instant.ofEpochSecond(Math.floorDiv(nanos, NANOS_PER_SECOND), Math.floorMod(nanos, NANOS_PER_SECOND));
  }

}
