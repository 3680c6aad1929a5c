package cal.recsync.impls;

import cal.prim.MalformedDataException;
import cal.recsync.Util;
import cal.recsync.crypto.EncryptedData;
import cal.recsync.types.HostId;
import cal.recsync.types.Record;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;

/**
 * The JSON form of an encrypted record, as stored on a relay.  Timestamps are
 * nanoseconds since the epoch.
 *
 * <pre>
 * {"id":"...", "host":"...", "parent":null, "tag":"kv", "version":"v0",
 *  "timestamp":1700000000000000000, "data":"rs1.local....", "cek":"{...}",
 *  "uploadedAt":1700000000000000000}
 * </pre>
 */
public abstract class RecordJson {

  private static final ObjectMapper MAPPER = new ObjectMapper()
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  /**
   * A record together with the time a relay received it.
   */
  public record Uploaded(Record<EncryptedData> record, @Nullable Instant uploadedAt) { }

  private static class JsonRecord {
    public @Nullable String id;
    public @Nullable String host;
    public @Nullable String parent;
    public @Nullable String tag;
    public @Nullable String version;
    public @Nullable Long timestamp;
    public @Nullable String data;
    public @Nullable String cek;
    public @Nullable Long uploadedAt;
  }

  public static byte[] serialize(Record<EncryptedData> record, @Nullable Instant uploadedAt) {
    JsonRecord r = new JsonRecord();
    r.id = record.id();
    r.host = record.host().value();
    r.parent = record.parent();
    r.tag = record.tag();
    r.version = record.version();
    r.timestamp = Util.toEpochNanos(record.timestamp());
    r.data = record.data().data();
    r.cek = record.data().contentEncryptionKey();
    r.uploadedAt = uploadedAt == null ? null : Util.toEpochNanos(uploadedAt);
    try {
      return MAPPER.writeValueAsBytes(r);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("could not serialize record " + record.id(), e);
    }
  }

  public static Uploaded deserialize(InputStream in) throws IOException, MalformedDataException {
    JsonRecord r;
    try {
      r = MAPPER.readValue(in, JsonRecord.class);
    } catch (JsonProcessingException e) {
      throw new MalformedDataException("record is not valid JSON", e);
    }
    if (r == null) {
      throw new MalformedDataException("record is null");
    }
    String id = require(r.id, "id");
    try {
      Record<EncryptedData> record = new Record<>(
              id,
              new HostId(require(r.host, "host")),
              r.parent,
              require(r.tag, "tag"),
              require(r.version, "version"),
              Util.fromEpochNanos(require(r.timestamp, "timestamp")),
              new EncryptedData(require(r.data, "data"), require(r.cek, "cek")));
      return new Uploaded(record, r.uploadedAt == null ? null : Util.fromEpochNanos(r.uploadedAt));
    } catch (IllegalArgumentException e) {
      throw new MalformedDataException("record " + id + " is invalid", e);
    }
  }

  private static <T> T require(@Nullable T value, String field) throws MalformedDataException {
    if (value == null) {
      throw new MalformedDataException("record is missing \"" + field + '"');
    }
    return value;
  }

}
