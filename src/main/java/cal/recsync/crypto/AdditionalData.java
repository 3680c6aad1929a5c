package cal.recsync.crypto;

import java.util.Objects;

/**
 * The identity of a record, bound into its ciphertext as an implicit assertion.
 * It is authenticated but not encrypted, and it is never stored inside the
 * ciphertext: both sides recompute it from the record's own fields.
 *
 * @param id the record id
 * @param version the payload schema version
 * @param tag the record's category (e.g. "kv" or "history")
 * @param host the id of the host that created the record
 */
public record AdditionalData(String id, String version, String tag, String host) {
  public AdditionalData {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(version, "version");
    Objects.requireNonNull(tag, "tag");
    Objects.requireNonNull(host, "host");
  }
}
