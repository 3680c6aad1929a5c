package cal.recsync.types;

import java.util.Objects;

/**
 * A unique identifier for a host.  Every host keeps one chain of records per
 * tag, and stamps its id on every record it creates.
 */
public record HostId(String value) {
  public HostId {
    Objects.requireNonNull(value, "host id may not be null");
    if (value.isEmpty()) {
      throw new IllegalArgumentException("host id may not be empty");
    }
  }

  @Override
  public String toString() {
    return value;
  }
}
