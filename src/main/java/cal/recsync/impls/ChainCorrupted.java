package cal.recsync.impls;

import cal.recsync.types.HostId;

/**
 * A chain's parent links do not form a single line from its tail back to its
 * first record.
 */
public class ChainCorrupted extends Exception {

  private final HostId host;
  private final String tag;

  public ChainCorrupted(HostId host, String tag, String message) {
    super(host + "/" + tag + ": " + message);
    this.host = host;
    this.tag = tag;
  }

  public HostId host() {
    return host;
  }

  public String tag() {
    return tag;
  }

}
