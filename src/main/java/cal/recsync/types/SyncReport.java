package cal.recsync.types;

/**
 * What a sync did, or got through before it failed.
 *
 * @param downloaded records that were new to the local store
 * @param uploaded records posted to the relay (re-posts of records the relay
 *   already had are included)
 * @param localCount records in the local store afterwards
 * @param remoteCount records on the relay at the last count
 */
public record SyncReport(long downloaded, long uploaded, long localCount, long remoteCount) {

  @Override
  public String toString() {
    return "downloaded " + downloaded + ", uploaded " + uploaded
            + " (local: " + localCount + ", remote: " + remoteCount + ')';
  }
}
