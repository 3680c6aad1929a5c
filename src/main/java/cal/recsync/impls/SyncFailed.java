package cal.recsync.impls;

import cal.recsync.types.SyncReport;

/**
 * A sync stopped before it finished.  Pages and batches that completed
 * before the failure stay committed; {@link #partialReport()} says how many.
 */
public class SyncFailed extends Exception {

  private final SyncReport partialReport;

  public SyncFailed(SyncReport partialReport, Throwable cause) {
    super("sync failed after " + partialReport + ": " + cause.getMessage(), cause);
    this.partialReport = partialReport;
  }

  public SyncReport partialReport() {
    return partialReport;
  }

}
