package cal.recsync.types;

import cal.prim.PreconditionFailed;

import java.io.IOException;
import java.time.Instant;

/**
 * The persisted time of the last successful sync.
 */
public interface SyncCheckpoint {

  /**
   * @return the start time of the last successful sync, or {@link Instant#EPOCH}
   *   if this host has never synced
   */
  Instant lastSync() throws IOException;

  /**
   * Atomically set the last sync time to <code>next</code> if it is currently
   * <code>expected</code> (compare-and-swap).  Two syncs that run at the same
   * time can therefore never move the checkpoint backwards.
   *
   * @throws PreconditionFailed if the current value is not <code>expected</code>
   */
  void recordSync(Instant expected, Instant next) throws IOException, PreconditionFailed;

}
