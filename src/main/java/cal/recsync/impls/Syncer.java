package cal.recsync.impls;

import cal.prim.PreconditionFailed;
import cal.prim.time.UnreliableWallClock;
import cal.recsync.crypto.DecryptionFailed;
import cal.recsync.crypto.EncryptedData;
import cal.recsync.crypto.MasterKey;
import cal.recsync.crypto.RecordEncryption;
import cal.recsync.types.Record;
import cal.recsync.types.RecordStore;
import cal.recsync.types.RelayClient;
import cal.recsync.types.SyncCheckpoint;
import cal.recsync.types.SyncReport;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Instant;
import java.util.List;

/**
 * Reconciles a local {@link RecordStore} with a {@link RelayClient}.
 *
 * <p>A sync downloads until the local store holds at least as many records
 * as the relay, then uploads until the relay holds at least as many as the
 * local store.  Record ids are global and both sides ignore duplicates, so
 * comparing counts is enough to decide which direction has work left.  Each
 * page and batch is committed on its own: an interrupted sync keeps what it
 * got, and the next sync picks up from the counts.
 */
public class Syncer {

  public static final int DEFAULT_UPLOAD_BATCH_SIZE = 100;

  private final RecordStore store;
  private final SyncCheckpoint checkpoint;
  private final RelayClient relay;
  private final UnreliableWallClock clock;
  private final int uploadBatchSize;
  private final @Nullable RecordEncryption verifyWith;
  private final @Nullable MasterKey verificationKey;

  public Syncer(RecordStore store, SyncCheckpoint checkpoint, RelayClient relay, UnreliableWallClock clock) {
    this(store, checkpoint, relay, clock, DEFAULT_UPLOAD_BATCH_SIZE, null, null);
  }

  /**
   * @param verifyWith if non-null, every downloaded record must decrypt with
   *   <code>verificationKey</code> before it is stored
   * @param verificationKey the key for verification; required exactly when
   *   <code>verifyWith</code> is given
   */
  public Syncer(
          RecordStore store, SyncCheckpoint checkpoint, RelayClient relay, UnreliableWallClock clock,
          int uploadBatchSize,
          @Nullable RecordEncryption verifyWith, @Nullable MasterKey verificationKey) {
    if (uploadBatchSize <= 0) {
      throw new IllegalArgumentException("upload batch size must be positive, not " + uploadBatchSize);
    }
    if ((verifyWith == null) != (verificationKey == null)) {
      throw new IllegalArgumentException("verification needs both an encryption scheme and a key");
    }
    this.store = store;
    this.checkpoint = checkpoint;
    this.relay = relay;
    this.clock = clock;
    this.uploadBatchSize = uploadBatchSize;
    this.verifyWith = verifyWith;
    this.verificationKey = verificationKey;
  }

  private static class Progress {
    long downloaded = 0;
    long uploaded = 0;
    long local = 0;
    long remote = 0;

    SyncReport report() {
      return new SyncReport(downloaded, uploaded, local, remote);
    }
  }

  /**
   * Download, then upload, then advance the last-sync checkpoint to the time
   * this sync started.  The checkpoint stays put if the download could not
   * bring the local store up to the relay's count.
   *
   * @throws SyncFailed if any step fails; its report says what was done before then
   */
  public SyncReport sync() throws SyncFailed {
    Progress progress = new Progress();
    try {
      Instant startedAt = clock.now();
      Instant previous = checkpoint.lastSync();
      download(previous, progress);
      boolean caughtUp = progress.local >= progress.remote;
      upload(progress);
      if (caughtUp) {
        checkpoint.recordSync(previous, startedAt);
      } else {
        // Moving the checkpoint would hide the missing records from every
        // later incremental sync.
        System.err.println("Last sync not recorded: download ended with " + progress.local + " local and " + progress.remote + " remote records");
      }
      return progress.report();
    } catch (IOException | DecryptionFailed | PreconditionFailed e) {
      throw new SyncFailed(progress.report(), e);
    }
  }

  /**
   * Fetch records from the relay into the local store.
   *
   * @param lastSync the start of the last successful sync; the relay may skip
   *   records it received before then
   * @return the report of the download
   * @throws DecryptionFailed if verification is on and a downloaded record
   *   does not decrypt; the page holding it is not stored
   */
  public SyncReport download(Instant lastSync) throws IOException, DecryptionFailed {
    Progress progress = new Progress();
    download(lastSync, progress);
    return progress.report();
  }

  /**
   * Post local records to the relay, newest first.
   *
   * @return the report of the upload
   */
  public SyncReport upload() throws IOException {
    Progress progress = new Progress();
    upload(progress);
    return progress.report();
  }

  private void download(Instant lastSync, Progress progress) throws IOException, DecryptionFailed {
    progress.remote = relay.count();
    progress.local = store.count();

    downloadPass(lastSync, progress);
    if (progress.remote > progress.local && !lastSync.equals(Instant.EPOCH)) {
      // The relay may have hidden records it received before lastSync that
      // we never saw, e.g. because of clock skew between hosts.
      System.err.println("Incremental download ended short (local " + progress.local + ", remote " + progress.remote + "); downloading everything");
      downloadPass(Instant.EPOCH, progress);
    }
  }

  private void downloadPass(Instant lastSync, Progress progress) throws IOException, DecryptionFailed {
    Instant cursor = Instant.EPOCH;
    @Nullable String cursorId = null;
    boolean resetSinceProgress = false;
    while (progress.remote > progress.local) {
      checkInterrupted();

      List<Record<EncryptedData>> page = relay.fetchPage(lastSync, cursor, cursorId);
      if (page.isEmpty()) {
        break;
      }

      if (verifyWith != null && verificationKey != null) {
        for (var record : page) {
          Record.decrypt(record, verifyWith, verificationKey);
        }
      }

      int added = store.saveBulk(page);
      progress.downloaded += added;
      progress.local = store.count();
      if (added > 0) {
        resetSinceProgress = false;
      }

      Record<EncryptedData> pageEnd = page.get(page.size() - 1);
      if (pageEnd.compareToCursor(cursor, cursorId) > 0) {
        cursor = pageEnd.timestamp();
        cursorId = pageEnd.id();
      } else if (resetSinceProgress) {
        // The relay keeps serving the same records without getting us any
        // closer to its count.
        System.err.println("Download stopped: relay returned the same page twice (local " + progress.local + ", remote " + progress.remote + ")");
        break;
      } else {
        cursor = Instant.EPOCH;
        cursorId = null;
        resetSinceProgress = true;
      }
    }
  }

  private void upload(Progress progress) throws IOException {
    progress.remote = relay.count();
    progress.local = store.count();

    Instant cursor = clock.now();
    @Nullable String cursorId = null;
    while (progress.local > progress.remote) {
      checkInterrupted();

      List<Record<EncryptedData>> batch = store.before(cursor, cursorId, uploadBatchSize);
      if (batch.isEmpty()) {
        break;
      }

      relay.postBatch(batch);
      progress.uploaded += batch.size();
      Record<EncryptedData> batchEnd = batch.get(batch.size() - 1);
      cursor = batchEnd.timestamp();
      cursorId = batchEnd.id();
      progress.remote = relay.count();
    }
  }

  private static void checkInterrupted() throws InterruptedIOException {
    if (Thread.interrupted()) {
      throw new InterruptedIOException("sync interrupted");
    }
  }

}
