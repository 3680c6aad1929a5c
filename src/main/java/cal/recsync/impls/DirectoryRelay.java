package cal.recsync.impls;

import cal.prim.MalformedDataException;
import cal.prim.storage.EventuallyConsistentDirectory;
import cal.prim.time.UnreliableWallClock;
import cal.recsync.Util;
import cal.recsync.crypto.EncryptedData;
import cal.recsync.types.Record;
import cal.recsync.types.RelayClient;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.NoSuchFileException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A relay made of one directory entry per record.
 *
 * <p>Entries are named <code>TTTTTTTTTTTTTTTTTTTT-ID</code>, where the T's are
 * the record's timestamp in nanoseconds since the epoch, zero-padded to 20
 * digits.  Directory listings are sorted by name and therefore by timestamp
 * and then id, so a page of records after some (timestamp, id) cursor is a
 * single listing that starts at the cursor's own name.  Entries are written once and never replaced.
 */
public class DirectoryRelay implements RelayClient {

  private static final Pattern NAME = Pattern.compile("^(\\d{20})-(.+)$");

  // sorts after every "TTTTTTTTTTTTTTTTTTTT-ID" name with the same timestamp
  private static final String AFTER_ALL_IDS = "-~";

  private final EventuallyConsistentDirectory directory;
  private final UnreliableWallClock clock;
  private final int pageSize;

  public DirectoryRelay(EventuallyConsistentDirectory directory, UnreliableWallClock clock, int pageSize) {
    if (pageSize <= 0) {
      throw new IllegalArgumentException("page size must be positive, not " + pageSize);
    }
    this.directory = directory;
    this.clock = clock;
    this.pageSize = pageSize;
  }

  static String entryName(Record<?> record) {
    return timestampPrefix(record.timestamp()) + '-' + record.id();
  }

  private static String timestampPrefix(Instant timestamp) {
    long nanos = Util.toEpochNanos(timestamp);
    if (nanos < 0) {
      throw new IllegalArgumentException("cannot relay records from before the epoch: " + timestamp);
    }
    return String.format("%020d", nanos);
  }

  @Override
  public long count() throws IOException {
    try (Stream<String> names = directory.list()) {
      return names.filter(name -> NAME.matcher(name).matches()).count();
    }
  }

  @Override
  public List<Record<EncryptedData>> fetchPage(Instant lastSync, Instant after, @Nullable String afterId) throws IOException {
    String startAfter;
    if (after.isBefore(Instant.EPOCH)) {
      startAfter = "";
    } else if (afterId == null) {
      // the bare prefix sorts before every entry with that timestamp
      startAfter = timestampPrefix(after);
    } else {
      startAfter = timestampPrefix(after) + '-' + afterId;
    }
    List<Record<EncryptedData>> page = new ArrayList<>();
    try (Stream<String> names = directory.listAfter(startAfter)) {
      Iterator<String> it = names.iterator();
      while (page.size() < pageSize && it.hasNext()) {
        String name = it.next();
        Matcher m = NAME.matcher(name);
        if (!m.matches()) {
          continue;
        }

        RecordJson.Uploaded entry;
        try (InputStream in = directory.open(name)) {
          entry = RecordJson.deserialize(in);
        } catch (NoSuchFileException e) {
          // Listed but not yet readable.  Stop here so that the caller's
          // cursor does not move past it.
          break;
        } catch (MalformedDataException e) {
          throw new IOException("relay entry " + name + " is corrupt", e);
        }

        Record<EncryptedData> record = entry.record();
        if (!name.equals(entryName(record))) {
          throw new IOException("relay entry " + name + " holds record " + entryName(record));
        }
        Instant uploadedAt = entry.uploadedAt();
        if (uploadedAt != null && uploadedAt.isBefore(lastSync)) {
          continue;
        }
        page.add(record);
      }
    }
    return page;
  }

  @Override
  public void postBatch(List<Record<EncryptedData>> batch) throws IOException {
    if (batch.isEmpty()) {
      return;
    }

    List<String> names = batch.stream().map(DirectoryRelay::entryName).sorted().collect(Collectors.toList());
    String first = names.get(0);
    String last = names.get(names.size() - 1);

    // Only the slice of the directory between the smallest and largest names
    // can hold duplicates.
    Set<String> existing;
    try (Stream<String> listed = directory.listAfter(precedingName(first))) {
      existing = listed.takeWhile(name -> name.compareTo(last) <= 0).collect(Collectors.toCollection(HashSet::new));
    }

    Instant now = clock.now();
    for (var record : batch) {
      String name = entryName(record);
      if (existing.add(name)) {
        directory.createOrReplace(name, new ByteArrayInputStream(RecordJson.serialize(record, now)));
      }
    }
  }

  private static String precedingName(String name) {
    // everything after the previous nanosecond's entries
    long nanos = Long.parseLong(name.substring(0, 20));
    return nanos == 0 ? "" : String.format("%020d", nanos - 1) + AFTER_ALL_IDS;
  }

}
