package cal.prim.storage;

import cal.recsync.Util;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * An in-memory directory where every write is visible immediately.  Useful in tests and as a
 * stand-in relay when experimenting.
 */
public class ConsistentInMemoryDir implements EventuallyConsistentDirectory {

  private final NavigableMap<String, byte[]> entries = new TreeMap<>();

  @Override
  public synchronized Stream<String> list() {
    return new ArrayList<>(entries.keySet()).stream();
  }

  @Override
  public synchronized Stream<String> listAfter(String startAfter) {
    return new ArrayList<>(entries.tailMap(startAfter, false).keySet()).stream();
  }

  @Override
  public void createOrReplace(String name, InputStream stream) throws IOException {
    byte[] bytes = Util.read(stream);
    synchronized (this) {
      entries.put(name, bytes);
    }
  }

  @Override
  public InputStream open(String name) throws NoSuchFileException {
    byte[] data;
    synchronized (this) {
      data = entries.get(name);
    }
    if (data == null) {
      throw new NoSuchFileException(name);
    }
    return new ByteArrayInputStream(data);
  }

  public synchronized int size() {
    return entries.size();
  }

  @Override
  public synchronized String toString() {
    return entries.keySet().toString();
  }

}
