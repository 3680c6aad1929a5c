package cal.prim.storage;

import cal.recsync.Util;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.stream.Stream;

/**
 * A directory on the local filesystem.  Writes go to a temporary file first and are then
 * renamed into place, so readers never observe a half-written entry.
 */
public class LocalDirectory implements EventuallyConsistentDirectory {

  private static final String TEMP_PREFIX = ".tmp-";

  private final Path dir;

  public LocalDirectory(Path dir) throws IOException {
    Files.createDirectories(dir);
    this.dir = dir;
  }

  @Override
  public Stream<String> list() throws IOException {
    List<String> result;
    try (Stream<Path> entries = Files.list(dir)) {
      result = entries
              .map(p -> p.getFileName().toString())
              .filter(name -> !name.startsWith(TEMP_PREFIX))
              .sorted()
              .toList();
    }
    return result.stream();
  }

  @Override
  public void createOrReplace(String name, InputStream data) throws IOException {
    Path tmp = Files.createTempFile(dir, TEMP_PREFIX, null);
    try {
      try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(tmp))) {
        Util.copyStream(data, out);
      }
      Files.move(tmp, dir.resolve(name), StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      try {
        Files.deleteIfExists(tmp);
      } catch (IOException onCleanup) {
        e.addSuppressed(onCleanup);
      }
      throw e;
    }
  }

  @Override
  public InputStream open(String name) throws IOException {
    return Files.newInputStream(dir.resolve(name));
  }

}
