package cal.recsync.impls;

import cal.prim.NoValue;
import cal.prim.PreconditionFailed;
import cal.recsync.Util;
import cal.recsync.crypto.EncryptedData;
import cal.recsync.types.HostId;
import cal.recsync.types.Record;
import cal.recsync.types.RecordStore;
import cal.recsync.types.SyncCheckpoint;
import org.checkerframework.checker.calledmethods.qual.EnsuresCalledMethods;
import org.checkerframework.checker.mustcall.qual.Owning;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * A {@link RecordStore} atop a SQLite database in a local file.
 *
 * <p>Every method runs in its own serializable transaction, and all methods
 * are <code>synchronized</code>, so pushes to the same chain from one process
 * are serialized.  {@link #pushIfTail(Record)} reads the tail and inserts in
 * one transaction, which also protects the chain against other processes
 * using the same file.
 */
public class SqliteRecordStore implements RecordStore, SyncCheckpoint, Closeable {

  private static final String COLUMNS = "id, host, parent, tag, version, timestamp, data, cek";

  private static final String TAIL_QUERY =
          "SELECT " + COLUMNS + " FROM records r WHERE r.host=? AND r.tag=? " +
          "AND NOT EXISTS (SELECT 1 FROM records c WHERE c.parent=r.id AND c.host=r.host AND c.tag=r.tag) " +
          "ORDER BY r.timestamp DESC, r.id DESC LIMIT 1";

  private static final String LAST_SYNC_KEY = "last_sync";

  @Owning
  private final Connection conn;

  public SqliteRecordStore(Path filename) throws SQLException, IOException {
    Path parent = filename.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }

    Connection conn = DriverManager.getConnection("jdbc:sqlite:" + filename.toAbsolutePath());
    try {
      conn.setAutoCommit(false);
      conn.setTransactionIsolation(Connection.TRANSACTION_SERIALIZABLE);

      try (Statement stmt = conn.createStatement()) {
        stmt.executeUpdate("CREATE TABLE IF NOT EXISTS records (" +
                "id TEXT PRIMARY KEY, " +
                "host TEXT NOT NULL, " +
                "parent TEXT, " +
                "tag TEXT NOT NULL, " +
                "version TEXT NOT NULL, " +
                "timestamp INTEGER NOT NULL, " + // nanoseconds since the epoch
                "data TEXT NOT NULL, " +
                "cek TEXT NOT NULL)");
        stmt.executeUpdate("CREATE INDEX IF NOT EXISTS records_chain ON records (host, tag, timestamp)");
        stmt.executeUpdate("CREATE INDEX IF NOT EXISTS records_parent ON records (parent)");
        stmt.executeUpdate("CREATE INDEX IF NOT EXISTS records_timestamp ON records (timestamp)");
        stmt.executeUpdate("CREATE TABLE IF NOT EXISTS meta (key TEXT PRIMARY KEY, value TEXT NOT NULL) WITHOUT ROWID");
      }
      try (PreparedStatement stmt = conn.prepareStatement("INSERT OR IGNORE INTO meta (key, value) VALUES (?, ?)")) {
        stmt.setString(1, LAST_SYNC_KEY);
        stmt.setString(2, Long.toString(Util.toEpochNanos(Instant.EPOCH)));
        stmt.executeUpdate();
      }
      conn.commit();
    } catch (Exception e) {
      try {
        conn.close();
      } catch (Exception onClose) {
        e.addSuppressed(onClose);
      }
      throw e;
    }

    this.conn = conn;
  }

  private IOException abort(SQLException e) {
    try {
      conn.rollback();
    } catch (SQLException onRollback) {
      e.addSuppressed(onRollback);
    }
    return new IOException(e);
  }

  private void rollback() throws SQLException {
    conn.rollback();
  }

  private static Record<EncryptedData> readRecord(ResultSet rs) throws SQLException {
    return new Record<>(
            rs.getString("id"),
            new HostId(rs.getString("host")),
            rs.getString("parent"),
            rs.getString("tag"),
            rs.getString("version"),
            Util.fromEpochNanos(rs.getLong("timestamp")),
            new EncryptedData(rs.getString("data"), rs.getString("cek")));
  }

  private static List<Record<EncryptedData>> readAll(PreparedStatement stmt) throws SQLException {
    List<Record<EncryptedData>> result = new ArrayList<>();
    try (ResultSet rs = stmt.executeQuery()) {
      while (rs.next()) {
        result.add(readRecord(rs));
      }
    }
    return result;
  }

  private @Nullable Record<EncryptedData> queryTail(HostId host, String tag) throws SQLException {
    try (PreparedStatement stmt = conn.prepareStatement(TAIL_QUERY)) {
      stmt.setString(1, host.value());
      stmt.setString(2, tag);
      try (ResultSet rs = stmt.executeQuery()) {
        return rs.next() ? readRecord(rs) : null;
      }
    }
  }

  private boolean exists(String id) throws SQLException {
    try (PreparedStatement stmt = conn.prepareStatement("SELECT 1 FROM records WHERE id=?")) {
      stmt.setString(1, id);
      try (ResultSet rs = stmt.executeQuery()) {
        return rs.next();
      }
    }
  }

  private void insert(Record<EncryptedData> record) throws SQLException {
    try (PreparedStatement stmt = conn.prepareStatement("INSERT INTO records (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?)")) {
      stmt.setString(1, record.id());
      stmt.setString(2, record.host().value());
      stmt.setString(3, record.parent());
      stmt.setString(4, record.tag());
      stmt.setString(5, record.version());
      stmt.setLong(6, Util.toEpochNanos(record.timestamp()));
      stmt.setString(7, record.data().data());
      stmt.setString(8, record.data().contentEncryptionKey());
      stmt.executeUpdate();
    }
  }

  @Override
  public synchronized long len(HostId host, String tag) throws IOException {
    try (PreparedStatement stmt = conn.prepareStatement("SELECT COUNT(*) FROM records WHERE host=? AND tag=?")) {
      stmt.setString(1, host.value());
      stmt.setString(2, tag);
      long n;
      try (ResultSet rs = stmt.executeQuery()) {
        n = rs.next() ? rs.getLong(1) : 0;
      }
      conn.commit();
      return n;
    } catch (SQLException e) {
      throw abort(e);
    }
  }

  @Override
  public synchronized Record<EncryptedData> last(HostId host, String tag) throws IOException, NoValue {
    Record<EncryptedData> tail;
    try {
      tail = queryTail(host, tag);
      conn.commit();
    } catch (SQLException e) {
      throw abort(e);
    }
    if (tail == null) {
      throw new NoValue("no records for " + host + '/' + tag);
    }
    return tail;
  }

  @Override
  public synchronized Record<EncryptedData> get(String id) throws IOException, NoValue {
    List<Record<EncryptedData>> found;
    try (PreparedStatement stmt = conn.prepareStatement("SELECT " + COLUMNS + " FROM records WHERE id=?")) {
      stmt.setString(1, id);
      found = readAll(stmt);
      conn.commit();
    } catch (SQLException e) {
      throw abort(e);
    }
    if (found.isEmpty()) {
      throw new NoValue("no record " + id);
    }
    return found.get(0);
  }

  @Override
  public synchronized void push(Record<EncryptedData> record) throws IOException {
    try {
      if (exists(record.id())) {
        rollback();
        throw new IllegalArgumentException("record " + record.id() + " already exists");
      }
      insert(record);
      conn.commit();
    } catch (SQLException e) {
      throw abort(e);
    }
  }

  @Override
  public synchronized void pushIfTail(Record<EncryptedData> record) throws IOException, PreconditionFailed {
    try {
      Record<EncryptedData> tail = queryTail(record.host(), record.tag());
      String tailId = tail == null ? null : tail.id();
      if (!Objects.equals(tailId, record.parent())) {
        rollback();
        throw new PreconditionFailed("expected tail " + record.parent() + " but tail is currently " + tailId);
      }
      if (exists(record.id())) {
        rollback();
        throw new IllegalArgumentException("record " + record.id() + " already exists");
      }
      insert(record);
      conn.commit();
    } catch (SQLException e) {
      throw abort(e);
    }
  }

  @Override
  public synchronized long count() throws IOException {
    try (Statement stmt = conn.createStatement()) {
      long n;
      try (ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM records")) {
        n = rs.next() ? rs.getLong(1) : 0;
      }
      conn.commit();
      return n;
    } catch (SQLException e) {
      throw abort(e);
    }
  }

  @Override
  public synchronized List<HostId> hosts() throws IOException {
    try (Statement stmt = conn.createStatement()) {
      List<HostId> result = new ArrayList<>();
      try (ResultSet rs = stmt.executeQuery("SELECT DISTINCT host FROM records ORDER BY host")) {
        while (rs.next()) {
          result.add(new HostId(rs.getString(1)));
        }
      }
      conn.commit();
      return result;
    } catch (SQLException e) {
      throw abort(e);
    }
  }

  @Override
  public synchronized List<Record<EncryptedData>> before(Instant cursor, @Nullable String cursorId, int limit) throws IOException {
    try (PreparedStatement stmt = conn.prepareStatement("SELECT " + COLUMNS + " FROM records WHERE timestamp < ? OR (timestamp = ? AND id < ?) ORDER BY timestamp DESC, id DESC LIMIT ?")) {
      long nanos = Util.toEpochNanos(cursor);
      stmt.setLong(1, nanos);
      stmt.setLong(2, nanos);
      // no id is less than the empty string
      stmt.setString(3, cursorId == null ? "" : cursorId);
      stmt.setInt(4, limit);
      List<Record<EncryptedData>> result = readAll(stmt);
      conn.commit();
      return result;
    } catch (SQLException e) {
      throw abort(e);
    }
  }

  @Override
  public synchronized int saveBulk(Collection<Record<EncryptedData>> records) throws IOException {
    int added = 0;
    try {
      for (var record : records) {
        if (!exists(record.id())) {
          insert(record);
          ++added;
        }
      }
      conn.commit();
    } catch (SQLException e) {
      throw abort(e);
    }
    return added;
  }

  @Override
  public synchronized List<Record<EncryptedData>> scan(@Nullable String afterId, int limit) throws IOException {
    try (PreparedStatement stmt = conn.prepareStatement("SELECT " + COLUMNS + " FROM records WHERE id > ? ORDER BY id LIMIT ?")) {
      stmt.setString(1, afterId == null ? "" : afterId);
      stmt.setInt(2, limit);
      List<Record<EncryptedData>> result = readAll(stmt);
      conn.commit();
      return result;
    } catch (SQLException e) {
      throw abort(e);
    }
  }

  @Override
  public synchronized void rewrap(String id, EncryptedData expected, EncryptedData replacement) throws IOException, NoValue, PreconditionFailed {
    if (!expected.data().equals(replacement.data())) {
      throw new IllegalArgumentException("rewrap may not change the ciphertext of " + id);
    }
    try {
      if (!exists(id)) {
        rollback();
        throw new NoValue("no record " + id);
      }
      try (PreparedStatement stmt = conn.prepareStatement("UPDATE records SET cek=? WHERE id=? AND data=? AND cek=?")) {
        stmt.setString(1, replacement.contentEncryptionKey());
        stmt.setString(2, id);
        stmt.setString(3, expected.data());
        stmt.setString(4, expected.contentEncryptionKey());
        int rowsChanged = stmt.executeUpdate();
        switch (rowsChanged) {
          case 1:
            conn.commit();
            return;
          case 0:
            rollback();
            throw new PreconditionFailed("record " + id + " changed concurrently");
          default:
            throw new IllegalStateException("updated " + rowsChanged + " rows; should have been 0 or 1!");
        }
      }
    } catch (SQLException e) {
      throw abort(e);
    }
  }

  @Override
  public synchronized Instant lastSync() throws IOException {
    try (PreparedStatement stmt = conn.prepareStatement("SELECT value FROM meta WHERE key=?")) {
      stmt.setString(1, LAST_SYNC_KEY);
      String value = null;
      try (ResultSet rs = stmt.executeQuery()) {
        if (rs.next()) {
          value = rs.getString(1);
        }
      }
      conn.commit();
      return value == null ? Instant.EPOCH : Util.fromEpochNanos(Long.parseLong(value));
    } catch (SQLException e) {
      throw abort(e);
    } catch (NumberFormatException e) {
      throw new IOException("corrupt last sync time", e);
    }
  }

  @Override
  public synchronized void recordSync(Instant expected, Instant next) throws IOException, PreconditionFailed {
    try (PreparedStatement stmt = conn.prepareStatement("UPDATE meta SET value=? WHERE key=? AND value=?")) {
      stmt.setString(1, Long.toString(Util.toEpochNanos(next)));
      stmt.setString(2, LAST_SYNC_KEY);
      stmt.setString(3, Long.toString(Util.toEpochNanos(expected)));
      int rowsChanged = stmt.executeUpdate();
      switch (rowsChanged) {
        case 1:
          conn.commit();
          return;
        case 0:
          rollback();
          throw new PreconditionFailed("last sync time is no longer " + expected);
        default:
          throw new IllegalStateException("updated " + rowsChanged + " rows; should have been 0 or 1!");
      }
    } catch (SQLException e) {
      throw abort(e);
    }
  }

  @Override
  @EnsuresCalledMethods(value = "conn", methods = {"close"})
  public void close() throws IOException {
    try {
      conn.close();
    } catch (SQLException e) {
      throw new IOException(e);
    }
  }

}
