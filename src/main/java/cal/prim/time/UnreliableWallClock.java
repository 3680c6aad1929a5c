package cal.prim.time;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A wall clock can tell you the date and time.  Most ways of measuring wall
 * clock time (such as Java's <code>Instant.now()</code>) are unreliable: a
 * computer's notion of wall clock time can be wrong.  It can also change in
 * unexpected ways, with sudden jumps forward and backward.
 *
 * <p>Record timestamps come from a wall clock, which is why nothing in this
 * project uses them for chain integrity.  Parent links are canonical; the
 * timestamps only order records for display and drive the sync cursors.
 */
public interface UnreliableWallClock {
  Instant now();

  UnreliableWallClock SYSTEM_CLOCK = Instant::now;

  /**
   * A deterministic clock for tests.  The first sample is <code>start</code>,
   * and every later sample is <code>step</code> after the previous one.
   *
   * @param start the first instant to report
   * @param step the amount to advance between samples
   * @return a new clock
   */
  static UnreliableWallClock ticking(Instant start, Duration step) {
    AtomicReference<Instant> next = new AtomicReference<>(start);
    return () -> next.getAndUpdate(t -> t.plus(step));
  }
}
