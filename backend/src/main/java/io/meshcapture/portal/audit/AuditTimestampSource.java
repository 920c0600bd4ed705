package io.meshcapture.portal.audit;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.stereotype.Component;

/**
 * Issues audit timestamps from one clock. Each instance keeps its own high-water mark: a reading
 * that does not advance past the last issued timestamp is bumped by one microsecond, so timestamps
 * issued by the same source are strictly increasing.
 */
@Component
public class AuditTimestampSource {

  private final Clock clock;
  private final AtomicReference<Instant> lastIssued = new AtomicReference<>(Instant.MIN);

  public AuditTimestampSource() {
    this(Clock.systemUTC());
  }

  public AuditTimestampSource(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public Instant next() {
    // microsecond resolution matches the timestamptz column
    Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
    return lastIssued.updateAndGet(
        last -> now.isAfter(last) ? now : last.plus(1, ChronoUnit.MICROS));
  }
}
