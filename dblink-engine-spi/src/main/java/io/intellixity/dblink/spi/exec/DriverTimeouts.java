package io.intellixity.dblink.spi.exec;

import java.time.Duration;
import java.util.Objects;

/**
 * Splits an operation deadline into the driver's own connect timeout and the bridge deadline.
 * The driver timeout always fires first, so an unreachable server is reported by the driver
 * as a connection failure rather than by the bridge as a timeout.
 */
public final class DriverTimeouts {
  /** Headroom the bridge keeps over the driver's timeout. */
  static final Duration MIN_HEADROOM = Duration.ofMillis(100);

  private DriverTimeouts() {}

  /** Three quarters of {@code deadline}, but never below {@code floor}. */
  public static Duration connectTimeout(Duration deadline, Duration floor) {
    Objects.requireNonNull(deadline, "deadline");
    Duration d = deadline.multipliedBy(3).dividedBy(4);
    if (floor != null && d.compareTo(floor) < 0) d = floor;
    return d.isZero() ? Duration.ofMillis(1) : d;
  }

  /** {@code deadline}, stretched when the driver's floor leaves it no headroom. */
  public static Duration deadline(Duration deadline, Duration connectTimeout) {
    Objects.requireNonNull(deadline, "deadline");
    Duration min = connectTimeout.plus(MIN_HEADROOM);
    return (deadline.compareTo(min) < 0) ? min : deadline;
  }
}
