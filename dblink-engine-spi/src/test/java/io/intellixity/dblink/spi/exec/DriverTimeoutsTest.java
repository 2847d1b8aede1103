package io.intellixity.dblink.spi.exec;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

final class DriverTimeoutsTest {
  @Test
  void driverFiresBeforeTheDeadline() {
    Duration deadline = Duration.ofSeconds(2);
    Duration connect = DriverTimeouts.connectTimeout(deadline, null);
    assertEquals(Duration.ofMillis(1500), connect);
    assertEquals(deadline, DriverTimeouts.deadline(deadline, connect));
  }

  @Test
  void floorStretchesTheDeadline() {
    Duration deadline = Duration.ofMillis(300);
    Duration connect = DriverTimeouts.connectTimeout(deadline, Duration.ofMillis(250));
    assertEquals(Duration.ofMillis(250), connect);
    Duration stretched = DriverTimeouts.deadline(deadline, connect);
    assertTrue(stretched.compareTo(connect) > 0);
    assertEquals(Duration.ofMillis(350), stretched);
  }

  @Test
  void tinyDeadlineStillGivesPositiveTimeout() {
    assertEquals(Duration.ofMillis(1), DriverTimeouts.connectTimeout(Duration.ofNanos(1), null));
  }
}
