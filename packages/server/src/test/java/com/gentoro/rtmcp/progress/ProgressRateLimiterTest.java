package com.gentoro.rtmcp.progress;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ProgressRateLimiterTest {

  @Test
  void allowsFirstEventAndDeltaBasedEvents() {
    ProgressRateLimiter limiter = new ProgressRateLimiter(300, 2);

    // t=0, first event must pass
    assertTrue(limiter.admit(0, 0));

    // within interval and below delta -> blocked
    assertFalse(limiter.admit(100, 1));

    // delta reached -> allowed
    assertTrue(limiter.admit(150, 2));

    // interval elapsed -> allowed even without delta
    assertTrue(limiter.admit(500, 2));
  }

  @Test
  void everyPageOfABulkSearchPassesWithUnitDelta() {
    ProgressRateLimiter limiter = new ProgressRateLimiter(10_000, 1);

    assertTrue(limiter.admit(0, 0));
    assertTrue(limiter.admit(1, 100));
    assertTrue(limiter.admit(2, 200));
    assertFalse(limiter.admit(3, 200));
  }

  @Test
  void negativeSettingsAreClampedToZero() {
    ProgressRateLimiter limiter = new ProgressRateLimiter(-5, -1);

    assertTrue(limiter.admit(0, 0));
    assertTrue(limiter.admit(0, 0));
  }
}
