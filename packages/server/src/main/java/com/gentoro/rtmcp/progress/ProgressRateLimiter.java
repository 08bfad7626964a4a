package com.gentoro.rtmcp.progress;

/**
 * Throttles intermediate progress steps. A step is admitted when it is the first one, when
 * {@code minIntervalMs} passed since the last admitted step, or when the counter moved by at least
 * {@code minDelta}.
 */
public class ProgressRateLimiter {
  private final long minIntervalMs;
  private final long minDelta;

  private boolean primed;
  private long lastAt;
  private long lastCompleted;

  public ProgressRateLimiter(long minIntervalMs, long minDelta) {
    this.minIntervalMs = Math.max(0, minIntervalMs);
    this.minDelta = Math.max(0, minDelta);
  }

  public synchronized boolean admit(long nowMs, long completed) {
    if (primed
        && nowMs - lastAt < minIntervalMs
        && Math.abs(completed - lastCompleted) < minDelta) {
      return false;
    }
    primed = true;
    lastAt = nowMs;
    lastCompleted = completed;
    return true;
  }
}
