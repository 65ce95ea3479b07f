package rill;

import java.util.concurrent.TimeUnit;

// Wall-clock stopwatch, started on creation
public class Timer {
  public final long _start = System.nanoTime();

  // Elapsed milliseconds
  public long time() { return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - _start); }

  @Override public String toString() { return toHuman(time()); }

  // 01:02:03.456, hours always shown
  public static String toHuman( long msecs ) {
    long s = msecs/1000;
    return String.format("%02d:%02d:%02d.%03d", s/3600, (s/60)%60, s%60, msecs%1000);
  }
}
