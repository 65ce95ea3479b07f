package rill.ops;

import java.util.Iterator;
import java.util.NoSuchElementException;

import com.google.common.base.Preconditions;
import com.google.common.primitives.Ints;

/**
 * A half-open range [lo, hi) of a dataset's flat index space, the unit of a
 * single read or write.
 */
public final class Window {
  public final long _lo, _hi;

  public Window( long lo, long hi ) {
    Preconditions.checkArgument(0 <= lo && lo <= hi, "bad window [%s, %s)", lo, hi);
    _lo = lo;
    _hi = hi;
  }

  // Number of elements; a window is always small enough for one buffer
  public int len() { return Ints.checkedCast(_hi-_lo); }

  // Test aid: only the middle pair of an odd height overlaps
  public boolean overlaps( Window w ) { return _lo < w._hi && w._lo < _hi; }

  @Override public boolean equals( Object o ) {
    return o instanceof Window && ((Window)o)._lo == _lo && ((Window)o)._hi == _hi;
  }
  @Override public int hashCode() { return (int)(_lo*31+_hi); }
  @Override public String toString() { return "["+_lo+", "+_hi+")"; }

  /**
   * Consecutive windows of 'batch' elements covering [0, length); the last
   * one is short.
   */
  public static Iterable<Window> batches( final long length, final int batch ) {
    Preconditions.checkArgument(batch > 0, "batch must be positive, was %s", batch);
    Preconditions.checkArgument(length >= 0, "negative length %s", length);
    return new Iterable<Window>() {
      @Override public Iterator<Window> iterator() {
        return new Iterator<Window>() {
          long _next = 0;
          @Override public boolean hasNext() { return _next < length; }
          @Override public Window next() {
            if( !hasNext() ) throw new NoSuchElementException();
            long lo = _next;
            _next = Math.min(length, lo+batch);
            return new Window(lo,_next);
          }
          @Override public void remove() { throw new UnsupportedOperationException(); }
        };
      }
    };
  }
}
