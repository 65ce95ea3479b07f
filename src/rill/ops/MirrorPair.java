package rill.ops;

import java.util.Iterator;
import java.util.NoSuchElementException;

import com.google.common.base.Preconditions;

/**
 * Mirror pairs for row reversal of a row-major (height, width) array.
 *
 * A pair is a forward batch of rows [row, row+rows) from the top half and the
 * batch at the exact mirror position from the bottom, [height-row-rows,
 * height-row).  Reversing the rows within each batch and writing each one to
 * the other's position reverses the whole array; walking the forward batches
 * over the top ceil(height/2) rows covers every row exactly once.
 *
 * The two batches are disjoint except in the last pair of an odd height,
 * where both contain the middle row.  That row is its own mirror, so both
 * cross-writes put the same bytes there.
 */
public final class MirrorPair {
  public final long _row;       // First forward row
  public final int  _rows;      // Rows in each batch
  public final long _mirror;    // First row of the mirror batch
  public final long _width;     // Elements per row

  MirrorPair( long row, int rows, long mirror, long width ) {
    _row = row;
    _rows = rows;
    _mirror = mirror;
    _width = width;
  }

  // Element windows of both batches
  public Window forward() { return new Window(_row*_width, (_row+_rows)*_width); }
  public Window mirror () { return new Window(_mirror*_width, (_mirror+_rows)*_width); }

  // Forward and mirror batch are the same rows (only the middle row of an
  // odd height, in batches of one row)
  public boolean coincident() { return _row == _mirror; }

  @Override public String toString() {
    return "rows "+_row+"+"+_rows+" <-> "+_mirror+"+"+_rows;
  }

  // Rows in the top half, the middle row included: ceil(height/2)
  public static long half( long height ) { return (height+1)/2; }

  /** The pair whose forward batch starts at 'row', at most 'batch' rows. */
  public static MirrorPair at( long height, long width, long row, int batch ) {
    final long half = half(height);
    Preconditions.checkArgument(0 <= row && row < half, "row %s not in top half [0, %s)", row, half);
    int rows = (int)Math.min(batch, half-row);
    return new MirrorPair(row, rows, height-row-rows, width);
  }

  /** All pairs of an array, top to middle, in batches of 'batch' rows. */
  public static Iterable<MirrorPair> pairs( final long height, final long width, final int batch ) {
    Preconditions.checkArgument(height >= 0 && width > 0, "bad shape %s x %s", height, width);
    Preconditions.checkArgument(batch > 0, "batch must be positive, was %s", batch);
    final long half = half(height);
    return new Iterable<MirrorPair>() {
      @Override public Iterator<MirrorPair> iterator() {
        return new Iterator<MirrorPair>() {
          long _yy = 0;
          @Override public boolean hasNext() { return _yy < half; }
          @Override public MirrorPair next() {
            if( !hasNext() ) throw new NoSuchElementException();
            MirrorPair p = at(height,width,_yy,batch);
            _yy += p._rows;
            return p;
          }
          @Override public void remove() { throw new UnsupportedOperationException(); }
        };
      }
    };
  }

  /**
   * Reverse the order of 'rows' rows of 'rowBytes' bytes each in a flat
   * buffer: row i lands at row rows-1-i.
   */
  public static byte[] flip( byte[] bits, int rows, int rowBytes ) {
    Preconditions.checkArgument(bits.length == rows*rowBytes,
                                "%s bytes is not %s rows of %s", bits.length, rows, rowBytes);
    byte[] res = new byte[bits.length];
    for( int i=0; i<rows; i++ )
      System.arraycopy(bits, i*rowBytes, res, (rows-1-i)*rowBytes, rowBytes);
    return res;
  }
}
