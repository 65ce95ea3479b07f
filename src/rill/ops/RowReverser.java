package rill.ops;

import java.io.IOException;
import java.util.logging.Logger;

import com.google.common.base.Preconditions;

import rill.Key;
import rill.store.ArrayStore;
import rill.store.Dataset;
import rill.store.SizeMismatchException;

/**
 * Reverse the row order of a flattened row-major (height, width) dataset into
 * a new dataset named with the "_rev" suffix, never holding more than two
 * batches of rows in memory.
 *
 * Rows are processed as {@link MirrorPair}s: the forward batch from the top
 * and its mirror from the bottom are read, each is flipped in place, and each
 * is written to the other's position in the output.
 */
public class RowReverser {
  private static final Logger LOG = Logger.getLogger(RowReverser.class.getName());

  public static final String SUFFIX = "_rev";
  public static final int DEFAULT_ROWS = 100;

  final ArrayStore _store;
  final long _width, _height;
  final int _rows;              // Rows per batch
  Progress _progress = Progress.NONE;

  public RowReverser( ArrayStore store, long width, long height, int rows ) {
    Preconditions.checkArgument(width > 0 && height > 0, "bad shape %s x %s", width, height);
    Preconditions.checkArgument(rows > 0, "rows per batch must be positive, was %s", rows);
    _store = store;
    _width = width;
    _height = height;
    _rows = rows;
  }

  public RowReverser progress( Progress p ) { _progress = p; return this; }

  // Key of the reversed twin of 'src'
  public static Key reversed( Key src ) { return src.suffixed(SUFFIX); }

  /**
   * Write the row-reversed twin of dataset 'src'.  A source that is itself a
   * reversed twin is refused, and an existing twin is left alone.
   */
  public Outcome reverse( Key src ) throws IOException {
    if( src.name().endsWith(SUFFIX) ) return Outcome.NOT_APPLICABLE;
    Key dst = reversed(src);
    if( _store.exists(dst) ) return Outcome.ALREADY_DONE;

    Dataset in = _store.open(src);
    if( in.length() != _width*_height )
      throw new SizeMismatchException(src,_width*_height,in.length());
    // Batch buffers must fit; fail before creating anything
    in.type().bytes((long)_rows*_width);

    Dataset out = _store.create(dst,in.type(),in.length());
    final int rowBytes = in.type().bytes(_width);
    final long half = MirrorPair.half(_height);
    for( MirrorPair p : MirrorPair.pairs(_height,_width,_rows) ) {
      Window fw = p.forward();
      byte[] fwd = MirrorPair.flip(in.read(fw._lo,fw.len()),p._rows,rowBytes);
      if( p.coincident() ) {    // The middle row, alone
        out.write(fw._lo,fwd);
      } else {
        Window mw = p.mirror();
        byte[] rev = MirrorPair.flip(in.read(mw._lo,mw.len()),p._rows,rowBytes);
        out.write(fw._lo,rev);
        out.write(mw._lo,fwd);
      }
      _progress.update(p._row+p._rows,half);
    }
    out.commit();
    LOG.fine("Reversed "+_height+" rows of "+src+" into "+dst);
    return Outcome.COMPUTED;
  }
}
