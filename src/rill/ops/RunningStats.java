package rill.ops;

import java.io.IOException;
import java.util.List;
import java.util.logging.Logger;

import com.google.common.base.Preconditions;

import rill.Key;
import rill.store.ArrayStore;
import rill.store.Dataset;
import rill.store.ElementType;
import rill.store.SizeMismatchException;

/**
 * Per-cell mean and standard deviation from running accumulators.
 *
 * A group holds three parallel datasets: sum and sum-of-squares (F32) and the
 * count of observations (U8) of every cell.  From them this computes, in
 * batches and entirely in float arithmetic,
 * <pre>
 *   mean = sum / count
 *   sd   = sqrt( (sumsq - sum*sum/count) / (count - 1) )
 * </pre>
 * the Bessel-corrected sample deviation.  Cells with fewer than
 * {@code minCount} (at least 1) observations get the sentinel sd of -1.  With the default
 * minCount of 1 only empty cells are masked; a single-observation cell then
 * divides by zero and yields NaN or infinity.  Their mean is left as the
 * IEEE result of dividing by zero.
 *
 * Inputs are the reversed accumulators ({@code <group>/sum_rev} etc.), the
 * outputs {@code <group>/mean_rev} and {@code <group>/sd_rev}.
 */
public class RunningStats {
  private static final Logger LOG = Logger.getLogger(RunningStats.class.getName());

  public static final int DEFAULT_BATCH = 1000000;
  public static final float SENTINEL = -1f;

  public static final String SUM   = "sum";
  public static final String SUMSQ = "sumsq";
  public static final String COUNT = "count";
  public static final String MEAN  = "mean";
  public static final String SD    = "sd";

  final ArrayStore _store;
  final int _batch;             // Elements per batch
  final int _minCount;          // Cells counting less get the sentinel sd
  Progress _progress = Progress.NONE;

  public RunningStats( ArrayStore store, int batch, int minCount ) {
    Preconditions.checkArgument(batch > 0, "batch must be positive, was %s", batch);
    Preconditions.checkArgument(minCount >= 1, "minimum count must be at least 1, was %s", minCount);
    _store = store;
    _batch = batch;
    _minCount = minCount;
  }
  public RunningStats( ArrayStore store ) { this(store,DEFAULT_BATCH,1); }

  public RunningStats progress( Progress p ) { _progress = p; return this; }

  public static Key key( Key group, String stat ) { return group.child(stat+RowReverser.SUFFIX); }

  /**
   * True if a group holds any accumulator, raw or reversed.  Other groups are
   * plain containers.
   */
  public static boolean isAccumulatorGroup( ArrayStore store, Key group ) throws IOException {
    List<String> members = store.members(group);
    for( String s : new String[]{SUM,SUMSQ,COUNT} )
      if( members.contains(s) || members.contains(s+RowReverser.SUFFIX) )
        return true;
    return false;
  }

  /** Write mean and sd for 'group', unless its mean already exists. */
  public Outcome reduce( Key group ) throws IOException {
    final Key meanKey = key(group,MEAN), sdKey = key(group,SD);
    if( _store.exists(meanKey) ) return Outcome.ALREADY_DONE;

    Dataset sum   = input(key(group,SUM  ),ElementType.F32);
    Dataset sumsq = input(key(group,SUMSQ),ElementType.F32);
    Dataset count = input(key(group,COUNT),ElementType.U8 );
    final long n = sum.length();
    if( sumsq.length() != n ) throw new SizeMismatchException(sumsq._key,n,sumsq.length());
    if( count.length() != n ) throw new SizeMismatchException(count._key,n,count.length());

    // The sd is committed before the mean, so an sd without a mean is from
    // an interrupted run.
    if( _store.exists(sdKey) ) {
      LOG.warning("Removing "+sdKey+" left without "+meanKey);
      _store.remove(sdKey);
    }
    Dataset sd   = _store.create(sdKey  ,ElementType.F32,n);
    Dataset mean = _store.create(meanKey,ElementType.F32,n);
    for( Window w : Window.batches(n,_batch) ) {
      final int len = w.len();
      float[] m = new float[len], d = new float[len];
      reduce(sum.readFloats(w._lo,len), sumsq.readFloats(w._lo,len),
             count.readUnsigned(w._lo,len), _minCount, m, d);
      mean.writeFloats(w._lo,m);
      sd  .writeFloats(w._lo,d);
      _progress.update(w._hi,n);
    }
    sd.commit();
    mean.commit();
    LOG.fine("Mean and sd of "+n+" cells written for "+group);
    return Outcome.COMPUTED;
  }

  private Dataset input( Key k, ElementType t ) throws IOException {
    Dataset ds = _store.open(k);
    if( ds.type() != t )
      throw new SizeMismatchException(k,"dataset "+k+" holds "+ds.type()+", expected "+t);
    return ds;
  }

  /**
   * One batch.  The mask is taken from the integer counts, before they are
   * turned into floats.
   */
  public static void reduce( float[] sum, float[] sumsq, int[] count, int minCount,
                             float[] mean, float[] sd ) {
    for( int i=0; i<count.length; i++ ) {
      boolean masked = count[i] < minCount;
      float c = count[i];
      float s = sum[i];
      mean[i] = s/c;
      float var = (sumsq[i] - s*s/c)/(c - 1f);
      sd[i] = masked ? SENTINEL : (float)Math.sqrt(var);
    }
  }
}
