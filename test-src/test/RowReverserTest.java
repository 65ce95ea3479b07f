package test;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import rill.Key;
import rill.ops.Outcome;
import rill.ops.Progress;
import rill.ops.RowReverser;
import rill.store.ArrayStore;
import rill.store.DatasetNotFoundException;
import rill.store.ElementType;
import rill.store.IceStore;
import rill.store.SizeMismatchException;

public class RowReverserTest extends TestUtil {

  @Test public void testOddHeight() throws Exception {
    ArrayStore s = store();
    putFloats(s,"/raw/sum", 1,2, 3,4, 5,6, 7,8, 9,10);
    Outcome o = new RowReverser(s,2,5,100).reverse(Key.make("/raw/sum"));
    assertEquals(Outcome.COMPUTED, o);
    assertFloats(new float[]{ 9,10, 7,8, 5,6, 3,4, 1,2 }, getFloats(s,"/raw/sum_rev"));
    // Input untouched
    assertFloats(new float[]{ 1,2, 3,4, 5,6, 7,8, 9,10 }, getFloats(s,"/raw/sum"));
  }

  @Test public void testSingleRow() throws Exception {
    ArrayStore s = store();
    putFloats(s,"/a", 1,2,3);
    assertEquals(Outcome.COMPUTED, new RowReverser(s,3,1,100).reverse(Key.make("/a")));
    assertFloats(new float[]{ 1,2,3 }, getFloats(s,"/a_rev"));
  }

  @Test public void testBatchSizeInvariance() throws Exception {
    final int w = 7, h = 23;
    float[] data = rowsOf(h,w);
    float[] expected = flipped(data,w);
    for( int batch : new int[]{ 1, 3, 12, 100 } ) { // 12 is the half height
      ArrayStore s = store();
      putFloats(s,"/d", data);
      new RowReverser(s,w,h,batch).reverse(Key.make("/d"));
      assertFloats(expected, getFloats(s,"/d_rev"));
    }
  }

  @Test public void testEvenHeightManyChunksUncompressed() throws Exception {
    final int w = 5, h = 40;
    ArrayStore s = store(12,0);
    float[] data = rowsOf(h,w);
    putFloats(s,"/g/x", data);
    new RowReverser(s,w,h,6).reverse(Key.make("/g/x"));
    assertFloats(flipped(data,w), getFloats(s,"/g/x_rev"));
  }

  // Reversing twice gives the input back, bit for bit
  @Test public void testInvolution() throws Exception {
    final int w = 4, h = 9;
    ArrayStore s = store();
    float[] data = rowsOf(h,w);
    data[5] = Float.NaN;
    data[6] = -0f;
    putFloats(s,"/once", data);
    RowReverser rr = new RowReverser(s,w,h,2);
    rr.reverse(Key.make("/once"));
    put(s,"/twice",ElementType.F32,get(s,"/once_rev"));
    rr.reverse(Key.make("/twice"));
    assertArrayEquals(get(s,"/once"), get(s,"/twice_rev"));
  }

  @Test public void testCountsKeepTheirType() throws Exception {
    ArrayStore s = store();
    putCounts(s,"/g/count", 0,1, 2,3, 255,7);
    new RowReverser(s,2,3,1).reverse(Key.make("/g/count"));
    assertEquals(ElementType.U8, s.open("/g/count_rev").type());
    assertArrayEquals(new int[]{ 255,7, 2,3, 0,1 }, getCounts(s,"/g/count_rev"));
  }

  @Test public void testExistingOutputIsLeftAlone() throws Exception {
    ArrayStore s = store();
    putFloats(s,"/d", 1,2,3,4);
    RowReverser rr = new RowReverser(s,2,2,100);
    assertEquals(Outcome.COMPUTED, rr.reverse(Key.make("/d")));
    // Scribble on the output; a recompute would overwrite it
    s.open("/d_rev").writeFloats(0,new float[]{ 42 });
    byte[] before = get(s,"/d_rev");
    assertEquals(Outcome.ALREADY_DONE, rr.reverse(Key.make("/d")));
    assertArrayEquals(before, get(s,"/d_rev"));
  }

  @Test public void testReversedInputIsRefused() throws Exception {
    ArrayStore s = store();
    putFloats(s,"/d_rev", 1,2,3,4);
    assertEquals(Outcome.NOT_APPLICABLE, new RowReverser(s,2,2,100).reverse(Key.make("/d_rev")));
    assertFalse(s.exists("/d_rev_rev"));
  }

  @Test public void testSizeMismatch() throws Exception {
    ArrayStore s = store();
    putFloats(s,"/d", 1,2,3,4,5);
    try {
      new RowReverser(s,2,2,100).reverse(Key.make("/d"));
      fail("expected a size mismatch");
    } catch( SizeMismatchException e ) {
      assertEquals(Key.make("/d"), e._key);
      assertEquals(4, e._expected);
      assertEquals(5, e._actual);
    }
    assertFalse(s.exists("/d_rev"));
  }

  @Test(expected = DatasetNotFoundException.class)
  public void testMissingInput() throws Exception {
    new RowReverser(store(),2,2,100).reverse(Key.make("/nope"));
  }

  // A crashed run leaves a staged output; the next run starts it afresh
  @Test public void testStaleStagedOutputIsDiscarded() throws Exception {
    IceStore s = store();
    putFloats(s,"/d", 1,2,3,4);
    s.create(Key.make("/d_rev"),ElementType.F32,4).writeFloats(0,new float[]{ 9,9,9,9 });
    assertFalse(s.exists("/d_rev"));
    assertEquals(Outcome.COMPUTED, new RowReverser(s,2,2,100).reverse(Key.make("/d")));
    assertFloats(new float[]{ 3,4,1,2 }, getFloats(s,"/d_rev"));
  }

  // Reported after each batch, ending at the half height
  @Test public void testProgressRisesToTheTotal() throws Exception {
    ArrayStore s = store();
    putFloats(s,"/d", rowsOf(11,3));
    final List<long[]> calls = new ArrayList<long[]>();
    new RowReverser(s,3,11,2).progress(new Progress() {
        @Override public void update( long done, long total ) { calls.add(new long[]{ done, total }); }
      }).reverse(Key.make("/d"));
    assertEquals(3, calls.size());      // One call after each batch of 2 rows
    assertEquals(2, calls.get(0)[0]);
    long last = -1;
    for( long[] c : calls ) {
      assertEquals(6, c[1]);
      assertTrue(c[0] > last);
      last = c[0];
    }
    assertEquals(6, last);
  }
}
