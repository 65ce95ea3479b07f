package rill.util;

// Little-endian get/set of primitives in raw byte arrays.  Every array the
// store and the raster writer touch is laid out this way.
public abstract class Bits {

  // Unsigned byte
  public static int get1( byte[] buf, int off ) { return 0xff&buf[off]; }

  public static int set2( byte[] buf, int off, int x ) {
    for( int i=0; i<2; i++ )
      buf[i+off] = (byte)(x>>(i<<3));
    return 2;
  }
  public static int get2( byte[] buf, int off ) {
    return (0xff&buf[off]) | ((0xff&buf[off+1])<<8);
  }

  public static int set4( byte[] buf, int off, int x ) {
    for( int i=0; i<4; i++ )
      buf[i+off] = (byte)(x>>(i<<3));
    return 4;
  }
  public static int get4( byte[] buf, int off ) {
    int sum=0;
    for( int i=0; i<4; i++ )
      sum |= (0xff&buf[off+i])<<(i<<3);
    return sum;
  }

  public static int set4f( byte[] buf, int off, float f ) { return set4(buf,off,Float.floatToRawIntBits(f)); }
  public static float get4f( byte[] buf, int off ) { return Float.intBitsToFloat(get4(buf,off)); }

  // Bulk conversions; 'bits' holds exactly the packed elements.
  public static float[] toFloats( byte[] bits ) {
    float[] fs = new float[bits.length>>2];
    for( int i=0; i<fs.length; i++ )
      fs[i] = get4f(bits,i<<2);
    return fs;
  }
  public static byte[] fromFloats( float[] fs ) {
    byte[] bits = new byte[fs.length<<2];
    for( int i=0; i<fs.length; i++ )
      set4f(bits,i<<2,fs[i]);
    return bits;
  }
  public static int[] toUnsigned( byte[] bits ) {
    int[] is = new int[bits.length];
    for( int i=0; i<is.length; i++ )
      is[i] = get1(bits,i);
    return is;
  }
}
