package rill.store;

/**
 * Fixed-width element types a dataset can hold.  Values are stored
 * little-endian.
 */
public enum ElementType {
  U8 (1),     // unsigned 8-bit: counts & masks
  F32(4);     // 32-bit IEEE float: sums, sums-of-squares, means, deviations

  public final int _width;      // Bytes per element
  ElementType( int width ) { _width = width; }

  // Byte length of 'n' elements, failing if it does not fit a single buffer
  public int bytes( long n ) {
    long b = n*_width;
    if( b > Integer.MAX_VALUE-8 )
      throw new IllegalArgumentException(n+" "+this+" elements do not fit a single buffer");
    return (int)b;
  }
}
