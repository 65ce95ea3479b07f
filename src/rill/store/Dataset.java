package rill.store;

import java.io.IOException;

import rill.Key;
import rill.util.Bits;

/**
 * A leaf of the array store: a flat, fixed-length sequence of fixed-width
 * elements.  Any 2-D shape is implied by the caller; the store only knows the
 * flat index space [0, length).
 *
 * Reads and writes move whole elements as raw little-endian bytes, so moving
 * data between datasets of the same type is bit-exact.
 *
 * A dataset handed out by {@link ArrayStore#create} is staged: it is invisible
 * to {@link ArrayStore#exists} until {@link #commit()} is called.
 */
public abstract class Dataset {
  public final Key _key;
  public final ElementType _type;
  public final long _length;    // Number of elements

  protected Dataset( Key key, ElementType type, long length ) {
    _key = key;
    _type = type;
    _length = length;
  }

  public long length() { return _length; }
  public ElementType type() { return _type; }

  // Read elements [off, off+len) as packed bytes
  public abstract byte[] read( long off, int len ) throws IOException;
  // Write packed elements starting at element 'off'
  public abstract void write( long off, byte[] bits ) throws IOException;

  // True for an output not yet committed
  public abstract boolean isStaged();
  // Publish a staged output under its final key, atomically
  public abstract void commit() throws IOException;

  public float[] readFloats( long off, int len ) throws IOException {
    expect(ElementType.F32);
    return Bits.toFloats(read(off,len));
  }
  public void writeFloats( long off, float[] fs ) throws IOException {
    expect(ElementType.F32);
    write(off,Bits.fromFloats(fs));
  }
  public int[] readUnsigned( long off, int len ) throws IOException {
    expect(ElementType.U8);
    return Bits.toUnsigned(read(off,len));
  }

  private void expect( ElementType t ) throws IOException {
    if( _type != t )
      throw new IOException("dataset "+_key+" holds "+_type+", not "+t);
  }

  // Fail on a range that leaves [0, length), or on a ragged byte buffer
  protected void check_range( long off, long len ) throws IOException {
    if( off < 0 || len < 0 || off+len > _length )
      throw new IOException("range ["+off+", "+(off+len)+") outside "+_key+" of length "+_length);
  }
  protected long elements( byte[] bits ) throws IOException {
    if( bits.length % _type._width != 0 )
      throw new IOException(bits.length+" bytes is not a whole number of "+_type+" elements");
    return bits.length/_type._width;
  }

  @Override public String toString() {
    return _key+" ["+_type+" x "+_length+(isStaged() ? ", staged" : "")+"]";
  }
}
