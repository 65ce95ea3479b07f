package rill.raster;

import java.io.Closeable;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import org.gdal.gdal.Band;
import org.gdal.gdal.Dataset;
import org.gdal.gdal.Driver;
import org.gdal.gdal.gdal;
import org.gdal.gdalconst.gdalconst;

import com.google.common.base.Preconditions;

import rill.store.ElementType;
import rill.util.Bits;

/**
 * The first band of a raster file, opened through GDAL.  Samples are 8-bit
 * unsigned or 32-bit float.
 *
 * Pixels move a window at a time through a direct buffer, so memory use is
 * bounded by the window.  New files are GeoTIFFs; an opened file keeps
 * whatever format, georeferencing and projection it already has.
 */
public class TiffBand implements Closeable {
  static final String DRIVER = "GTiff";
  private static boolean _registered;

  final File _file;
  final Dataset _ds;
  final Band _band;
  public final int _width, _height;
  public final ElementType _type;

  TiffBand( File file, Dataset ds, ElementType type ) {
    _file = file;
    _ds = ds;
    _band = ds.GetRasterBand(1);
    _width = ds.GetRasterXSize();
    _height = ds.GetRasterYSize();
    _type = type;
  }

  /** Register the GDAL drivers once; fails if the native library is missing. */
  public static synchronized void register() throws IOException {
    if( _registered ) return;
    try {
      gdal.AllRegister();
    } catch( LinkageError e ) {
      throw new IOException("GDAL native libraries are not installed",e);
    }
    _registered = true;
  }

  public static boolean available() {
    try {
      register();
      return true;
    } catch( IOException e ) {
      return false;
    }
  }

  /** Create (or truncate) a GeoTIFF of zero pixels. */
  public static TiffBand create( File f, int width, int height, ElementType type ) throws IOException {
    Preconditions.checkArgument(width > 0 && height > 0, "bad raster size %s x %s", width, height);
    register();
    Driver drv = gdal.GetDriverByName(DRIVER);
    if( drv == null ) throw new IOException("GDAL has no "+DRIVER+" driver");
    Dataset ds = drv.Create(f.getPath(),width,height,1,gdal_type(type));
    if( ds == null ) throw error("cannot create "+f);
    return new TiffBand(f,ds,type);
  }

  /** Open an existing raster, for update or read-only. */
  public static TiffBand open( File f, boolean update ) throws IOException {
    Dataset ds = dataset(f,update);
    if( ds.GetRasterCount() < 1 ) {
      ds.delete();
      throw new IOException(f+" has no raster band");
    }
    int dt = ds.GetRasterBand(1).getDataType();
    ElementType type = dt == gdalconst.GDT_Byte ? ElementType.U8 : dt == gdalconst.GDT_Float32 ? ElementType.F32 : null;
    if( type == null ) {
      ds.delete();
      throw new IOException(f+" holds "+gdal.GetDataTypeName(dt)+" samples, not Byte or Float32");
    }
    return new TiffBand(f,ds,type);
  }

  /** Width and height of any raster GDAL reads, whatever its sample type. */
  public static int[] size( File f ) throws IOException {
    Dataset ds = dataset(f,false);
    try {
      return new int[]{ ds.GetRasterXSize(), ds.GetRasterYSize() };
    } finally {
      ds.delete();
    }
  }

  private static Dataset dataset( File f, boolean update ) throws IOException {
    register();
    if( !f.isFile() ) throw new FileNotFoundException(f.getPath());
    Dataset ds = gdal.Open(f.getPath(), update ? gdalconst.GA_Update : gdalconst.GA_ReadOnly);
    if( ds == null ) throw error("cannot open "+f);
    return ds;
  }

  /**
   * Write a window of pixels: 'bits' holds ysize rows of xsize packed
   * little-endian samples, placed with its top-left corner at (xoff, yoff).
   */
  public void write( int xoff, int yoff, int xsize, int ysize, byte[] bits ) throws IOException {
    check_window(xoff,yoff,xsize,ysize,bits.length);
    ByteBuffer buf = ByteBuffer.allocateDirect(bits.length).order(ByteOrder.nativeOrder());
    if( _type == ElementType.F32 ) buf.asFloatBuffer().put(Bits.toFloats(bits));
    else buf.put(bits);
    int err = _band.WriteRaster_Direct(xoff,yoff,xsize,ysize,xsize,ysize,gdal_type(_type),buf);
    if( err != gdalconst.CE_None )
      throw error("cannot write "+xsize+"x"+ysize+" at ("+xoff+","+yoff+") of "+_file);
  }

  /** Read a window of pixels as packed little-endian samples, row by row. */
  public byte[] read( int xoff, int yoff, int xsize, int ysize ) throws IOException {
    final int len = _type.bytes((long)xsize*ysize);
    check_window(xoff,yoff,xsize,ysize,len);
    ByteBuffer buf = ByteBuffer.allocateDirect(len).order(ByteOrder.nativeOrder());
    int err = _band.ReadRaster_Direct(xoff,yoff,xsize,ysize,xsize,ysize,gdal_type(_type),buf);
    if( err != gdalconst.CE_None )
      throw error("cannot read "+xsize+"x"+ysize+" at ("+xoff+","+yoff+") of "+_file);
    if( _type == ElementType.F32 ) {
      float[] fs = new float[xsize*ysize];
      buf.asFloatBuffer().get(fs);
      return Bits.fromFloats(fs);
    }
    byte[] bits = new byte[len];
    buf.get(bits);
    return bits;
  }

  // Flush and release the dataset; the file is complete after this
  @Override public void close() {
    _ds.FlushCache();
    _ds.delete();
  }

  static int gdal_type( ElementType t ) {
    return t == ElementType.F32 ? gdalconst.GDT_Float32 : gdalconst.GDT_Byte;
  }

  private static IOException error( String msg ) {
    return new IOException(msg+": "+gdal.GetLastErrorMsg());
  }

  private void check_window( int xoff, int yoff, int xsize, int ysize, int len ) throws IOException {
    if( xoff < 0 || yoff < 0 || xsize < 0 || ysize < 0 ||
        (long)xoff+xsize > _width || (long)yoff+ysize > _height )
      throw new IOException("window "+xsize+"x"+ysize+" at ("+xoff+","+yoff+") outside "+_width+"x"+_height+" raster");
    if( (long)xsize*ysize*_type._width != len )
      throw new IOException(len+" bytes do not fill a "+xsize+"x"+ysize+" "+_type+" window");
  }
}
