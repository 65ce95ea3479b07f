package rill.raster;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import com.google.common.base.Preconditions;
import com.google.common.io.Files;
import com.google.common.primitives.Ints;

import rill.Key;
import rill.ops.Progress;
import rill.ops.RunningStats;
import rill.store.ArrayStore;
import rill.store.Dataset;
import rill.store.ElementType;
import rill.store.SizeMismatchException;

/**
 * Streams the reversed count and the derived mean and sd of an accumulator
 * group into raster image files, a batch of lines at a time.
 *
 * Files are named {@code <prefix>_<group>_<stat>.tif} in the output directory,
 * with the slashes of nested group names dropped.  Existing files are
 * overwritten.
 *
 * With templates set, each output starts as a copy of a template raster (the
 * byte template for the count, the float template for mean and sd) and only
 * its pixels are rewritten, so georeferencing and projection carry over.
 * Without them the outputs are bare GeoTIFFs.
 */
public class RasterExport {
  private static final Logger LOG = Logger.getLogger(RasterExport.class.getName());

  public static final int DEFAULT_LINES = 100;
  static final String[] STATS = { RunningStats.COUNT, RunningStats.MEAN, RunningStats.SD };

  final ArrayStore _store;
  final File _dir;
  final String _prefix;
  final int _width, _height;
  final int _lines;             // Raster lines per write
  File _byteTemplate, _floatTemplate; // Null: no templates
  Progress _progress = Progress.NONE;

  public RasterExport( ArrayStore store, File dir, String prefix, long width, long height, int lines ) {
    Preconditions.checkArgument(width > 0 && height > 0, "bad raster size %s x %s", width, height);
    Preconditions.checkArgument(lines > 0, "lines per write must be positive, was %s", lines);
    _store = store;
    _dir = dir;
    _prefix = prefix;
    _width = Ints.checkedCast(width);
    _height = Ints.checkedCast(height);
    _lines = lines;
  }

  public RasterExport progress( Progress p ) { _progress = p; return this; }

  public RasterExport templates( File byteTemplate, File floatTemplate ) {
    Preconditions.checkArgument((byteTemplate == null) == (floatTemplate == null),
                                "byte and float templates go together");
    _byteTemplate = byteTemplate;
    _floatTemplate = floatTemplate;
    return this;
  }

  public File file( Key group, String stat ) {
    return new File(_dir,_prefix+"_"+group.relative().replace("/","")+"_"+stat+".tif");
  }

  /** Write the count, mean and sd rasters of 'group'; returns the files. */
  public List<File> export( Key group ) throws IOException {
    if( !_dir.isDirectory() && !_dir.mkdirs() )
      throw new IOException("cannot make raster directory "+_dir);
    List<File> res = new ArrayList<File>();
    for( String stat : STATS ) {
      Dataset ds = _store.open(RunningStats.key(group,stat));
      if( ds.length() != (long)_width*_height )
        throw new SizeMismatchException(ds._key,(long)_width*_height,ds.length());
      File f = file(group,stat);
      write(ds,f);
      res.add(f);
    }
    LOG.fine("Rasters of "+group+" written to "+_dir);
    return res;
  }

  private void write( Dataset ds, File f ) throws IOException {
    TiffBand band = band(ds.type(),f);
    try {
      for( int yy=0; yy<_height; yy+=_lines ) {
        int lines = Math.min(_lines,_height-yy);
        band.write(0,yy,_width,lines,ds.read((long)yy*_width,Ints.checkedCast((long)lines*_width)));
        _progress.update(yy+lines,_height);
      }
    } finally {
      band.close();
    }
  }

  // The output raster for samples of type 't': a template copy or a new file
  private TiffBand band( ElementType t, File f ) throws IOException {
    if( _byteTemplate == null ) return TiffBand.create(f,_width,_height,t);
    File template = t == ElementType.U8 ? _byteTemplate : _floatTemplate;
    Files.copy(template,f);
    TiffBand band = TiffBand.open(f,true);
    if( band._type != t || band._width != _width || band._height != _height ) {
      band.close();
      throw new IOException("template "+template+" is "+band._width+"x"+band._height+" "+band._type+
                            ", the output needs "+_width+"x"+_height+" "+t);
    }
    return band;
  }
}
