package rill;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

import rill.ops.ConsoleProgress;
import rill.ops.Pipeline;
import rill.ops.Progress;
import rill.ops.Report;
import rill.ops.RowReverser;
import rill.ops.RunningStats;
import rill.raster.RasterExport;
import rill.raster.TiffBand;
import rill.store.ArrayStore;
import rill.store.IceStore;

/**
 * Command line entry point: reverse the rows of every dataset of a store,
 * reduce its accumulator groups to mean and sd, and optionally export the
 * results as rasters.
 *
 * <pre>
 *   java -jar rill.jar --store=cerrado_100 --template=base_byte.tif --float_template=base_float.tif
 *                      --out=rasters --prefix=100_cerrado
 * </pre>
 */
public final class Rill {
  private static final Logger LOG = Logger.getLogger(Rill.class.getName());

  public static class OptArgs extends Arguments.Opt {
    public String store;                  // Array store root directory
    public String template;               // Byte raster: gives width & height, copied for counts
    public String float_template;         // Float raster copied for mean & sd
    public long width;                    // Raster columns, unless from template
    public long height;                   // Raster rows, unless from template
    public int rows = RowReverser.DEFAULT_ROWS;      // Rows per reversal batch
    public int batch = RunningStats.DEFAULT_BATCH;   // Cells per statistics batch
    public int lines = RasterExport.DEFAULT_LINES;   // Raster lines per write
    public int min_count = 1;             // Cells counting less get sd -1
    public String out;                    // Raster output directory; none if unset
    public String prefix = "rill";        // Raster file name prefix
    public int chunk = 1<<IceStore.LOG_CHK; // Chunk bytes of new datasets
    public int gzip = 1;                  // Chunk compression level; 0 for none
    public boolean quiet;                 // No console progress
  }

  static final String USAGE =
    "usage: rill --store=<dir> (--template=<tif> --float_template=<tif> | --width=<n> --height=<n>)\n"+
    "            [--rows=100] [--batch=1000000] [--lines=100] [--min_count=1]\n"+
    "            [--out=<dir>] [--prefix=rill] [--chunk=1048576] [--gzip=1] [--quiet]";

  private Rill() { }

  public static void main( String[] args ) {
    Log.init();
    Report rep;
    try {
      rep = run(args);
    } catch( IllegalArgumentException e ) {
      Log.die(e.getMessage()+"\n"+USAGE);
      return;
    } catch( IOException e ) {
      Log.die("[rill] "+e.getMessage());
      return;
    }
    System.out.println(rep.summary());
    System.exit(rep.ok() ? 0 : 1);
  }

  // Parse arguments, build the pipeline and run it
  public static Report run( String[] args ) throws IOException {
    OptArgs opts = parse(args);
    return pipeline(opts).run();
  }

  public static OptArgs parse( String[] args ) throws IOException {
    Arguments arguments = new Arguments(args);
    OptArgs opts = new OptArgs();
    arguments.extract(opts);
    List<String> unknown = arguments.unused();
    if( !unknown.isEmpty() ) throw new IllegalArgumentException("unknown options "+unknown);
    LOG.config("Arguments: "+Arrays.toString(arguments.toStringArray()));
    if( opts.store == null ) throw new IllegalArgumentException("--store is required");
    if( opts.float_template != null && opts.template == null )
      throw new IllegalArgumentException("--float_template needs --template");
    if( opts.template != null ) {
      if( opts.out != null && opts.float_template == null )
        throw new IllegalArgumentException("rasters from templates need both --template and --float_template");
      int[] size = TiffBand.size(new File(opts.template));
      opts.width = size[0];
      opts.height = size[1];
    }
    if( opts.width <= 0 || opts.height <= 0 )
      throw new IllegalArgumentException("raster size needs --template or positive --width and --height");
    return opts;
  }

  public static Pipeline pipeline( OptArgs opts ) throws IOException {
    File root = new File(opts.store);
    if( !root.isDirectory() ) throw new IOException("no array store at "+root);
    ArrayStore store = IceStore.open(root,opts.chunk,opts.gzip);
    Progress p = opts.quiet ? Progress.NONE : new ConsoleProgress();
    RowReverser rev = new RowReverser(store,opts.width,opts.height,opts.rows).progress(p);
    RunningStats stats = new RunningStats(store,opts.batch,opts.min_count).progress(p);
    RasterExport export = null;
    if( opts.out != null ) {
      export = new RasterExport(store,new File(opts.out),opts.prefix,opts.width,opts.height,opts.lines).progress(p);
      if( opts.template != null )
        export.templates(new File(opts.template),new File(opts.float_template));
    }
    return new Pipeline(store,rev,stats,export);
  }
}
