package rill.ops;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import rill.Key;
import rill.Timer;
import rill.raster.RasterExport;
import rill.store.ArrayStore;
import rill.store.ArrayStore.Node;

/**
 * A whole run over one store: reverse every dataset, then reduce every
 * accumulator group to mean and sd and, when an exporter is given, write its
 * rasters.
 *
 * Every dataset and group is processed on its own: a failure is logged with
 * the key and the operation, recorded in the {@link Report}, and the run goes
 * on with the rest.
 */
public class Pipeline {
  private static final Logger LOG = Logger.getLogger(Pipeline.class.getName());

  public static final String REVERSE = "reverse";
  public static final String STATS   = "stats";
  public static final String EXPORT  = "export";
  public static final String WALK    = "walk";

  final ArrayStore _store;
  final RowReverser _reverser;
  final RunningStats _stats;
  final RasterExport _export;   // May be null: no rasters

  public Pipeline( ArrayStore store, RowReverser reverser, RunningStats stats, RasterExport export ) {
    _store = store;
    _reverser = reverser;
    _stats = stats;
    _export = export;
  }

  public Report run() {
    Report rep = new Report();
    Timer t = new Timer();
    List<Node> nodes;
    try {
      nodes = _store.walk();
    } catch( IOException e ) {
      LOG.log(Level.SEVERE, "Cannot list the store", e);
      rep.fail(Key.ROOT,WALK,e);
      return rep;
    }
    List<Key> datasets = new ArrayList<Key>(), groups = new ArrayList<Key>();
    for( Node n : nodes )
      (n._group ? groups : datasets).add(n._key);

    LOG.info("Inverting datasets rows!");
    for( int i=0; i<datasets.size(); i++ ) {
      Key k = datasets.get(i);
      LOG.info("Processing dataset: "+k+" ("+(i+1)+" of "+datasets.size()+")");
      try {
        rep.add(k,REVERSE,_reverser.reverse(k));
      } catch( IOException e ) {
        failed(rep,k,REVERSE,e);
      } catch( RuntimeException e ) {
        failed(rep,k,REVERSE,e);
      }
    }

    for( int i=0; i<groups.size(); i++ ) {
      Key g = groups.get(i);
      LOG.info("Processing group: "+g+" ("+(i+1)+" of "+groups.size()+")");
      if( !group(rep,g) ) continue;
      if( _export == null ) continue;
      try {
        LOG.info("Reading arrays and writing to rasters...");
        _export.export(g);
        rep.add(g,EXPORT,Outcome.COMPUTED);
      } catch( IOException e ) {
        failed(rep,g,EXPORT,e);
      } catch( RuntimeException e ) {
        failed(rep,g,EXPORT,e);
      }
    }
    LOG.info("Finished in "+t+": "+rep.summary());
    return rep;
  }

  // Mean and sd of one group; true if its outputs are there to export
  private boolean group( Report rep, Key g ) {
    try {
      if( !RunningStats.isAccumulatorGroup(_store,g) ) {
        rep.add(g,STATS,Outcome.NOT_APPLICABLE);
        return false;
      }
      LOG.info("Computing mean and sd...");
      rep.add(g,STATS,_stats.reduce(g));
      return true;
    } catch( IOException e ) {
      failed(rep,g,STATS,e);
    } catch( RuntimeException e ) {
      failed(rep,g,STATS,e);
    }
    return false;
  }

  private static void failed( Report rep, Key k, String op, Exception e ) {
    LOG.log(Level.SEVERE, op+" failed for "+k+": "+e.getMessage(), e);
    rep.fail(k,op,e);
  }
}
