package rill.store;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import com.google.common.base.Preconditions;
import com.google.common.io.ByteStreams;
import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import rill.Key;

/**
 * File-backed array store.
 *
 * The store is a directory tree: a group is a directory, a dataset is a
 * directory holding a JSON header and its chunks.  Large arrays are broken
 * into chunks of (by default) 1Meg, one file per chunk, optionally gzipped.
 * Chunks never written read back as zeros.
 *
 * Layout of a dataset directory:
 * <pre>
 *   header.json   {"type":"F32","length":4566016,"chunk":262144,"gzip":1}
 *   0.chk         elements [0, chunk)
 *   1.chk         elements [chunk, 2*chunk)
 *   ...
 * </pre>
 *
 * New datasets are staged under a hidden ".partial-" name next to their final
 * place and renamed into place on commit, so a dataset that exists is always
 * completely written.
 */
public class IceStore extends ArrayStore {
  private static final Logger LOG = Logger.getLogger(IceStore.class.getName());

  public static final int LOG_CHK = 20; // Chunks are 1<<20, or 1Meg
  static final String HEADER  = "header.json";
  static final String CHUNK   = ".chk";
  static final String PARTIAL = ".partial-";
  static final Gson GSON = new Gson();

  final File _root;
  final int _chunkBytes;        // Target bytes per chunk for new datasets
  final int _gzip;              // Compression level for new datasets; 0 for none

  public IceStore( File root ) { this(root, 1<<LOG_CHK, 1); }

  public IceStore( File root, int chunkBytes, int gzip ) {
    Preconditions.checkArgument(chunkBytes >= 4, "chunk of %s bytes is too small", chunkBytes);
    Preconditions.checkArgument(gzip >= 0 && gzip <= 9, "gzip level %s not in 0..9", gzip);
    _root = root;
    _chunkBytes = chunkBytes;
    _gzip = gzip;
  }

  // Open a store, making the root directory as-needed
  public static IceStore open( File root, int chunkBytes, int gzip ) throws IOException {
    if( !root.isDirectory() && !root.mkdirs() )
      throw new IOException("cannot make store directory "+root);
    return new IceStore(root,chunkBytes,gzip);
  }

  public File root() { return _root; }

  // Dataset header, as stored in header.json
  static final class Header {
    String type;
    long length;
    int chunk;                  // Elements per chunk
    int gzip;
  }

  File dir( Key k ) { return k.isRoot() ? _root : new File(_root,k.relative()); }
  private static File header( File dir ) { return new File(dir,HEADER); }
  private File partial( Key k ) { return new File(dir(k.parent()),PARTIAL+k.name()); }

  @Override public boolean exists( Key k ) { return dir(k).isDirectory(); }

  @Override public boolean isGroup( Key k ) {
    File d = dir(k);
    return d.isDirectory() && !header(d).exists();
  }

  @Override public List<String> members( Key group ) throws IOException {
    File d = dir(group);
    if( !d.isDirectory() || header(d).exists() )
      throw new DatasetNotFoundException(group,"no such group "+group);
    String[] names = d.list();
    if( names == null ) throw new IOException("cannot list "+d);
    List<String> res = new ArrayList<String>();
    for( String name : names )
      if( name.charAt(0) != '.' && new File(d,name).isDirectory() )
        res.add(name);
    Collections.sort(res);
    return res;
  }

  @Override public void createGroup( Key group ) throws IOException {
    File d = dir(group);
    if( header(d).exists() )
      throw new IOException(group+" is a dataset, not a group");
    if( !d.isDirectory() && !d.mkdirs() )
      throw new IOException("cannot make group "+group);
  }

  @Override public Dataset open( Key k ) throws IOException {
    File d = dir(k);
    File h = header(d);
    if( !h.isFile() ) {
      if( d.isDirectory() ) throw new DatasetNotFoundException(k,k+" is a group, not a dataset");
      throw new DatasetNotFoundException(k);
    }
    return new IceDataset(k,d,read_header(k,h),false);
  }

  @Override public Dataset create( Key k, ElementType type, long length ) throws IOException {
    Preconditions.checkArgument(!k.isRoot(), "cannot create a dataset at the root");
    Preconditions.checkArgument(length >= 0, "negative length %s", length);
    if( exists(k) ) throw new IOException(k+" already exists");
    createGroup(k.parent());
    File d = partial(k);
    if( d.exists() ) {          // Left over from a crashed writer
      LOG.warning("Discarding partial output "+d);
      delete(d);
    }
    if( !d.mkdirs() ) throw new IOException("cannot make "+d);
    Header h = new Header();
    h.type = type.name();
    h.length = length;
    h.chunk = Math.max(1,_chunkBytes/type._width);
    h.gzip = _gzip;
    Writer w = Files.newBufferedWriter(header(d).toPath(),StandardCharsets.UTF_8);
    try {
      GSON.toJson(h,w);
    } finally {
      w.close();
    }
    return new IceDataset(k,d,h,true);
  }

  @Override public void remove( Key k ) throws IOException {
    Preconditions.checkArgument(!k.isRoot(), "cannot remove the root");
    File d = dir(k);
    if( d.exists() ) delete(d);
  }

  private static void delete( File f ) throws IOException {
    MoreFiles.deleteRecursively(f.toPath(),RecursiveDeleteOption.ALLOW_INSECURE);
  }

  private static Header read_header( Key k, File f ) throws IOException {
    Reader r = Files.newBufferedReader(f.toPath(),StandardCharsets.UTF_8);
    try {
      Header h = GSON.fromJson(r,Header.class);
      if( h == null || h.type == null || h.length < 0 || h.chunk <= 0 )
        throw new IOException("broken header for "+k);
      ElementType.valueOf(h.type); // Fail early on an unknown type
      return h;
    } catch( JsonParseException e ) {
      throw new IOException("broken header for "+k,e);
    } catch( IllegalArgumentException e ) {
      throw new IOException("unknown element type in header for "+k,e);
    } finally {
      r.close();
    }
  }

  // --------------------------------------------------------------------------
  final class IceDataset extends Dataset {
    final Header _h;
    File _dir;
    boolean _staged;

    IceDataset( Key k, File dir, Header h, boolean staged ) {
      super(k,ElementType.valueOf(h.type),h.length);
      _dir = dir;
      _h = h;
      _staged = staged;
    }

    long chunks() { return (_length+_h.chunk-1)/_h.chunk; }
    // Elements in chunk 'c'; the last chunk may be short
    int chunk_len( long c ) { return (int)Math.min(_h.chunk,_length-c*_h.chunk); }
    File chunk_file( long c ) { return new File(_dir,c+CHUNK); }

    @Override public byte[] read( long off, int len ) throws IOException {
      check_range(off,len);
      final int w = _type._width;
      byte[] res = new byte[_type.bytes(len)];
      long pos = off, end = off+len;
      while( pos < end ) {
        long c = pos/_h.chunk;
        int in = (int)(pos - c*_h.chunk); // Element offset within chunk
        int n = (int)Math.min(chunk_len(c)-in,end-pos);
        byte[] bits = load(c);
        System.arraycopy(bits,in*w,res,(int)(pos-off)*w,n*w);
        pos += n;
      }
      return res;
    }

    @Override public void write( long off, byte[] bits ) throws IOException {
      long len = elements(bits);
      check_range(off,len);
      final int w = _type._width;
      long pos = off, end = off+len;
      while( pos < end ) {
        long c = pos/_h.chunk;
        int in = (int)(pos - c*_h.chunk);
        int clen = chunk_len(c);
        int n = (int)Math.min(clen-in,end-pos);
        // A whole-chunk write need not read the old chunk
        byte[] chk = n == clen ? new byte[clen*w] : load(c);
        System.arraycopy(bits,(int)(pos-off)*w,chk,in*w,n*w);
        store(c,chk);
        pos += n;
      }
    }

    // Load chunk 'c' fully; a missing chunk is all zeros
    byte[] load( long c ) throws IOException {
      final int sz = chunk_len(c)*_type._width;
      File f = chunk_file(c);
      if( !f.exists() ) return new byte[sz];
      InputStream s = new FileInputStream(f);
      try {
        if( _h.gzip > 0 ) s = new GZIPInputStream(s);
        byte[] b = new byte[sz];
        ByteStreams.readFully(s,b);
        if( s.read() != -1 )
          throw new IOException("chunk "+c+" of "+_key+" is longer than "+sz+" bytes");
        return b;
      } catch( java.io.EOFException e ) { // Broken disk / short-file???
        throw new IOException("chunk "+c+" of "+_key+" is short",e);
      } finally {
        s.close();
      }
    }

    void store( long c, byte[] b ) throws IOException {
      OutputStream s = new FileOutputStream(chunk_file(c)); // Nuke any prior chunk
      try {
        if( _h.gzip > 0 ) s = gzip(s,_h.gzip);
        s.write(b);
      } finally {
        s.close();
      }
    }

    @Override public boolean isStaged() { return _staged; }

    @Override public void commit() throws IOException {
      Preconditions.checkState(_staged, "%s is already committed", _key);
      File dst = dir(_key);
      if( dst.exists() ) throw new IOException(_key+" already exists");
      try {
        Files.move(_dir.toPath(),dst.toPath(),StandardCopyOption.ATOMIC_MOVE);
      } catch( AtomicMoveNotSupportedException e ) {
        LOG.log(Level.WARNING,"Atomic rename not supported, committing "+_key+" with a plain rename",e);
        Files.move(_dir.toPath(),dst.toPath());
      }
      _dir = dst;
      _staged = false;
    }
  }

  // A gzip stream at the given compression level
  static OutputStream gzip( OutputStream os, final int level ) throws IOException {
    return new GZIPOutputStream(os,1<<16) { { def.setLevel(level); } };
  }
}
