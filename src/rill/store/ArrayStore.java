package rill.store;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import rill.Key;

/**
 * The hierarchical array store: groups (containers) holding datasets and
 * further groups, addressed by {@link Key}.
 *
 * Note that at the moment a store must be used single-threaded; datasets
 * have exactly one reader or writer at a time.
 */
public abstract class ArrayStore {

  // A group or dataset found by walk()
  public static final class Node {
    public final Key _key;
    public final boolean _group;
    Node( Key key, boolean group ) { _key = key; _group = group; }
    @Override public String toString() { return (_group ? "group " : "dataset ")+_key; }
  }

  // True if a group or a committed dataset lives at 'key'
  public abstract boolean exists( Key key );
  // True if 'key' names a group
  public abstract boolean isGroup( Key key );
  // Sorted names of the members of a group
  public abstract List<String> members( Key group ) throws IOException;
  // Make a group and any missing parents
  public abstract void createGroup( Key group ) throws IOException;
  // Open a committed dataset
  public abstract Dataset open( Key key ) throws IOException;
  // Start a new, zero-filled output; nothing is visible until it is committed
  public abstract Dataset create( Key key, ElementType type, long length ) throws IOException;
  // Remove a dataset or a whole group; no-op if absent
  public abstract void remove( Key key ) throws IOException;

  public Dataset open( String path ) throws IOException { return open(Key.make(path)); }
  public boolean exists( String path ) { return exists(Key.make(path)); }

  // Depth-first listing of every node below the root, each group directly
  // followed by its members.
  public List<Node> walk() throws IOException {
    List<Node> res = new ArrayList<Node>();
    walk(Key.ROOT,res);
    return res;
  }
  private void walk( Key group, List<Node> res ) throws IOException {
    for( String name : members(group) ) {
      Key k = group.child(name);
      if( isGroup(k) ) {
        res.add(new Node(k,true));
        walk(k,res);            // Recursively list the members
      } else {
        res.add(new Node(k,false));
      }
    }
  }
}
