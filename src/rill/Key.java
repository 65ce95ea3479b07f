package rill;

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

/**
 * Keys
 *
 * A Key names a node of the hierarchical array store: a group or a dataset.
 * Keys are absolute, slash-separated paths; the root group is "/".  Keys are
 * normalized on creation (duplicate and trailing slashes dropped) so two keys
 * for the same node are always equal.
 *
 * Names starting with a '.' are reserved for the store's own bookkeeping
 * (staged outputs) and cannot be used in user keys.
 */
public final class Key implements Comparable<Key> {

  // Before ROOT: the constructor needs JOIN
  private static final Splitter SLASH = Splitter.on('/').omitEmptyStrings().trimResults();
  private static final Joiner JOIN = Joiner.on('/');

  public static final Key ROOT = new Key(ImmutableList.<String>of());

  final ImmutableList<String> _path; // Path segments, root first
  private final String _name;        // Cached "/a/b" form

  private Key( List<String> path ) {
    _path = ImmutableList.copyOf(path);
    _name = "/"+JOIN.join(_path);
  }

  // Make a Key from a path.  Leading slash is optional.
  public static Key make( String s ) {
    Preconditions.checkNotNull(s, "null key");
    List<String> segs = SLASH.splitToList(s);
    for( String seg : segs )
      check_segment(seg);
    return segs.isEmpty() ? ROOT : new Key(segs);
  }

  private static void check_segment( String seg ) {
    Preconditions.checkArgument(!seg.isEmpty() && seg.charAt(0) != '.',
                                "illegal key segment '%s'", seg);
  }

  public boolean isRoot() { return _path.isEmpty(); }

  // Last path segment; "" for the root
  public String name() { return isRoot() ? "" : _path.get(_path.size()-1); }

  // Enclosing group, or null for the root
  public Key parent() {
    if( isRoot() ) return null;
    return _path.size() == 1 ? ROOT : new Key(_path.subList(0,_path.size()-1));
  }

  public Key child( String name ) {
    check_segment(name);
    return new Key(ImmutableList.<String>builder().addAll(_path).add(name).build());
  }

  // Sibling named by appending a suffix to the last segment: /g/sum -> /g/sum_rev
  public Key suffixed( String suffix ) {
    Preconditions.checkState(!isRoot(), "root has no name to suffix");
    return parent().child(name()+suffix);
  }

  public List<String> segments() { return _path; }

  // Relative form without the leading slash, "" for the root
  public String relative() { return _name.substring(1); }

  @Override public boolean equals( Object o ) {
    return o instanceof Key && ((Key)o)._name.equals(_name);
  }
  @Override public int hashCode() { return _name.hashCode(); }
  @Override public int compareTo( Key k ) { return _name.compareTo(k._name); }
  @Override public String toString() { return _name; }
}
