package rill.ops;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Throwables;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import rill.Key;

/**
 * Outcome of every operation of a run, failures included, in the order they
 * ran.
 */
public class Report {

  public static final class Entry {
    public final Key _key;
    public final String _op;        // "reverse", "stats", "export"...
    public final Outcome _outcome;  // null when the operation failed
    public final Throwable _error;  // null unless the operation failed

    Entry( Key key, String op, Outcome outcome, Throwable error ) {
      _key = key;
      _op = op;
      _outcome = outcome;
      _error = error;
    }
    public boolean failed() { return _error != null; }

    @Override public String toString() {
      return _op+" "+_key+": "+(failed() ? "FAILED "+_error : _outcome);
    }
  }

  private final List<Entry> _entries = new ArrayList<Entry>();

  public void add( Key key, String op, Outcome outcome ) { _entries.add(new Entry(key,op,outcome,null)); }
  public void fail( Key key, String op, Throwable error ) { _entries.add(new Entry(key,op,null,error)); }

  public List<Entry> entries() { return Collections.unmodifiableList(_entries); }

  public List<Entry> failures() {
    List<Entry> res = new ArrayList<Entry>();
    for( Entry e : _entries )
      if( e.failed() ) res.add(e);
    return res;
  }

  public boolean ok() { return failures().isEmpty(); }

  // Entries of one operation that ended with 'o'
  public int count( String op, Outcome o ) {
    int n = 0;
    for( Entry e : _entries )
      if( e._op.equals(op) && e._outcome == o ) n++;
    return n;
  }

  // First outcome recorded for 'key' and 'op'; a lookup for tests and callers of run()
  public Outcome outcome( Key key, String op ) {
    for( Entry e : _entries )
      if( e._key.equals(key) && e._op.equals(op) ) return e._outcome;
    return null;
  }

  public String summary() {
    int failed = failures().size();
    return _entries.size()+" operations, "+(_entries.size()-failed)+" succeeded, "+failed+" failed";
  }

  public JsonObject toJson() {
    JsonArray arr = new JsonArray();
    for( Entry e : _entries ) {
      JsonObject o = new JsonObject();
      o.addProperty("key", e._key.toString());
      o.addProperty("op", e._op);
      if( e.failed() ) {
        o.addProperty("outcome", "FAILED");
        o.addProperty("error", e._error.toString());
        o.addProperty("cause", Throwables.getRootCause(e._error).getClass().getSimpleName());
      } else {
        o.addProperty("outcome", e._outcome.name());
      }
      arr.add(o);
    }
    JsonObject res = new JsonObject();
    res.add("entries", arr);
    res.addProperty("failed", failures().size());
    res.addProperty("summary", summary());
    return res;
  }

  @Override public String toString() {
    Gson gson = new GsonBuilder().setPrettyPrinting().create();
    return gson.toJson(toJson());
  }
}
