package rill;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line arguments of the form {@code --name=value} (or {@code -name=value},
 * or a bare {@code --name} for a boolean switch).
 *
 * Options are declared as the non-static fields of an {@link Opt} subclass,
 * with their defaults as field initializers; {@link #extract} sets every field
 * whose name was given on the command line.
 */
public class Arguments {

  // Marker base class of option holders
  public static class Opt { }

  static final class Entry {
    final String _name, _value; // _value is null for a bare switch
    boolean _used;
    Entry( String name, String value ) { _name = name; _value = value; }
    @Override public String toString() { return "--"+_name+(_value == null ? "" : "="+_value); }
  }

  private final List<Entry> _args = new ArrayList<Entry>();

  public Arguments( String[] args ) {
    for( String s : args ) {
      if( s.trim().isEmpty() ) continue;
      if( !s.startsWith("-") )
        throw new IllegalArgumentException("unexpected argument '"+s+"', options look like --name=value");
      String body = s.startsWith("--") ? s.substring(2) : s.substring(1);
      int eq = body.indexOf('=');
      if( eq == 0 || body.isEmpty() ) throw new IllegalArgumentException("malformed option '"+s+"'");
      _args.add(eq < 0 ? new Entry(body,null) : new Entry(body.substring(0,eq),body.substring(eq+1)));
    }
  }

  /**
   * Set the fields of 'opt' named on the command line.  Returns the number of
   * fields set.
   */
  public int extract( Opt opt ) {
    int n = 0;
    for( Field f : opt.getClass().getFields() ) {
      if( Modifier.isStatic(f.getModifiers()) || Modifier.isFinal(f.getModifiers()) ) continue;
      for( Entry e : _args ) {
        if( !e._name.equals(f.getName()) ) continue;
        set(opt,f,e);
        e._used = true;
        n++;
      }
    }
    return n;
  }

  // Options no extract() call has consumed
  public List<String> unused() {
    List<String> res = new ArrayList<String>();
    for( Entry e : _args )
      if( !e._used ) res.add(e._name);
    return res;
  }

  public String[] toStringArray() {
    String[] res = new String[_args.size()];
    for( int i=0; i<res.length; i++ )
      res[i] = _args.get(i).toString();
    return res;
  }

  private static void set( Opt opt, Field f, Entry e ) {
    Class<?> c = f.getType();
    String v = e._value;
    try {
      if( c == boolean.class ) {
        f.setBoolean(opt, v == null || Boolean.parseBoolean(v));
        return;
      }
      if( v == null ) throw new IllegalArgumentException("option --"+e._name+" needs a value");
      if( c == String.class )      f.set(opt,v);
      else if( c == int.class )    f.setInt(opt,Integer.parseInt(v.trim()));
      else if( c == long.class )   f.setLong(opt,Long.parseLong(v.trim()));
      else if( c == double.class ) f.setDouble(opt,Double.parseDouble(v.trim()));
      else if( c == float.class )  f.setFloat(opt,Float.parseFloat(v.trim()));
      else throw new IllegalArgumentException("option --"+e._name+" has unsupported type "+c.getSimpleName());
    } catch( NumberFormatException nfe ) {
      throw new IllegalArgumentException("option --"+e._name+" expects a number, got '"+v+"'",nfe);
    } catch( IllegalAccessException iae ) {
      throw new IllegalArgumentException("option --"+e._name+" cannot be set",iae);
    }
  }
}
