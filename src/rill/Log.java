package rill;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.LogManager;

import com.google.common.io.Closeables;

/**
 * Logging set-up.  Classes log through their own java.util.logging Logger;
 * this loads the bundled logging.properties once, unless the JVM was started
 * with an explicit configuration.
 */
public final class Log {
  static final String CONFIG = "/logging.properties";
  private static boolean _configured;

  private Log() { }

  public static synchronized void init() {
    if( _configured ) return;
    _configured = true;
    if( System.getProperty("java.util.logging.config.file") != null ) return;
    InputStream is = Log.class.getResourceAsStream(CONFIG);
    if( is == null ) return;    // Keep the JVM defaults
    try {
      LogManager.getLogManager().readConfiguration(is);
    } catch( IOException e ) {
      System.err.println("Cannot read "+CONFIG+": "+e);
    } finally {
      Closeables.closeQuietly(is);
    }
  }

  // Print to the original STDERR & die
  public static void die( String s ) {
    System.err.println(s);
    System.exit(-1);
  }
}
