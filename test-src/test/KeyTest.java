package test;

import static org.junit.Assert.*;

import java.net.URL;
import java.net.URLClassLoader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import com.google.common.collect.ImmutableList;

import rill.Key;
import rill.ops.Window;

public class KeyTest {

  static URL location( Class<?> c ) { return c.getProtectionDomain().getCodeSource().getLocation(); }

  // Load Key in a loader of its own, so ROOT is the first thing its static
  // initializer builds no matter what other tests ran before.
  @Test public void testRootInAFreshLoader() throws Exception {
    URLClassLoader cl = new URLClassLoader(new URL[]{ location(Key.class), location(ImmutableList.class) },
                                           ClassLoader.getPlatformClassLoader());
    try {
      Class<?> k = Class.forName("rill.Key",true,cl);
      assertNotSame(Key.class, k);
      assertEquals("/", k.getField("ROOT").get(null).toString());
    } finally {
      cl.close();
    }
  }

  @Test public void testNormalized() {
    assertEquals(Key.make("/a/b"), Key.make("a//b/"));
    assertEquals("/a/b", Key.make("a//b/").toString());
    assertSame(Key.ROOT, Key.make("/"));
    assertSame(Key.ROOT, Key.make(""));
    assertEquals("a/b", Key.make("/a/b").relative());
  }

  @Test public void testNavigation() {
    Key k = Key.make("/cerrado/g1/sum");
    assertEquals("sum", k.name());
    assertEquals(Key.make("/cerrado/g1"), k.parent());
    assertEquals(Key.ROOT, Key.make("/x").parent());
    assertNull(Key.ROOT.parent());
    assertEquals(Key.make("/cerrado/g1/sum_rev"), k.suffixed("_rev"));
    assertEquals(k, k.parent().child("sum"));
    assertEquals(Arrays.asList("cerrado","g1","sum"), k.segments());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testHiddenNamesAreReserved() {
    Key.make("/g/.partial-sum");
  }

  @Test(expected = IllegalStateException.class)
  public void testRootHasNoSuffix() {
    Key.ROOT.suffixed("_rev");
  }

  @Test public void testBatches() {
    List<Window> ws = new ArrayList<Window>();
    for( Window w : Window.batches(25,10) ) ws.add(w);
    assertEquals(Arrays.asList(new Window(0,10),new Window(10,20),new Window(20,25)), ws);
    assertFalse(Window.batches(0,10).iterator().hasNext());
    assertFalse(new Window(0,10).overlaps(new Window(10,20)));
    assertTrue(new Window(0,11).overlaps(new Window(10,20)));
  }
}
