package rill.store;

import java.io.IOException;

import rill.Key;

/**
 * A dataset does not have the length (or element type) its consumer requires.
 */
public class SizeMismatchException extends IOException {
  public final Key _key;
  public final long _expected, _actual;

  public SizeMismatchException( Key key, long expected, long actual ) {
    super("dataset "+key+" has "+actual+" elements, expected "+expected);
    _key = key;
    _expected = expected;
    _actual = actual;
  }

  public SizeMismatchException( Key key, String msg ) {
    super(msg);
    _key = key;
    _expected = _actual = -1;
  }
}
