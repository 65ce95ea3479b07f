package rill.store;

import java.io.IOException;

import rill.Key;

/**
 * A required group or dataset does not exist in the store.
 */
public class DatasetNotFoundException extends IOException {
  public final Key _key;
  public DatasetNotFoundException( Key key ) { this(key,"no such dataset "+key); }
  public DatasetNotFoundException( Key key, String msg ) {
    super(msg);
    _key = key;
  }
}
