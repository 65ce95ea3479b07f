package rill.ops;

/**
 * Progress listener for long sequential passes.  Called with the units done
 * so far and the total; the final call has done == total.
 */
public interface Progress {
  void update( long done, long total );

  Progress NONE = new Progress() {
      @Override public void update( long done, long total ) { }
    };
}
