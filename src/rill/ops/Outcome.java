package rill.ops;

/**
 * How an operation on one dataset or group ended, short of failing.
 */
public enum Outcome {
  COMPUTED,        // Output written and committed
  ALREADY_DONE,    // Output already existed; nothing touched
  NOT_APPLICABLE   // Input is not something this operation works on
}
