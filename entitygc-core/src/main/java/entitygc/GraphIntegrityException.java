package entitygc;

/**
 * Thrown when the persisted graph violates an invariant the sweep relies on,
 * such as a malformed edge row, a duplicated entity reference, or a delete
 * that removed a different number of rows than planned.
 *
 * <p>Indicates an upstream defect. Callers must roll back the enclosing transaction.
 */
public final class GraphIntegrityException extends RuntimeException {

  public GraphIntegrityException(String message) {
    super(message);
  }
}
