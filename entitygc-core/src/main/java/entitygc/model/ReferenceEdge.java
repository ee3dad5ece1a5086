package entitygc.model;

/**
 * One row of the reference graph.
 *
 * <p>A root edge carries a {@code sourceKey} (an external provider that is not
 * itself an entity); an internal edge carries a {@code sourceEntityRef}.
 * Exactly one of the two is set. Construction does not enforce this so that
 * stores can hand malformed rows to {@link GraphSnapshot}, which rejects them
 * with a {@link entitygc.GraphIntegrityException}.
 *
 * @see GraphSnapshot
 */
public record ReferenceEdge(
    String sourceKey,
    String sourceEntityRef,
    String targetEntityRef
) {

  public static ReferenceEdge root(String sourceKey, String targetEntityRef) {
    return new ReferenceEdge(sourceKey, null, targetEntityRef);
  }

  public static ReferenceEdge internal(String sourceEntityRef, String targetEntityRef) {
    return new ReferenceEdge(null, sourceEntityRef, targetEntityRef);
  }

  /** Returns {@code true} for edges asserted by an external provider. */
  public boolean isRoot() {
    return sourceKey != null;
  }

  /** Returns {@code true} if exactly one source column and the target are set. */
  public boolean isWellFormed() {
    return targetEntityRef != null && ((sourceKey == null) != (sourceEntityRef == null));
  }

  @Override
  public String toString() {
    return (isRoot() ? "key:" + sourceKey : sourceEntityRef) + " -> " + targetEntityRef;
  }
}
