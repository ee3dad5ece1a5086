package entitygc.model;

import entitygc.GraphIntegrityException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GraphSnapshotTest {

  @Test
  void splitsRootAndInternalEdges() {
    GraphSnapshot snapshot = GraphSnapshot.of(
        List.of("A", "B"),
        List.of(ReferenceEdge.root("p", "A"), ReferenceEdge.root("q", "A"),
            ReferenceEdge.internal("A", "B")));

    assertEquals(2, snapshot.rootEdges().size());
    assertEquals(1, snapshot.internalEdges().size());
    assertEquals(Set.of("A"), snapshot.rootTargets());
    assertEquals(3, snapshot.edgeCount());
    assertTrue(snapshot.contains("B"));
    assertFalse(snapshot.contains("p"));
  }

  @Test
  void rejectsDuplicateEntityRefs() {
    assertThrows(GraphIntegrityException.class,
        () -> GraphSnapshot.of(List.of("A", "A"), List.of()));
  }

  @Test
  void rejectsNullEntityRef() {
    assertThrows(GraphIntegrityException.class,
        () -> GraphSnapshot.of(Arrays.asList("A", null), List.of()));
  }

  @Test
  void rejectsEdgeWithBothSources() {
    assertThrows(GraphIntegrityException.class,
        () -> GraphSnapshot.of(List.of("A"), List.of(new ReferenceEdge("p", "A", "A"))));
  }

  @Test
  void rejectsEdgeWithNoSource() {
    assertThrows(GraphIntegrityException.class,
        () -> GraphSnapshot.of(List.of("A"), List.of(new ReferenceEdge(null, null, "A"))));
  }

  @Test
  void rejectsEdgeWithoutTarget() {
    assertThrows(GraphIntegrityException.class,
        () -> GraphSnapshot.of(List.of("A"), List.of(ReferenceEdge.internal("A", null))));
  }

  @Test
  void viewsAreUnmodifiable() {
    GraphSnapshot snapshot = GraphSnapshot.of(List.of("A"), List.of(ReferenceEdge.root("p", "A")));

    assertThrows(UnsupportedOperationException.class, () -> snapshot.entityRefs().add("B"));
    assertThrows(UnsupportedOperationException.class, () -> snapshot.rootEdges().clear());
  }
}
