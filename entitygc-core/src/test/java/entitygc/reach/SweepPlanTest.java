package entitygc.reach;

import entitygc.model.GraphSnapshot;
import entitygc.model.ReferenceEdge;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SweepPlanTest {

  @Test
  void orphansAreEntitiesOutsideTheReachableSet() {
    GraphSnapshot snapshot = GraphSnapshot.of(
        List.of("A", "B", "C"),
        List.of(ReferenceEdge.root("p", "A")));

    SweepPlan plan = SweepPlan.of(snapshot, Set.of("A", "not-an-entity"));

    assertEquals(Set.of("B", "C"), plan.orphans());
    assertTrue(plan.childrenToMark().isEmpty());
    assertEquals(0, plan.orphanEdges());
  }

  @Test
  void marksEverySurvivingChildOfAnOrphan() {
    GraphSnapshot snapshot = GraphSnapshot.of(
        List.of("R", "X", "Y", "O"),
        List.of(
            ReferenceEdge.root("p", "R"),
            ReferenceEdge.internal("R", "X"),
            ReferenceEdge.internal("R", "Y"),
            ReferenceEdge.internal("O", "X"),
            ReferenceEdge.internal("O", "Y"),
            ReferenceEdge.internal("O", "O")));

    SweepPlan plan = SweepPlan.of(snapshot, Set.of("R", "X", "Y"));

    assertEquals(Set.of("O"), plan.orphans());
    assertEquals(Set.of("X", "Y"), plan.childrenToMark());
    assertEquals(3, plan.orphanEdges());
  }

  @Test
  void orphanChildrenAreNotMarked() {
    GraphSnapshot snapshot = GraphSnapshot.of(
        List.of("O1", "O2"),
        List.of(ReferenceEdge.internal("O1", "O2")));

    SweepPlan plan = SweepPlan.of(snapshot, Set.of());

    assertEquals(Set.of("O1", "O2"), plan.orphans());
    assertTrue(plan.childrenToMark().isEmpty());
  }

  @Test
  void danglingTargetsAreReportedButNotMarked() {
    GraphSnapshot snapshot = GraphSnapshot.of(
        List.of("O"),
        List.of(ReferenceEdge.internal("O", "gone")));

    SweepPlan plan = SweepPlan.of(snapshot, Set.of());

    assertTrue(plan.childrenToMark().isEmpty());
    assertEquals(Set.of("gone"), plan.danglingTargets());
  }

  @Test
  void edgesFromDeletedSourcesAreIgnored() {
    GraphSnapshot snapshot = GraphSnapshot.of(
        List.of("R", "C"),
        List.of(ReferenceEdge.root("p", "R"), ReferenceEdge.internal("R", "C"),
            ReferenceEdge.internal("already-deleted", "C")));

    SweepPlan plan = SweepPlan.of(snapshot, Set.of("R", "C"));

    assertTrue(plan.isEmpty());
    assertTrue(plan.childrenToMark().isEmpty());
  }
}
