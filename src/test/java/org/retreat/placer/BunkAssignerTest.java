package org.retreat.placer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BunkAssignerTest {

    private static PlacementData.Person person(int index, String first, boolean needsBottom) {
        return new PlacementData.Person(index, first, "Test", "", "", "", "Any",
                needsBottom ? "Bottom" : "Any", false, needsBottom);
    }

    @Test
    @DisplayName("bottom-bunk needs are served first, then roster order")
    void bottomFirst() {
        PlacementData.Room room = new PlacementData.Room(0, "Oak", "101", 1, 2, 2);
        List<BunkAssigner.BunkAssignment> assignments = BunkAssigner.assignRoom(room, Arrays.asList(
                person(0, "Ann", false), person(1, "Bob", true), person(2, "Cal", false), person(3, "Dee", true)));

        assertThat(assignments).extracting(a -> a.person.firstName).containsExactly("Bob", "Dee", "Ann", "Cal");
        assertThat(assignments).extracting(a -> a.tier).containsExactly(
                PlacementData.BunkTier.BOTTOM, PlacementData.BunkTier.BOTTOM,
                PlacementData.BunkTier.TOP, PlacementData.BunkTier.TOP);
    }

    @Test
    @DisplayName("spare bottom bunks go to the earliest people on the roster")
    void spareBottomBunks() {
        PlacementData.Room room = new PlacementData.Room(0, "Oak", "101", 1, 1, 2);
        List<BunkAssigner.BunkAssignment> assignments = BunkAssigner.assignRoom(room, Arrays.asList(
                person(5, "Eve", false), person(2, "Cal", false)));

        assertThat(assignments).extracting(a -> a.person.firstName).containsExactly("Cal", "Eve");
        assertThat(assignments.get(0).tier).isEqualTo(PlacementData.BunkTier.BOTTOM);
        assertThat(assignments.get(1).tier).isEqualTo(PlacementData.BunkTier.TOP);
    }

    @Test
    @DisplayName("more occupants than bunks is an error")
    void overCapacity() {
        PlacementData.Room room = new PlacementData.Room(0, "Oak", "101", 1, 1, 0);

        assertThatThrownBy(() -> BunkAssigner.assignRoom(room,
                Arrays.asList(person(0, "Ann", false), person(1, "Bob", false))))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("solve results are grouped by room")
    void assignBunksFromResult() {
        PlacementData data = TestRosters.data(
                Arrays.asList(TestRosters.room("Oak", "101", 1, 1, 1), TestRosters.room("Oak", "102", 1, 1, 0)),
                TestRosters.person("Ann", "Lee", "", "", ""),
                TestRosters.person("Bob", "Jones", "", "", "", "Any", "Bottom"),
                TestRosters.person("Cal", "Diaz", "", "", ""),
                TestRosters.person("Dee", "Fox", "", "", ""));
        PlacementCPSATOptimizer.SoftConstraintStats stats =
                new PlacementCPSATOptimizer.SoftConstraintStats(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);
        PlacementCPSATOptimizer.SolveResult result = new PlacementCPSATOptimizer.SolveResult(
                PlacementCPSATOptimizer.SolveStatus.OPTIMAL, new int[]{1, 0, 0, -1}, 0, 0, 1, stats);

        List<BunkAssigner.BunkAssignment> assignments = new BunkAssigner(data).assignBunks(result);

        assertThat(assignments).extracting(BunkAssigner.BunkAssignment::toString).containsExactly(
                "Bob Jones -> Oak / 101 (Bottom)",
                "Cal Diaz -> Oak / 101 (Top)",
                "Ann Lee -> Oak / 102 (Bottom)");
    }
}
