package org.retreat.placer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.retreat.placer.TestRosters.person;
import static org.retreat.placer.TestRosters.room;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RosterPreparerTest {

    private static final List<RosterPreparer.RawPerson> NOBODY = Collections.emptyList();

    @Test
    @DisplayName("text fields are trimmed and null becomes empty")
    void trimsFields() {
        RosterPreparer.RawPerson raw = new RosterPreparer.RawPerson(2, "  Ann ", null, " Alpha", "", null, " 1 ", "bottom ");
        PlacementData data = RosterPreparer.prepare(Arrays.asList(room("Oak", "101", 1, 1, 0)), Arrays.asList(raw));

        PlacementData.Person ann = data.people.get(0);
        assertThat(ann.firstName).isEqualTo("Ann");
        assertThat(ann.lastName).isEmpty();
        assertThat(ann.orgName).isEqualTo("Alpha");
        assertThat(ann.attachName).isEmpty();
        assertThat(ann.needsFloorOne).isTrue();
        assertThat(ann.needsBottomBunk).isTrue();
    }

    @Test
    @DisplayName("room counts written as spreadsheet decimals are accepted")
    void decimalCounts() {
        RosterPreparer.RawRoom raw = new RosterPreparer.RawRoom(2, "Oak", "101", "2.0", "2.0", "0");
        PlacementData data = RosterPreparer.prepare(Arrays.asList(raw), NOBODY);

        PlacementData.Room room = data.rooms.get(0);
        assertThat(room.floor).isEqualTo(2);
        assertThat(room.bottomBunks).isEqualTo(2);
        assertThat(room.getTotalCapacity()).isEqualTo(2);
    }

    @Test
    @DisplayName("a non-numeric capacity names the row and the column")
    void nonNumericCapacity() {
        RosterPreparer.RawRoom raw = new RosterPreparer.RawRoom(7, "Oak", "101", "1", "two", "0");

        assertThatThrownBy(() -> RosterPreparer.prepare(Arrays.asList(raw), NOBODY))
                .isInstanceOf(InputDataException.class)
                .hasMessageContaining("room row 7")
                .hasMessageContaining("#BottomBunk");
    }

    @Test
    @DisplayName("negative and fractional capacities are rejected")
    void invalidCapacities() {
        assertThatThrownBy(() -> RosterPreparer.prepare(
                Arrays.asList(new RosterPreparer.RawRoom(2, "Oak", "101", "1", "-1", "0")), NOBODY))
                .isInstanceOf(InputDataException.class)
                .hasMessageContaining("negative");
        assertThatThrownBy(() -> RosterPreparer.prepare(
                Arrays.asList(new RosterPreparer.RawRoom(2, "Oak", "101", "1", "1.5", "0")), NOBODY))
                .isInstanceOf(InputDataException.class);
    }

    @Test
    @DisplayName("floors other than 1 and 2 are rejected")
    void invalidFloor() {
        assertThatThrownBy(() -> RosterPreparer.prepare(Arrays.asList(room("Oak", "301", 3, 1, 1)), NOBODY))
                .isInstanceOf(InputDataException.class)
                .hasMessageContaining("RoomFloor");
    }

    @Test
    @DisplayName("duplicate rooms are rejected")
    void duplicateRoom() {
        assertThatThrownBy(() -> RosterPreparer.prepare(
                Arrays.asList(room("Oak", "101", 1, 1, 1), room("oak", "101", 1, 2, 2)), NOBODY))
                .isInstanceOf(InputDataException.class)
                .hasMessageContaining("duplicate");
    }

    @Test
    @DisplayName("requirement values outside the allowed set are rejected")
    void invalidRequirements() {
        List<RosterPreparer.RawRoom> rooms = Arrays.asList(room("Oak", "101", 1, 1, 1));

        assertThatThrownBy(() -> RosterPreparer.prepare(rooms,
                Arrays.asList(person("Ann", "Lee", "", "", "", "Any", "Top"))))
                .isInstanceOf(InputDataException.class)
                .hasMessageContaining("BunkPref");
        assertThatThrownBy(() -> RosterPreparer.prepare(rooms,
                Arrays.asList(person("Ann", "Lee", "", "", "", "2", "Any"))))
                .isInstanceOf(InputDataException.class)
                .hasMessageContaining("RoomLocationPref");
    }

    @Test
    @DisplayName("group and org labels are canonicalized to the first spelling")
    void canonicalizesLabels() {
        PlacementData data = TestRosters.people(
                person("Ann", "Lee", "Alpha", "MomLife", ""),
                person("Bob", "Jones", "ALPHA", "momlife", ""));

        assertThat(data.people.get(1).orgName).isEqualTo("Alpha");
        assertThat(data.people.get(1).groupName).isEqualTo("MomLife");
        assertThat(data.labels.getGroupLabels()).containsExactly("MomLife");
    }

    @Test
    @DisplayName("a group named in AttachName fills an empty GroupName")
    void autoAssignsGroup() {
        PlacementData data = TestRosters.people(
                person("Tina", "Gold", "", "Mom Life", ""),
                person("Hannah", "Emerson", "", "", "momlife"),
                person("Ivy", "Stone", "", "Choir", "momlife"));

        assertThat(data.people.get(1).groupName).isEqualTo("Mom Life");
        assertThat(data.people.get(1).attachName).isEqualTo("momlife");
        assertThat(data.people.get(2).groupName).isEqualTo("Choir");
    }
}
