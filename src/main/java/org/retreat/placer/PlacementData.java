package org.retreat.placer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Validated rooms and people for one placement run.
 */
public class PlacementData {

    /**
     * Bunk tier inside a room.
     */
    public enum BunkTier {
        BOTTOM("Bottom"),
        TOP("Top");

        public final String displayName;

        BunkTier(String displayName) {
            this.displayName = displayName;
        }
    }

    /**
     * A room reduced to its two tier counts.
     */
    public static class Room {
        public final int index;
        public final String building;
        public final String name;
        public final int floor;
        public final int bottomBunks;
        public final int topBunks;

        public Room(int index, String building, String name, int floor, int bottomBunks, int topBunks) {
            this.index = index;
            this.building = building;
            this.name = name;
            this.floor = floor;
            this.bottomBunks = bottomBunks;
            this.topBunks = topBunks;
        }

        public int getTotalCapacity() {
            return bottomBunks + topBunks;
        }

        public String getKey() {
            return building + " / " + name;
        }

        @Override
        public String toString() {
            return getKey() + " (floor " + floor + ", bottom=" + bottomBunks + ", top=" + topBunks + ")";
        }
    }

    /**
     * A person on the roster. The index is the roster position.
     */
    public static class Person {
        public final int index;
        public final String firstName;
        public final String lastName;
        public final String orgName;
        public final String groupName;
        public final String attachName;
        public final String roomLocationPref;
        public final String bunkPref;
        public final boolean needsFloorOne;
        public final boolean needsBottomBunk;

        public Person(int index, String firstName, String lastName, String orgName, String groupName,
                      String attachName, String roomLocationPref, String bunkPref,
                      boolean needsFloorOne, boolean needsBottomBunk) {
            this.index = index;
            this.firstName = firstName;
            this.lastName = lastName;
            this.orgName = orgName;
            this.groupName = groupName;
            this.attachName = attachName;
            this.roomLocationPref = roomLocationPref;
            this.bunkPref = bunkPref;
            this.needsFloorOne = needsFloorOne;
            this.needsBottomBunk = needsBottomBunk;
        }

        public String getFullName() {
            return (firstName + " " + lastName).trim();
        }

        public boolean hasFullName() {
            return !firstName.isEmpty() && !lastName.isEmpty();
        }

        /**
         * Lowercase "first last" with single spaces, used for name matching.
         */
        public String getNameKey() {
            return normalizeName(firstName + " " + lastName);
        }

        @Override
        public String toString() {
            return getFullName() + " (Org=" + orgName + ", Group=" + groupName + ")";
        }
    }

    public final List<Room> rooms;
    public final List<Person> people;
    public final CohortLabels labels;

    public PlacementData(List<Room> rooms, List<Person> people, CohortLabels labels) {
        this.rooms = Collections.unmodifiableList(new ArrayList<>(rooms));
        this.people = Collections.unmodifiableList(new ArrayList<>(people));
        this.labels = labels;
    }

    public int getTotalBedSlots() {
        return rooms.stream().mapToInt(Room::getTotalCapacity).sum();
    }

    static String normalizeName(String text) {
        return text.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
