package org.retreat.placer;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Turns raw room and roster rows into {@link PlacementData}.
 *
 * Trims every text field, validates numbers and requirement values, builds the
 * {@link CohortLabels} table and canonicalizes group and org names with it.
 */
public class RosterPreparer {
    private static final Logger LOGGER = Logger.getLogger(RosterPreparer.class.getName());

    /**
     * One row of the room inventory, as text.
     */
    public static class RawRoom {
        public final int rowNumber;
        public final String building;
        public final String room;
        public final String floor;
        public final String bottomBunks;
        public final String topBunks;

        public RawRoom(int rowNumber, String building, String room, String floor,
                       String bottomBunks, String topBunks) {
            this.rowNumber = rowNumber;
            this.building = clean(building);
            this.room = clean(room);
            this.floor = clean(floor);
            this.bottomBunks = clean(bottomBunks);
            this.topBunks = clean(topBunks);
        }

        @Override
        public String toString() {
            return "room row " + rowNumber + " [" + building + ", " + room + "]";
        }
    }

    /**
     * One row of the roster, as text.
     */
    public static class RawPerson {
        public final int rowNumber;
        public final String firstName;
        public final String lastName;
        public final String orgName;
        public final String groupName;
        public final String attachName;
        public final String roomLocationPref;
        public final String bunkPref;

        public RawPerson(int rowNumber, String firstName, String lastName, String orgName,
                         String groupName, String attachName, String roomLocationPref, String bunkPref) {
            this.rowNumber = rowNumber;
            this.firstName = clean(firstName);
            this.lastName = clean(lastName);
            this.orgName = clean(orgName);
            this.groupName = clean(groupName);
            this.attachName = clean(attachName);
            this.roomLocationPref = clean(roomLocationPref);
            this.bunkPref = clean(bunkPref);
        }

        @Override
        public String toString() {
            return "person row " + rowNumber + " [" + firstName + " " + lastName + "]";
        }
    }

    private RosterPreparer() {
    }

    public static PlacementData prepare(List<RawRoom> rawRooms, List<RawPerson> rawPeople) {
        List<PlacementData.Room> rooms = prepareRooms(rawRooms);

        CohortLabels labels = CohortLabels.fromRoster(
                rawPeople.stream().map(p -> p.groupName).collect(Collectors.toList()),
                rawPeople.stream().map(p -> p.orgName).collect(Collectors.toList()));

        List<PlacementData.Person> people = new ArrayList<>();
        int autoAssigned = 0;
        for (RawPerson raw : rawPeople) {
            boolean needsFloorOne = parseFloorRequirement(raw);
            boolean needsBottom = parseBunkRequirement(raw);

            String group = labels.canonicalGroup(raw.groupName);
            String org = labels.canonicalOrg(raw.orgName);

            // People sometimes put their group in AttachName instead of GroupName.
            if (group.isEmpty() && !raw.attachName.isEmpty()) {
                String referenced = labels.findGroupLabel(raw.attachName);
                if (referenced != null) {
                    group = referenced;
                    autoAssigned++;
                    LOGGER.info(String.format("Auto-assigned GroupName='%s' for %s %s (AttachName was '%s')",
                            referenced, raw.firstName, raw.lastName, raw.attachName));
                }
            }

            people.add(new PlacementData.Person(people.size(), raw.firstName, raw.lastName, org, group,
                    raw.attachName, raw.roomLocationPref, raw.bunkPref, needsFloorOne, needsBottom));
        }

        LOGGER.info(String.format("Prepared %d rooms, %d people (%d groups, %d orgs, %d group auto-assignments)",
                rooms.size(), people.size(), labels.getGroupLabels().size(), labels.getOrgLabels().size(),
                autoAssigned));

        return new PlacementData(rooms, people, labels);
    }

    private static List<PlacementData.Room> prepareRooms(List<RawRoom> rawRooms) {
        List<PlacementData.Room> rooms = new ArrayList<>();
        Set<String> seenKeys = new HashSet<>();

        for (RawRoom raw : rawRooms) {
            if (raw.building.isEmpty() || raw.room.isEmpty()) {
                throw fail(raw + ": BuildingName and RoomName are required");
            }
            int floor = parseCount(raw, "RoomFloor", raw.floor);
            if (floor != 1 && floor != 2) {
                throw fail(raw + ": RoomFloor must be 1 or 2 but was '" + raw.floor + "'");
            }
            int bottom = parseCount(raw, "#BottomBunk", raw.bottomBunks);
            int top = parseCount(raw, "#TopBunk", raw.topBunks);

            String key = raw.building.toLowerCase(Locale.ROOT) + "\u0000" + raw.room.toLowerCase(Locale.ROOT);
            if (!seenKeys.add(key)) {
                throw fail(raw + ": duplicate room " + raw.building + " / " + raw.room);
            }

            rooms.add(new PlacementData.Room(rooms.size(), raw.building, raw.room, floor, bottom, top));
        }
        return rooms;
    }

    /**
     * Parses a nonnegative whole number. Spreadsheet numbers such as "2.0" are accepted.
     */
    static int parseCount(Object record, String column, String value) {
        if (value.isEmpty()) {
            throw fail(record + ": " + column + " is empty");
        }
        int parsed;
        try {
            parsed = new BigDecimal(value).intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            String message = record + ": " + column + " is not a whole number: '" + value + "'";
            LOGGER.severe(message);
            throw new InputDataException(message, e);
        }
        if (parsed < 0) {
            throw fail(record + ": " + column + " must not be negative but was " + parsed);
        }
        return parsed;
    }

    private static boolean parseFloorRequirement(RawPerson raw) {
        String value = raw.roomLocationPref.toLowerCase(Locale.ROOT);
        if (value.isEmpty() || value.equals("any")) {
            return false;
        }
        if (value.equals("1") || value.equals("1.0")) {
            return true;
        }
        throw fail(raw + ": RoomLocationPref must be '1' or 'Any' but was '" + raw.roomLocationPref + "'");
    }

    private static boolean parseBunkRequirement(RawPerson raw) {
        String value = raw.bunkPref.toLowerCase(Locale.ROOT);
        if (value.isEmpty() || value.equals("any")) {
            return false;
        }
        if (value.equals("bottom")) {
            return true;
        }
        throw fail(raw + ": BunkPref must be 'Bottom' or 'Any' but was '" + raw.bunkPref + "'");
    }

    private static InputDataException fail(String message) {
        LOGGER.severe(message);
        return new InputDataException(message);
    }

    private static String clean(String value) {
        return value == null ? "" : value.trim();
    }
}
