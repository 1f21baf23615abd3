package org.retreat.placer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Room inventory reduced to the integer tables the optimizer needs, plus the
 * greedy org-to-building plan used as a soft bias.
 */
public class PlacementProblem {
    private static final Logger LOGGER = Logger.getLogger(PlacementProblem.class.getName());

    public final PlacementData data;
    /** Buildings in first-seen order. */
    public final List<String> buildings;
    /** Room choice that means "not placed". Equals the number of rooms. */
    public final int unassignedRoom;
    /** Building id of the unassigned room choice. Equals the number of buildings. */
    public final int unassignedBuilding;
    /** Building id per room choice, including the unassigned one at the end. */
    public final long[] roomBuilding;
    public final int[] roomCapacity;
    public final int[] roomBottomCapacity;
    public final int[] roomFloor;
    /** Total capacity per building, in first-seen order. */
    public final Map<String, Integer> buildingCapacity;
    /** Preferred buildings per org, from {@link #computeOrgBuildingAffinity}. */
    public final Map<String, Set<String>> orgPreferredBuildings;

    private PlacementProblem(PlacementData data, List<String> buildings, long[] roomBuilding,
                             int[] roomCapacity, int[] roomBottomCapacity, int[] roomFloor,
                             Map<String, Integer> buildingCapacity,
                             Map<String, Set<String>> orgPreferredBuildings) {
        this.data = data;
        this.buildings = Collections.unmodifiableList(buildings);
        this.unassignedRoom = data.rooms.size();
        this.unassignedBuilding = buildings.size();
        this.roomBuilding = roomBuilding;
        this.roomCapacity = roomCapacity;
        this.roomBottomCapacity = roomBottomCapacity;
        this.roomFloor = roomFloor;
        this.buildingCapacity = Collections.unmodifiableMap(buildingCapacity);
        this.orgPreferredBuildings = Collections.unmodifiableMap(orgPreferredBuildings);
    }

    public static PlacementProblem build(PlacementData data) {
        LOGGER.info("=== Building placement problem ===");

        List<String> buildings = new ArrayList<>();
        Map<String, Integer> buildingCapacity = new LinkedHashMap<>();
        for (PlacementData.Room room : data.rooms) {
            if (!buildingCapacity.containsKey(room.building)) {
                buildings.add(room.building);
            }
            buildingCapacity.merge(room.building, room.getTotalCapacity(), Integer::sum);
        }

        int roomCount = data.rooms.size();
        long[] roomBuilding = new long[roomCount + 1];
        int[] roomCapacity = new int[roomCount];
        int[] roomBottomCapacity = new int[roomCount];
        int[] roomFloor = new int[roomCount];
        for (PlacementData.Room room : data.rooms) {
            roomBuilding[room.index] = buildings.indexOf(room.building);
            roomCapacity[room.index] = room.getTotalCapacity();
            roomBottomCapacity[room.index] = room.bottomBunks;
            roomFloor[room.index] = room.floor;
        }
        roomBuilding[roomCount] = buildings.size();

        Map<String, Set<String>> orgPreferred = computeOrgBuildingAffinity(buildingCapacity, data.people);

        LOGGER.info(String.format("Rooms: %d, buildings: %d, bed slots: %d, people: %d",
                roomCount, buildings.size(), data.getTotalBedSlots(), data.people.size()));
        for (Map.Entry<String, Set<String>> entry : orgPreferred.entrySet()) {
            long members = data.people.stream().filter(p -> p.orgName.equals(entry.getKey())).count();
            LOGGER.info(String.format("  Org %s (%d people) -> %s", entry.getKey(), members, entry.getValue()));
        }

        return new PlacementProblem(data, buildings, roomBuilding, roomCapacity, roomBottomCapacity, roomFloor,
                buildingCapacity, orgPreferred);
    }

    /**
     * Greedy plan: largest org first takes capacity from the buildings with the
     * most remaining room until its members are covered. Both sorts are stable.
     */
    static Map<String, Set<String>> computeOrgBuildingAffinity(Map<String, Integer> buildingCapacity,
                                                               List<PlacementData.Person> people) {
        Map<String, Integer> orgSizes = new LinkedHashMap<>();
        for (PlacementData.Person person : people) {
            if (!person.orgName.isEmpty()) {
                orgSizes.merge(person.orgName, 1, Integer::sum);
            }
        }

        List<Map.Entry<String, Integer>> sortedOrgs = new ArrayList<>(orgSizes.entrySet());
        sortedOrgs.sort(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()));

        Map<String, Integer> remaining = new LinkedHashMap<>(buildingCapacity);
        Map<String, Set<String>> plan = new LinkedHashMap<>();

        for (Map.Entry<String, Integer> org : sortedOrgs) {
            Set<String> touched = new LinkedHashSet<>();
            int needed = org.getValue();

            List<Map.Entry<String, Integer>> candidates = new ArrayList<>(remaining.entrySet());
            candidates.sort(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()));

            for (Map.Entry<String, Integer> building : candidates) {
                if (needed <= 0) {
                    break;
                }
                int capacity = building.getValue();
                if (capacity > 0) {
                    touched.add(building.getKey());
                    int take = Math.min(capacity, needed);
                    remaining.put(building.getKey(), capacity - take);
                    needed -= take;
                }
            }
            plan.put(org.getKey(), touched);
        }
        return plan;
    }

    public int getRoomCount() {
        return unassignedRoom;
    }

    /**
     * Room indexes whose building is in the org's preferred set.
     */
    public List<Integer> getPreferredRooms(String orgName) {
        Set<String> preferred = orgPreferredBuildings.get(orgName);
        List<Integer> rooms = new ArrayList<>();
        if (preferred == null) {
            return rooms;
        }
        for (PlacementData.Room room : data.rooms) {
            if (preferred.contains(room.building)) {
                rooms.add(room.index);
            }
        }
        return rooms;
    }
}
