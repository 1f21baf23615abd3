package org.retreat.placer;

import java.util.*;
import java.util.logging.Logger;

/**
 * Hands out concrete bunk tiers after solving.
 * Per room, people who need a bottom bunk go first (otherwise roster order),
 * the bottom tier is filled in that order and everyone left gets a top bunk.
 */
public class BunkAssigner {
    private static final Logger LOGGER = Logger.getLogger(BunkAssigner.class.getName());

    /**
     * A placed person with a room and tier.
     */
    public static class BunkAssignment {
        public final PlacementData.Person person;
        public final PlacementData.Room room;
        public final PlacementData.BunkTier tier;

        public BunkAssignment(PlacementData.Person person, PlacementData.Room room, PlacementData.BunkTier tier) {
            this.person = person;
            this.room = room;
            this.tier = tier;
        }

        @Override
        public String toString() {
            return person.getFullName() + " -> " + room.getKey() + " (" + tier.displayName + ")";
        }
    }

    private static final Comparator<PlacementData.Person> BOTTOM_FIRST =
            Comparator.comparing((PlacementData.Person p) -> p.needsBottomBunk ? 0 : 1)
                    .thenComparingInt(p -> p.index);

    private final PlacementData data;

    public BunkAssigner(PlacementData data) {
        this.data = data;
    }

    /**
     * Assigns tiers for every placed person, grouped by room in room order.
     */
    public List<BunkAssignment> assignBunks(PlacementCPSATOptimizer.SolveResult result) {
        Map<Integer, List<PlacementData.Person>> occupantsByRoom = new TreeMap<>();
        for (PlacementData.Person person : data.people) {
            if (result.isAssigned(person.index)) {
                occupantsByRoom.computeIfAbsent(result.getRoomIndex(person.index), k -> new ArrayList<>())
                        .add(person);
            }
        }

        List<BunkAssignment> assignments = new ArrayList<>();
        for (Map.Entry<Integer, List<PlacementData.Person>> entry : occupantsByRoom.entrySet()) {
            PlacementData.Room room = data.rooms.get(entry.getKey());
            assignments.addAll(assignRoom(room, entry.getValue()));
        }
        return assignments;
    }

    static List<BunkAssignment> assignRoom(PlacementData.Room room, List<PlacementData.Person> occupants) {
        if (occupants.size() > room.getTotalCapacity()) {
            throw new IllegalStateException(String.format("%s holds %d people but has %d bunks",
                    room.getKey(), occupants.size(), room.getTotalCapacity()));
        }

        List<PlacementData.Person> ordered = new ArrayList<>(occupants);
        ordered.sort(BOTTOM_FIRST);

        List<BunkAssignment> assignments = new ArrayList<>();
        int bottomUsed = 0;
        for (PlacementData.Person person : ordered) {
            PlacementData.BunkTier tier;
            if (bottomUsed < room.bottomBunks) {
                tier = PlacementData.BunkTier.BOTTOM;
                bottomUsed++;
            } else {
                tier = PlacementData.BunkTier.TOP;
                if (person.needsBottomBunk) {
                    LOGGER.warning(person.getFullName() + " needs a bottom bunk but got a top bunk in " + room.getKey());
                }
            }
            assignments.add(new BunkAssignment(person, room, tier));
        }
        return assignments;
    }
}
