package org.retreat.placer;

import java.util.ArrayList;
import java.util.List;

/**
 * Best-guess reasons why a person was left unplaced. Heuristic, not a proof.
 */
public class UnplacedDiagnostics {
    static final String FALLBACK_REASON = "Capacity exhausted or competing constraints";

    private final PlacementData data;
    private final AttachResolver.AttachResolution attach;
    private final PlacementCPSATOptimizer.SolveResult result;

    private final int floorOneRooms;
    private final int bottomBunks;
    private final int floorOneBottomBunks;

    public UnplacedDiagnostics(PlacementData data, AttachResolver.AttachResolution attach,
                               PlacementCPSATOptimizer.SolveResult result) {
        this.data = data;
        this.attach = attach;
        this.result = result;

        int rooms = 0;
        int bottom = 0;
        int floorOneBottom = 0;
        for (PlacementData.Room room : data.rooms) {
            bottom += room.bottomBunks;
            if (room.floor == 1) {
                rooms++;
                floorOneBottom += room.bottomBunks;
            }
        }
        this.floorOneRooms = rooms;
        this.bottomBunks = bottom;
        this.floorOneBottomBunks = floorOneBottom;
    }

    /**
     * Reasons in order: scarcity, attach partner, unresolved attach, cohort pressure.
     * Never empty.
     */
    public List<String> diagnose(PlacementData.Person person) {
        List<String> reasons = new ArrayList<>();

        if (person.needsBottomBunk && person.needsFloorOne) {
            reasons.add(floorOneBottomBunks == 0
                    ? "Needs bottom bunk on floor 1 (no such bunks exist)"
                    : String.format("Needs bottom bunk on floor 1 (%d such bunks exist, likely full)",
                    floorOneBottomBunks));
        } else if (person.needsBottomBunk) {
            reasons.add(bottomBunks == 0
                    ? "Needs bottom bunk (no bottom bunks exist)"
                    : String.format("Needs bottom bunk (%d exist total, high demand)", bottomBunks));
        } else if (person.needsFloorOne) {
            reasons.add(floorOneRooms == 0
                    ? "Needs floor 1 (no floor 1 rooms exist)"
                    : String.format("Needs floor 1 (%d rooms exist)", floorOneRooms));
        }

        int partnerIndex = attach.getTarget(person.index);
        if (partnerIndex >= 0) {
            PlacementData.Person partner = data.people.get(partnerIndex);
            if (!result.isAssigned(partnerIndex)) {
                reasons.add(String.format("Attached to '%s' who is also unplaced", partner.getFullName()));
            } else {
                PlacementData.Room partnerRoom = data.rooms.get(result.getRoomIndex(partnerIndex));
                if (person.needsFloorOne && partnerRoom.floor != 1) {
                    reasons.add(String.format("Attached to '%s' (placed on floor %d, this person needs floor 1)",
                            partner.getFullName(), partnerRoom.floor));
                } else {
                    reasons.add(String.format("Attached to '%s' (placed), room may have been full",
                            partner.getFullName()));
                }
            }
        } else if (!person.attachName.isEmpty() && !attach.isCohortReference(person.index)) {
            reasons.add(String.format("AttachName '%s' could not be resolved to a person in the list",
                    person.attachName));
        }

        if (!person.groupName.isEmpty()) {
            reasons.add(String.format("Group '%s' cohesion constraints may have limited options", person.groupName));
        }
        if (!person.orgName.isEmpty()) {
            reasons.add(String.format("Org '%s' building affinity may have limited available slots", person.orgName));
        }

        if (reasons.isEmpty()) {
            reasons.add(FALLBACK_REASON);
        }
        return reasons;
    }
}
