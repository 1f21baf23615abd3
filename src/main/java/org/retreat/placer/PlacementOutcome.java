package org.retreat.placer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Everything a placement run produces: placements with tiers, unplaced people
 * with reasons, the attach resolution audit log and summary counts.
 */
public class PlacementOutcome {

    /**
     * A placed person.
     */
    public static class PlacementRecord {
        public final PlacementData.Person person;
        public final String building;
        public final String room;
        public final int floor;
        public final PlacementData.BunkTier bunk;
        /** Full name of the resolved attach target, or "". */
        public final String attachResolved;

        public PlacementRecord(PlacementData.Person person, String building, String room, int floor,
                               PlacementData.BunkTier bunk, String attachResolved) {
            this.person = person;
            this.building = building;
            this.room = room;
            this.floor = floor;
            this.bunk = bunk;
            this.attachResolved = attachResolved;
        }

        @Override
        public String toString() {
            return person.getFullName() + " -> " + building + " / " + room + " (" + bunk.displayName + ")";
        }
    }

    /**
     * A person left unplaced, with reasons most specific first.
     */
    public static class UnplacedRecord {
        public final PlacementData.Person person;
        public final String attachResolved;
        public final List<String> reasons;

        public UnplacedRecord(PlacementData.Person person, String attachResolved, List<String> reasons) {
            this.person = person;
            this.attachResolved = attachResolved;
            this.reasons = Collections.unmodifiableList(new ArrayList<>(reasons));
        }
    }

    public final List<PlacementRecord> placements;
    public final List<UnplacedRecord> unplaced;
    public final List<AttachResolver.ResolutionEntry> auditLog;
    public final PlacementCPSATOptimizer.SolveStatus status;
    public final PlacementSummary summary;

    public PlacementOutcome(List<PlacementRecord> placements, List<UnplacedRecord> unplaced,
                            List<AttachResolver.ResolutionEntry> auditLog,
                            PlacementCPSATOptimizer.SolveStatus status, PlacementSummary summary) {
        this.placements = Collections.unmodifiableList(new ArrayList<>(placements));
        this.unplaced = Collections.unmodifiableList(new ArrayList<>(unplaced));
        this.auditLog = auditLog;
        this.status = status;
        this.summary = summary;
    }

    public PlacementRecord findPlacement(String firstName, String lastName) {
        for (PlacementRecord record : placements) {
            if (record.person.firstName.equals(firstName) && record.person.lastName.equals(lastName)) {
                return record;
            }
        }
        return null;
    }

    public UnplacedRecord findUnplaced(String firstName, String lastName) {
        for (UnplacedRecord record : unplaced) {
            if (record.person.firstName.equals(firstName) && record.person.lastName.equals(lastName)) {
                return record;
            }
        }
        return null;
    }

    public void printDetailedSummary() {
        String rule = "======================================================================";
        System.out.println("\n" + rule);
        System.out.println("RETREAT CENTER PLACEMENT RESULTS");
        System.out.println(rule);

        System.out.printf("\n  Total bed slots : %d\n", summary.totalBedSlots);
        System.out.printf("  People placed   : %d\n", summary.placedCount);
        System.out.printf("  People unplaced : %d\n", summary.unplacedCount);
        System.out.printf("  Solution        : %s\n", status);

        if (!placements.isEmpty()) {
            System.out.println("\n  By building:");
            for (Map.Entry<String, Integer> entry : summary.placedByBuilding.entrySet()) {
                System.out.printf("    %s: %d\n", entry.getKey(), entry.getValue());
            }

            System.out.println("\n  Org-Building distribution:");
            for (Map.Entry<String, Map<String, Integer>> org : summary.placedByOrgAndBuilding.entrySet()) {
                List<String> parts = new ArrayList<>();
                for (Map.Entry<String, Integer> building : org.getValue().entrySet()) {
                    parts.add(building.getKey() + ":" + building.getValue());
                }
                System.out.printf("    %s: %s\n", org.getKey(), String.join(", ", parts));
            }
        }

        if (!unplaced.isEmpty()) {
            System.out.println("\n" + rule.replace('=', '-'));
            System.out.println("UNPLACED PEOPLE");
            System.out.println(rule.replace('=', '-'));
            for (UnplacedRecord record : unplaced) {
                PlacementData.Person p = record.person;
                System.out.printf("\n  %s  (Org=%s, Group=%s, Attach=%s, FloorPref=%s, BunkPref=%s)\n",
                        p.getFullName(), p.orgName, p.groupName, p.attachName, p.roomLocationPref, p.bunkPref);
                for (String reason : record.reasons) {
                    System.out.println("    -> " + reason);
                }
            }
        } else {
            System.out.println("\n  All people placed successfully!");
        }
        System.out.println(rule);
    }
}
