package org.retreat.placer;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregate counts for one placement run.
 */
public class PlacementSummary {
    public final int totalBedSlots;
    public final int totalPeople;
    public final int placedCount;
    public final int unplacedCount;
    /** Placed people per building, sorted by building name. */
    public final Map<String, Integer> placedByBuilding;
    /** Placed people per org and building, both sorted by name. Empty org is kept as "". */
    public final Map<String, Map<String, Integer>> placedByOrgAndBuilding;
    public final PlacementCPSATOptimizer.SoftConstraintStats softConstraints;

    public PlacementSummary(int totalBedSlots, List<PlacementOutcome.PlacementRecord> placements,
                            List<PlacementOutcome.UnplacedRecord> unplaced,
                            PlacementCPSATOptimizer.SoftConstraintStats softConstraints) {
        Map<String, Integer> byBuilding = new TreeMap<>();
        Map<String, Map<String, Integer>> byOrg = new TreeMap<>();
        for (PlacementOutcome.PlacementRecord record : placements) {
            byBuilding.merge(record.building, 1, Integer::sum);
            byOrg.computeIfAbsent(record.person.orgName, k -> new TreeMap<>())
                    .merge(record.building, 1, Integer::sum);
        }
        for (Map.Entry<String, Map<String, Integer>> entry : byOrg.entrySet()) {
            entry.setValue(Collections.unmodifiableMap(entry.getValue()));
        }

        this.totalBedSlots = totalBedSlots;
        this.placedCount = placements.size();
        this.unplacedCount = unplaced.size();
        this.totalPeople = placedCount + unplacedCount;
        this.placedByBuilding = Collections.unmodifiableMap(byBuilding);
        this.placedByOrgAndBuilding = Collections.unmodifiableMap(byOrg);
        this.softConstraints = softConstraints;
    }
}
