package org.retreat.placer;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Runs one placement: prepare, resolve attach names, build, solve, extract.
 * Each call builds a fresh model; nothing is kept between calls.
 */
public class RetreatPlacer {
    private static final Logger LOGGER = Logger.getLogger(RetreatPlacer.class.getName());

    private final PlacementConfig config;
    private final MatchingTables tables;

    public RetreatPlacer(PlacementConfig config, MatchingTables tables) {
        this.config = config;
        this.tables = tables;
    }

    public PlacementOutcome place(List<RosterPreparer.RawRoom> rooms, List<RosterPreparer.RawPerson> people) {
        return place(RosterPreparer.prepare(rooms, people));
    }

    public PlacementOutcome place(PlacementData data) {
        LOGGER.info("=== Retreat placement start ===");
        LOGGER.info("Config: " + config);

        AttachResolver.AttachResolution attach = new AttachResolver(tables).resolve(data);
        PlacementProblem problem = PlacementProblem.build(data);
        PlacementCPSATOptimizer.SolveResult result = PlacementCPSATOptimizer.optimize(problem, attach, config);

        List<PlacementOutcome.PlacementRecord> placements = new ArrayList<>();
        for (BunkAssigner.BunkAssignment bunk : new BunkAssigner(data).assignBunks(result)) {
            placements.add(new PlacementOutcome.PlacementRecord(bunk.person, bunk.room.building, bunk.room.name,
                    bunk.room.floor, bunk.tier, attach.getResolvedName(bunk.person.index)));
        }

        UnplacedDiagnostics diagnostics = new UnplacedDiagnostics(data, attach, result);
        List<PlacementOutcome.UnplacedRecord> unplaced = new ArrayList<>();
        for (PlacementData.Person person : data.people) {
            if (!result.isAssigned(person.index)) {
                unplaced.add(new PlacementOutcome.UnplacedRecord(person, attach.getResolvedName(person.index),
                        diagnostics.diagnose(person)));
            }
        }

        PlacementSummary summary = new PlacementSummary(data.getTotalBedSlots(), placements, unplaced, result.stats);
        LOGGER.info(String.format("=== Retreat placement done: %d placed, %d unplaced (%s) ===",
                summary.placedCount, summary.unplacedCount, result.status));

        return new PlacementOutcome(placements, unplaced, attach.entries, result.status, summary);
    }
}
