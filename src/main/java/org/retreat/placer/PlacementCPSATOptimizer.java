package org.retreat.placer;

import com.google.ortools.sat.*;
import java.util.*;
import java.util.logging.Logger;

/**
 * CP-SAT model for placing people into rooms.
 *
 * Each person picks a room id in {@code 0..rooms}, where the last value means
 * unassigned. Bunk tiers are not modelled; only the bottom-tier count per room
 * limits people who need a bottom bunk. Tiers are handed out afterwards by
 * {@link BunkAssigner}.
 *
 * Hard: room capacity, bottom capacity, floor 1 requirement, mutual attach pairs
 * share a room when both are placed.
 * Soft: one-directional attach and group pairs share a room, org pairs share a
 * building, people land in their org's preferred buildings.
 */
public class PlacementCPSATOptimizer {
    private static final Logger LOGGER = Logger.getLogger(PlacementCPSATOptimizer.class.getName());

    static {
        com.google.ortools.Loader.loadNativeLibraries();
    }

    /**
     * Terminal solver outcome. Anything else is an {@link InfeasibleModelException}.
     */
    public enum SolveStatus {
        OPTIMAL,
        /** Time budget reached with a solution that is not proven optimal. */
        FEASIBLE
    }

    /**
     * How many soft pairs were satisfied in the returned solution.
     */
    public static class SoftConstraintStats {
        public final int groupPairs;
        public final int groupMatched;
        public final int groupMismatched;
        public final int attachPairs;
        public final int attachMatched;
        public final int attachMismatched;
        public final int mutualPairs;
        public final int orgPairs;
        public final int orgMatched;
        public final int orgMismatched;
        public final int affinityTargets;
        public final int affinityMatched;

        public SoftConstraintStats(int groupPairs, int groupMatched, int groupMismatched,
                                   int attachPairs, int attachMatched, int attachMismatched, int mutualPairs,
                                   int orgPairs, int orgMatched, int orgMismatched,
                                   int affinityTargets, int affinityMatched) {
            this.groupPairs = groupPairs;
            this.groupMatched = groupMatched;
            this.groupMismatched = groupMismatched;
            this.attachPairs = attachPairs;
            this.attachMatched = attachMatched;
            this.attachMismatched = attachMismatched;
            this.mutualPairs = mutualPairs;
            this.orgPairs = orgPairs;
            this.orgMatched = orgMatched;
            this.orgMismatched = orgMismatched;
            this.affinityTargets = affinityTargets;
            this.affinityMatched = affinityMatched;
        }
    }

    public static class SolveResult {
        public final SolveStatus status;
        /** Room index per person, -1 when unassigned. */
        private final int[] roomOfPerson;
        public final double objectiveValue;
        public final double wallTimeSeconds;
        public final long placementWeight;
        public final SoftConstraintStats stats;

        public SolveResult(SolveStatus status, int[] roomOfPerson, double objectiveValue, double wallTimeSeconds,
                           long placementWeight, SoftConstraintStats stats) {
            this.status = status;
            this.roomOfPerson = roomOfPerson.clone();
            this.objectiveValue = objectiveValue;
            this.wallTimeSeconds = wallTimeSeconds;
            this.placementWeight = placementWeight;
            this.stats = stats;
        }

        public boolean isAssigned(int personIndex) {
            return roomOfPerson[personIndex] >= 0;
        }

        public int getRoomIndex(int personIndex) {
            return roomOfPerson[personIndex];
        }

        public int getAssignedCount() {
            int count = 0;
            for (int room : roomOfPerson) {
                if (room >= 0) {
                    count++;
                }
            }
            return count;
        }
    }

    /**
     * The two indicator variables behind one soft pair.
     */
    private static class SoftPair {
        final BoolVar matched;
        final BoolVar mismatched;

        SoftPair(BoolVar matched, BoolVar mismatched) {
            this.matched = matched;
            this.mismatched = mismatched;
        }
    }

    public static SolveResult optimize(PlacementProblem problem, AttachResolver.AttachResolution attach,
                                       PlacementConfig config) {
        LOGGER.info("=== CP-SAT placement optimization ===");

        List<PlacementData.Person> people = problem.data.people;
        int numPeople = people.size();
        int numRooms = problem.getRoomCount();

        CpModel model = new CpModel();

        // Decision: room id per person, derived building id
        IntVar[] roomId = new IntVar[numPeople];
        IntVar[] buildingId = new IntVar[numPeople];
        BoolVar[] assigned = new BoolVar[numPeople];
        BoolVar[][] inRoom = new BoolVar[numPeople][numRooms];

        for (int p = 0; p < numPeople; p++) {
            roomId[p] = model.newIntVar(0, problem.unassignedRoom, "rid_" + p);
            buildingId[p] = model.newIntVar(0, problem.unassignedBuilding, "bid_" + p);
            model.addElement(roomId[p], problem.roomBuilding, buildingId[p]);

            assigned[p] = model.newBoolVar("asgn_" + p);
            model.addDifferent(roomId[p], problem.unassignedRoom).onlyEnforceIf(assigned[p]);
            model.addEquality(roomId[p], problem.unassignedRoom).onlyEnforceIf(assigned[p].not());

            for (int r = 0; r < numRooms; r++) {
                BoolVar b = model.newBoolVar("ir_" + p + "_" + r);
                model.addEquality(roomId[p], r).onlyEnforceIf(b);
                model.addDifferent(roomId[p], r).onlyEnforceIf(b.not());
                inRoom[p][r] = b;
            }
            model.addEquality(LinearExpr.sum(inRoom[p]), assigned[p]);
        }

        // H1: room capacity
        // H2: bottom bunk capacity
        for (int r = 0; r < numRooms; r++) {
            List<BoolVar> occupants = new ArrayList<>();
            List<BoolVar> bottomOccupants = new ArrayList<>();
            for (int p = 0; p < numPeople; p++) {
                occupants.add(inRoom[p][r]);
                if (people.get(p).needsBottomBunk) {
                    bottomOccupants.add(inRoom[p][r]);
                }
            }
            if (!occupants.isEmpty()) {
                model.addLessOrEqual(LinearExpr.sum(occupants.toArray(new BoolVar[0])), problem.roomCapacity[r]);
            }
            if (!bottomOccupants.isEmpty()) {
                model.addLessOrEqual(LinearExpr.sum(bottomOccupants.toArray(new BoolVar[0])),
                        problem.roomBottomCapacity[r]);
            }
        }

        // H3: floor 1 requirement
        List<Long> floorOneChoices = new ArrayList<>();
        for (int r = 0; r < numRooms; r++) {
            if (problem.roomFloor[r] == 1) {
                floorOneChoices.add((long) r);
            }
        }
        floorOneChoices.add((long) problem.unassignedRoom);
        long[][] floorOneTuples = new long[floorOneChoices.size()][];
        for (int i = 0; i < floorOneChoices.size(); i++) {
            floorOneTuples[i] = new long[]{floorOneChoices.get(i)};
        }
        for (int p = 0; p < numPeople; p++) {
            if (people.get(p).needsFloorOne) {
                model.addAllowedAssignments(new IntVar[]{roomId[p]}).addTuples(floorOneTuples);
            }
        }

        // H4: mutual attach pairs share a room when both are placed
        Set<AttachResolver.AttachPair> mutualPairs = attach.getMutualPairs();
        for (AttachResolver.AttachPair pair : mutualPairs) {
            BoolVar both = bothAssigned(model, assigned, pair.first, pair.second, "att_b_" + pair);
            model.addEquality(roomId[pair.first], roomId[pair.second]).onlyEnforceIf(both);
        }

        // S-attach: one-directional links, room level
        List<SoftPair> attachPairs = new ArrayList<>();
        for (AttachResolver.AttachPair pair : attach.getOneDirectionalPairs()) {
            attachPairs.add(softPair(model, assigned, roomId, pair.first, pair.second, "ats_" + pair));
        }

        // S-group: consecutive group members, room level
        List<SoftPair> groupPairs = new ArrayList<>();
        for (Map.Entry<String, List<Integer>> group : cohorts(people, true).entrySet()) {
            List<Integer> members = group.getValue();
            for (int i = 0; i < members.size() - 1; i++) {
                groupPairs.add(softPair(model, assigned, roomId, members.get(i), members.get(i + 1),
                        "g_" + group.getKey() + "_" + i));
            }
        }

        // S-org: consecutive org members, building level
        List<SoftPair> orgPairs = new ArrayList<>();
        for (Map.Entry<String, List<Integer>> org : cohorts(people, false).entrySet()) {
            List<Integer> members = org.getValue();
            for (int i = 0; i < members.size() - 1; i++) {
                orgPairs.add(softPair(model, assigned, buildingId, members.get(i), members.get(i + 1),
                        "o_" + org.getKey() + "_" + i));
            }
        }

        // S-affinity: placed inside the org's preferred buildings
        List<BoolVar> affinityVars = new ArrayList<>();
        for (int p = 0; p < numPeople; p++) {
            String org = people.get(p).orgName;
            if (org.isEmpty() || !problem.orgPreferredBuildings.containsKey(org)) {
                continue;
            }
            List<BoolVar> preferredRooms = new ArrayList<>();
            for (int r : problem.getPreferredRooms(org)) {
                preferredRooms.add(inRoom[p][r]);
            }
            BoolVar inPreferred = model.newBoolVar("afn_" + p);
            model.addEquality(inPreferred, LinearExpr.sum(preferredRooms.toArray(new BoolVar[0])));
            affinityVars.add(inPreferred);
        }

        LOGGER.info(String.format("Attach pairs: %d mutual (hard), %d one-directional (soft)",
                mutualPairs.size(), attachPairs.size()));
        LOGGER.info(String.format("Soft pairs: %d group, %d org, %d affinity targets",
                groupPairs.size(), orgPairs.size(), affinityVars.size()));

        // Objective
        long softSwing = 2 * config.groupWeight * groupPairs.size()
                + 2 * config.attachWeight * attachPairs.size()
                + 2 * config.orgWeight * orgPairs.size()
                + config.affinityWeight * affinityVars.size();
        long placeWeight = effectivePlacementWeight(config.placeWeight, softSwing);
        if (placeWeight != config.placeWeight) {
            LOGGER.info(String.format("Placement weight raised from %d to %d (soft swing %d)",
                    config.placeWeight, placeWeight, softSwing));
        }

        LinearExprBuilder objective = LinearExpr.newBuilder();
        for (BoolVar a : assigned) {
            objective.addTerm(a, placeWeight);
        }
        addSoftTerms(objective, groupPairs, config.groupWeight);
        addSoftTerms(objective, attachPairs, config.attachWeight);
        addSoftTerms(objective, orgPairs, config.orgWeight);
        for (BoolVar a : affinityVars) {
            objective.addTerm(a, config.affinityWeight);
        }
        model.maximize(objective.build());

        // Solve
        CpSolver solver = new CpSolver();
        solver.getParameters().setMaxTimeInSeconds(config.timeLimitSeconds);
        solver.getParameters().setNumSearchWorkers(config.searchWorkers);

        CpSolverStatus status = solver.solve(model);

        SolveStatus solveStatus = toSolveStatus(status, config.timeLimitSeconds);
        if (solveStatus == SolveStatus.FEASIBLE) {
            LOGGER.warning("Time budget reached, solution is feasible but not proven optimal");
        }

        int[] roomOfPerson = new int[numPeople];
        for (int p = 0; p < numPeople; p++) {
            int rid = (int) solver.value(roomId[p]);
            roomOfPerson[p] = rid == problem.unassignedRoom ? -1 : rid;
        }

        SoftConstraintStats stats = new SoftConstraintStats(
                groupPairs.size(), countMatched(solver, groupPairs), countMismatched(solver, groupPairs),
                attachPairs.size(), countMatched(solver, attachPairs), countMismatched(solver, attachPairs),
                mutualPairs.size(),
                orgPairs.size(), countMatched(solver, orgPairs), countMismatched(solver, orgPairs),
                affinityVars.size(), countTrue(solver, affinityVars));

        SolveResult result = new SolveResult(solveStatus, roomOfPerson, solver.objectiveValue(), solver.wallTime(),
                placeWeight, stats);

        LOGGER.info(String.format("Solution: %s, placed %d/%d, objective=%.0f, wall time=%.2fs",
                solveStatus, result.getAssignedCount(), numPeople, result.objectiveValue, result.wallTimeSeconds));
        LOGGER.info(String.format("  Group-same-room:       %d/%d matched, %d mismatched",
                stats.groupMatched, stats.groupPairs, stats.groupMismatched));
        LOGGER.info(String.format("  Attach-same-room:      %d/%d matched, %d mismatched",
                stats.attachMatched, stats.attachPairs, stats.attachMismatched));
        LOGGER.info(String.format("  Org-same-building:     %d/%d matched, %d mismatched",
                stats.orgMatched, stats.orgPairs, stats.orgMismatched));
        LOGGER.info(String.format("  Org-building affinity: %d/%d in preferred building",
                stats.affinityMatched, stats.affinityTargets));

        return result;
    }

    /**
     * OPTIMAL and FEASIBLE map to their {@link SolveStatus}. Every other status is
     * fatal: the empty assignment always satisfies the model.
     */
    static SolveStatus toSolveStatus(CpSolverStatus status, double timeLimitSeconds) {
        if (status == CpSolverStatus.OPTIMAL) {
            return SolveStatus.OPTIMAL;
        }
        if (status == CpSolverStatus.FEASIBLE) {
            return SolveStatus.FEASIBLE;
        }
        String message;
        if (status == CpSolverStatus.UNKNOWN) {
            message = String.format("Solver found no solution within %.1fs", timeLimitSeconds);
        } else {
            message = "Solver reported " + status + ", the placement model is defective";
        }
        LOGGER.severe(message);
        throw new InfeasibleModelException(message);
    }

    /**
     * Reward per placed person, kept strictly above the largest change the soft
     * terms can make to the objective.
     */
    static long effectivePlacementWeight(long configured, long softSwing) {
        return Math.max(configured, softSwing + 1);
    }

    /**
     * Members per nonempty group (or org) label, in roster order.
     */
    static Map<String, List<Integer>> cohorts(List<PlacementData.Person> people, boolean byGroup) {
        Map<String, List<Integer>> cohorts = new LinkedHashMap<>();
        for (PlacementData.Person person : people) {
            String label = byGroup ? person.groupName : person.orgName;
            if (!label.isEmpty()) {
                cohorts.computeIfAbsent(label, k -> new ArrayList<>()).add(person.index);
            }
        }
        return cohorts;
    }

    private static BoolVar bothAssigned(CpModel model, BoolVar[] assigned, int p1, int p2, String name) {
        BoolVar both = model.newBoolVar(name);
        model.addBoolAnd(new Literal[]{assigned[p1], assigned[p2]}).onlyEnforceIf(both);
        model.addBoolOr(new Literal[]{assigned[p1].not(), assigned[p2].not()}).onlyEnforceIf(both.not());
        return both;
    }

    /**
     * matched = both placed and equal choice; mismatched = both placed and different.
     * Neither is set when one of the two is unassigned.
     */
    private static SoftPair softPair(CpModel model, BoolVar[] assigned, IntVar[] choice, int p1, int p2,
                                     String name) {
        BoolVar both = bothAssigned(model, assigned, p1, p2, name + "_b");

        BoolVar same = model.newBoolVar(name + "_s");
        model.addEquality(choice[p1], choice[p2]).onlyEnforceIf(same);
        model.addDifferent(choice[p1], choice[p2]).onlyEnforceIf(same.not());

        BoolVar ok = model.newBoolVar(name + "_ok");
        model.addBoolAnd(new Literal[]{both, same}).onlyEnforceIf(ok);
        model.addBoolOr(new Literal[]{both.not(), same.not()}).onlyEnforceIf(ok.not());

        BoolVar mis = model.newBoolVar(name + "_mis");
        model.addBoolAnd(new Literal[]{both, same.not()}).onlyEnforceIf(mis);
        model.addBoolOr(new Literal[]{both.not(), same}).onlyEnforceIf(mis.not());

        return new SoftPair(ok, mis);
    }

    private static void addSoftTerms(LinearExprBuilder objective, List<SoftPair> pairs, long weight) {
        for (SoftPair pair : pairs) {
            objective.addTerm(pair.matched, weight);
            objective.addTerm(pair.mismatched, -weight);
        }
    }

    private static int countMatched(CpSolver solver, List<SoftPair> pairs) {
        int count = 0;
        for (SoftPair pair : pairs) {
            if (solver.booleanValue(pair.matched)) {
                count++;
            }
        }
        return count;
    }

    private static int countMismatched(CpSolver solver, List<SoftPair> pairs) {
        int count = 0;
        for (SoftPair pair : pairs) {
            if (solver.booleanValue(pair.mismatched)) {
                count++;
            }
        }
        return count;
    }

    private static int countTrue(CpSolver solver, List<BoolVar> vars) {
        int count = 0;
        for (BoolVar v : vars) {
            if (solver.booleanValue(v)) {
                count++;
            }
        }
        return count;
    }
}
