package org.retreat.placer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Resolves free-text AttachName references to people on the roster.
 *
 * Stages, first success wins:
 * <ol>
 *   <li>cohort references (group/org names, curated phrases, lists of names) are skipped</li>
 *   <li>exact full name</li>
 *   <li>nickname expansion of the first name</li>
 *   <li>same last name, checked against the first name</li>
 *   <li>first name only</li>
 *   <li>first name plus a short last-name prefix</li>
 *   <li>fuzzy match boosted by group/org affinity</li>
 * </ol>
 * Ties inside a stage are broken by affinity: same group counts 2, same org 1.
 * An unresolved reference never stops the run; it only leaves the link absent.
 */
public class AttachResolver {
    private static final Logger LOGGER = Logger.getLogger(AttachResolver.class.getName());

    static final double AFFINITY_BOOST = 0.15;
    static final double FIRST_NAME_MIN_SIMILARITY = 0.4;
    static final double FUZZY_MIN_WITH_AFFINITY = 0.60;
    static final double FUZZY_MIN_WITHOUT_AFFINITY = 0.70;
    static final double FUZZY_CONFIDENT = 0.95;
    static final int SHORT_PREFIX_LENGTH = 3;

    public enum Stage {
        NON_PERSON("Skipped, cohort reference"),
        EXACT("Exact match"),
        NICKNAME("Nickname match"),
        LAST_NAME("Last-name match"),
        LAST_NAME_REJECTED("Last-name match rejected"),
        FIRST_NAME("First-name match"),
        LAST_NAME_PREFIX("Prefix match"),
        FUZZY("Fuzzy match"),
        UNRESOLVED("Unresolved");

        public final String displayName;

        Stage(String displayName) {
            this.displayName = displayName;
        }
    }

    /**
     * One line of the resolution audit log.
     */
    public static class ResolutionEntry {
        public final PlacementData.Person person;
        public final String attachValue;
        public final Stage stage;
        /** Resolved or rejected person; null when nobody was picked. */
        public final PlacementData.Person target;
        /** Similarity that decided the stage, NaN when the stage does not score. */
        public final double rawScore;
        public final int affinity;
        public final int candidateCount;
        public final boolean warning;
        public final String message;

        ResolutionEntry(PlacementData.Person person, Stage stage, PlacementData.Person target,
                        double rawScore, int affinity, int candidateCount, boolean warning, String message) {
            this.person = person;
            this.attachValue = person.attachName;
            this.stage = stage;
            this.target = target;
            this.rawScore = rawScore;
            this.affinity = affinity;
            this.candidateCount = candidateCount;
            this.warning = warning;
            this.message = message;
        }

        @Override
        public String toString() {
            return person.getFullName() + " -> '" + attachValue + "': " + message;
        }
    }

    /**
     * Two people linked by attach references, stored with the lower index first.
     */
    public static class AttachPair {
        public final int first;
        public final int second;

        AttachPair(int a, int b) {
            this.first = Math.min(a, b);
            this.second = Math.max(a, b);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof AttachPair)) return false;
            AttachPair other = (AttachPair) o;
            return first == other.first && second == other.second;
        }

        @Override
        public int hashCode() {
            return Objects.hash(first, second);
        }

        @Override
        public String toString() {
            return "(" + first + ", " + second + ")";
        }
    }

    /**
     * Result of resolving every reference on the roster.
     */
    public static class AttachResolution {
        private final List<PlacementData.Person> people;
        private final Map<Integer, Integer> links;
        private final Set<Integer> cohortReferences;
        public final List<ResolutionEntry> entries;

        AttachResolution(List<PlacementData.Person> people, Map<Integer, Integer> links,
                         Set<Integer> cohortReferences, List<ResolutionEntry> entries) {
            this.people = people;
            this.links = Collections.unmodifiableMap(new LinkedHashMap<>(links));
            this.cohortReferences = Collections.unmodifiableSet(new HashSet<>(cohortReferences));
            this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
        }

        public boolean hasLink(int personIndex) {
            return links.containsKey(personIndex);
        }

        /**
         * Index of the resolved target, or -1.
         */
        public int getTarget(int personIndex) {
            Integer target = links.get(personIndex);
            return target == null ? -1 : target;
        }

        public String getResolvedName(int personIndex) {
            int target = getTarget(personIndex);
            return target < 0 ? "" : people.get(target).getFullName();
        }

        public Map<Integer, Integer> getLinks() {
            return links;
        }

        public boolean isCohortReference(int personIndex) {
            return cohortReferences.contains(personIndex);
        }

        public boolean isMutual(int a, int b) {
            return getTarget(a) == b && getTarget(b) == a;
        }

        public Set<AttachPair> getMutualPairs() {
            Set<AttachPair> pairs = new LinkedHashSet<>();
            for (Map.Entry<Integer, Integer> link : links.entrySet()) {
                if (isMutual(link.getKey(), link.getValue())) {
                    pairs.add(new AttachPair(link.getKey(), link.getValue()));
                }
            }
            return pairs;
        }

        public Set<AttachPair> getOneDirectionalPairs() {
            Set<AttachPair> pairs = new LinkedHashSet<>();
            for (Map.Entry<Integer, Integer> link : links.entrySet()) {
                if (!isMutual(link.getKey(), link.getValue())) {
                    pairs.add(new AttachPair(link.getKey(), link.getValue()));
                }
            }
            return pairs;
        }

        public List<ResolutionEntry> getWarnings() {
            return entries.stream().filter(e -> e.warning).collect(Collectors.toList());
        }
    }

    private final MatchingTables tables;

    public AttachResolver(MatchingTables tables) {
        this.tables = tables;
    }

    /**
     * Group/org closeness of two people: +2 for a shared group, +1 for a shared org.
     */
    public static int affinityScore(PlacementData.Person source, PlacementData.Person candidate) {
        int score = 0;
        if (!source.groupName.isEmpty() && source.groupName.equals(candidate.groupName)) {
            score += 2;
        }
        if (!source.orgName.isEmpty() && source.orgName.equals(candidate.orgName)) {
            score += 1;
        }
        return score;
    }

    /**
     * Picks the candidate with the highest affinity. Returns null when the best
     * affinity is zero and shared by several candidates.
     */
    static PlacementData.Person pickByAffinity(PlacementData.Person source, List<PlacementData.Person> candidates) {
        if (candidates.isEmpty()) {
            return null;
        }
        int best = candidates.stream().mapToInt(c -> affinityScore(source, c)).max().getAsInt();
        List<PlacementData.Person> topTier = candidates.stream()
                .filter(c -> affinityScore(source, c) == best)
                .collect(Collectors.toList());
        if (topTier.size() == 1) {
            return topTier.get(0);
        }
        if (best == 0) {
            return null;
        }
        return topTier.get(0);
    }

    public AttachResolution resolve(PlacementData data) {
        LOGGER.info("=== AttachName resolution ===");

        Map<Integer, Integer> links = new LinkedHashMap<>();
        Set<Integer> cohortReferences = new HashSet<>();
        List<ResolutionEntry> entries = new ArrayList<>();

        for (PlacementData.Person person : data.people) {
            if (person.attachName.isEmpty()) {
                continue;
            }
            List<ResolutionEntry> personEntries = resolveOne(person, data);
            for (ResolutionEntry entry : personEntries) {
                if (entry.warning) {
                    LOGGER.warning(entry.toString());
                } else {
                    LOGGER.fine(entry.toString());
                }
            }
            entries.addAll(personEntries);

            ResolutionEntry last = personEntries.get(personEntries.size() - 1);
            if (last.stage == Stage.NON_PERSON) {
                cohortReferences.add(person.index);
            } else if (last.stage != Stage.UNRESOLVED && last.target != null) {
                links.put(person.index, last.target.index);
            }
        }

        AttachResolution resolution = new AttachResolution(data.people, links, cohortReferences, entries);
        LOGGER.info(String.format("Resolved %d links (%d mutual pairs, %d one-directional), %d warnings",
                links.size(), resolution.getMutualPairs().size(), resolution.getOneDirectionalPairs().size(),
                resolution.getWarnings().size()));
        return resolution;
    }

    /**
     * Runs the stages for one person. The last returned entry carries the outcome.
     */
    private List<ResolutionEntry> resolveOne(PlacementData.Person person, PlacementData data) {
        List<ResolutionEntry> log = new ArrayList<>();
        String reference = PlacementData.normalizeName(person.attachName);

        if (isNonPerson(reference, data.labels)) {
            log.add(new ResolutionEntry(person, Stage.NON_PERSON, null, Double.NaN, 0, 0, true,
                    String.format("Skipped: '%s' appears to be a group/org reference, not a person name",
                            person.attachName)));
            return log;
        }

        String[] parts = reference.split(" ");
        Set<Integer> rejected = new HashSet<>();

        ResolutionEntry exact = matchFullName(person, reference, data, Stage.EXACT);
        if (exact != null) {
            log.add(exact);
            return log;
        }

        if (parts.length >= 2) {
            String expandedFirst = tables.expandNickname(parts[0]);
            if (!expandedFirst.equals(parts[0])) {
                String expanded = expandedFirst + reference.substring(parts[0].length());
                ResolutionEntry nickname = matchFullName(person, expanded, data, Stage.NICKNAME);
                if (nickname != null) {
                    log.add(nickname);
                    return log;
                }
            }
        }

        if (parts.length == 2) {
            ResolutionEntry lastName = matchLastName(person, parts[0], parts[1], data);
            if (lastName != null) {
                log.add(lastName);
                if (lastName.stage == Stage.LAST_NAME) {
                    return log;
                }
                rejected.add(lastName.target.index);
            }
        }

        if (parts.length == 1) {
            String first = parts[0];
            List<PlacementData.Person> candidates = data.people.stream()
                    .filter(c -> c.index != person.index && c.hasFullName())
                    .filter(c -> firstToken(c.firstName).equals(first))
                    .collect(Collectors.toList());
            PlacementData.Person best = pickByAffinity(person, candidates);
            if (best != null) {
                int affinity = affinityScore(person, best);
                log.add(new ResolutionEntry(person, Stage.FIRST_NAME, best, Double.NaN, affinity,
                        candidates.size(), true,
                        String.format("First-name matched to '%s' (from %d candidates, affinity=%d)",
                                best.getFullName(), candidates.size(), affinity)));
                return log;
            }
        }

        if (parts.length == 2 && parts[1].length() <= SHORT_PREFIX_LENGTH) {
            String first = parts[0];
            String prefix = parts[1];
            List<PlacementData.Person> candidates = data.people.stream()
                    .filter(c -> c.index != person.index && c.hasFullName())
                    .filter(c -> PlacementData.normalizeName(c.firstName).equals(first))
                    .filter(c -> PlacementData.normalizeName(c.lastName).startsWith(prefix))
                    .collect(Collectors.toList());
            PlacementData.Person best = pickByAffinity(person, candidates);
            if (best != null) {
                int affinity = affinityScore(person, best);
                log.add(new ResolutionEntry(person, Stage.LAST_NAME_PREFIX, best, Double.NaN, affinity,
                        candidates.size(), true,
                        String.format("Prefix matched to '%s' (from %d candidates, affinity=%d)",
                                best.getFullName(), candidates.size(), affinity)));
                return log;
            }
        }

        log.add(matchFuzzy(person, reference, data, rejected));
        return log;
    }

    private boolean isNonPerson(String reference, CohortLabels labels) {
        return labels.isKnownLabel(reference)
                || tables.isNonPersonPhrase(reference)
                || tables.hasNonPersonPrefix(reference)
                || tables.hasSeparator(reference);
    }

    /**
     * Exact full-name lookup. Duplicate names are split by affinity; if that is
     * still a tie the first one on the roster is taken and flagged.
     */
    private ResolutionEntry matchFullName(PlacementData.Person person, String key, PlacementData data, Stage stage) {
        List<PlacementData.Person> matches = data.people.stream()
                .filter(c -> c.index != person.index && c.hasFullName())
                .filter(c -> c.getNameKey().equals(key))
                .collect(Collectors.toList());
        if (matches.isEmpty()) {
            return null;
        }
        PlacementData.Person best = pickByAffinity(person, matches);
        boolean ambiguous = best == null;
        if (ambiguous) {
            best = matches.get(0);
        }
        int affinity = affinityScore(person, best);
        String message;
        if (ambiguous) {
            message = String.format("%s to '%s' (ambiguous: %d people share this name, took the first)",
                    stage.displayName, best.getFullName(), matches.size());
        } else if (matches.size() > 1) {
            message = String.format("%s to '%s' (picked from %d people with this name, affinity=%d)",
                    stage.displayName, best.getFullName(), matches.size(), affinity);
        } else {
            message = String.format("%s to '%s'", stage.displayName, best.getFullName());
        }
        return new ResolutionEntry(person, stage, best, 1.0, affinity, matches.size(), matches.size() > 1, message);
    }

    /**
     * Same-last-name lookup. A pick whose first name looks unrelated is returned
     * as a {@link Stage#LAST_NAME_REJECTED} entry so the fuzzy stage can skip it.
     */
    private ResolutionEntry matchLastName(PlacementData.Person person, String first, String last, PlacementData data) {
        List<PlacementData.Person> candidates = data.people.stream()
                .filter(c -> c.index != person.index)
                .filter(c -> PlacementData.normalizeName(c.lastName).equals(last))
                .collect(Collectors.toList());
        PlacementData.Person best = pickByAffinity(person, candidates);
        if (best == null) {
            return null;
        }

        String candidateFirst = PlacementData.normalizeName(best.firstName);
        double similarity = NameSimilarity.ratio(first, candidateFirst);
        int affinity = affinityScore(person, best);
        boolean nickname = tables.expandNickname(first).equals(candidateFirst);

        if (similarity >= FIRST_NAME_MIN_SIMILARITY || affinity > 0 || nickname) {
            return new ResolutionEntry(person, Stage.LAST_NAME, best, similarity, affinity, candidates.size(), true,
                    String.format("Last-name matched to '%s' (picked from %d candidates, sim=%.2f, affinity=%d)",
                            best.getFullName(), candidates.size(), similarity, affinity));
        }
        return new ResolutionEntry(person, Stage.LAST_NAME_REJECTED, best, similarity, affinity, candidates.size(), true,
                String.format("Last-name match rejected: '%s' vs '%s' (sim=%.2f, affinity=%d), likely different person",
                        first, candidateFirst, similarity, affinity));
    }

    private ResolutionEntry matchFuzzy(PlacementData.Person person, String reference, PlacementData data,
                                       Set<Integer> rejected) {
        double bestCombined = 0;
        double bestRaw = 0;
        PlacementData.Person best = null;
        int considered = 0;

        for (PlacementData.Person candidate : data.people) {
            if (candidate.index == person.index || !candidate.hasFullName() || rejected.contains(candidate.index)) {
                continue;
            }
            considered++;
            double raw = NameSimilarity.ratio(reference, candidate.getNameKey());
            double combined = raw + affinityScore(person, candidate) * AFFINITY_BOOST;
            if (combined > bestCombined || (combined == bestCombined && raw > bestRaw)) {
                bestCombined = combined;
                bestRaw = raw;
                best = candidate;
            }
        }

        int affinity = best != null ? affinityScore(person, best) : 0;
        double threshold = affinity > 0 ? FUZZY_MIN_WITH_AFFINITY : FUZZY_MIN_WITHOUT_AFFINITY;

        if (best != null && bestRaw >= threshold) {
            return new ResolutionEntry(person, Stage.FUZZY, best, bestRaw, affinity, considered,
                    bestRaw < FUZZY_CONFIDENT,
                    String.format("Fuzzy matched to '%s' (raw=%.2f, affinity=%d, combined=%.2f)",
                            best.getFullName(), bestRaw, affinity, bestCombined));
        }
        return new ResolutionEntry(person, Stage.UNRESOLVED, null, bestRaw, affinity, considered, true,
                String.format("UNRESOLVED: No match found for '%s' (best raw=%.2f, affinity=%d)",
                        person.attachName, bestRaw, affinity));
    }

    private static String firstToken(String name) {
        String normalized = PlacementData.normalizeName(name);
        int space = normalized.indexOf(' ');
        return space < 0 ? normalized : normalized.substring(0, space);
    }
}
