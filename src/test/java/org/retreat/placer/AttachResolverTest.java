package org.retreat.placer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.retreat.placer.TestRosters.find;
import static org.retreat.placer.TestRosters.people;
import static org.retreat.placer.TestRosters.person;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AttachResolverTest {

    private final AttachResolver resolver = new AttachResolver(MatchingTables.defaults());

    private static AttachResolver.ResolutionEntry lastEntry(AttachResolver.AttachResolution resolution,
                                                            PlacementData.Person person) {
        AttachResolver.ResolutionEntry last = null;
        for (AttachResolver.ResolutionEntry entry : resolution.entries) {
            if (entry.person == person) {
                last = entry;
            }
        }
        return last;
    }

    @Test
    @DisplayName("an exact full name resolves at the exact stage")
    void exactMatch() {
        PlacementData data = people(
                person("Dave", "Wilson", "Alpha", "", "eve  BROWN"),
                person("Eve", "Brown", "Alpha", "", ""));
        AttachResolver.AttachResolution resolution = resolver.resolve(data);

        PlacementData.Person dave = find(data, "Dave", "Wilson");
        assertThat(resolution.getTarget(dave.index)).isEqualTo(find(data, "Eve", "Brown").index);
        AttachResolver.ResolutionEntry entry = lastEntry(resolution, dave);
        assertThat(entry.stage).isEqualTo(AttachResolver.Stage.EXACT);
        assertThat(entry.warning).isFalse();
        assertThat(resolution.getResolvedName(dave.index)).isEqualTo("Eve Brown");
    }

    @Test
    @DisplayName("a nickname is expanded before the exact lookup is retried")
    void nicknameMatch() {
        PlacementData data = people(
                person("Ann", "Lee", "", "", "Jess Carter"),
                person("Jessica", "Carter", "", "", ""));
        AttachResolver.AttachResolution resolution = resolver.resolve(data);

        PlacementData.Person ann = find(data, "Ann", "Lee");
        assertThat(resolution.getTarget(ann.index)).isEqualTo(find(data, "Jessica", "Carter").index);
        assertThat(lastEntry(resolution, ann).stage).isEqualTo(AttachResolver.Stage.NICKNAME);
    }

    @Test
    @DisplayName("a first name shared by two people resolves to the one in the same org")
    void firstNameAffinityTieBreak() {
        PlacementData data = people(
                person("Heather", "Young", "Alpha", "", ""),
                person("Heather", "Young", "Beta", "", ""),
                person("Mia", "Ross", "Beta", "", "Heather"));
        AttachResolver.AttachResolution resolution = resolver.resolve(data);

        PlacementData.Person mia = find(data, "Mia", "Ross");
        assertThat(resolution.getTarget(mia.index)).isEqualTo(1);
        AttachResolver.ResolutionEntry entry = lastEntry(resolution, mia);
        assertThat(entry.stage).isEqualTo(AttachResolver.Stage.FIRST_NAME);
        assertThat(entry.affinity).isEqualTo(1);
        assertThat(entry.candidateCount).isEqualTo(2);
    }

    @Test
    @DisplayName("a reference naming a known group is skipped as a cohort reference")
    void groupLabelIsNotAPerson() {
        PlacementData data = people(
                person("Tina", "Gold", "", "Momlife", ""),
                person("Hannah", "Emerson", "", "", "MomLife"));
        AttachResolver.AttachResolution resolution = resolver.resolve(data);

        PlacementData.Person hannah = find(data, "Hannah", "Emerson");
        assertThat(resolution.hasLink(hannah.index)).isFalse();
        assertThat(resolution.isCohortReference(hannah.index)).isTrue();
        AttachResolver.ResolutionEntry entry = lastEntry(resolution, hannah);
        assertThat(entry.stage).isEqualTo(AttachResolver.Stage.NON_PERSON);
        assertThat(entry.warning).isTrue();
        assertThat(entry.message).contains("MomLife");
    }

    @Test
    @DisplayName("curated phrases and name lists are skipped too")
    void curatedNonPersonReferences() {
        PlacementData data = people(
                person("Ann", "Lee", "", "", "Young Ladies"),
                person("Bea", "Cole", "", "", "Ann, Cal"),
                person("Cal", "Diaz", "", "", "Ann and Bea"));
        AttachResolver.AttachResolution resolution = resolver.resolve(data);

        assertThat(resolution.getLinks()).isEmpty();
        assertThat(resolution.entries).extracting(e -> e.stage)
                .containsOnly(AttachResolver.Stage.NON_PERSON);
    }

    @Test
    @DisplayName("an unknown name stays unresolved and the warning reports the best raw score")
    void unresolved() {
        PlacementData data = people(
                person("Alice", "Smith", "", "", "Xyzzy Nomatch"),
                person("Bob", "Jones", "", "", ""));
        AttachResolver.AttachResolution resolution = resolver.resolve(data);

        PlacementData.Person alice = find(data, "Alice", "Smith");
        assertThat(resolution.hasLink(alice.index)).isFalse();
        AttachResolver.ResolutionEntry entry = lastEntry(resolution, alice);
        assertThat(entry.stage).isEqualTo(AttachResolver.Stage.UNRESOLVED);
        assertThat(entry.warning).isTrue();
        assertThat(entry.message).contains("best raw=");
        assertThat(resolution.getWarnings()).contains(entry);
    }

    @Test
    @DisplayName("a same-last-name candidate with an unrelated first name is rejected and kept out of the fuzzy stage")
    void lastNameRejection() {
        PlacementData data = people(
                person("Tom", "Lee", "", "", "Zed Smith"),
                person("Alice", "Smith", "", "", ""));
        AttachResolver.AttachResolution resolution = resolver.resolve(data);

        PlacementData.Person tom = find(data, "Tom", "Lee");
        assertThat(resolution.hasLink(tom.index)).isFalse();
        assertThat(resolution.entries).extracting(e -> e.stage)
                .containsExactly(AttachResolver.Stage.LAST_NAME_REJECTED, AttachResolver.Stage.UNRESOLVED);
        assertThat(resolution.entries.get(0).target.firstName).isEqualTo("Alice");
    }

    @Test
    @DisplayName("a same-last-name candidate with a similar first name is accepted")
    void lastNameMatch() {
        PlacementData data = people(
                person("Tom", "Lee", "", "", "Al Smith"),
                person("Alice", "Smith", "", "", ""));
        AttachResolver.AttachResolution resolution = resolver.resolve(data);

        PlacementData.Person tom = find(data, "Tom", "Lee");
        assertThat(resolution.getResolvedName(tom.index)).isEqualTo("Alice Smith");
        assertThat(lastEntry(resolution, tom).stage).isEqualTo(AttachResolver.Stage.LAST_NAME);
    }

    @Test
    @DisplayName("a short last-name token matches as a prefix")
    void prefixMatch() {
        PlacementData data = people(
                person("Tom", "Lee", "", "", "Jennifer Wi"),
                person("Jennifer", "Adams", "", "", ""),
                person("Jennifer", "Wilson", "", "", ""));
        AttachResolver.AttachResolution resolution = resolver.resolve(data);

        PlacementData.Person tom = find(data, "Tom", "Lee");
        assertThat(resolution.getResolvedName(tom.index)).isEqualTo("Jennifer Wilson");
        assertThat(lastEntry(resolution, tom).stage).isEqualTo(AttachResolver.Stage.LAST_NAME_PREFIX);
    }

    @Test
    @DisplayName("an ambiguous first name without affinity falls through to the fuzzy stage")
    void ambiguousFirstNameFallsThrough() {
        PlacementData data = people(
                person("Heather", "Young", "Alpha", "", ""),
                person("Heather", "Young", "Beta", "", ""),
                person("Mia", "Ross", "", "", "Heather"));
        AttachResolver.AttachResolution resolution = resolver.resolve(data);

        PlacementData.Person mia = find(data, "Mia", "Ross");
        AttachResolver.ResolutionEntry entry = lastEntry(resolution, mia);
        assertThat(entry.stage).isEqualTo(AttachResolver.Stage.FUZZY);
        assertThat(entry.target.index).isEqualTo(0);
        assertThat(entry.warning).isTrue();
    }

    @Test
    @DisplayName("duplicate exact names without affinity take the first one and warn")
    void duplicateExactNames() {
        PlacementData data = people(
                person("Heather", "Young", "Alpha", "", ""),
                person("Heather", "Young", "Beta", "", ""),
                person("Mia", "Ross", "", "", "Heather Young"));
        AttachResolver.AttachResolution resolution = resolver.resolve(data);

        AttachResolver.ResolutionEntry entry = lastEntry(resolution, find(data, "Mia", "Ross"));
        assertThat(entry.stage).isEqualTo(AttachResolver.Stage.EXACT);
        assertThat(entry.target.index).isEqualTo(0);
        assertThat(entry.warning).isTrue();
        assertThat(entry.message).contains("ambiguous");
    }

    @Test
    @DisplayName("a near-identical fuzzy match is accepted without a warning")
    void confidentFuzzyMatch() {
        PlacementData data = people(
                person("Tom", "Lee", "", "", "Katherine Olsn"),
                person("Katherine", "Olsen", "", "", ""));
        AttachResolver.AttachResolution resolution = resolver.resolve(data);

        AttachResolver.ResolutionEntry entry = lastEntry(resolution, find(data, "Tom", "Lee"));
        assertThat(entry.stage).isEqualTo(AttachResolver.Stage.FUZZY);
        assertThat(entry.rawScore).isGreaterThanOrEqualTo(0.95);
        assertThat(entry.warning).isFalse();
    }

    @Test
    @DisplayName("a person never resolves to themselves")
    void noSelfMatch() {
        PlacementData data = people(
                person("Ann", "Lee", "", "", "Ann Lee"),
                person("Bob", "Jones", "", "", ""));
        AttachResolver.AttachResolution resolution = resolver.resolve(data);

        assertThat(resolution.hasLink(0)).isFalse();
    }

    @Test
    @DisplayName("links are split into mutual and one-directional pairs")
    void pairs() {
        PlacementData data = RosterPreparer.prepare(SampleDataGenerator.sampleRooms(),
                SampleDataGenerator.samplePeople());
        AttachResolver.AttachResolution resolution = resolver.resolve(data);

        assertThat(resolution.getMutualPairs()).hasSize(2);
        assertThat(resolution.getOneDirectionalPairs()).isEmpty();
        int dave = find(data, "Dave", "Wilson").index;
        int eve = find(data, "Eve", "Brown").index;
        assertThat(resolution.isMutual(dave, eve)).isTrue();
        assertThat(resolution.entries).hasSize(4);
    }

    @Test
    @DisplayName("a one-way reference is a one-directional pair")
    void oneDirectionalPair() {
        PlacementData data = people(
                person("Ann", "Lee", "", "", "Bob Jones"),
                person("Bob", "Jones", "", "", ""));
        AttachResolver.AttachResolution resolution = resolver.resolve(data);

        assertThat(resolution.getMutualPairs()).isEmpty();
        assertThat(resolution.getOneDirectionalPairs()).containsExactly(new AttachResolver.AttachPair(1, 0));
    }

    @Test
    @DisplayName("affinity counts 2 for a shared group and 1 for a shared org")
    void affinityScore() {
        PlacementData data = people(
                person("Ann", "Lee", "Alpha", "Choir", ""),
                person("Bob", "Jones", "Alpha", "Choir", ""),
                person("Cal", "Diaz", "Alpha", "", ""),
                person("Dee", "Fox", "", "", ""),
                person("Eli", "Gray", "", "", ""));
        List<PlacementData.Person> p = data.people;

        assertThat(AttachResolver.affinityScore(p.get(0), p.get(1))).isEqualTo(3);
        assertThat(AttachResolver.affinityScore(p.get(0), p.get(2))).isEqualTo(1);
        assertThat(AttachResolver.affinityScore(p.get(3), p.get(4))).isZero();
    }

    @Test
    @DisplayName("a shared org lowers the fuzzy acceptance threshold")
    void fuzzyThresholdWithAffinity() {
        PlacementData sameOrg = people(
                person("Ann", "Lee", "Alpha", "", "Kathy Olsun"),
                person("Katherine", "Olsen", "Alpha", "", ""));
        AttachResolver.AttachResolution resolved = resolver.resolve(sameOrg);

        AttachResolver.ResolutionEntry entry = lastEntry(resolved, find(sameOrg, "Ann", "Lee"));
        assertThat(entry.stage).isEqualTo(AttachResolver.Stage.FUZZY);
        assertThat(entry.target.lastName).isEqualTo("Olsen");
        assertThat(entry.affinity).isEqualTo(1);
        assertThat(entry.rawScore).isBetween(0.60, 0.70);

        PlacementData strangers = people(
                person("Ann", "Lee", "Alpha", "", "Kathy Olsun"),
                person("Katherine", "Olsen", "Beta", "", ""));
        AttachResolver.AttachResolution unresolved = resolver.resolve(strangers);

        PlacementData.Person ann = find(strangers, "Ann", "Lee");
        assertThat(unresolved.hasLink(ann.index)).isFalse();
        assertThat(lastEntry(unresolved, ann).stage).isEqualTo(AttachResolver.Stage.UNRESOLVED);
    }

    @Test
    @DisplayName("fuzzy matching ranks by similarity plus the affinity boost")
    void fuzzyCombinedScore() {
        PlacementData data = people(
                person("Ann", "Lee", "Alpha", "", "Kathy Olsun"),
                person("Cathy", "Olsen", "Beta", "", ""),
                person("Katherine", "Olsen", "Alpha", "", ""));
        AttachResolver.AttachResolution resolution = resolver.resolve(data);

        PlacementData.Person ann = find(data, "Ann", "Lee");
        PlacementData.Person cathy = find(data, "Cathy", "Olsen");
        assertThat(NameSimilarity.ratio("kathy olsun", cathy.getNameKey()))
                .isGreaterThan(NameSimilarity.ratio("kathy olsun", "katherine olsen"));
        assertThat(resolution.getTarget(ann.index)).isEqualTo(find(data, "Katherine", "Olsen").index);
        assertThat(lastEntry(resolution, ann).stage).isEqualTo(AttachResolver.Stage.FUZZY);
    }

    @Test
    @DisplayName("a same-last-name candidate in the same org is accepted despite an unlike first name")
    void lastNameAcceptedByAffinity() {
        PlacementData data = people(
                person("Tom", "Lee", "Alpha", "", "Zed Smith"),
                person("Alice", "Smith", "Alpha", "", ""));
        AttachResolver.AttachResolution resolution = resolver.resolve(data);

        PlacementData.Person tom = find(data, "Tom", "Lee");
        AttachResolver.ResolutionEntry entry = lastEntry(resolution, tom);
        assertThat(entry.stage).isEqualTo(AttachResolver.Stage.LAST_NAME);
        assertThat(entry.rawScore).isLessThan(0.4);
        assertThat(entry.affinity).isEqualTo(1);
        assertThat(resolution.getTarget(tom.index)).isEqualTo(find(data, "Alice", "Smith").index);
    }
}
