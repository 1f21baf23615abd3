package org.retreat.placer;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MatchingTablesTest {

    private final MatchingTables tables = MatchingTables.defaults();

    @AfterEach
    void clearOverride() {
        System.clearProperty(MatchingTables.OVERRIDE_PROPERTY);
    }

    @Test
    @DisplayName("bundled nicknames expand to the canonical first name")
    void nicknames() {
        assertThat(tables.expandNickname("Jess")).isEqualTo("jessica");
        assertThat(tables.expandNickname("bob")).isEqualTo("robert");
        assertThat(tables.expandNickname("Alice")).isEqualTo("alice");
    }

    @Test
    @DisplayName("curated phrases, prefixes and name lists are cohort references")
    void nonPersonReferences() {
        assertThat(tables.isNonPersonPhrase("30/40s")).isTrue();
        assertThat(tables.isNonPersonPhrase("Young  Ladies")).isTrue();
        assertThat(tables.isNonPersonPhrase("Young Lady")).isFalse();
        assertThat(tables.hasNonPersonPrefix("CR - Smith family")).isTrue();
        assertThat(tables.hasSeparator("Ann, Bea")).isTrue();
        assertThat(tables.hasSeparator("Ann and Bea")).isTrue();
        assertThat(tables.hasSeparator("Sandy Anderson")).isFalse();
    }

    @Test
    @DisplayName("tables can be built from plain properties")
    void fromProperties() {
        Properties props = new Properties();
        props.setProperty("nickname.Kate", "Katherine");
        props.setProperty("nonperson.phrases", "Choir Kids | Band");
        MatchingTables custom = MatchingTables.fromProperties(props);

        assertThat(custom.expandNickname("kate")).isEqualTo("katherine");
        assertThat(custom.expandNickname("jess")).isEqualTo("jess");
        assertThat(custom.isNonPersonPhrase("choirkids")).isTrue();
        assertThat(custom.isNonPersonPhrase("band")).isTrue();
        assertThat(custom.hasSeparator("Ann, Bea")).isFalse();
    }

    @Test
    @DisplayName("an override file is overlaid onto the bundled tables")
    void overrideFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("matching.properties");
        Files.write(file, "nickname.kate=katherine\nnickname.jess=jessamine\n".getBytes(StandardCharsets.UTF_8));
        System.setProperty(MatchingTables.OVERRIDE_PROPERTY, file.toString());

        MatchingTables loaded = MatchingTables.load();

        assertThat(loaded.expandNickname("kate")).isEqualTo("katherine");
        assertThat(loaded.expandNickname("jess")).isEqualTo("jessamine");
        assertThat(loaded.expandNickname("bob")).isEqualTo("robert");
    }
}
