package org.retreat.placer;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Curated lookup data for attach-name resolution: nicknames and the phrases
 * that mark a reference as a cohort rather than a person.
 *
 * <p>Property keys:
 * <ul>
 *   <li>{@code nickname.<short>=<canonical first name>}</li>
 *   <li>{@code nonperson.phrases}: exact phrases, separated by {@code |}</li>
 *   <li>{@code nonperson.prefixes}: prefixes, separated by {@code |}</li>
 *   <li>{@code nonperson.separators}: substrings such as a comma, separated by {@code |}</li>
 *   <li>{@code nonperson.separator-words}: whole words such as "and", separated by {@code |}</li>
 * </ul>
 */
public final class MatchingTables {
    private static final Logger LOGGER = Logger.getLogger(MatchingTables.class.getName());

    public static final String DEFAULT_RESOURCE = "/attach-matching.properties";
    public static final String OVERRIDE_PROPERTY = "retreat.matchingTables";

    private static final String NICKNAME_PREFIX = "nickname.";

    private final Map<String, String> nicknames;
    private final Set<String> nonPersonPhrases;
    private final List<String> nonPersonPrefixes;
    private final List<String> separators;
    private final Set<String> separatorWords;

    private MatchingTables(Map<String, String> nicknames, Set<String> nonPersonPhrases,
                           List<String> nonPersonPrefixes, List<String> separators, Set<String> separatorWords) {
        this.nicknames = Collections.unmodifiableMap(nicknames);
        this.nonPersonPhrases = Collections.unmodifiableSet(nonPersonPhrases);
        this.nonPersonPrefixes = Collections.unmodifiableList(nonPersonPrefixes);
        this.separators = Collections.unmodifiableList(separators);
        this.separatorWords = Collections.unmodifiableSet(separatorWords);
    }

    /**
     * Bundled defaults, overlaid with the file named by {@value #OVERRIDE_PROPERTY} when set.
     */
    public static MatchingTables load() {
        Properties props = readDefaults();
        String overridePath = System.getProperty(OVERRIDE_PROPERTY);
        if (overridePath != null && !overridePath.trim().isEmpty()) {
            Path path = Paths.get(overridePath.trim());
            try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                props.load(reader);
                LOGGER.info("Matching tables overlaid from " + path.toAbsolutePath());
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read matching tables from " + path, e);
            }
        }
        return fromProperties(props);
    }

    public static MatchingTables defaults() {
        return fromProperties(readDefaults());
    }

    private static Properties readDefaults() {
        Properties props = new Properties();
        try (InputStream in = MatchingTables.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + DEFAULT_RESOURCE);
            }
            props.load(new InputStreamReader(in, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + DEFAULT_RESOURCE, e);
        }
        return props;
    }

    public static MatchingTables fromProperties(Properties props) {
        Map<String, String> nicknames = new LinkedHashMap<>();
        for (String key : props.stringPropertyNames()) {
            if (key.startsWith(NICKNAME_PREFIX)) {
                String shortName = lower(key.substring(NICKNAME_PREFIX.length()));
                String canonical = lower(props.getProperty(key));
                if (!shortName.isEmpty() && !canonical.isEmpty()) {
                    nicknames.put(shortName, canonical);
                }
            }
        }

        Set<String> phrases = new LinkedHashSet<>();
        for (String phrase : split(props.getProperty("nonperson.phrases", ""))) {
            phrases.add(CohortLabels.compact(phrase));
        }

        return new MatchingTables(nicknames, phrases,
                split(props.getProperty("nonperson.prefixes", "")),
                split(props.getProperty("nonperson.separators", "")),
                new LinkedHashSet<>(split(props.getProperty("nonperson.separator-words", ""))));
    }

    private static List<String> split(String value) {
        List<String> items = new ArrayList<>();
        for (String item : value.split("\\|")) {
            String cleaned = lower(item);
            if (!cleaned.isEmpty()) {
                items.add(cleaned);
            }
        }
        return items;
    }

    private static String lower(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Canonical first name for a nickname, or the name itself.
     */
    public String expandNickname(String firstName) {
        String key = lower(firstName);
        return nicknames.getOrDefault(key, key);
    }

    public boolean isNonPersonPhrase(String reference) {
        return nonPersonPhrases.contains(CohortLabels.compact(reference));
    }

    public boolean hasNonPersonPrefix(String reference) {
        String lowered = lower(reference);
        for (String prefix : nonPersonPrefixes) {
            if (lowered.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True when the reference lists several names, e.g. "Ann, Bea" or "Ann and Bea".
     */
    public boolean hasSeparator(String reference) {
        String lowered = lower(reference);
        for (String separator : separators) {
            if (lowered.contains(separator)) {
                return true;
            }
        }
        for (String token : lowered.split("\\s+")) {
            if (separatorWords.contains(token)) {
                return true;
            }
        }
        return false;
    }
}
