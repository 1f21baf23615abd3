package org.retreat.placer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Canonical spelling of group and org labels.
 *
 * Labels are matched case-insensitively and mapped to the spelling that was
 * seen first in the roster ("Momlife" and "MomLife" become one group). Built
 * once per run and never modified afterwards.
 */
public final class CohortLabels {

    private final Map<String, String> groupCanon;
    private final Map<String, String> orgCanon;

    private CohortLabels(Map<String, String> groupCanon, Map<String, String> orgCanon) {
        this.groupCanon = Collections.unmodifiableMap(groupCanon);
        this.orgCanon = Collections.unmodifiableMap(orgCanon);
    }

    /**
     * Builds the table from raw label columns in roster order.
     */
    public static CohortLabels fromRoster(List<String> groupNames, List<String> orgNames) {
        return new CohortLabels(firstSeen(groupNames), firstSeen(orgNames));
    }

    private static Map<String, String> firstSeen(List<String> values) {
        Map<String, String> canon = new LinkedHashMap<>();
        for (String value : values) {
            String trimmed = value == null ? "" : value.trim();
            if (!trimmed.isEmpty()) {
                canon.putIfAbsent(trimmed.toLowerCase(Locale.ROOT), trimmed);
            }
        }
        return canon;
    }

    public String canonicalGroup(String label) {
        return canonical(groupCanon, label);
    }

    public String canonicalOrg(String label) {
        return canonical(orgCanon, label);
    }

    private static String canonical(Map<String, String> canon, String label) {
        if (label == null) {
            return "";
        }
        String trimmed = label.trim();
        if (trimmed.isEmpty()) {
            return trimmed;
        }
        return canon.getOrDefault(trimmed.toLowerCase(Locale.ROOT), trimmed);
    }

    public List<String> getGroupLabels() {
        return new ArrayList<>(groupCanon.values());
    }

    public List<String> getOrgLabels() {
        return new ArrayList<>(orgCanon.values());
    }

    /**
     * True when the text names a known group or org, ignoring case and whitespace.
     */
    public boolean isKnownLabel(String text) {
        return findGroupLabel(text) != null || findLabel(orgCanon, text) != null;
    }

    /**
     * Returns the canonical group whose compacted form equals the text, or null.
     */
    public String findGroupLabel(String text) {
        return findLabel(groupCanon, text);
    }

    private static String findLabel(Map<String, String> canon, String text) {
        String key = compact(text);
        if (key.isEmpty()) {
            return null;
        }
        for (String label : canon.values()) {
            if (compact(label).equals(key)) {
                return label;
            }
        }
        return null;
    }

    static String compact(String text) {
        if (text == null) {
            return "";
        }
        return text.replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
    }
}
