package org.retreat.placer;

import java.util.logging.Logger;

/**
 * Solver budget and objective weights.
 *
 * Defaults can be overridden with system properties, e.g.
 * {@code -Dretreat.timeLimitSeconds=60 -Dretreat.weight.group=1200}.
 */
public final class PlacementConfig {
    private static final Logger LOGGER = Logger.getLogger(PlacementConfig.class.getName());

    public static final String TIME_LIMIT_PROPERTY = "retreat.timeLimitSeconds";
    public static final String WORKERS_PROPERTY = "retreat.searchWorkers";
    public static final String WEIGHT_PROPERTY_PREFIX = "retreat.weight.";

    public static final double DEFAULT_TIME_LIMIT_SECONDS = 300.0;
    public static final int DEFAULT_SEARCH_WORKERS = 8;
    public static final long DEFAULT_PLACE_WEIGHT = 10000;
    public static final long DEFAULT_GROUP_WEIGHT = 1000;
    public static final long DEFAULT_ATTACH_WEIGHT = 800;
    public static final long DEFAULT_AFFINITY_WEIGHT = 200;
    public static final long DEFAULT_ORG_WEIGHT = 100;

    public final double timeLimitSeconds;
    public final int searchWorkers;
    /** Base reward per placed person. Raised at solve time if the soft terms could outweigh it. */
    public final long placeWeight;
    public final long groupWeight;
    public final long attachWeight;
    public final long affinityWeight;
    public final long orgWeight;

    public PlacementConfig(double timeLimitSeconds, int searchWorkers, long placeWeight, long groupWeight,
                           long attachWeight, long affinityWeight, long orgWeight) {
        if (!(timeLimitSeconds > 0)) {
            throw new IllegalArgumentException("Time limit must be positive: " + timeLimitSeconds);
        }
        if (searchWorkers < 1) {
            throw new IllegalArgumentException("Search workers must be at least 1: " + searchWorkers);
        }
        if (placeWeight < 1) {
            throw new IllegalArgumentException("Placement weight must be positive: " + placeWeight);
        }
        if (orgWeight < 1 || affinityWeight <= orgWeight
                || groupWeight <= affinityWeight || attachWeight <= affinityWeight) {
            throw new IllegalArgumentException(String.format(
                    "Weights must satisfy group, attach > affinity > org > 0 (group=%d, attach=%d, affinity=%d, org=%d)",
                    groupWeight, attachWeight, affinityWeight, orgWeight));
        }
        this.timeLimitSeconds = timeLimitSeconds;
        this.searchWorkers = searchWorkers;
        this.placeWeight = placeWeight;
        this.groupWeight = groupWeight;
        this.attachWeight = attachWeight;
        this.affinityWeight = affinityWeight;
        this.orgWeight = orgWeight;
    }

    public static PlacementConfig defaults() {
        return new PlacementConfig(DEFAULT_TIME_LIMIT_SECONDS, DEFAULT_SEARCH_WORKERS, DEFAULT_PLACE_WEIGHT,
                DEFAULT_GROUP_WEIGHT, DEFAULT_ATTACH_WEIGHT, DEFAULT_AFFINITY_WEIGHT, DEFAULT_ORG_WEIGHT);
    }

    public static PlacementConfig fromSystemProperties() {
        PlacementConfig config = new PlacementConfig(
                doubleProperty(TIME_LIMIT_PROPERTY, DEFAULT_TIME_LIMIT_SECONDS),
                (int) longProperty(WORKERS_PROPERTY, DEFAULT_SEARCH_WORKERS),
                longProperty(WEIGHT_PROPERTY_PREFIX + "place", DEFAULT_PLACE_WEIGHT),
                longProperty(WEIGHT_PROPERTY_PREFIX + "group", DEFAULT_GROUP_WEIGHT),
                longProperty(WEIGHT_PROPERTY_PREFIX + "attach", DEFAULT_ATTACH_WEIGHT),
                longProperty(WEIGHT_PROPERTY_PREFIX + "affinity", DEFAULT_AFFINITY_WEIGHT),
                longProperty(WEIGHT_PROPERTY_PREFIX + "org", DEFAULT_ORG_WEIGHT));
        LOGGER.config("Placement config: " + config);
        return config;
    }

    public PlacementConfig withTimeLimit(double seconds) {
        return new PlacementConfig(seconds, searchWorkers, placeWeight, groupWeight, attachWeight,
                affinityWeight, orgWeight);
    }

    public PlacementConfig withPlaceWeight(long weight) {
        return new PlacementConfig(timeLimitSeconds, searchWorkers, weight, groupWeight, attachWeight,
                affinityWeight, orgWeight);
    }

    private static long longProperty(String name, long defaultValue) {
        String value = System.getProperty(name);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("System property " + name + " is not an integer: " + value, e);
        }
    }

    private static double doubleProperty(String name, double defaultValue) {
        String value = System.getProperty(name);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("System property " + name + " is not a number: " + value, e);
        }
    }

    @Override
    public String toString() {
        return String.format("timeLimit=%.1fs, workers=%d, weights[place=%d, group=%d, attach=%d, affinity=%d, org=%d]",
                timeLimitSeconds, searchWorkers, placeWeight, groupWeight, attachWeight, affinityWeight, orgWeight);
    }
}
