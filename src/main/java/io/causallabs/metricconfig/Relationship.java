package io.causallabs.metricconfig;

import java.util.Locale;

/**
 * Cardinality hint of a join. It never changes the SQL emitted for the join, it is carried along
 * so that callers can tell when rows may fan out.
 */
public enum Relationship {
    ONE_TO_ONE, ONE_TO_MANY, MANY_TO_ONE, MANY_TO_MANY;

    /** true when one row on the left may meet several rows on the right */
    public boolean fansOut() {
        return this == ONE_TO_MANY || this == MANY_TO_MANY;
    }

    /** the snake_case name used in definition files */
    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Parse the snake_case name used in definition files. Returns null if it is not known. */
    public static Relationship fromConfig(String value) {
        for (Relationship r : values()) {
            if (r.configName().equals(value.toLowerCase(Locale.ROOT)))
                return r;
        }
        return null;
    }
}
