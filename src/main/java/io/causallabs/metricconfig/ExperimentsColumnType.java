package io.causallabs.metricconfig;

import java.util.Locale;

/**
 * Describes whether and how a data source records experiment membership. The type decides the
 * predicate used when a query is restricted to clients enrolled in the experiment.
 */
public enum ExperimentsColumnType {
    /** an experiments column mapping experiment slug to branch name */
    SIMPLE("experiments['{{experiment.slug}}'] IS NOT NULL"),
    /** an experiments column mapping experiment slug to a struct with a branch field */
    NATIVE("experiments['{{experiment.slug}}'].branch IS NOT NULL"),
    /** glean pings keep the experiments map inside ping_info */
    GLEAN("ping_info.experiments['{{experiment.slug}}'].branch IS NOT NULL"),
    /** no experiments column, membership can not be filtered */
    NONE(null);

    ExperimentsColumnType(String membershipPredicate) {
        m_membershipPredicate = membershipPredicate;
    }

    /** Template of the predicate selecting enrolled rows, null for NONE */
    public String getMembershipPredicate() {
        return m_membershipPredicate;
    }

    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Parse the name used in definition files. Returns null if it is not known. */
    public static ExperimentsColumnType fromConfig(String value) {
        for (ExperimentsColumnType t : values()) {
            if (t.configName().equals(value.toLowerCase(Locale.ROOT)))
                return t;
        }
        return null;
    }

    private final String m_membershipPredicate;
}
