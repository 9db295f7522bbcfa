package io.causallabs.metricconfig;

/**
 * A time window the results of an analysis are reported for. Each period has a list of metric
 * slugs under the metrics section, e.g. {@code weekly = ["active_hours"]}.
 */
public enum AnalysisPeriod {
    DAY("daily"), WEEK("weekly"), DAYS_28("28_day"), OVERALL("overall");

    AnalysisPeriod(String configName) {
        m_configName = configName;
    }

    /** The key of the period's metric list in a layer */
    public String configName() {
        return m_configName;
    }

    /** The period listed under the given key, null if the key is not a period */
    public static AnalysisPeriod fromConfig(String key) {
        for (AnalysisPeriod p : values()) {
            if (p.m_configName.equals(key))
                return p;
        }
        return null;
    }

    private final String m_configName;
}
