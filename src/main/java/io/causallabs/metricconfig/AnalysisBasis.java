package io.causallabs.metricconfig;

import java.util.Locale;

/** The population a metric is analysed over. */
public enum AnalysisBasis {
    ENROLLMENTS, EXPOSURES;

    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AnalysisBasis fromConfig(String value) {
        for (AnalysisBasis b : values()) {
            if (b.configName().equals(value.toLowerCase(Locale.ROOT)))
                return b;
        }
        return null;
    }
}
