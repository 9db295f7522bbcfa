package io.causallabs.metricconfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** A transformation applied to metric values before a statistic is computed. */
public final class PreTreatment {

    PreTreatment(String name, Map<String, Object> args) {
        m_name = name;
        m_args = Collections.unmodifiableMap(new LinkedHashMap<>(args));
    }

    public String getName() {
        return m_name;
    }

    public Map<String, Object> getArgs() {
        return m_args;
    }

    private final String m_name;
    private final Map<String, Object> m_args;
}
