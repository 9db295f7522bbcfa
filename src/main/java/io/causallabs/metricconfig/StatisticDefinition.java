package io.causallabs.metricconfig;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * The parameters of a statistic as declared by one or more layers. Parameters are free-form, so
 * they are kept as JSON until the configuration is resolved.
 */
final class StatisticDefinition {

    /** reserved parameter holding the pre-treatments of the statistic */
    static final String PRE_TREATMENTS = "pre_treatments";

    static StatisticDefinition fromJson(FieldReader reader) {
        StatisticDefinition def = new StatisticDefinition();
        def.m_disabled = reader.disabled();
        for (Map.Entry<String, JsonNode> e : reader.fields().entrySet()) {
            if (!FieldReader.ENABLED.equals(e.getKey()))
                def.m_params.put(e.getKey(), e.getValue());
        }
        return def;
    }

    /**
     * Override parameter by parameter. A parameter whose JSON type differs from the one already
     * established is reported and keeps its established value.
     */
    void merge(StatisticDefinition other, MergeContext ctx, String path) {
        Iterator<Map.Entry<String, JsonNode>> it = other.m_params.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            JsonNode current = m_params.get(e.getKey());
            if (current != null && !current.isNull() && !e.getValue().isNull()
                    && current.getNodeType() != e.getValue().getNodeType()) {
                ctx.error(ErrorKind.MALFORMED_OVERRIDE, path,
                        "parameter " + e.getKey() + " was " + FieldReader.describe(current)
                                + " and can not be overridden with "
                                + FieldReader.describe(e.getValue()));
                continue;
            }
            m_params.put(e.getKey(), e.getValue());
        }
    }

    boolean isDisabled() {
        return m_disabled;
    }

    final Map<String, JsonNode> m_params = new LinkedHashMap<>();
    private boolean m_disabled;
}
