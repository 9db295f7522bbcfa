package io.causallabs.metricconfig;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import com.fasterxml.jackson.core.JsonGenerator;

/**
 * A named statistical treatment of a metric. The parameters are not interpreted by the engine, they
 * are handed through to whoever runs the analysis.
 */
public final class Statistic {

    Statistic(String name, Map<String, Object> params, List<PreTreatment> preTreatments) {
        m_name = name;
        m_params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
        m_preTreatments = List.copyOf(preTreatments);
    }

    public String getName() {
        return m_name;
    }

    /** Parameters in declaration order, without pre_treatments */
    public Map<String, Object> getParams() {
        return m_params;
    }

    public List<PreTreatment> getPreTreatments() {
        return m_preTreatments;
    }

    void serialize(JsonGenerator gen) throws IOException {
        gen.writeStartObject();
        for (Map.Entry<String, Object> e : m_params.entrySet()) {
            gen.writeObjectField(e.getKey(), e.getValue());
        }
        if (!m_preTreatments.isEmpty()) {
            gen.writeFieldName(StatisticDefinition.PRE_TREATMENTS);
            gen.writeStartArray();
            for (PreTreatment pt : m_preTreatments) {
                gen.writeStartObject();
                gen.writeStringField("name", pt.getName());
                for (Map.Entry<String, Object> e : pt.getArgs().entrySet()) {
                    gen.writeObjectField(e.getKey(), e.getValue());
                }
                gen.writeEndObject();
            }
            gen.writeEndArray();
        }
        gen.writeEndObject();
    }

    private final String m_name;
    private final Map<String, Object> m_params;
    private final List<PreTreatment> m_preTreatments;
}
