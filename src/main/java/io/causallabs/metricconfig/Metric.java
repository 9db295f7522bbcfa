package io.causallabs.metricconfig;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import com.fasterxml.jackson.core.JsonGenerator;

/** A per-client aggregation computed over one data source. */
public final class Metric {

    Metric(String slug, String dataSource, String selectExpression, String friendlyName,
            String description, boolean biggerIsBetter, List<AnalysisBasis> analysisBases,
            String type, String category, Map<String, Statistic> statistics) {
        m_slug = slug;
        m_dataSource = dataSource;
        m_selectExpression = selectExpression;
        m_friendlyName = friendlyName;
        m_description = description;
        m_biggerIsBetter = biggerIsBetter;
        m_analysisBases = List.copyOf(analysisBases);
        m_type = type;
        m_category = category;
        m_statistics = Collections.unmodifiableMap(new LinkedHashMap<>(statistics));
    }

    /** The metric name, also the name of its output column */
    public String getSlug() {
        return m_slug;
    }

    public String getDataSource() {
        return m_dataSource;
    }

    /** The aggregation expression. May use aggregation macros and experiment variables. */
    public String getSelectExpression() {
        return m_selectExpression;
    }

    public String getFriendlyName() {
        return m_friendlyName;
    }

    public String getDescription() {
        return m_description;
    }

    public boolean isBiggerBetter() {
        return m_biggerIsBetter;
    }

    public List<AnalysisBasis> getAnalysisBases() {
        return m_analysisBases;
    }

    public String getType() {
        return m_type;
    }

    public String getCategory() {
        return m_category;
    }

    public Map<String, Statistic> getStatistics() {
        return m_statistics;
    }

    void serialize(JsonGenerator gen) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("data_source", m_dataSource);
        gen.writeStringField("select_expression", m_selectExpression);
        gen.writeStringField("friendly_name", m_friendlyName);
        gen.writeStringField("description", m_description);
        gen.writeBooleanField("bigger_is_better", m_biggerIsBetter);
        gen.writeFieldName("analysis_bases");
        gen.writeStartArray();
        for (AnalysisBasis basis : m_analysisBases) {
            gen.writeString(basis.configName());
        }
        gen.writeEndArray();
        gen.writeStringField("type", m_type);
        gen.writeStringField("category", m_category);
        gen.writeFieldName("statistics");
        gen.writeStartObject();
        for (Map.Entry<String, Statistic> e : m_statistics.entrySet()) {
            gen.writeFieldName(e.getKey());
            e.getValue().serialize(gen);
        }
        gen.writeEndObject();
        gen.writeEndObject();
    }

    private final String m_slug;
    private final String m_dataSource;
    private final String m_selectExpression;
    private final String m_friendlyName;
    private final String m_description;
    private final boolean m_biggerIsBetter;
    private final List<AnalysisBasis> m_analysisBases;
    private final String m_type;
    private final String m_category;
    private final Map<String, Statistic> m_statistics;
}
