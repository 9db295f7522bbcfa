package io.causallabs.metricconfig;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** The fields of a metric as declared by one or more layers. Absent fields are null. */
final class MetricDefinition {

    static final Set<String> FIELDS = Set.of("data_source", "select_expression", "friendly_name",
            "description", "bigger_is_better", "analysis_bases", "type", "category",
            "statistics");

    static MetricDefinition fromJson(FieldReader reader, MetricDefinition established) {
        MetricDefinition def = new MetricDefinition();
        def.m_dataSource = reader.string("data_source");
        def.m_selectExpression = reader.string("select_expression");
        def.m_friendlyName = reader.string("friendly_name");
        def.m_description = reader.string("description");
        def.m_biggerIsBetter = reader.bool("bigger_is_better");
        def.m_type = reader.string("type");
        def.m_category = reader.string("category");

        List<String> bases = reader.stringList("analysis_bases");
        if (bases != null) {
            List<AnalysisBasis> parsed = new ArrayList<>();
            for (String basis : bases) {
                AnalysisBasis b = AnalysisBasis.fromConfig(basis);
                if (b == null) {
                    reader.context().error(ErrorKind.INVALID_VALUE, reader.path(),
                            "unknown analysis basis '" + basis + "'");
                } else {
                    parsed.add(b);
                }
            }
            def.m_analysisBases = parsed;
        }

        ObjectNode statistics = reader.table("statistics");
        if (statistics != null) {
            Iterator<Map.Entry<String, JsonNode>> it = statistics.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                boolean known =
                        established != null && established.m_statistics.containsKey(e.getKey());
                FieldReader statReader = new FieldReader(reader.context(),
                        reader.path() + ".statistics." + e.getKey(), e.getValue(), known);
                def.m_statistics.put(e.getKey(), StatisticDefinition.fromJson(statReader));
            }
        }
        reader.rejectUnknown(FIELDS);
        return def;
    }

    /** Override every field the other definition declares; statistics merge by name. */
    void merge(MetricDefinition other, MergeContext ctx, String path) {
        if (other.m_dataSource != null)
            m_dataSource = other.m_dataSource;
        if (other.m_selectExpression != null)
            m_selectExpression = other.m_selectExpression;
        if (other.m_friendlyName != null)
            m_friendlyName = other.m_friendlyName;
        if (other.m_description != null)
            m_description = other.m_description;
        if (other.m_biggerIsBetter != null)
            m_biggerIsBetter = other.m_biggerIsBetter;
        if (other.m_analysisBases != null)
            m_analysisBases = other.m_analysisBases;
        if (other.m_type != null)
            m_type = other.m_type;
        if (other.m_category != null)
            m_category = other.m_category;

        for (Map.Entry<String, StatisticDefinition> e : other.m_statistics.entrySet()) {
            StatisticDefinition stat = e.getValue();
            if (stat.isDisabled()) {
                m_statistics.remove(e.getKey());
            } else if (m_statistics.containsKey(e.getKey())) {
                m_statistics.get(e.getKey()).merge(stat, ctx, path + ".statistics." + e.getKey());
            } else {
                m_statistics.put(e.getKey(), stat);
            }
        }
    }

    String m_dataSource;
    String m_selectExpression;
    String m_friendlyName;
    String m_description;
    Boolean m_biggerIsBetter;
    List<AnalysisBasis> m_analysisBases;
    String m_type;
    String m_category;
    final Map<String, StatisticDefinition> m_statistics = new LinkedHashMap<>();
}
