package io.causallabs.metricconfig;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** The fields of a data source as declared by one or more layers. Absent fields are null. */
final class DataSourceDefinition {

    static final Set<String> FIELDS = Set.of("from_expression", "client_id_column",
            "submission_date_column", "experiments_column_type", "default_dataset",
            "build_id_column", "friendly_name", "description", "joins");

    static DataSourceDefinition fromJson(FieldReader reader, DataSourceDefinition established) {
        DataSourceDefinition def = new DataSourceDefinition();
        def.m_fromExpression = reader.string("from_expression");
        def.m_clientIdColumn = reader.string("client_id_column");
        def.m_submissionDateColumn = reader.string("submission_date_column");
        def.m_experimentsColumnType = reader.enumeration("experiments_column_type",
                ExperimentsColumnType::fromConfig, ExperimentsColumnType.values());
        def.m_defaultDataset = reader.string("default_dataset");
        def.m_buildIdColumn = reader.string("build_id_column");
        def.m_friendlyName = reader.string("friendly_name");
        def.m_description = reader.string("description");
        ObjectNode joins = reader.table("joins");
        if (joins != null) {
            Iterator<Map.Entry<String, JsonNode>> it = joins.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                boolean known = established != null && established.m_joins.containsKey(e.getKey());
                FieldReader joinReader = new FieldReader(reader.context(),
                        reader.path() + ".joins." + e.getKey(), e.getValue(), known);
                def.m_joins.put(e.getKey(), JoinDefinition.fromJson(joinReader));
            }
        }
        reader.rejectUnknown(FIELDS);
        return def;
    }

    /** Override every field the other definition declares; joins merge by target slug. */
    void merge(DataSourceDefinition other) {
        if (other.m_fromExpression != null)
            m_fromExpression = other.m_fromExpression;
        if (other.m_clientIdColumn != null)
            m_clientIdColumn = other.m_clientIdColumn;
        if (other.m_submissionDateColumn != null)
            m_submissionDateColumn = other.m_submissionDateColumn;
        if (other.m_experimentsColumnType != null)
            m_experimentsColumnType = other.m_experimentsColumnType;
        if (other.m_defaultDataset != null)
            m_defaultDataset = other.m_defaultDataset;
        if (other.m_buildIdColumn != null)
            m_buildIdColumn = other.m_buildIdColumn;
        if (other.m_friendlyName != null)
            m_friendlyName = other.m_friendlyName;
        if (other.m_description != null)
            m_description = other.m_description;

        for (Map.Entry<String, JoinDefinition> e : other.m_joins.entrySet()) {
            JoinDefinition join = e.getValue();
            if (join.isDisabled()) {
                m_joins.remove(e.getKey());
            } else if (m_joins.containsKey(e.getKey())) {
                m_joins.get(e.getKey()).merge(join);
            } else {
                m_joins.put(e.getKey(), join);
            }
        }
    }

    String m_fromExpression;
    String m_clientIdColumn;
    String m_submissionDateColumn;
    ExperimentsColumnType m_experimentsColumnType;
    String m_defaultDataset;
    String m_buildIdColumn;
    String m_friendlyName;
    String m_description;
    final Map<String, JoinDefinition> m_joins = new LinkedHashMap<>();
}
