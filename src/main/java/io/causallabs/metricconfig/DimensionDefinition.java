package io.causallabs.metricconfig;

import java.util.Set;

/** The fields of a dimension as declared by one or more layers. */
final class DimensionDefinition {

    static final Set<String> FIELDS =
            Set.of("data_source", "select_expression", "friendly_name", "description");

    static DimensionDefinition fromJson(FieldReader reader) {
        DimensionDefinition def = new DimensionDefinition();
        def.m_dataSource = reader.string("data_source");
        def.m_selectExpression = reader.string("select_expression");
        def.m_friendlyName = reader.string("friendly_name");
        def.m_description = reader.string("description");
        reader.rejectUnknown(FIELDS);
        return def;
    }

    void merge(DimensionDefinition other) {
        if (other.m_dataSource != null)
            m_dataSource = other.m_dataSource;
        if (other.m_selectExpression != null)
            m_selectExpression = other.m_selectExpression;
        if (other.m_friendlyName != null)
            m_friendlyName = other.m_friendlyName;
        if (other.m_description != null)
            m_description = other.m_description;
    }

    String m_dataSource;
    String m_selectExpression;
    String m_friendlyName;
    String m_description;
}
