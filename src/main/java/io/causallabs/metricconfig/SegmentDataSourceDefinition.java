package io.causallabs.metricconfig;

import java.util.Set;

/** The fields of a segment data source as declared by one or more layers. */
final class SegmentDataSourceDefinition {

    static final Set<String> FIELDS = Set.of("from_expression", "client_id_column",
            "submission_date_column", "window_start", "window_end", "friendly_name",
            "description");

    static SegmentDataSourceDefinition fromJson(FieldReader reader) {
        SegmentDataSourceDefinition def = new SegmentDataSourceDefinition();
        def.m_fromExpression = reader.string("from_expression");
        def.m_clientIdColumn = reader.string("client_id_column");
        def.m_submissionDateColumn = reader.string("submission_date_column");
        def.m_windowStart = reader.integer("window_start");
        def.m_windowEnd = reader.integer("window_end");
        def.m_friendlyName = reader.string("friendly_name");
        def.m_description = reader.string("description");
        reader.rejectUnknown(FIELDS);
        return def;
    }

    void merge(SegmentDataSourceDefinition other) {
        if (other.m_fromExpression != null)
            m_fromExpression = other.m_fromExpression;
        if (other.m_clientIdColumn != null)
            m_clientIdColumn = other.m_clientIdColumn;
        if (other.m_submissionDateColumn != null)
            m_submissionDateColumn = other.m_submissionDateColumn;
        if (other.m_windowStart != null)
            m_windowStart = other.m_windowStart;
        if (other.m_windowEnd != null)
            m_windowEnd = other.m_windowEnd;
        if (other.m_friendlyName != null)
            m_friendlyName = other.m_friendlyName;
        if (other.m_description != null)
            m_description = other.m_description;
    }

    String m_fromExpression;
    String m_clientIdColumn;
    String m_submissionDateColumn;
    Integer m_windowStart;
    Integer m_windowEnd;
    String m_friendlyName;
    String m_description;
}
