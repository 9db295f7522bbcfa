package io.causallabs.metricconfig;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import com.fasterxml.jackson.core.JsonGenerator;

/**
 * A table or subquery metrics are computed from, along with the columns that identify the client
 * and the day of each row.
 */
public final class DataSource {

    DataSource(String slug, String fromExpression, String clientIdColumn,
            String submissionDateColumn, ExperimentsColumnType experimentsColumnType,
            String defaultDataset, String buildIdColumn, String friendlyName, String description,
            Map<String, Join> joins) {
        m_slug = slug;
        m_fromExpression = fromExpression;
        m_clientIdColumn = clientIdColumn;
        m_submissionDateColumn = submissionDateColumn;
        m_experimentsColumnType = experimentsColumnType;
        m_defaultDataset = defaultDataset;
        m_buildIdColumn = buildIdColumn;
        m_friendlyName = friendlyName;
        m_description = description;
        m_joins = Collections.unmodifiableMap(new LinkedHashMap<>(joins));
    }

    public String getSlug() {
        return m_slug;
    }

    /**
     * The FROM expression, usually a fully qualified table name. May refer to {{dataset}}, which is
     * replaced with the dataset of the request or the default dataset.
     */
    public String getFromExpression() {
        return m_fromExpression;
    }

    public String getClientIdColumn() {
        return m_clientIdColumn;
    }

    public String getSubmissionDateColumn() {
        return m_submissionDateColumn;
    }

    public ExperimentsColumnType getExperimentsColumnType() {
        return m_experimentsColumnType;
    }

    public String getDefaultDataset() {
        return m_defaultDataset;
    }

    public String getBuildIdColumn() {
        return m_buildIdColumn;
    }

    public String getFriendlyName() {
        return m_friendlyName;
    }

    public String getDescription() {
        return m_description;
    }

    /** Joins keyed by target slug, in declaration order */
    public Map<String, Join> getJoins() {
        return m_joins;
    }

    void serialize(JsonGenerator gen) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("from_expression", m_fromExpression);
        gen.writeStringField("client_id_column", m_clientIdColumn);
        gen.writeStringField("submission_date_column", m_submissionDateColumn);
        gen.writeStringField("experiments_column_type", m_experimentsColumnType.configName());
        gen.writeStringField("default_dataset", m_defaultDataset);
        gen.writeStringField("build_id_column", m_buildIdColumn);
        gen.writeStringField("friendly_name", m_friendlyName);
        gen.writeStringField("description", m_description);
        gen.writeFieldName("joins");
        gen.writeStartObject();
        for (Map.Entry<String, Join> e : m_joins.entrySet()) {
            gen.writeFieldName(e.getKey());
            e.getValue().serialize(gen);
        }
        gen.writeEndObject();
        gen.writeEndObject();
    }

    private final String m_slug;
    private final String m_fromExpression;
    private final String m_clientIdColumn;
    private final String m_submissionDateColumn;
    private final ExperimentsColumnType m_experimentsColumnType;
    private final String m_defaultDataset;
    private final String m_buildIdColumn;
    private final String m_friendlyName;
    private final String m_description;
    private final Map<String, Join> m_joins;
}
