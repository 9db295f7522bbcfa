package io.causallabs.metricconfig;

import java.io.IOException;
import com.fasterxml.jackson.core.JsonGenerator;

/** A grouping dimension a data source exposes, e.g. the operating system of the client. */
public final class Dimension {

    Dimension(String slug, String dataSource, String selectExpression, String friendlyName,
            String description) {
        m_slug = slug;
        m_dataSource = dataSource;
        m_selectExpression = selectExpression;
        m_friendlyName = friendlyName;
        m_description = description;
    }

    public String getSlug() {
        return m_slug;
    }

    public String getDataSource() {
        return m_dataSource;
    }

    public String getSelectExpression() {
        return m_selectExpression;
    }

    public String getFriendlyName() {
        return m_friendlyName;
    }

    public String getDescription() {
        return m_description;
    }

    void serialize(JsonGenerator gen) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("data_source", m_dataSource);
        gen.writeStringField("select_expression", m_selectExpression);
        gen.writeStringField("friendly_name", m_friendlyName);
        gen.writeStringField("description", m_description);
        gen.writeEndObject();
    }

    private final String m_slug;
    private final String m_dataSource;
    private final String m_selectExpression;
    private final String m_friendlyName;
    private final String m_description;
}
