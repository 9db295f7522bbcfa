package io.causallabs.metricconfig;

import java.io.IOException;
import com.fasterxml.jackson.core.JsonGenerator;

/** A table or subquery that segments are computed from. */
public final class SegmentDataSource {

    SegmentDataSource(String slug, String fromExpression, String clientIdColumn,
            String submissionDateColumn, int windowStart, int windowEnd, String friendlyName,
            String description) {
        m_slug = slug;
        m_fromExpression = fromExpression;
        m_clientIdColumn = clientIdColumn;
        m_submissionDateColumn = submissionDateColumn;
        m_windowStart = windowStart;
        m_windowEnd = windowEnd;
        m_friendlyName = friendlyName;
        m_description = description;
    }

    public String getSlug() {
        return m_slug;
    }

    public String getFromExpression() {
        return m_fromExpression;
    }

    public String getClientIdColumn() {
        return m_clientIdColumn;
    }

    public String getSubmissionDateColumn() {
        return m_submissionDateColumn;
    }

    /** First day of the window, relative to enrollment */
    public int getWindowStart() {
        return m_windowStart;
    }

    /** Last day of the window, relative to enrollment */
    public int getWindowEnd() {
        return m_windowEnd;
    }

    public String getFriendlyName() {
        return m_friendlyName;
    }

    public String getDescription() {
        return m_description;
    }

    void serialize(JsonGenerator gen) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("from_expression", m_fromExpression);
        gen.writeStringField("client_id_column", m_clientIdColumn);
        gen.writeStringField("submission_date_column", m_submissionDateColumn);
        gen.writeNumberField("window_start", m_windowStart);
        gen.writeNumberField("window_end", m_windowEnd);
        gen.writeStringField("friendly_name", m_friendlyName);
        gen.writeStringField("description", m_description);
        gen.writeEndObject();
    }

    private final String m_slug;
    private final String m_fromExpression;
    private final String m_clientIdColumn;
    private final String m_submissionDateColumn;
    private final int m_windowStart;
    private final int m_windowEnd;
    private final String m_friendlyName;
    private final String m_description;
}
