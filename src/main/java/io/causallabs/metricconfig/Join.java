package io.causallabs.metricconfig;

import java.io.IOException;
import com.fasterxml.jackson.core.JsonGenerator;

/** A declared join from one data source to another. */
public final class Join {

    Join(String target, String onExpression, Relationship relationship) {
        m_target = target;
        m_onExpression = onExpression;
        m_relationship = relationship;
    }

    /** Slug of the data source being joined in */
    public String getTarget() {
        return m_target;
    }

    /** The explicit join condition, or null if it should be synthesized from the key columns */
    public String getOnExpression() {
        return m_onExpression;
    }

    public Relationship getRelationship() {
        return m_relationship;
    }

    void serialize(JsonGenerator gen) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("on_expression", m_onExpression);
        gen.writeStringField("relationship", m_relationship.configName());
        gen.writeEndObject();
    }

    private final String m_target;
    private final String m_onExpression;
    private final Relationship m_relationship;
}
