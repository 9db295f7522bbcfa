package io.causallabs.metricconfig;

import java.util.Set;

/** The fields of a join as declared by one or more layers. */
final class JoinDefinition {

    static final Set<String> FIELDS = Set.of("on_expression", "relationship");

    static JoinDefinition fromJson(FieldReader reader) {
        JoinDefinition def = new JoinDefinition();
        def.m_disabled = reader.disabled();
        def.m_onExpression = reader.string("on_expression");
        def.m_relationship = reader.enumeration("relationship", Relationship::fromConfig,
                Relationship.values());
        reader.rejectUnknown(FIELDS);
        return def;
    }

    void merge(JoinDefinition other) {
        if (other.m_onExpression != null)
            m_onExpression = other.m_onExpression;
        if (other.m_relationship != null)
            m_relationship = other.m_relationship;
    }

    boolean isDisabled() {
        return m_disabled;
    }

    String m_onExpression;
    Relationship m_relationship;
    private boolean m_disabled;
}
