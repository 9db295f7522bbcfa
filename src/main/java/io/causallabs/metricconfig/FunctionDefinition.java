package io.causallabs.metricconfig;

import java.util.Set;

final class FunctionDefinition {

    static final Set<String> FIELDS = Set.of("definition");

    static FunctionDefinition fromJson(FieldReader reader) {
        FunctionDefinition def = new FunctionDefinition();
        def.m_definition = reader.string("definition");
        reader.rejectUnknown(FIELDS);
        return def;
    }

    void merge(FunctionDefinition other) {
        if (other.m_definition != null)
            m_definition = other.m_definition;
    }

    String m_definition;
}
