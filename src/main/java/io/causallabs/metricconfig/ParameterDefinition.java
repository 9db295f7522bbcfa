package io.causallabs.metricconfig;

import java.util.Set;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * The fields of a metric parameter as declared by one or more layers. The default and the value
 * are kept as JSON until the configuration is resolved, since either may be a scalar or a table of
 * per-branch values.
 */
final class ParameterDefinition {

    static final Set<String> FIELDS = Set.of("friendly_name", "description", "default", "value",
            "distinct_by_branch");

    static ParameterDefinition fromJson(FieldReader reader) {
        ParameterDefinition def = new ParameterDefinition();
        def.m_friendlyName = reader.string("friendly_name");
        def.m_description = reader.string("description");
        def.m_default = present(reader.fields().get("default"));
        def.m_value = present(reader.fields().get("value"));
        def.m_distinctByBranch = reader.bool("distinct_by_branch");
        reader.rejectUnknown(FIELDS);
        return def;
    }

    private static JsonNode present(JsonNode node) {
        return node == null || node.isNull() ? null : node;
    }

    void merge(ParameterDefinition other) {
        if (other.m_friendlyName != null)
            m_friendlyName = other.m_friendlyName;
        if (other.m_description != null)
            m_description = other.m_description;
        if (other.m_default != null)
            m_default = other.m_default;
        if (other.m_value != null)
            m_value = other.m_value;
        if (other.m_distinctByBranch != null)
            m_distinctByBranch = other.m_distinctByBranch;
    }

    String m_friendlyName;
    String m_description;
    JsonNode m_default;
    JsonNode m_value;
    Boolean m_distinctByBranch;
}
