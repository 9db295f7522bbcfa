package io.causallabs.metricconfig;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import com.fasterxml.jackson.core.JsonGenerator;

/**
 * A named value select expressions refer to as {{parameters.&lt;name&gt;}}. A parameter that is
 * distinct by branch holds one value per experiment branch and renders as a CASE expression over
 * the branch of the enrollment.
 */
public final class Parameter {

    /** The column holding the branch of a client in the enrollments table */
    public static final String BRANCH_COLUMN = "e.branch";

    Parameter(String name, String value, Map<String, String> branchValues,
            String defaultValue, String friendlyName, String description) {
        m_name = name;
        m_value = value;
        m_branchValues = branchValues == null ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(branchValues));
        m_defaultValue = defaultValue;
        m_friendlyName = friendlyName;
        m_description = description;
    }

    public String getName() {
        return m_name;
    }

    public boolean isDistinctByBranch() {
        return m_branchValues != null;
    }

    /** The value shared by all branches, null if the parameter is distinct by branch */
    public String getValue() {
        return m_value;
    }

    /** Branch name to value, null unless the parameter is distinct by branch */
    public Map<String, String> getBranchValues() {
        return m_branchValues;
    }

    /** The declared default as text, null if the parameter has none or it is per branch */
    public String getDefaultValue() {
        return m_defaultValue;
    }

    public String getFriendlyName() {
        return m_friendlyName;
    }

    public String getDescription() {
        return m_description;
    }

    /** What {{parameters.&lt;name&gt;}} expands to in a select expression */
    public String toSql() {
        if (m_branchValues == null)
            return m_value;
        StringBuilder sb = new StringBuilder("CASE ").append(BRANCH_COLUMN);
        for (Map.Entry<String, String> e : m_branchValues.entrySet()) {
            sb.append(" WHEN \"").append(e.getKey()).append("\" THEN \"").append(e.getValue())
                    .append('"');
        }
        return sb.append(" END").toString();
    }

    void serialize(JsonGenerator gen) throws IOException {
        gen.writeStartObject();
        if (m_branchValues != null) {
            gen.writeObjectField("value", m_branchValues);
        } else {
            gen.writeStringField("value", m_value);
        }
        gen.writeStringField("default", m_defaultValue);
        gen.writeBooleanField("distinct_by_branch", isDistinctByBranch());
        gen.writeStringField("friendly_name", m_friendlyName);
        gen.writeStringField("description", m_description);
        gen.writeEndObject();
    }

    private final String m_name;
    private final String m_value;
    private final Map<String, String> m_branchValues;
    private final String m_defaultValue;
    private final String m_friendlyName;
    private final String m_description;
}
