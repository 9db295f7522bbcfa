package io.causallabs.metricconfig;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Typed access to the fields of one definition body in one layer. A field of the wrong JSON type is
 * reported and read as absent, so the rest of the body still merges.
 */
final class FieldReader {

    /** Field that removes a previously defined entity when set to false */
    static final String ENABLED = "enabled";

    FieldReader(MergeContext ctx, String path, JsonNode body, boolean established) {
        m_ctx = ctx;
        m_path = path;
        m_established = established;
        m_fields = new LinkedHashMap<>();
        if (body != null && body.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = body.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                m_fields.put(e.getKey().toLowerCase(Locale.ROOT), e.getValue());
            }
        } else if (body != null && !body.isNull()) {
            ctx.error(ErrorKind.INVALID_VALUE, path, "expected a table but found " + describe(body));
        }
    }

    String path() {
        return m_path;
    }

    MergeContext context() {
        return m_ctx;
    }

    /** true if the body explicitly disables the entity */
    boolean disabled() {
        return Boolean.FALSE.equals(bool(ENABLED));
    }

    String string(String key) {
        JsonNode node = m_fields.get(key);
        if (node == null || node.isNull())
            return null;
        if (!node.isTextual()) {
            typeError(key, "a string", node);
            return null;
        }
        return node.textValue();
    }

    Boolean bool(String key) {
        JsonNode node = m_fields.get(key);
        if (node == null || node.isNull())
            return null;
        if (!node.isBoolean()) {
            typeError(key, "a boolean", node);
            return null;
        }
        return node.booleanValue();
    }

    Integer integer(String key) {
        JsonNode node = m_fields.get(key);
        if (node == null || node.isNull())
            return null;
        if (!node.isIntegralNumber()) {
            typeError(key, "an integer", node);
            return null;
        }
        return node.intValue();
    }

    ObjectNode table(String key) {
        JsonNode node = m_fields.get(key);
        if (node == null || node.isNull())
            return null;
        if (!node.isObject()) {
            typeError(key, "a table", node);
            return null;
        }
        return (ObjectNode) node;
    }

    List<String> stringList(String key) {
        JsonNode node = m_fields.get(key);
        if (node == null || node.isNull())
            return null;
        if (!node.isArray()) {
            typeError(key, "a list of strings", node);
            return null;
        }
        List<String> result = new ArrayList<>();
        for (JsonNode element : node) {
            if (!element.isTextual()) {
                typeError(key, "a list of strings", node);
                return null;
            }
            result.add(element.textValue());
        }
        return result;
    }

    /** Read an enumeration value through the given parser, reporting unknown names */
    <T> T enumeration(String key, java.util.function.Function<String, T> parser, Object[] allowed) {
        String value = string(key);
        if (value == null)
            return null;
        T result = parser.apply(value);
        if (result == null) {
            m_ctx.error(ErrorKind.INVALID_VALUE, m_path, key + " '" + value + "' must be one of "
                    + Arrays.toString(allowed).toLowerCase(Locale.ROOT));
        }
        return result;
    }

    /** The raw fields of the body, keys lower-cased */
    Map<String, JsonNode> fields() {
        return m_fields;
    }

    /** Report every field that is not one of the known keys */
    void rejectUnknown(Set<String> known) {
        for (String key : m_fields.keySet()) {
            if (!known.contains(key) && !ENABLED.equals(key)) {
                m_ctx.error(ErrorKind.UNEXPECTED_KEY, m_path, "unexpected field '" + key + "'");
            }
        }
    }

    private void typeError(String key, String expected, JsonNode found) {
        // once a slug is established, a mistyped field conflicts with the value it would override
        ErrorKind kind = m_established ? ErrorKind.MALFORMED_OVERRIDE : ErrorKind.INVALID_VALUE;
        m_ctx.error(kind, m_path,
                key + " should be " + expected + " but is " + describe(found));
    }

    static String describe(JsonNode node) {
        return node.getNodeType().name().toLowerCase(Locale.ROOT);
    }

    private final MergeContext m_ctx;
    private final String m_path;
    private final boolean m_established;
    private final Map<String, JsonNode> m_fields;
}
