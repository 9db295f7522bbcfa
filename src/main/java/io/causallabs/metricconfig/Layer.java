package io.causallabs.metricconfig;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;

/**
 * One set of definitions (general, platform, app or experiment specific). The root holds the
 * sections data_sources, metrics, segments, dimensions, functions and statistics, each mapping
 * slugs to partial definitions.
 */
public final class Layer {

    public static Layer of(String name, ObjectNode root) {
        return new Layer(name, root.deepCopy());
    }

    public static Layer fromToml(String name, String toml) throws ConfigException {
        try {
            return fromTree(name, s_toml.readTree(toml));
        } catch (JsonProcessingException e) {
            throw new ConfigException(ErrorKind.LOAD_FAILURE,
                    "Layer " + name + " is not valid TOML: " + e.getOriginalMessage(), e);
        }
    }

    public static Layer fromJson(String name, String json) throws ConfigException {
        try {
            return fromTree(name, MetricQueryGenerator.m_mapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new ConfigException(ErrorKind.LOAD_FAILURE,
                    "Layer " + name + " is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static Layer fromTree(String name, JsonNode tree) throws ConfigException {
        if (tree == null || tree.isMissingNode() || tree.isNull()) {
            return new Layer(name, MetricQueryGenerator.m_mapper.createObjectNode());
        }
        if (!tree.isObject()) {
            throw new ConfigException(ErrorKind.LOAD_FAILURE,
                    "Layer " + name + " must be a table of sections");
        }
        return new Layer(name, (ObjectNode) tree);
    }

    private Layer(String name, ObjectNode root) {
        m_name = name;
        m_root = root;
    }

    public String getName() {
        return m_name;
    }

    /** The parsed definitions. Treat as read only. */
    public ObjectNode getRoot() {
        return m_root;
    }

    @Override
    public String toString() {
        return "Layer(" + m_name + ")";
    }

    private final String m_name;
    private final ObjectNode m_root;
    private static final TomlMapper s_toml = new TomlMapper();
}
