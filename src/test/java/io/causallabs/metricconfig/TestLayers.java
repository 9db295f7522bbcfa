package io.causallabs.metricconfig;

import java.util.ArrayList;
import java.util.List;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** Builds layers from TOML lines for tests. */
public final class TestLayers {

    private TestLayers() {}

    public static Layer toml(String name, String... lines) throws ConfigException {
        return Layer.fromToml(name, String.join("\n", lines));
    }

    public static ResolvedConfiguration merge(Layer... layers) {
        List<Layer> list = new ArrayList<>(List.of(layers));
        return new LayerMerger().merge(list);
    }

    /** The canonical JSON of a configuration without the layer names, for comparisons */
    public static JsonNode definitions(ResolvedConfiguration config)
            throws JsonProcessingException {
        ObjectNode node = (ObjectNode) MetricQueryGenerator.m_mapper.readTree(config.toJson());
        node.remove("layers");
        return node;
    }

    /** baseline joins events without a condition, both keyed on the default columns */
    public static Layer baselineAndEvents() throws ConfigException {
        return toml("general",
                "[data_sources.baseline]",
                "from_expression = 'mozdata.telemetry.baseline'",
                "[data_sources.baseline.joins.events]",
                "relationship = 'many_to_many'",
                "[data_sources.events]",
                "from_expression = 'mozdata.telemetry.events'");
    }
}
