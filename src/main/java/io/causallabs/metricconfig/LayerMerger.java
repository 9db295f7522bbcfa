package io.causallabs.metricconfig;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Supplier;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Combines ordered layers (general first, most specific last) into one configuration.
 *
 * <p>
 * A slug seen for the first time starts a new definition. A slug seen again is overridden field by
 * field: fields present in the later layer replace the accumulated ones, absent fields are left
 * alone, and joins, statistics and statistic parameters merge key by key in the same way. A body
 * with {@code enabled = false} removes the slug; an empty body changes nothing.
 *
 * <p>
 * Lists of metric slugs (the analysis periods under {@code metrics} and {@code default_metrics})
 * are not overridden: each layer appends to them.
 */
public class LayerMerger {

    public static final String DATA_SOURCES = "data_sources";
    public static final String METRICS = "metrics";
    public static final String SEGMENTS = "segments";
    public static final String DIMENSIONS = "dimensions";
    public static final String FUNCTIONS = "functions";
    public static final String STATISTICS = "statistics";
    public static final String PARAMETERS = "parameters";
    public static final String DEFAULT_METRICS = "default_metrics";

    // top level keys that describe the file rather than define anything
    private static final Set<String> IGNORED_KEYS = Set.of("friendly_name", "description");

    public ResolvedConfiguration merge(List<Layer> layers) {
        State state = new State();
        List<String> names = new ArrayList<>();
        for (Layer layer : layers) {
            logger.debug("Merging layer {}", layer.getName());
            state.ctx.enterLayer(layer.getName());
            names.add(layer.getName());
            mergeLayer(layer, state);
        }
        state.ctx.enterLayer(null);
        return resolve(state, names);
    }

    private void mergeLayer(Layer layer, State state) {
        Iterator<Map.Entry<String, JsonNode>> it = layer.getRoot().fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            JsonNode section = e.getValue();
            switch (e.getKey()) {
                case DATA_SOURCES:
                    mergeSection(section, DATA_SOURCES, state.dataSources, state.ctx,
                            DataSourceDefinition::new, DataSourceDefinition::fromJson,
                            (acc, def, path) -> acc.merge(def));
                    break;
                case METRICS:
                    mergeMetrics(section, state);
                    break;
                case DEFAULT_METRICS:
                    appendSlugs(section, DEFAULT_METRICS, state.defaultMetrics, state.ctx);
                    break;
                case PARAMETERS:
                    mergeSection(section, PARAMETERS, state.parameters, state.ctx,
                            ParameterDefinition::new,
                            (reader, established) -> ParameterDefinition.fromJson(reader),
                            (acc, def, path) -> acc.merge(def));
                    break;
                case SEGMENTS:
                    mergeSegments(section, state);
                    break;
                case DIMENSIONS:
                    mergeSection(section, DIMENSIONS, state.dimensions, state.ctx,
                            DimensionDefinition::new,
                            (reader, established) -> DimensionDefinition.fromJson(reader),
                            (acc, def, path) -> acc.merge(def));
                    break;
                case FUNCTIONS:
                    // function files may wrap the slug map in another functions table
                    JsonNode nested = section.get(FUNCTIONS);
                    if (section.size() == 1 && nested != null && nested.isObject()
                            && !nested.has("definition"))
                        section = nested;
                    mergeSection(section, FUNCTIONS, state.functions, state.ctx,
                            FunctionDefinition::new,
                            (reader, established) -> FunctionDefinition.fromJson(reader),
                            (acc, def, path) -> acc.merge(def));
                    break;
                case STATISTICS:
                    mergeSection(section, STATISTICS, state.statistics, state.ctx,
                            StatisticDefinition::new,
                            (reader, established) -> StatisticDefinition.fromJson(reader),
                            (acc, def, path) -> acc.merge(def, state.ctx, path));
                    break;
                default:
                    if (!IGNORED_KEYS.contains(e.getKey())) {
                        state.ctx.error(ErrorKind.UNEXPECTED_KEY, e.getKey(),
                                "unexpected section '" + e.getKey() + "'");
                    }
            }
        }
    }

    // analysis period lists sit next to the metric definitions
    private void mergeMetrics(JsonNode section, State state) {
        JsonNode definitions = section;
        if (section.isObject()) {
            ObjectNode copy = ((ObjectNode) section).deepCopy();
            for (AnalysisPeriod period : AnalysisPeriod.values()) {
                JsonNode slugs = copy.remove(period.configName());
                if (slugs != null) {
                    appendSlugs(slugs, METRICS + "." + period.configName(),
                            state.periods.get(period), state.ctx);
                }
            }
            definitions = copy;
        }
        mergeSection(definitions, METRICS, state.metrics, state.ctx, MetricDefinition::new,
                MetricDefinition::fromJson, (acc, def, path) -> acc.merge(def, state.ctx, path));
    }

    private static void appendSlugs(JsonNode list, String path, List<String> acc,
            MergeContext ctx) {
        if (!list.isArray()) {
            ctx.error(ErrorKind.INVALID_VALUE, path,
                    "expected a list of metric slugs but found " + FieldReader.describe(list));
            return;
        }
        for (JsonNode slug : list) {
            if (!slug.isTextual()) {
                ctx.error(ErrorKind.INVALID_VALUE, path,
                        "expected a metric slug but found " + FieldReader.describe(slug));
                continue;
            }
            acc.add(slug.textValue());
        }
    }

    // segments hold their own data sources under a reserved key
    private void mergeSegments(JsonNode section, State state) {
        if (!section.isObject()) {
            state.ctx.error(ErrorKind.INVALID_VALUE, SEGMENTS, "expected a table of segments");
            return;
        }
        JsonNode sources = section.get(DATA_SOURCES);
        if (sources != null) {
            mergeSection(sources, SEGMENTS + "." + DATA_SOURCES, state.segmentDataSources,
                    state.ctx, SegmentDataSourceDefinition::new,
                    (reader, established) -> SegmentDataSourceDefinition.fromJson(reader),
                    (acc, def, path) -> acc.merge(def));
        }
        JsonNode segments = ((ObjectNode) section).deepCopy().without(DATA_SOURCES);
        mergeSection(segments, SEGMENTS, state.segments, state.ctx, SegmentDefinition::new,
                (reader, established) -> SegmentDefinition.fromJson(reader),
                (acc, def, path) -> acc.merge(def));
    }

    private <D> void mergeSection(JsonNode section, String sectionName, Map<String, D> acc,
            MergeContext ctx, Supplier<D> empty, BiFunction<FieldReader, D, D> reader,
            Overrider<D> overrider) {
        if (!section.isObject()) {
            ctx.error(ErrorKind.INVALID_VALUE, sectionName,
                    "expected a table but found " + FieldReader.describe(section));
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> it = section.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            String slug = e.getKey();
            String path = sectionName + "." + slug;
            if (!e.getValue().isObject()) {
                ctx.error(ErrorKind.INVALID_VALUE, path,
                        "expected a table but found " + FieldReader.describe(e.getValue()));
                continue;
            }
            D established = acc.get(slug);
            FieldReader fields = new FieldReader(ctx, path, e.getValue(), established != null);
            if (fields.disabled()) {
                if (acc.remove(slug) != null)
                    logger.debug("Layer {} removed {}", ctx.layer(), path);
                continue;
            }
            D def = reader.apply(fields, established);
            if (established == null) {
                // a new entity is an empty definition overridden by this layer
                established = empty.get();
                acc.put(slug, established);
            }
            overrider.override(established, def, path);
        }
    }

    private ResolvedConfiguration resolve(State state, List<String> names) {
        MergeContext ctx = state.ctx;
        Map<String, DataSource> dataSources = new LinkedHashMap<>();
        for (Map.Entry<String, DataSourceDefinition> e : state.dataSources.entrySet()) {
            if (require(ctx, DATA_SOURCES, e.getKey(), "from_expression",
                    e.getValue().m_fromExpression)) {
                dataSources.put(e.getKey(), Defaults.dataSource(e.getKey(), e.getValue()));
            }
        }

        Map<String, Metric> metrics = new LinkedHashMap<>();
        for (Map.Entry<String, MetricDefinition> e : state.metrics.entrySet()) {
            MetricDefinition def = e.getValue();
            if (require(ctx, METRICS, e.getKey(), "data_source", def.m_dataSource)
                    & require(ctx, METRICS, e.getKey(), "select_expression",
                            def.m_selectExpression)) {
                metrics.put(e.getKey(), Defaults.metric(e.getKey(), def, ctx));
            }
        }

        Map<String, Segment> segments = new LinkedHashMap<>();
        for (Map.Entry<String, SegmentDefinition> e : state.segments.entrySet()) {
            SegmentDefinition def = e.getValue();
            if (require(ctx, SEGMENTS, e.getKey(), "data_source", def.m_dataSource)
                    & require(ctx, SEGMENTS, e.getKey(), "select_expression",
                            def.m_selectExpression)) {
                segments.put(e.getKey(), Defaults.segment(e.getKey(), def));
            }
        }

        Map<String, SegmentDataSource> segmentDataSources = new LinkedHashMap<>();
        for (Map.Entry<String, SegmentDataSourceDefinition> e : state.segmentDataSources
                .entrySet()) {
            if (require(ctx, SEGMENTS + "." + DATA_SOURCES, e.getKey(), "from_expression",
                    e.getValue().m_fromExpression)) {
                segmentDataSources.put(e.getKey(),
                        Defaults.segmentDataSource(e.getKey(), e.getValue()));
            }
        }

        Map<String, Dimension> dimensions = new LinkedHashMap<>();
        for (Map.Entry<String, DimensionDefinition> e : state.dimensions.entrySet()) {
            DimensionDefinition def = e.getValue();
            if (require(ctx, DIMENSIONS, e.getKey(), "data_source", def.m_dataSource)
                    & require(ctx, DIMENSIONS, e.getKey(), "select_expression",
                            def.m_selectExpression)) {
                dimensions.put(e.getKey(), Defaults.dimension(e.getKey(), def));
            }
        }

        Map<String, Function> functions = new LinkedHashMap<>();
        for (Map.Entry<String, FunctionDefinition> e : state.functions.entrySet()) {
            if (require(ctx, FUNCTIONS, e.getKey(), "definition", e.getValue().m_definition)) {
                functions.put(e.getKey(), Defaults.function(e.getKey(), e.getValue()));
            }
        }

        Map<String, Map<String, Object>> statistics = new LinkedHashMap<>();
        for (Map.Entry<String, StatisticDefinition> e : state.statistics.entrySet()) {
            statistics.put(e.getKey(), Defaults.statisticDefaults(e.getValue()));
        }

        Map<String, Parameter> parameters = new LinkedHashMap<>();
        for (Map.Entry<String, ParameterDefinition> e : state.parameters.entrySet()) {
            Parameter parameter = Defaults.parameter(e.getKey(), e.getValue(), ctx);
            if (parameter != null)
                parameters.put(e.getKey(), parameter);
        }

        // a slug listed by several layers is computed once
        Map<AnalysisPeriod, List<String>> periods = new EnumMap<>(AnalysisPeriod.class);
        for (Map.Entry<AnalysisPeriod, List<String>> e : state.periods.entrySet()) {
            periods.put(e.getKey(), new ArrayList<>(new LinkedHashSet<>(e.getValue())));
        }
        List<String> defaultMetrics = new ArrayList<>(new LinkedHashSet<>(state.defaultMetrics));

        return new ResolvedConfiguration(dataSources, metrics, segments, segmentDataSources,
                dimensions, functions, statistics, parameters, periods, defaultMetrics, names,
                ctx.errors());
    }

    private static boolean require(MergeContext ctx, String section, String slug, String field,
            Object value) {
        if (value != null)
            return true;
        ctx.error(ErrorKind.MISSING_FIELD, section + "." + slug, field + " is required");
        return false;
    }

    @FunctionalInterface
    private interface Overrider<D> {
        void override(D accumulated, D layer, String path);
    }

    // accumulated definitions while the layers are processed
    private static class State {
        final MergeContext ctx = new MergeContext();
        final Map<String, DataSourceDefinition> dataSources = new LinkedHashMap<>();
        final Map<String, MetricDefinition> metrics = new LinkedHashMap<>();
        final Map<String, SegmentDefinition> segments = new LinkedHashMap<>();
        final Map<String, SegmentDataSourceDefinition> segmentDataSources = new LinkedHashMap<>();
        final Map<String, DimensionDefinition> dimensions = new LinkedHashMap<>();
        final Map<String, FunctionDefinition> functions = new LinkedHashMap<>();
        final Map<String, StatisticDefinition> statistics = new LinkedHashMap<>();
        final Map<String, ParameterDefinition> parameters = new LinkedHashMap<>();
        final Map<AnalysisPeriod, List<String>> periods = new EnumMap<>(AnalysisPeriod.class);
        final List<String> defaultMetrics = new ArrayList<>();

        State() {
            for (AnalysisPeriod period : AnalysisPeriod.values()) {
                periods.put(period, new ArrayList<>());
            }
        }
    }

    private static final Logger logger = LoggerFactory.getLogger(LayerMerger.class);
}
