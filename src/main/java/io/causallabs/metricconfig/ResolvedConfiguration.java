package io.causallabs.metricconfig;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import com.fasterxml.jackson.core.JsonGenerator;

/**
 * The result of merging an ordered list of layers: every entity keyed by slug, the names of the
 * layers that produced it, and the problems found while merging. Immutable.
 */
public final class ResolvedConfiguration {

    ResolvedConfiguration(Map<String, DataSource> dataSources, Map<String, Metric> metrics,
            Map<String, Segment> segments, Map<String, SegmentDataSource> segmentDataSources,
            Map<String, Dimension> dimensions, Map<String, Function> functions,
            Map<String, Map<String, Object>> statisticDefaults, Map<String, Parameter> parameters,
            Map<AnalysisPeriod, List<String>> periods, List<String> defaultMetrics,
            List<String> layerNames, List<ConfigError> errors) {
        m_dataSources = sorted(dataSources);
        m_metrics = sorted(metrics);
        m_segments = sorted(segments);
        m_segmentDataSources = sorted(segmentDataSources);
        m_dimensions = sorted(dimensions);
        m_functions = sorted(functions);
        m_statisticDefaults = sorted(statisticDefaults);
        m_parameters = sorted(parameters);
        Map<AnalysisPeriod, List<String>> p = new EnumMap<>(AnalysisPeriod.class);
        for (AnalysisPeriod period : AnalysisPeriod.values()) {
            List<String> slugs = periods.get(period);
            p.put(period, slugs == null ? List.of() : List.copyOf(slugs));
        }
        m_periods = Collections.unmodifiableMap(p);
        m_defaultMetrics = List.copyOf(defaultMetrics);
        m_layerNames = List.copyOf(layerNames);
        m_errors = List.copyOf(errors);
    }

    private static <T> Map<String, T> sorted(Map<String, T> map) {
        return Collections.unmodifiableMap(new TreeMap<>(map));
    }

    public Map<String, DataSource> getDataSources() {
        return m_dataSources;
    }

    public DataSource getDataSource(String slug) {
        return m_dataSources.get(slug);
    }

    public Map<String, Metric> getMetrics() {
        return m_metrics;
    }

    public Metric getMetric(String slug) {
        return m_metrics.get(slug);
    }

    public Map<String, Segment> getSegments() {
        return m_segments;
    }

    public Segment getSegment(String slug) {
        return m_segments.get(slug);
    }

    public Map<String, SegmentDataSource> getSegmentDataSources() {
        return m_segmentDataSources;
    }

    public SegmentDataSource getSegmentDataSource(String slug) {
        return m_segmentDataSources.get(slug);
    }

    public Map<String, Dimension> getDimensions() {
        return m_dimensions;
    }

    public Dimension getDimension(String slug) {
        return m_dimensions.get(slug);
    }

    /** The dimensions declared on the given data source, ordered by slug */
    public List<Dimension> dimensionsOf(String dataSource) {
        List<Dimension> result = new ArrayList<>();
        for (Dimension d : m_dimensions.values()) {
            if (d.getDataSource().equals(dataSource))
                result.add(d);
        }
        return result;
    }

    public Map<String, Function> getFunctions() {
        return m_functions;
    }

    /** Default parameters of each statistic, keyed by statistic name */
    public Map<String, Map<String, Object>> getStatisticDefaults() {
        return m_statisticDefaults;
    }

    /**
     * The statistics of a metric with each statistic's declared defaults filled in under the
     * parameters the metric sets itself.
     */
    public Map<String, Map<String, Object>> effectiveStatistics(String metricSlug) {
        Metric metric = m_metrics.get(metricSlug);
        if (metric == null)
            return Collections.emptyMap();
        Map<String, Map<String, Object>> result = new LinkedHashMap<>();
        for (Statistic stat : metric.getStatistics().values()) {
            Map<String, Object> params = new LinkedHashMap<>();
            Map<String, Object> defaults = m_statisticDefaults.get(stat.getName());
            if (defaults != null)
                params.putAll(defaults);
            params.putAll(stat.getParams());
            result.put(stat.getName(), Collections.unmodifiableMap(params));
        }
        return Collections.unmodifiableMap(result);
    }

    public Map<String, Parameter> getParameters() {
        return m_parameters;
    }

    public Parameter getParameter(String name) {
        return m_parameters.get(name);
    }

    /** Metric slugs listed for each analysis period, in the order the layers list them */
    public Map<AnalysisPeriod, List<String>> getPeriods() {
        return m_periods;
    }

    public List<String> getPeriodMetrics(AnalysisPeriod period) {
        return m_periods.get(period);
    }

    /** Metric slugs listed under default_metrics, typically by outcome layers */
    public List<String> getDefaultMetrics() {
        return m_defaultMetrics;
    }

    /** Names of the layers merged into this configuration, general first */
    public List<String> getLayerNames() {
        return m_layerNames;
    }

    /** Problems found while merging */
    public List<ConfigError> getErrors() {
        return m_errors;
    }

    /** Canonical JSON form. Identical layers always give identical text. */
    public String toJson() {
        StringWriter sw = new StringWriter();
        try {
            JsonGenerator gen = MetricQueryGenerator.m_mapper.getFactory().createGenerator(sw);
            gen.writeStartObject();
            gen.writeFieldName("layers");
            gen.writeStartArray();
            for (String name : m_layerNames) {
                gen.writeString(name);
            }
            gen.writeEndArray();
            gen.writeFieldName("data_sources");
            gen.writeStartObject();
            for (DataSource ds : m_dataSources.values()) {
                gen.writeFieldName(ds.getSlug());
                ds.serialize(gen);
            }
            gen.writeEndObject();
            gen.writeFieldName("metrics");
            gen.writeStartObject();
            for (Metric m : m_metrics.values()) {
                gen.writeFieldName(m.getSlug());
                m.serialize(gen);
            }
            gen.writeEndObject();
            gen.writeFieldName("dimensions");
            gen.writeStartObject();
            for (Dimension d : m_dimensions.values()) {
                gen.writeFieldName(d.getSlug());
                d.serialize(gen);
            }
            gen.writeEndObject();
            gen.writeFieldName("segments");
            gen.writeStartObject();
            for (Segment s : m_segments.values()) {
                gen.writeFieldName(s.getSlug());
                s.serialize(gen);
            }
            gen.writeFieldName("data_sources");
            gen.writeStartObject();
            for (SegmentDataSource sds : m_segmentDataSources.values()) {
                gen.writeFieldName(sds.getSlug());
                sds.serialize(gen);
            }
            gen.writeEndObject();
            gen.writeEndObject();
            gen.writeFieldName("functions");
            gen.writeStartObject();
            for (Function f : m_functions.values()) {
                gen.writeStringField(f.getSlug(), f.getDefinition());
            }
            gen.writeEndObject();
            gen.writeObjectField("statistics", m_statisticDefaults);
            gen.writeFieldName("parameters");
            gen.writeStartObject();
            for (Parameter p : m_parameters.values()) {
                gen.writeFieldName(p.getName());
                p.serialize(gen);
            }
            gen.writeEndObject();
            gen.writeFieldName("periods");
            gen.writeStartObject();
            for (Map.Entry<AnalysisPeriod, List<String>> e : m_periods.entrySet()) {
                gen.writeObjectField(e.getKey().configName(), e.getValue());
            }
            gen.writeEndObject();
            gen.writeObjectField("default_metrics", m_defaultMetrics);
            gen.writeEndObject();
            gen.close();
            return sw.toString();
        } catch (IOException e) {
            // we are writing to a string, so this should never fail
            throw new RuntimeException("Error creating in memory JSON string.", e);
        }
    }

    private final Map<String, DataSource> m_dataSources;
    private final Map<String, Metric> m_metrics;
    private final Map<String, Segment> m_segments;
    private final Map<String, SegmentDataSource> m_segmentDataSources;
    private final Map<String, Dimension> m_dimensions;
    private final Map<String, Function> m_functions;
    private final Map<String, Map<String, Object>> m_statisticDefaults;
    private final Map<String, Parameter> m_parameters;
    private final Map<AnalysisPeriod, List<String>> m_periods;
    private final List<String> m_defaultMetrics;
    private final List<String> m_layerNames;
    private final List<ConfigError> m_errors;
}
