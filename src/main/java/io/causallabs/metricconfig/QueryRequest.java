package io.causallabs.metricconfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import io.causallabs.mustache.ExperimentContext;

/**
 * What to compute: the metrics (or segments) by slug, how to group them, an optional row filter
 * and the experiment the query is generated for.
 */
public class QueryRequest {

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {

        public Builder metric(String slug) {
            m_metrics.add(slug);
            return this;
        }

        public Builder metrics(List<String> slugs) {
            m_metrics.addAll(slugs);
            return this;
        }

        /** Compute the metrics the configuration lists for an analysis period */
        public Builder period(ResolvedConfiguration config, AnalysisPeriod period) {
            m_period = period;
            return metrics(config.getPeriodMetrics(period));
        }

        /** Compute the metrics the configuration lists under default_metrics */
        public Builder defaultMetrics(ResolvedConfiguration config) {
            return metrics(config.getDefaultMetrics());
        }

        public Builder segment(String slug) {
            m_segments.add(slug);
            return this;
        }

        /**
         * Group by a dimension given as an output name and the SQL that computes it. The name
         * can not be a key column or, ignoring case, the name of an earlier dimension.
         */
        public Builder groupBy(String name, String sql) {
            String lower = name.toLowerCase(Locale.ROOT);
            if (QueryAssembler.KEY_COLUMNS.contains(lower))
                throw new IllegalArgumentException(
                        "Dimension " + name + " has the name of a key column");
            for (String existing : m_groupBy.keySet()) {
                if (existing.toLowerCase(Locale.ROOT).equals(lower))
                    throw new IllegalArgumentException(
                            "Dimension " + name + " is already grouped by as " + existing);
            }
            m_groupBy.put(name, sql);
            return this;
        }

        /** Group by a declared dimension, which must exist in the configuration */
        public Builder groupBy(ResolvedConfiguration config, String dimensionSlug) {
            Dimension d = config.getDimension(dimensionSlug);
            if (d == null)
                throw new IllegalArgumentException("Unknown dimension " + dimensionSlug);
            return groupBy(d.getSlug(), d.getSelectExpression());
        }

        public Builder where(String predicate) {
            m_where = predicate;
            return this;
        }

        public Builder experiment(ExperimentContext experiment) {
            m_experiment = experiment;
            return this;
        }

        /** Value of {{dataset}} in from expressions, overriding each data source's default */
        public Builder dataset(String dataset) {
            m_dataset = dataset;
            return this;
        }

        /** Keep only rows of clients enrolled in the experiment, where the data source knows */
        public Builder filterToExperiment(boolean x) {
            m_filterToExperiment = x;
            return this;
        }

        public QueryRequest build() {
            return new QueryRequest(this);
        }

        private Builder() {}

        private final List<String> m_metrics = new ArrayList<>();
        private final List<String> m_segments = new ArrayList<>();
        private final Map<String, String> m_groupBy = new LinkedHashMap<>();
        private String m_where;
        private ExperimentContext m_experiment;
        private String m_dataset;
        private boolean m_filterToExperiment = false;
        private AnalysisPeriod m_period;
    }

    private QueryRequest(Builder b) {
        m_metrics = List.copyOf(b.m_metrics);
        m_segments = List.copyOf(b.m_segments);
        m_groupBy = Collections.unmodifiableMap(new LinkedHashMap<>(b.m_groupBy));
        m_where = b.m_where;
        m_experiment = b.m_experiment;
        m_dataset = b.m_dataset;
        m_filterToExperiment = b.m_filterToExperiment;
        m_period = b.m_period;
    }

    /** Requested metric slugs in request order, possibly with repeats */
    public List<String> getMetrics() {
        return m_metrics;
    }

    public List<String> getSegments() {
        return m_segments;
    }

    /** Grouping dimensions, output name to SQL, in request order */
    public Map<String, String> getGroupBy() {
        return m_groupBy;
    }

    public String getWhere() {
        return m_where;
    }

    public ExperimentContext getExperiment() {
        return m_experiment;
    }

    public String getDataset() {
        return m_dataset;
    }

    public boolean isFilterToExperiment() {
        return m_filterToExperiment;
    }

    /** The analysis period the metrics were taken from, null if they were named one by one */
    public AnalysisPeriod getPeriod() {
        return m_period;
    }

    private final List<String> m_metrics;
    private final List<String> m_segments;
    private final Map<String, String> m_groupBy;
    private final String m_where;
    private final ExperimentContext m_experiment;
    private final String m_dataset;
    private final boolean m_filterToExperiment;
    private final AnalysisPeriod m_period;
}
