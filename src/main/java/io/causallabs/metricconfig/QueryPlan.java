package io.causallabs.metricconfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import io.causallabs.mustache.ExperimentContext;

/**
 * Everything needed to render one query: the aggregation blocks with the first one as anchor,
 * the grouping dimensions, and what the rendered fragments may refer to. Also lists what was left
 * out of the query and why.
 */
public final class QueryPlan {

    public enum Kind {
        METRICS, SEGMENTS
    }

    QueryPlan(Kind kind, List<QueryBlock> blocks, List<String> keyColumns,
            Map<String, String> groupBy, String where, ExperimentContext experiment,
            String dataset, Map<String, Function> functions, Map<String, Parameter> parameters,
            List<Exclusion> exclusions, List<String> warnings) {
        m_kind = kind;
        m_blocks = List.copyOf(blocks);
        m_keyColumns = List.copyOf(keyColumns);
        m_groupBy = Collections.unmodifiableMap(new LinkedHashMap<>(groupBy));
        m_where = where;
        m_experiment = experiment;
        m_dataset = dataset;
        m_functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
        m_parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        m_exclusions = List.copyOf(exclusions);
        m_warnings = List.copyOf(warnings);
    }

    public Kind getKind() {
        return m_kind;
    }

    public List<QueryBlock> getBlocks() {
        return m_blocks;
    }

    /** The block every other block is joined to, null if there are no blocks */
    public QueryBlock getAnchor() {
        return m_blocks.isEmpty() ? null : m_blocks.get(0);
    }

    public QueryBlock getBlock(String name) {
        for (QueryBlock b : m_blocks) {
            if (b.getName().equals(name))
                return b;
        }
        return null;
    }

    public boolean isEmpty() {
        return m_blocks.isEmpty();
    }

    public List<String> getKeyColumns() {
        return m_keyColumns;
    }

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

    /** Aggregation macros the fragments may call */
    public Map<String, Function> getFunctions() {
        return m_functions;
    }

    /** Parameters the select expressions may refer to */
    public Map<String, Parameter> getParameters() {
        return m_parameters;
    }

    public List<Exclusion> getExclusions() {
        return m_exclusions;
    }

    public List<String> getWarnings() {
        return m_warnings;
    }

    private final Kind m_kind;
    private final List<QueryBlock> m_blocks;
    private final List<String> m_keyColumns;
    private final Map<String, String> m_groupBy;
    private final String m_where;
    private final ExperimentContext m_experiment;
    private final String m_dataset;
    private final Map<String, Function> m_functions;
    private final Map<String, Parameter> m_parameters;
    private final List<Exclusion> m_exclusions;
    private final List<String> m_warnings;
}
