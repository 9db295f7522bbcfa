package io.causallabs.metricconfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One aggregation subquery of a generated query: the columns it selects, the FROM clause it reads
 * and the columns it groups by. Expressions are still unrendered SQL fragments.
 */
public final class QueryBlock {

    QueryBlock(String name, CompositionPlan composition, String from, String defaultDataset,
            List<String> keyColumns, Map<String, String> columns, List<String> dimensions,
            List<String> values, List<Metric> metrics, String where) {
        m_name = name;
        m_composition = composition;
        m_from = from;
        m_defaultDataset = defaultDataset;
        m_keyColumns = List.copyOf(keyColumns);
        m_columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
        m_dimensions = List.copyOf(dimensions);
        m_values = List.copyOf(values);
        m_metrics = List.copyOf(metrics);
        m_where = where;
    }

    /** Name of the block in the WITH clause, the slug of its data source */
    public String getName() {
        return m_name;
    }

    /** How the block's data sources are joined, null for segment blocks */
    public CompositionPlan getComposition() {
        return m_composition;
    }

    public String getFrom() {
        return m_from;
    }

    /** Value of {{dataset}} when the request gives none, may be null */
    public String getDefaultDataset() {
        return m_defaultDataset;
    }

    /** The columns the blocks of a query are joined on */
    public List<String> getKeyColumns() {
        return m_keyColumns;
    }

    /** Selected columns, output name to expression, in select order */
    public Map<String, String> getColumns() {
        return m_columns;
    }

    /** Names of the grouping dimensions */
    public List<String> getDimensions() {
        return m_dimensions;
    }

    /** Names of the computed columns, metrics or segments */
    public List<String> getValues() {
        return m_values;
    }

    public List<Metric> getMetrics() {
        return m_metrics;
    }

    /** The row filter, null if there is none */
    public String getWhere() {
        return m_where;
    }

    /** Grouping columns: the dimensions followed by the key columns */
    public List<String> getGroupBy() {
        List<String> result = new ArrayList<>(m_dimensions);
        result.addAll(m_keyColumns);
        return result;
    }

    /**
     * Whether the block groups by the column expressions instead of the output names. A joined
     * FROM clause has the key and dimension names in several data sources, so the names alone
     * are ambiguous there.
     */
    public boolean isGroupedByExpression() {
        return m_composition != null && m_composition.isJoined();
    }

    private final String m_name;
    private final CompositionPlan m_composition;
    private final String m_from;
    private final String m_defaultDataset;
    private final List<String> m_keyColumns;
    private final Map<String, String> m_columns;
    private final List<String> m_dimensions;
    private final List<String> m_values;
    private final List<Metric> m_metrics;
    private final String m_where;
}
