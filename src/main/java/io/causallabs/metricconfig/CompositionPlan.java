package io.causallabs.metricconfig;

import java.util.ArrayList;
import java.util.List;

/**
 * The data sources needed to compute metrics over a root data source, in the order they are
 * joined, and the joins between them. A plan with errors can not be used.
 */
public final class CompositionPlan {

    CompositionPlan(String root, List<CompositionBlock> blocks, List<JoinEdge> edges,
            List<ConfigError> errors, List<String> warnings) {
        m_root = root;
        m_blocks = List.copyOf(blocks);
        m_edges = List.copyOf(edges);
        m_errors = List.copyOf(errors);
        m_warnings = List.copyOf(warnings);
    }

    public String getRoot() {
        return m_root;
    }

    /** The root data source, null if it does not exist */
    public DataSource getRootDataSource() {
        return m_blocks.isEmpty() ? null : m_blocks.get(0).getDataSource();
    }

    /** Placed data sources in breadth first order, the root first */
    public List<CompositionBlock> getBlocks() {
        return m_blocks;
    }

    public List<JoinEdge> getEdges() {
        return m_edges;
    }

    public List<ConfigError> getErrors() {
        return m_errors;
    }

    public boolean hasErrors() {
        return !m_errors.isEmpty();
    }

    /** Joins that were dropped because their target was already placed */
    public List<String> getWarnings() {
        return m_warnings;
    }

    public boolean isJoined() {
        return !m_edges.isEmpty();
    }

    /**
     * The FROM clause of the root's aggregation block. A root without joins is used as is,
     * otherwise every placed data source is aliased by its slug and chained with full outer joins.
     */
    public String fromClause() {
        DataSource root = getRootDataSource();
        if (!isJoined())
            return root.getFromExpression();
        StringBuilder sb = new StringBuilder();
        sb.append(root.getFromExpression()).append(" AS ").append(root.getSlug());
        for (JoinEdge edge : m_edges) {
            sb.append("\n    FULL OUTER JOIN ").append(block(edge.getRight()).getFromExpression())
                    .append(" AS ").append(edge.getRight()).append("\n    ON ")
                    .append(edge.getOnExpression());
        }
        return sb.toString();
    }

    /** The client id of a row of the composed FROM clause */
    public String clientIdExpression() {
        DataSource root = getRootDataSource();
        if (!isJoined())
            return root.getClientIdColumn();
        List<String> columns = new ArrayList<>();
        for (CompositionBlock b : m_blocks) {
            columns.add(JoinGraphResolver.qualify(b.getAlias(),
                    b.getDataSource().getClientIdColumn()));
        }
        return coalesce(columns);
    }

    /** The submission date of a row of the composed FROM clause */
    public String submissionDateExpression() {
        DataSource root = getRootDataSource();
        if (!isJoined())
            return root.getSubmissionDateColumn();
        List<String> columns = new ArrayList<>();
        for (CompositionBlock b : m_blocks) {
            columns.add(JoinGraphResolver.qualify(b.getAlias(),
                    b.getDataSource().getSubmissionDateColumn()));
        }
        return coalesce(columns);
    }

    /**
     * A grouping dimension over a row of the composed FROM clause. Without joins this is the
     * requested SQL. Otherwise it is the qualified expression of each data source that declares
     * the dimension, coalesced, or the requested SQL qualified with the root when none does.
     */
    public String dimensionExpression(String name, String sql) {
        if (!isJoined())
            return sql;
        List<String> columns = new ArrayList<>();
        for (CompositionBlock b : m_blocks) {
            String expression = b.getDimensionExpression(name);
            if (expression != null)
                columns.add(JoinGraphResolver.qualify(b.getAlias(), expression));
        }
        if (columns.isEmpty())
            return JoinGraphResolver.qualify(m_root, sql);
        if (columns.size() == 1)
            return columns.get(0);
        return coalesce(columns);
    }

    private static String coalesce(List<String> columns) {
        return "COALESCE(" + String.join(", ", columns) + ")";
    }

    private DataSource block(String slug) {
        for (CompositionBlock b : m_blocks) {
            if (b.getAlias().equals(slug))
                return b.getDataSource();
        }
        throw new IllegalStateException("No block for " + slug);
    }

    private final String m_root;
    private final List<CompositionBlock> m_blocks;
    private final List<JoinEdge> m_edges;
    private final List<ConfigError> m_errors;
    private final List<String> m_warnings;
}
