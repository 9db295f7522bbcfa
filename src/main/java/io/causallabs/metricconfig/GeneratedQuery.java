package io.causallabs.metricconfig;

import java.util.List;

/** The SQL for one request, the plan it was rendered from, and every problem met on the way. */
public final class GeneratedQuery {

    GeneratedQuery(String sql, QueryPlan plan, List<ConfigError> errors) {
        m_sql = sql;
        m_plan = plan;
        m_errors = List.copyOf(errors);
    }

    public String getSql() {
        return m_sql;
    }

    public QueryPlan getPlan() {
        return m_plan;
    }

    /** Merge and validation errors of the configuration */
    public List<ConfigError> getErrors() {
        return m_errors;
    }

    /** Requested metrics or segments missing from the SQL */
    public List<Exclusion> getExclusions() {
        return m_plan.getExclusions();
    }

    private final String m_sql;
    private final QueryPlan m_plan;
    private final List<ConfigError> m_errors;
}
