package io.causallabs.metricconfig;

/**
 * An aggregation macro that select expressions can call, e.g. {{#agg_sum}}active_hours{{/agg_sum}}.
 * The definition holds the placeholder {select_expr} for the enclosed expression.
 */
public final class Function {

    public static final String PLACEHOLDER = "{select_expr}";

    Function(String slug, String definition) {
        m_slug = slug;
        m_definition = definition;
    }

    public String getSlug() {
        return m_slug;
    }

    public String getDefinition() {
        return m_definition;
    }

    /** Expand the macro around the given expression */
    public String apply(String selectExpression) {
        return m_definition.replace(PLACEHOLDER, selectExpression);
    }

    private final String m_slug;
    private final String m_definition;
}
