package io.causallabs.metricconfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** A data source placed in a composition plan, with the grouping dimensions it exposes. */
public final class CompositionBlock {

    CompositionBlock(DataSource dataSource, Map<String, String> dimensions) {
        m_dataSource = dataSource;
        m_dimensions = Collections.unmodifiableMap(new LinkedHashMap<>(dimensions));
    }

    public DataSource getDataSource() {
        return m_dataSource;
    }

    /** The name the data source is known by inside the composed FROM clause */
    public String getAlias() {
        return m_dataSource.getSlug();
    }

    /** Names of the requested grouping dimensions this data source declares */
    public List<String> getDimensions() {
        return new ArrayList<>(m_dimensions.keySet());
    }

    /** The select expression this data source declares for a dimension, null if none */
    public String getDimensionExpression(String name) {
        return m_dimensions.get(name);
    }

    private final DataSource m_dataSource;
    private final Map<String, String> m_dimensions;
}
