package io.causallabs.metricconfig;

/** The kinds of problems the engine reports about a configuration or a request. */
public enum ErrorKind {
    /** a metric, dimension or segment names a data source that does not exist */
    UNKNOWN_DATA_SOURCE,
    /** a join names a target data source that does not exist */
    UNKNOWN_JOIN_TARGET,
    /** following joins from a data source comes back to a data source already on the path */
    CYCLIC_JOIN_GRAPH,
    /** two metrics would produce the same output column in one query */
    DUPLICATE_METRIC_NAME,
    /** a template variable or macro used by a fragment is not available */
    MISSING_TEMPLATE_VARIABLE,
    /** a later layer gives a field a type that conflicts with the one already established */
    MALFORMED_OVERRIDE,
    /** a section or field name the engine does not know */
    UNEXPECTED_KEY,
    /** a field has the wrong type or an unknown enumeration value */
    INVALID_VALUE,
    /** a required field is absent after all layers were merged */
    MISSING_FIELD,
    /** the request names a metric that is not defined */
    UNKNOWN_METRIC,
    /** the request names a segment that is not defined */
    UNKNOWN_SEGMENT,
    /** a statistic parameter that the statistic's declared defaults do not know */
    UNKNOWN_STATISTIC_PARAMETER,
    /** a select expression refers to a parameter that is not defined */
    UNKNOWN_PARAMETER,
    /** every requested entity was excluded, so there is nothing to query */
    EMPTY_QUERY,
    /** a layer file could not be read or parsed */
    LOAD_FAILURE
}
