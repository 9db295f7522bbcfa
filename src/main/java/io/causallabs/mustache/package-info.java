/**
 * This package defines the context made available to the JMustache templates that produce the
 * final SQL, and the {@link io.causallabs.mustache.QueryRenderer} that drives them.
 * <p>
 * The query templates see: <ul>
 * <li>blocks - the list of {@link io.causallabs.mustache.Block}s, one WITH subquery each</li>
 * <li>columns - the {@link io.causallabs.mustache.Column}s of the final select</li>
 * <li>anchor - the name of the first block</li>
 * <li>joins - a {@link io.causallabs.mustache.JoinClause} per other block</li>
 * </ul>
 * <p>
 * SQL fragments written in definition files are rendered before that, against the experiment
 * variables and the aggregation macros. So if a metric is defined as
 *
 * <pre>
 *  select_expression = "{{#agg_sum}}active_hours{{/agg_sum}}"
 * </pre>
 *
 * and agg_sum is defined as COALESCE(SUM({select_expr}), 0), the block selects
 * COALESCE(SUM(active_hours), 0). Likewise {{experiment.start_date_str}} expands to the start date
 * of the {@link io.causallabs.mustache.ExperimentContext}, and {{parameters.id}} to the value of
 * the parameter named id, or to a CASE over the branch when it is distinct by branch.
 *
 */
package io.causallabs.mustache;
