package io.causallabs.metricconfig;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands the joins of a root data source, transitive ones included, into a composition plan.
 * Data sources are placed breadth first and each is placed once: a join onto a data source that
 * is already in the plan is dropped with a warning, so cyclic graphs still terminate.
 */
public class JoinGraphResolver {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public CompositionPlan resolve(String root, ResolvedConfiguration config) {
        return resolve(root, config, Collections.emptyList());
    }

    /**
     * @param dimensions names of the grouping dimensions of the query. Joins without a declared
     *        condition also match on the ones both sides declare.
     */
    public CompositionPlan resolve(String root, ResolvedConfiguration config,
            Collection<String> dimensions) {
        List<ConfigError> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        DataSource rootSource = config.getDataSource(root);
        if (rootSource == null) {
            errors.add(new ConfigError(ErrorKind.UNKNOWN_DATA_SOURCE, root,
                    "unknown data source " + root));
            return new CompositionPlan(root, List.of(), List.of(), errors, warnings);
        }

        JoinGraph graph = JoinGraph.of(config);
        for (List<String> cycle : graph.cyclesReachableFrom(root)) {
            errors.add(ReferenceValidator.cyclicJoinGraph(cycle));
        }

        Map<String, CompositionBlock> placed = new LinkedHashMap<>();
        List<JoinEdge> edges = new ArrayList<>();
        placed.put(root, block(rootSource, config, dimensions));
        Deque<String> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            String slug = queue.poll();
            for (Join join : graph.joinsOf(slug)) {
                String target = join.getTarget();
                if (!graph.contains(target)) {
                    errors.add(ReferenceValidator.unknownJoinTarget(slug, join));
                    continue;
                }
                if (placed.containsKey(target)) {
                    String warning = "dropped join " + slug + " -> " + target + ", " + target
                            + " is already part of the plan for " + root;
                    logger.warn(warning);
                    warnings.add(warning);
                    continue;
                }
                CompositionBlock left = placed.get(slug);
                CompositionBlock right = block(config.getDataSource(target), config, dimensions);
                placed.put(target, right);
                edges.add(edge(left, right, join));
                queue.add(target);
            }
        }
        logger.debug("Resolved {} into {} blocks and {} joins", root, placed.size(),
                edges.size());
        return new CompositionPlan(root, new ArrayList<>(placed.values()), edges, errors,
                warnings);
    }

    private CompositionBlock block(DataSource ds, ResolvedConfiguration config,
            Collection<String> dimensions) {
        Map<String, String> exposed = new LinkedHashMap<>();
        for (String name : dimensions) {
            Dimension d = declared(ds, name, config);
            if (d != null)
                exposed.put(name, d.getSelectExpression());
        }
        return new CompositionBlock(ds, exposed);
    }

    private JoinEdge edge(CompositionBlock left, CompositionBlock right, Join join) {
        if (join.getOnExpression() != null) {
            return new JoinEdge(left.getAlias(), right.getAlias(), join.getOnExpression(),
                    join.getRelationship(), false);
        }
        DataSource l = left.getDataSource();
        DataSource r = right.getDataSource();
        List<String> conditions = new ArrayList<>();
        conditions.add(equality(left.getAlias(), l.getClientIdColumn(), right.getAlias(),
                r.getClientIdColumn()));
        conditions.add(equality(left.getAlias(), l.getSubmissionDateColumn(), right.getAlias(),
                r.getSubmissionDateColumn()));
        for (String name : left.getDimensions()) {
            String rightExpr = right.getDimensionExpression(name);
            if (rightExpr != null) {
                conditions.add(equality(left.getAlias(), left.getDimensionExpression(name),
                        right.getAlias(), rightExpr));
            }
        }
        return new JoinEdge(left.getAlias(), right.getAlias(), String.join(" AND ", conditions),
                join.getRelationship(), true);
    }

    /**
     * The dimension a data source declares under the given name: one named so, or one that
     * selects a column of that name.
     */
    private static Dimension declared(DataSource ds, String name, ResolvedConfiguration config) {
        Dimension byExpression = null;
        for (Dimension d : config.dimensionsOf(ds.getSlug())) {
            if (d.getSlug().equals(name))
                return d;
            if (byExpression == null && name.equals(d.getSelectExpression()))
                byExpression = d;
        }
        return byExpression;
    }

    private static String equality(String leftAlias, String leftExpr, String rightAlias,
            String rightExpr) {
        return qualify(leftAlias, leftExpr) + " = " + qualify(rightAlias, rightExpr);
    }

    /** Prefix plain column names with the alias, leave any other expression alone */
    static String qualify(String alias, String expression) {
        if (IDENTIFIER.matcher(expression).matches())
            return alias + "." + expression;
        return expression;
    }

    private static final Logger logger = LoggerFactory.getLogger(JoinGraphResolver.class);
}
