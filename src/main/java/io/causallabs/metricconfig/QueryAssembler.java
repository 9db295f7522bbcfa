package io.causallabs.metricconfig;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Groups the requested metrics by data source and builds one aggregation block per data source.
 * The data source of the first requested metric anchors the query. Metrics that can not be
 * computed are excluded with the reason, and the rest of the request still goes through.
 */
public class QueryAssembler {

    public static final String CLIENT_ID = "client_id";
    public static final String SUBMISSION_DATE = "submission_date";
    static final List<String> KEY_COLUMNS = List.of(CLIENT_ID, SUBMISSION_DATE);

    public QueryAssembler() {
        this(new JoinGraphResolver());
    }

    public QueryAssembler(JoinGraphResolver resolver) {
        m_resolver = resolver;
    }

    public QueryPlan assemble(QueryRequest request, ResolvedConfiguration config) {
        List<Exclusion> exclusions = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        if (request.getPeriod() != null)
            logger.debug("Assembling the {} metrics", request.getPeriod().configName());

        // output names already in use, lower cased
        Map<String, String> taken = new HashMap<>();
        for (String key : KEY_COLUMNS) {
            taken.put(key, "key column " + key);
        }
        for (String dim : request.getGroupBy().keySet()) {
            taken.putIfAbsent(dim.toLowerCase(Locale.ROOT), "dimension " + dim);
        }

        Map<String, List<Metric>> perSource = new LinkedHashMap<>();
        for (String slug : new LinkedHashSet<>(request.getMetrics())) {
            Metric metric = config.getMetric(slug);
            if (metric == null) {
                exclude(exclusions, slug,
                        new ConfigError(ErrorKind.UNKNOWN_METRIC, slug, "unknown metric " + slug));
                continue;
            }
            if (config.getDataSource(metric.getDataSource()) == null) {
                exclude(exclusions, slug, new ConfigError(ErrorKind.UNKNOWN_DATA_SOURCE, slug,
                        "metric " + slug + " uses unknown data source " + metric.getDataSource(),
                        List.of(metric.getDataSource())));
                continue;
            }
            String owner = taken.putIfAbsent(slug.toLowerCase(Locale.ROOT), "metric " + slug);
            if (owner != null) {
                exclude(exclusions, slug, new ConfigError(ErrorKind.DUPLICATE_METRIC_NAME, slug,
                        "metric " + slug + " has the same output name as " + owner));
                continue;
            }
            perSource.computeIfAbsent(metric.getDataSource(), k -> new ArrayList<>()).add(metric);
        }

        List<QueryBlock> blocks = new ArrayList<>();
        for (Map.Entry<String, List<Metric>> e : perSource.entrySet()) {
            CompositionPlan composition =
                    m_resolver.resolve(e.getKey(), config, request.getGroupBy().keySet());
            warnings.addAll(composition.getWarnings());
            if (composition.hasErrors()) {
                for (Metric m : e.getValue()) {
                    for (ConfigError error : composition.getErrors()) {
                        exclude(exclusions, m.getSlug(), error);
                    }
                }
                continue;
            }
            blocks.add(block(e.getKey(), composition, e.getValue(), request));
        }

        return new QueryPlan(QueryPlan.Kind.METRICS, blocks, KEY_COLUMNS, request.getGroupBy(),
                request.getWhere(), request.getExperiment(), request.getDataset(),
                config.getFunctions(), config.getParameters(), exclusions, warnings);
    }

    private QueryBlock block(String name, CompositionPlan composition, List<Metric> metrics,
            QueryRequest request) {
        DataSource root = composition.getRootDataSource();
        Map<String, String> columns = new LinkedHashMap<>();
        columns.put(CLIENT_ID, composition.clientIdExpression());
        columns.put(SUBMISSION_DATE, composition.submissionDateExpression());
        for (Map.Entry<String, String> dim : request.getGroupBy().entrySet()) {
            columns.putIfAbsent(dim.getKey(),
                    composition.dimensionExpression(dim.getKey(), dim.getValue()));
        }
        List<String> values = new ArrayList<>();
        for (Metric m : metrics) {
            columns.put(m.getSlug(), m.getSelectExpression());
            values.add(m.getSlug());
        }

        String where = request.getWhere();
        if (request.isFilterToExperiment()) {
            where = and(where, root.getExperimentsColumnType().getMembershipPredicate());
        }
        logger.debug("Block {} computes {} over {} data sources", name, values,
                composition.getBlocks().size());
        return new QueryBlock(name, composition, composition.fromClause(),
                root.getDefaultDataset(), KEY_COLUMNS, columns,
                new ArrayList<>(request.getGroupBy().keySet()), values, metrics, where);
    }

    static String and(String left, String right) {
        if (left == null)
            return right;
        if (right == null)
            return left;
        return "(" + left + ") AND (" + right + ")";
    }

    static void exclude(List<Exclusion> exclusions, String entity, ConfigError error) {
        logger.warn("Excluding {}: {}", entity, error);
        exclusions.add(new Exclusion(entity, error));
    }

    private final JoinGraphResolver m_resolver;
    private static final Logger logger = LoggerFactory.getLogger(QueryAssembler.class);
}
