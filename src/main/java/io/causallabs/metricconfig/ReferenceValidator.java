package io.causallabs.metricconfig;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks the references between the entities of a resolved configuration. Validation never
 * changes the configuration; the caller decides what to do with the errors.
 */
public class ReferenceValidator {

    /** column names every generated block emits, so no metric may use them */
    public static final Set<String> KEY_COLUMNS = Set.copyOf(QueryAssembler.KEY_COLUMNS);

    private static final Pattern PARAMETER_REFERENCE =
            Pattern.compile("\\{\\{\\s*parameters\\.([A-Za-z0-9_]+)\\s*\\}\\}");

    public List<ConfigError> validate(ResolvedConfiguration config) {
        List<ConfigError> errors = new ArrayList<>();
        checkDataSources(config, errors);
        checkJoins(config, errors);
        checkMetricNames(config, errors);
        checkStatistics(config, errors);
        checkMetricLists(config, errors);
        checkParameters(config, errors);
        return errors;
    }

    private void checkDataSources(ResolvedConfiguration config, List<ConfigError> errors) {
        for (Metric m : config.getMetrics().values()) {
            if (config.getDataSource(m.getDataSource()) == null) {
                errors.add(new ConfigError(ErrorKind.UNKNOWN_DATA_SOURCE, m.getSlug(),
                        "metric " + m.getSlug() + " uses unknown data source "
                                + m.getDataSource(),
                        List.of(m.getDataSource())));
            }
        }
        for (Dimension d : config.getDimensions().values()) {
            if (config.getDataSource(d.getDataSource()) == null) {
                errors.add(new ConfigError(ErrorKind.UNKNOWN_DATA_SOURCE, d.getSlug(),
                        "dimension " + d.getSlug() + " uses unknown data source "
                                + d.getDataSource(),
                        List.of(d.getDataSource())));
            }
        }
        for (Segment s : config.getSegments().values()) {
            if (config.getSegmentDataSource(s.getDataSource()) == null) {
                errors.add(new ConfigError(ErrorKind.UNKNOWN_DATA_SOURCE, s.getSlug(),
                        "segment " + s.getSlug() + " uses unknown segment data source "
                                + s.getDataSource(),
                        List.of(s.getDataSource())));
            }
        }
    }

    private void checkJoins(ResolvedConfiguration config, List<ConfigError> errors) {
        JoinGraph graph = JoinGraph.of(config);
        for (String slug : graph.nodes()) {
            for (Join join : graph.joinsOf(slug)) {
                if (!graph.contains(join.getTarget())) {
                    errors.add(unknownJoinTarget(slug, join));
                }
            }
        }
        for (List<String> cycle : graph.cycles()) {
            errors.add(cyclicJoinGraph(cycle));
        }
    }

    static ConfigError unknownJoinTarget(String slug, Join join) {
        return new ConfigError(ErrorKind.UNKNOWN_JOIN_TARGET, slug,
                "data source " + slug + " joins unknown data source " + join.getTarget(),
                List.of(join.getTarget()));
    }

    static ConfigError cyclicJoinGraph(List<String> cycle) {
        List<String> shown = new ArrayList<>(cycle);
        shown.add(cycle.get(0));
        return new ConfigError(ErrorKind.CYCLIC_JOIN_GRAPH, cycle.get(0),
                "join cycle " + String.join(" -> ", shown), cycle);
    }

    // metric names become output columns, so they must differ within a data source
    private void checkMetricNames(ResolvedConfiguration config, List<ConfigError> errors) {
        Map<String, Map<String, String>> seen = new HashMap<>();
        for (Metric m : config.getMetrics().values()) {
            String key = m.getSlug().toLowerCase(Locale.ROOT);
            if (KEY_COLUMNS.contains(key)) {
                errors.add(new ConfigError(ErrorKind.DUPLICATE_METRIC_NAME, m.getSlug(),
                        "metric " + m.getSlug() + " has the name of a key column"));
                continue;
            }
            Map<String, String> names =
                    seen.computeIfAbsent(m.getDataSource(), k -> new HashMap<>());
            String previous = names.putIfAbsent(key, m.getSlug());
            if (previous != null) {
                errors.add(new ConfigError(ErrorKind.DUPLICATE_METRIC_NAME, m.getSlug(),
                        "metric " + m.getSlug() + " collides with " + previous + " in data source "
                                + m.getDataSource(),
                        List.of(previous)));
            }
        }
    }

    private void checkMetricLists(ResolvedConfiguration config, List<ConfigError> errors) {
        for (Map.Entry<AnalysisPeriod, List<String>> e : config.getPeriods().entrySet()) {
            checkListed(config, e.getValue(),
                    LayerMerger.METRICS + "." + e.getKey().configName(), errors);
        }
        checkListed(config, config.getDefaultMetrics(), LayerMerger.DEFAULT_METRICS, errors);
    }

    private void checkListed(ResolvedConfiguration config, List<String> slugs, String list,
            List<ConfigError> errors) {
        for (String slug : slugs) {
            if (config.getMetric(slug) == null) {
                errors.add(new ConfigError(ErrorKind.UNKNOWN_METRIC, slug,
                        list + " lists unknown metric " + slug));
            }
        }
    }

    private void checkParameters(ResolvedConfiguration config, List<ConfigError> errors) {
        for (Metric m : config.getMetrics().values()) {
            Matcher matcher = PARAMETER_REFERENCE.matcher(m.getSelectExpression());
            while (matcher.find()) {
                String name = matcher.group(1);
                if (config.getParameter(name) == null) {
                    errors.add(new ConfigError(ErrorKind.UNKNOWN_PARAMETER, m.getSlug(),
                            "metric " + m.getSlug() + " refers to unknown parameter " + name,
                            List.of(name)));
                }
            }
        }
    }

    private void checkStatistics(ResolvedConfiguration config, List<ConfigError> errors) {
        for (Metric m : config.getMetrics().values()) {
            for (Statistic stat : m.getStatistics().values()) {
                Map<String, Object> defaults = config.getStatisticDefaults().get(stat.getName());
                if (defaults == null || defaults.isEmpty())
                    continue;
                for (String param : stat.getParams().keySet()) {
                    if (!defaults.containsKey(param)) {
                        errors.add(new ConfigError(ErrorKind.UNKNOWN_STATISTIC_PARAMETER,
                                m.getSlug(), "statistic " + stat.getName() + " of metric "
                                        + m.getSlug() + " has no parameter " + param,
                                List.of(stat.getName())));
                    }
                }
            }
        }
    }
}
