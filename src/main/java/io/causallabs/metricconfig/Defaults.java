package io.causallabs.metricconfig;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Every default value of the definition records, and the only place records are built from merged
 * definitions. A field left unset by all layers gets its value here and nowhere else.
 */
public final class Defaults {

    public static final String CLIENT_ID_COLUMN = "client_id";
    public static final String SUBMISSION_DATE_COLUMN = "submission_date";
    public static final ExperimentsColumnType EXPERIMENTS_COLUMN_TYPE = ExperimentsColumnType.NONE;
    public static final String BUILD_ID_COLUMN = "SAFE.SUBSTR(application.build_id, 0, 8)";
    public static final Relationship RELATIONSHIP = Relationship.MANY_TO_MANY;
    public static final boolean BIGGER_IS_BETTER = true;
    public static final List<AnalysisBasis> ANALYSIS_BASES =
            List.of(AnalysisBasis.ENROLLMENTS, AnalysisBasis.EXPOSURES);
    public static final String METRIC_TYPE = "scalar";
    public static final int WINDOW_START = 0;
    public static final int WINDOW_END = 0;
    public static final boolean DISTINCT_BY_BRANCH = false;

    private Defaults() {}

    static DataSource dataSource(String slug, DataSourceDefinition def) {
        Map<String, Join> joins = new LinkedHashMap<>();
        for (Map.Entry<String, JoinDefinition> e : def.m_joins.entrySet()) {
            joins.put(e.getKey(), join(e.getKey(), e.getValue()));
        }
        return new DataSource(slug, def.m_fromExpression,
                or(def.m_clientIdColumn, CLIENT_ID_COLUMN),
                or(def.m_submissionDateColumn, SUBMISSION_DATE_COLUMN),
                or(def.m_experimentsColumnType, EXPERIMENTS_COLUMN_TYPE), def.m_defaultDataset,
                or(def.m_buildIdColumn, BUILD_ID_COLUMN), def.m_friendlyName, def.m_description,
                joins);
    }

    static Join join(String target, JoinDefinition def) {
        return new Join(target, def.m_onExpression, or(def.m_relationship, RELATIONSHIP));
    }

    static Metric metric(String slug, MetricDefinition def, MergeContext ctx) {
        Map<String, Statistic> statistics = new LinkedHashMap<>();
        for (Map.Entry<String, StatisticDefinition> e : def.m_statistics.entrySet()) {
            statistics.put(e.getKey(), statistic(e.getKey(), e.getValue(), ctx,
                    "metrics." + slug + ".statistics." + e.getKey()));
        }
        return new Metric(slug, def.m_dataSource, def.m_selectExpression,
                dedent(def.m_friendlyName), dedent(def.m_description),
                or(def.m_biggerIsBetter, BIGGER_IS_BETTER),
                or(def.m_analysisBases, ANALYSIS_BASES), or(def.m_type, METRIC_TYPE),
                def.m_category, statistics);
    }

    static Statistic statistic(String name, StatisticDefinition def, MergeContext ctx,
            String path) {
        Map<String, Object> params = new LinkedHashMap<>();
        List<PreTreatment> preTreatments = new ArrayList<>();
        for (Map.Entry<String, JsonNode> e : def.m_params.entrySet()) {
            if (StatisticDefinition.PRE_TREATMENTS.equals(e.getKey())) {
                preTreatments.addAll(preTreatments(e.getValue(), ctx, path));
            } else {
                params.put(e.getKey(), toValue(e.getValue()));
            }
        }
        return new Statistic(name, params, preTreatments);
    }

    static Segment segment(String slug, SegmentDefinition def) {
        return new Segment(slug, def.m_dataSource, def.m_selectExpression,
                dedent(def.m_friendlyName), dedent(def.m_description));
    }

    static SegmentDataSource segmentDataSource(String slug, SegmentDataSourceDefinition def) {
        return new SegmentDataSource(slug, def.m_fromExpression,
                or(def.m_clientIdColumn, CLIENT_ID_COLUMN),
                or(def.m_submissionDateColumn, SUBMISSION_DATE_COLUMN),
                or(def.m_windowStart, WINDOW_START), or(def.m_windowEnd, WINDOW_END),
                dedent(def.m_friendlyName), dedent(def.m_description));
    }

    static Dimension dimension(String slug, DimensionDefinition def) {
        return new Dimension(slug, def.m_dataSource, def.m_selectExpression,
                dedent(def.m_friendlyName), dedent(def.m_description));
    }

    static Function function(String slug, FunctionDefinition def) {
        return new Function(slug, def.m_definition);
    }

    /**
     * The value of a parameter is the declared value, else the default. Returns null after
     * reporting when there is neither, or when its shape does not match distinct_by_branch.
     */
    static Parameter parameter(String name, ParameterDefinition def, MergeContext ctx) {
        String path = "parameters." + name;
        JsonNode value = def.m_value != null ? def.m_value : def.m_default;
        if (value == null) {
            ctx.error(ErrorKind.MISSING_FIELD, path, "value or default is required");
            return null;
        }
        boolean distinct = or(def.m_distinctByBranch, DISTINCT_BY_BRANCH);
        if (distinct != value.isObject()) {
            ctx.error(ErrorKind.INVALID_VALUE, path, distinct
                    ? "distinct_by_branch needs a table of branch values"
                    : "a table of branch values needs distinct_by_branch = true");
            return null;
        }
        String defaultValue = def.m_default != null && def.m_default.isValueNode()
                ? def.m_default.asText() : null;
        if (!distinct) {
            if (!value.isValueNode()) {
                ctx.error(ErrorKind.INVALID_VALUE, path,
                        "value should be a scalar but is " + FieldReader.describe(value));
                return null;
            }
            return new Parameter(name, value.asText(), null, defaultValue,
                    dedent(def.m_friendlyName), dedent(def.m_description));
        }
        Map<String, String> branches = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = value.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (!e.getValue().isValueNode()) {
                ctx.error(ErrorKind.INVALID_VALUE, path, "value of branch " + e.getKey()
                        + " should be a scalar but is " + FieldReader.describe(e.getValue()));
                return null;
            }
            branches.put(e.getKey(), e.getValue().asText());
        }
        return new Parameter(name, null, branches, defaultValue, dedent(def.m_friendlyName),
                dedent(def.m_description));
    }

    /** Statistic defaults keep the raw parameter values, pre-treatments included */
    static Map<String, Object> statisticDefaults(StatisticDefinition def) {
        Map<String, Object> params = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> e : def.m_params.entrySet()) {
            params.put(e.getKey(), toValue(e.getValue()));
        }
        return params;
    }

    private static List<PreTreatment> preTreatments(JsonNode node, MergeContext ctx, String path) {
        List<PreTreatment> result = new ArrayList<>();
        if (!node.isArray()) {
            ctx.error(ErrorKind.INVALID_VALUE, path, "pre_treatments should be a list");
            return result;
        }
        for (JsonNode pt : node) {
            if (pt.isTextual()) {
                result.add(new PreTreatment(pt.textValue(), Map.of()));
            } else if (pt.isObject() && pt.path("name").isTextual()) {
                Map<String, Object> args = new LinkedHashMap<>();
                Iterator<Map.Entry<String, JsonNode>> it = pt.fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> arg = it.next();
                    if (!"name".equals(arg.getKey()))
                        args.put(arg.getKey(), toValue(arg.getValue()));
                }
                result.add(new PreTreatment(pt.get("name").textValue(), args));
            } else {
                ctx.error(ErrorKind.INVALID_VALUE, path,
                        "a pre-treatment must be a name or a table with a name");
            }
        }
        return result;
    }

    private static Object toValue(JsonNode node) {
        return MetricQueryGenerator.m_mapper.convertValue(node, Object.class);
    }

    private static <T> T or(T value, T fallback) {
        return value != null ? value : fallback;
    }

    /** Strip the common leading indentation of multi-line descriptions */
    static String dedent(String text) {
        if (text == null || text.indexOf('\n') < 0)
            return text;
        String[] lines = text.split("\n", -1);
        int indent = Integer.MAX_VALUE;
        for (String line : lines) {
            if (line.isBlank())
                continue;
            int i = 0;
            while (i < line.length() && line.charAt(i) == ' ')
                i++;
            indent = Math.min(indent, i);
        }
        if (indent == Integer.MAX_VALUE || indent == 0)
            return text;
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            sb.append(line.length() >= indent ? line.substring(indent) : line.strip());
            if (i < lines.length - 1)
                sb.append('\n');
        }
        return sb.toString();
    }
}
