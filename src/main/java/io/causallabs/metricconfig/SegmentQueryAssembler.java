package io.causallabs.metricconfig;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import io.causallabs.mustache.ExperimentContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the per-client segment membership query. Segments are grouped by their segment data
 * source, each source becomes one block grouped by client, and blocks are joined on the client
 * id. When the experiment's enrollment dates are known, each block only reads the days of its
 * data source's window around enrollment.
 */
public class SegmentQueryAssembler {

    static final List<String> KEY_COLUMNS = List.of(QueryAssembler.CLIENT_ID);

    public QueryPlan assemble(QueryRequest request, ResolvedConfiguration config) {
        List<Exclusion> exclusions = new ArrayList<>();
        Map<String, String> taken = new HashMap<>();
        taken.put(QueryAssembler.CLIENT_ID, "key column " + QueryAssembler.CLIENT_ID);

        Map<String, List<Segment>> perSource = new LinkedHashMap<>();
        for (String slug : new LinkedHashSet<>(request.getSegments())) {
            Segment segment = config.getSegment(slug);
            if (segment == null) {
                QueryAssembler.exclude(exclusions, slug, new ConfigError(
                        ErrorKind.UNKNOWN_SEGMENT, slug, "unknown segment " + slug));
                continue;
            }
            if (config.getSegmentDataSource(segment.getDataSource()) == null) {
                QueryAssembler.exclude(exclusions, slug,
                        new ConfigError(ErrorKind.UNKNOWN_DATA_SOURCE, slug,
                                "segment " + slug + " uses unknown segment data source "
                                        + segment.getDataSource(),
                                List.of(segment.getDataSource())));
                continue;
            }
            String owner = taken.putIfAbsent(slug.toLowerCase(Locale.ROOT), "segment " + slug);
            if (owner != null) {
                QueryAssembler.exclude(exclusions, slug,
                        new ConfigError(ErrorKind.DUPLICATE_METRIC_NAME, slug,
                                "segment " + slug + " has the same output name as " + owner));
                continue;
            }
            perSource.computeIfAbsent(segment.getDataSource(), k -> new ArrayList<>())
                    .add(segment);
        }

        List<QueryBlock> blocks = new ArrayList<>();
        for (Map.Entry<String, List<Segment>> e : perSource.entrySet()) {
            blocks.add(block(config.getSegmentDataSource(e.getKey()), e.getValue(), request));
        }
        return new QueryPlan(QueryPlan.Kind.SEGMENTS, blocks, KEY_COLUMNS, Map.of(),
                request.getWhere(), request.getExperiment(), request.getDataset(),
                config.getFunctions(), config.getParameters(), exclusions, List.of());
    }

    private QueryBlock block(SegmentDataSource source, List<Segment> segments,
            QueryRequest request) {
        Map<String, String> columns = new LinkedHashMap<>();
        columns.put(QueryAssembler.CLIENT_ID, source.getClientIdColumn());
        List<String> values = new ArrayList<>();
        for (Segment s : segments) {
            columns.put(s.getSlug(), s.getSelectExpression());
            values.add(s.getSlug());
        }
        String where = QueryAssembler.and(request.getWhere(),
                windowPredicate(source, request.getExperiment()));
        logger.debug("Segment block {} computes {}", source.getSlug(), values);
        return new QueryBlock(source.getSlug(), null, source.getFromExpression(), null,
                KEY_COLUMNS, columns, List.of(), values, List.of(), where);
    }

    private static String windowPredicate(SegmentDataSource source,
            ExperimentContext experiment) {
        if (experiment == null || experiment.getLastEnrollmentDate() == null)
            return null;
        return source.getSubmissionDateColumn()
                + " BETWEEN DATE_ADD('{{experiment.start_date_str}}', INTERVAL "
                + source.getWindowStart() + " DAY) AND DATE_ADD("
                + "'{{experiment.last_enrollment_date_str}}', INTERVAL " + source.getWindowEnd()
                + " DAY)";
    }

    private static final Logger logger = LoggerFactory.getLogger(SegmentQueryAssembler.class);
}
