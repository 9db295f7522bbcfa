package io.causallabs.metricconfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.causallabs.mustache.QueryRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates analysis SQL from layered definitions: merge the layers, validate the result, assemble
 * the requested metrics into a plan and render it.
 *
 * <p>
 * Problems with individual metrics leave those metrics out of the query and are reported with the
 * result. A missing template variable fails the whole request, as does anything at all when the
 * generator is configured with {@link GeneratorOptions.Builder#failOnValidationErrors(boolean)}.
 *
 * <p>
 * A generator holds no per-request state and may be shared between threads.
 */
public class MetricQueryGenerator {

    public static final ObjectMapper m_mapper = new ObjectMapper();

    /** classpath location of the bundled aggregation macros */
    public static final String BUILTIN_FUNCTIONS = "io/causallabs/metricconfig/functions.toml";

    public MetricQueryGenerator() throws ConfigException {
        this(GeneratorOptions.DEFAULTS);
    }

    public MetricQueryGenerator(GeneratorOptions options) throws ConfigException {
        m_options = options;
        m_renderer = new QueryRenderer(options.getTemplatePath());
        m_builtins = options.isIncludeBuiltinFunctions()
                ? LayerLoader.loadResource(BUILTIN_FUNCTIONS)
                : null;
    }

    /** Merge the layers, general first, after the bundled functions if those are enabled */
    public ResolvedConfiguration resolve(List<Layer> layers) {
        List<Layer> all = new ArrayList<>();
        if (m_builtins != null)
            all.add(m_builtins);
        all.addAll(layers);
        return m_merger.merge(all);
    }

    /** Merge and validation errors of a configuration */
    public List<ConfigError> validate(ResolvedConfiguration config) {
        List<ConfigError> errors = new ArrayList<>(config.getErrors());
        errors.addAll(m_validator.validate(config));
        return errors;
    }

    public GeneratedQuery generate(List<Layer> layers, QueryRequest request)
            throws ConfigException {
        return generate(resolve(layers), request);
    }

    public GeneratedQuery generate(ResolvedConfiguration config, QueryRequest request)
            throws ConfigException {
        List<ConfigError> errors = check(config);
        QueryPlan plan = m_assembler.assemble(request, config);
        return render(plan, errors);
    }

    public GeneratedQuery generateSegments(List<Layer> layers, QueryRequest request)
            throws ConfigException {
        return generateSegments(resolve(layers), request);
    }

    public GeneratedQuery generateSegments(ResolvedConfiguration config, QueryRequest request)
            throws ConfigException {
        List<ConfigError> errors = check(config);
        QueryPlan plan = m_segmentAssembler.assemble(request, config);
        return render(plan, errors);
    }

    public GeneratorOptions getOptions() {
        return m_options;
    }

    private List<ConfigError> check(ResolvedConfiguration config) throws ConfigException {
        List<ConfigError> errors = validate(config);
        if (errors.isEmpty())
            return errors;
        if (m_options.isFailOnValidationErrors()) {
            throw new ConfigException(errors.get(0).getKind(),
                    "Configuration has " + errors.size() + " errors, the first is "
                            + errors.get(0),
                    errors);
        }
        for (ConfigError error : errors) {
            logger.warn("Configuration error: {}", error);
        }
        return errors;
    }

    private GeneratedQuery render(QueryPlan plan, List<ConfigError> errors)
            throws ConfigException {
        if (m_options.isFailOnValidationErrors() && !plan.getExclusions().isEmpty()) {
            List<ConfigError> reasons = new ArrayList<>();
            for (Exclusion e : plan.getExclusions()) {
                reasons.add(e.getReason());
            }
            throw new ConfigException(reasons.get(0).getKind(),
                    plan.getExclusions().size() + " requested entities can not be computed",
                    reasons);
        }
        String sql = m_renderer.render(plan);
        logger.info("Generated {} query with {} blocks, {} excluded",
                plan.getKind().name().toLowerCase(Locale.ROOT), plan.getBlocks().size(),
                plan.getExclusions().size());
        return new GeneratedQuery(sql, plan, errors);
    }

    private final GeneratorOptions m_options;
    private final QueryRenderer m_renderer;
    private final Layer m_builtins;
    private final LayerMerger m_merger = new LayerMerger();
    private final ReferenceValidator m_validator = new ReferenceValidator();
    private final QueryAssembler m_assembler = new QueryAssembler();
    private final SegmentQueryAssembler m_segmentAssembler = new SegmentQueryAssembler();
    private static final Logger logger = LoggerFactory.getLogger(MetricQueryGenerator.class);
}
