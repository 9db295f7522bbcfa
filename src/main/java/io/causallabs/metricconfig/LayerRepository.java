package io.causallabs.metricconfig;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A checked out directory of definition files. The layers that apply to an analysis are, from
 * general to specific:
 *
 * <pre>
 *   definitions/functions.toml
 *   definitions/general.toml
 *   definitions/&lt;platform&gt;.toml
 *   defaults/&lt;app&gt;.toml
 *   outcomes/&lt;platform&gt;/&lt;outcome&gt;.toml, for each outcome of the experiment
 *   &lt;experiment&gt;.toml
 * </pre>
 *
 * Files that do not exist are skipped, except outcomes, which the experiment asks for by name.
 */
public class LayerRepository {

    public static final String DEFINITIONS_DIR = "definitions";
    public static final String DEFAULTS_DIR = "defaults";
    public static final String FUNCTIONS_FILE = "functions.toml";
    public static final String GENERAL_FILE = "general.toml";
    public static final String OUTCOMES_DIR = "outcomes";

    public LayerRepository(Path root) {
        m_root = root;
    }

    /**
     * Return the layers for the given platform, app and experiment in merge order. Any of the
     * arguments may be null to leave that layer out.
     */
    public List<Layer> layersFor(String platform, String app, String experimentSlug)
            throws ConfigException {
        return layersFor(platform, app, experimentSlug, List.of());
    }

    /**
     * As above, with the given outcomes of the platform merged in order between the defaults and
     * the experiment.
     *
     * @throws ConfigException if an outcome does not exist for the platform
     */
    public List<Layer> layersFor(String platform, String app, String experimentSlug,
            List<String> outcomes) throws ConfigException {
        List<Layer> result = new ArrayList<>();
        addIfPresent(result, m_root.resolve(DEFINITIONS_DIR).resolve(FUNCTIONS_FILE));
        addIfPresent(result, m_root.resolve(DEFINITIONS_DIR).resolve(GENERAL_FILE));
        if (platform != null)
            addIfPresent(result, m_root.resolve(DEFINITIONS_DIR).resolve(platform + ".toml"));
        if (app != null)
            addIfPresent(result, m_root.resolve(DEFAULTS_DIR).resolve(app + ".toml"));
        for (String outcome : outcomes) {
            result.add(outcome(platform, outcome));
        }
        if (experimentSlug != null)
            addIfPresent(result, m_root.resolve(experimentSlug + ".toml"));
        return result;
    }

    /** The layer of one outcome of a platform */
    public Layer outcome(String platform, String slug) throws ConfigException {
        if (platform == null)
            throw new ConfigException(ErrorKind.LOAD_FAILURE,
                    "Outcome " + slug + " needs a platform");
        Path file = m_root.resolve(OUTCOMES_DIR).resolve(platform).resolve(slug + ".toml");
        if (!Files.isRegularFile(file))
            throw new ConfigException(ErrorKind.LOAD_FAILURE,
                    "No outcome " + slug + " for platform " + platform);
        return LayerLoader.load(file, m_root.relativize(file).toString());
    }

    public Path getRoot() {
        return m_root;
    }

    private void addIfPresent(List<Layer> layers, Path file) throws ConfigException {
        if (!Files.isRegularFile(file)) {
            logger.debug("No layer at {}, skipping", file);
            return;
        }
        layers.add(LayerLoader.load(file, m_root.relativize(file).toString()));
    }

    private final Path m_root;
    private static final Logger logger = LoggerFactory.getLogger(LayerRepository.class);
}
