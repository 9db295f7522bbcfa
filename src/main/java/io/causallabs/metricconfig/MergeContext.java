package io.causallabs.metricconfig;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Collects the errors of one merge, tagging each with the layer being processed. */
final class MergeContext {

    void enterLayer(String layerName) {
        m_layer = layerName;
    }

    String layer() {
        return m_layer;
    }

    void error(ErrorKind kind, String entity, String message) {
        String full = m_layer == null ? message : "layer '" + m_layer + "': " + message;
        ConfigError error = new ConfigError(kind, entity, full);
        logger.debug("{}", error);
        m_errors.add(error);
    }

    List<ConfigError> errors() {
        return m_errors;
    }

    private String m_layer;
    private final List<ConfigError> m_errors = new ArrayList<>();
    private static final Logger logger = LoggerFactory.getLogger(MergeContext.class);
}
