package io.causallabs.metricconfig;

import java.util.Collections;
import java.util.List;

/** A problem that makes the whole request impossible to complete */
public class ConfigException extends Exception {

    /**
     *
     */
    private static final long serialVersionUID = 3150471528867312201L;

    public ConfigException(ErrorKind kind, String message) {
        this(kind, message, Collections.emptyList());
    }

    public ConfigException(ErrorKind kind, String message, List<ConfigError> errors) {
        super(message);
        m_kind = kind;
        m_errors = List.copyOf(errors);
    }

    public ConfigException(ErrorKind kind, String message, Throwable e) {
        super(message, e);
        m_kind = kind;
        m_errors = Collections.emptyList();
    }

    public ErrorKind getKind() {
        return m_kind;
    }

    /** The collected errors behind this exception, if it aborts on more than one problem */
    public List<ConfigError> getErrors() {
        return m_errors;
    }

    private final ErrorKind m_kind;
    private final List<ConfigError> m_errors;

}
