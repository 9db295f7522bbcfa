package io.causallabs.metricconfig;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** One problem found while merging, validating or assembling a configuration. */
public final class ConfigError {

    public ConfigError(ErrorKind kind, String entity, String message) {
        this(kind, entity, message, Collections.emptyList());
    }

    public ConfigError(ErrorKind kind, String entity, String message, List<String> related) {
        m_kind = Objects.requireNonNull(kind);
        m_entity = entity;
        m_message = message;
        m_related = List.copyOf(related);
    }

    public ErrorKind getKind() {
        return m_kind;
    }

    /** The slug or section path the problem is attached to */
    public String getEntity() {
        return m_entity;
    }

    public String getMessage() {
        return m_message;
    }

    /** Other slugs involved, e.g. the members of a join cycle */
    public List<String> getRelated() {
        return m_related;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ConfigError))
            return false;
        ConfigError other = (ConfigError) o;
        return m_kind == other.m_kind && Objects.equals(m_entity, other.m_entity)
                && Objects.equals(m_message, other.m_message)
                && m_related.equals(other.m_related);
    }

    @Override
    public int hashCode() {
        return Objects.hash(m_kind, m_entity, m_message, m_related);
    }

    @Override
    public String toString() {
        return m_kind + " [" + m_entity + "]: " + m_message;
    }

    private final ErrorKind m_kind;
    private final String m_entity;
    private final String m_message;
    private final List<String> m_related;
}
