package io.causallabs.metricconfig;

/** A requested entity left out of a generated query, and why. */
public final class Exclusion {

    public Exclusion(String entity, ConfigError reason) {
        m_entity = entity;
        m_reason = reason;
    }

    /** Slug of the metric or segment that was left out */
    public String getEntity() {
        return m_entity;
    }

    public ConfigError getReason() {
        return m_reason;
    }

    @Override
    public String toString() {
        return m_entity + " excluded: " + m_reason;
    }

    private final String m_entity;
    private final ConfigError m_reason;
}
