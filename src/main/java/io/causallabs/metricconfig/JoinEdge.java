package io.causallabs.metricconfig;

/** One join of a composition plan, from a placed data source to the one it pulls in. */
public final class JoinEdge {

    JoinEdge(String left, String right, String onExpression, Relationship relationship,
            boolean synthesized) {
        m_left = left;
        m_right = right;
        m_onExpression = onExpression;
        m_relationship = relationship;
        m_synthesized = synthesized;
    }

    public String getLeft() {
        return m_left;
    }

    public String getRight() {
        return m_right;
    }

    /** The effective join condition, declared or synthesized */
    public String getOnExpression() {
        return m_onExpression;
    }

    /**
     * The declared cardinality. The join is a full outer join whatever its value; callers use it to
     * decide whether rows need deduplication.
     */
    public Relationship getRelationship() {
        return m_relationship;
    }

    /** true if the condition was built from the key columns rather than declared */
    public boolean isSynthesized() {
        return m_synthesized;
    }

    @Override
    public String toString() {
        return m_left + " -> " + m_right + " ON " + m_onExpression;
    }

    private final String m_left;
    private final String m_right;
    private final String m_onExpression;
    private final Relationship m_relationship;
    private final boolean m_synthesized;
}
