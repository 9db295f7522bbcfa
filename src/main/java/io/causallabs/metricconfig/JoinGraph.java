package io.causallabs.metricconfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The declared joins of a configuration as a directed graph keyed by data source slug. Edges keep
 * their declaration order. Targets that are not data sources are kept as edges but are not nodes.
 */
public final class JoinGraph {

    public static JoinGraph of(ResolvedConfiguration config) {
        Map<String, List<Join>> edges = new LinkedHashMap<>();
        for (DataSource ds : config.getDataSources().values()) {
            edges.put(ds.getSlug(), List.copyOf(ds.getJoins().values()));
        }
        return new JoinGraph(edges);
    }

    private JoinGraph(Map<String, List<Join>> edges) {
        m_edges = Collections.unmodifiableMap(edges);
    }

    public boolean contains(String slug) {
        return m_edges.containsKey(slug);
    }

    public Set<String> nodes() {
        return m_edges.keySet();
    }

    /** Outgoing joins of a data source, empty if it is not in the graph */
    public List<Join> joinsOf(String slug) {
        List<Join> joins = m_edges.get(slug);
        return joins == null ? Collections.emptyList() : joins;
    }

    /** Every cycle in the graph */
    public List<List<String>> cycles() {
        return cyclesFrom(m_edges.keySet());
    }

    /** The cycles that can be reached by following joins from the given data source */
    public List<List<String>> cyclesReachableFrom(String root) {
        return cyclesFrom(List.of(root));
    }

    // depth first search keeping the current path; a join back onto the path closes a cycle
    private List<List<String>> cyclesFrom(Iterable<String> starts) {
        Set<List<String>> found = new LinkedHashSet<>();
        Set<String> done = new HashSet<>();
        for (String start : starts) {
            if (contains(start))
                visit(start, new ArrayList<>(), new HashSet<>(), done, found);
        }
        return new ArrayList<>(found);
    }

    private void visit(String node, List<String> path, Set<String> onPath, Set<String> done,
            Set<List<String>> found) {
        if (done.contains(node))
            return;
        path.add(node);
        onPath.add(node);
        for (Join join : joinsOf(node)) {
            String target = join.getTarget();
            if (onPath.contains(target)) {
                found.add(canonical(path.subList(path.indexOf(target), path.size())));
            } else if (contains(target)) {
                visit(target, path, onPath, done, found);
            }
        }
        onPath.remove(node);
        path.remove(path.size() - 1);
        done.add(node);
    }

    // rotate so the cycle starts at its smallest slug, so each cycle has one spelling
    private static List<String> canonical(List<String> cycle) {
        int min = 0;
        for (int i = 1; i < cycle.size(); i++) {
            if (cycle.get(i).compareTo(cycle.get(min)) < 0)
                min = i;
        }
        List<String> result = new ArrayList<>(cycle.size());
        for (int i = 0; i < cycle.size(); i++) {
            result.add(cycle.get((min + i) % cycle.size()));
        }
        return Collections.unmodifiableList(result);
    }

    private final Map<String, List<Join>> m_edges;
}
