package sa.com.cloudsolutions.fortree.depsolver;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable directed graph stored as an adjacency list.
 *
 * @param <N> the node type: file names for the compilation graph, scope paths for the execution graph
 */
public class DependencyGraph<N> {
    private final Map<N, List<N>> edges;
    private Map<N, List<N>> reverse;

    /**
     * @param adjacency map from a node to the nodes it depends on; duplicated targets are removed
     */
    public DependencyGraph(Map<N, ? extends Collection<N>> adjacency) {
        Map<N, List<N>> copy = new LinkedHashMap<>();
        for (Map.Entry<N, ? extends Collection<N>> e : adjacency.entrySet()) {
            copy.put(e.getKey(), List.copyOf(new LinkedHashSet<>(e.getValue())));
        }
        this.edges = Collections.unmodifiableMap(copy);
    }

    /**
     * The nodes the given node points to.
     */
    public List<N> successors(N node) {
        return edges.getOrDefault(node, List.of());
    }

    /**
     * The nodes pointing to the given node.
     */
    public List<N> predecessors(N node) {
        if (reverse == null) {
            Map<N, List<N>> r = new LinkedHashMap<>();
            for (Map.Entry<N, List<N>> e : edges.entrySet()) {
                for (N target : e.getValue()) {
                    r.computeIfAbsent(target, k -> new ArrayList<>()).add(e.getKey());
                }
            }
            reverse = r;
        }
        return reverse.getOrDefault(node, List.of());
    }

    public boolean hasEdge(N from, N to) {
        return successors(from).contains(to);
    }

    /**
     * Nodes that have an entry of their own in the adjacency list.
     */
    public Set<N> nodes() {
        return edges.keySet();
    }

    public boolean contains(N node) {
        return edges.containsKey(node);
    }

    public Map<N, List<N>> asMap() {
        return edges;
    }

    public int edgeCount() {
        int count = 0;
        for (List<N> targets : edges.values()) {
            count += targets.size();
        }
        return count;
    }
}
