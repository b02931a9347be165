package sa.com.cloudsolutions.fortree.depsolver;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Transitive closure queries over a {@link DependencyGraph}.
 *
 * <p>
 * The result of a query holds every node reachable from the start node through a path of
 * one to <code>level</code> edges, in breadth first order. The start node itself is part of
 * the result only when a cycle leads back to it. A self loop is reported even when
 * <code>level</code> is zero.
 * </p>
 *
 * <p>
 * Fortran allows recursive procedures and modules may depend on each other through include
 * files, so the graphs are not acyclic. Each node is expanded at most once, which bounds the
 * work by the size of the graph.
 * </p>
 */
public class Reachability {

    public enum Direction {
        /**
         * Follow the outgoing edges: what the node needs or calls.
         */
        DOWN,
        /**
         * Follow the incoming edges: what needs or calls the node.
         */
        UP
    }

    private record Pending<N>(N node, int depth) {}

    private Reachability() {
        // Utility class
    }

    /**
     * Collects the nodes reachable from the start node.
     *
     * @param graph the graph to walk
     * @param start initial node
     * @param level maximum number of edges to follow, <code>null</code> for no limit
     * @param direction whether to follow outgoing or incoming edges
     * @return the reachable nodes in discovery order
     */
    public static <N> Set<N> collect(DependencyGraph<N> graph, N start, Integer level, Direction direction) {
        if (level != null && level < 0) {
            throw new IllegalArgumentException("level must be positive or null, got " + level);
        }
        Set<N> result = new LinkedHashSet<>();
        if (level != null && level == 0) {
            if (neighbours(graph, start, direction).contains(start)) {
                result.add(start);
            }
            return result;
        }

        Set<N> expanded = new HashSet<>();
        expanded.add(start);
        Deque<Pending<N>> queue = new ArrayDeque<>();
        queue.add(new Pending<>(start, 0));
        while (!queue.isEmpty()) {
            Pending<N> current = queue.poll();
            for (N next : neighbours(graph, current.node(), direction)) {
                result.add(next);
                if ((level == null || current.depth() + 1 < level) && expanded.add(next)) {
                    queue.add(new Pending<>(next, current.depth() + 1));
                }
            }
        }
        return result;
    }

    /**
     * True if any of the targets can be reached from the start node without depth limit.
     */
    public static <N> boolean reachesAny(DependencyGraph<N> graph, N start, Collection<N> targets,
                                         Direction direction) {
        Set<N> reachable = collect(graph, start, null, direction);
        for (N target : targets) {
            if (reachable.contains(target)) {
                return true;
            }
        }
        return false;
    }

    private static <N> List<N> neighbours(DependencyGraph<N> graph, N node, Direction direction) {
        return direction == Direction.DOWN ? graph.successors(node) : graph.predecessors(node);
    }
}
