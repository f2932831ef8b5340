package io.flowcheck.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Enumerates simple paths (no repeated node) between two nodes with an iterative
 * depth-first search.
 * <p>
 * The number of simple paths grows exponentially in densely branching graphs.
 * A positive {@code maxPaths} stops each enumeration after that many paths.
 */
public class PathFinder {

    private final FlowGraph graph;
    private final int maxPaths;

    /**
     * Creates an unbounded path finder.
     */
    public PathFinder(FlowGraph graph) {
        this(graph, 0);
    }

    /**
     * @param graph    Graph to search
     * @param maxPaths Maximum number of paths per source/target pair; zero or negative means unbounded
     */
    public PathFinder(FlowGraph graph, int maxPaths) {
        this.graph = graph;
        this.maxPaths = maxPaths;
    }

    /**
     * Returns every simple path from source to target, each as [source, ..., target].
     * Returns an empty list when source equals target or either node is unknown.
     */
    public List<List<String>> findSimplePaths(String sourceId, String targetId) {
        List<List<String>> paths = new ArrayList<>();
        forEachSimplePath(sourceId, targetId, paths::add);
        return paths;
    }

    /**
     * Streams every simple path from source to target to the given consumer.
     * Each path handed out is an immutable snapshot.
     *
     * @return the number of paths visited
     */
    public int forEachSimplePath(String sourceId, String targetId, Consumer<List<String>> visitor) {
        if (!graph.hasNode(sourceId) || !graph.hasNode(targetId) || sourceId.equals(targetId)) {
            return 0;
        }

        int count = 0;
        List<String> path = new ArrayList<>();
        Set<String> onPath = new HashSet<>();
        Deque<Iterator<String>> frontier = new ArrayDeque<>();
        path.add(sourceId);
        onPath.add(sourceId);
        frontier.push(graph.successors(sourceId).iterator());

        while (!frontier.isEmpty()) {
            Iterator<String> children = frontier.peek();
            if (!children.hasNext()) {
                frontier.pop();
                onPath.remove(path.remove(path.size() - 1));
                continue;
            }

            String child = children.next();
            if (onPath.contains(child)) {
                continue;
            }
            if (child.equals(targetId)) {
                List<String> found = new ArrayList<>(path);
                found.add(child);
                visitor.accept(List.copyOf(found));
                count++;
                if (maxPaths > 0 && count >= maxPaths) {
                    break;
                }
                continue;
            }

            path.add(child);
            onPath.add(child);
            frontier.push(graph.successors(child).iterator());
        }

        return count;
    }
}
