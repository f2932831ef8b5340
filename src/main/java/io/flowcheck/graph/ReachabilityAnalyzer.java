package io.flowcheck.graph;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.Queue;
import java.util.Set;
import java.util.function.Function;

/**
 * Computes descendant and ancestor sets with breadth-first search.
 * Result sets iterate in discovery order.
 */
public class ReachabilityAnalyzer {

    private final FlowGraph graph;

    public ReachabilityAnalyzer(FlowGraph graph) {
        this.graph = graph;
    }

    /**
     * Returns all nodes reachable from the given node by following edges forward.
     * The node itself is never included, even when it lies on a cycle.
     */
    public Set<String> descendants(String nodeId) {
        return traverse(nodeId, graph::successors);
    }

    /**
     * Returns all nodes from which the given node can be reached.
     * The node itself is never included, even when it lies on a cycle.
     */
    public Set<String> ancestors(String nodeId) {
        return traverse(nodeId, graph::predecessors);
    }

    /**
     * Returns the roots themselves plus everything reachable from any of them.
     * Unknown root ids are ignored.
     */
    public Set<String> reachableFrom(Collection<String> roots) {
        Set<String> reachable = new LinkedHashSet<>();
        Queue<String> workQueue = new LinkedList<>();

        for (String root : roots) {
            if (graph.hasNode(root) && reachable.add(root)) {
                workQueue.add(root);
            }
        }

        while (!workQueue.isEmpty()) {
            String current = workQueue.poll();
            for (String next : graph.successors(current)) {
                addIfNew(next, reachable, workQueue);
            }
        }

        return reachable;
    }

    /**
     * Returns true if target can be reached from source in one or more steps.
     * Always false when source and target are the same node.
     */
    public boolean hasPath(String sourceId, String targetId) {
        return descendants(sourceId).contains(targetId);
    }

    private Set<String> traverse(String start, Function<String, Collection<String>> neighbours) {
        Set<String> visited = new LinkedHashSet<>();
        if (!graph.hasNode(start)) {
            return visited;
        }

        Queue<String> workQueue = new LinkedList<>(neighbours.apply(start));
        for (String first : workQueue) {
            visited.add(first);
        }

        while (!workQueue.isEmpty()) {
            String current = workQueue.poll();
            for (String next : neighbours.apply(current)) {
                addIfNew(next, visited, workQueue);
            }
        }

        visited.remove(start);
        return visited;
    }

    private void addIfNew(String nodeId, Set<String> visited, Queue<String> workQueue) {
        if (visited.add(nodeId)) {
            workQueue.add(nodeId);
        }
    }
}
