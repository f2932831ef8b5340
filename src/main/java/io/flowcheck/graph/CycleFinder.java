package io.flowcheck.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Enumerates elementary (simple) cycles using Johnson's algorithm.
 * <p>
 * Nodes are ranked by input order. Each cycle is reported once, starting at its
 * lowest-ranked node and listed in visiting order, e.g. {@code [n2, n3]} for
 * {@code n2 -> n3 -> n2}. A self-loop is a one-node cycle.
 * <p>
 * The number of simple cycles can grow exponentially with the number of edges.
 * A positive {@code maxCycles} stops the enumeration once that many cycles were found.
 */
public class CycleFinder {

    private final FlowGraph graph;
    private final int maxCycles;

    private final List<List<String>> cycles = new ArrayList<>();
    private final Set<String> blocked = new HashSet<>();
    private final Map<String, Set<String>> blockedMap = new HashMap<>();
    private final Deque<String> stack = new ArrayDeque<>();
    private Map<String, List<String>> component;
    private String startNode;
    private boolean truncated;

    /**
     * Creates an unbounded finder.
     */
    public CycleFinder(FlowGraph graph) {
        this(graph, 0);
    }

    /**
     * @param graph     Graph to search
     * @param maxCycles Maximum number of cycles to report; zero or negative means unbounded
     */
    public CycleFinder(FlowGraph graph, int maxCycles) {
        this.graph = graph;
        this.maxCycles = maxCycles;
    }

    /**
     * Returns all simple cycles, each as the list of its node ids in visiting order.
     */
    public List<List<String>> findCycles() {
        cycles.clear();
        truncated = false;

        List<String> ordered = new ArrayList<>(graph.nodeIds());
        int s = 0;
        while (s < ordered.size() && !limitReached()) {
            Set<String> allowed = new HashSet<>(ordered.subList(s, ordered.size()));
            Map<String, List<String>> scc = lowestCyclicComponent(allowed);
            if (scc == null) {
                break;
            }

            component = scc;
            startNode = lowestRanked(scc.keySet());
            for (String node : scc.keySet()) {
                blocked.remove(node);
                blockedMap.computeIfAbsent(node, k -> new HashSet<>()).clear();
            }
            circuit(startNode);

            s = graph.indexOf(startNode) + 1;
        }

        return List.copyOf(cycles);
    }

    /**
     * Returns true if the last search stopped at the configured limit.
     */
    public boolean isTruncated() {
        return truncated;
    }

    /**
     * Johnson's CIRCUIT procedure, driven by an explicit frame stack.
     */
    private void circuit(String root) {
        Deque<CircuitFrame> frames = new ArrayDeque<>();
        enter(root, frames);

        while (!frames.isEmpty()) {
            CircuitFrame frame = frames.peek();
            if (!limitReached() && frame.children.hasNext()) {
                String w = frame.children.next();
                if (w.equals(startNode)) {
                    recordCycle();
                    frame.found = true;
                } else if (!blocked.contains(w)) {
                    enter(w, frames);
                }
                continue;
            }

            frames.pop();
            if (frame.found) {
                unblock(frame.node);
            } else {
                for (String w : component.get(frame.node)) {
                    blockedMap.get(w).add(frame.node);
                }
            }
            stack.pop();

            if (frame.found && !frames.isEmpty()) {
                frames.peek().found = true;
            }
        }
    }

    private void enter(String v, Deque<CircuitFrame> frames) {
        stack.push(v);
        blocked.add(v);
        frames.push(new CircuitFrame(v, component.get(v).iterator()));
    }

    private void unblock(String u) {
        Deque<String> pending = new ArrayDeque<>();
        pending.push(u);
        while (!pending.isEmpty()) {
            String node = pending.pop();
            if (blocked.remove(node)) {
                Set<String> dependents = blockedMap.get(node);
                pending.addAll(dependents);
                dependents.clear();
            }
        }
    }

    private void recordCycle() {
        List<String> cycle = new ArrayList<>(stack.size());
        stack.descendingIterator().forEachRemaining(cycle::add);
        cycles.add(List.copyOf(cycle));
        if (maxCycles > 0 && cycles.size() >= maxCycles) {
            truncated = true;
        }
    }

    private boolean limitReached() {
        return maxCycles > 0 && cycles.size() >= maxCycles;
    }

    /**
     * Finds the strongly connected component, within the allowed nodes, that contains a cycle
     * and whose lowest-ranked node is lowest overall. Returns its adjacency restricted to itself.
     */
    private Map<String, List<String>> lowestCyclicComponent(Set<String> allowed) {
        List<Set<String>> components = new TarjanScc(allowed).run();

        Set<String> best = null;
        int bestRank = Integer.MAX_VALUE;
        for (Set<String> candidate : components) {
            if (!isCyclic(candidate)) {
                continue;
            }
            int rank = graph.indexOf(lowestRanked(candidate));
            if (rank < bestRank) {
                bestRank = rank;
                best = candidate;
            }
        }
        if (best == null) {
            return null;
        }

        Map<String, List<String>> adjacency = new HashMap<>();
        for (String node : best) {
            List<String> next = new ArrayList<>();
            for (String w : graph.successors(node)) {
                if (best.contains(w)) {
                    next.add(w);
                }
            }
            adjacency.put(node, next);
        }
        return adjacency;
    }

    private boolean isCyclic(Set<String> scc) {
        if (scc.size() > 1) {
            return true;
        }
        String only = scc.iterator().next();
        return graph.successors(only).contains(only);
    }

    private String lowestRanked(Set<String> nodes) {
        String lowest = null;
        for (String node : nodes) {
            if (lowest == null || graph.indexOf(node) < graph.indexOf(lowest)) {
                lowest = node;
            }
        }
        return lowest;
    }

    /**
     * Tarjan's strongly connected components over the subgraph induced by the allowed nodes.
     * Iterative, so path length is not bounded by the thread stack.
     */
    private class TarjanScc {
        private final Set<String> allowed;
        private final Map<String, Integer> index = new HashMap<>();
        private final Map<String, Integer> lowLink = new HashMap<>();
        private final Deque<String> sccStack = new ArrayDeque<>();
        private final Set<String> onStack = new HashSet<>();
        private final List<Set<String>> result = new ArrayList<>();
        private int counter;

        TarjanScc(Set<String> allowed) {
            this.allowed = allowed;
        }

        List<Set<String>> run() {
            for (String node : graph.nodeIds()) {
                if (allowed.contains(node) && !index.containsKey(node)) {
                    strongConnect(node);
                }
            }
            return result;
        }

        private void strongConnect(String root) {
            Deque<TarjanFrame> frames = new ArrayDeque<>();
            visit(root, frames);

            while (!frames.isEmpty()) {
                TarjanFrame frame = frames.peek();
                String v = frame.node();
                if (frame.successors().hasNext()) {
                    String w = frame.successors().next();
                    if (!allowed.contains(w)) {
                        continue;
                    }
                    if (!index.containsKey(w)) {
                        visit(w, frames);
                    } else if (onStack.contains(w)) {
                        lowLink.put(v, Math.min(lowLink.get(v), index.get(w)));
                    }
                    continue;
                }

                frames.pop();
                if (lowLink.get(v).equals(index.get(v))) {
                    Set<String> scc = new HashSet<>();
                    String w;
                    do {
                        w = sccStack.pop();
                        onStack.remove(w);
                        scc.add(w);
                    } while (!w.equals(v));
                    result.add(scc);
                }
                if (!frames.isEmpty()) {
                    String parent = frames.peek().node();
                    lowLink.put(parent, Math.min(lowLink.get(parent), lowLink.get(v)));
                }
            }
        }

        private void visit(String v, Deque<TarjanFrame> frames) {
            index.put(v, counter);
            lowLink.put(v, counter);
            counter++;
            sccStack.push(v);
            onStack.add(v);
            frames.push(new TarjanFrame(v, graph.successors(v).iterator()));
        }
    }

    private static final class CircuitFrame {
        private final String node;
        private final Iterator<String> children;
        private boolean found;

        CircuitFrame(String node, Iterator<String> children) {
            this.node = node;
            this.children = children;
        }
    }

    private record TarjanFrame(String node, Iterator<String> successors) {
    }
}
