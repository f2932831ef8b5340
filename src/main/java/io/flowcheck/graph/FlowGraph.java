package io.flowcheck.graph;

import io.flowcheck.model.FlowchartEdge;
import io.flowcheck.model.NodeType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable directed multigraph of a flowchart.
 * <p>
 * Every submitted node is present, connected or not. Parallel edges between the same
 * ordered pair are kept, so degrees count them. Node and edge order follow the input,
 * which keeps every traversal (and therefore every result list) deterministic.
 */
public class FlowGraph {

    private final Map<String, FlowNode> nodes;
    private final List<FlowEdge> edges;
    private final List<FlowchartEdge> droppedEdges;

    // Derived indexes
    private final Map<String, List<FlowEdge>> outgoing;
    private final Map<String, List<FlowEdge>> incoming;
    private final Map<String, Integer> order;

    private FlowGraph(Map<String, FlowNode> nodes, List<FlowEdge> edges, List<FlowchartEdge> droppedEdges) {
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.edges = List.copyOf(edges);
        this.droppedEdges = Collections.unmodifiableList(new ArrayList<>(droppedEdges));

        Map<String, List<FlowEdge>> out = new HashMap<>();
        Map<String, List<FlowEdge>> in = new HashMap<>();
        for (FlowEdge edge : this.edges) {
            out.computeIfAbsent(edge.sourceId(), k -> new ArrayList<>()).add(edge);
            in.computeIfAbsent(edge.targetId(), k -> new ArrayList<>()).add(edge);
        }
        this.outgoing = deepCopyListMap(out);
        this.incoming = deepCopyListMap(in);

        Map<String, Integer> index = new HashMap<>();
        for (String id : this.nodes.keySet()) {
            index.put(id, index.size());
        }
        this.order = Map.copyOf(index);
    }

    private static <K, V> Map<K, List<V>> deepCopyListMap(Map<K, List<V>> original) {
        return original.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(
                        Map.Entry::getKey,
                        e -> List.copyOf(e.getValue())
                ));
    }

    /**
     * Returns the node with the given id, or empty if not present.
     */
    public Optional<FlowNode> getNode(String id) {
        return Optional.ofNullable(id != null ? nodes.get(id) : null);
    }

    public boolean hasNode(String id) {
        return id != null && nodes.containsKey(id);
    }

    /**
     * Returns all nodes in input order.
     */
    public Collection<FlowNode> allNodes() {
        return nodes.values();
    }

    /**
     * Returns all node ids in input order.
     */
    public Set<String> nodeIds() {
        return nodes.keySet();
    }

    /**
     * Returns nodes of the given canonical type, in input order.
     */
    public List<FlowNode> nodesOfType(NodeType type) {
        return nodes.values().stream()
                .filter(n -> n.type() == type)
                .toList();
    }

    /**
     * Returns the ids of nodes of the given canonical type, in input order.
     */
    public List<String> nodeIdsOfType(NodeType type) {
        return nodes.values().stream()
                .filter(n -> n.type() == type)
                .map(FlowNode::id)
                .toList();
    }

    /**
     * Returns the canonical type of a node, or empty for unknown ids.
     */
    public Optional<NodeType> typeOf(String id) {
        return getNode(id).map(FlowNode::type);
    }

    public boolean isOfType(String id, NodeType type) {
        FlowNode node = id != null ? nodes.get(id) : null;
        return node != null && node.type() == type;
    }

    /**
     * Returns all valid edges in input order.
     */
    public List<FlowEdge> allEdges() {
        return edges;
    }

    /**
     * Returns edges that were dropped because an endpoint was missing or unknown.
     */
    public List<FlowchartEdge> droppedEdges() {
        return droppedEdges;
    }

    public List<FlowEdge> outgoingEdges(String id) {
        return outgoing.getOrDefault(id, List.of());
    }

    public List<FlowEdge> incomingEdges(String id) {
        return incoming.getOrDefault(id, List.of());
    }

    /**
     * Returns distinct direct successors in edge order.
     */
    public List<String> successors(String id) {
        Set<String> result = new LinkedHashSet<>();
        for (FlowEdge edge : outgoingEdges(id)) {
            result.add(edge.targetId());
        }
        return List.copyOf(result);
    }

    /**
     * Returns distinct direct predecessors in edge order.
     */
    public List<String> predecessors(String id) {
        Set<String> result = new LinkedHashSet<>();
        for (FlowEdge edge : incomingEdges(id)) {
            result.add(edge.sourceId());
        }
        return List.copyOf(result);
    }

    /**
     * Number of outgoing edges, parallel edges included.
     */
    public int outDegree(String id) {
        return outgoingEdges(id).size();
    }

    /**
     * Number of incoming edges, parallel edges included.
     */
    public int inDegree(String id) {
        return incomingEdges(id).size();
    }

    /**
     * Position of the node in input order, or -1 for unknown ids.
     */
    public int indexOf(String id) {
        Integer index = id != null ? order.get(id) : null;
        return index != null ? index : -1;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, FlowNode> nodes = new LinkedHashMap<>();
        private final List<FlowEdge> edges = new ArrayList<>();
        private final List<FlowchartEdge> droppedEdges = new ArrayList<>();

        /**
         * Adds a node. Returns false (and keeps the existing node) if the id is already taken.
         */
        public boolean addNode(FlowNode node) {
            return nodes.putIfAbsent(node.id(), node) == null;
        }

        public boolean hasNode(String id) {
            return id != null && nodes.containsKey(id);
        }

        /**
         * Adds an edge between two nodes that were already added.
         *
         * @throws IllegalArgumentException if an endpoint is unknown
         */
        public Builder addEdge(FlowEdge edge) {
            if (!hasNode(edge.sourceId()) || !hasNode(edge.targetId())) {
                throw new IllegalArgumentException("Edge " + edge.id() + " references an unknown node: "
                        + edge.sourceId() + " -> " + edge.targetId());
            }
            edges.add(edge);
            return this;
        }

        /**
         * Convenience for tests and generated graphs: adds an unnamed edge.
         */
        public Builder addEdge(String sourceId, String targetId) {
            return addEdge(new FlowEdge(null, sourceId, targetId, null));
        }

        /**
         * Records an edge that could not be added.
         */
        public Builder addDroppedEdge(FlowchartEdge edge) {
            droppedEdges.add(edge);
            return this;
        }

        public FlowGraph build() {
            return new FlowGraph(nodes, edges, droppedEdges);
        }
    }
}
