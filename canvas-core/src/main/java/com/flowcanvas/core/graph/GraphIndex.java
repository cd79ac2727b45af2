package com.flowcanvas.core.graph;

import com.flowcanvas.core.model.Connection;
import com.flowcanvas.core.model.Node;
import com.flowcanvas.core.model.NodeId;
import com.flowcanvas.core.model.Workflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * Transient adjacency view of a workflow, addressed by dense integer indices.
 * Index i is the i-th node in workflow insertion order, which doubles as the stable tie-break key.
 * Built per use and never stored on the model.
 *
 * Parallel connections (same endpoints, different ports) yield parallel edges.
 * Connections with an endpoint outside the workflow are ignored.
 */
final class GraphIndex {

    private final List<NodeId> ids;
    private final List<List<Integer>> incoming;
    private final List<List<Integer>> outgoing;

    private GraphIndex(List<NodeId> ids, List<List<Integer>> incoming, List<List<Integer>> outgoing) {
        this.ids = ids;
        this.incoming = incoming;
        this.outgoing = outgoing;
    }

    static GraphIndex of(Workflow workflow) {
        List<Node> nodes = workflow.nodes();
        List<NodeId> ids = new ArrayList<>(nodes.size());
        Map<NodeId, Integer> indexById = new HashMap<>();
        List<List<Integer>> incoming = new ArrayList<>(nodes.size());
        List<List<Integer>> outgoing = new ArrayList<>(nodes.size());

        for (Node node : nodes) {
            indexById.put(node.id(), ids.size());
            ids.add(node.id());
            incoming.add(new ArrayList<>());
            outgoing.add(new ArrayList<>());
        }

        for (Connection connection : workflow.connections()) {
            Integer source = indexById.get(connection.source());
            Integer target = indexById.get(connection.target());
            if (source != null && target != null) {
                outgoing.get(source).add(target);
                incoming.get(target).add(source);
            }
        }

        return new GraphIndex(ids, incoming, outgoing);
    }

    int size() {
        return ids.size();
    }

    NodeId idAt(int index) {
        return ids.get(index);
    }

    List<Integer> incoming(int index) {
        return Collections.unmodifiableList(incoming.get(index));
    }

    List<Integer> outgoing(int index) {
        return Collections.unmodifiableList(outgoing.get(index));
    }

    int[] inDegrees() {
        int[] degrees = new int[size()];
        for (int i = 0; i < degrees.length; i++) {
            degrees[i] = incoming.get(i).size();
        }
        return degrees;
    }

    /**
     * Kahn's algorithm; among ready vertices the lowest insertion index goes first.
     *
     * @return the topological order, or empty if the graph has a cycle
     */
    Optional<int[]> topologicalOrder() {
        int[] remaining = inDegrees();
        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int i = 0; i < remaining.length; i++) {
            if (remaining[i] == 0) {
                ready.add(i);
            }
        }

        int[] order = new int[size()];
        int emitted = 0;
        while (!ready.isEmpty()) {
            int current = ready.poll();
            order[emitted++] = current;
            for (int next : outgoing.get(current)) {
                if (--remaining[next] == 0) {
                    ready.add(next);
                }
            }
        }

        return emitted == order.length ? Optional.of(order) : Optional.empty();
    }
}
