package com.flowcanvas.core.graph;

import com.flowcanvas.core.model.NodeId;
import com.flowcanvas.core.model.Workflow;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Computes the step order consumed by the execution subsystem.
 *
 * Kahn's algorithm driven by a stack: the initial ready set is sorted by node name and the
 * last entry is taken first; nodes that become ready are pushed on top and run next, so a
 * branch is followed to its end before a sibling starts. Nodes on a cycle are never scheduled.
 */
public final class ExecutionPlanner {

    private ExecutionPlanner() {
    }

    public static List<NodeId> plan(Workflow workflow) {
        GraphIndex graph = GraphIndex.of(workflow);
        int[] remaining = graph.inDegrees();

        List<Integer> available = new ArrayList<>();
        for (int i = 0; i < remaining.length; i++) {
            if (remaining[i] == 0) {
                available.add(i);
            }
        }
        available.sort(Comparator.comparing(
            (Integer index) -> workflow.nodes().get(index).name(),
            Comparator.nullsFirst(Comparator.naturalOrder())
        ));

        List<NodeId> queue = new ArrayList<>(graph.size());
        while (!available.isEmpty()) {
            int current = available.remove(available.size() - 1);
            queue.add(graph.idAt(current));
            for (int next : graph.outgoing(current)) {
                if (--remaining[next] == 0) {
                    available.add(next);
                }
            }
        }
        return queue;
    }
}
