package com.flowcanvas.core.graph;

import com.flowcanvas.core.model.Workflow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import static com.flowcanvas.core.geometry.CanvasMath.NODE_HEIGHT;
import static com.flowcanvas.core.geometry.CanvasMath.NODE_WIDTH;

/**
 * Layered (Sugiyama-style) auto-layout for acyclic workflows.
 *
 * Steps:
 * 1. topological sort (aborts on a cycle, positions untouched)
 * 2. longest-path layering: layer(v) = max(layer(parent) + 1), 0 for roots
 * 3. {@value #SWEEPS} barycenter sweeps over layers 1..N, ties broken by insertion order
 * 4. x placement biased under parents, never overlapping the previous sibling
 * 5. each layer centred against the widest layer
 * 6. translation so the top-left node sits at ({@value #LEFT_PADDING}, {@value #TOP_PADDING})
 *
 * Only node positions are written. The result depends on topology and insertion order alone,
 * so applying the layout twice yields the same positions.
 */
public class DagLayout {

    private static final Logger log = LoggerFactory.getLogger(DagLayout.class);

    public static final double DEFAULT_LAYER_SPACING = 140.0;
    public static final double DEFAULT_NODE_SPACING = 60.0;

    public static final double LEFT_PADDING = 120.0;
    public static final double TOP_PADDING = 80.0;

    static final int SWEEPS = 4;

    private final double layerSpacing;
    private final double nodeSpacing;

    public DagLayout(double layerSpacing, double nodeSpacing) {
        if (!Double.isFinite(layerSpacing) || layerSpacing < 0.0) {
            throw new IllegalArgumentException("layerSpacing must be a finite value >= 0");
        }
        if (!Double.isFinite(nodeSpacing) || nodeSpacing < 0.0) {
            throw new IllegalArgumentException("nodeSpacing must be a finite value >= 0");
        }
        this.layerSpacing = layerSpacing;
        this.nodeSpacing = nodeSpacing;
    }

    /**
     * Layout with the editor's default spacing (140 between layers, 60 between siblings).
     */
    public static DagLayout defaults() {
        return new DagLayout(DEFAULT_LAYER_SPACING, DEFAULT_NODE_SPACING);
    }

    public double layerSpacing() {
        return layerSpacing;
    }

    public double nodeSpacing() {
        return nodeSpacing;
    }

    /**
     * Compute and write new node positions.
     *
     * @return {@link LayoutOutcome#APPLIED}, or the reason nothing was moved
     */
    public LayoutOutcome apply(Workflow workflow) {
        if (workflow.nodes().isEmpty()) {
            return LayoutOutcome.SKIPPED_EMPTY;
        }

        GraphIndex graph = GraphIndex.of(workflow);
        Optional<int[]> sorted = graph.topologicalOrder();
        if (sorted.isEmpty()) {
            log.warn("Skipping auto-layout: connection graph of {} nodes contains a cycle", graph.size());
            return LayoutOutcome.SKIPPED_CYCLIC;
        }

        int[] layerOf = assignLayers(graph, sorted.get());
        List<List<Integer>> layers = groupByLayer(sorted.get(), layerOf);
        minimizeCrossings(graph, layers);

        double[] xs = new double[graph.size()];
        double[] ys = new double[graph.size()];
        assignCoordinates(graph, layers, xs, ys);
        normalize(xs, ys);

        for (int i = 0; i < graph.size(); i++) {
            workflow.placeNode(graph.idAt(i), xs[i], ys[i]);
        }

        log.debug("Laid out {} nodes in {} layers", graph.size(), layers.size());
        return LayoutOutcome.APPLIED;
    }

    private static int[] assignLayers(GraphIndex graph, int[] sorted) {
        int[] layerOf = new int[graph.size()];
        for (int vertex : sorted) {
            int layer = 0;
            for (int parent : graph.incoming(vertex)) {
                layer = Math.max(layer, layerOf[parent] + 1);
            }
            layerOf[vertex] = layer;
        }
        return layerOf;
    }

    private static List<List<Integer>> groupByLayer(int[] sorted, int[] layerOf) {
        List<List<Integer>> layers = new ArrayList<>();
        for (int vertex : sorted) {
            int layer = layerOf[vertex];
            while (layers.size() <= layer) {
                layers.add(new ArrayList<>());
            }
            layers.get(layer).add(vertex);
        }
        return layers;
    }

    /**
     * Barycenter heuristic. Layer 0 keeps its topological order.
     * Parents outside the previous layer do not contribute; no parents means barycenter 0.
     */
    private static void minimizeCrossings(GraphIndex graph, List<List<Integer>> layers) {
        for (int sweep = 0; sweep < SWEEPS; sweep++) {
            for (int layer = 1; layer < layers.size(); layer++) {
                List<Integer> previous = layers.get(layer - 1);
                double[] barycenter = new double[graph.size()];

                for (int vertex : layers.get(layer)) {
                    double sum = 0.0;
                    int count = 0;
                    for (int parent : graph.incoming(vertex)) {
                        int position = previous.indexOf(parent);
                        if (position >= 0) {
                            sum += position;
                            count++;
                        }
                    }
                    barycenter[vertex] = count > 0 ? sum / count : 0.0;
                }

                List<Integer> reordered = new ArrayList<>(layers.get(layer));
                reordered.sort(Comparator
                    .comparingDouble((Integer vertex) -> barycenter[vertex])
                    .thenComparingInt(vertex -> vertex));
                layers.set(layer, reordered);
            }
        }
    }

    private void assignCoordinates(GraphIndex graph, List<List<Integer>> layers, double[] xs, double[] ys) {
        boolean[] placed = new boolean[graph.size()];
        double[] layerWidths = new double[layers.size()];
        double maxLayerWidth = 0.0;

        for (int layer = 0; layer < layers.size(); layer++) {
            List<Integer> vertices = layers.get(layer);
            double y = layer * (NODE_HEIGHT + layerSpacing);
            Double previousX = null;

            for (int vertex : vertices) {
                double sum = 0.0;
                int count = 0;
                for (int parent : graph.incoming(vertex)) {
                    if (placed[parent]) {
                        sum += xs[parent];
                        count++;
                    }
                }
                double preferredX = count > 0 ? sum / count : 0.0;

                double x = previousX == null
                    ? preferredX
                    : Math.max(preferredX, previousX + NODE_WIDTH + nodeSpacing);
                xs[vertex] = x;
                ys[vertex] = y;
                placed[vertex] = true;
                previousX = x;
            }

            if (!vertices.isEmpty()) {
                double first = xs[vertices.get(0)];
                double last = xs[vertices.get(vertices.size() - 1)];
                layerWidths[layer] = Math.max(last - first + NODE_WIDTH, 0.0);
                maxLayerWidth = Math.max(maxLayerWidth, layerWidths[layer]);
            }
        }

        for (int layer = 0; layer < layers.size(); layer++) {
            double offset = (maxLayerWidth - layerWidths[layer]) / 2.0;
            for (int vertex : layers.get(layer)) {
                xs[vertex] += offset;
            }
        }
    }

    private static void normalize(double[] xs, double[] ys) {
        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        for (int i = 0; i < xs.length; i++) {
            minX = Math.min(minX, xs[i]);
            minY = Math.min(minY, ys[i]);
        }
        for (int i = 0; i < xs.length; i++) {
            xs[i] = xs[i] - minX + LEFT_PADDING;
            ys[i] = ys[i] - minY + TOP_PADDING;
        }
    }
}
