package vn.com.fecredit.flowable.layout.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only output of one layout run: node placements keyed by id (in node table order),
 * lane and rank bands, routed edges and the canvas size.
 */
public final class LayoutResult {
    private final Map<String, NodeLayout> nodes;
    private final List<LaneLayout> lanes;
    private final List<RankLayout> ranks;
    private final List<EdgeLayout> edges;
    private final double width;
    private final double height;

    public LayoutResult(Map<String, NodeLayout> nodes, List<LaneLayout> lanes, List<RankLayout> ranks,
                        List<EdgeLayout> edges, double width, double height) {
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.lanes = Collections.unmodifiableList(new ArrayList<>(lanes));
        this.ranks = Collections.unmodifiableList(new ArrayList<>(ranks));
        this.edges = Collections.unmodifiableList(new ArrayList<>(edges));
        this.width = width;
        this.height = height;
    }

    public Map<String, NodeLayout> getNodes() { return nodes; }
    public List<LaneLayout> getLanes() { return lanes; }
    public List<RankLayout> getRanks() { return ranks; }
    public List<EdgeLayout> getEdges() { return edges; }
    public double getWidth() { return width; }
    public double getHeight() { return height; }

    public NodeLayout node(String id) {
        return nodes.get(id);
    }
}
