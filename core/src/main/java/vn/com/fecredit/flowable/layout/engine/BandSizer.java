package vn.com.fecredit.flowable.layout.engine;

import java.util.List;

/**
 * Rank widths and lane heights as pure functions of node population.
 *
 * <pre>
 * rank.width  = max(width of every node in the rank)
 * lane.height = max(laneMinHeight, maxH * count + nodeSpacing * (count - 1) + 2 * lanePadding)
 * </pre>
 */
final class BandSizer {

    private final LayoutSettings settings;

    BandSizer(LayoutSettings settings) {
        this.settings = settings;
    }

    void sizeRanks(List<LayoutRank> ranks) {
        for (LayoutRank rank : ranks) {
            double w = 0;
            for (LayoutNode m : rank.members) w = Math.max(w, m.width);
            rank.width = w;
        }
    }

    void sizeLanes(List<LayoutLane> lanes, NodeTable table) {
        for (LayoutLane lane : lanes) lane.maxNodeHeight = 0;
        for (LayoutNode n : table.nodes()) {
            LayoutLane lane = lanes.get(n.laneIndex);
            lane.maxNodeHeight = Math.max(lane.maxNodeHeight, n.height);
        }
        for (LayoutLane lane : lanes) {
            lane.height = laneHeight(lane.nodeCount, lane.maxNodeHeight);
        }
    }

    double laneHeight(int nodeCount, double maxNodeHeight) {
        if (nodeCount <= 0) return settings.getLaneMinHeight();
        double needed = maxNodeHeight * nodeCount
                + settings.getNodeSpacing() * (nodeCount - 1)
                + 2 * settings.getLanePadding();
        return Math.max(settings.getLaneMinHeight(), needed);
    }
}
