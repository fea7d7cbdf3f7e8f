package vn.com.fecredit.flowable.layout.engine;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns rank and lane bands into cumulative offsets, then places every node.
 * Nodes sharing a (rank, lane) cell are stacked in {@code orderInRank} order and the
 * stack is centered in the lane; horizontally each node is centered in its rank.
 */
final class CoordinateAssigner {

    private final LayoutSettings settings;

    CoordinateAssigner(LayoutSettings settings) {
        this.settings = settings;
    }

    void place(List<LayoutRank> ranks, List<LayoutLane> lanes) {
        double x = settings.getMarginX() + settings.getLaneHeaderWidth();
        for (LayoutRank rank : ranks) {
            rank.x = x;
            x += rank.width + settings.getRankSpacing();
        }
        double y = settings.getMarginY();
        for (LayoutLane lane : lanes) {
            lane.y = y;
            y += lane.height;
        }

        for (LayoutRank rank : ranks) {
            for (LayoutLane lane : lanes) {
                List<LayoutNode> cell = cell(rank, lane.index);
                if (cell.isEmpty()) continue;
                double stack = settings.getNodeSpacing() * (cell.size() - 1);
                for (LayoutNode n : cell) stack += n.height;
                double cursor = lane.y + (lane.height - stack) / 2d;
                for (LayoutNode n : cell) {
                    n.x = rank.x + (rank.width - n.width) / 2d;
                    n.y = cursor;
                    cursor += n.height + settings.getNodeSpacing();
                }
            }
        }
    }

    // members are already sorted by lane then id, so the cell keeps orderInRank order
    private static List<LayoutNode> cell(LayoutRank rank, int laneIndex) {
        List<LayoutNode> out = new ArrayList<>();
        for (LayoutNode m : rank.members) {
            if (m.laneIndex == laneIndex) out.add(m);
        }
        return out;
    }
}
