package vn.com.fecredit.flowable.layout.engine;

import vn.com.fecredit.flowable.layout.model.FlowDocument;

import java.util.Comparator;
import java.util.List;

/**
 * Orders the members of each rank by lane, then by id, and numbers them. Also labels
 * each rank with the phase of its first task that names a declared phase.
 */
final class RankOrderer {

    static final Comparator<LayoutNode> LANE_THEN_ID =
            Comparator.<LayoutNode>comparingInt(n -> n.laneIndex).thenComparing(n -> n.id);

    void order(List<LayoutRank> ranks, FlowDocument doc) {
        for (LayoutRank rank : ranks) {
            rank.members.sort(LANE_THEN_ID);
            for (int i = 0; i < rank.members.size(); i++) {
                rank.members.get(i).orderInRank = i;
            }
            rank.phaseId = null;
            for (LayoutNode m : rank.members) {
                if (m.kind == NodeKind.TASK && doc.findPhase(m.rankHint) != null) {
                    rank.phaseId = m.rankHint;
                    break;
                }
            }
        }
    }
}
