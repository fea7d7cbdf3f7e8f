package vn.com.fecredit.flowable.layout.engine;

import java.util.ArrayList;
import java.util.List;

final class LayoutRank {
    final int index;
    /** Members in {@code orderInRank} order once {@link RankOrderer} ran. */
    final List<LayoutNode> members = new ArrayList<>();
    String phaseId;
    double x;
    double width;

    LayoutRank(int index) {
        this.index = index;
    }
}
