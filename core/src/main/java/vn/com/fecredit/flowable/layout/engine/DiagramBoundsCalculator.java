package vn.com.fecredit.flowable.layout.engine;

import java.util.List;

/** Canvas size recomputed from the final lane and rank bands. */
final class DiagramBoundsCalculator {

    private final LayoutSettings settings;

    DiagramBoundsCalculator(LayoutSettings settings) {
        this.settings = settings;
    }

    double width(List<LayoutRank> ranks) {
        double w = 2 * settings.getMarginX() + settings.getLaneHeaderWidth();
        for (LayoutRank r : ranks) w += r.width;
        if (ranks.size() > 1) w += settings.getRankSpacing() * (ranks.size() - 1);
        return w;
    }

    double height(List<LayoutLane> lanes) {
        double h = 2 * settings.getMarginY();
        for (LayoutLane l : lanes) h += l.height;
        return h;
    }
}
