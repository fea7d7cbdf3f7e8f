package vn.com.fecredit.flowable.layout.engine;

import java.util.Arrays;
import java.util.List;

/**
 * Straight line between neighbours in the same lane (rank distance at most 1),
 * otherwise an orthogonal dog-leg bending at the horizontal midpoint.
 */
public class AdjacentSameLaneRoutingPolicy implements RoutingPolicy {

    @Override
    public List<Waypoint> route(NodeLayout source, NodeLayout target) {
        Waypoint start = source.rightMid();
        Waypoint end = target.leftMid();
        boolean sameLane = source.getLaneIndex() == target.getLaneIndex();
        if (sameLane && Math.abs(source.getRankIndex() - target.getRankIndex()) <= 1) {
            return Arrays.asList(start, end);
        }
        double midX = (start.getX() + end.getX()) / 2d;
        return Arrays.asList(start,
                new Waypoint(midX, start.getY()),
                new Waypoint(midX, end.getY()),
                end);
    }
}
