package vn.com.fecredit.flowable.layout.engine;

import java.util.List;

/**
 * Chooses the waypoints of one connector once both endpoints are placed.
 * Implementations must start at {@code source.rightMid()}, end at {@code target.leftMid()}
 * and return at least two points.
 */
public interface RoutingPolicy {

    List<Waypoint> route(NodeLayout source, NodeLayout target);
}
