package vn.com.fecredit.flowable.layout.engine;

import vn.com.fecredit.flowable.layout.model.GatewayType;

/**
 * Working record for one task or gateway while the pipeline runs. Each stage fills in
 * its own fields; the finished values are copied into an immutable {@link NodeLayout}.
 */
final class LayoutNode {
    final int index;
    final String id;
    final NodeKind kind;
    final String label;
    /** Participant id; empty for gateways until lane inference. */
    final String laneOwner;
    final String rankHint;
    final GatewayType gatewayType;

    int laneIndex = -1;
    int rankIndex = -1;
    int orderInRank = -1;

    double width;
    double height;
    double x;
    double y;

    LayoutNode(int index, String id, NodeKind kind, String label, String laneOwner, String rankHint, GatewayType gatewayType) {
        this.index = index;
        this.id = id;
        this.kind = kind;
        this.label = label == null ? "" : label;
        this.laneOwner = laneOwner == null ? "" : laneOwner;
        this.rankHint = rankHint;
        this.gatewayType = gatewayType;
    }

    double rightMidX() { return x + width; }
    double midY() { return y + height / 2d; }

    NodeLayout freeze() {
        return new NodeLayout(id, kind, label, laneOwner, gatewayType, laneIndex, rankIndex, orderInRank, x, y, width, height);
    }

    @Override
    public String toString() {
        return "LayoutNode{" + id + ", " + kind + ", lane=" + laneIndex + ", rank=" + rankIndex + ", order=" + orderInRank + "}";
    }
}
