package vn.com.fecredit.flowable.layout.engine;

import vn.com.fecredit.flowable.layout.model.GatewayType;

/**
 * Final placement of one task or gateway. {@code (x, y)} is the top-left corner.
 */
public final class NodeLayout {
    private final String id;
    private final NodeKind kind;
    private final String label;
    private final String laneOwner;
    private final GatewayType gatewayType;
    private final int laneIndex;
    private final int rankIndex;
    private final int orderInRank;
    private final double x;
    private final double y;
    private final double width;
    private final double height;

    public NodeLayout(String id, NodeKind kind, String label, String laneOwner, GatewayType gatewayType,
                      int laneIndex, int rankIndex, int orderInRank,
                      double x, double y, double width, double height) {
        this.id = id;
        this.kind = kind;
        this.label = label;
        this.laneOwner = laneOwner;
        this.gatewayType = gatewayType;
        this.laneIndex = laneIndex;
        this.rankIndex = rankIndex;
        this.orderInRank = orderInRank;
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public String getId() { return id; }
    public NodeKind getKind() { return kind; }
    public String getLabel() { return label; }
    public String getLaneOwner() { return laneOwner; }
    /** Only set for gateways. */
    public GatewayType getGatewayType() { return gatewayType; }
    public int getLaneIndex() { return laneIndex; }
    public int getRankIndex() { return rankIndex; }
    public int getOrderInRank() { return orderInRank; }
    public double getX() { return x; }
    public double getY() { return y; }
    public double getWidth() { return width; }
    public double getHeight() { return height; }

    public double centerX() { return x + width / 2d; }
    public double centerY() { return y + height / 2d; }

    public Waypoint leftMid() { return new Waypoint(x, centerY()); }
    public Waypoint rightMid() { return new Waypoint(x + width, centerY()); }

    @Override
    public String toString() {
        return "NodeLayout{" + id + " " + kind + " lane=" + laneIndex + " rank=" + rankIndex
                + " [" + x + "," + y + " " + width + "x" + height + "]}";
    }
}
