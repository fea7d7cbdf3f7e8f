package vn.com.fecredit.flowable.layout.engine;

/**
 * Horizontal swimlane band for one participant. {@code x}/{@code width} span the
 * whole canvas between the horizontal margins.
 */
public final class LaneLayout {
    private final int index;
    private final String participantId;
    private final String label;
    private final double x;
    private final double y;
    private final double width;
    private final double height;

    public LaneLayout(int index, String participantId, String label, double x, double y, double width, double height) {
        this.index = index;
        this.participantId = participantId;
        this.label = label;
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public int getIndex() { return index; }
    public String getParticipantId() { return participantId; }
    public String getLabel() { return label; }
    public double getX() { return x; }
    public double getY() { return y; }
    public double getWidth() { return width; }
    public double getHeight() { return height; }

    @Override
    public String toString() {
        return "LaneLayout{" + index + " " + participantId + " y=" + y + " h=" + height + "}";
    }
}
