package vn.com.fecredit.flowable.layout.engine;

/** Vertical column of the execution-order axis. */
public final class RankLayout {
    private final int index;
    private final String phaseId;
    private final double x;
    private final double width;

    public RankLayout(int index, String phaseId, double x, double width) {
        this.index = index;
        this.phaseId = phaseId;
        this.x = x;
        this.width = width;
    }

    public int getIndex() { return index; }
    /** Phase named by the first task of the column, or {@code null}. */
    public String getPhaseId() { return phaseId; }
    public double getX() { return x; }
    public double getWidth() { return width; }

    @Override
    public String toString() {
        return "RankLayout{" + index + " phase=" + phaseId + " x=" + x + " w=" + width + "}";
    }
}
