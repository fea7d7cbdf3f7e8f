package vn.com.fecredit.flowable.layout.engine;

/**
 * Immutable set of sizing constants used by every layout stage.
 *
 * <p>Values are in diagram units (pixels for SVG/PNG, DI units for BPMN).
 * Use {@link #defaults()} and {@link #with(String, double)} to derive variants.</p>
 */
public final class LayoutSettings {

    private final double marginX;
    private final double marginY;
    private final double laneHeaderWidth;
    private final double taskBaseWidth;
    private final double taskMaxWidth;
    private final double taskWidthOffset;
    private final double perCharWidth;
    private final double taskHeight;
    private final double gatewaySize;
    private final double rankSpacing;
    private final double nodeSpacing;
    private final double lanePadding;
    private final double laneMinHeight;

    public LayoutSettings(double marginX, double marginY, double laneHeaderWidth,
                          double taskBaseWidth, double taskMaxWidth, double taskWidthOffset,
                          double perCharWidth, double taskHeight, double gatewaySize,
                          double rankSpacing, double nodeSpacing, double lanePadding,
                          double laneMinHeight) {
        requireNonNegative("marginX", marginX);
        requireNonNegative("marginY", marginY);
        requireNonNegative("laneHeaderWidth", laneHeaderWidth);
        requirePositive("taskBaseWidth", taskBaseWidth);
        requirePositive("taskHeight", taskHeight);
        requirePositive("gatewaySize", gatewaySize);
        requirePositive("laneMinHeight", laneMinHeight);
        requireNonNegative("taskWidthOffset", taskWidthOffset);
        requireNonNegative("perCharWidth", perCharWidth);
        requireNonNegative("rankSpacing", rankSpacing);
        requireNonNegative("nodeSpacing", nodeSpacing);
        requireNonNegative("lanePadding", lanePadding);
        if (taskMaxWidth < taskBaseWidth) {
            throw new IllegalArgumentException("taskMaxWidth (" + taskMaxWidth + ") must be >= taskBaseWidth (" + taskBaseWidth + ")");
        }
        this.marginX = marginX;
        this.marginY = marginY;
        this.laneHeaderWidth = laneHeaderWidth;
        this.taskBaseWidth = taskBaseWidth;
        this.taskMaxWidth = taskMaxWidth;
        this.taskWidthOffset = taskWidthOffset;
        this.perCharWidth = perCharWidth;
        this.taskHeight = taskHeight;
        this.gatewaySize = gatewaySize;
        this.rankSpacing = rankSpacing;
        this.nodeSpacing = nodeSpacing;
        this.lanePadding = lanePadding;
        this.laneMinHeight = laneMinHeight;
    }

    public static LayoutSettings defaults() {
        return new LayoutSettings(50, 50, 180, 120, 300, 80, 12, 80, 60, 80, 20, 20, 150);
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0)) throw new IllegalArgumentException(name + " must be > 0 but was " + value);
    }

    private static void requireNonNegative(String name, double value) {
        if (!(value >= 0)) throw new IllegalArgumentException(name + " must be >= 0 but was " + value);
    }

    public double getMarginX() { return marginX; }
    public double getMarginY() { return marginY; }
    public double getLaneHeaderWidth() { return laneHeaderWidth; }
    public double getTaskBaseWidth() { return taskBaseWidth; }
    public double getTaskMaxWidth() { return taskMaxWidth; }
    public double getTaskWidthOffset() { return taskWidthOffset; }
    public double getPerCharWidth() { return perCharWidth; }
    public double getTaskHeight() { return taskHeight; }
    public double getGatewaySize() { return gatewaySize; }
    public double getRankSpacing() { return rankSpacing; }
    public double getNodeSpacing() { return nodeSpacing; }
    public double getLanePadding() { return lanePadding; }
    public double getLaneMinHeight() { return laneMinHeight; }

    /**
     * Copy with one named value replaced. Names match the {@code flow.layout.*}
     * property keys (camelCase or kebab-case).
     */
    public LayoutSettings with(String key, double value) {
        double[] v = {marginX, marginY, laneHeaderWidth, taskBaseWidth, taskMaxWidth, taskWidthOffset,
                perCharWidth, taskHeight, gatewaySize, rankSpacing, nodeSpacing, lanePadding, laneMinHeight};
        String k = key == null ? "" : key.replace("-", "").toLowerCase(java.util.Locale.ROOT);
        switch (k) {
            case "marginx": v[0] = value; break;
            case "marginy": v[1] = value; break;
            case "laneheaderwidth": v[2] = value; break;
            case "taskbasewidth": v[3] = value; break;
            case "taskmaxwidth": v[4] = value; break;
            case "taskwidthoffset": v[5] = value; break;
            case "percharwidth": v[6] = value; break;
            case "taskheight": v[7] = value; break;
            case "gatewaysize": v[8] = value; break;
            case "rankspacing": v[9] = value; break;
            case "nodespacing": v[10] = value; break;
            case "lanepadding": v[11] = value; break;
            case "laneminheight": v[12] = value; break;
            default:
                throw new IllegalArgumentException("Unknown layout setting: " + key);
        }
        return new LayoutSettings(v[0], v[1], v[2], v[3], v[4], v[5], v[6], v[7], v[8], v[9], v[10], v[11], v[12]);
    }

    @Override
    public String toString() {
        return "LayoutSettings{marginX=" + marginX + ", marginY=" + marginY + ", laneHeaderWidth=" + laneHeaderWidth
                + ", taskBaseWidth=" + taskBaseWidth + ", taskMaxWidth=" + taskMaxWidth + ", taskWidthOffset=" + taskWidthOffset
                + ", perCharWidth=" + perCharWidth + ", taskHeight=" + taskHeight
                + ", gatewaySize=" + gatewaySize + ", rankSpacing=" + rankSpacing + ", nodeSpacing=" + nodeSpacing
                + ", lanePadding=" + lanePadding + ", laneMinHeight=" + laneMinHeight + "}";
    }
}
