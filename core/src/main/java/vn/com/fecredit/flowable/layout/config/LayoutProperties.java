package vn.com.fecredit.flowable.layout.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import vn.com.fecredit.flowable.layout.engine.LayoutSettings;

/**
 * {@code flow.layout.*} overrides for the engine constants. Unset keys keep the
 * values of {@link LayoutSettings#defaults()}.
 */
@ConfigurationProperties(prefix = "flow.layout")
public class LayoutProperties {

    private static final LayoutSettings DEFAULTS = LayoutSettings.defaults();

    private double marginX = DEFAULTS.getMarginX();
    private double marginY = DEFAULTS.getMarginY();
    private double laneHeaderWidth = DEFAULTS.getLaneHeaderWidth();
    private double taskBaseWidth = DEFAULTS.getTaskBaseWidth();
    private double taskMaxWidth = DEFAULTS.getTaskMaxWidth();
    private double taskWidthOffset = DEFAULTS.getTaskWidthOffset();
    private double perCharWidth = DEFAULTS.getPerCharWidth();
    private double taskHeight = DEFAULTS.getTaskHeight();
    private double gatewaySize = DEFAULTS.getGatewaySize();
    private double rankSpacing = DEFAULTS.getRankSpacing();
    private double nodeSpacing = DEFAULTS.getNodeSpacing();
    private double lanePadding = DEFAULTS.getLanePadding();
    private double laneMinHeight = DEFAULTS.getLaneMinHeight();

    public LayoutSettings toSettings() {
        return new LayoutSettings(marginX, marginY, laneHeaderWidth, taskBaseWidth, taskMaxWidth, taskWidthOffset,
                perCharWidth, taskHeight, gatewaySize, rankSpacing, nodeSpacing, lanePadding, laneMinHeight);
    }

    public double getMarginX() { return marginX; }
    public void setMarginX(double marginX) { this.marginX = marginX; }
    public double getMarginY() { return marginY; }
    public void setMarginY(double marginY) { this.marginY = marginY; }
    public double getLaneHeaderWidth() { return laneHeaderWidth; }
    public void setLaneHeaderWidth(double laneHeaderWidth) { this.laneHeaderWidth = laneHeaderWidth; }
    public double getTaskBaseWidth() { return taskBaseWidth; }
    public void setTaskBaseWidth(double taskBaseWidth) { this.taskBaseWidth = taskBaseWidth; }
    public double getTaskMaxWidth() { return taskMaxWidth; }
    public void setTaskMaxWidth(double taskMaxWidth) { this.taskMaxWidth = taskMaxWidth; }
    public double getTaskWidthOffset() { return taskWidthOffset; }
    public void setTaskWidthOffset(double taskWidthOffset) { this.taskWidthOffset = taskWidthOffset; }
    public double getPerCharWidth() { return perCharWidth; }
    public void setPerCharWidth(double perCharWidth) { this.perCharWidth = perCharWidth; }
    public double getTaskHeight() { return taskHeight; }
    public void setTaskHeight(double taskHeight) { this.taskHeight = taskHeight; }
    public double getGatewaySize() { return gatewaySize; }
    public void setGatewaySize(double gatewaySize) { this.gatewaySize = gatewaySize; }
    public double getRankSpacing() { return rankSpacing; }
    public void setRankSpacing(double rankSpacing) { this.rankSpacing = rankSpacing; }
    public double getNodeSpacing() { return nodeSpacing; }
    public void setNodeSpacing(double nodeSpacing) { this.nodeSpacing = nodeSpacing; }
    public double getLanePadding() { return lanePadding; }
    public void setLanePadding(double lanePadding) { this.lanePadding = lanePadding; }
    public double getLaneMinHeight() { return laneMinHeight; }
    public void setLaneMinHeight(double laneMinHeight) { this.laneMinHeight = laneMinHeight; }
}
