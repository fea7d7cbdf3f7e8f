package vn.com.fecredit.flowable.layout.util;

import vn.com.fecredit.flowable.layout.engine.EdgeLayout;
import vn.com.fecredit.flowable.layout.engine.LaneLayout;
import vn.com.fecredit.flowable.layout.engine.LayoutResult;
import vn.com.fecredit.flowable.layout.engine.NodeKind;
import vn.com.fecredit.flowable.layout.engine.NodeLayout;
import vn.com.fecredit.flowable.layout.engine.RankLayout;
import vn.com.fecredit.flowable.layout.engine.Waypoint;
import vn.com.fecredit.flowable.layout.model.FlowDocument;

import java.math.BigDecimal;
import java.util.List;

/**
 * Standalone SVG rendition of a layout: lane bands with headers, phase captions over
 * the rank columns, tasks as rounded rectangles, gateways as diamonds and connectors
 * as polylines ending in an arrow.
 */
public final class SvgDiagramRenderer {

    private static final String[] LANE_FILLS = {"#f7f9fc", "#eef3f8"};

    private SvgDiagramRenderer() {}

    public static String render(LayoutResult layout) {
        return render(layout, null);
    }

    /**
     * @param doc optional; when present phase names replace phase ids and tasks of
     *            system actors are drawn as service tasks
     */
    public static String render(LayoutResult layout, FlowDocument doc) {
        StringBuilder sb = new StringBuilder(4096);
        String w = num(layout.getWidth());
        String h = num(layout.getHeight());
        sb.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        sb.append("<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"").append(w).append("\" height=\"").append(h)
                .append("\" viewBox=\"0 0 ").append(w).append(' ').append(h).append("\">\n");
        sb.append("  <defs>\n")
                .append("    <marker id=\"arrow\" viewBox=\"0 0 10 10\" refX=\"10\" refY=\"5\" markerWidth=\"8\" markerHeight=\"8\" orient=\"auto\">\n")
                .append("      <path d=\"M0,0 L10,5 L0,10 z\" fill=\"#444\"/>\n")
                .append("    </marker>\n")
                .append("    <style>\n")
                .append("      .bpmn-lane-title, .bpmn-label, .bpmn-phase, .bpmn-condition { font-family: Arial, sans-serif; }\n")
                .append("      .bpmn-label { font-size: 13px; }\n")
                .append("      .bpmn-condition { font-size: 11px; fill: #555; }\n")
                .append("    </style>\n")
                .append("  </defs>\n");
        sb.append("  <rect x=\"0\" y=\"0\" width=\"").append(w).append("\" height=\"").append(h).append("\" fill=\"#ffffff\"/>\n");

        double headerWidth = headerWidth(layout);
        for (LaneLayout lane : layout.getLanes()) {
            appendLane(sb, lane, headerWidth);
        }
        appendPhases(sb, layout, doc);
        for (EdgeLayout edge : layout.getEdges()) {
            appendEdge(sb, edge);
        }
        for (NodeLayout node : layout.getNodes().values()) {
            if (node.getKind() == NodeKind.GATEWAY) {
                appendGateway(sb, node);
            } else {
                appendTask(sb, node, isServiceTask(doc, node));
            }
        }
        sb.append("</svg>\n");
        return sb.toString();
    }

    private static double headerWidth(LayoutResult layout) {
        if (layout.getLanes().isEmpty()) return 0;
        LaneLayout first = layout.getLanes().get(0);
        if (layout.getRanks().isEmpty()) return first.getWidth();
        return layout.getRanks().get(0).getX() - first.getX();
    }

    private static void appendLane(StringBuilder sb, LaneLayout lane, double headerWidth) {
        String fill = LANE_FILLS[lane.getIndex() % LANE_FILLS.length];
        sb.append("  <g class=\"bpmn-lane\" id=\"lane-").append(escape(lane.getParticipantId())).append("\">\n");
        sb.append("    <rect x=\"").append(num(lane.getX())).append("\" y=\"").append(num(lane.getY()))
                .append("\" width=\"").append(num(lane.getWidth())).append("\" height=\"").append(num(lane.getHeight()))
                .append("\" fill=\"").append(fill).append("\" stroke=\"#9aa5b1\"/>\n");
        sb.append("    <rect x=\"").append(num(lane.getX())).append("\" y=\"").append(num(lane.getY()))
                .append("\" width=\"").append(num(headerWidth)).append("\" height=\"").append(num(lane.getHeight()))
                .append("\" fill=\"#dde4ec\" stroke=\"#9aa5b1\"/>\n");
        sb.append("    <text class=\"bpmn-lane-title\" x=\"").append(num(lane.getX() + headerWidth / 2d))
                .append("\" y=\"").append(num(lane.getY() + lane.getHeight() / 2d))
                .append("\" text-anchor=\"middle\" dominant-baseline=\"middle\" font-size=\"14\" font-weight=\"bold\">")
                .append(escape(lane.getLabel())).append("</text>\n");
        sb.append("  </g>\n");
    }

    private static void appendPhases(StringBuilder sb, LayoutResult layout, FlowDocument doc) {
        if (layout.getLanes().isEmpty()) return;
        double top = layout.getLanes().get(0).getY();
        double y = Math.max(12, top - 12);
        for (RankLayout rank : layout.getRanks()) {
            if (rank.getPhaseId() == null) continue;
            String label = rank.getPhaseId();
            if (doc != null) {
                FlowDocument.Phase phase = doc.findPhase(rank.getPhaseId());
                if (phase != null && phase.name != null && !phase.name.isBlank()) label = phase.name;
            }
            sb.append("  <text class=\"bpmn-phase\" x=\"").append(num(rank.getX() + rank.getWidth() / 2d))
                    .append("\" y=\"").append(num(y)).append("\" text-anchor=\"middle\" font-size=\"12\" fill=\"#52606d\">")
                    .append(escape(label)).append("</text>\n");
        }
    }

    private static void appendEdge(StringBuilder sb, EdgeLayout edge) {
        sb.append("  <polyline class=\"bpmn-flow\" id=\"").append(escape(edge.getId())).append("\" points=\"");
        List<Waypoint> points = edge.getWaypoints();
        for (int i = 0; i < points.size(); i++) {
            if (i > 0) sb.append(' ');
            sb.append(num(points.get(i).getX())).append(',').append(num(points.get(i).getY()));
        }
        sb.append("\" fill=\"none\" stroke=\"#444\" stroke-width=\"1.5\" marker-end=\"url(#arrow)\"/>\n");
        if (edge.getCondition() != null) {
            Waypoint mid = points.get(points.size() / 2);
            sb.append("  <text class=\"bpmn-condition\" x=\"").append(num(mid.getX() + 4)).append("\" y=\"")
                    .append(num(mid.getY() - 6)).append("\">").append(escape(edge.getCondition())).append("</text>\n");
        }
    }

    private static void appendTask(StringBuilder sb, NodeLayout node, boolean service) {
        sb.append("  <g class=\"").append(service ? "bpmn-service-task" : "bpmn-task").append("\" id=\"")
                .append(escape(node.getId())).append("\">\n");
        sb.append("    <rect x=\"").append(num(node.getX())).append("\" y=\"").append(num(node.getY()))
                .append("\" width=\"").append(num(node.getWidth())).append("\" height=\"").append(num(node.getHeight()))
                .append("\" rx=\"10\" ry=\"10\" fill=\"").append(service ? "#fff4e5" : "#ffffff")
                .append("\" stroke=\"#1f2933\" stroke-width=\"1.5\"/>\n");
        sb.append("    <text class=\"bpmn-label\" x=\"").append(num(node.centerX())).append("\" y=\"").append(num(node.centerY()))
                .append("\" text-anchor=\"middle\" dominant-baseline=\"middle\">").append(escape(node.getLabel())).append("</text>\n");
        sb.append("  </g>\n");
    }

    private static void appendGateway(StringBuilder sb, NodeLayout node) {
        double cx = node.centerX();
        double cy = node.centerY();
        double half = node.getWidth() / 2d;
        sb.append("  <g class=\"bpmn-gateway\" id=\"").append(escape(node.getId())).append("\">\n");
        sb.append("    <polygon points=\"")
                .append(num(cx)).append(',').append(num(cy - half)).append(' ')
                .append(num(cx + half)).append(',').append(num(cy)).append(' ')
                .append(num(cx)).append(',').append(num(cy + half)).append(' ')
                .append(num(cx - half)).append(',').append(num(cy))
                .append("\" fill=\"#fffbea\" stroke=\"#1f2933\" stroke-width=\"1.5\"/>\n");
        if (node.getGatewayType() != null) {
            sb.append("    <text x=\"").append(num(cx)).append("\" y=\"").append(num(cy))
                    .append("\" text-anchor=\"middle\" dominant-baseline=\"middle\" font-size=\"20\" font-weight=\"bold\">")
                    .append(escape(node.getGatewayType().marker())).append("</text>\n");
        }
        if (!node.getLabel().isEmpty()) {
            sb.append("    <text class=\"bpmn-label\" x=\"").append(num(cx)).append("\" y=\"").append(num(cy + half + 14))
                    .append("\" text-anchor=\"middle\">").append(escape(node.getLabel())).append("</text>\n");
        }
        sb.append("  </g>\n");
    }

    private static boolean isServiceTask(FlowDocument doc, NodeLayout node) {
        if (doc == null) return false;
        FlowDocument.Actor actor = doc.findActor(node.getLaneOwner());
        return actor != null && "system".equalsIgnoreCase(actor.type);
    }

    static String num(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) return Long.toString((long) value);
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    static String escape(String text) {
        if (text == null) return "";
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&': out.append("&amp;"); break;
                case '<': out.append("&lt;"); break;
                case '>': out.append("&gt;"); break;
                case '"': out.append("&quot;"); break;
                case '\'': out.append("&apos;"); break;
                default:
                    // control characters other than tab, LF and CR are not allowed in XML 1.0
                    if (c < 0x20 && c != '\t' && c != '\n' && c != '\r') {
                        out.append(' ');
                    } else if (c != '\uFFFE' && c != '\uFFFF') {
                        out.append(c);
                    }
            }
        }
        return out.toString();
    }
}
