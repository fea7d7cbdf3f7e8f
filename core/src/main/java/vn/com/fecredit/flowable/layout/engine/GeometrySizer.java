package vn.com.fecredit.flowable.layout.engine;

/**
 * Node sizes from content: gateways are fixed squares, tasks grow with their label
 * between the base and maximum width.
 */
final class GeometrySizer {

    private final LayoutSettings settings;

    GeometrySizer(LayoutSettings settings) {
        this.settings = settings;
    }

    void size(NodeTable table) {
        for (LayoutNode n : table.nodes()) {
            if (n.kind == NodeKind.GATEWAY) {
                n.width = settings.getGatewaySize();
                n.height = settings.getGatewaySize();
            } else {
                n.width = taskWidth(n.label);
                n.height = settings.getTaskHeight();
            }
        }
    }

    double taskWidth(String label) {
        int length = label == null ? 0 : label.codePointCount(0, label.length());
        double wanted = settings.getTaskWidthOffset() + length * settings.getPerCharWidth();
        return Math.min(settings.getTaskMaxWidth(), Math.max(settings.getTaskBaseWidth(), wanted));
    }
}
