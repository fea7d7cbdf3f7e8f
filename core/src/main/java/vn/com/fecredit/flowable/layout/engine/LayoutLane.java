package vn.com.fecredit.flowable.layout.engine;

final class LayoutLane {
    final int index;
    final String participantId;
    final String label;
    int nodeCount;
    double maxNodeHeight;
    double y;
    double height;

    LayoutLane(int index, String participantId, String label) {
        this.index = index;
        this.participantId = participantId;
        this.label = label;
    }
}
