package vn.com.fecredit.flowable.layout.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.flowable.layout.model.FlowDocument;
import vn.com.fecredit.flowable.layout.model.GatewayType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Dense node storage: tasks in document order followed by gateways in document order,
 * plus an id to index map so later stages work on integer indices.
 */
final class NodeTable {

    private static final Logger log = LoggerFactory.getLogger(NodeTable.class);

    private final List<LayoutNode> nodes = new ArrayList<>();
    private final Map<String, Integer> indexById = new HashMap<>();

    static NodeTable from(FlowDocument doc) {
        NodeTable table = new NodeTable();
        for (FlowDocument.Task t : doc.tasks()) {
            if (t == null) continue;
            table.add(t.id, NodeKind.TASK, t.name, t.actorId, t.phaseId, null);
        }
        for (FlowDocument.Gateway g : doc.gateways()) {
            if (g == null) continue;
            table.add(g.id, NodeKind.GATEWAY, g.name, null, null, GatewayType.from(g.type));
        }
        return table;
    }

    private void add(String id, NodeKind kind, String label, String owner, String rankHint, GatewayType gatewayType) {
        if (id == null || id.isBlank()) {
            log.warn("Skipping {} without id (label='{}')", kind.name().toLowerCase(), label);
            return;
        }
        if (indexById.containsKey(id)) {
            log.warn("Duplicate node id '{}' ignored; first declaration wins", id);
            return;
        }
        int idx = nodes.size();
        nodes.add(new LayoutNode(idx, id, kind, label == null ? id : label, owner, rankHint, gatewayType));
        indexById.put(id, idx);
    }

    int size() {
        return nodes.size();
    }

    boolean isEmpty() {
        return nodes.isEmpty();
    }

    LayoutNode get(int index) {
        return nodes.get(index);
    }

    /** @return the node with that id or {@code null} when the id is unknown */
    LayoutNode find(String id) {
        Integer idx = id == null ? null : indexById.get(id);
        return idx == null ? null : nodes.get(idx);
    }

    /** @return index of the node or -1 */
    int indexOf(String id) {
        Integer idx = id == null ? null : indexById.get(id);
        return idx == null ? -1 : idx;
    }

    List<LayoutNode> nodes() {
        return Collections.unmodifiableList(nodes);
    }
}
