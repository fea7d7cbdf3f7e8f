package vn.com.fecredit.flowable.layout.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.flowable.layout.model.FlowDocument;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Lane stage: one lane per actor in document order, tasks go to their actor's lane and
 * gateways are inferred from neighbours through a {@link GatewayLanePolicy}.
 */
final class LaneAssigner {

    private static final Logger log = LoggerFactory.getLogger(LaneAssigner.class);

    static final String DEFAULT_LANE_ID = "default";

    private final GatewayLanePolicy policy;

    LaneAssigner(GatewayLanePolicy policy) {
        this.policy = policy;
    }

    List<LayoutLane> assign(FlowDocument doc, NodeTable table, FlowGraph graph) {
        List<LayoutLane> lanes = new ArrayList<>();
        Map<String, Integer> laneByActor = new HashMap<>();
        for (FlowDocument.Actor actor : doc.actors()) {
            if (actor == null || actor.id == null || actor.id.isBlank()) {
                log.warn("Skipping actor without id");
                continue;
            }
            if (laneByActor.containsKey(actor.id)) {
                log.warn("Duplicate actor id '{}' ignored", actor.id);
                continue;
            }
            int idx = lanes.size();
            String label = actor.name == null || actor.name.isBlank() ? actor.id : actor.name;
            lanes.add(new LayoutLane(idx, actor.id, label));
            laneByActor.put(actor.id, idx);
        }
        if (lanes.isEmpty() && !table.isEmpty()) {
            log.warn("Document declares no actors; placing {} nodes in a default lane", table.size());
            lanes.add(new LayoutLane(0, DEFAULT_LANE_ID, "Default"));
        }

        List<LayoutNode> pending = new ArrayList<>();
        for (LayoutNode n : table.nodes()) {
            if (n.kind == NodeKind.TASK) {
                Integer lane = laneByActor.get(n.laneOwner);
                if (lane == null) {
                    if (!laneByActor.isEmpty()) {
                        log.warn("Task '{}' references unknown actor '{}'; using lane 0", n.id, n.laneOwner);
                    }
                    lane = 0;
                }
                n.laneIndex = lane;
            } else {
                pending.add(n);
            }
        }

        // predecessors first, across the whole gateway set; the successor fallback settles one
        // gateway at a time so its downstream gateways can inherit from it
        resolveFromPredecessors(pending, table, graph, lanes.size());
        while (!pending.isEmpty() && resolveOneFromSuccessors(pending, table, graph, lanes.size())) {
            resolveFromPredecessors(pending, table, graph, lanes.size());
        }
        for (LayoutNode g : pending) {
            log.debug("Gateway '{}' has no resolvable neighbour; using lane 0", g.id);
            g.laneIndex = 0;
        }

        for (LayoutNode n : table.nodes()) {
            LayoutLane lane = lanes.get(n.laneIndex);
            lane.nodeCount++;
        }
        return lanes;
    }

    private void resolveFromPredecessors(List<LayoutNode> pending, NodeTable table, FlowGraph graph, int laneCount) {
        boolean progress = true;
        while (progress && !pending.isEmpty()) {
            progress = false;
            for (var it = pending.iterator(); it.hasNext(); ) {
                LayoutNode g = it.next();
                OptionalInt lane = policy.inferLane(knownLanes(graph.predecessors(g.id), table), Collections.emptyList());
                if (isLane(lane, laneCount)) {
                    g.laneIndex = lane.getAsInt();
                    it.remove();
                    progress = true;
                }
            }
        }
    }

    /**
     * Settles the first pending gateway that no other pending gateway feeds into, using its
     * successors. Only when every pending gateway waits on another one (a gateway cycle) is the
     * first gateway that resolves at all taken instead.
     */
    private boolean resolveOneFromSuccessors(List<LayoutNode> pending, NodeTable table, FlowGraph graph, int laneCount) {
        LayoutNode fallback = null;
        int fallbackLane = -1;
        for (LayoutNode g : pending) {
            OptionalInt lane = policy.inferLane(knownLanes(graph.predecessors(g.id), table),
                    knownLanes(graph.successors(g.id), table));
            if (!isLane(lane, laneCount)) continue;
            if (!hasPendingPredecessor(g, table, graph)) {
                return settle(pending, g, lane.getAsInt());
            }
            if (fallback == null) {
                fallback = g;
                fallbackLane = lane.getAsInt();
            }
        }
        return fallback != null && settle(pending, fallback, fallbackLane);
    }

    private static boolean settle(List<LayoutNode> pending, LayoutNode g, int lane) {
        g.laneIndex = lane;
        pending.remove(g);
        return true;
    }

    private static boolean hasPendingPredecessor(LayoutNode g, NodeTable table, FlowGraph graph) {
        for (String id : graph.predecessors(g.id)) {
            LayoutNode p = table.find(id);
            if (p != null && p != g && p.laneIndex < 0) return true;
        }
        return false;
    }

    private static boolean isLane(OptionalInt lane, int laneCount) {
        return lane.isPresent() && lane.getAsInt() >= 0 && lane.getAsInt() < laneCount;
    }

    private static List<Integer> knownLanes(List<String> ids, NodeTable table) {
        List<Integer> out = new ArrayList<>();
        for (String id : ids) {
            LayoutNode n = table.find(id);
            if (n != null && n.laneIndex >= 0) out.add(n.laneIndex);
        }
        return out;
    }
}
