package vn.com.fecredit.flowable.layout.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.flowable.layout.model.FlowDocument;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Routes every flow whose endpoints were placed, in document order. Flows naming an
 * unknown node are dropped with a warning; flows without an id get {@code flow_<index>}
 * and a repeated id gets {@code _<index>} appended.
 */
final class EdgeRouter {

    private static final Logger log = LoggerFactory.getLogger(EdgeRouter.class);

    private final RoutingPolicy policy;

    EdgeRouter(RoutingPolicy policy) {
        this.policy = policy;
    }

    List<EdgeLayout> route(List<FlowDocument.Flow> flows, Map<String, NodeLayout> nodes) {
        List<EdgeLayout> edges = new ArrayList<>();
        Set<String> usedIds = new HashSet<>();
        for (int i = 0; i < flows.size(); i++) {
            FlowDocument.Flow f = flows.get(i);
            if (f == null || FlowGraphBuilder.isBlank(f.from) || FlowGraphBuilder.isBlank(f.to)) {
                log.warn("Skipping flow #{} with a missing endpoint", i);
                continue;
            }
            String id = FlowGraphBuilder.isBlank(f.id) ? "flow_" + i : f.id;
            NodeLayout source = nodes.get(f.from);
            NodeLayout target = nodes.get(f.to);
            if (source == null || target == null) {
                log.warn("Dropping flow '{}': {} -> {} references an unknown node", id, f.from, f.to);
                continue;
            }
            if (!usedIds.add(id)) {
                String renamed = id + "_" + i;
                log.warn("Flow id '{}' is used more than once; routing flow #{} as '{}'", id, i, renamed);
                id = renamed;
                usedIds.add(id);
            }
            String condition = FlowGraphBuilder.isBlank(f.condition) ? null : f.condition;
            String name = FlowGraphBuilder.isBlank(f.name) ? null : f.name;
            edges.add(new EdgeLayout(id, f.from, f.to, condition, name, policy.route(source, target)));
        }
        return edges;
    }
}
