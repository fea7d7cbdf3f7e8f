package vn.com.fecredit.flowable.layout.engine;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Forward and reverse adjacency keyed by node id. Lists keep edge declaration order
 * and may contain ids that do not name a node; stages resolve ids through {@link NodeTable}.
 */
public final class FlowGraph {

    private final Map<String, List<String>> successors;
    private final Map<String, List<String>> predecessors;

    FlowGraph(Map<String, List<String>> successors, Map<String, List<String>> predecessors) {
        this.successors = successors;
        this.predecessors = predecessors;
    }

    public List<String> successors(String id) {
        List<String> out = successors.get(id);
        return out == null ? Collections.emptyList() : Collections.unmodifiableList(out);
    }

    public List<String> predecessors(String id) {
        List<String> in = predecessors.get(id);
        return in == null ? Collections.emptyList() : Collections.unmodifiableList(in);
    }

    public Map<String, List<String>> forward() {
        return Collections.unmodifiableMap(successors);
    }

    public Map<String, List<String>> reverse() {
        return Collections.unmodifiableMap(predecessors);
    }
}
