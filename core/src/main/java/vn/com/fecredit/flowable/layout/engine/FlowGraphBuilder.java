package vn.com.fecredit.flowable.layout.engine;

import vn.com.fecredit.flowable.layout.model.FlowDocument;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the document's flows into adjacency maps. Flows with a blank endpoint are skipped;
 * dangling ids are kept here and dropped later by {@link EdgeRouter}.
 */
public final class FlowGraphBuilder {
    private FlowGraphBuilder() {}

    public static FlowGraph build(List<FlowDocument.Flow> flows) {
        Map<String, List<String>> forward = new LinkedHashMap<>();
        Map<String, List<String>> reverse = new LinkedHashMap<>();
        if (flows != null) {
            for (FlowDocument.Flow f : flows) {
                if (f == null || isBlank(f.from) || isBlank(f.to)) continue;
                forward.computeIfAbsent(f.from, k -> new ArrayList<>()).add(f.to);
                reverse.computeIfAbsent(f.to, k -> new ArrayList<>()).add(f.from);
            }
        }
        return new FlowGraph(forward, reverse);
    }

    static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
