package vn.com.fecredit.flowable.layout.util;

import vn.com.fecredit.flowable.layout.model.FlowDocument;

import java.util.ArrayList;
import java.util.List;

/** Renders a flow document as a fenced Mermaid {@code flowchart TD} block. */
public final class MermaidExporter {
    private MermaidExporter() {}

    public static String export(FlowDocument doc) {
        List<String> lines = new ArrayList<>();
        lines.add("```mermaid");
        lines.add("flowchart TD");
        lines.add("");

        boolean anyNode = false;
        for (FlowDocument.Task t : doc.tasks()) {
            if (t == null || isBlank(t.id)) continue;
            lines.add("    " + t.id + "[\"" + sanitize(t.name == null ? t.id : t.name) + "\"]");
            anyNode = true;
        }
        for (FlowDocument.Gateway g : doc.gateways()) {
            if (g == null || isBlank(g.id)) continue;
            lines.add("    " + g.id + "{\"" + sanitize(g.name == null ? g.id : g.name) + "\"}");
            anyNode = true;
        }
        if (anyNode) lines.add("");

        for (FlowDocument.Flow f : doc.flows()) {
            if (f == null || isBlank(f.from) || isBlank(f.to)) continue;
            if (!isBlank(f.condition)) {
                lines.add("    " + f.from + " -->|\"" + sanitize(f.condition) + "\"| " + f.to);
            } else {
                lines.add("    " + f.from + " --> " + f.to);
            }
        }
        lines.add("```");
        return String.join("\n", lines);
    }

    /** Double quotes become single quotes and line breaks become spaces. */
    static String sanitize(String text) {
        return text.replace('"', '\'').replace('\n', ' ').replace('\r', ' ').trim();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
