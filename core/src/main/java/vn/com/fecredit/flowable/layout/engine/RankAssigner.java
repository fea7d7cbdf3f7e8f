package vn.com.fecredit.flowable.layout.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * Rank stage: longest-path topological leveling (Kahn's algorithm with max propagation).
 *
 * <p>When the queue drains while nodes remain, the leftovers are held back by cycles. The
 * first remaining node in table order that belongs to a cycle with no unfinished entry from
 * outside that cycle is placed one rank past the highest rank assigned so far and traversal
 * resumes from it. Nodes merely downstream of a cycle keep waiting for their predecessors.
 * Every node is dequeued exactly once, so cyclic input terminates.</p>
 */
final class RankAssigner {

    private static final Logger log = LoggerFactory.getLogger(RankAssigner.class);

    List<LayoutRank> assign(NodeTable table, FlowGraph graph) {
        int n = table.size();
        int[][] successors = new int[n][];
        int[][] predecessors = new int[n][];
        int[] inDegree = new int[n];
        for (int i = 0; i < n; i++) {
            LayoutNode node = table.get(i);
            successors[i] = resolve(graph.successors(node.id), table);
            predecessors[i] = resolve(graph.predecessors(node.id), table);
            inDegree[i] = predecessors[i].length;
        }
        int[] component = components(successors, predecessors);
        boolean[] cyclic = cyclicComponents(component, successors);

        int[] rank = new int[n];
        int[] tentative = new int[n];
        boolean[] done = new boolean[n];
        Arrays.fill(rank, -1);

        Deque<Integer> queue = new ArrayDeque<>();
        for (int i = 0; i < n; i++) {
            if (inDegree[i] == 0) {
                rank[i] = 0;
                queue.add(i);
            }
        }

        int processed = 0;
        int maxRank = -1;
        while (processed < n) {
            while (!queue.isEmpty()) {
                int cur = queue.poll();
                done[cur] = true;
                processed++;
                maxRank = Math.max(maxRank, rank[cur]);
                for (int succ : successors[cur]) {
                    if (done[succ] || rank[succ] >= 0) continue;
                    tentative[succ] = Math.max(tentative[succ], rank[cur] + 1);
                    if (--inDegree[succ] == 0) {
                        rank[succ] = tentative[succ];
                        queue.add(succ);
                    }
                }
            }
            if (processed == n) break;
            int entry = cycleEntry(component, cyclic, predecessors, done);
            rank[entry] = maxRank + 1;
            log.warn("Cycle detected: placing '{}' at rank {}", table.get(entry).id, rank[entry]);
            queue.add(entry);
        }

        List<LayoutRank> ranks = new ArrayList<>();
        for (int i = 0; i <= maxRank; i++) ranks.add(new LayoutRank(i));
        for (int i = 0; i < n; i++) {
            LayoutNode node = table.get(i);
            node.rankIndex = rank[i];
            ranks.get(rank[i]).members.add(node);
        }
        log.debug("Assigned {} nodes to {} ranks", n, ranks.size());
        return ranks;
    }

    /**
     * Picks the node that breaks the next cycle: first in table order among unfinished nodes
     * whose strongly connected component is cyclic and has no unfinished predecessor outside
     * itself.
     */
    private static int cycleEntry(int[] component, boolean[] cyclic, int[][] predecessors, boolean[] done) {
        int n = component.length;
        boolean[] blocked = new boolean[cyclic.length];
        for (int v = 0; v < n; v++) {
            if (done[v]) continue;
            for (int u : predecessors[v]) {
                if (!done[u] && component[u] != component[v]) blocked[component[v]] = true;
            }
        }
        int fallback = -1;
        for (int v = 0; v < n; v++) {
            if (done[v]) continue;
            if (cyclic[component[v]] && !blocked[component[v]]) return v;
            if (fallback < 0) fallback = v;
        }
        return fallback;
    }

    /** Kosaraju's algorithm with explicit stacks; returns the component index of every node. */
    static int[] components(int[][] successors, int[][] predecessors) {
        int n = successors.length;
        int[] finishOrder = new int[n];
        int finished = 0;
        boolean[] seen = new boolean[n];
        int[] next = new int[n];
        Deque<Integer> stack = new ArrayDeque<>();
        for (int s = 0; s < n; s++) {
            if (seen[s]) continue;
            seen[s] = true;
            stack.push(s);
            while (!stack.isEmpty()) {
                int v = stack.peek();
                if (next[v] < successors[v].length) {
                    int w = successors[v][next[v]++];
                    if (!seen[w]) {
                        seen[w] = true;
                        stack.push(w);
                    }
                } else {
                    stack.pop();
                    finishOrder[finished++] = v;
                }
            }
        }

        int[] component = new int[n];
        Arrays.fill(component, -1);
        int count = 0;
        for (int i = n - 1; i >= 0; i--) {
            int root = finishOrder[i];
            if (component[root] >= 0) continue;
            component[root] = count;
            stack.push(root);
            while (!stack.isEmpty()) {
                int v = stack.pop();
                for (int u : predecessors[v]) {
                    if (component[u] < 0) {
                        component[u] = count;
                        stack.push(u);
                    }
                }
            }
            count++;
        }
        return component;
    }

    private static boolean[] cyclicComponents(int[] component, int[][] successors) {
        int count = 0;
        for (int c : component) count = Math.max(count, c + 1);
        int[] size = new int[count];
        boolean[] cyclic = new boolean[count];
        for (int v = 0; v < component.length; v++) {
            size[component[v]]++;
            for (int w : successors[v]) {
                if (w == v) cyclic[component[v]] = true;
            }
        }
        for (int c = 0; c < count; c++) {
            if (size[c] > 1) cyclic[c] = true;
        }
        return cyclic;
    }

    private static int[] resolve(List<String> ids, NodeTable table) {
        int[] out = new int[ids.size()];
        int k = 0;
        for (String id : ids) {
            int idx = table.indexOf(id);
            if (idx >= 0) out[k++] = idx;
        }
        return Arrays.copyOf(out, k);
    }
}
