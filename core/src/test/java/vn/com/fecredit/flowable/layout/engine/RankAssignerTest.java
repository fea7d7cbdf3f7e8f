package vn.com.fecredit.flowable.layout.engine;

import org.junit.jupiter.api.Test;
import vn.com.fecredit.flowable.layout.model.FlowDocument;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static vn.com.fecredit.flowable.layout.model.FlowDocumentFixtures.actor;
import static vn.com.fecredit.flowable.layout.model.FlowDocumentFixtures.chain;
import static vn.com.fecredit.flowable.layout.model.FlowDocumentFixtures.doc;
import static vn.com.fecredit.flowable.layout.model.FlowDocumentFixtures.flow;
import static vn.com.fecredit.flowable.layout.model.FlowDocumentFixtures.task;

public class RankAssignerTest {

    private List<LayoutRank> rank(FlowDocument doc, NodeTable table) {
        return new RankAssigner().assign(table, FlowGraphBuilder.build(doc.flows));
    }

    @Test
    void every_source_starts_at_rank_zero() {
        FlowDocument doc = chain("A", "B");
        task(doc, "C", "a");
        NodeTable table = NodeTable.from(doc);

        List<LayoutRank> ranks = rank(doc, table);

        assertThat(table.find("A").rankIndex).isZero();
        assertThat(table.find("C").rankIndex).isZero();
        assertThat(table.find("B").rankIndex).isEqualTo(1);
        assertThat(ranks).hasSize(2);
        assertThat(ranks.get(0).members).extracting(n -> n.id).containsExactly("A", "C");
    }

    @Test
    void three_node_cycle_is_broken_at_first_declared_node() {
        FlowDocument doc = chain("A", "B", "C");
        flow(doc, "C", "A");
        NodeTable table = NodeTable.from(doc);

        List<LayoutRank> ranks = rank(doc, table);

        assertThat(table.find("A").rankIndex).isZero();
        assertThat(table.find("B").rankIndex).isEqualTo(1);
        assertThat(table.find("C").rankIndex).isEqualTo(2);
        assertThat(ranks).hasSize(3);
    }

    @Test
    void cycle_downstream_of_a_source_continues_after_highest_rank() {
        FlowDocument doc = chain("S", "A", "B");
        flow(doc, "B", "A");
        NodeTable table = NodeTable.from(doc);

        rank(doc, table);

        // S is rank 0; A waits on B, so A is forced past the highest rank seen so far
        assertThat(table.find("S").rankIndex).isZero();
        assertThat(table.find("A").rankIndex).isEqualTo(1);
        assertThat(table.find("B").rankIndex).isEqualTo(2);
    }

    @Test
    void node_downstream_of_a_cycle_is_not_chosen_to_break_it() {
        FlowDocument doc = actor(doc("downstream"), "a");
        for (String id : new String[]{"C", "D", "A", "B"}) task(doc, id, "a");
        flow(doc, "A", "B");
        flow(doc, "B", "A");
        flow(doc, "B", "D");
        flow(doc, "D", "C");
        NodeTable table = NodeTable.from(doc);

        rank(doc, table);

        assertThat(table.find("A").rankIndex).isZero();
        assertThat(table.find("B").rankIndex).isEqualTo(1);
        assertThat(table.find("D").rankIndex).isEqualTo(2);
        assertThat(table.find("C").rankIndex).isEqualTo(3);
    }

    @Test
    void upstream_cycle_is_broken_before_the_cycle_it_feeds() {
        FlowDocument doc = actor(doc("two-cycles"), "a");
        for (String id : new String[]{"C", "D", "A", "B"}) task(doc, id, "a");
        flow(doc, "A", "B");
        flow(doc, "B", "A");
        flow(doc, "C", "D");
        flow(doc, "D", "C");
        flow(doc, "B", "C");
        NodeTable table = NodeTable.from(doc);

        rank(doc, table);

        assertThat(table.find("A").rankIndex).isZero();
        assertThat(table.find("B").rankIndex).isEqualTo(1);
        assertThat(table.find("C").rankIndex).isEqualTo(2);
        assertThat(table.find("D").rankIndex).isEqualTo(3);
    }

    @Test
    void edges_to_unknown_nodes_do_not_hold_back_ranking() {
        FlowDocument doc = chain("A", "B");
        flow(doc, "ghost", "B");
        NodeTable table = NodeTable.from(doc);

        rank(doc, table);

        assertThat(table.find("B").rankIndex).isEqualTo(1);
    }
}
