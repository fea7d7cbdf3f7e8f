package vn.com.fecredit.flowable.layout.engine;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import vn.com.fecredit.flowable.layout.model.FlowDocumentFixtures;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Geometric properties every layout must satisfy, checked against the bundled fixtures.
 */
public class LayoutInvariantsTest {

    private final LayoutSettings settings = LayoutSettings.defaults();
    private final LayoutEngine engine = new LayoutEngine(settings);

    @ParameterizedTest
    @ValueSource(strings = {"sample-tiny.json", "parallel-review.json"})
    void lanes_tile_the_canvas_without_gaps(String fixture) {
        LayoutResult result = engine.layout(FlowDocumentFixtures.load(fixture));

        double y = settings.getMarginY();
        for (LaneLayout lane : result.getLanes()) {
            assertThat(lane.getY()).isEqualTo(y);
            y += lane.getHeight();
        }
        assertThat(result.getHeight()).isEqualTo(y + settings.getMarginY());
    }

    @ParameterizedTest
    @ValueSource(strings = {"sample-tiny.json", "parallel-review.json"})
    void edges_point_forward_in_acyclic_documents(String fixture) {
        LayoutResult result = engine.layout(FlowDocumentFixtures.load(fixture));

        for (EdgeLayout edge : result.getEdges()) {
            assertThat(result.node(edge.getTargetId()).getRankIndex())
                    .as(edge.getId())
                    .isGreaterThan(result.node(edge.getSourceId()).getRankIndex());
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"sample-tiny.json", "parallel-review.json"})
    void edges_start_and_end_on_node_boundaries(String fixture) {
        LayoutResult result = engine.layout(FlowDocumentFixtures.load(fixture));

        for (EdgeLayout edge : result.getEdges()) {
            List<Waypoint> points = edge.getWaypoints();
            assertThat(points.size()).isGreaterThanOrEqualTo(2);
            assertThat(points.get(0)).isEqualTo(result.node(edge.getSourceId()).rightMid());
            assertThat(points.get(points.size() - 1)).isEqualTo(result.node(edge.getTargetId()).leftMid());
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"sample-tiny.json", "parallel-review.json"})
    void nodes_are_positive_and_inside_their_bands(String fixture) {
        LayoutResult result = engine.layout(FlowDocumentFixtures.load(fixture));

        for (NodeLayout node : result.getNodes().values()) {
            assertThat(node.getWidth()).isPositive();
            assertThat(node.getHeight()).isPositive();
            LaneLayout lane = result.getLanes().get(node.getLaneIndex());
            RankLayout rank = result.getRanks().get(node.getRankIndex());
            assertThat(node.getY()).isGreaterThanOrEqualTo(lane.getY());
            assertThat(node.getY() + node.getHeight()).isLessThanOrEqualTo(lane.getY() + lane.getHeight());
            assertThat(node.getX()).isGreaterThanOrEqualTo(rank.getX());
            assertThat(node.getX() + node.getWidth()).isLessThanOrEqualTo(rank.getX() + rank.getWidth());
            assertThat(node.getX() + node.getWidth()).isLessThanOrEqualTo(result.getWidth());
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"sample-tiny.json", "parallel-review.json"})
    void nodes_never_overlap(String fixture) {
        LayoutResult result = engine.layout(FlowDocumentFixtures.load(fixture));

        List<NodeLayout> nodes = new ArrayList<>(result.getNodes().values());
        for (int i = 0; i < nodes.size(); i++) {
            for (int j = i + 1; j < nodes.size(); j++) {
                NodeLayout a = nodes.get(i);
                NodeLayout b = nodes.get(j);
                boolean apart = a.getX() + a.getWidth() <= b.getX() || b.getX() + b.getWidth() <= a.getX()
                        || a.getY() + a.getHeight() <= b.getY() || b.getY() + b.getHeight() <= a.getY();
                assertThat(apart).as(a.getId() + " vs " + b.getId()).isTrue();
            }
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"sample-tiny.json", "parallel-review.json"})
    void rank_width_is_widest_member_and_canvas_width_adds_up(String fixture) {
        LayoutResult result = engine.layout(FlowDocumentFixtures.load(fixture));

        double sum = 0;
        for (RankLayout rank : result.getRanks()) {
            double widest = result.getNodes().values().stream()
                    .filter(n -> n.getRankIndex() == rank.getIndex())
                    .mapToDouble(NodeLayout::getWidth).max().orElse(0);
            assertThat(rank.getWidth()).isEqualTo(widest);
            sum += rank.getWidth();
        }
        double expected = 2 * settings.getMarginX() + settings.getLaneHeaderWidth() + sum
                + settings.getRankSpacing() * (result.getRanks().size() - 1);
        assertThat(result.getWidth()).isEqualTo(expected);
    }
}
