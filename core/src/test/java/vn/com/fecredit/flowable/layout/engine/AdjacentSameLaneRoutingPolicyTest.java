package vn.com.fecredit.flowable.layout.engine;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class AdjacentSameLaneRoutingPolicyTest {

    private final RoutingPolicy policy = new AdjacentSameLaneRoutingPolicy();

    private static NodeLayout node(String id, int lane, int rank, double x, double y) {
        return new NodeLayout(id, NodeKind.TASK, id, "", null, lane, rank, 0, x, y, 100, 40);
    }

    @Test
    void neighbours_in_same_lane_get_a_straight_line() {
        NodeLayout a = node("a", 0, 0, 0, 0);
        NodeLayout b = node("b", 0, 1, 200, 0);

        assertThat(policy.route(a, b)).containsExactly(new Waypoint(100, 20), new Waypoint(200, 20));
    }

    @Test
    void backward_neighbour_in_same_lane_is_still_straight() {
        NodeLayout a = node("a", 0, 1, 200, 0);
        NodeLayout b = node("b", 0, 0, 0, 0);

        assertThat(policy.route(a, b)).hasSize(2);
    }

    @Test
    void rank_skip_bends_at_midpoint() {
        NodeLayout a = node("a", 0, 0, 0, 0);
        NodeLayout c = node("c", 0, 2, 400, 60);

        assertThat(policy.route(a, c)).containsExactly(
                new Waypoint(100, 20), new Waypoint(250, 20), new Waypoint(250, 80), new Waypoint(400, 80));
    }

    @Test
    void lane_change_bends_even_between_neighbours() {
        NodeLayout a = node("a", 0, 0, 0, 0);
        NodeLayout b = node("b", 1, 1, 200, 150);

        assertThat(policy.route(a, b)).hasSize(4);
    }
}
