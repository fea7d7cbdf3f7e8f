package vn.com.fecredit.flowable.layout.engine;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class BandSizerTest {

    private final BandSizer sizer = new BandSizer(LayoutSettings.defaults());

    @Test
    void empty_lane_gets_minimum_height() {
        assertThat(sizer.laneHeight(0, 0)).isEqualTo(150d);
    }

    @Test
    void sparse_lane_is_held_at_minimum() {
        assertThat(sizer.laneHeight(1, 80)).isEqualTo(150d);
    }

    @Test
    void crowded_lane_grows_with_node_count() {
        assertThat(sizer.laneHeight(2, 80)).isEqualTo(2 * 80d + 20d + 2 * 20d);
        assertThat(sizer.laneHeight(4, 80)).isEqualTo(4 * 80d + 3 * 20d + 2 * 20d);
    }
}
