package vn.com.fecredit.flowable.layout.engine;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class LayoutSettingsTest {

    @Test
    void with_accepts_camel_and_kebab_keys() {
        LayoutSettings s = LayoutSettings.defaults()
                .with("rankSpacing", 120)
                .with("lane-min-height", 200);

        assertThat(s.getRankSpacing()).isEqualTo(120d);
        assertThat(s.getLaneMinHeight()).isEqualTo(200d);
        assertThat(s.getMarginX()).isEqualTo(50d);
    }

    @Test
    void unknown_key_is_rejected() {
        assertThatThrownBy(() -> LayoutSettings.defaults().with("zoom", 2))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("zoom");
    }

    @Test
    void inconsistent_widths_are_rejected() {
        assertThatThrownBy(() -> LayoutSettings.defaults().with("taskMaxWidth", 100))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void sizes_must_be_positive() {
        assertThatThrownBy(() -> LayoutSettings.defaults().with("taskHeight", 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> LayoutSettings.defaults().with("nodeSpacing", -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void custom_settings_flow_through_the_engine() {
        LayoutSettings s = LayoutSettings.defaults().with("marginX", 10).with("laneHeaderWidth", 40);

        LayoutResult result = new LayoutEngine(s).layout(vn.com.fecredit.flowable.layout.model.FlowDocumentFixtures.chain("A"));

        assertThat(result.node("A").getX()).isEqualTo(50d);
        assertThat(result.getWidth()).isEqualTo(2 * 10d + 40d + 120d);
    }

    @Test
    void to_string_lists_every_setting() {
        assertThat(LayoutSettings.defaults().toString())
                .contains("taskWidthOffset=80.0", "perCharWidth=12.0", "laneMinHeight=150.0", "gatewaySize=60.0");
    }
}
