package vn.com.fecredit.flowable.layout.util;

import org.junit.jupiter.api.Test;
import vn.com.fecredit.flowable.layout.engine.LayoutEngine;
import vn.com.fecredit.flowable.layout.engine.LayoutResult;
import vn.com.fecredit.flowable.layout.model.FlowDocument;
import vn.com.fecredit.flowable.layout.model.FlowDocumentFixtures;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

public class SvgDiagramRendererTest {

    private final FlowDocument doc = FlowDocumentFixtures.load("sample-tiny.json");
    private final LayoutResult layout = new LayoutEngine().layout(doc);

    @Test
    void renders_lanes_nodes_and_connectors() {
        String svg = SvgDiagramRenderer.render(layout);

        assertThat(svg).startsWith("<?xml");
        assertThat(svg).contains("xmlns=\"http://www.w3.org/2000/svg\"");
        assertThat(svg).contains("viewBox=\"0 0 " + SvgDiagramRenderer.num(layout.getWidth()));
        assertThat(svg).contains("<marker id=\"arrow\"");
        assertThat(svg).contains("class=\"bpmn-lane\" id=\"lane-applicant\"", "class=\"bpmn-lane\" id=\"lane-scoring\"");
        assertThat(svg).contains("class=\"bpmn-gateway\" id=\"gw_eligible\"");
        assertThat(svg).contains("class=\"bpmn-flow\" id=\"f1\"");
        assertThat(svg).contains(">Approved</text>");
        assertThat(svg.trim()).endsWith("</svg>");
    }

    @Test
    void without_document_phase_ids_and_plain_tasks_are_used() {
        String svg = SvgDiagramRenderer.render(layout);

        assertThat(svg).contains("class=\"bpmn-phase\"").contains(">intake</text>");
        assertThat(svg).doesNotContain("bpmn-service-task");
    }

    @Test
    void with_document_phase_names_and_service_tasks_are_used() {
        String svg = SvgDiagramRenderer.render(layout, doc);

        assertThat(svg).contains(">Intake</text>", ">Decision</text>");
        assertThat(svg).contains("class=\"bpmn-service-task\" id=\"score_application\"");
        assertThat(svg).contains("class=\"bpmn-task\" id=\"submit_form\"");
    }

    @Test
    void empty_layout_is_a_blank_canvas() {
        String svg = SvgDiagramRenderer.render(new LayoutEngine().layout(new FlowDocument()));

        assertThat(svg).contains("width=\"280\" height=\"100\"");
        assertThat(svg).doesNotContain("bpmn-lane\"");
    }

    @Test
    void control_characters_in_labels_still_give_well_formed_xml() throws Exception {
        FlowDocument odd = FlowDocumentFixtures.chain("A", "B");
        odd.tasks.get(0).name = "Bell\u0007 and\u0000nul";

        String svg = SvgDiagramRenderer.render(new LayoutEngine().layout(odd));

        DocumentBuilderFactory.newInstance().newDocumentBuilder()
                .parse(new ByteArrayInputStream(svg.getBytes(StandardCharsets.UTF_8)));
        assertThat(svg).contains(">Bell  and nul</text>");
        assertThat(SvgDiagramRenderer.escape("a\u0001b\tc\nd")).isEqualTo("a b\tc\nd");
    }

    @Test
    void escapes_markup_and_formats_numbers() {
        assertThat(SvgDiagramRenderer.escape("A & <B> \"c\" 'd'")).isEqualTo("A &amp; &lt;B&gt; &quot;c&quot; &apos;d&apos;");
        assertThat(SvgDiagramRenderer.escape(null)).isEmpty();
        assertThat(SvgDiagramRenderer.num(230d)).isEqualTo("230");
        assertThat(SvgDiagramRenderer.num(12.5d)).isEqualTo("12.5");
    }
}
