package vn.com.fecredit.flowable.layout.util;

import org.flowable.bpmn.model.BpmnModel;
import org.flowable.bpmn.model.ExclusiveGateway;
import org.flowable.bpmn.model.Lane;
import org.flowable.bpmn.model.Pool;
import org.flowable.bpmn.model.Process;
import org.flowable.bpmn.model.SequenceFlow;
import org.flowable.bpmn.model.ServiceTask;
import org.flowable.bpmn.model.UserTask;
import org.junit.jupiter.api.Test;
import vn.com.fecredit.flowable.layout.engine.LayoutEngine;
import vn.com.fecredit.flowable.layout.engine.LayoutResult;
import vn.com.fecredit.flowable.layout.engine.NodeLayout;
import vn.com.fecredit.flowable.layout.exception.BpmnConversionException;
import vn.com.fecredit.flowable.layout.model.FlowDocument;
import vn.com.fecredit.flowable.layout.model.FlowDocumentFixtures;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class BpmnModelBuilderTest {

    private final FlowDocument doc = FlowDocumentFixtures.load("sample-tiny.json");
    private final LayoutResult layout = new LayoutEngine().layout(doc);

    @Test
    void builds_single_pool_with_one_lane_per_actor() {
        BpmnModel model = BpmnModelBuilder.build(doc, layout);

        Process process = model.getProcessById("Process_loan_request");
        assertThat(process).isNotNull();
        assertThat(process.getName()).isEqualTo("Loan request");
        assertThat(model.getPools()).extracting(Pool::getId).containsExactly("Participant_loan_request");
        assertThat(model.getPools().get(0).getProcessRef()).isEqualTo("Process_loan_request");
        assertThat(process.getLanes()).extracting(Lane::getId).containsExactly("Lane_applicant", "Lane_scoring");
        assertThat(process.getLanes().get(1).getFlowReferences()).containsExactlyInAnyOrder("score_application", "gw_score");
    }

    @Test
    void task_kind_follows_actor_type_and_notes_become_documentation() {
        BpmnModel model = BpmnModelBuilder.build(doc, layout);
        Process process = model.getProcessById("Process_loan_request");

        assertThat(process.getFlowElement("submit_form")).isInstanceOf(UserTask.class);
        assertThat(process.getFlowElement("score_application")).isInstanceOf(ServiceTask.class);
        assertThat(process.getFlowElement("score_application").getDocumentation()).isEqualTo("Uses bureau data");
        assertThat(process.getFlowElement("gw_score")).isInstanceOf(ExclusiveGateway.class);
    }

    @Test
    void shapes_and_edges_carry_layout_geometry() {
        BpmnModel model = BpmnModelBuilder.build(doc, layout);

        NodeLayout node = layout.node("sign_contract");
        assertThat(model.getGraphicInfo("sign_contract").getX()).isEqualTo(node.getX());
        assertThat(model.getGraphicInfo("sign_contract").getWidth()).isEqualTo(node.getWidth());
        assertThat(model.getGraphicInfo("Lane_applicant")).isNotNull();
        assertThat(model.getGraphicInfo("Participant_loan_request").getHeight())
                .isEqualTo(layout.getHeight() - 2 * 50d);
        assertThat(model.getFlowLocationGraphicInfo("f2")).hasSize(4);
    }

    @Test
    void conditional_flows_keep_condition_as_name_and_expression() {
        BpmnModel model = BpmnModelBuilder.build(doc, layout);
        SequenceFlow flow = (SequenceFlow) model.getProcessById("Process_loan_request").getFlowElement("f5");

        assertThat(flow.getSourceRef()).isEqualTo("gw_score");
        assertThat(flow.getTargetRef()).isEqualTo("sign_contract");
        assertThat(flow.getName()).isEqualTo("Approved");
        assertThat(flow.getConditionExpression()).isEqualTo("Approved");
    }

    @Test
    void missing_layout_is_a_conversion_error() {
        assertThatThrownBy(() -> BpmnModelBuilder.build(doc, null)).isInstanceOf(BpmnConversionException.class);
    }
}
