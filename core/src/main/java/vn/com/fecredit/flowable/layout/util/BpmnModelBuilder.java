package vn.com.fecredit.flowable.layout.util;

import org.flowable.bpmn.model.Activity;
import org.flowable.bpmn.model.BpmnModel;
import org.flowable.bpmn.model.ExclusiveGateway;
import org.flowable.bpmn.model.FlowNode;
import org.flowable.bpmn.model.Gateway;
import org.flowable.bpmn.model.GraphicInfo;
import org.flowable.bpmn.model.InclusiveGateway;
import org.flowable.bpmn.model.Lane;
import org.flowable.bpmn.model.ParallelGateway;
import org.flowable.bpmn.model.Pool;
import org.flowable.bpmn.model.Process;
import org.flowable.bpmn.model.SequenceFlow;
import org.flowable.bpmn.model.ServiceTask;
import org.flowable.bpmn.model.UserTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.flowable.layout.engine.EdgeLayout;
import vn.com.fecredit.flowable.layout.engine.LaneLayout;
import vn.com.fecredit.flowable.layout.engine.LayoutResult;
import vn.com.fecredit.flowable.layout.engine.NodeKind;
import vn.com.fecredit.flowable.layout.engine.NodeLayout;
import vn.com.fecredit.flowable.layout.engine.Waypoint;
import vn.com.fecredit.flowable.layout.exception.BpmnConversionException;
import vn.com.fecredit.flowable.layout.model.FlowDocument;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps a flow document plus its computed layout onto a Flowable {@link BpmnModel}
 * with a single pool, one lane per layout lane and complete diagram interchange.
 *
 * <p>Only routed edges become sequence flows, so every emitted flow has DI waypoints.</p>
 */
public final class BpmnModelBuilder {

    private static final Logger log = LoggerFactory.getLogger(BpmnModelBuilder.class);

    public static final String TARGET_NAMESPACE = "http://bpmn.io/schema/bpmn";

    private BpmnModelBuilder() {}

    public static String participantId(FlowDocument doc) {
        return "Participant_" + doc.documentId();
    }

    public static String processId(FlowDocument doc) {
        return "Process_" + doc.documentId();
    }

    public static String laneId(String participantId) {
        return "Lane_" + participantId;
    }

    public static BpmnModel build(FlowDocument doc, LayoutResult layout) {
        if (doc == null || layout == null) {
            throw new BpmnConversionException("Flow document and layout are required");
        }
        BpmnModel model = new BpmnModel();
        model.setTargetNamespace(TARGET_NAMESPACE);

        Process process = new Process();
        process.setId(processId(doc));
        process.setName(doc.title());
        process.setExecutable(false);
        model.addProcess(process);

        Pool pool = new Pool();
        pool.setId(participantId(doc));
        pool.setName(doc.title());
        pool.setProcessRef(process.getId());
        model.getPools().add(pool);

        Map<String, FlowNode> elements = new HashMap<>();
        for (NodeLayout node : layout.getNodes().values()) {
            FlowNode element = node.getKind() == NodeKind.GATEWAY
                    ? gateway(node)
                    : task(node, doc);
            element.setId(node.getId());
            element.setName(node.getLabel());
            String notes = notesOf(doc, node);
            if (notes != null && !notes.isBlank()) element.setDocumentation(notes);
            process.addFlowElement(element);
            elements.put(node.getId(), element);
            model.addGraphicInfo(node.getId(), bounds(node.getX(), node.getY(), node.getWidth(), node.getHeight()));
        }

        double poolHeight = 0;
        for (LaneLayout laneLayout : layout.getLanes()) {
            Lane lane = new Lane();
            lane.setId(laneId(laneLayout.getParticipantId()));
            lane.setName(laneLayout.getLabel());
            lane.setParentProcess(process);
            for (NodeLayout node : layout.getNodes().values()) {
                if (node.getLaneIndex() == laneLayout.getIndex()) lane.getFlowReferences().add(node.getId());
            }
            process.getLanes().add(lane);
            model.addGraphicInfo(lane.getId(),
                    bounds(laneLayout.getX(), laneLayout.getY(), laneLayout.getWidth(), laneLayout.getHeight()));
            poolHeight += laneLayout.getHeight();
        }
        if (!layout.getLanes().isEmpty()) {
            LaneLayout first = layout.getLanes().get(0);
            model.addGraphicInfo(pool.getId(), bounds(first.getX(), first.getY(), first.getWidth(), poolHeight));
        }

        for (EdgeLayout edge : layout.getEdges()) {
            FlowNode source = elements.get(edge.getSourceId());
            FlowNode target = elements.get(edge.getTargetId());
            if (source == null || target == null) {
                throw new BpmnConversionException("Edge " + edge.getId() + " has no node bounds for "
                        + edge.getSourceId() + " -> " + edge.getTargetId());
            }
            if (edge.getWaypoints().size() < 2) {
                throw new BpmnConversionException("Edge " + edge.getId() + " has fewer than 2 waypoints");
            }
            SequenceFlow flow = new SequenceFlow(edge.getSourceId(), edge.getTargetId());
            flow.setId(edge.getId());
            String name = edge.getName() != null ? edge.getName() : edge.getCondition();
            if (name != null) flow.setName(name);
            if (edge.getCondition() != null) flow.setConditionExpression(edge.getCondition());
            flow.setSourceFlowElement(source);
            flow.setTargetFlowElement(target);
            source.getOutgoingFlows().add(flow);
            target.getIncomingFlows().add(flow);
            process.addFlowElement(flow);

            List<GraphicInfo> points = new ArrayList<>();
            for (Waypoint w : edge.getWaypoints()) {
                GraphicInfo gi = new GraphicInfo();
                gi.setX(w.getX());
                gi.setY(w.getY());
                points.add(gi);
            }
            model.addFlowGraphicInfoList(flow.getId(), points);
        }
        log.debug("Built BPMN model {} with {} nodes, {} lanes and {} flows",
                process.getId(), elements.size(), process.getLanes().size(), layout.getEdges().size());
        return model;
    }

    private static Activity task(NodeLayout node, FlowDocument doc) {
        FlowDocument.Actor actor = doc.findActor(node.getLaneOwner());
        if (actor != null && "system".equalsIgnoreCase(actor.type)) {
            return new ServiceTask();
        }
        return new UserTask();
    }

    private static Gateway gateway(NodeLayout node) {
        switch (node.getGatewayType()) {
            case PARALLEL:
                return new ParallelGateway();
            case INCLUSIVE:
                return new InclusiveGateway();
            default:
                return new ExclusiveGateway();
        }
    }

    private static String notesOf(FlowDocument doc, NodeLayout node) {
        if (node.getKind() == NodeKind.TASK) {
            for (FlowDocument.Task t : doc.tasks()) {
                if (t != null && node.getId().equals(t.id)) return t.notes;
            }
        } else {
            for (FlowDocument.Gateway g : doc.gateways()) {
                if (g != null && node.getId().equals(g.id)) return g.notes;
            }
        }
        return null;
    }

    private static GraphicInfo bounds(double x, double y, double width, double height) {
        GraphicInfo gi = new GraphicInfo();
        gi.setX(x);
        gi.setY(y);
        gi.setWidth(width);
        gi.setHeight(height);
        return gi;
    }
}
