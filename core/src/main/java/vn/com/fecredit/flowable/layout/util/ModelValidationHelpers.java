package vn.com.fecredit.flowable.layout.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import vn.com.fecredit.flowable.layout.exception.BpmnConversionException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks for generated BPMN 2.0 files: definitions, collaboration, processes,
 * sequence flow references and diagram interchange. A Flowable parse runs afterwards
 * and reports its problems as warnings only.
 */
public final class ModelValidationHelpers {

    private static final Logger log = LoggerFactory.getLogger(ModelValidationHelpers.class);

    static final String BPMN_NS = "http://www.omg.org/spec/BPMN/20100524/MODEL";
    static final String BPMNDI_NS = "http://www.omg.org/spec/BPMN/20100524/DI";
    static final String DC_NS = "http://www.omg.org/spec/DD/20100524/DC";
    static final String DI_NS = "http://www.omg.org/spec/DD/20100524/DI";

    private ModelValidationHelpers() {}

    public static ValidationResult validate(Path xml) {
        try {
            return validate(Files.readAllBytes(xml));
        } catch (IOException e) {
            return new ValidationResult(List.of("Cannot read " + xml + ": " + e.getMessage()), List.of());
        }
    }

    public static ValidationResult validate(byte[] xml) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Document doc;
        try {
            DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
            dbf.setNamespaceAware(true);
            dbf.setExpandEntityReferences(false);
            DocumentBuilder db = dbf.newDocumentBuilder();
            doc = db.parse(new ByteArrayInputStream(xml));
        } catch (Exception e) {
            errors.add("XML parsing error: " + e.getMessage());
            return new ValidationResult(errors, warnings);
        }

        Element root = doc.getDocumentElement();
        if (!BPMN_NS.equals(root.getNamespaceURI()) || !"definitions".equals(root.getLocalName())) {
            errors.add("Root element must be 'definitions' in the BPMN 2.0 namespace, found: " + root.getTagName());
            return new ValidationResult(errors, warnings);
        }
        if (!root.hasAttribute("targetNamespace")) {
            errors.add("definitions element missing required 'targetNamespace' attribute");
        }
        if (!root.hasAttribute("id")) {
            warnings.add("definitions element has no 'id' attribute");
        }

        Set<String> processIds = new HashSet<>();
        Set<String> elementIds = new HashSet<>();
        checkProcesses(root, processIds, elementIds, errors);
        checkCollaborations(root, processIds, elementIds, errors);
        checkDiagram(root, elementIds, errors, warnings);

        try {
            ModelConverterHelpers.parse(xml);
        } catch (BpmnConversionException e) {
            warnings.add("Engine-level parsing raised exception: " + e.getMessage());
        }

        ValidationResult result = new ValidationResult(errors, warnings);
        if (!result.valid) log.debug("BPMN validation found {} errors", errors.size());
        return result;
    }

    private static void checkProcesses(Element root, Set<String> processIds, Set<String> elementIds, List<String> errors) {
        List<Element> processes = children(root, BPMN_NS, "process");
        if (processes.isEmpty()) {
            errors.add("definitions must contain at least one process");
            return;
        }
        for (Element process : processes) {
            String processId = process.getAttribute("id");
            if (processId.isEmpty()) {
                errors.add("process element missing required 'id' attribute");
                processId = "unknown";
            } else {
                processIds.add(processId);
                elementIds.add(processId);
            }
            collectIds(process, elementIds);

            List<Element> flows = new ArrayList<>();
            for (Element el : children(process, BPMN_NS, null)) {
                String name = el.getLocalName();
                if ("sequenceFlow".equals(name)) {
                    flows.add(el);
                } else if (isTask(name) && el.getAttribute("id").isEmpty()) {
                    errors.add("Task in process " + processId + " missing 'id' attribute");
                } else if (name.endsWith("Gateway") && el.getAttribute("id").isEmpty()) {
                    errors.add("Gateway in process " + processId + " missing 'id' attribute");
                }
            }
            for (Element flow : flows) {
                String id = flow.getAttribute("id");
                if (id.isEmpty()) {
                    errors.add("sequenceFlow in process " + processId + " missing 'id' attribute");
                    id = "unknown";
                }
                String source = flow.getAttribute("sourceRef");
                String target = flow.getAttribute("targetRef");
                if (source.isEmpty()) {
                    errors.add("sequenceFlow " + id + " missing 'sourceRef' attribute");
                } else if (!elementIds.contains(source)) {
                    errors.add("sequenceFlow " + id + " sourceRef references non-existent element: " + source);
                }
                if (target.isEmpty()) {
                    errors.add("sequenceFlow " + id + " missing 'targetRef' attribute");
                } else if (!elementIds.contains(target)) {
                    errors.add("sequenceFlow " + id + " targetRef references non-existent element: " + target);
                }
            }
        }
    }

    private static void checkCollaborations(Element root, Set<String> processIds, Set<String> elementIds, List<String> errors) {
        for (Element collaboration : children(root, BPMN_NS, "collaboration")) {
            if (collaboration.getAttribute("id").isEmpty()) {
                errors.add("collaboration element missing required 'id' attribute");
            } else {
                elementIds.add(collaboration.getAttribute("id"));
            }
            List<Element> participants = children(collaboration, BPMN_NS, "participant");
            if (participants.isEmpty()) {
                errors.add("collaboration must contain at least one participant");
            }
            for (Element participant : participants) {
                String id = participant.getAttribute("id");
                if (id.isEmpty()) {
                    errors.add("participant element missing required 'id' attribute");
                    id = "unknown";
                } else {
                    elementIds.add(id);
                }
                String processRef = participant.getAttribute("processRef");
                if (processRef.isEmpty()) {
                    errors.add("participant " + id + " missing 'processRef' attribute");
                } else if (!processIds.contains(processRef)) {
                    errors.add("participant " + id + " references non-existent process: " + processRef);
                }
            }
        }
    }

    private static void checkDiagram(Element root, Set<String> elementIds, List<String> errors, List<String> warnings) {
        List<Element> diagrams = children(root, BPMNDI_NS, "BPMNDiagram");
        if (diagrams.isEmpty()) {
            warnings.add("No BPMNDiagram element; the model has no layout information");
            return;
        }
        for (Element diagram : diagrams) {
            List<Element> planes = children(diagram, BPMNDI_NS, "BPMNPlane");
            if (planes.isEmpty()) {
                errors.add("BPMNDiagram " + diagram.getAttribute("id") + " missing BPMNPlane element");
                continue;
            }
            for (Element plane : planes) {
                if (plane.getAttribute("bpmnElement").isEmpty()) {
                    errors.add("BPMNPlane element missing required 'bpmnElement' attribute");
                }
                for (Element shape : children(plane, BPMNDI_NS, "BPMNShape")) {
                    checkShape(shape, elementIds, errors, warnings);
                }
                for (Element edge : children(plane, BPMNDI_NS, "BPMNEdge")) {
                    checkEdge(edge, elementIds, errors, warnings);
                }
            }
        }
    }

    private static void checkShape(Element shape, Set<String> elementIds, List<String> errors, List<String> warnings) {
        String ref = shape.getAttribute("bpmnElement");
        String label = shape.getAttribute("id").isEmpty() ? ref : shape.getAttribute("id");
        if (ref.isEmpty()) {
            errors.add("BPMNShape " + label + " missing 'bpmnElement' attribute");
        } else if (!elementIds.contains(ref)) {
            warnings.add("BPMNShape " + label + " references unknown element '" + ref + "'");
        }
        List<Element> bounds = children(shape, DC_NS, "Bounds");
        if (bounds.isEmpty()) {
            errors.add("BPMNShape " + label + " missing Bounds element");
            return;
        }
        for (String attr : new String[]{"x", "y", "width", "height"}) {
            if (!isNumber(bounds.get(0).getAttribute(attr))) {
                errors.add("BPMNShape " + label + " Bounds missing or invalid '" + attr + "'");
            }
        }
    }

    private static void checkEdge(Element edge, Set<String> elementIds, List<String> errors, List<String> warnings) {
        String ref = edge.getAttribute("bpmnElement");
        String label = edge.getAttribute("id").isEmpty() ? ref : edge.getAttribute("id");
        if (ref.isEmpty()) {
            errors.add("BPMNEdge " + label + " missing 'bpmnElement' attribute");
        } else if (!elementIds.contains(ref)) {
            warnings.add("BPMNEdge " + label + " references unknown element '" + ref + "'");
        }
        List<Element> waypoints = children(edge, DI_NS, "waypoint");
        if (waypoints.size() < 2) {
            errors.add("BPMNEdge " + label + " must have at least 2 waypoints, found " + waypoints.size());
        }
        for (Element wp : waypoints) {
            if (!isNumber(wp.getAttribute("x")) || !isNumber(wp.getAttribute("y"))) {
                errors.add("BPMNEdge " + label + " has a waypoint without numeric 'x' and 'y'");
                break;
            }
        }
    }

    private static boolean isTask(String localName) {
        return "task".equals(localName) || localName.endsWith("Task");
    }

    private static boolean isNumber(String value) {
        if (value == null || value.isEmpty()) return false;
        try {
            Double.parseDouble(value);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static void collectIds(Element parent, Set<String> out) {
        NodeList all = parent.getElementsByTagNameNS(BPMN_NS, "*");
        for (int i = 0; i < all.getLength(); i++) {
            Element el = (Element) all.item(i);
            if (el.hasAttribute("id")) out.add(el.getAttribute("id"));
        }
    }

    /** Direct element children, optionally filtered by local name. */
    private static List<Element> children(Element parent, String ns, String localName) {
        List<Element> out = new ArrayList<>();
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n.getNodeType() != Node.ELEMENT_NODE) continue;
            if (!ns.equals(n.getNamespaceURI())) continue;
            if (localName == null || localName.equals(n.getLocalName())) out.add((Element) n);
        }
        return out;
    }
}
