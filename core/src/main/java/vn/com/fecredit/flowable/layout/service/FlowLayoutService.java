package vn.com.fecredit.flowable.layout.service;

import org.flowable.bpmn.model.BpmnModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import vn.com.fecredit.flowable.layout.engine.LayoutEngine;
import vn.com.fecredit.flowable.layout.engine.LayoutResult;
import vn.com.fecredit.flowable.layout.exception.InvalidFlowDocumentException;
import vn.com.fecredit.flowable.layout.model.FlowDocument;
import vn.com.fecredit.flowable.layout.util.BpmnModelBuilder;
import vn.com.fecredit.flowable.layout.util.MermaidExporter;
import vn.com.fecredit.flowable.layout.util.ModelConverterHelpers;
import vn.com.fecredit.flowable.layout.util.ModelRenderHelpers;
import vn.com.fecredit.flowable.layout.util.ModelValidationHelpers;
import vn.com.fecredit.flowable.layout.util.SvgDiagramRenderer;
import vn.com.fecredit.flowable.layout.util.ValidationResult;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Facade over reading, layout and every export format. Stateless apart from its collaborators.
 */
@Service
public class FlowLayoutService {

    private static final Logger log = LoggerFactory.getLogger(FlowLayoutService.class);

    private final LayoutEngine engine;
    private final FlowDocumentReader reader;

    public FlowLayoutService(LayoutEngine engine, FlowDocumentReader reader) {
        this.engine = engine;
        this.reader = reader;
    }

    public FlowDocument read(String json) {
        return reader.read(json);
    }

    public FlowDocument read(Path path) {
        return reader.read(path);
    }

    public LayoutResult layout(FlowDocument doc) {
        if (doc == null) throw new InvalidFlowDocumentException("Flow document is required");
        LayoutResult result = engine.layout(doc);
        log.info("Layout for '{}': {} nodes, {} edges, canvas {}x{}",
                doc.documentId(), result.getNodes().size(), result.getEdges().size(), result.getWidth(), result.getHeight());
        return result;
    }

    public BpmnModel toBpmnModel(FlowDocument doc) {
        return BpmnModelBuilder.build(doc, layout(doc));
    }

    public String toBpmnXml(FlowDocument doc) {
        return ModelConverterHelpers.toXml(toBpmnModel(doc));
    }

    public String toSvg(FlowDocument doc) {
        return SvgDiagramRenderer.render(layout(doc), doc);
    }

    public String toMermaid(FlowDocument doc) {
        if (doc == null) throw new InvalidFlowDocumentException("Flow document is required");
        return MermaidExporter.export(doc);
    }

    /** Generates BPMN for the document and runs the structural checks on it. */
    public ValidationResult validateBpmn(FlowDocument doc) {
        return validateBpmn(toBpmnXml(doc));
    }

    public ValidationResult validateBpmn(String bpmnXml) {
        ValidationResult result = ModelValidationHelpers.validate(bpmnXml.getBytes(StandardCharsets.UTF_8));
        if (!result.valid) {
            log.warn("Generated BPMN failed validation: {}", result.errors);
        }
        return result;
    }

    public Path renderPng(FlowDocument doc, Path outputFile) {
        return ModelRenderHelpers.renderToPng(toBpmnModel(doc), outputFile);
    }
}
