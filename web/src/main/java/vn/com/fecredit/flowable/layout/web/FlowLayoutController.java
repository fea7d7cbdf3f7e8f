package vn.com.fecredit.flowable.layout.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import vn.com.fecredit.flowable.layout.engine.LayoutResult;
import vn.com.fecredit.flowable.layout.exception.FlowLayoutException;
import vn.com.fecredit.flowable.layout.exception.InvalidFlowDocumentException;
import vn.com.fecredit.flowable.layout.model.FlowDocument;
import vn.com.fecredit.flowable.layout.service.FlowLayoutService;
import vn.com.fecredit.flowable.layout.util.ValidationResult;

import java.util.Map;

/**
 * Layout endpoints. Every operation takes the flow JSON document as request body.
 *
 * <p>Malformed documents answer 400, failures while exporting answer 500; both carry
 * {@code {"error": message}}.</p>
 */
@RestController
@RequestMapping("/api/layout")
public class FlowLayoutController {

    private static final Logger log = LoggerFactory.getLogger(FlowLayoutController.class);

    static final MediaType SVG = MediaType.valueOf("image/svg+xml");

    private final FlowLayoutService service;

    public FlowLayoutController(FlowLayoutService service) {
        this.service = service;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<LayoutResult> layout(@RequestBody String body) {
        FlowDocument doc = service.read(body);
        return ResponseEntity.ok(service.layout(doc));
    }

    @PostMapping(path = "/bpmn", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> bpmn(@RequestBody String body) {
        FlowDocument doc = service.read(body);
        return ResponseEntity.ok().contentType(MediaType.APPLICATION_XML).body(service.toBpmnXml(doc));
    }

    @PostMapping(path = "/svg", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> svg(@RequestBody String body) {
        FlowDocument doc = service.read(body);
        return ResponseEntity.ok().contentType(SVG).body(service.toSvg(doc));
    }

    @PostMapping(path = "/mermaid", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> mermaid(@RequestBody String body) {
        FlowDocument doc = service.read(body);
        return ResponseEntity.ok().contentType(MediaType.TEXT_PLAIN).body(service.toMermaid(doc));
    }

    /** Generates BPMN for the document and reports the structural check result. */
    @PostMapping(path = "/validate", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ValidationResult> validate(@RequestBody String body) {
        FlowDocument doc = service.read(body);
        return ResponseEntity.ok(service.validateBpmn(doc));
    }

    @ExceptionHandler(InvalidFlowDocumentException.class)
    public ResponseEntity<Map<String, String>> invalidDocument(InvalidFlowDocumentException ex) {
        log.debug("Rejected flow document: {}", ex.getMessage());
        return ResponseEntity.badRequest().contentType(MediaType.APPLICATION_JSON).body(Map.of("error", ex.getMessage()));
    }

    @ExceptionHandler(FlowLayoutException.class)
    public ResponseEntity<Map<String, String>> exportFailed(FlowLayoutException ex) {
        log.error("Flow export failed", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("error", ex.getMessage()));
    }
}
