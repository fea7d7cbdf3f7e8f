package vn.com.fecredit.flowable.layout.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import vn.com.fecredit.flowable.layout.exception.InvalidFlowDocumentException;
import vn.com.fecredit.flowable.layout.model.FlowDocument;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads flow JSON into a {@link FlowDocument}. Unknown properties are ignored and missing
 * lists become empty; anything that is not a JSON object with list-valued sections is rejected.
 */
public class FlowDocumentReader {

    private static final Logger log = LoggerFactory.getLogger(FlowDocumentReader.class);

    private static final String[] LIST_FIELDS = {"actors", "phases", "tasks", "gateways", "flows"};

    private final ObjectMapper mapper;

    public FlowDocumentReader() {
        this(new ObjectMapper());
    }

    public FlowDocumentReader(ObjectMapper mapper) {
        this.mapper = mapper.copy().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public FlowDocument read(Path path) {
        try (InputStream is = Files.newInputStream(path)) {
            return read(is);
        } catch (IOException e) {
            throw new InvalidFlowDocumentException("Cannot read flow document " + path + ": " + e.getMessage(), e);
        }
    }

    public FlowDocument read(Resource resource) {
        try (InputStream is = resource.getInputStream()) {
            return read(is);
        } catch (IOException e) {
            throw new InvalidFlowDocumentException("Cannot read flow document " + resource.getDescription() + ": " + e.getMessage(), e);
        }
    }

    public FlowDocument read(InputStream in) {
        try {
            return fromTree(mapper.readTree(in));
        } catch (JsonProcessingException e) {
            throw new InvalidFlowDocumentException("Malformed flow JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new InvalidFlowDocumentException("Cannot read flow JSON: " + e.getMessage(), e);
        }
    }

    public FlowDocument read(String json) {
        if (json == null || json.isBlank()) {
            throw new InvalidFlowDocumentException("Flow JSON is empty");
        }
        try {
            return fromTree(mapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new InvalidFlowDocumentException("Malformed flow JSON: " + e.getOriginalMessage(), e);
        }
    }

    private FlowDocument fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new InvalidFlowDocumentException("Flow document must be a JSON object");
        }
        for (String field : LIST_FIELDS) {
            JsonNode value = root.get(field);
            if (value != null && !value.isNull() && !value.isArray()) {
                throw new InvalidFlowDocumentException("'" + field + "' must be an array but was " + value.getNodeType());
            }
        }
        JsonNode metadata = root.get("metadata");
        if (metadata != null && !metadata.isNull() && !metadata.isObject()) {
            throw new InvalidFlowDocumentException("'metadata' must be an object but was " + metadata.getNodeType());
        }
        FlowDocument doc;
        try {
            doc = mapper.treeToValue(root, FlowDocument.class);
        } catch (JsonProcessingException e) {
            throw new InvalidFlowDocumentException("Flow document has an unexpected shape: " + e.getOriginalMessage(), e);
        }
        doc.normalize();
        log.debug("Read flow '{}': {} actors, {} tasks, {} gateways, {} flows",
                doc.documentId(), doc.actors.size(), doc.tasks.size(), doc.gateways.size(), doc.flows.size());
        return doc;
    }
}
