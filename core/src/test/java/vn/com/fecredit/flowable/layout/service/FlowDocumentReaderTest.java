package vn.com.fecredit.flowable.layout.service;

import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import vn.com.fecredit.flowable.layout.exception.InvalidFlowDocumentException;
import vn.com.fecredit.flowable.layout.model.FlowDocument;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class FlowDocumentReaderTest {

    private final FlowDocumentReader reader = new FlowDocumentReader();

    @Test
    void reads_fixture_with_snake_case_references() {
        FlowDocument doc = reader.read(new ClassPathResource("flows/sample-tiny.json"));

        assertThat(doc.documentId()).isEqualTo("loan_request");
        assertThat(doc.title()).isEqualTo("Loan request");
        assertThat(doc.actors).hasSize(2);
        assertThat(doc.tasks.get(1).actorId).isEqualTo("scoring");
        assertThat(doc.tasks.get(1).phaseId).isEqualTo("decision");
        assertThat(doc.tasks.get(1).notes).isEqualTo("Uses bureau data");
        assertThat(doc.flows.get(1).condition).isEqualTo("Yes");
    }

    @Test
    void missing_sections_become_empty_lists() {
        FlowDocument doc = reader.read("{\"tasks\": null, \"extra\": {\"ignored\": true}}");

        assertThat(doc.actors).isEmpty();
        assertThat(doc.tasks).isEmpty();
        assertThat(doc.flows).isEmpty();
        assertThat(doc.documentId()).isEqualTo("flow");
        assertThat(doc.title()).isEqualTo("Business Process");
    }

    @Test
    void reads_from_stream() {
        String json = "{\"actors\":[{\"id\":\"a\",\"name\":\"A\"}],\"tasks\":[{\"id\":\"t\",\"name\":\"T\",\"actor_id\":\"a\"}]}";

        FlowDocument doc = reader.read(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));

        assertThat(doc.findActor("a").name).isEqualTo("A");
        assertThat(doc.tasks.get(0).actorId).isEqualTo("a");
    }

    @Test
    void rejects_non_object_root() {
        assertThatThrownBy(() -> reader.read("[1, 2]"))
                .isInstanceOf(InvalidFlowDocumentException.class)
                .hasMessageContaining("JSON object");
    }

    @Test
    void rejects_section_with_wrong_shape() {
        assertThatThrownBy(() -> reader.read("{\"tasks\": {\"id\": \"t\"}}"))
                .isInstanceOf(InvalidFlowDocumentException.class)
                .hasMessageContaining("tasks");
    }

    @Test
    void rejects_malformed_json() {
        assertThatThrownBy(() -> reader.read("{\"tasks\": ["))
                .isInstanceOf(InvalidFlowDocumentException.class);
        assertThatThrownBy(() -> reader.read("  "))
                .isInstanceOf(InvalidFlowDocumentException.class);
    }
}
