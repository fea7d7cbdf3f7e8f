package vn.com.fecredit.flowable.layout.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * POJO that represents the business flow JSON produced upstream: participants,
 * phases, tasks, gateways and the control-flow edges between them.
 *
 * <p>Fields are public and bound directly by Jackson. {@link vn.com.fecredit.flowable.layout.service.FlowDocumentReader}
 * replaces missing lists with empty ones; hand-built documents may leave them null and are
 * read through the list accessors, which never modify the document.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class FlowDocument {
    public Metadata metadata;
    public List<Actor> actors = new ArrayList<>();
    public List<Phase> phases = new ArrayList<>();
    public List<Task> tasks = new ArrayList<>();
    public List<Gateway> gateways = new ArrayList<>();
    public List<Flow> flows = new ArrayList<>();

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Metadata {
        public String id;
        public String title;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Actor {
        public String id;
        public String name;
        // "human" or "system"; system actors produce service tasks
        public String type;

        public Actor() {}

        public Actor(String id, String name, String type) {
            this.id = id;
            this.name = name;
            this.type = type;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Phase {
        public String id;
        public String name;

        public Phase() {}

        public Phase(String id, String name) {
            this.id = id;
            this.name = name;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Task {
        public String id;
        public String name;
        @JsonProperty("actor_id")
        public String actorId;
        @JsonProperty("phase_id")
        public String phaseId;
        public String notes;

        public Task() {}

        public Task(String id, String name, String actorId, String phaseId) {
            this.id = id;
            this.name = name;
            this.actorId = actorId;
            this.phaseId = phaseId;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Gateway {
        public String id;
        public String name;
        public String type;
        public String notes;

        public Gateway() {}

        public Gateway(String id, String name, String type) {
            this.id = id;
            this.name = name;
            this.type = type;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Flow {
        public String id;
        public String from;
        public String to;
        public String condition;
        public String name;

        public Flow() {}

        public Flow(String id, String from, String to) {
            this.id = id;
            this.from = from;
            this.to = to;
        }

        public Flow(String id, String from, String to, String condition) {
            this(id, from, to);
            this.condition = condition;
        }
    }

    /** Replaces missing lists with empty ones and returns this document. */
    public FlowDocument normalize() {
        if (actors == null) actors = new ArrayList<>();
        if (phases == null) phases = new ArrayList<>();
        if (tasks == null) tasks = new ArrayList<>();
        if (gateways == null) gateways = new ArrayList<>();
        if (flows == null) flows = new ArrayList<>();
        return this;
    }

    public List<Actor> actors() { return orEmpty(actors); }
    public List<Phase> phases() { return orEmpty(phases); }
    public List<Task> tasks() { return orEmpty(tasks); }
    public List<Gateway> gateways() { return orEmpty(gateways); }
    public List<Flow> flows() { return orEmpty(flows); }

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? Collections.emptyList() : list;
    }

    /** Identifier used to derive process, pool and diagram ids. */
    public String documentId() {
        if (metadata != null && metadata.id != null && !metadata.id.isBlank()) return metadata.id;
        return "flow";
    }

    public String title() {
        if (metadata != null && metadata.title != null && !metadata.title.isBlank()) return metadata.title;
        return "Business Process";
    }

    public Actor findActor(String actorId) {
        if (actorId == null) return null;
        for (Actor a : actors()) {
            if (a != null && actorId.equals(a.id)) return a;
        }
        return null;
    }

    public Phase findPhase(String phaseId) {
        if (phaseId == null) return null;
        for (Phase p : phases()) {
            if (p != null && phaseId.equals(p.id)) return p;
        }
        return null;
    }
}
