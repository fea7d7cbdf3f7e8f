package vn.com.fecredit.flowable.layout.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A routed connector. Waypoints run from the source's right-mid point to the
 * target's left-mid point and always hold at least two entries.
 */
public final class EdgeLayout {
    private final String id;
    private final String sourceId;
    private final String targetId;
    private final String condition;
    private final String name;
    private final List<Waypoint> waypoints;

    public EdgeLayout(String id, String sourceId, String targetId, String condition, List<Waypoint> waypoints) {
        this(id, sourceId, targetId, condition, null, waypoints);
    }

    public EdgeLayout(String id, String sourceId, String targetId, String condition, String name, List<Waypoint> waypoints) {
        if (waypoints == null || waypoints.size() < 2) {
            throw new IllegalArgumentException("edge " + id + " needs at least 2 waypoints");
        }
        this.id = id;
        this.sourceId = sourceId;
        this.targetId = targetId;
        this.condition = condition;
        this.name = name;
        this.waypoints = Collections.unmodifiableList(new ArrayList<>(waypoints));
    }

    public String getId() { return id; }
    public String getSourceId() { return sourceId; }
    public String getTargetId() { return targetId; }
    public String getCondition() { return condition; }
    public String getName() { return name; }
    public List<Waypoint> getWaypoints() { return waypoints; }

    @Override
    public String toString() {
        return "EdgeLayout{" + id + " " + sourceId + "->" + targetId + " " + waypoints + "}";
    }
}
