package vn.com.fecredit.flowable.layout.engine;

import java.util.List;
import java.util.OptionalInt;

/**
 * Decides which lane a gateway without an owner belongs to, given the lanes of its
 * neighbours that are already known. Lists keep edge declaration order.
 */
public interface GatewayLanePolicy {

    OptionalInt inferLane(List<Integer> predecessorLanes, List<Integer> successorLanes);
}
