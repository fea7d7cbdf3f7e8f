package vn.com.fecredit.flowable.layout.engine;

import java.util.List;
import java.util.OptionalInt;
import java.util.TreeMap;

/**
 * Gateways run where control arrives: the most common predecessor lane wins (lowest
 * lane index on a tie), otherwise the first successor lane, otherwise nothing.
 */
public class PredecessorFirstLanePolicy implements GatewayLanePolicy {

    @Override
    public OptionalInt inferLane(List<Integer> predecessorLanes, List<Integer> successorLanes) {
        if (predecessorLanes != null && !predecessorLanes.isEmpty()) {
            TreeMap<Integer, Integer> counts = new TreeMap<>();
            for (Integer lane : predecessorLanes) counts.merge(lane, 1, Integer::sum);
            int best = -1;
            int bestCount = 0;
            for (var e : counts.entrySet()) {
                if (e.getValue() > bestCount) {
                    best = e.getKey();
                    bestCount = e.getValue();
                }
            }
            return OptionalInt.of(best);
        }
        if (successorLanes != null && !successorLanes.isEmpty()) {
            return OptionalInt.of(successorLanes.get(0));
        }
        return OptionalInt.empty();
    }
}
