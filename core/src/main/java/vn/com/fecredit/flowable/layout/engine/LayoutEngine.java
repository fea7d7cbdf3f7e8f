package vn.com.fecredit.flowable.layout.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.flowable.layout.exception.InvalidFlowDocumentException;
import vn.com.fecredit.flowable.layout.model.FlowDocument;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes a swimlane layout for a {@link FlowDocument}.
 *
 * <p>Stages run in a fixed order: graph building, lane assignment, rank assignment,
 * rank ordering, node sizing, band sizing, coordinate assignment, edge routing and
 * bounds. Each call owns all of its working state, so one engine instance can serve
 * concurrent callers.</p>
 */
public class LayoutEngine {

    private static final Logger log = LoggerFactory.getLogger(LayoutEngine.class);

    private final LayoutSettings settings;
    private final GatewayLanePolicy lanePolicy;
    private final RoutingPolicy routingPolicy;

    public LayoutEngine() {
        this(LayoutSettings.defaults(), new PredecessorFirstLanePolicy(), new AdjacentSameLaneRoutingPolicy());
    }

    public LayoutEngine(LayoutSettings settings) {
        this(settings, new PredecessorFirstLanePolicy(), new AdjacentSameLaneRoutingPolicy());
    }

    public LayoutEngine(LayoutSettings settings, GatewayLanePolicy lanePolicy, RoutingPolicy routingPolicy) {
        if (settings == null || lanePolicy == null || routingPolicy == null) {
            throw new IllegalArgumentException("settings, lanePolicy and routingPolicy are required");
        }
        this.settings = settings;
        this.lanePolicy = lanePolicy;
        this.routingPolicy = routingPolicy;
    }

    public LayoutSettings getSettings() {
        return settings;
    }

    public LayoutResult layout(FlowDocument doc) {
        if (doc == null) {
            throw new InvalidFlowDocumentException("Flow document is null");
        }
        List<FlowDocument.Flow> flows = doc.flows();
        NodeTable table = NodeTable.from(doc);
        FlowGraph graph = FlowGraphBuilder.build(flows);

        List<LayoutLane> lanes = new LaneAssigner(lanePolicy).assign(doc, table, graph);
        List<LayoutRank> ranks = new RankAssigner().assign(table, graph);
        new RankOrderer().order(ranks, doc);

        new GeometrySizer(settings).size(table);
        BandSizer bands = new BandSizer(settings);
        bands.sizeRanks(ranks);
        bands.sizeLanes(lanes, table);
        new CoordinateAssigner(settings).place(ranks, lanes);

        Map<String, NodeLayout> nodes = new LinkedHashMap<>();
        for (LayoutNode n : table.nodes()) nodes.put(n.id, n.freeze());
        List<EdgeLayout> edges = new EdgeRouter(routingPolicy).route(flows, nodes);

        DiagramBoundsCalculator bounds = new DiagramBoundsCalculator(settings);
        double width = bounds.width(ranks);
        double height = bounds.height(lanes);

        List<LaneLayout> laneLayouts = new ArrayList<>();
        double laneWidth = width - 2 * settings.getMarginX();
        for (LayoutLane l : lanes) {
            laneLayouts.add(new LaneLayout(l.index, l.participantId, l.label, settings.getMarginX(), l.y, laneWidth, l.height));
        }
        List<RankLayout> rankLayouts = new ArrayList<>();
        for (LayoutRank r : ranks) {
            rankLayouts.add(new RankLayout(r.index, r.phaseId, r.x, r.width));
        }

        log.debug("Laid out '{}': {} nodes, {} lanes, {} ranks, {} edges, {}x{}",
                doc.documentId(), nodes.size(), laneLayouts.size(), rankLayouts.size(), edges.size(), width, height);
        return new LayoutResult(nodes, laneLayouts, rankLayouts, edges, width, height);
    }
}
