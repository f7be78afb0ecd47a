package analysis.pointer.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Graph mapping local variables and object fields to the allocation sites they may point to. Records which nodes
 * are read and which change so the engine can track dependencies between constraints.
 * <p>
 * The engine freezes the graph once it reaches a fixed point, after which no edges can be added.
 */
public class PointsToGraph {

    private final Map<PointsToGraphNode, Set<AllocSiteNode>> graph = new LinkedHashMap<>();
    private final Set<AllocSiteNode> allSites = new LinkedHashSet<>();

    private Set<PointsToGraphNode> changedNodes = new LinkedHashSet<>();
    private Set<PointsToGraphNode> readNodes = new LinkedHashSet<>();
    private boolean frozen = false;

    /**
     * Add an edge from node to site
     *
     * @param node
     *            source of the edge
     * @param site
     *            allocation site the node may point to
     * @return true if the graph changed
     */
    public boolean addEdge(PointsToGraphNode node, AllocSiteNode site) {
        assert node != null && site != null;
        checkNotFrozen();
        Set<AllocSiteNode> pointsToSet = graph.get(node);
        if (pointsToSet == null) {
            pointsToSet = new LinkedHashSet<>();
            graph.put(node, pointsToSet);
        }

        boolean changed = pointsToSet.add(site);
        if (changed) {
            changedNodes.add(node);
            allSites.add(site);
        }
        return changed;
    }

    /**
     * Add edges from node to every site in sites
     *
     * @param node
     *            source of the edges
     * @param sites
     *            allocation sites the node may point to
     * @return true if the graph changed
     */
    public boolean addEdges(PointsToGraphNode node, Set<AllocSiteNode> sites) {
        checkNotFrozen();
        if (sites.isEmpty()) {
            return false;
        }

        Set<AllocSiteNode> pointsToSet = graph.get(node);
        if (pointsToSet == null) {
            pointsToSet = new LinkedHashSet<>();
            graph.put(node, pointsToSet);
        }
        boolean changed = pointsToSet.addAll(sites);

        if (changed) {
            changedNodes.add(node);
            allSites.addAll(sites);
        }
        return changed;
    }

    /**
     * Get the points-to set for the given node and record that the node was read.
     *
     * @param node
     *            node to look up
     * @return Modifiable copy of the set of allocation sites the node points to
     */
    public Set<AllocSiteNode> getPointsToSet(PointsToGraphNode node) {
        if (!frozen) {
            readNodes.add(node);
        }

        if (graph.containsKey(node)) {
            return new LinkedHashSet<>(graph.get(node));
        }
        return Collections.emptySet();
    }

    /**
     * Get the points-to set for the given node without recording a read
     *
     * @param node
     *            node to look up
     * @return unmodifiable set of allocation sites the node points to
     */
    public Set<AllocSiteNode> lookup(PointsToGraphNode node) {
        Set<AllocSiteNode> s = graph.get(node);
        if (s == null) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(s);
    }

    /**
     * @return every node with at least one outgoing edge, in insertion order
     */
    public Set<PointsToGraphNode> getNodes() {
        return Collections.unmodifiableSet(graph.keySet());
    }

    /**
     * Set containing every allocation site some node points to
     *
     * @return set of allocation sites
     */
    public Set<AllocSiteNode> getAllocationSites() {
        return Collections.unmodifiableSet(allSites);
    }

    /**
     * @return number of edges in the graph
     */
    public int getEdgeCount() {
        int count = 0;
        for (Set<AllocSiteNode> s : graph.values()) {
            count += s.size();
        }
        return count;
    }

    /**
     * Get the nodes that changed since the last call and reset the tracking set
     *
     * @return changed nodes
     */
    public Set<PointsToGraphNode> getAndClearChangedNodes() {
        Set<PointsToGraphNode> c = changedNodes;
        changedNodes = new LinkedHashSet<>();
        return c;
    }

    /**
     * Get the nodes read since the last call and reset the tracking set
     *
     * @return nodes read
     */
    public Set<PointsToGraphNode> getAndClearReadNodes() {
        Set<PointsToGraphNode> c = readNodes;
        readNodes = new LinkedHashSet<>();
        return c;
    }

    /**
     * Disallow any further edges. Called once the graph is at a fixed point.
     */
    public void freeze() {
        frozen = true;
        changedNodes.clear();
        readNodes.clear();
    }

    public boolean isFrozen() {
        return frozen;
    }

    private void checkNotFrozen() {
        if (frozen) {
            throw new IllegalStateException("Points-to graph is frozen, cannot add edges");
        }
    }
}
