package ir.cfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import util.OrderedPair;

import com.ibm.wala.util.graph.Graph;
import com.ibm.wala.util.graph.NumberedGraph;
import com.ibm.wala.util.graph.impl.InvertedGraph;
import com.ibm.wala.util.graph.traverse.DFS;

/**
 * Control flow graph for a single procedure. Contains a synthetic entry node, one node per statement and a synthetic
 * exit node. Instances are built by {@link CFGBuilder} and are not modified afterwards.
 */
public final class ControlFlowGraph implements Iterable<CFGNode> {

    /**
     * Name of the procedure this is the graph for
     */
    private final String procedureName;
    /**
     * Nodes in order: entry, statements, exit
     */
    private final List<CFGNode> nodes;
    /**
     * Underlying graph
     */
    private final NumberedGraph<CFGNode> graph;

    ControlFlowGraph(String procedureName, List<CFGNode> nodes, NumberedGraph<CFGNode> graph) {
        assert nodes.size() >= 2 && nodes.get(0).isEntry() && nodes.get(nodes.size() - 1).isExit();
        this.procedureName = procedureName;
        this.nodes = Collections.unmodifiableList(nodes);
        this.graph = graph;
    }

    public String getProcedureName() {
        return procedureName;
    }

    /**
     * All nodes in a stable order: the entry node, the statement nodes in program order, then the exit node
     *
     * @return unmodifiable list of nodes
     */
    public List<CFGNode> getNodes() {
        return nodes;
    }

    @Override
    public Iterator<CFGNode> iterator() {
        return nodes.iterator();
    }

    /**
     * Get the node with the given number
     *
     * @param number
     *            0 for the entry, i for the i-th statement, {@link #size()}-1 for the exit
     * @return the node
     */
    public CFGNode getNode(int number) {
        return nodes.get(number);
    }

    /**
     * Number of nodes including entry and exit
     */
    public int size() {
        return nodes.size();
    }

    public CFGNode entry() {
        return nodes.get(0);
    }

    public CFGNode exit() {
        return nodes.get(nodes.size() - 1);
    }

    /**
     * Control flow successors of the given node, ordered by node number
     *
     * @param n
     *            node in this graph
     * @return unmodifiable list of successors
     */
    public List<CFGNode> getSuccs(CFGNode n) {
        return sorted(graph.getSuccNodes(n));
    }

    /**
     * Control flow predecessors of the given node, ordered by node number
     *
     * @param n
     *            node in this graph
     * @return unmodifiable list of predecessors
     */
    public List<CFGNode> getPreds(CFGNode n) {
        return sorted(graph.getPredNodes(n));
    }

    /**
     * Nodes facts flow in from: the predecessors for a forward analysis, the successors for a backward one
     *
     * @param n
     *            node in this graph
     * @param forward
     *            direction of the analysis
     * @return unmodifiable list of nodes ordered by node number
     */
    public List<CFGNode> getFlowPreds(CFGNode n, boolean forward) {
        return forward ? getPreds(n) : getSuccs(n);
    }

    /**
     * Nodes facts flow out to: the successors for a forward analysis, the predecessors for a backward one
     *
     * @param n
     *            node in this graph
     * @param forward
     *            direction of the analysis
     * @return unmodifiable list of nodes ordered by node number
     */
    public List<CFGNode> getFlowSuccs(CFGNode n, boolean forward) {
        return forward ? getSuccs(n) : getPreds(n);
    }

    public int getPredNodeCount(CFGNode n) {
        return graph.getPredNodeCount(n);
    }

    public boolean hasEdge(CFGNode source, CFGNode target) {
        return graph.hasEdge(source, target);
    }

    /**
     * All edges of the graph ordered by source then target
     *
     * @return list of (source, target) pairs
     */
    public List<OrderedPair<CFGNode, CFGNode>> getEdges() {
        List<OrderedPair<CFGNode, CFGNode>> edges = new ArrayList<>();
        for (CFGNode n : nodes) {
            for (CFGNode succ : getSuccs(n)) {
                edges.add(new OrderedPair<>(n, succ));
            }
        }
        return edges;
    }

    /**
     * Nodes reachable from the root in postorder (depth-first finish time). The root is the entry for a forward
     * traversal and the exit for a backward one.
     *
     * @param forward
     *            direction of the traversal
     * @return reachable nodes, the root last
     */
    public List<CFGNode> postorder(boolean forward) {
        Graph<CFGNode> g = forward ? graph : new InvertedGraph<>(graph);
        CFGNode root = forward ? entry() : exit();

        List<CFGNode> order = new ArrayList<>(nodes.size());
        Iterator<CFGNode> finish = DFS.iterateFinishTime(g, Collections.singleton(root).iterator());
        while (finish.hasNext()) {
            order.add(finish.next());
        }
        return order;
    }

    /**
     * Nodes in reverse postorder of a depth-first traversal. For a forward traversal the search starts at the entry
     * and follows control flow edges; otherwise it starts at the exit and follows the edges backwards. Nodes the
     * traversal does not reach are appended in node order.
     *
     * @param forward
     *            direction of the traversal
     * @return every node of the graph exactly once
     */
    public List<CFGNode> reversePostorder(boolean forward) {
        List<CFGNode> order = postorder(forward);
        Collections.reverse(order);

        if (order.size() < nodes.size()) {
            Set<CFGNode> seen = new LinkedHashSet<>(order);
            for (CFGNode n : nodes) {
                if (!seen.contains(n)) {
                    order.add(n);
                }
            }
        }
        return order;
    }

    /**
     * Nodes that cannot be reached from the entry by following control flow edges
     *
     * @return set of unreachable nodes in node order
     */
    public Set<CFGNode> getUnreachableNodes() {
        Set<CFGNode> reachable = DFS.getReachableNodes(graph, Collections.singleton(entry()));
        Set<CFGNode> unreachable = new LinkedHashSet<>();
        for (CFGNode n : nodes) {
            if (!reachable.contains(n)) {
                unreachable.add(n);
            }
        }
        return unreachable;
    }

    private static List<CFGNode> sorted(Iterator<CFGNode> iter) {
        List<CFGNode> l = new ArrayList<>();
        while (iter.hasNext()) {
            l.add(iter.next());
        }
        Collections.sort(l);
        return Collections.unmodifiableList(l);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("CFG for " + procedureName + "\n");
        for (CFGNode n : nodes) {
            sb.append("\t" + n + " -> " + getSuccs(n) + "\n");
        }
        return sb.toString();
    }
}
