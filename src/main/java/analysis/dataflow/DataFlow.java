package analysis.dataflow;

import ir.cfg.CFGNode;
import ir.cfg.ControlFlowGraph;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import util.WorkQueue;
import analysis.dataflow.util.AbstractValue;

/**
 * Base class for an intra-procedural data-flow analysis solved by worklist iteration to a fixed point.
 * <p>
 * Subclasses define the lattice (through the fact type and {@link #bottom()}), the value at the boundary of the
 * graph ({@link #boundary()}) and the transfer function ({@link #flow(AbstractValue, CFGNode)}). Termination requires
 * that the lattice has finite height and that the transfer function is monotonic. The solver does not prove either,
 * but it fails with a {@link NonMonotonicTransferException} as soon as it sees a fact shrink or a node revisited more
 * than {@link #getMaxVisitsPerNode()} times.
 *
 * @param <F>
 *            type for the data-flow facts propagated by this analysis, must have hashCode and equals defined
 */
public abstract class DataFlow<F extends AbstractValue<F>> {

    /**
     * Default bound on the number of times a single node is visited
     */
    public static final int DEFAULT_MAX_VISITS_PER_NODE = 10000;

    /**
     * True if this is a forward analysis false if this is a backward analysis
     */
    private final boolean forward;
    /**
     * determines printing volume
     */
    protected int outputLevel = 0;
    /**
     * Order the worklist is seeded in
     */
    private WorklistOrder order = WorklistOrder.REVERSE_POSTORDER;
    /**
     * Notified of every fact change, may be null
     */
    private DataFlowListener<F> listener;
    private int maxVisitsPerNode = DEFAULT_MAX_VISITS_PER_NODE;

    /**
     * Create a new intra-procedural data-flow
     *
     * @param forward
     *            true if facts flow along control flow edges, false if they flow against them
     */
    protected DataFlow(boolean forward) {
        this.forward = forward;
    }

    /**
     * Bottom element of the lattice, the initial fact of every node
     *
     * @return bottom
     */
    protected abstract F bottom();

    /**
     * Fact flowing into the entry node (forward) or the exit node (backward). Defaults to bottom.
     *
     * @return boundary fact
     */
    protected F boundary() {
        return bottom();
    }

    /**
     * Transfer function for the data-flow. Must be monotonic and free of side effects.
     *
     * @param input
     *            join of the facts flowing into the node, for a backward analysis this is the fact after the node
     * @param current
     *            node being analyzed
     * @return fact flowing out of the node, for a backward analysis this is the fact before the node
     */
    protected abstract F flow(F input, CFGNode current);

    /**
     * Perform the data-flow on the given graph, starting from bottom
     *
     * @param cfg
     *            control flow graph to analyze
     * @return facts for every node at the fixed point
     */
    public final DataFlowResult<F> dataflow(ControlFlowGraph cfg) {
        return dataflow(cfg, null);
    }

    /**
     * Perform the data-flow on the given graph starting from the facts in a previous result. Starting from a fixed
     * point changes nothing.
     *
     * @param cfg
     *            control flow graph to analyze
     * @param start
     *            facts to start from (null to start from bottom), must be a result of this analysis on the same graph
     * @return facts for every node at the fixed point
     */
    public final DataFlowResult<F> dataflow(ControlFlowGraph cfg, DataFlowResult<F> start) {
        assert start == null || (start.getControlFlowGraph() == cfg && start.isForward() == forward);
        CFGNode initial = getInitialNode(cfg);

        Map<CFGNode, F> flowIn = new LinkedHashMap<>();
        Map<CFGNode, F> flowOut = new LinkedHashMap<>();
        Map<CFGNode, Integer> visitCounts = new HashMap<>();
        for (CFGNode n : cfg) {
            flowOut.put(n, start == null ? bottom() : start.getFlowOutput(n));
        }

        WorkQueue<CFGNode> q = new WorkQueue<>(seedOrder(cfg));
        CFGNode current;
        while ((current = q.poll()) != null) {
            Integer count = visitCounts.get(current);
            int visits = count == null ? 1 : count + 1;
            visitCounts.put(current, visits);
            if (visits > maxVisitsPerNode) {
                throw new NonMonotonicTransferException(getClass().getSimpleName() + " visited " + current.getName()
                        + " in " + cfg.getProcedureName() + " " + visits
                        + " times without reaching a fixed point", current);
            }

            F input = current == initial ? boundary() : bottom();
            for (CFGNode pred : cfg.getFlowPreds(current, forward)) {
                input = input.join(flowOut.get(pred));
            }
            flowIn.put(current, input);

            if (outputLevel >= 3) {
                System.err.println("FLOWING " + current.getName() + " in " + cfg.getProcedureName() + ": " + input);
            }

            F output = flow(input, current);
            assert output != null : "Null output for " + current + " with input: " + input;
            F previous = flowOut.get(current);
            if (!output.equals(previous)) {
                if (!previous.leq(output)) {
                    throw new NonMonotonicTransferException(getClass().getSimpleName() + " shrank the fact for "
                            + current.getName() + " in " + cfg.getProcedureName() + " from " + previous + " to "
                            + output, current);
                }
                if (outputLevel >= 3) {
                    System.err.println("OUTPUT " + current.getName() + ":\n\t" + output);
                }
                flowOut.put(current, output);
                if (listener != null) {
                    listener.factChanged(current, previous, output);
                }
                q.addAll(cfg.getFlowSuccs(current, forward));
            }
        }

        if (outputLevel >= 1) {
            System.err.println(getClass().getSimpleName() + " reached a fixed point for " + cfg.getProcedureName()
                    + " after " + q.getPolledCount() + " visits of " + cfg.size() + " nodes");
        }
        return forward ? new DataFlowResult<>(cfg, true, flowIn, flowOut, q.getPolledCount())
                : new DataFlowResult<>(cfg, false, flowOut, flowIn, q.getPolledCount());
    }

    /**
     * Order the worklist is initially filled in
     */
    private List<CFGNode> seedOrder(ControlFlowGraph cfg) {
        switch (order) {
        case REVERSE_POSTORDER:
            return cfg.reversePostorder(forward);
        case PROGRAM_ORDER:
            return cfg.getNodes();
        default:
            throw new RuntimeException("Unknown worklist order " + order);
        }
    }

    /**
     * Get the first node analyzed in the data-flow. For a forward analysis this is the entry node and for a backward
     * analysis this is the exit node.
     *
     * @param cfg
     *            control flow graph the data-flow is performed over
     * @return the node the boundary fact flows into
     */
    protected final CFGNode getInitialNode(ControlFlowGraph cfg) {
        return forward ? cfg.entry() : cfg.exit();
    }

    public final boolean isForward() {
        return forward;
    }

    /**
     * Set the level of output
     *
     * @param level
     *            level of the output, higher means more output
     */
    public void setOutputLevel(int level) {
        outputLevel = level;
    }

    /**
     * Set the order in which nodes are first put on the worklist
     *
     * @param order
     *            worklist order
     */
    public void setWorklistOrder(WorklistOrder order) {
        this.order = order;
    }

    public WorklistOrder getWorklistOrder() {
        return order;
    }

    /**
     * Register a listener for changes to facts, replacing any previous listener
     *
     * @param listener
     *            listener, null to remove the current one
     */
    public void setListener(DataFlowListener<F> listener) {
        this.listener = listener;
    }

    /**
     * Set the number of visits to a single node after which the analysis is considered to diverge
     *
     * @param maxVisitsPerNode
     *            positive bound
     */
    public void setMaxVisitsPerNode(int maxVisitsPerNode) {
        if (maxVisitsPerNode <= 0) {
            throw new IllegalArgumentException("Visit bound must be positive: " + maxVisitsPerNode);
        }
        this.maxVisitsPerNode = maxVisitsPerNode;
    }

    public int getMaxVisitsPerNode() {
        return maxVisitsPerNode;
    }
}
