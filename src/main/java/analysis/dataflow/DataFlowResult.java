package analysis.dataflow;

import ir.cfg.CFGNode;
import ir.cfg.ControlFlowGraph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stable facts computed by a data-flow analysis for every node of a control flow graph. Facts are stated in program
 * order whatever the direction of the analysis: the in-fact holds immediately before the node executes and the
 * out-fact immediately after it. Immutable.
 *
 * @param <F>
 *            type of data-flow facts
 */
public final class DataFlowResult<F> {

    private final ControlFlowGraph cfg;
    private final boolean forward;
    private final Map<CFGNode, F> in;
    private final Map<CFGNode, F> out;
    /**
     * Number of times the solver applied a transfer function
     */
    private final int visits;

    DataFlowResult(ControlFlowGraph cfg, boolean forward, Map<CFGNode, F> in, Map<CFGNode, F> out, int visits) {
        this.cfg = cfg;
        this.forward = forward;
        this.in = Collections.unmodifiableMap(new LinkedHashMap<>(in));
        this.out = Collections.unmodifiableMap(new LinkedHashMap<>(out));
        this.visits = visits;
    }

    /**
     * Fact holding immediately before the given node
     *
     * @param n
     *            node in the analyzed graph
     * @return data-flow fact
     */
    public F getInFact(CFGNode n) {
        F f = in.get(n);
        assert f != null : "No fact for " + n + " in " + cfg.getProcedureName();
        return f;
    }

    /**
     * Fact holding immediately after the given node
     *
     * @param n
     *            node in the analyzed graph
     * @return data-flow fact
     */
    public F getOutFact(CFGNode n) {
        F f = out.get(n);
        assert f != null : "No fact for " + n + " in " + cfg.getProcedureName();
        return f;
    }

    /**
     * Fact the solver propagates out of the node: the out-fact for a forward analysis and the in-fact for a backward
     * one
     */
    F getFlowOutput(CFGNode n) {
        return forward ? getOutFact(n) : getInFact(n);
    }

    public ControlFlowGraph getControlFlowGraph() {
        return cfg;
    }

    public boolean isForward() {
        return forward;
    }

    /**
     * Number of node visits (transfer function applications) it took to reach the fixed point
     */
    public int getVisits() {
        return visits;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (CFGNode n : cfg) {
            sb.append(n.getName() + "\tin: " + in.get(n) + "\tout: " + out.get(n) + "\n");
        }
        return sb.toString();
    }
}
