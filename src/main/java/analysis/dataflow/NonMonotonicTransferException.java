package analysis.dataflow;

import ir.cfg.CFGNode;

/**
 * Thrown when a data-flow analysis breaks the lattice contract: a transfer function made a fact smaller, or the
 * solver kept revisiting a node without stabilizing. This is a bug in the analysis definition, not in the analyzed
 * code.
 */
public class NonMonotonicTransferException extends RuntimeException {

    private static final long serialVersionUID = 2406474617330916271L;

    /**
     * Node where the violation was observed
     */
    private final transient CFGNode node;

    public NonMonotonicTransferException(String message, CFGNode node) {
        super(message);
        this.node = node;
    }

    /**
     * Node where the violation was observed
     *
     * @return CFG node
     */
    public CFGNode getNode() {
        return node;
    }
}
