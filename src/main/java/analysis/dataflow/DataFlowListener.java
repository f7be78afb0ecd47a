package analysis.dataflow;

import ir.cfg.CFGNode;

/**
 * Receives a callback every time the solver replaces the stored output fact of a node
 *
 * @param <F>
 *            type of data-flow facts
 */
public interface DataFlowListener<F> {

    /**
     * The data-flow output of <code>node</code> changed
     *
     * @param node
     *            node whose fact changed
     * @param previous
     *            previous data-flow output of the node
     * @param current
     *            new data-flow output of the node
     */
    void factChanged(CFGNode node, F previous, F current);
}
