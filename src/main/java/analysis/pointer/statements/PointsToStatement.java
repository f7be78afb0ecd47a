package analysis.pointer.statements;

import ir.cfg.CFGNode;
import analysis.pointer.graph.PointsToGraph;

/**
 * Defines how to process points-to graph information for a particular statement
 */
public interface PointsToStatement {

    /**
     * Process this statement, modifying the points-to graph if necessary
     *
     * @param g
     *            points-to graph (may be modified)
     * @return true if the points-to graph was modified
     */
    boolean process(PointsToGraph g);

    /**
     * CFG node of the statement this constraint was generated for
     *
     * @return CFG node
     */
    CFGNode getNode();

    @Override
    public boolean equals(Object obj);

    @Override
    public int hashCode();
}
