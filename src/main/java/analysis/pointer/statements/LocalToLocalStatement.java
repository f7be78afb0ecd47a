package analysis.pointer.statements;

import ir.cfg.CFGNode;
import analysis.pointer.graph.LocalNode;
import analysis.pointer.graph.PointsToGraph;

/**
 * Points-to statement for a local assignment, left = right
 */
public class LocalToLocalStatement implements PointsToStatement {

    private final LocalNode left;
    private final LocalNode right;
    private final CFGNode node;

    /**
     * Statement for a local assignment, left = right
     *
     * @param left
     *            points-to graph node for the assignee
     * @param right
     *            points-to graph node for the assigned value
     * @param node
     *            CFG node of the assignment
     */
    public LocalToLocalStatement(LocalNode left, LocalNode right, CFGNode node) {
        this.left = left;
        this.right = right;
        this.node = node;
    }

    @Override
    public boolean process(PointsToGraph g) {
        return g.addEdges(left, g.getPointsToSet(right));
    }

    @Override
    public CFGNode getNode() {
        return node;
    }

    @Override
    public int hashCode() {
        return 31 * left.hashCode() + right.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        LocalToLocalStatement other = (LocalToLocalStatement) obj;
        return left.equals(other.left) && right.equals(other.right) && node == other.node;
    }

    @Override
    public String toString() {
        return left + " = " + right;
    }
}
