package analysis.pointer.statements;

import ir.cfg.CFGNode;
import analysis.pointer.graph.AllocSiteNode;
import analysis.pointer.graph.LocalNode;
import analysis.pointer.graph.PointsToGraph;

/**
 * Points-to statement for an allocation, x = new
 */
public class NewStatement implements PointsToStatement {

    /**
     * Points-to node for the assignee
     */
    private final LocalNode result;
    /**
     * Abstract object created by the allocation
     */
    private final AllocSiteNode alloc;
    /**
     * Node of the allocating statement
     */
    private final CFGNode node;

    /**
     * Points-to graph statement for an allocation
     *
     * @param result
     *            points-to node for the variable assigned
     * @param alloc
     *            allocation site
     * @param node
     *            CFG node of the allocation
     */
    public NewStatement(LocalNode result, AllocSiteNode alloc, CFGNode node) {
        this.result = result;
        this.alloc = alloc;
        this.node = node;
    }

    @Override
    public boolean process(PointsToGraph g) {
        return g.addEdge(result, alloc);
    }

    @Override
    public CFGNode getNode() {
        return node;
    }

    public AllocSiteNode getAllocSite() {
        return alloc;
    }

    @Override
    public int hashCode() {
        return 31 * result.hashCode() + alloc.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        NewStatement other = (NewStatement) obj;
        return result.equals(other.result) && alloc.equals(other.alloc) && node == other.node;
    }

    @Override
    public String toString() {
        return result + " = new " + alloc;
    }
}
