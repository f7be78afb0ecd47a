package analysis.pointer.statements;

import ir.cfg.CFGNode;
import analysis.pointer.graph.AllocSiteNode;
import analysis.pointer.graph.LocalNode;
import analysis.pointer.graph.ObjectField;
import analysis.pointer.graph.PointsToGraph;

/**
 * Points-to statement for a field access assigned to a local, l = o.f
 */
public class FieldToLocalStatement implements PointsToStatement {

    /**
     * Field being accessed
     */
    private final String field;
    /**
     * receiver of field access
     */
    private final LocalNode receiver;
    /**
     * local assigned into
     */
    private final LocalNode assignee;
    private final CFGNode node;

    /**
     * Statement for a field access assigned to a local, l = o.f
     *
     * @param l
     *            points-to graph node for local assigned into
     * @param o
     *            points-to graph node for receiver of field access
     * @param f
     *            field accessed
     * @param node
     *            CFG node of the access
     */
    public FieldToLocalStatement(LocalNode l, LocalNode o, String f, CFGNode node) {
        this.assignee = l;
        this.receiver = o;
        this.field = f;
        this.node = node;
    }

    @Override
    public boolean process(PointsToGraph g) {
        boolean changed = false;
        for (AllocSiteNode recHeapContext : g.getPointsToSet(receiver)) {
            ObjectField f = new ObjectField(recHeapContext, field);
            changed |= g.addEdges(assignee, g.getPointsToSet(f));
        }
        return changed;
    }

    @Override
    public CFGNode getNode() {
        return node;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + assignee.hashCode();
        result = prime * result + field.hashCode();
        result = prime * result + receiver.hashCode();
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        FieldToLocalStatement other = (FieldToLocalStatement) obj;
        return assignee.equals(other.assignee) && field.equals(other.field) && receiver.equals(other.receiver)
                && node == other.node;
    }

    @Override
    public String toString() {
        return assignee + " = " + receiver + "." + field;
    }
}
