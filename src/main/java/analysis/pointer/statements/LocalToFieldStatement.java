package analysis.pointer.statements;

import ir.cfg.CFGNode;

import java.util.Set;

import analysis.pointer.graph.AllocSiteNode;
import analysis.pointer.graph.LocalNode;
import analysis.pointer.graph.ObjectField;
import analysis.pointer.graph.PointsToGraph;

/**
 * Points-to statement for an assignment into a field, o.f = v
 */
public class LocalToFieldStatement implements PointsToStatement {
    /**
     * Field assigned into
     */
    private final String field;
    /**
     * receiver for field access
     */
    private final LocalNode receiver;
    /**
     * Value assigned into field
     */
    private final LocalNode assigned;
    private final CFGNode node;

    /**
     * Statement for an assignment into a field
     *
     * @param o
     *            points-to graph node for receiver of field access
     * @param f
     *            field assigned to
     * @param v
     *            points-to graph node for value assigned
     * @param node
     *            CFG node of the store
     */
    public LocalToFieldStatement(LocalNode o, String f, LocalNode v, CFGNode node) {
        this.field = f;
        this.receiver = o;
        this.assigned = v;
        this.node = node;
    }

    @Override
    public boolean process(PointsToGraph g) {
        Set<AllocSiteNode> localHeapContexts = g.getPointsToSet(assigned);

        boolean changed = false;
        for (AllocSiteNode recHeapContext : g.getPointsToSet(receiver)) {
            ObjectField f = new ObjectField(recHeapContext, field);
            changed |= g.addEdges(f, localHeapContexts);
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
        result = prime * result + assigned.hashCode();
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
        LocalToFieldStatement other = (LocalToFieldStatement) obj;
        return assigned.equals(other.assigned) && field.equals(other.field) && receiver.equals(other.receiver)
                && node == other.node;
    }

    @Override
    public String toString() {
        return receiver + "." + field + " = " + assigned;
    }
}
