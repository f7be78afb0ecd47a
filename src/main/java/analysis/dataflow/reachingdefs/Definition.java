package analysis.dataflow.reachingdefs;

import ir.cfg.CFGNode;

/**
 * Assignment to a variable at a particular CFG node, printed as <code>variable@node</code>
 */
public final class Definition implements Comparable<Definition> {

    private final String variable;
    private final CFGNode node;

    public Definition(String variable, CFGNode node) {
        assert variable != null && node != null;
        this.variable = variable;
        this.node = node;
    }

    public String getVariable() {
        return variable;
    }

    /**
     * Node where the definition occurs
     */
    public CFGNode getNode() {
        return node;
    }

    @Override
    public int compareTo(Definition o) {
        int c = variable.compareTo(o.variable);
        return c != 0 ? c : node.compareTo(o.node);
    }

    @Override
    public int hashCode() {
        return 31 * variable.hashCode() + node.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Definition)) {
            return false;
        }
        Definition other = (Definition) obj;
        return node == other.node && variable.equals(other.variable);
    }

    @Override
    public String toString() {
        return variable + "@" + node.getNumber();
    }
}
