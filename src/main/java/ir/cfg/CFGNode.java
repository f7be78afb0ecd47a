package ir.cfg;

import ir.Statement;

import java.util.Collections;
import java.util.Set;

/**
 * Node in a control flow graph. Either wraps one statement or is the synthetic entry or exit node. Nodes are owned by
 * their {@link ControlFlowGraph}; edges are only available through the graph.
 * <p>
 * Equality is identity, two graphs built from the same procedure do not share nodes.
 */
public final class CFGNode implements Comparable<CFGNode> {

    /**
     * Role of a node in the graph
     */
    public enum Type {
        ENTRY, STATEMENT, EXIT
    }

    /**
     * Position in the graph: 0 for the entry, i for the i-th statement and n+1 for the exit
     */
    private final int number;
    private final Type type;
    /**
     * null for entry and exit
     */
    private final Statement statement;

    CFGNode(int number, Type type, Statement statement) {
        assert (type == Type.STATEMENT) == (statement != null);
        this.number = number;
        this.type = type;
        this.statement = statement;
    }

    public int getNumber() {
        return number;
    }

    public boolean isEntry() {
        return type == Type.ENTRY;
    }

    public boolean isExit() {
        return type == Type.EXIT;
    }

    /**
     * Statement for this node
     *
     * @return the statement, null for the entry and exit nodes
     */
    public Statement getStatement() {
        return statement;
    }

    /**
     * Variables defined by this node, empty for the entry and exit nodes
     */
    public Set<String> getDefs() {
        return statement == null ? Collections.<String> emptySet() : statement.getDefs();
    }

    /**
     * Variables used by this node, empty for the entry and exit nodes
     */
    public Set<String> getUses() {
        return statement == null ? Collections.<String> emptySet() : statement.getUses();
    }

    /**
     * Short printable name, e.g. "n3", "ENTRY" or "EXIT"
     */
    public String getName() {
        switch (type) {
        case ENTRY:
            return "ENTRY";
        case EXIT:
            return "EXIT";
        default:
            return "n" + number;
        }
    }

    @Override
    public int compareTo(CFGNode o) {
        return Integer.compare(number, o.number);
    }

    @Override
    public String toString() {
        return statement == null ? getName() : getName() + ": " + statement;
    }
}
