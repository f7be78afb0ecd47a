package ir;

import ir.cfg.CFGBuilder;
import ir.cfg.ControlFlowGraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Named, ordered sequence of statements. The procedure owns its control flow graph, which is built the first time
 * it is requested.
 */
public final class Procedure {

    private final String name;
    private final List<Statement> statements;
    /**
     * Lazily built CFG
     */
    private ControlFlowGraph cfg;

    /**
     * Create a procedure
     *
     * @param name
     *            unique name of the procedure within its program
     * @param statements
     *            statements in program order
     */
    public Procedure(String name, List<Statement> statements) {
        if (name == null) {
            throw new IllegalArgumentException("Procedure needs a name");
        }
        this.name = name;
        this.statements = Collections.unmodifiableList(new ArrayList<>(statements));
    }

    public String getName() {
        return name;
    }

    /**
     * Statements in program order, the statement at index i is numbered i+1 in the CFG
     *
     * @return unmodifiable list of statements
     */
    public List<Statement> getStatements() {
        return statements;
    }

    /**
     * Get the control flow graph, building it if necessary
     *
     * @return control flow graph for this procedure
     * @throws MalformedProcedureException
     *             if the statements do not describe valid control flow
     */
    public synchronized ControlFlowGraph getControlFlowGraph() throws MalformedProcedureException {
        if (cfg == null) {
            cfg = CFGBuilder.build(this);
        }
        return cfg;
    }

    @Override
    public String toString() {
        return name;
    }
}
