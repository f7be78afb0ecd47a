package analysis.pointer.registrar;

import ir.PointerOperation;
import ir.cfg.CFGNode;
import ir.cfg.ControlFlowGraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import analysis.pointer.graph.AllocSiteNode;
import analysis.pointer.graph.LocalNode;
import analysis.pointer.statements.FieldToLocalStatement;
import analysis.pointer.statements.LocalToFieldStatement;
import analysis.pointer.statements.LocalToLocalStatement;
import analysis.pointer.statements.NewStatement;
import analysis.pointer.statements.PointsToStatement;

/**
 * This class manages the registration of points-to graph statements for one procedure, which are then processed by
 * the pointer analysis
 */
public class StatementRegistrar {

    /**
     * Points-to graph nodes for local variables
     */
    private final Map<String, LocalNode> locals = new LinkedHashMap<>();
    /**
     * Allocation sites by identifier
     */
    private final Map<String, AllocSiteNode> allocSites = new LinkedHashMap<>();
    /**
     * Set of all points-to statements
     */
    private final Set<PointsToStatement> statements = new LinkedHashSet<>();
    /**
     * Statements whose effect is not modeled
     */
    private final List<UnsupportedConstruct> unsupported = new ArrayList<>();
    /**
     * Name of the procedure the statements were generated for
     */
    private final String procedureName;

    /**
     * Create a registrar and register the pointer operations of every node of the given graph
     *
     * @param cfg
     *            control flow graph of the procedure
     */
    public StatementRegistrar(ControlFlowGraph cfg) {
        this.procedureName = cfg.getProcedureName();
        for (CFGNode n : cfg) {
            if (n.getStatement() != null && n.getStatement().getPointerOperation() != null) {
                registerOperation(n.getStatement().getPointerOperation(), n);
            }
        }
    }

    /**
     * Translate a pointer operation into points-to statements
     *
     * @param op
     *            operation to register
     * @param n
     *            node the operation occurs at
     */
    private void registerOperation(PointerOperation op, CFGNode n) {
        switch (op.getKind()) {
        case NEW:
            if (op.getTarget() == null) {
                recordUnsupported(n, "allocation without a target variable");
                return;
            }
            registerAllocation(op, n);
            return;
        case COPY:
            if (op.getTarget() == null || op.getSource() == null) {
                recordUnsupported(n, "copy missing an operand");
                return;
            }
            addStatement(new LocalToLocalStatement(getLocal(op.getTarget()), getLocal(op.getSource()), n));
            return;
        case LOAD:
            if (op.getTarget() == null || op.getSource() == null || op.getField() == null) {
                recordUnsupported(n, "field load missing an operand");
                return;
            }
            addStatement(new FieldToLocalStatement(getLocal(op.getTarget()), getLocal(op.getSource()), op.getField(),
                                                   n));
            return;
        case STORE:
            if (op.getTarget() == null || op.getSource() == null || op.getField() == null) {
                recordUnsupported(n, "field store missing an operand");
                return;
            }
            addStatement(new LocalToFieldStatement(getLocal(op.getTarget()), op.getField(), getLocal(op.getSource()),
                                                   n));
            return;
        case NULL:
            // null points to nothing, just make sure the variable shows up in the results
            if (op.getTarget() != null) {
                getLocal(op.getTarget());
            }
            return;
        case UNSUPPORTED:
            recordUnsupported(n, op.getDetail());
            return;
        }
        throw new RuntimeException("Unhandled pointer operation " + op.getKind());
    }

    private void registerAllocation(PointerOperation op, CFGNode n) {
        String id = op.getDetail() == null ? "s" + n.getNumber() : op.getDetail();
        AllocSiteNode site = allocSites.get(id);
        if (site == null) {
            site = new AllocSiteNode(id, n.getNumber(), n.getStatement().getText());
            allocSites.put(id, site);
        }
        addStatement(new NewStatement(getLocal(op.getTarget()), site, n));
    }

    private void recordUnsupported(CFGNode n, String reason) {
        unsupported.add(new UnsupportedConstruct(n, reason));
    }

    private void addStatement(PointsToStatement s) {
        statements.add(s);
    }

    /**
     * Get the points-to graph node for the given variable, creating it if necessary
     *
     * @param name
     *            variable name
     * @return node for the variable
     */
    private LocalNode getLocal(String name) {
        LocalNode node = locals.get(name);
        if (node == null) {
            node = new LocalNode(name);
            locals.put(name, node);
        }
        return node;
    }

    /**
     * @return all registered points-to statements in registration order
     */
    public Set<PointsToStatement> getAllStatements() {
        return Collections.unmodifiableSet(statements);
    }

    /**
     * @return nodes for every variable mentioned by a pointer operation, in order of first mention
     */
    public Map<String, LocalNode> getLocals() {
        return Collections.unmodifiableMap(locals);
    }

    /**
     * @return allocation sites by identifier
     */
    public Map<String, AllocSiteNode> getAllocationSites() {
        return Collections.unmodifiableMap(allocSites);
    }

    /**
     * @return constructs whose effect was excluded, in program order
     */
    public List<UnsupportedConstruct> getUnsupportedConstructs() {
        return Collections.unmodifiableList(unsupported);
    }

    public String getProcedureName() {
        return procedureName;
    }
}
