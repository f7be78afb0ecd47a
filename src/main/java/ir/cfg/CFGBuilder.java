package ir.cfg;

import ir.ControlKind;
import ir.MalformedProcedureException;
import ir.Procedure;
import ir.Statement;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.ibm.wala.util.graph.NumberedGraph;
import com.ibm.wala.util.graph.impl.SlowSparseNumberedGraph;

/**
 * Builds the control flow graph for a procedure from the control kinds, labels and jump targets of its statements
 */
public final class CFGBuilder {

    private CFGBuilder() {
        // static methods only
    }

    /**
     * Build the control flow graph for the given procedure
     *
     * @param p
     *            procedure to build the graph for
     * @return new control flow graph
     * @throws MalformedProcedureException
     *             if a jump refers to an undefined label, a label is defined twice, or a statement has the wrong
     *             number of targets for its kind
     */
    public static ControlFlowGraph build(Procedure p) throws MalformedProcedureException {
        List<Statement> statements = p.getStatements();
        int n = statements.size();

        List<CFGNode> nodes = new ArrayList<>(n + 2);
        nodes.add(new CFGNode(0, CFGNode.Type.ENTRY, null));
        Map<String, CFGNode> labels = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            Statement s = statements.get(i);
            if (s == null) {
                throw new MalformedProcedureException(p.getName(), "null statement at position " + (i + 1));
            }
            CFGNode node = new CFGNode(i + 1, CFGNode.Type.STATEMENT, s);
            nodes.add(node);
            if (s.getLabel() != null) {
                CFGNode previous = labels.put(s.getLabel(), node);
                if (previous != null) {
                    throw new MalformedProcedureException(p.getName(), "label " + s.getLabel() + " defined at both "
                            + previous.getName() + " and " + node.getName());
                }
            }
        }
        CFGNode exit = new CFGNode(n + 1, CFGNode.Type.EXIT, null);
        nodes.add(exit);

        NumberedGraph<CFGNode> g = SlowSparseNumberedGraph.make();
        for (CFGNode node : nodes) {
            g.addNode(node);
        }

        addEdge(g, nodes.get(0), nodes.get(1));
        for (int i = 1; i <= n; i++) {
            CFGNode current = nodes.get(i);
            Statement s = current.getStatement();
            checkTargetCount(p, current);

            for (String target : s.getTargets()) {
                CFGNode targetNode = labels.get(target);
                if (targetNode == null) {
                    throw new MalformedProcedureException(p.getName(), current.getName() + " (" + s.getText()
                            + ") jumps to undefined label " + target);
                }
                addEdge(g, current, targetNode);
            }

            if (s.getKind().fallsThrough()) {
                addEdge(g, current, nodes.get(i + 1));
            }
            else if (s.getKind() == ControlKind.RETURN) {
                addEdge(g, current, exit);
            }
        }
        return new ControlFlowGraph(p.getName(), nodes, g);
    }

    /**
     * Make sure the statement has a number of targets consistent with its kind
     */
    private static void checkTargetCount(Procedure p, CFGNode node) throws MalformedProcedureException {
        Statement s = node.getStatement();
        int targets = s.getTargets().size();
        switch (s.getKind()) {
        case GOTO:
            if (targets != 1) {
                throw new MalformedProcedureException(p.getName(), node.getName() + " is a goto with " + targets
                        + " targets");
            }
            break;
        case BRANCH:
        case SWITCH:
            if (targets == 0) {
                throw new MalformedProcedureException(p.getName(), node.getName() + " is a " + s.getKind()
                        + " without targets");
            }
            break;
        case NORMAL:
        case RETURN:
            if (targets != 0) {
                throw new MalformedProcedureException(p.getName(), node.getName() + " is a " + s.getKind()
                        + " statement with jump targets " + s.getTargets());
            }
            break;
        default:
            throw new RuntimeException("Unhandled control kind " + s.getKind());
        }
    }

    private static void addEdge(NumberedGraph<CFGNode> g, CFGNode source, CFGNode target) {
        if (!g.hasEdge(source, target)) {
            g.addEdge(source, target);
        }
    }
}
