package results;

import ir.cfg.CFGNode;
import ir.cfg.ControlFlowGraph;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

import analysis.pointer.PointsToResults;
import analysis.pointer.registrar.UnsupportedConstruct;

/**
 * Human readable report of the results for every procedure
 */
public class TextReport {

    private final ProgramResults results;

    public TextReport(ProgramResults results) {
        this.results = results;
    }

    /**
     * Write the report
     *
     * @param out
     *            writer to write to; will not be closed
     * @throws IOException
     *             writer issues
     */
    public void write(Writer out) throws IOException {
        out.write("Program (" + results.getProgram().getLanguage() + ")"
                + (results.getProgram().getSource() == null ? "" : " from " + results.getProgram().getSource()) + "\n");
        if (results.wasCancelled()) {
            out.write("Analysis was cancelled\n");
        }
        for (ProcedureResult r : results.getResults().values()) {
            out.write("\n");
            writeProcedure(r, out);
        }
        out.write("\n" + summary() + "\n");
        out.flush();
    }

    private void writeProcedure(ProcedureResult r, Writer out) throws IOException {
        out.write("=== " + r.getProcedureName() + " [" + r.getStatus() + "]\n");
        if (r.getMessage() != null) {
            out.write("  " + r.getMessage() + "\n");
        }
        ControlFlowGraph cfg = r.getControlFlowGraph();
        if (cfg == null) {
            return;
        }

        for (CFGNode n : cfg) {
            out.write("  " + n.getName());
            if (n.getStatement() != null) {
                out.write(": " + n.getStatement());
            }
            out.write(" -> " + names(cfg.getSuccs(n)) + "\n");
            if (r.getLiveVariables() != null) {
                out.write("      live in: " + r.getLiveVariables().getInFact(n) + " out: "
                        + r.getLiveVariables().getOutFact(n) + "\n");
            }
            if (r.getReachingDefinitions() != null) {
                out.write("      reaching in: " + r.getReachingDefinitions().getInFact(n) + " out: "
                        + r.getReachingDefinitions().getOutFact(n) + "\n");
            }
        }

        PointsToResults pts = r.getPointsTo();
        if (pts != null) {
            out.write("  points-to" + (pts.isApproximate() ? " (approximate)" : "") + ":\n");
            for (String v : pts.getVariables()) {
                out.write("    " + v + " -> " + pts.getPointsToSet(v) + " aliases " + pts.getAliases(v) + "\n");
            }
            for (UnsupportedConstruct u : pts.getUnsupportedConstructs()) {
                out.write("    unsupported " + u + "\n");
            }
        }
    }

    private static String names(List<CFGNode> nodes) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < nodes.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(nodes.get(i).getName());
        }
        return sb.append("]").toString();
    }

    /**
     * One line count of the procedures with each status
     */
    public String summary() {
        StringBuilder sb = new StringBuilder(results.getResults().size() + " procedures:");
        for (ProcedureStatus s : ProcedureStatus.values()) {
            sb.append(" " + s + "=" + results.getResults(s).size());
        }
        return sb.toString();
    }
}
