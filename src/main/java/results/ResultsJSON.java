package results;

import ir.Program;
import ir.cfg.CFGNode;
import ir.cfg.ControlFlowGraph;

import java.util.Collection;

import org.json.JSONArray;
import org.json.JSONObject;

import analysis.dataflow.DataFlowResult;
import analysis.dataflow.util.SetAbsVal;
import analysis.pointer.PointsToResults;
import analysis.pointer.registrar.UnsupportedConstruct;

/**
 * Conversion of analysis results to JSON
 */
public final class ResultsJSON {

    private ResultsJSON() {
        // static methods only
    }

    /**
     * Serialize the results for a whole program
     *
     * @param results
     *            results to serialize
     * @return {@link JSONObject} containing the serialized form
     */
    public static JSONObject programToJSON(ProgramResults results) {
        Program p = results.getProgram();
        JSONObject json = new JSONObject();
        json.put("language", p.getLanguage());
        json.put("source", p.getSource() == null ? JSONObject.NULL : p.getSource());
        json.put("cancelled", results.wasCancelled());
        JSONArray procs = new JSONArray();
        for (ProcedureResult r : results.getResults().values()) {
            procs.put(procedureToJSON(r));
        }
        json.put("procedures", procs);
        return json;
    }

    /**
     * Serialize the results for one procedure. Nodes carry the facts of every analysis that was run.
     *
     * @param r
     *            results to serialize
     * @return {@link JSONObject} containing the serialized form
     */
    public static JSONObject procedureToJSON(ProcedureResult r) {
        JSONObject json = new JSONObject();
        json.put("name", r.getProcedureName());
        json.put("status", r.getStatus().name());
        if (r.getMessage() != null) {
            json.put("message", r.getMessage());
        }
        ControlFlowGraph cfg = r.getControlFlowGraph();
        if (cfg == null) {
            return json;
        }

        JSONArray nodes = new JSONArray();
        for (CFGNode n : cfg) {
            JSONObject node = new JSONObject();
            node.put("id", n.getNumber());
            node.put("name", n.getName());
            if (n.getStatement() != null) {
                node.put("text", n.getStatement().getText());
            }
            JSONArray succs = new JSONArray();
            for (CFGNode s : cfg.getSuccs(n)) {
                succs.put(s.getNumber());
            }
            node.put("succs", succs);
            if (r.getLiveVariables() != null) {
                node.put("live", factsToJSON(r.getLiveVariables(), n));
            }
            if (r.getReachingDefinitions() != null) {
                node.put("reaching", factsToJSON(r.getReachingDefinitions(), n));
            }
            nodes.put(node);
        }
        json.put("nodes", nodes);

        if (r.getPointsTo() != null) {
            json.put("pointsTo", pointsToJSON(r.getPointsTo()));
        }
        return json;
    }

    private static <E extends Comparable<? super E>> JSONObject factsToJSON(DataFlowResult<SetAbsVal<E>> result,
                                                                             CFGNode n) {
        JSONObject json = new JSONObject();
        json.put("in", toStrings(result.getInFact(n).getElements()));
        json.put("out", toStrings(result.getOutFact(n).getElements()));
        return json;
    }

    /**
     * Serialize points-to results
     *
     * @param pts
     *            points-to results for one procedure
     * @return {@link JSONObject} containing the serialized form
     */
    public static JSONObject pointsToJSON(PointsToResults pts) {
        JSONObject json = new JSONObject();
        json.put("approximate", pts.isApproximate());
        JSONObject vars = new JSONObject();
        for (String v : pts.getVariables()) {
            JSONObject var = new JSONObject();
            var.put("pointsTo", toStrings(pts.getPointsToSet(v)));
            var.put("aliases", toStrings(pts.getAliases(v)));
            vars.put(v, var);
        }
        json.put("variables", vars);
        JSONArray unsupported = new JSONArray();
        for (UnsupportedConstruct u : pts.getUnsupportedConstructs()) {
            JSONObject uc = new JSONObject();
            uc.put("node", u.getNode().getNumber());
            uc.put("text", u.getNode().getStatement().getText());
            uc.put("reason", u.getReason());
            unsupported.put(uc);
        }
        json.put("unsupported", unsupported);
        return json;
    }

    private static JSONArray toStrings(Collection<?> c) {
        JSONArray a = new JSONArray();
        for (Object o : c) {
            a.put(o.toString());
        }
        return a;
    }
}
