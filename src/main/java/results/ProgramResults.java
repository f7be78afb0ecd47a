package results;

import ir.Procedure;
import ir.Program;

import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.json.JSONException;
import org.json.JSONObject;

/**
 * Read-only results for every procedure of a program, in program order
 */
public final class ProgramResults implements JSONSerializable {

    private final Program program;
    private final Map<String, ProcedureResult> results;
    private final boolean cancelled;

    /**
     * Collect the committed results, any procedure without one is marked as not analyzed
     *
     * @param program
     *            program that was analyzed
     * @param committed
     *            committed results keyed by procedure name
     * @param cancelled
     *            whether the run was cancelled
     */
    public ProgramResults(Program program, Map<String, ProcedureResult> committed, boolean cancelled) {
        this.program = program;
        this.cancelled = cancelled;
        Map<String, ProcedureResult> m = new LinkedHashMap<>();
        for (Procedure p : program.getProcedures()) {
            ProcedureResult r = committed.get(p.getName());
            m.put(p.getName(), r == null ? ProcedureResult.notAnalyzed(p.getName()) : r);
        }
        this.results = Collections.unmodifiableMap(m);
    }

    public Program getProgram() {
        return program;
    }

    /**
     * @return results keyed by procedure name in program order
     */
    public Map<String, ProcedureResult> getResults() {
        return results;
    }

    public ProcedureResult getResult(String procedureName) {
        return results.get(procedureName);
    }

    public boolean wasCancelled() {
        return cancelled;
    }

    /**
     * Results with the given status in program order
     */
    public List<ProcedureResult> getResults(ProcedureStatus status) {
        List<ProcedureResult> l = new ArrayList<>();
        for (ProcedureResult r : results.values()) {
            if (r.getStatus() == status) {
                l.add(r);
            }
        }
        return l;
    }

    /**
     * @return true if some procedure failed
     */
    public boolean hasFailures() {
        return !getResults(ProcedureStatus.FAILED).isEmpty();
    }

    @Override
    public JSONObject toJSON() {
        return ResultsJSON.programToJSON(this);
    }

    @Override
    public void writeJSON(Writer out) throws JSONException {
        toJSON().write(out);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (ProcedureResult r : results.values()) {
            sb.append(r + "\n");
        }
        return sb.toString();
    }
}
