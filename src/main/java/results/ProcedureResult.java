package results;

import ir.cfg.ControlFlowGraph;

import java.io.Writer;

import org.json.JSONException;
import org.json.JSONObject;

import analysis.dataflow.DataFlowResult;
import analysis.dataflow.reachingdefs.Definition;
import analysis.dataflow.util.SetAbsVal;
import analysis.pointer.PointsToResults;

/**
 * Results of the requested analyses for one procedure. Analyses that were not requested have null results.
 */
public final class ProcedureResult implements JSONSerializable {

    private final String procedureName;
    private final ProcedureStatus status;
    /**
     * Reason for a failure, null otherwise
     */
    private final String message;
    private final ControlFlowGraph cfg;
    private final DataFlowResult<SetAbsVal<String>> liveVariables;
    private final DataFlowResult<SetAbsVal<Definition>> reachingDefinitions;
    private final PointsToResults pointsTo;

    private ProcedureResult(String procedureName, ProcedureStatus status, String message, ControlFlowGraph cfg,
                            DataFlowResult<SetAbsVal<String>> liveVariables,
                            DataFlowResult<SetAbsVal<Definition>> reachingDefinitions, PointsToResults pointsTo) {
        this.procedureName = procedureName;
        this.status = status;
        this.message = message;
        this.cfg = cfg;
        this.liveVariables = liveVariables;
        this.reachingDefinitions = reachingDefinitions;
        this.pointsTo = pointsTo;
    }

    /**
     * Results for a procedure whose analyses all finished. The status is approximate if the points-to results are.
     *
     * @param cfg
     *            control flow graph of the procedure
     * @param live
     *            live variables, null if not requested
     * @param reaching
     *            reaching definitions, null if not requested
     * @param pointsTo
     *            points-to results, null if not requested
     * @return result
     */
    public static ProcedureResult analyzed(ControlFlowGraph cfg, DataFlowResult<SetAbsVal<String>> live,
                                           DataFlowResult<SetAbsVal<Definition>> reaching, PointsToResults pointsTo) {
        ProcedureStatus s = pointsTo != null && pointsTo.isApproximate() ? ProcedureStatus.APPROXIMATE
                : ProcedureStatus.SUCCESS;
        return new ProcedureResult(cfg.getProcedureName(), s, null, cfg, live, reaching, pointsTo);
    }

    /**
     * Result for a procedure that could not be analyzed
     *
     * @param procedureName
     *            procedure name
     * @param message
     *            reason for the failure
     * @return result
     */
    public static ProcedureResult failed(String procedureName, String message) {
        return new ProcedureResult(procedureName, ProcedureStatus.FAILED, message, null, null, null, null);
    }

    /**
     * Marker for a procedure that was never analyzed because the run was cancelled
     */
    public static ProcedureResult notAnalyzed(String procedureName) {
        return new ProcedureResult(procedureName, ProcedureStatus.NOT_ANALYZED, null, null, null, null, null);
    }

    public String getProcedureName() {
        return procedureName;
    }

    public ProcedureStatus getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    /**
     * @return the control flow graph, null unless the status has results
     */
    public ControlFlowGraph getControlFlowGraph() {
        return cfg;
    }

    public DataFlowResult<SetAbsVal<String>> getLiveVariables() {
        return liveVariables;
    }

    public DataFlowResult<SetAbsVal<Definition>> getReachingDefinitions() {
        return reachingDefinitions;
    }

    public PointsToResults getPointsTo() {
        return pointsTo;
    }

    @Override
    public JSONObject toJSON() {
        return ResultsJSON.procedureToJSON(this);
    }

    @Override
    public void writeJSON(Writer out) throws JSONException {
        toJSON().write(out);
    }

    @Override
    public String toString() {
        return procedureName + ": " + status + (message == null ? "" : " (" + message + ")");
    }
}
