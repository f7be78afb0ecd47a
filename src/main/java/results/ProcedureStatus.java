package results;

/**
 * Outcome of analyzing one procedure
 */
public enum ProcedureStatus {
    /**
     * Every requested analysis finished with exact results
     */
    SUCCESS,
    /**
     * Finished, but the points-to analysis excluded some unsupported construct
     */
    APPROXIMATE,
    /**
     * The procedure is malformed or an analysis failed
     */
    FAILED,
    /**
     * The run was cancelled before a result for the procedure was committed
     */
    NOT_ANALYZED;

    /**
     * @return true if there are analysis results for a procedure with this status
     */
    public boolean hasResults() {
        return this == SUCCESS || this == APPROXIMATE;
    }
}
