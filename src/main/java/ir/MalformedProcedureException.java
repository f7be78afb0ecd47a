package ir;

/**
 * Structural defect in a procedure, e.g. a jump to a label that does not exist. Fatal for the procedure, but not for
 * other procedures analyzed in the same run.
 */
public class MalformedProcedureException extends Exception {

    private static final long serialVersionUID = -4151298263520387313L;

    /**
     * Name of the procedure (null if the procedure could not be identified)
     */
    private final String procedureName;

    /**
     * Create an exception for a defect in the given procedure
     *
     * @param procedureName
     *            name of the procedure, null if unknown
     * @param message
     *            description of the defect
     */
    public MalformedProcedureException(String procedureName, String message) {
        super(procedureName == null ? message : procedureName + ": " + message);
        this.procedureName = procedureName;
    }

    /**
     * Create an exception for a defect in the given procedure
     *
     * @param procedureName
     *            name of the procedure, null if unknown
     * @param message
     *            description of the defect
     * @param cause
     *            underlying problem
     */
    public MalformedProcedureException(String procedureName, String message, Throwable cause) {
        super(procedureName == null ? message : procedureName + ": " + message, cause);
        this.procedureName = procedureName;
    }

    /**
     * Name of the malformed procedure
     *
     * @return procedure name, null if unknown
     */
    public String getProcedureName() {
        return procedureName;
    }
}
