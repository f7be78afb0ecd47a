package analysis;

import results.ProcedureResult;

/**
 * Notified each time the result for a procedure is committed. Called while the commit lock is held, so the
 * implementation should be quick; it may call {@link ProgramAnalysis#cancel()}.
 */
public interface ProcedureListener {

    void procedureCommitted(ProcedureResult result);
}
