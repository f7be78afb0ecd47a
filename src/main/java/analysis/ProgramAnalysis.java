package analysis;

import ir.MalformedProcedureException;
import ir.Procedure;
import ir.Program;
import ir.cfg.ControlFlowGraph;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import results.ProcedureResult;
import results.ProgramResults;
import util.Logger;
import analysis.dataflow.DataFlow;
import analysis.dataflow.DataFlowResult;
import analysis.dataflow.live.LiveVariableDataFlow;
import analysis.dataflow.reachingdefs.Definition;
import analysis.dataflow.reachingdefs.ReachingDefinitionsDataFlow;
import analysis.dataflow.util.SetAbsVal;
import analysis.pointer.PointsToResults;
import analysis.pointer.engine.PointsToAnalysisSingleThreaded;
import analysis.pointer.graph.PointsToGraph;
import analysis.pointer.registrar.StatementRegistrar;

/**
 * Runs the configured analyses over every procedure of a program. Procedures are independent and are analyzed in
 * parallel on a fixed pool of threads. A failure in one procedure is recorded in its result and never stops the
 * others.
 * <p>
 * The run can be cancelled from any thread with {@link #cancel()}. Each procedure's result is computed completely
 * and then committed atomically; once the run is cancelled no procedure is started and no result is committed.
 */
public class ProgramAnalysis {

    private final AnalysisConfiguration config;
    /**
     * Guards committed and cancelled
     */
    private final Object commitLock = new Object();
    private final Map<String, ProcedureResult> committed = new LinkedHashMap<>();
    private volatile boolean cancelled = false;
    private ProcedureListener listener;

    public ProgramAnalysis(AnalysisConfiguration config) {
        this.config = config;
    }

    /**
     * Set a listener called after each commit, replacing any existing one
     *
     * @param listener
     *            listener, null to remove the current one
     */
    public void setListener(ProcedureListener listener) {
        this.listener = listener;
    }

    /**
     * Stop the run. Procedures that are being analyzed finish, but their results are dropped.
     */
    public void cancel() {
        synchronized (commitLock) {
            cancelled = true;
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Analyze every procedure of the program. An analysis object is meant for a single run.
     *
     * @param program
     *            program to analyze
     * @return results for every procedure, procedures without a committed result are marked not analyzed
     */
    public ProgramResults run(Program program) {
        if (config.getOutputLevel() >= 1) {
            System.err.println("Analyzing " + program.getProcedures().size() + " procedures with " + config);
        }
        ExecutorService exec = Executors.newFixedThreadPool(config.getNumThreads());
        for (final Procedure p : program.getProcedures()) {
            exec.execute(new Runnable() {
                @Override
                public void run() {
                    analyzeAndCommit(p);
                }
            });
        }
        shutdownAndAwaitTermination(exec);

        synchronized (commitLock) {
            return new ProgramResults(program, committed, cancelled);
        }
    }

    /**
     * Wait for the pool to finish. If this thread is interrupted the run is cancelled.
     */
    private void shutdownAndAwaitTermination(ExecutorService exec) {
        exec.shutdown();
        boolean finished = false;
        // keep waiting until all the outstanding tasks are done
        do {
            try {
                finished = exec.awaitTermination(Long.MAX_VALUE, TimeUnit.HOURS);
            }
            catch (InterruptedException e) {
                // running tasks can no longer commit once cancelled
                cancel();
                exec.shutdownNow();
                Thread.currentThread().interrupt();
                finished = true;
            }
        } while (!finished);
    }

    private void analyzeAndCommit(Procedure p) {
        if (cancelled) {
            return;
        }
        ProcedureResult r;
        try {
            r = analyze(p);
        }
        catch (Error e) {
            // a procedure without a result reads as cancelled
            Logger.println("Analysis of " + p.getName() + " failed: " + e);
            commit(p, ProcedureResult.failed(p.getName(), e.toString()));
            throw e;
        }
        commit(p, r);
    }

    /**
     * Record the result for a procedure unless the run has been cancelled
     */
    private void commit(Procedure p, ProcedureResult r) {
        synchronized (commitLock) {
            if (cancelled) {
                if (config.getOutputLevel() >= 2) {
                    Logger.println("Dropping result for " + p.getName() + ", run was cancelled");
                }
                return;
            }
            committed.put(p.getName(), r);
            if (listener != null) {
                listener.procedureCommitted(r);
            }
        }
    }

    /**
     * Run the configured analyses on one procedure
     *
     * @param p
     *            procedure to analyze
     * @return result, with status FAILED if the procedure is malformed or an analysis threw an exception
     */
    public ProcedureResult analyze(Procedure p) {
        long start = System.currentTimeMillis();
        try {
            ControlFlowGraph cfg = p.getControlFlowGraph();

            DataFlowResult<SetAbsVal<String>> live = null;
            if (config.shouldRun(AnalysisKind.LIVE)) {
                live = configure(new LiveVariableDataFlow()).dataflow(cfg);
            }

            DataFlowResult<SetAbsVal<Definition>> reaching = null;
            if (config.shouldRun(AnalysisKind.REACHING)) {
                reaching = configure(new ReachingDefinitionsDataFlow()).dataflow(cfg);
            }

            PointsToResults pointsTo = null;
            if (config.shouldRun(AnalysisKind.POINTER)) {
                StatementRegistrar registrar = new StatementRegistrar(cfg);
                PointsToAnalysisSingleThreaded engine = new PointsToAnalysisSingleThreaded();
                engine.setOutputLevel(config.getOutputLevel());
                engine.setParanoidMode(config.isParanoidPointerAnalysis());
                PointsToGraph g = engine.solve(registrar);
                pointsTo = new PointsToResults(registrar, g);
            }

            ProcedureResult r = ProcedureResult.analyzed(cfg, live, reaching, pointsTo);
            if (config.getOutputLevel() >= 1) {
                Logger.println("Analyzed " + p.getName() + " in " + (System.currentTimeMillis() - start) + "ms: "
                        + r.getStatus());
            }
            return r;
        }
        catch (MalformedProcedureException e) {
            if (config.getOutputLevel() >= 1) {
                Logger.println("Malformed procedure " + e.getMessage());
            }
            return ProcedureResult.failed(p.getName(), e.getMessage());
        }
        catch (RuntimeException e) {
            Logger.println("Analysis of " + p.getName() + " failed: " + e);
            if (config.getOutputLevel() >= 2) {
                e.printStackTrace();
            }
            return ProcedureResult.failed(p.getName(), e.toString());
        }
    }

    private <F extends DataFlow<?>> F configure(F df) {
        df.setOutputLevel(config.getOutputLevel());
        df.setWorklistOrder(config.getWorklistOrder());
        df.setMaxVisitsPerNode(config.getMaxVisitsPerNode());
        return df;
    }
}
