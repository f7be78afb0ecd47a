package analysis.pointer.engine;

import analysis.pointer.graph.PointsToGraph;
import analysis.pointer.registrar.StatementRegistrar;

/**
 * Points-to analysis engine
 */
public abstract class PointsToAnalysis {

    /**
     * Print diagnostic information at or above this level
     */
    protected int outputLevel = 0;
    /**
     * If true then re-process every statement once the engine is done and make sure nothing changes
     */
    protected boolean paranoidMode = false;

    /**
     * Compute the points-to graph for the statements in the registrar
     *
     * @param registrar
     *            points-to statements for one procedure
     * @return points-to graph at the fixed point
     */
    public abstract PointsToGraph solve(StatementRegistrar registrar);

    public void setOutputLevel(int outputLevel) {
        this.outputLevel = outputLevel;
    }

    public void setParanoidMode(boolean paranoidMode) {
        this.paranoidMode = paranoidMode;
    }
}
