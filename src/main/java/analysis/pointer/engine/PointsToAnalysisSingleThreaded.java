package analysis.pointer.engine;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import util.Logger;
import util.WorkQueue;
import analysis.pointer.graph.PointsToGraph;
import analysis.pointer.graph.PointsToGraphNode;
import analysis.pointer.registrar.StatementRegistrar;
import analysis.pointer.statements.PointsToStatement;

/**
 * Single-threaded implementation of a points-to graph solver. Given a set of constraints, {@link PointsToStatement}s,
 * compute the fixed point.
 */
public class PointsToAnalysisSingleThreaded extends PointsToAnalysis {

    /**
     * Number of statements processed by the last call to solve
     */
    private int processed;

    @Override
    public PointsToGraph solve(StatementRegistrar registrar) {
        return solveSmarter(registrar);
    }

    /**
     * Generate a points-to graph by tracking dependencies. A statement is processed again only when a node it read
     * the last time it was processed changes.
     *
     * @param registrar
     *            points-to statement registrar
     * @return Points-to graph, frozen
     */
    public PointsToGraph solveSmarter(StatementRegistrar registrar) {
        PointsToGraph g = new PointsToGraph();
        Map<PointsToGraphNode, Set<PointsToStatement>> dependencies = new HashMap<>();
        WorkQueue<PointsToStatement> queue = new WorkQueue<>(registrar.getAllStatements());

        PointsToStatement s;
        while ((s = queue.poll()) != null) {
            s.process(g);

            for (PointsToGraphNode read : g.getAndClearReadNodes()) {
                Set<PointsToStatement> deps = dependencies.get(read);
                if (deps == null) {
                    deps = new LinkedHashSet<>();
                    dependencies.put(read, deps);
                }
                deps.add(s);
            }

            for (PointsToGraphNode changed : g.getAndClearChangedNodes()) {
                Set<PointsToStatement> deps = dependencies.get(changed);
                if (deps != null) {
                    queue.addAll(deps);
                }
            }
        }
        processed = queue.getPolledCount();

        if (outputLevel >= 1) {
            Logger.println("Points-to for " + registrar.getProcedureName() + ": " + registrar.getAllStatements().size()
                    + " statements, " + processed + " processed, " + g.getEdgeCount() + " edges");
        }

        if (paranoidMode) {
            // check that nothing changes
            for (PointsToStatement stmt : registrar.getAllStatements()) {
                if (stmt.process(g)) {
                    throw new RuntimeException("Points-to graph not at a fixed point: " + stmt + " changed "
                            + g.getAndClearChangedNodes());
                }
            }
        }
        g.freeze();
        return g;
    }

    /**
     * @return number of statements processed by the last call to solve
     */
    public int getProcessedCount() {
        return processed;
    }
}
