package analysis.dataflow;

import ir.MalformedProcedureException;
import ir.Programs;
import ir.cfg.CFGNode;
import ir.cfg.ControlFlowGraph;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import junit.framework.TestCase;
import analysis.dataflow.live.LiveVariableDataFlow;
import analysis.dataflow.reachingdefs.Definition;
import analysis.dataflow.reachingdefs.ReachingDefinitionsDataFlow;
import analysis.dataflow.util.SetAbsVal;

/**
 * Properties of the worklist solver that hold for any analysis
 */
public class TestDataFlow extends TestCase {

    /**
     * Forward analysis that drops the fact for the loop header the second time it is visited
     */
    private static class Shrinking extends DataFlow<SetAbsVal<String>> {
        private int headerVisits = 0;

        Shrinking() {
            super(true);
        }

        @Override
        protected SetAbsVal<String> bottom() {
            return SetAbsVal.empty();
        }

        @Override
        protected SetAbsVal<String> flow(SetAbsVal<String> input, CFGNode current) {
            if (current.getNumber() == 2 && ++headerVisits > 1) {
                return SetAbsVal.empty();
            }
            return input.plus(Collections.singleton("x" + current.getNumber()));
        }
    }

    /**
     * Forward analysis over an infinite lattice: facts grow forever around a loop
     */
    private static class Counting extends DataFlow<SetAbsVal<String>> {
        private final Map<CFGNode, SetAbsVal<String>> seen = new HashMap<>();
        private int counter = 0;

        Counting() {
            super(true);
        }

        @Override
        protected SetAbsVal<String> bottom() {
            return SetAbsVal.empty();
        }

        @Override
        protected SetAbsVal<String> flow(SetAbsVal<String> input, CFGNode current) {
            SetAbsVal<String> previous = seen.get(current);
            SetAbsVal<String> output = input.plus(Collections.singleton("c" + counter++));
            if (previous != null) {
                output = output.join(previous);
            }
            seen.put(current, output);
            return output;
        }
    }

    public void testIdempotent() throws MalformedProcedureException {
        ControlFlowGraph cfg = Programs.loop().getControlFlowGraph();
        ReachingDefinitionsDataFlow df = new ReachingDefinitionsDataFlow();
        DataFlowResult<SetAbsVal<Definition>> first = df.dataflow(cfg);
        DataFlowResult<SetAbsVal<Definition>> second = df.dataflow(cfg, first);
        for (CFGNode n : cfg) {
            assertEquals(first.getInFact(n), second.getInFact(n));
            assertEquals(first.getOutFact(n), second.getOutFact(n));
        }
        // every node visited once, nothing changes
        assertEquals(cfg.size(), second.getVisits());

        LiveVariableDataFlow live = new LiveVariableDataFlow();
        DataFlowResult<SetAbsVal<String>> l1 = live.dataflow(cfg);
        DataFlowResult<SetAbsVal<String>> l2 = live.dataflow(cfg, l1);
        for (CFGNode n : cfg) {
            assertEquals(l1.getInFact(n), l2.getInFact(n));
            assertEquals(l1.getOutFact(n), l2.getOutFact(n));
        }
        assertEquals(cfg.size(), l2.getVisits());
    }

    public void testFactsOnlyGrow() throws MalformedProcedureException {
        ControlFlowGraph cfg = Programs.loop().getControlFlowGraph();
        final int[] changes = { 0 };
        LiveVariableDataFlow df = new LiveVariableDataFlow();
        df.setListener(new DataFlowListener<SetAbsVal<String>>() {
            @Override
            public void factChanged(CFGNode node, SetAbsVal<String> previous, SetAbsVal<String> current) {
                assertTrue(previous + " -> " + current, previous.leq(current));
                assertFalse(current.equals(previous));
                changes[0]++;
            }
        });
        df.dataflow(cfg);
        assertTrue(changes[0] > 0);
    }

    public void testOrderDoesNotChangeFixedPoint() throws MalformedProcedureException {
        ControlFlowGraph cfg = Programs.loop().getControlFlowGraph();

        ReachingDefinitionsDataFlow rpo = new ReachingDefinitionsDataFlow();
        ReachingDefinitionsDataFlow program = new ReachingDefinitionsDataFlow();
        program.setWorklistOrder(WorklistOrder.PROGRAM_ORDER);
        DataFlowResult<SetAbsVal<Definition>> r1 = rpo.dataflow(cfg);
        DataFlowResult<SetAbsVal<Definition>> r2 = program.dataflow(cfg);

        LiveVariableDataFlow liveRpo = new LiveVariableDataFlow();
        LiveVariableDataFlow liveProgram = new LiveVariableDataFlow();
        liveProgram.setWorklistOrder(WorklistOrder.PROGRAM_ORDER);
        DataFlowResult<SetAbsVal<String>> l1 = liveRpo.dataflow(cfg);
        DataFlowResult<SetAbsVal<String>> l2 = liveProgram.dataflow(cfg);

        for (CFGNode n : cfg) {
            assertEquals(r1.getInFact(n), r2.getInFact(n));
            assertEquals(r1.getOutFact(n), r2.getOutFact(n));
            assertEquals(l1.getInFact(n), l2.getInFact(n));
            assertEquals(l1.getOutFact(n), l2.getOutFact(n));
        }
        // backward analysis in program order needs extra passes
        assertTrue(l1.getVisits() <= l2.getVisits());
    }

    public void testShrinkingFactFailsFast() throws MalformedProcedureException {
        ControlFlowGraph cfg = Programs.loop().getControlFlowGraph();
        try {
            new Shrinking().dataflow(cfg);
            fail("Should have thrown exception");
        }
        catch (NonMonotonicTransferException e) {
            assertEquals(2, e.getNode().getNumber());
        }
    }

    public void testVisitBound() throws MalformedProcedureException {
        ControlFlowGraph cfg = Programs.loop().getControlFlowGraph();
        Counting df = new Counting();
        df.setMaxVisitsPerNode(50);
        try {
            df.dataflow(cfg);
            fail("Should have thrown exception");
        }
        catch (NonMonotonicTransferException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("51 times"));
        }
    }

    public void testBadVisitBound() {
        try {
            new LiveVariableDataFlow().setMaxVisitsPerNode(0);
            fail("Should have thrown exception");
        }
        catch (IllegalArgumentException e) {
            // expected
        }
    }

    public void testDirection() throws MalformedProcedureException {
        ControlFlowGraph cfg = Programs.straightLine().getControlFlowGraph();
        assertFalse(new LiveVariableDataFlow().isForward());
        assertTrue(new ReachingDefinitionsDataFlow().isForward());
        DataFlowResult<SetAbsVal<String>> r = new LiveVariableDataFlow().dataflow(cfg);
        assertFalse(r.isForward());
        assertSame(cfg, r.getControlFlowGraph());
    }
}
