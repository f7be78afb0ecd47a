package ir.cfg;

import static ir.Programs.jump;
import static ir.Programs.procedure;
import static ir.Programs.ret;
import static ir.Programs.stmt;
import ir.ControlKind;
import ir.MalformedProcedureException;
import ir.Procedure;
import ir.Programs;
import ir.Statement;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import junit.framework.TestCase;

/**
 * Test the construction of control flow graphs from statement lists
 */
public class TestCFGBuilder extends TestCase {

    private static void assertSuccs(ControlFlowGraph cfg, int node, int... succs) {
        List<CFGNode> actual = cfg.getSuccs(cfg.getNode(node));
        assertEquals("successors of " + node + ": " + actual, succs.length, actual.size());
        for (int i = 0; i < succs.length; i++) {
            assertEquals(succs[i], actual.get(i).getNumber());
        }
    }

    public void testStraightLine() throws MalformedProcedureException {
        ControlFlowGraph cfg = Programs.straightLine().getControlFlowGraph();
        assertEquals(5, cfg.size());
        assertTrue(cfg.entry().isEntry());
        assertEquals(0, cfg.entry().getNumber());
        assertTrue(cfg.exit().isExit());
        assertEquals(4, cfg.exit().getNumber());
        assertSuccs(cfg, 0, 1);
        assertSuccs(cfg, 1, 2);
        assertSuccs(cfg, 2, 3);
        assertSuccs(cfg, 3, 4);
        assertSuccs(cfg, 4);
        assertEquals(0, cfg.getPredNodeCount(cfg.entry()));
        assertEquals("y = x + 1", cfg.getNode(2).getStatement().getText());
    }

    public void testEmptyProcedure() throws MalformedProcedureException {
        ControlFlowGraph cfg = procedure("empty").getControlFlowGraph();
        assertEquals(2, cfg.size());
        assertSuccs(cfg, 0, 1);
        assertTrue(cfg.hasEdge(cfg.entry(), cfg.exit()));
    }

    public void testLoop() throws MalformedProcedureException {
        ControlFlowGraph cfg = Programs.loop().getControlFlowGraph();
        assertSuccs(cfg, 1, 2);
        // branch jumps to E and falls through
        assertSuccs(cfg, 2, 3, 5);
        assertSuccs(cfg, 3, 4);
        // back edge
        assertSuccs(cfg, 4, 2);
        assertSuccs(cfg, 5, 6);

        List<CFGNode> preds = cfg.getPreds(cfg.getNode(2));
        assertEquals(2, preds.size());
        assertEquals(1, preds.get(0).getNumber());
        assertEquals(4, preds.get(1).getNumber());
        assertTrue(cfg.getUnreachableNodes().isEmpty());
    }

    public void testSwitchDoesNotFallThrough() throws MalformedProcedureException {
        Procedure p = procedure("switch",
                                jump(null, ControlKind.SWITCH, "switch x", "x", "A", "B"),
                                stmt("unreachable()", "", ""),
                                Programs.labeled("A", "a = 1", "a", ""),
                                ret("B", "return", ""));
        ControlFlowGraph cfg = p.getControlFlowGraph();
        assertSuccs(cfg, 1, 3, 4);
        assertEquals(Collections.singleton(cfg.getNode(2)), cfg.getUnreachableNodes());
    }

    public void testReturnGoesToExit() throws MalformedProcedureException {
        Procedure p = procedure("early", ret(null, "return", ""), stmt("dead()", "", ""));
        ControlFlowGraph cfg = p.getControlFlowGraph();
        assertSuccs(cfg, 1, 3);
        assertSuccs(cfg, 2, 3);
        assertTrue(cfg.getUnreachableNodes().contains(cfg.getNode(2)));
    }

    public void testEdges() throws MalformedProcedureException {
        ControlFlowGraph cfg = Programs.loop().getControlFlowGraph();
        // entry->1, 1->2, 2->3, 2->5, 3->4, 4->2, 5->exit
        assertEquals(7, cfg.getEdges().size());
        assertEquals(cfg.entry(), cfg.getEdges().get(0).fst());
    }

    public void testReversePostorder() throws MalformedProcedureException {
        ControlFlowGraph cfg = Programs.loop().getControlFlowGraph();
        List<CFGNode> rpo = cfg.reversePostorder(true);
        assertEquals(cfg.size(), rpo.size());
        assertEquals(cfg.entry(), rpo.get(0));
        // every forward edge that is not a back edge goes forward in reverse postorder
        assertTrue(rpo.indexOf(cfg.getNode(1)) < rpo.indexOf(cfg.getNode(2)));
        assertTrue(rpo.indexOf(cfg.getNode(2)) < rpo.indexOf(cfg.getNode(3)));
        assertTrue(rpo.indexOf(cfg.getNode(3)) < rpo.indexOf(cfg.getNode(4)));
        assertTrue(rpo.indexOf(cfg.getNode(5)) < rpo.indexOf(cfg.exit()));

        List<CFGNode> backward = cfg.reversePostorder(false);
        assertEquals(cfg.exit(), backward.get(0));
        assertTrue(backward.indexOf(cfg.getNode(5)) < backward.indexOf(cfg.getNode(2)));
        assertTrue(backward.indexOf(cfg.getNode(1)) < backward.indexOf(cfg.entry()));

        List<CFGNode> post = cfg.postorder(true);
        assertEquals(cfg.entry(), post.get(post.size() - 1));
    }

    public void testUnreachableNodesAppendedToOrder() throws MalformedProcedureException {
        Procedure p = procedure("early", ret(null, "return", ""), stmt("dead()", "", ""));
        ControlFlowGraph cfg = p.getControlFlowGraph();
        List<CFGNode> rpo = cfg.reversePostorder(true);
        assertEquals(cfg.size(), rpo.size());
        assertEquals(cfg.getNode(2), rpo.get(rpo.size() - 1));
        assertEquals(3, cfg.postorder(true).size());
    }

    public void testUndefinedLabel() {
        Procedure p = procedure("bad", stmt("x = 1", "x", ""), jump(null, ControlKind.GOTO, "goto NOWHERE", "",
                                                                     "NOWHERE"));
        try {
            p.getControlFlowGraph();
            fail("Should have thrown exception");
        }
        catch (MalformedProcedureException e) {
            assertEquals("bad", e.getProcedureName());
            assertTrue(e.getMessage(), e.getMessage().contains("NOWHERE"));
        }
    }

    public void testDuplicateLabel() {
        Procedure p = procedure("dup", Programs.labeled("L", "a()", "", ""), Programs.labeled("L", "b()", "", ""));
        try {
            p.getControlFlowGraph();
            fail("Should have thrown exception");
        }
        catch (MalformedProcedureException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("L"));
        }
    }

    public void testGotoNeedsOneTarget() {
        Procedure p = procedure("goto2",
                                jump(null, ControlKind.GOTO, "goto A, B", "", "A", "B"),
                                Programs.labeled("A", "a()", "", ""),
                                Programs.labeled("B", "b()", "", ""));
        try {
            p.getControlFlowGraph();
            fail("Should have thrown exception");
        }
        catch (MalformedProcedureException e) {
            // expected
        }
    }

    public void testBranchNeedsTargets() {
        Procedure p = procedure("branch", jump(null, ControlKind.BRANCH, "if c", "c"));
        try {
            p.getControlFlowGraph();
            fail("Should have thrown exception");
        }
        catch (MalformedProcedureException e) {
            // expected
        }
    }

    public void testNullStatement() {
        Procedure p = new Procedure("nulls", Arrays.asList(stmt("a()", "", ""), (Statement) null));
        try {
            p.getControlFlowGraph();
            fail("Should have thrown exception");
        }
        catch (MalformedProcedureException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("null"));
        }
    }

    public void testGraphIsCached() throws MalformedProcedureException {
        Procedure p = Programs.straightLine();
        assertSame(p.getControlFlowGraph(), p.getControlFlowGraph());
    }

    public void testNeighboursCannotChangeGraph() throws MalformedProcedureException {
        ControlFlowGraph cfg = Programs.loop().getControlFlowGraph();
        int edges = cfg.getEdges().size();
        try {
            cfg.getSuccs(cfg.getNode(2)).add(cfg.entry());
            fail("Should have thrown exception");
        }
        catch (UnsupportedOperationException e) {
            // expected
        }
        try {
            cfg.getPreds(cfg.exit()).clear();
            fail("Should have thrown exception");
        }
        catch (UnsupportedOperationException e) {
            // expected
        }
        assertEquals(edges, cfg.getEdges().size());
        assertFalse(cfg.hasEdge(cfg.exit(), cfg.entry()));
    }

    public void testFlowNeighbours() throws MalformedProcedureException {
        ControlFlowGraph cfg = Programs.loop().getControlFlowGraph();
        CFGNode branch = cfg.getNode(2);
        assertEquals(cfg.getPreds(branch), cfg.getFlowPreds(branch, true));
        assertEquals(cfg.getSuccs(branch), cfg.getFlowPreds(branch, false));
        assertEquals(Arrays.asList(cfg.getNode(3), cfg.getNode(5)), cfg.getFlowSuccs(branch, true));
        assertEquals(Arrays.asList(cfg.getNode(1), cfg.getNode(4)), cfg.getFlowSuccs(branch, false));
    }
}
