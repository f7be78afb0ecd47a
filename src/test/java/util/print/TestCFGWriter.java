package util.print;

import ir.MalformedProcedureException;
import ir.PointerOperation;
import ir.Programs;
import ir.cfg.ControlFlowGraph;

import java.io.IOException;
import java.io.StringWriter;

import junit.framework.TestCase;
import analysis.dataflow.live.LiveVariableDataFlow;
import analysis.pointer.engine.PointsToAnalysisSingleThreaded;
import analysis.pointer.graph.PointsToGraph;
import analysis.pointer.registrar.StatementRegistrar;

public class TestCFGWriter extends TestCase {

    public void testHeaderAndEdges() throws MalformedProcedureException, IOException {
        ControlFlowGraph cfg = Programs.straightLine().getControlFlowGraph();
        StringWriter sw = new StringWriter();
        new CFGWriter(cfg).write(sw, "", "");
        String dot = sw.toString();

        assertTrue(dot, dot.startsWith("digraph G {\nnode [shape=record];\n"));
        assertTrue(dot, dot.contains("\t\"ENTRY\" -> \"n1\";\n"));
        assertTrue(dot, dot.contains("\t\"n3\" -> \"EXIT\";\n"));
        // exit has no successors and is written on its own
        assertTrue(dot, dot.contains("\t\"EXIT\";\n"));
        assertTrue(dot, dot.endsWith("\n};\n"));
    }

    public void testBranchLabels() throws MalformedProcedureException, IOException {
        ControlFlowGraph cfg = Programs.loop().getControlFlowGraph();
        StringWriter sw = new StringWriter();
        new CFGWriter(cfg).write(sw, "", "");
        String dot = sw.toString();

        assertTrue(dot, dot.contains("\t\"n2\" -> \"n5\" [label=\"TRUE\"];\n"));
        assertTrue(dot, dot.contains("\t\"n2\" -> \"n3\" [label=\"FALSE\"];\n"));
        assertTrue(dot, dot.contains("\t\"n4\" -> \"n2\";\n"));
    }

    public void testVerboseAnnotations() throws MalformedProcedureException, IOException {
        ControlFlowGraph cfg = Programs.loop().getControlFlowGraph();
        CFGWriter w = new CFGWriter(cfg);
        w.addAnnotation("live", new LiveVariableDataFlow().dataflow(cfg));
        StringWriter sw = new StringWriter();
        w.writeVerbose(sw, "", "\\l");
        String dot = sw.toString();

        assertTrue(dot, dot.contains("L: if i \\>= 10 goto E\\l"));
        assertTrue(dot, dot.contains("live in: \\{i\\}\\l"));
        assertTrue(dot, dot.contains("live in: \\{\\}\\l"));
    }

    public void testEscapeDot() {
        assertEquals("a \\< b \\| \\{c\\} \\\"d\\\"\\l", CFGWriter.escapeDot("a < b | {c} \"d\"\n"));
    }

    public void testPointsToGraph() throws MalformedProcedureException, IOException {
        ControlFlowGraph cfg = Programs.procedure("heap",
                                                  Programs.pointer("a = new A()", PointerOperation.allocation("a", "A1")),
                                                  Programs.pointer("b = a", PointerOperation.copy("b", "a")))
                                       .getControlFlowGraph();
        PointsToGraph g = new PointsToAnalysisSingleThreaded().solve(new StatementRegistrar(cfg));
        StringWriter sw = new StringWriter();
        new PointsToGraphWriter(g).write(sw);
        String dot = sw.toString();

        assertTrue(dot, dot.contains("\t\"new A1: a = new A()\" [shape=box];\n"));
        assertTrue(dot, dot.contains("\t\"a\" -> \"new A1: a = new A()\";\n"));
        assertTrue(dot, dot.contains("\t\"b\" -> \"new A1: a = new A()\";\n"));
    }
}
