package analysis.dataflow.reachingdefs;

import ir.MalformedProcedureException;
import ir.Programs;
import ir.cfg.ControlFlowGraph;

import java.util.LinkedHashSet;
import java.util.Set;

import junit.framework.TestCase;
import analysis.dataflow.DataFlowResult;
import analysis.dataflow.util.SetAbsVal;

public class TestReachingDefinitionsDataFlow extends TestCase {

    private static Set<String> names(SetAbsVal<Definition> defs) {
        Set<String> s = new LinkedHashSet<>();
        for (Definition d : defs) {
            s.add(d.toString());
        }
        return s;
    }

    private static Set<String> set(String... defs) {
        Set<String> s = new LinkedHashSet<>();
        for (String d : defs) {
            s.add(d);
        }
        return s;
    }

    public void testLoopHeaderSeesBothDefinitions() throws MalformedProcedureException {
        // 1: i = 0; 2: L: if i >= 10 goto E; 3: i = i + 1; 4: goto L; 5: E: return i
        ControlFlowGraph cfg = Programs.loop().getControlFlowGraph();
        DataFlowResult<SetAbsVal<Definition>> r = new ReachingDefinitionsDataFlow().dataflow(cfg);

        assertEquals(set("i@1", "i@3"), names(r.getInFact(cfg.getNode(2))));
        assertEquals(set("i@1", "i@3"), names(r.getInFact(cfg.getNode(5))));
        // the increment kills the initial definition
        assertEquals(set("i@3"), names(r.getOutFact(cfg.getNode(3))));
        assertEquals(set("i@3"), names(r.getInFact(cfg.getNode(4))));
        assertTrue(r.getInFact(cfg.getNode(1)).isBottom());
        assertEquals(set("i@1", "i@3"), names(r.getInFact(cfg.exit())));
    }

    public void testStraightLine() throws MalformedProcedureException {
        ControlFlowGraph cfg = Programs.straightLine().getControlFlowGraph();
        DataFlowResult<SetAbsVal<Definition>> r = new ReachingDefinitionsDataFlow().dataflow(cfg);
        assertEquals(set("x@1", "y@2"), names(r.getInFact(cfg.getNode(3))));
        assertEquals(set("x@1"), names(r.getOutFact(cfg.getNode(1))));

        Definition d = r.getOutFact(cfg.getNode(1)).iterator().next();
        assertEquals("x", d.getVariable());
        assertSame(cfg.getNode(1), d.getNode());
    }

    public void testRedefinitionKills() throws MalformedProcedureException {
        ControlFlowGraph cfg = Programs.procedure("kill",
                                                  Programs.stmt("x = 1", "x", ""),
                                                  Programs.stmt("x = 2", "x", ""),
                                                  Programs.stmt("use(x)", "", "x")).getControlFlowGraph();
        DataFlowResult<SetAbsVal<Definition>> r = new ReachingDefinitionsDataFlow().dataflow(cfg);
        assertEquals(set("x@2"), names(r.getInFact(cfg.getNode(3))));
    }
}
