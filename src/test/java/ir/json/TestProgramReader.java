package ir.json;

import ir.ControlKind;
import ir.MalformedProcedureException;
import ir.PointerOperation;
import ir.Procedure;
import ir.Program;
import ir.Statement;

import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;

import junit.framework.TestCase;

public class TestProgramReader extends TestCase {

    static Program readSample() throws IOException, MalformedProcedureException {
        try (Reader r = new InputStreamReader(TestProgramReader.class.getResourceAsStream("/programs/sample.json"),
                                              StandardCharsets.UTF_8)) {
            return ProgramReader.read(r, "sample.json");
        }
    }

    public void testReadSample() throws IOException, MalformedProcedureException {
        Program p = readSample();
        assertEquals("java", p.getLanguage());
        assertEquals("sample.json", p.getSource());
        assertEquals(4, p.getProcedures().size());

        Procedure loop = p.getProcedure("loop");
        Statement branch = loop.getStatements().get(1);
        assertEquals(ControlKind.BRANCH, branch.getKind());
        assertEquals("L", branch.getLabel());
        assertEquals(Collections.singletonList("E"), branch.getTargets());
        assertEquals(Collections.singleton("i"), branch.getUses());
        assertEquals(ControlKind.NORMAL, loop.getStatements().get(0).getKind());
        assertEquals(7, loop.getControlFlowGraph().size());
    }

    public void testPointerOperations() throws IOException, MalformedProcedureException {
        Procedure heap = readSample().getProcedure("heap");
        Statement alloc = heap.getStatements().get(0);
        assertEquals(PointerOperation.allocation("a", "A1"), alloc.getPointerOperation());
        // pointer operations contribute their defs and uses
        assertEquals(Collections.singleton("a"), alloc.getDefs());

        Statement store = heap.getStatements().get(3);
        assertEquals(PointerOperation.store("a", "f", "v"), store.getPointerOperation());
        assertEquals(new LinkedHashSet<>(Arrays.asList("a", "v")), store.getUses());
        assertTrue(store.getDefs().isEmpty());

        assertEquals(PointerOperation.load("w", "b", "f"), heap.getStatements().get(4).getPointerOperation());
        assertEquals(PointerOperation.Kind.UNSUPPORTED, heap.getStatements().get(6).getPointerOperation().getKind());
        assertEquals("reflection", heap.getStatements().get(6).getPointerOperation().getDetail());
    }

    public void testControlFlowErrorsAreDeferred() throws IOException, MalformedProcedureException {
        Procedure broken = readSample().getProcedure("broken");
        try {
            broken.getControlFlowGraph();
            fail("Should have thrown exception");
        }
        catch (MalformedProcedureException e) {
            assertEquals("broken", e.getProcedureName());
        }
    }

    public void testInvalidJson() {
        try {
            ProgramReader.parse("{\"procedures\": [");
            fail("Should have thrown exception");
        }
        catch (MalformedProcedureException e) {
            assertEquals(ProgramReader.DOCUMENT, e.getProcedureName());
        }
    }

    public void testMissingProcedures() {
        try {
            ProgramReader.parse("{\"language\": \"cpp\"}");
            fail("Should have thrown exception");
        }
        catch (MalformedProcedureException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("procedures"));
        }
    }

    public void testMissingTextNamesProcedure() {
        try {
            ProgramReader.parse("{\"procedures\": [{\"name\": \"f\", \"statements\": [{\"defs\": [\"x\"]}]}]}");
            fail("Should have thrown exception");
        }
        catch (MalformedProcedureException e) {
            assertEquals("f", e.getProcedureName());
        }
    }

    public void testUnknownKind() {
        try {
            ProgramReader.parse("{\"procedures\": [{\"name\": \"f\", \"statements\": [{\"text\": \"x\", \"kind\": \"jump\"}]}]}");
            fail("Should have thrown exception");
        }
        catch (MalformedProcedureException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("jump"));
        }
    }

    public void testDuplicateProcedureNames() {
        try {
            ProgramReader.parse("{\"procedures\": [{\"name\": \"f\", \"statements\": []}, {\"name\": \"f\", \"statements\": []}]}");
            fail("Should have thrown exception");
        }
        catch (MalformedProcedureException e) {
            // expected
        }
    }

    public void testDefaults() throws MalformedProcedureException {
        Program p = ProgramReader.parse("{\"procedures\": [{\"name\": \"f\", \"statements\": [null]}]}");
        assertEquals(Program.UNKNOWN_LANGUAGE, p.getLanguage());
        assertNull(p.getSource());
        try {
            p.getProcedure("f").getControlFlowGraph();
            fail("Should have thrown exception");
        }
        catch (MalformedProcedureException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("null statement"));
        }
    }

    public void testMissingFile() throws MalformedProcedureException {
        try {
            ProgramReader.read(new File("does/not/exist.json"));
            fail("Should have thrown exception");
        }
        catch (IOException e) {
            // expected
        }
    }
}
