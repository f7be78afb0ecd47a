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
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

/**
 * Reads a program handed over by a front-end as JSON:
 *
 * <pre>
 * {"language": "java",
 *  "procedures": [{"name": "main",
 *                  "statements": [{"text": "x = new A()", "defs": ["x"], "pointer": {"op": "new", "lhs": "x"}},
 *                                 {"text": "if c goto L", "kind": "branch", "uses": ["c"], "targets": ["L"]},
 *                                 {"text": "return", "kind": "return", "label": "L"}]}]}
 * </pre>
 *
 * Only the shape of the document is checked here. Control flow errors such as undefined labels are reported when the
 * procedure's control flow graph is built, so they only affect that procedure.
 */
public final class ProgramReader {

    /**
     * Name used in errors that are not specific to one procedure
     */
    public static final String DOCUMENT = "<document>";

    private ProgramReader() {
        // static methods only
    }

    /**
     * Read a program from a file
     *
     * @param file
     *            JSON file
     * @return the program
     * @throws IOException
     *             if the file cannot be read
     * @throws MalformedProcedureException
     *             if the document is not a well formed program description
     */
    public static Program read(File file) throws IOException, MalformedProcedureException {
        try (Reader r = new InputStreamReader(Files.newInputStream(file.toPath()), StandardCharsets.UTF_8)) {
            return read(r, file.getPath());
        }
    }

    /**
     * Read a program from a JSON string
     *
     * @param json
     *            program description
     * @return the program
     * @throws MalformedProcedureException
     *             if the document is not a well formed program description
     */
    public static Program parse(String json) throws MalformedProcedureException {
        return read(new StringReader(json), null);
    }

    /**
     * Read a program from a reader
     *
     * @param in
     *            source of the JSON text
     * @param source
     *            where the text came from, may be null
     * @return the program
     * @throws MalformedProcedureException
     *             if the document is not a well formed program description
     */
    public static Program read(Reader in, String source) throws MalformedProcedureException {
        JSONObject doc;
        try {
            doc = new JSONObject(new JSONTokener(in));
        }
        catch (JSONException e) {
            throw new MalformedProcedureException(DOCUMENT, "invalid JSON: " + e.getMessage(), e);
        }

        String language = doc.optString("language", Program.UNKNOWN_LANGUAGE);
        JSONArray procs = doc.optJSONArray("procedures");
        if (procs == null) {
            throw new MalformedProcedureException(DOCUMENT, "missing \"procedures\" array");
        }

        List<Procedure> procedures = new ArrayList<>(procs.length());
        for (int i = 0; i < procs.length(); i++) {
            JSONObject p = procs.optJSONObject(i);
            if (p == null) {
                throw new MalformedProcedureException(DOCUMENT, "procedure " + i + " is not an object");
            }
            procedures.add(readProcedure(p, i));
        }

        try {
            return new Program(procedures, language, source);
        }
        catch (IllegalArgumentException e) {
            throw new MalformedProcedureException(DOCUMENT, e.getMessage(), e);
        }
    }

    private static Procedure readProcedure(JSONObject p, int index) throws MalformedProcedureException {
        String name = p.optString("name", null);
        if (name == null) {
            throw new MalformedProcedureException(DOCUMENT, "procedure " + index + " has no name");
        }
        JSONArray stmts = p.optJSONArray("statements");
        if (stmts == null) {
            throw new MalformedProcedureException(name, "missing \"statements\" array");
        }

        List<Statement> statements = new ArrayList<>(stmts.length());
        for (int i = 0; i < stmts.length(); i++) {
            if (stmts.isNull(i)) {
                // rejected when the CFG is built
                statements.add(null);
                continue;
            }
            JSONObject s = stmts.optJSONObject(i);
            if (s == null) {
                throw new MalformedProcedureException(name, "statement " + (i + 1) + " is not an object");
            }
            statements.add(readStatement(s, name, i + 1));
        }
        return new Procedure(name, statements);
    }

    private static Statement readStatement(JSONObject s, String proc, int position) throws MalformedProcedureException {
        String text = s.optString("text", null);
        if (text == null) {
            throw new MalformedProcedureException(proc, "statement " + position + " has no text");
        }
        String kindName = s.optString("kind", "normal");
        ControlKind kind = ControlKind.forName(kindName);
        if (kind == null) {
            throw new MalformedProcedureException(proc, "statement " + position + " has unknown kind " + kindName);
        }
        String label = s.optString("label", null);

        PointerOperation op = null;
        if (s.has("pointer") && !s.isNull("pointer")) {
            JSONObject ptr = s.optJSONObject("pointer");
            if (ptr == null) {
                throw new MalformedProcedureException(proc, "statement " + position + " has a malformed pointer entry");
            }
            op = readPointerOperation(ptr, proc, position);
        }

        return new Statement(text,
                             kind,
                             readStrings(s, "defs", proc, position),
                             readStrings(s, "uses", proc, position),
                             label,
                             readStrings(s, "targets", proc, position),
                             op);
    }

    private static PointerOperation readPointerOperation(JSONObject ptr, String proc, int position)
                                                                                                   throws MalformedProcedureException {
        String opName = ptr.optString("op", null);
        PointerOperation.Kind k = opName == null ? null : PointerOperation.Kind.forName(opName);
        if (k == null) {
            throw new MalformedProcedureException(proc, "statement " + position + " has unknown pointer operation "
                    + opName);
        }
        String lhs = ptr.optString("lhs", null);
        String rhs = ptr.optString("rhs", null);
        String base = ptr.optString("base", null);
        String field = ptr.optString("field", null);
        switch (k) {
        case NEW:
            return PointerOperation.allocation(lhs, ptr.optString("site", null));
        case COPY:
            return PointerOperation.copy(lhs, rhs);
        case LOAD:
            return PointerOperation.load(lhs, base, field);
        case STORE:
            return PointerOperation.store(base, field, rhs);
        case NULL:
            return PointerOperation.nullAssignment(lhs);
        case UNSUPPORTED:
            return PointerOperation.unsupported(ptr.optString("reason", null));
        }
        throw new RuntimeException("Unhandled pointer operation " + k);
    }

    private static List<String> readStrings(JSONObject s, String key, String proc, int position)
                                                                                              throws MalformedProcedureException {
        if (!s.has(key) || s.isNull(key)) {
            return Collections.emptyList();
        }
        JSONArray a = s.optJSONArray(key);
        if (a == null) {
            throw new MalformedProcedureException(proc, "statement " + position + ": \"" + key
                    + "\" is not an array");
        }
        List<String> l = new ArrayList<>(a.length());
        for (int i = 0; i < a.length(); i++) {
            Object o = a.opt(i);
            if (!(o instanceof String)) {
                throw new MalformedProcedureException(proc, "statement " + position + ": \"" + key
                        + "\" must contain strings");
            }
            l.add((String) o);
        }
        return l;
    }
}
