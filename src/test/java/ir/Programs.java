package ir;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Shorthand for building statements and procedures in tests
 */
public final class Programs {

    private Programs() {
        // static methods only
    }

    /**
     * Comma separated variable names, e.g. "x,y"; the empty string is the empty list
     */
    public static List<String> vars(String s) {
        if (s == null || s.isEmpty()) {
            return Collections.emptyList();
        }
        return Arrays.asList(s.split(","));
    }

    /**
     * Statement that falls through
     */
    public static Statement stmt(String text, String defs, String uses) {
        return Statement.simple(text, vars(defs), vars(uses));
    }

    /**
     * Labeled statement that falls through
     */
    public static Statement labeled(String label, String text, String defs, String uses) {
        return new Statement(text, ControlKind.NORMAL, vars(defs), vars(uses), label, Collections.<String> emptyList(),
                             null);
    }

    /**
     * Jump of the given kind, label may be null
     */
    public static Statement jump(String label, ControlKind kind, String text, String uses, String... targets) {
        return new Statement(text, kind, Collections.<String> emptyList(), vars(uses), label, Arrays.asList(targets),
                             null);
    }

    /**
     * Return statement, label may be null
     */
    public static Statement ret(String label, String text, String uses) {
        return new Statement(text, ControlKind.RETURN, Collections.<String> emptyList(), vars(uses), label,
                             Collections.<String> emptyList(), null);
    }

    /**
     * Statement with a pointer effect that falls through
     */
    public static Statement pointer(String text, PointerOperation op) {
        return new Statement(text, ControlKind.NORMAL, Collections.<String> emptyList(),
                             Collections.<String> emptyList(), null, Collections.<String> emptyList(), op);
    }

    public static Procedure procedure(String name, Statement... statements) {
        return new Procedure(name, new ArrayList<>(Arrays.asList(statements)));
    }

    /**
     * x = 1; y = x + 1; use(y)
     */
    public static Procedure straightLine() {
        return procedure("straight", stmt("x = 1", "x", ""), stmt("y = x + 1", "y", "x"), stmt("use(y)", "", "y"));
    }

    /**
     * i = 0; L: if i >= 10 goto E; i = i + 1; goto L; E: return i
     */
    public static Procedure loop() {
        return procedure("loop",
                         stmt("i = 0", "i", ""),
                         jump("L", ControlKind.BRANCH, "if i >= 10 goto E", "i", "E"),
                         stmt("i = i + 1", "i", "i"),
                         jump(null, ControlKind.GOTO, "goto L", "", "L"),
                         ret("E", "return i", "i"));
    }
}
