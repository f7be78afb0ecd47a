package ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Container for the procedures produced by a front-end
 */
public final class Program {

    /**
     * Language tag used when the front-end does not supply one
     */
    public static final String UNKNOWN_LANGUAGE = "unknown";

    private final Map<String, Procedure> procedures;
    private final String language;
    /**
     * Path of the source file the procedures came from, may be null
     */
    private final String source;

    /**
     * Create a program
     *
     * @param procedures
     *            procedures in order, names must be unique
     * @param language
     *            source language tag, e.g. "java" or "cpp", null for unknown
     * @param source
     *            source file name, may be null
     */
    public Program(List<Procedure> procedures, String language, String source) {
        Map<String, Procedure> m = new LinkedHashMap<>();
        for (Procedure p : procedures) {
            if (m.put(p.getName(), p) != null) {
                throw new IllegalArgumentException("Duplicate procedure name " + p.getName());
            }
        }
        this.procedures = Collections.unmodifiableMap(m);
        this.language = language == null ? UNKNOWN_LANGUAGE : language;
        this.source = source;
    }

    public List<Procedure> getProcedures() {
        return Collections.unmodifiableList(new ArrayList<>(procedures.values()));
    }

    /**
     * Find a procedure by name
     *
     * @param name
     *            procedure name
     * @return the procedure or null if there is none with that name
     */
    public Procedure getProcedure(String name) {
        return procedures.get(name);
    }

    public String getLanguage() {
        return language;
    }

    public String getSource() {
        return source;
    }

    /**
     * Copy of this program with a different language tag
     *
     * @param newLanguage
     *            language tag
     * @return program sharing the procedures of this one
     */
    public Program withLanguage(String newLanguage) {
        return new Program(new ArrayList<>(procedures.values()), newLanguage, source);
    }
}
