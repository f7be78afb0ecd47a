package ir;

/**
 * How control leaves a statement
 */
public enum ControlKind {
    /**
     * Falls through to the next statement (or to the exit after the last statement)
     */
    NORMAL,
    /**
     * Unconditional jump to exactly one labeled statement
     */
    GOTO,
    /**
     * Conditional jump to each target, may also fall through
     */
    BRANCH,
    /**
     * Multi-way jump to each target, never falls through
     */
    SWITCH,
    /**
     * Leaves the procedure
     */
    RETURN;

    /**
     * Find the kind with the given (case-insensitive) name
     *
     * @param name
     *            name of the kind, e.g. "goto"
     * @return the kind or null if there is no kind with that name
     */
    public static ControlKind forName(String name) {
        for (ControlKind k : values()) {
            if (k.name().equalsIgnoreCase(name)) {
                return k;
            }
        }
        return null;
    }

    /**
     * Whether control may continue to the statement that follows this one
     *
     * @return true if this kind can fall through
     */
    public boolean fallsThrough() {
        return this == NORMAL || this == BRANCH;
    }
}
