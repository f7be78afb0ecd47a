package analysis.dataflow;

/**
 * Order in which the data-flow solver seeds its worklist. The order does not change the fixed point, only the number
 * of times nodes are visited before reaching it.
 */
public enum WorklistOrder {
    /**
     * Reverse postorder of the data-flow graph: reverse postorder of the CFG for forward analyses and of the inverted
     * CFG for backward ones
     */
    REVERSE_POSTORDER("rpo"),
    /**
     * Entry, statements in program order, exit
     */
    PROGRAM_ORDER("program");

    private final String shortName;

    private WorklistOrder(String shortName) {
        this.shortName = shortName;
    }

    /**
     * Name used on the command line
     */
    public String getShortName() {
        return shortName;
    }

    /**
     * Find the order with the given short name
     *
     * @param name
     *            e.g. "rpo"
     * @return the order or null if there is none with that name
     */
    public static WorklistOrder forName(String name) {
        for (WorklistOrder o : values()) {
            if (o.shortName.equals(name)) {
                return o;
            }
        }
        return null;
    }
}
