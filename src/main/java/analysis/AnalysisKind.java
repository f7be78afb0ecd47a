package analysis;

/**
 * Analyses that can be requested for a program
 */
public enum AnalysisKind {
    /**
     * Live variables, backward data-flow
     */
    LIVE("live"),
    /**
     * Reaching definitions, forward data-flow
     */
    REACHING("reaching"),
    /**
     * Flow-insensitive points-to and alias analysis
     */
    POINTER("pointer");

    private final String shortName;

    private AnalysisKind(String shortName) {
        this.shortName = shortName;
    }

    /**
     * @return name used on the command line and in reports
     */
    public String getShortName() {
        return shortName;
    }

    /**
     * Look up an analysis by its short name
     *
     * @param name
     *            short name, case insensitive
     * @return the analysis, or null if there is none with that name
     */
    public static AnalysisKind forName(String name) {
        for (AnalysisKind k : values()) {
            if (k.shortName.equalsIgnoreCase(name)) {
                return k;
            }
        }
        return null;
    }
}
