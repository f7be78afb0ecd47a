package analysis.pointer.graph;

/**
 * Represents an allocation site in the code. Every object allocated at the same site is represented by the same
 * node.
 */
public final class AllocSiteNode implements Comparable<AllocSiteNode> {

    /**
     * Identifier of the site, unique within a procedure
     */
    private final String id;
    /**
     * Number of the CFG node of the first statement allocating at this site
     */
    private final int nodeNumber;
    /**
     * String used for printing and debugging
     */
    private final String debugString;

    /**
     * Represents the allocation of a new object
     *
     * @param id
     *            identifier of the site
     * @param nodeNumber
     *            CFG node number of the allocating statement
     * @param debugString
     *            String for printing and debugging
     */
    public AllocSiteNode(String id, int nodeNumber, String debugString) {
        if (id == null) {
            throw new RuntimeException("Need allocation site id");
        }
        this.id = id;
        this.nodeNumber = nodeNumber;
        this.debugString = debugString == null ? id : debugString;
    }

    public String getId() {
        return id;
    }

    public int getNodeNumber() {
        return nodeNumber;
    }

    public String getDebugString() {
        return debugString;
    }

    @Override
    public int compareTo(AllocSiteNode o) {
        return id.compareTo(o.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof AllocSiteNode)) {
            return false;
        }
        return id.equals(((AllocSiteNode) obj).id);
    }

    @Override
    public String toString() {
        return id;
    }
}
