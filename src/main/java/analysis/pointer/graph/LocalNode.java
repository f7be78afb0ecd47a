package analysis.pointer.graph;

/**
 * Points-to graph node for a local variable of the procedure being analyzed
 */
public final class LocalNode implements PointsToGraphNode {

    /**
     * Variable name
     */
    private final String name;

    /**
     * Points-to graph node for a local variable
     *
     * @param name
     *            name of the variable
     */
    public LocalNode(String name) {
        assert name != null;
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof LocalNode)) {
            return false;
        }
        return name.equals(((LocalNode) obj).name);
    }

    @Override
    public String toString() {
        return name;
    }
}
