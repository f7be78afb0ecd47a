package analysis.pointer.graph;

/**
 * Source node in the points-to graph: something that can hold a reference (a local variable or an object field)
 */
public interface PointsToGraphNode {

    @Override
    public boolean equals(Object obj);

    @Override
    public int hashCode();
}
