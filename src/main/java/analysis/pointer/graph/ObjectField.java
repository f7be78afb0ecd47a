package analysis.pointer.graph;

/**
 * Points-to graph node for a field of every object allocated at a particular site
 */
public final class ObjectField implements PointsToGraphNode {

    /**
     * Abstract object whose field this is
     */
    private final AllocSiteNode receiver;
    /**
     * Name of the field
     */
    private final String fieldName;
    private final int memoizedHashCode;

    /**
     * Points-to graph node for a field of an abstract object
     *
     * @param receiver
     *            allocation site of the object
     * @param fieldName
     *            name of the field
     */
    public ObjectField(AllocSiteNode receiver, String fieldName) {
        assert receiver != null && fieldName != null;
        this.receiver = receiver;
        this.fieldName = fieldName;
        this.memoizedHashCode = 31 * receiver.hashCode() + fieldName.hashCode();
    }

    public AllocSiteNode getReceiver() {
        return receiver;
    }

    public String getFieldName() {
        return fieldName;
    }

    @Override
    public int hashCode() {
        return memoizedHashCode;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ObjectField)) {
            return false;
        }
        ObjectField other = (ObjectField) obj;
        return receiver.equals(other.receiver) && fieldName.equals(other.fieldName);
    }

    @Override
    public String toString() {
        return "[" + receiver + "]." + fieldName;
    }
}
