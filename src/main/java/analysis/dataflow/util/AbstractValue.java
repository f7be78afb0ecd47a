package analysis.dataflow.util;

/**
 * Abstract value used for data-flow analysis. Implementations must be immutable and define equals and hashCode.
 * <p>
 * The values of one analysis form a lattice of finite height: {@link #leq(Object)} is a partial order, the bottom
 * element is below every other value and {@link #join(Object)} computes the least upper bound, so joining is
 * idempotent, commutative and never loses information.
 *
 * @param <T>
 *            Type of the implementing class (e.g. MyAbsVal implements AbstractValue&lt;MyAbsVal&gt;)
 */
public interface AbstractValue<T> {

    /**
     * Is this abstract value less than or equal to the given abstract value
     *
     * @param that
     *            value to compare
     * @return true if this is less than or equal to that
     */
    boolean leq(T that);

    /**
     * Is this the bottom element
     *
     * @return true if this is the bottom element
     */
    boolean isBottom();

    /**
     * Take the upper bound of this abstract value and the given abstract value
     *
     * @param that
     *            value to take the upper bound with
     * @return the upper bound of this and that
     */
    T join(T that);
}
