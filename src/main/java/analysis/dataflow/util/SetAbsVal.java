package analysis.dataflow.util;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Immutable set of elements ordered by subset inclusion. Join is union and the empty set is bottom, which makes this
 * the lattice for "may" analyses over a finite universe.
 *
 * @param <E>
 *            type of the elements, the natural ordering is used for printing
 */
public final class SetAbsVal<E extends Comparable<? super E>> implements AbstractValue<SetAbsVal<E>>, Iterable<E> {

    @SuppressWarnings("rawtypes")
    private static final SetAbsVal EMPTY = new SetAbsVal<>(new TreeSet<String>());

    private final SortedSet<E> elements;

    private SetAbsVal(SortedSet<E> elements) {
        this.elements = Collections.unmodifiableSortedSet(elements);
    }

    /**
     * The bottom element
     *
     * @return empty set
     */
    @SuppressWarnings("unchecked")
    public static <E extends Comparable<? super E>> SetAbsVal<E> empty() {
        return EMPTY;
    }

    /**
     * Set containing exactly the given elements
     *
     * @param c
     *            elements
     * @return abstract value for the set
     */
    public static <E extends Comparable<? super E>> SetAbsVal<E> of(Collection<? extends E> c) {
        if (c.isEmpty()) {
            return empty();
        }
        return new SetAbsVal<>(new TreeSet<E>(c));
    }

    @Override
    public boolean leq(SetAbsVal<E> that) {
        return this == that || that.elements.containsAll(this.elements);
    }

    @Override
    public boolean isBottom() {
        return elements.isEmpty();
    }

    @Override
    public SetAbsVal<E> join(SetAbsVal<E> that) {
        if (this.leq(that)) {
            return that;
        }
        if (that.leq(this)) {
            return this;
        }
        SortedSet<E> union = new TreeSet<>(this.elements);
        union.addAll(that.elements);
        return new SetAbsVal<>(union);
    }

    /**
     * This set with the given elements added
     *
     * @param c
     *            elements to add
     * @return new set (or this set if nothing was added)
     */
    public SetAbsVal<E> plus(Collection<? extends E> c) {
        if (elements.containsAll(c)) {
            return this;
        }
        SortedSet<E> s = new TreeSet<>(this.elements);
        s.addAll(c);
        return new SetAbsVal<>(s);
    }

    /**
     * This set with the given elements removed
     *
     * @param c
     *            elements to remove
     * @return new set (or this set if nothing was removed)
     */
    public SetAbsVal<E> minus(Collection<?> c) {
        if (Collections.disjoint(elements, c)) {
            return this;
        }
        SortedSet<E> s = new TreeSet<>(this.elements);
        s.removeAll(c);
        return s.isEmpty() ? SetAbsVal.<E> empty() : new SetAbsVal<>(s);
    }

    public boolean contains(E e) {
        return elements.contains(e);
    }

    public int size() {
        return elements.size();
    }

    /**
     * Elements in their natural order
     *
     * @return unmodifiable sorted set
     */
    public SortedSet<E> getElements() {
        return elements;
    }

    @Override
    public Iterator<E> iterator() {
        return elements.iterator();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SetAbsVal)) {
            return false;
        }
        return elements.equals(((SetAbsVal<?>) obj).elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        Iterator<E> iter = elements.iterator();
        while (iter.hasNext()) {
            sb.append(iter.next());
            if (iter.hasNext()) {
                sb.append(", ");
            }
        }
        return sb.append("}").toString();
    }
}
