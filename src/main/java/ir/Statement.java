package ir;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One statement of a procedure as handed over by a front-end: its text, how control leaves it, the variables it
 * defines and uses, and (optionally) its effect on references.
 * <p>
 * Variables defined or used by the pointer operation are always part of the def and use sets, whether or not the
 * front-end listed them.
 */
public final class Statement {

    private final String text;
    private final ControlKind kind;
    private final Set<String> defs;
    private final Set<String> uses;
    /**
     * Label naming this statement as a jump target, may be null
     */
    private final String label;
    /**
     * Labels this statement may jump to
     */
    private final List<String> targets;
    /**
     * Effect on references, null if the statement does not manipulate references
     */
    private final PointerOperation pointerOperation;

    /**
     * Create a new statement
     *
     * @param text
     *            source text used for printing
     * @param kind
     *            how control leaves the statement
     * @param defs
     *            variables defined
     * @param uses
     *            variables used
     * @param label
     *            label of this statement, null if it has none
     * @param targets
     *            labels of jump targets (empty for NORMAL and RETURN)
     * @param pointerOperation
     *            effect on references, null if none
     */
    public Statement(String text, ControlKind kind, Collection<String> defs, Collection<String> uses, String label,
                     List<String> targets, PointerOperation pointerOperation) {
        if (text == null || kind == null) {
            throw new IllegalArgumentException("Statement needs text and a control kind");
        }
        this.text = text;
        this.kind = kind;
        this.label = label;
        this.pointerOperation = pointerOperation;

        Set<String> d = new LinkedHashSet<>(defs);
        Set<String> u = new LinkedHashSet<>(uses);
        if (pointerOperation != null) {
            d.addAll(pointerOperation.getImplicitDefs());
            u.addAll(pointerOperation.getImplicitUses());
        }
        this.defs = Collections.unmodifiableSet(d);
        this.uses = Collections.unmodifiableSet(u);
        this.targets = Collections.unmodifiableList(new ArrayList<>(targets));
    }

    /**
     * Ordinary statement that falls through
     *
     * @param text
     *            source text
     * @param defs
     *            variables defined
     * @param uses
     *            variables used
     * @return new statement
     */
    public static Statement simple(String text, Collection<String> defs, Collection<String> uses) {
        return new Statement(text,
                             ControlKind.NORMAL,
                             defs,
                             uses,
                             null,
                             Collections.<String> emptyList(),
                             null);
    }

    public String getText() {
        return text;
    }

    public ControlKind getKind() {
        return kind;
    }

    public Set<String> getDefs() {
        return defs;
    }

    public Set<String> getUses() {
        return uses;
    }

    public String getLabel() {
        return label;
    }

    public List<String> getTargets() {
        return targets;
    }

    public PointerOperation getPointerOperation() {
        return pointerOperation;
    }

    @Override
    public String toString() {
        return label == null ? text : label + ": " + text;
    }
}
