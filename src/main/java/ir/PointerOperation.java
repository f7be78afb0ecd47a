package ir;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Effect of a statement on references, used by the points-to analysis. Instances are created through the static
 * factory methods and are immutable.
 */
public final class PointerOperation {

    /**
     * Kind of reference manipulation
     */
    public enum Kind {
        /**
         * x = new ..., allocation at a given site
         */
        NEW,
        /**
         * x = y
         */
        COPY,
        /**
         * x = y.f
         */
        LOAD,
        /**
         * x.f = y
         */
        STORE,
        /**
         * x = null
         */
        NULL,
        /**
         * Something the points-to abstraction cannot model (reflection, pointer arithmetic, ...)
         */
        UNSUPPORTED;

        public static Kind forName(String name) {
            for (Kind k : values()) {
                if (k.name().equalsIgnoreCase(name)) {
                    return k;
                }
            }
            return null;
        }
    }

    private final Kind kind;
    /**
     * Variable assigned to (NEW, COPY, LOAD, NULL) or base of the field written (STORE)
     */
    private final String target;
    /**
     * Variable read (COPY, STORE) or base of the field read (LOAD)
     */
    private final String source;
    /**
     * Field name for LOAD and STORE
     */
    private final String field;
    /**
     * Allocation site identifier for NEW, reason for UNSUPPORTED
     */
    private final String detail;

    private PointerOperation(Kind kind, String target, String source, String field, String detail) {
        this.kind = kind;
        this.target = target;
        this.source = source;
        this.field = field;
        this.detail = detail;
    }

    /**
     * x = new T(), allocation site may be null in which case the statement position is used
     */
    public static PointerOperation allocation(String x, String site) {
        return new PointerOperation(Kind.NEW, x, null, null, site);
    }

    /**
     * x = y
     */
    public static PointerOperation copy(String x, String y) {
        return new PointerOperation(Kind.COPY, x, y, null, null);
    }

    /**
     * x = y.f
     */
    public static PointerOperation load(String x, String y, String f) {
        return new PointerOperation(Kind.LOAD, x, y, f, null);
    }

    /**
     * x.f = y
     */
    public static PointerOperation store(String x, String f, String y) {
        return new PointerOperation(Kind.STORE, x, y, f, null);
    }

    /**
     * x = null
     */
    public static PointerOperation nullAssignment(String x) {
        return new PointerOperation(Kind.NULL, x, null, null, null);
    }

    /**
     * Construct the points-to analysis does not model
     *
     * @param reason
     *            human readable description, e.g. "reflective call"
     */
    public static PointerOperation unsupported(String reason) {
        return new PointerOperation(Kind.UNSUPPORTED, null, null, null, reason);
    }

    public Kind getKind() {
        return kind;
    }

    public String getTarget() {
        return target;
    }

    public String getSource() {
        return source;
    }

    public String getField() {
        return field;
    }

    /**
     * Allocation site for {@link Kind#NEW} (may be null), or the reason for {@link Kind#UNSUPPORTED}
     */
    public String getDetail() {
        return detail;
    }

    /**
     * Variables whose value this operation replaces
     *
     * @return set of variables defined
     */
    public Set<String> getImplicitDefs() {
        switch (kind) {
        case NEW:
        case COPY:
        case LOAD:
        case NULL:
            if (target != null) {
                return Collections.singleton(target);
            }
            return Collections.emptySet();
        default:
            return Collections.emptySet();
        }
    }

    /**
     * Variables this operation reads, a store reads both the base and the stored value
     *
     * @return set of variables used
     */
    public Set<String> getImplicitUses() {
        Set<String> uses = new LinkedHashSet<>();
        switch (kind) {
        case COPY:
        case LOAD:
            uses.add(source);
            break;
        case STORE:
            uses.add(target);
            uses.add(source);
            break;
        default:
            break;
        }
        // operands may be missing, the points-to analysis reports those statements as unsupported
        uses.remove(null);
        return uses;
    }

    @Override
    public String toString() {
        switch (kind) {
        case NEW:
            return target + " = new" + (detail == null ? "" : " @" + detail);
        case COPY:
            return target + " = " + source;
        case LOAD:
            return target + " = " + source + "." + field;
        case STORE:
            return target + "." + field + " = " + source;
        case NULL:
            return target + " = null";
        case UNSUPPORTED:
            return "unsupported(" + detail + ")";
        default:
            throw new RuntimeException("Unknown pointer operation " + kind);
        }
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + kind.hashCode();
        result = prime * result + ((target == null) ? 0 : target.hashCode());
        result = prime * result + ((source == null) ? 0 : source.hashCode());
        result = prime * result + ((field == null) ? 0 : field.hashCode());
        result = prime * result + ((detail == null) ? 0 : detail.hashCode());
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof PointerOperation)) {
            return false;
        }
        PointerOperation other = (PointerOperation) obj;
        return kind == other.kind && eq(target, other.target) && eq(source, other.source) && eq(field, other.field)
                && eq(detail, other.detail);
    }

    private static boolean eq(String a, String b) {
        return a == null ? b == null : a.equals(b);
    }
}
