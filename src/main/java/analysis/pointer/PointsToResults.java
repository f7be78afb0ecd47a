package analysis.pointer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import analysis.pointer.graph.AllocSiteNode;
import analysis.pointer.graph.LocalNode;
import analysis.pointer.graph.PointsToGraph;
import analysis.pointer.registrar.StatementRegistrar;
import analysis.pointer.registrar.UnsupportedConstruct;

/**
 * Points-to and alias information for the variables of one procedure
 */
public final class PointsToResults {

    /**
     * Allocation site identifiers each variable may point to, variables in order of first mention
     */
    private final Map<String, SortedSet<String>> pointsTo;
    /**
     * Other variables sharing at least one allocation site with each variable
     */
    private final Map<String, SortedSet<String>> aliases;
    private final List<UnsupportedConstruct> unsupported;
    private final PointsToGraph graph;

    /**
     * Extract the results for the locals of the registrar from a solved graph
     *
     * @param registrar
     *            registrar the graph was computed from
     * @param graph
     *            points-to graph at the fixed point
     */
    public PointsToResults(StatementRegistrar registrar, PointsToGraph graph) {
        graph.freeze();
        this.graph = graph;
        this.unsupported = Collections.unmodifiableList(new ArrayList<>(registrar.getUnsupportedConstructs()));

        Map<String, SortedSet<String>> pts = new LinkedHashMap<>();
        for (Map.Entry<String, LocalNode> e : registrar.getLocals().entrySet()) {
            SortedSet<String> sites = new TreeSet<>();
            for (AllocSiteNode site : graph.lookup(e.getValue())) {
                sites.add(site.getId());
            }
            pts.put(e.getKey(), Collections.unmodifiableSortedSet(sites));
        }
        this.pointsTo = Collections.unmodifiableMap(pts);

        Map<String, SortedSet<String>> al = new LinkedHashMap<>();
        for (String v : pts.keySet()) {
            SortedSet<String> others = new TreeSet<>();
            for (String w : pts.keySet()) {
                if (!v.equals(w) && !Collections.disjoint(pts.get(v), pts.get(w))) {
                    others.add(w);
                }
            }
            al.put(v, Collections.unmodifiableSortedSet(others));
        }
        this.aliases = Collections.unmodifiableMap(al);
    }

    /**
     * @return variables mentioned by a pointer operation, in order of first mention
     */
    public Set<String> getVariables() {
        return pointsTo.keySet();
    }

    /**
     * Allocation sites the variable may point to
     *
     * @param variable
     *            variable name
     * @return sorted set of allocation site ids, empty if the variable is unknown or points to nothing
     */
    public SortedSet<String> getPointsToSet(String variable) {
        SortedSet<String> s = pointsTo.get(variable);
        if (s == null) {
            return Collections.unmodifiableSortedSet(new TreeSet<String>());
        }
        return s;
    }

    /**
     * Variables that may alias the given one. Never contains the variable itself.
     *
     * @param variable
     *            variable name
     * @return sorted set of variable names
     */
    public SortedSet<String> getAliases(String variable) {
        SortedSet<String> s = aliases.get(variable);
        if (s == null) {
            return Collections.unmodifiableSortedSet(new TreeSet<String>());
        }
        return s;
    }

    /**
     * @return true if the two distinct variables may point to a common allocation site
     */
    public boolean mayAlias(String v, String w) {
        return getAliases(v).contains(w);
    }

    /**
     * @return true if some construct was excluded from the analysis
     */
    public boolean isApproximate() {
        return !unsupported.isEmpty();
    }

    public List<UnsupportedConstruct> getUnsupportedConstructs() {
        return unsupported;
    }

    public PointsToGraph getGraph() {
        return graph;
    }

    @Override
    public String toString() {
        return "pointsTo=" + pointsTo + " aliases=" + aliases + (isApproximate() ? " (approximate)" : "");
    }
}
