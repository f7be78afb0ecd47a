package util.print;

import ir.ControlKind;
import ir.cfg.CFGNode;
import ir.cfg.ControlFlowGraph;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import util.OrderedPair;
import analysis.dataflow.DataFlowResult;

/**
 * Write out a control flow graph for a procedure in graphviz dot format, optionally annotated with data-flow facts
 */
public class CFGWriter {

    /**
     * Graph to be written
     */
    private final ControlFlowGraph cfg;
    /**
     * If true then the statement text will be included in the nodes, otherwise just the node names
     */
    private boolean verbose;
    /**
     * Holds the string representation of the nodes
     */
    private final Map<CFGNode, String> nodeStrings = new HashMap<>();
    /**
     * Facts printed on each node, with the name of the analysis that computed them
     */
    private final List<OrderedPair<String, DataFlowResult<?>>> annotations = new ArrayList<>();
    /**
     * String to prepend to statements
     */
    private String prefix;
    /**
     * String to append to statements
     */
    private String postfix;

    /**
     * Create a writer for the given control flow graph
     *
     * @param cfg
     *            graph to be printed
     */
    public CFGWriter(ControlFlowGraph cfg) {
        assert cfg != null : "Cannot print null CFG";
        this.cfg = cfg;
    }

    /**
     * Print the in and out facts of the given result on every node
     *
     * @param analysisName
     *            name printed before the facts, e.g. "live"
     * @param result
     *            result for the graph being written
     */
    public void addAnnotation(String analysisName, DataFlowResult<?> result) {
        assert result.getControlFlowGraph() == cfg;
        annotations.add(new OrderedPair<String, DataFlowResult<?>>(analysisName, result));
        nodeStrings.clear();
    }

    /**
     * Write out the graph to the given writer
     *
     * @param writer
     *            writer to write the code to
     * @param prefix
     *            prepended to each line of a node label (e.g. "\t" to indent)
     * @param postfix
     *            append this string to each line of a node label (e.g. "\\l" to left-justify it)
     * @throws IOException
     *             writer issues
     */
    public final void write(Writer writer, String prefix, String postfix) throws IOException {
        this.prefix = prefix;
        this.postfix = postfix;
        nodeStrings.clear();
        double spread = 1.0;
        writer.write("digraph G {\n" + "node [shape=record];\n" + "nodesep=" + spread + ";\n" + "ranksep=" + spread
                + ";\n" + "graph [fontsize=10]" + ";\n" + "node [fontsize=10]" + ";\n" + "edge [fontsize=10]" + ";\n");

        writeGraph(writer);

        writer.write("\n};\n");
    }

    /**
     * Write out the graph with the statement text and annotations on each node.
     *
     * @param writer
     *            writer to write the code to
     * @param prefix
     *            prepended to each line of a node label
     * @param postfix
     *            append this string to each line of a node label
     * @throws IOException
     *             writer issues
     */
    public final void writeVerbose(Writer writer, String prefix, String postfix) throws IOException {
        this.verbose = true;
        write(writer, prefix, postfix);
    }

    /**
     * Write the verbose graph to a dot file with the given name
     *
     * @param filename
     *            file name, ".dot" is appended
     * @return true if the file was written
     */
    public final boolean writeToFile(String filename) {
        String fullFilename = filename + ".dot";
        try (Writer out = Files.newBufferedWriter(Paths.get(fullFilename), StandardCharsets.UTF_8)) {
            writeVerbose(out, "", "\\l");
            System.err.println("DOT written to: " + fullFilename);
            return true;
        }
        catch (IOException e) {
            System.err.println("Could not write DOT to file, " + fullFilename + ", " + e.getMessage());
            return false;
        }
    }

    /**
     * Write all the nodes and edges in the CFG to the given writer
     *
     * @param writer
     *            writer to write the graph to
     * @throws IOException
     *             writer issues
     */
    private void writeGraph(Writer writer) throws IOException {
        for (CFGNode current : cfg) {
            String currentString = getStringForNode(current);
            List<CFGNode> succs = cfg.getSuccs(current);
            if (succs.isEmpty()) {
                writer.write("\t\"" + currentString + "\";\n");
            }
            for (CFGNode succ : succs) {
                String edge = getEdgeLabel(current, succ);
                String edgeLabel = edge == null ? "" : " [label=\"" + edge + "\"]";
                writer.write("\t\"" + currentString + "\" -> \"" + getStringForNode(succ) + "\"" + edgeLabel + ";\n");
            }
        }
    }

    /**
     * Get the string representation of the node
     *
     * @param n
     *            node to get a string for
     * @return string for <code>n</code>
     */
    private String getStringForNode(CFGNode n) {
        String nString = nodeStrings.get(n);
        if (nString == null) {
            StringBuilder sb = new StringBuilder();
            sb.append(n.getName() + postfix);
            if (verbose) {
                if (n.getStatement() != null) {
                    sb.append(prefix + n.getStatement() + postfix);
                }
                for (OrderedPair<String, DataFlowResult<?>> a : annotations) {
                    DataFlowResult<?> r = a.snd();
                    sb.append(prefix + a.fst() + " in: " + r.getInFact(n) + postfix);
                    sb.append(prefix + a.fst() + " out: " + r.getOutFact(n) + postfix);
                }
            }
            nString = escapeDot(sb.toString());
            nodeStrings.put(n, nString);
        }
        return nString;
    }

    /**
     * Properly escape the string so it will be properly formatted in dot
     *
     * @param s
     *            string to escape
     * @return dot-safe string
     */
    static String escapeDot(String s) {
        return s.replace("\"", "\\\"").replace("{", "\\{").replace("}", "\\}").replace("|", "\\|")
                .replace("<", "\\<").replace(">", "\\>").replace("\n", "\\l");
    }

    /**
     * Label for the edge from source to target, can be overridden by subclass
     *
     * @param source
     *            source of the edge
     * @param target
     *            target of the edge
     * @return label or null for no label
     */
    protected String getEdgeLabel(CFGNode source, CFGNode target) {
        if (source.getStatement() == null || source.getStatement().getKind() != ControlKind.BRANCH) {
            return null;
        }
        String targetLabel = target.getStatement() == null ? null : target.getStatement().getLabel();
        if (targetLabel != null && source.getStatement().getTargets().contains(targetLabel)) {
            return "TRUE";
        }
        return "FALSE";
    }
}
