package util.print;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

import analysis.pointer.graph.AllocSiteNode;
import analysis.pointer.graph.PointsToGraph;
import analysis.pointer.graph.PointsToGraphNode;

/**
 * Write a points-to graph in graphviz dot format. Variables and object fields point to the allocation sites they may
 * refer to.
 */
public class PointsToGraphWriter {

    private final PointsToGraph g;

    public PointsToGraphWriter(PointsToGraph g) {
        this.g = g;
    }

    /**
     * Write the graph to a dot file with the given name
     *
     * @param filename
     *            file name, ".dot" is appended
     * @return true if the file was written
     */
    public final boolean writeToFile(String filename) {
        String fullFilename = filename + ".dot";
        try (Writer out = Files.newBufferedWriter(Paths.get(fullFilename), StandardCharsets.UTF_8)) {
            write(out);
            System.err.println("DOT written to: " + fullFilename);
            return true;
        }
        catch (IOException e) {
            System.err.println("Could not write DOT to file, " + fullFilename + ", " + e.getMessage());
            return false;
        }
    }

    /**
     * Write the graph to the given writer
     *
     * @param writer
     *            output will be written to this writer; will not be closed
     * @throws IOException
     *             writer issues
     */
    public void write(Writer writer) throws IOException {
        double spread = 1.0;
        writer.write("digraph G {\n" + "nodesep=" + spread + ";\n" + "ranksep=" + spread + ";\n"
                + "graph [fontsize=10]" + ";\n" + "node [fontsize=10]" + ";\n" + "edge [fontsize=10]" + ";\n");

        Map<String, Integer> dotToCount = new HashMap<>();
        Map<PointsToGraphNode, String> n2s = new HashMap<>();
        Map<AllocSiteNode, String> k2s = new HashMap<>();

        // Need to differentiate between different nodes with the same string
        for (PointsToGraphNode n : g.getNodes()) {
            n2s.put(n, unique(escape(n.toString()), dotToCount));
        }
        for (AllocSiteNode k : g.getAllocationSites()) {
            k2s.put(k, unique(escape("new " + k.getId() + ": " + k.getDebugString()), dotToCount));
        }

        for (AllocSiteNode k : g.getAllocationSites()) {
            writer.write("\t\"" + k2s.get(k) + "\" [shape=box];\n");
        }
        for (PointsToGraphNode n : g.getNodes()) {
            for (AllocSiteNode k : g.lookup(n)) {
                writer.write("\t\"" + n2s.get(n) + "\" -> " + "\"" + k2s.get(k) + "\";\n");
            }
        }

        writer.write("\n};\n");
    }

    private static String unique(String s, Map<String, Integer> dotToCount) {
        Integer count = dotToCount.get(s);
        if (count == null) {
            dotToCount.put(s, 1);
            return s;
        }
        dotToCount.put(s, count + 1);
        return s + " (" + count + ")";
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
