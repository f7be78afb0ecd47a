package main;

import ir.MalformedProcedureException;
import ir.Program;
import ir.json.ProgramReader;

import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.Set;

import org.json.JSONException;

import results.ProcedureResult;
import results.ProgramResults;
import results.TextReport;
import util.print.CFGWriter;
import util.print.PointsToGraphWriter;
import analysis.AnalysisConfiguration;
import analysis.ProgramAnalysis;

import com.beust.jcommander.ParameterException;

/**
 * Analyze the procedures described in a JSON file and report the results, see usage
 */
public class AnalyzerMain {

    /**
     * Every procedure was analyzed (possibly approximately)
     */
    public static final int EXIT_OK = 0;
    /**
     * Some procedure failed
     */
    public static final int EXIT_FAILURE = 1;
    /**
     * Bad command line, or the input could not be read
     */
    public static final int EXIT_USAGE = 2;

    /**
     * Run the analyzer
     *
     * @param args
     *            options and parameters see useage (pass in "-h") for details
     */
    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    /**
     * Run the analyzer, printing text and JSON reports to the given stream unless an output directory is given
     *
     * @param args
     *            command line arguments
     * @param out
     *            stream for reports
     * @return exit code
     */
    public static int run(String[] args, PrintStream out) {
        AnalyzerOptions options;
        try {
            options = AnalyzerOptions.getOptions(args);
        }
        catch (ParameterException e) {
            System.err.println(e.getMessage());
            System.err.println(AnalyzerOptions.getUseage());
            return EXIT_USAGE;
        }
        if (options.shouldPrintUseage()) {
            System.err.println(AnalyzerOptions.getUseage());
            return EXIT_OK;
        }
        if (options.getFile() == null) {
            System.err.println("No input file, use -file");
            System.err.println(AnalyzerOptions.getUseage());
            return EXIT_USAGE;
        }

        Program program;
        try {
            program = ProgramReader.read(new File(options.getFile()));
        }
        catch (IOException e) {
            System.err.println("Could not read " + options.getFile() + ": " + e);
            return EXIT_USAGE;
        }
        catch (MalformedProcedureException e) {
            System.err.println("Malformed input " + options.getFile() + ": " + e.getMessage());
            return EXIT_USAGE;
        }
        if (options.getLanguage() != null) {
            program = program.withLanguage(options.getLanguage());
        }

        AnalysisConfiguration config = options.toConfiguration();
        if (options.getOutputLevel() >= 1) {
            System.err.println("Read " + program.getProcedures().size() + " procedures from " + options.getFile());
        }
        long start = System.currentTimeMillis();
        ProgramResults results = new ProgramAnalysis(config).run(program);
        if (options.getOutputLevel() >= 1) {
            System.err.println("Finished analysis in " + (System.currentTimeMillis() - start) / 1000.0 + "s");
        }

        try {
            writeResults(results, options, out);
        }
        catch (IOException | JSONException e) {
            System.err.println("Could not write results: " + e.getMessage());
            return EXIT_USAGE;
        }
        return results.hasFailures() ? EXIT_FAILURE : EXIT_OK;
    }

    private static void writeResults(ProgramResults results, AnalyzerOptions options, PrintStream out)
                                                                                                      throws IOException {
        String dir = options.getOutputDir();
        String baseName = fileNameFor(new File(options.getFile()).getName().replaceFirst("\\.json$", ""));
        switch (options.getFormat()) {
        case "dot":
            writeDot(results, dir == null ? AnalyzerOptions.DEFAULT_DOT_DIR : dir);
            return;
        case "json":
            if (dir == null) {
                Writer w = new OutputStreamWriter(out, StandardCharsets.UTF_8);
                results.writeJSON(w);
                w.write("\n");
                w.flush();
            }
            else {
                Files.createDirectories(Paths.get(dir));
                String fullFilename = dir + "/" + baseName + "_results.json";
                try (Writer w = Files.newBufferedWriter(Paths.get(fullFilename), StandardCharsets.UTF_8)) {
                    results.writeJSON(w);
                }
                System.err.println("JSON written to: " + fullFilename);
            }
            return;
        case "text":
            if (dir == null) {
                new TextReport(results).write(new OutputStreamWriter(out, StandardCharsets.UTF_8));
            }
            else {
                Files.createDirectories(Paths.get(dir));
                String fullFilename = dir + "/" + baseName + "_report.txt";
                try (Writer w = Files.newBufferedWriter(Paths.get(fullFilename), StandardCharsets.UTF_8)) {
                    new TextReport(results).write(w);
                }
                System.err.println("Report written to: " + fullFilename);
            }
            return;
        default:
            throw new RuntimeException("Unknown format " + options.getFormat());
        }
    }

    /**
     * Write a CFG (annotated with the data-flow facts) and a points-to graph for every analyzed procedure
     */
    private static void writeDot(ProgramResults results, String dir) throws IOException {
        Files.createDirectories(Paths.get(dir));
        Set<String> usedNames = new HashSet<>();
        for (ProcedureResult r : results.getResults().values()) {
            if (!r.getStatus().hasResults()) {
                continue;
            }
            String name = uniqueFileName(fileNameFor(r.getProcedureName()), usedNames);
            CFGWriter cfgWriter = new CFGWriter(r.getControlFlowGraph());
            if (r.getLiveVariables() != null) {
                cfgWriter.addAnnotation("live", r.getLiveVariables());
            }
            if (r.getReachingDefinitions() != null) {
                cfgWriter.addAnnotation("reaching", r.getReachingDefinitions());
            }
            if (!cfgWriter.writeToFile(dir + "/cfg_" + name)) {
                throw new IOException("could not write CFG for " + r.getProcedureName());
            }
            if (r.getPointsTo() != null) {
                PointsToGraphWriter ptgWriter = new PointsToGraphWriter(r.getPointsTo().getGraph());
                if (!ptgWriter.writeToFile(dir + "/ptg_" + name)) {
                    throw new IOException("could not write points-to graph for " + r.getProcedureName());
                }
            }
        }
    }

    /**
     * Replace characters that are not safe in file names
     */
    static String fileNameFor(String name) {
        return name.replaceAll("[^A-Za-z0-9_.-]", "_");
    }

    /**
     * Add a numeric suffix to the name if it has been used already, e.g. for "ns::f" and "ns__f"
     *
     * @param base
     *            file name with unsafe characters replaced
     * @param usedNames
     *            names handed out so far, the returned name is added
     * @return name not in usedNames
     */
    static String uniqueFileName(String base, Set<String> usedNames) {
        String name = base;
        int count = 1;
        while (!usedNames.add(name)) {
            name = base + "_" + count++;
        }
        return name;
    }
}
