package main;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import analysis.AnalysisConfiguration;
import analysis.AnalysisKind;
import analysis.dataflow.WorklistOrder;

import com.beust.jcommander.IParameterValidator;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;

/**
 * Command line options for {@link AnalyzerMain}
 */
public final class AnalyzerOptions {

    /**
     * Directory DOT files are written to when no output directory is given
     */
    public static final String DEFAULT_DOT_DIR = "tests";

    /**
     * JSON file describing the program to analyze
     */
    @Parameter(names = { "-f", "-file" }, description = "JSON file containing the procedures to analyze (required)")
    private String file;

    /**
     * Analyses to run
     */
    @Parameter(names = { "-n", "-analysis" }, validateWith = AnalyzerOptions.AnalysisNameValidator.class, description = "Analyses to run, any of live, reaching and pointer (comma separated or repeated). Default is all of them.")
    private List<String> analyses = new ArrayList<>();

    /**
     * Report format
     */
    @Parameter(names = { "-format" }, validateWith = AnalyzerOptions.FormatValidator.class, description = "Output format: text, dot or json")
    private String format = "text";

    /**
     * Output folder, results are printed to the console if this is not set (DOT files go to "tests")
     */
    @Parameter(names = { "-out" }, description = "Output directory. Text and JSON reports go to the console if this is not set, DOT files go to the tests directory.")
    private String outputDir;

    /**
     * Level of output
     */
    @Parameter(names = { "-output", "-o" }, description = "Level of output (higher means more console output)")
    private Integer outputLevel = 0;

    /**
     * Number of threads used to analyze procedures
     */
    @Parameter(names = { "-threads" }, validateWith = AnalyzerOptions.PositiveInteger.class, description = "Number of procedures to analyze in parallel")
    private Integer numThreads = 1;

    /**
     * Order the data-flow worklist is seeded in
     */
    @Parameter(names = { "-order" }, validateWith = AnalyzerOptions.OrderValidator.class, description = "Data-flow worklist order: rpo (reverse postorder) or program")
    private String order = WorklistOrder.REVERSE_POSTORDER.getShortName();

    /**
     * Source language, overrides the one in the input
     */
    @Parameter(names = { "-lang" }, validateWith = AnalyzerOptions.LanguageValidator.class, description = "Source language of the program: java, cpp or unknown. Overrides the language recorded in the input.")
    private String language;

    /**
     * Flag for re-processing all points-to statements once the engine reaches a fixed point
     */
    @Parameter(names = { "-paranoidPointerAnalysis" }, description = "If set, reprocess all points-to statements after the analysis and fail if anything changes.")
    private boolean paranoidPointerAnalysis = false;

    /**
     * Flag for printing useage information
     */
    @Parameter(names = { "-h", "-help", "-useage", "--help" }, description = "Print useage information")
    private boolean help = false;

    private AnalyzerOptions() {
        // Intentionally blank. Use getOptions to parse the command line.
    }

    /**
     * Parse the command line
     *
     * @param args
     *            command line arguments
     * @return options
     * @throws ParameterException
     *             if an option is unknown or has a bad value
     */
    public static AnalyzerOptions getOptions(String[] args) {
        AnalyzerOptions o = new AnalyzerOptions();
        JCommander jc = JCommander.newBuilder().addObject(o).build();
        jc.parse(args);
        return o;
    }

    /**
     * Validate the requested analysis names
     */
    public static class AnalysisNameValidator implements IParameterValidator {

        @Override
        public void validate(String name, String value) throws ParameterException {
            for (String s : value.split(",")) {
                if (AnalysisKind.forName(s.trim()) == null) {
                    throw new ParameterException(s + " is not a valid analysis name (expected live, reaching or pointer)");
                }
            }
        }
    }

    /**
     * Validate the report format
     */
    public static class FormatValidator implements IParameterValidator {

        @Override
        public void validate(String name, String value) throws ParameterException {
            if (value.equals("text") || value.equals("dot") || value.equals("json")) {
                return;
            }
            throw new ParameterException(name + " must be one of text, dot or json, found " + value);
        }
    }

    /**
     * Validate the worklist order
     */
    public static class OrderValidator implements IParameterValidator {

        @Override
        public void validate(String name, String value) throws ParameterException {
            if (WorklistOrder.forName(value) == null) {
                throw new ParameterException(name + " must be rpo or program, found " + value);
            }
        }
    }

    /**
     * Validate the source language
     */
    public static class LanguageValidator implements IParameterValidator {

        @Override
        public void validate(String name, String value) throws ParameterException {
            if (value.equals("java") || value.equals("cpp") || value.equals("unknown")) {
                return;
            }
            throw new ParameterException(name + " must be java, cpp or unknown, found " + value);
        }
    }

    /**
     * Check that a parameter is a positive integer
     */
    public static class PositiveInteger implements IParameterValidator {

        @Override
        public void validate(String name, String value) throws ParameterException {
            int n;
            try {
                n = Integer.parseInt(value);
            }
            catch (NumberFormatException e) {
                throw new ParameterException(name + " should be a positive integer (found " + value + ")");
            }
            if (n < 1) {
                throw new ParameterException(name + " should be a positive integer (found " + value + ")");
            }
        }
    }

    public String getFile() {
        return file;
    }

    /**
     * Analyses to run, every analysis if none were requested
     *
     * @return set of analyses
     */
    public Set<AnalysisKind> getAnalyses() {
        if (analyses.isEmpty()) {
            return EnumSet.allOf(AnalysisKind.class);
        }
        Set<AnalysisKind> kinds = EnumSet.noneOf(AnalysisKind.class);
        for (String a : analyses) {
            for (String s : a.split(",")) {
                kinds.add(AnalysisKind.forName(s.trim()));
            }
        }
        return Collections.unmodifiableSet(kinds);
    }

    public String getFormat() {
        return format;
    }

    /**
     * @return output directory, null if none was given
     */
    public String getOutputDir() {
        return outputDir;
    }

    public int getOutputLevel() {
        return outputLevel;
    }

    public int getNumThreads() {
        return numThreads;
    }

    public WorklistOrder getWorklistOrder() {
        return WorklistOrder.forName(order);
    }

    /**
     * @return language given on the command line, null if it was not given
     */
    public String getLanguage() {
        return language;
    }

    public boolean isParanoidPointerAnalysis() {
        return paranoidPointerAnalysis;
    }

    public boolean shouldPrintUseage() {
        return help;
    }

    /**
     * Build the analysis configuration described by these options
     *
     * @return immutable configuration
     */
    public AnalysisConfiguration toConfiguration() {
        return new AnalysisConfiguration.Builder().analyses(getAnalyses())
                                                  .numThreads(getNumThreads())
                                                  .worklistOrder(getWorklistOrder())
                                                  .outputLevel(getOutputLevel())
                                                  .paranoidPointerAnalysis(isParanoidPointerAnalysis())
                                                  .build();
    }

    public static String getUseage() {
        StringBuilder sb = new StringBuilder();
        AnalyzerOptions o = new AnalyzerOptions();
        JCommander jc = JCommander.newBuilder().addObject(o).programName("analyzer").build();
        jc.getUsageFormatter().usage(sb);
        return sb.toString();
    }
}
