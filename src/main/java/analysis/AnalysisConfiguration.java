package analysis;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import analysis.dataflow.DataFlow;
import analysis.dataflow.WorklistOrder;

/**
 * Settings for one run of the analyzer. Immutable, use the {@link Builder} to create one.
 */
public final class AnalysisConfiguration {

    private final Set<AnalysisKind> analyses;
    private final int numThreads;
    private final WorklistOrder order;
    private final int outputLevel;
    private final boolean paranoidPointerAnalysis;
    private final int maxVisitsPerNode;

    private AnalysisConfiguration(Builder b) {
        this.analyses = Collections.unmodifiableSet(EnumSet.copyOf(b.analyses));
        this.numThreads = b.numThreads;
        this.order = b.order;
        this.outputLevel = b.outputLevel;
        this.paranoidPointerAnalysis = b.paranoidPointerAnalysis;
        this.maxVisitsPerNode = b.maxVisitsPerNode;
    }

    /**
     * @return configuration running every analysis on one thread in reverse postorder
     */
    public static AnalysisConfiguration defaults() {
        return new Builder().build();
    }

    public Set<AnalysisKind> getAnalyses() {
        return analyses;
    }

    public boolean shouldRun(AnalysisKind kind) {
        return analyses.contains(kind);
    }

    public int getNumThreads() {
        return numThreads;
    }

    public WorklistOrder getWorklistOrder() {
        return order;
    }

    public int getOutputLevel() {
        return outputLevel;
    }

    public boolean isParanoidPointerAnalysis() {
        return paranoidPointerAnalysis;
    }

    public int getMaxVisitsPerNode() {
        return maxVisitsPerNode;
    }

    @Override
    public String toString() {
        return "analyses=" + analyses + " threads=" + numThreads + " order=" + order.getShortName() + " output="
                + outputLevel;
    }

    /**
     * Builder for {@link AnalysisConfiguration}
     */
    public static final class Builder {
        private Set<AnalysisKind> analyses = EnumSet.allOf(AnalysisKind.class);
        private int numThreads = 1;
        private WorklistOrder order = WorklistOrder.REVERSE_POSTORDER;
        private int outputLevel = 0;
        private boolean paranoidPointerAnalysis = false;
        private int maxVisitsPerNode = DataFlow.DEFAULT_MAX_VISITS_PER_NODE;

        /**
         * Analyses to run, an empty collection is not allowed
         */
        public Builder analyses(Collection<AnalysisKind> kinds) {
            if (kinds == null || kinds.isEmpty()) {
                throw new IllegalArgumentException("At least one analysis is required");
            }
            this.analyses = EnumSet.copyOf(kinds);
            return this;
        }

        public Builder numThreads(int n) {
            if (n < 1) {
                throw new IllegalArgumentException("Number of threads must be positive: " + n);
            }
            this.numThreads = n;
            return this;
        }

        public Builder worklistOrder(WorklistOrder o) {
            if (o == null) {
                throw new IllegalArgumentException("null worklist order");
            }
            this.order = o;
            return this;
        }

        public Builder outputLevel(int level) {
            this.outputLevel = level;
            return this;
        }

        public Builder paranoidPointerAnalysis(boolean paranoid) {
            this.paranoidPointerAnalysis = paranoid;
            return this;
        }

        public Builder maxVisitsPerNode(int max) {
            if (max < 1) {
                throw new IllegalArgumentException("Visit bound must be positive: " + max);
            }
            this.maxVisitsPerNode = max;
            return this;
        }

        public AnalysisConfiguration build() {
            return new AnalysisConfiguration(this);
        }
    }
}
