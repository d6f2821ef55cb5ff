package org.benchlab.state;

/**
 * Lifecycle stages in their total order.
 */
public enum StageType {
    BENCHMARK("Benchmark", 1),
    EXEC("BenchmarkExec", 2),
    EVAL("BenchmarkEval", 3),
    REPORT("BenchmarkReport", 4);

    private final String label;
    private final int rank;

    StageType(String label, int rank) {
        this.label = label;
        this.rank = rank;
    }

    /**
     * Name recorded as {@code metadata.class_name} in artifacts.
     */
    public String label() {
        return label;
    }

    public int rank() {
        return rank;
    }

    /**
     * Whether an artifact recorded at this stage carries enough data to build {@code target}.
     */
    public boolean canBuild(StageType target) {
        return rank >= target.rank;
    }

    public static StageType fromLabel(String label) {
        for (StageType type : values()) {
            if (type.label.equals(label)) {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown stage: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
