package io.github.barebone.llm.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Token counters reported by a backend for one turn.
 */
public final class Usage {

    private static final Usage EMPTY = new Usage(0, 0, 0);

    private final int inputTokens;
    private final int outputTokens;
    private final int totalTokens;

    @JsonCreator
    public Usage(
            @JsonProperty("inputTokens") int inputTokens,
            @JsonProperty("outputTokens") int outputTokens,
            @JsonProperty("totalTokens") int totalTokens) {
        this.inputTokens = inputTokens;
        this.outputTokens = outputTokens;
        this.totalTokens = totalTokens;
    }

    /**
     * Creates usage whose total is the sum of input and output.
     */
    public static Usage of(int inputTokens, int outputTokens) {
        return new Usage(inputTokens, outputTokens, inputTokens + outputTokens);
    }

    /**
     * Creates usage from a backend that may omit the total (reported as zero or less).
     */
    public static Usage of(int inputTokens, int outputTokens, int reportedTotal) {
        return reportedTotal > 0 ?
                new Usage(inputTokens, outputTokens, reportedTotal) :
                of(inputTokens, outputTokens);
    }

    public static Usage empty() {
        return EMPTY;
    }

    public int getInputTokens() {
        return inputTokens;
    }

    public int getOutputTokens() {
        return outputTokens;
    }

    public int getTotalTokens() {
        return totalTokens;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Usage usage = (Usage) o;
        return inputTokens == usage.inputTokens &&
                outputTokens == usage.outputTokens &&
                totalTokens == usage.totalTokens;
    }

    @Override
    public int hashCode() {
        return 31 * (31 * inputTokens + outputTokens) + totalTokens;
    }

    @Override
    public String toString() {
        return "Usage{in=" + inputTokens + ", out=" + outputTokens + ", total=" + totalTokens + '}';
    }
}
