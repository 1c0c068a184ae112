package fr.lapetina.airouter.domain.model;

/**
 * Token accounting for one completion.
 * The total is derived, so it always equals prompt plus completion tokens.
 */
public record Usage(int promptTokens, int completionTokens) {

    public static final Usage EMPTY = new Usage(0, 0);

    public Usage {
        if (promptTokens < 0 || completionTokens < 0) {
            throw new IllegalArgumentException(
                    "Token counts must be non-negative: prompt=" + promptTokens + ", completion=" + completionTokens);
        }
    }

    public static Usage of(int promptTokens, int completionTokens) {
        return new Usage(promptTokens, completionTokens);
    }

    /**
     * Builds usage from nullable vendor counts, treating missing values as zero.
     */
    public static Usage ofNullable(Integer promptTokens, Integer completionTokens) {
        return new Usage(
                promptTokens != null ? Math.max(0, promptTokens) : 0,
                completionTokens != null ? Math.max(0, completionTokens) : 0
        );
    }

    /**
     * Exact sum, even when both counts are near {@link Integer#MAX_VALUE}.
     */
    public long totalTokens() {
        return (long) promptTokens + completionTokens;
    }
}
