package io.rthub.domain.event;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of a retry request. Every field is optional.
 */
public record RetryParams(
    @JsonProperty("reason") String reason,
    @JsonProperty("priority") String priority,
    @JsonProperty("retry_options") RetryOptions retryOptions
) {
    public static RetryParams none() {
        return new RetryParams(null, null, null);
    }

    public static RetryParams withOptions(Integer maxAttempts, Integer delaySeconds) {
        return new RetryParams(null, null, new RetryOptions(maxAttempts, delaySeconds));
    }

    /**
     * Overrides for the retry budget and delay; non-positive values mean "use the default".
     */
    public record RetryOptions(
        @JsonProperty("max_attempts") Integer maxAttempts,
        @JsonProperty("delay_seconds") Integer delaySeconds
    ) {
    }
}
