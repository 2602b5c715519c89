package io.rthub.domain.event;

/**
 * @param interval rate window such as "30s", "5m" or "1h"
 * @param type     report flavour; "overview" is the default, anything else adds source and priority breakdowns
 */
public record StatsParams(String interval, String type) {

    public static StatsParams overview(String interval) {
        return new StatsParams(interval, "overview");
    }
}
