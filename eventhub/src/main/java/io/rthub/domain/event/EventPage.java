package io.rthub.domain.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One page of a cursor-paginated listing. Items are always newest first.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EventPage(
    @JsonProperty("items") List<RtEvent> items,
    @JsonProperty("total") long total,
    @JsonProperty("next_cursor") String nextCursor,
    @JsonProperty("prev_cursor") String prevCursor,
    @JsonProperty("has_next_page") boolean hasNextPage,
    @JsonProperty("has_prev_page") boolean hasPrevPage
) {
}
