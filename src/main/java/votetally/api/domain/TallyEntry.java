package votetally.api.domain;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Count for one choice. Written on the wire as {@code [choice, count]}.
 */
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"choice", "count"})
public record TallyEntry(
        String choice,
        long count
) {
}
