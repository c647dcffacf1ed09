package sandboxstudio.playback.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.PositiveOrZero;
import sandboxstudio.playback.domain.CountyOverride;

/**
 * Partial manual correction; omitted fields keep the county's current value.
 */
public record OverrideRequest(
        @PositiveOrZero(message = "Dem votes must not be negative")
        Long demVotes,

        @PositiveOrZero(message = "GOP votes must not be negative")
        Long gopVotes,

        @PositiveOrZero(message = "Other votes must not be negative")
        Long otherVotes,

        @PositiveOrZero(message = "Total votes must not be negative")
        Long totalVotes,

        @DecimalMin(value = "0.0", message = "Reporting percent must be between 0 and 100")
        @DecimalMax(value = "100.0", message = "Reporting percent must be between 0 and 100")
        Double reportingPercent,

        @JsonProperty("isFullyReported")
        Boolean fullyReported
) {
    public CountyOverride toOverride() {
        return new CountyOverride(demVotes, gopVotes, otherVotes, totalVotes, reportingPercent, fullyReported);
    }
}
