package sandboxstudio.playback.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Vote state of one county as of the playback cursor.
 */
public record CountyState(
        String id,
        long demVotes,
        long gopVotes,
        long otherVotes,
        long totalVotes,
        double reportingPercent,
        @JsonProperty("isFullyReported") boolean fullyReported,
        double sourceTimestamp,
        @JsonProperty("isManualOverride") boolean manualOverride
) {
    public static final double FULLY_REPORTED_PERCENT = 99.9;

    public static CountyState initial(String id) {
        return new CountyState(id, 0, 0, 0, 0, 0, false, 0, false);
    }

    public boolean hasReported() {
        return reportingPercent > 0;
    }

    @JsonIgnore
    public boolean isComplete() {
        return fullyReported || reportingPercent >= FULLY_REPORTED_PERCENT;
    }
}
