package sandboxstudio.playback.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One county's entry in a frame. Any component may be absent; missing parts are carried over
 * from the county's earlier updates when the update is materialized into a {@link CountyState}.
 */
public record CountyUpdate(
        String fips,
        Long demVotes,
        Long gopVotes,
        Long otherVotes,
        Long totalVotes,
        Double reportingPercent,
        @JsonProperty("isFullyReported") Boolean fullyReported
) {
    public static CountyUpdate of(String fips, long dem, long gop, long total, double reportingPercent) {
        return new CountyUpdate(fips, dem, gop, null, total, reportingPercent, null);
    }

    /**
     * Whether this update determines a county state without looking at earlier updates.
     */
    public boolean isSelfContained() {
        return demVotes != null
                && gopVotes != null
                && (totalVotes != null || otherVotes != null)
                && reportingPercent != null && !reportingPercent.isNaN();
    }

    public CountyUpdate withFips(String normalizedFips) {
        return new CountyUpdate(normalizedFips, demVotes, gopVotes, otherVotes, totalVotes, reportingPercent, fullyReported);
    }
}
