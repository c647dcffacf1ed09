package sandboxstudio.playback.domain;

/**
 * Partial manual correction for one county; {@code null} fields keep their current value.
 */
public record CountyOverride(
        Long demVotes,
        Long gopVotes,
        Long otherVotes,
        Long totalVotes,
        Double reportingPercent,
        Boolean fullyReported
) {
    public boolean touchesVoteComponents() {
        return demVotes != null || gopVotes != null || otherVotes != null;
    }

    public boolean isEmpty() {
        return !touchesVoteComponents() && totalVotes == null && reportingPercent == null && fullyReported == null;
    }
}
