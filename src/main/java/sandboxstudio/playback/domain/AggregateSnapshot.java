package sandboxstudio.playback.domain;

/**
 * Rollup over a group of counties. Rebuilt from county state on every pass, never mutated.
 */
public record AggregateSnapshot(
        String scope,
        long demVotes,
        long gopVotes,
        long otherVotes,
        long totalVotes,
        double demPercent,
        double gopPercent,
        double otherPercent,
        double reportingPercent,
        double voteReportingPercent,
        long expectedTotalVotes,
        long votesRemaining,
        long marginAbsolute,
        double marginPercent,
        Leader leader,
        double winProbabilityHeuristic,
        int countiesReporting,
        int totalCounties,
        int fullyReported,
        int inProgress,
        int notStarted,
        Double reportingEtaSeconds,
        Double voteEtaSeconds,
        double baselineMarginPercent,
        double marginShiftPercent
) {
    public static final String NATIONAL = "national";
}
