package sandboxstudio.playback.engine;

/**
 * Margin-over-outstanding-votes heuristic. Not a statistical model.
 *
 * <p>The lead is taken as a share of all votes counted plus still expected, scaled, and added to
 * (GOP lead) or subtracted from (DEM lead) 50. The result is clamped to [0, 100], is 50 at a tie,
 * grows with the lead and shrinks as more of the vote is outstanding.
 */
public class HeuristicWinProbabilityEstimator implements WinProbabilityEstimator {

    public static final double DEFAULT_SCALE = 160.0;

    private final double scale;

    public HeuristicWinProbabilityEstimator() {
        this(DEFAULT_SCALE);
    }

    public HeuristicWinProbabilityEstimator(double scale) {
        this.scale = scale;
    }

    @Override
    public double estimate(long marginAbsolute, long totalVotes, long votesRemaining) {
        double denominator = Math.max((double) Math.max(totalVotes, 0) + Math.max(votesRemaining, 0), 1.0);
        double marginShare = marginAbsolute / denominator;
        double probability = 50.0 + marginShare * scale;
        return Math.max(0.0, Math.min(100.0, probability));
    }
}
