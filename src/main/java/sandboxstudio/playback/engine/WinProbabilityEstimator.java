package sandboxstudio.playback.engine;

/**
 * Chance, in percent, that the Republican side carries a rollup. 50 means even.
 */
@FunctionalInterface
public interface WinProbabilityEstimator {

    double estimate(long marginAbsolute, long totalVotes, long votesRemaining);
}
