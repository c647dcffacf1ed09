package sandboxstudio.playback.engine;

import sandboxstudio.playback.domain.AggregateSnapshot;
import sandboxstudio.playback.domain.BaselineEntity;
import sandboxstudio.playback.domain.CountyState;
import sandboxstudio.playback.domain.Leader;
import sandboxstudio.playback.domain.Rollups;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * State and national rollups over a county snapshot.
 *
 * <p>Margins are GOP minus DEM at every level: positive leans Republican, negative Democratic.
 * Every ratio over an empty denominator is 0. Counties missing from the baseline catalog count
 * toward the national rollup only.
 *
 * <p>The last result is memoized against the snapshot fingerprint and elapsed time.
 */
public class AggregationEngine {

    public static final double DEFAULT_NOISE_FLOOR_PERCENT = 1.0;

    private final BaselineCatalog catalog;
    private final WinProbabilityEstimator winProbability;
    private final double noiseFloorPercent;

    private Map<String, CountyState> lastStates;
    private int lastFingerprint;
    private double lastElapsed;
    private Rollups lastResult;

    public AggregationEngine(BaselineCatalog catalog, WinProbabilityEstimator winProbability, double noiseFloorPercent) {
        this.catalog = catalog;
        this.winProbability = winProbability;
        this.noiseFloorPercent = noiseFloorPercent;
    }

    public Rollups compute(Map<String, CountyState> states, double elapsedSeconds) {
        return compute(states, states.hashCode(), elapsedSeconds);
    }

    public synchronized Rollups compute(Map<String, CountyState> states, int fingerprint, double elapsedSeconds) {
        if (lastResult != null
                && fingerprint == lastFingerprint
                && Double.compare(elapsedSeconds, lastElapsed) == 0
                && (states == lastStates || states.equals(lastStates))) {
            return lastResult;
        }

        Map<String, AggregateSnapshot> byState = new LinkedHashMap<>();
        for (String stateId : catalog.stateIds()) {
            Tally tally = new Tally();
            for (BaselineEntity county : catalog.countiesInState(stateId)) {
                tally.add(states.getOrDefault(county.id(), CountyState.initial(county.id())), county);
            }
            byState.put(stateId, snapshot(stateId, tally, elapsedSeconds));
        }

        Tally national = new Tally();
        long unassigned = 0;
        for (CountyState state : states.values()) {
            BaselineEntity baseline = catalog.get(state.id()).orElse(null);
            national.add(state, baseline);
            if (baseline == null) {
                unassigned += state.totalVotes();
            }
        }

        Rollups result = new Rollups(snapshot(AggregateSnapshot.NATIONAL, national, elapsedSeconds), byState, unassigned);
        lastStates = states;
        lastFingerprint = fingerprint;
        lastElapsed = elapsedSeconds;
        lastResult = result;
        return result;
    }

    /**
     * Eventual total for one county: extrapolated from its reporting pace once past the noise
     * floor, otherwise the baseline expectation. Never below what it has already reported.
     */
    long estimateEventualTotal(CountyState state, long baselineExpected) {
        long estimate;
        if (state.isComplete()) {
            estimate = state.totalVotes();
        } else if (state.reportingPercent() > noiseFloorPercent) {
            estimate = Math.round(state.totalVotes() / (state.reportingPercent() / 100.0));
        } else {
            estimate = baselineExpected;
        }
        return Math.max(estimate, state.totalVotes());
    }

    private AggregateSnapshot snapshot(String scope, Tally tally, double elapsedSeconds) {
        long total = tally.totalVotes;
        long expected = Math.max(total, tally.estimatedTotal);
        long remaining = Math.max(expected - total, 0);
        long margin = tally.gopVotes - tally.demVotes;

        double reportingPercent = percent(tally.countiesReporting, tally.totalCounties);
        double voteReportingPercent = Math.min(percent(total, expected), 100.0);
        double marginPercent = finite(margin / (double) Math.max(total, 1) * 100.0);
        double baselineMargin = tally.baselineExpected > 0
                ? finite(tally.baselineMarginWeighted / tally.baselineExpected * 100.0)
                : 0.0;

        return new AggregateSnapshot(
                scope,
                tally.demVotes,
                tally.gopVotes,
                tally.otherVotes,
                total,
                percent(tally.demVotes, total),
                percent(tally.gopVotes, total),
                percent(tally.otherVotes, total),
                reportingPercent,
                voteReportingPercent,
                expected,
                remaining,
                margin,
                marginPercent,
                Leader.fromMargin(margin),
                finite(winProbability.estimate(margin, total, remaining)),
                tally.countiesReporting,
                tally.totalCounties,
                tally.fullyReported,
                tally.inProgress,
                tally.notStarted,
                eta(reportingPercent, elapsedSeconds),
                eta(voteReportingPercent, elapsedSeconds),
                baselineMargin,
                total > 0 ? finite(marginPercent - baselineMargin) : 0.0
        );
    }

    private static Double eta(double progressPercent, double elapsedSeconds) {
        if (elapsedSeconds <= 0) {
            return null;
        }
        double velocity = progressPercent / Math.max(elapsedSeconds, 1.0);
        if (velocity <= 0 || !Double.isFinite(velocity)) {
            return null;
        }
        return Math.max((100.0 - progressPercent) / velocity, 0.0);
    }

    private static double percent(double part, double whole) {
        return whole > 0 ? finite(part / whole * 100.0) : 0.0;
    }

    private static double finite(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }

    private final class Tally {
        long demVotes;
        long gopVotes;
        long otherVotes;
        long totalVotes;
        long estimatedTotal;
        long baselineExpected;
        double baselineMarginWeighted;
        int countiesReporting;
        int totalCounties;
        int fullyReported;
        int inProgress;
        int notStarted;

        void add(CountyState state, BaselineEntity baseline) {
            long expected = baseline == null ? 0 : baseline.expectedTotalVotes();
            demVotes += state.demVotes();
            gopVotes += state.gopVotes();
            otherVotes += state.otherVotes();
            totalVotes += state.totalVotes();
            estimatedTotal += estimateEventualTotal(state, expected);
            totalCounties++;
            if (baseline != null) {
                baselineExpected += expected;
                baselineMarginWeighted += expected * (baseline.gopShare() - baseline.demShare());
            }
            if (state.hasReported()) {
                countiesReporting++;
                if (state.isComplete()) {
                    fullyReported++;
                } else {
                    inProgress++;
                }
            } else {
                notStarted++;
            }
        }
    }
}
