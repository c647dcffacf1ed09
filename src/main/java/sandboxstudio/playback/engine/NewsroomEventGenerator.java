package sandboxstudio.playback.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sandboxstudio.playback.domain.AggregateSnapshot;
import sandboxstudio.playback.domain.BaselineEntity;
import sandboxstudio.playback.domain.Leader;
import sandboxstudio.playback.domain.NewsroomEvent;
import sandboxstudio.playback.domain.ReportingConfig;
import sandboxstudio.playback.domain.Rollups;
import sandboxstudio.playback.domain.Severity;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns successive rollups into newsroom moments: race calls, lead changes, swings against the
 * baseline and national coverage milestones.
 *
 * <p>A call needs both the share of counties reporting and the share of expected vote counted past
 * the call threshold. Swings are judged on the expected-vote share only.
 *
 * <p>Each event is remembered so that feeding the same rollups again emits nothing new. Lead
 * changes compare against the last non-tied sign seen for the state and fire once per new leader
 * and vote count. Rollups older than the last ones processed (a backward seek) update the lead
 * silently. The memory lives until {@link #reset()}.
 */
public class NewsroomEventGenerator {

    private static final Logger log = LoggerFactory.getLogger(NewsroomEventGenerator.class);

    public static final String RACE_CALL = "race-call";
    public static final String LEAD_CHANGE = "lead-change";
    public static final String SWING = "swing";
    public static final String MILESTONE = "milestone";
    public static final String REPORTING_PLAN = "reporting-plan";

    private static final int[] COVERAGE_MILESTONES = {25, 50, 75, 100};

    private final NewsroomSettings settings;
    private final BaselineCatalog catalog;
    private final ReportingConfig reportingConfig;

    private final Set<String> calledStates = new HashSet<>();
    private final Set<String> swungStates = new HashSet<>();
    private final Map<String, Integer> leadSigns = new HashMap<>();
    private final Set<String> announcedLeadChanges = new HashSet<>();
    private final Set<Integer> milestonesReached = new HashSet<>();
    private final Deque<NewsroomEvent> recent = new ArrayDeque<>();
    private boolean planAnnounced;
    private double lastProcessedTime = Double.NEGATIVE_INFINITY;
    private boolean disposed;

    public NewsroomEventGenerator(NewsroomSettings settings, BaselineCatalog catalog, ReportingConfig reportingConfig) {
        this.settings = settings;
        this.catalog = catalog;
        this.reportingConfig = reportingConfig == null ? ReportingConfig.none() : reportingConfig;
    }

    /**
     * Scans one set of rollups and returns the events it produced, oldest first.
     */
    public synchronized List<NewsroomEvent> process(Rollups rollups, double simulationTimeSeconds) {
        if (disposed) {
            return List.of();
        }
        boolean rewound = simulationTimeSeconds < lastProcessedTime;
        lastProcessedTime = simulationTimeSeconds;
        List<NewsroomEvent> fresh = new ArrayList<>();

        if (!planAnnounced && reportingConfig.isPresent()) {
            planAnnounced = true;
            String description = reportingConfig.description();
            fresh.add(NewsroomEvent.create(REPORTING_PLAN, simulationTimeSeconds, "Reporting plan loaded",
                    description != null ? description : "Custom reporting order in effect",
                    Severity.INFO, null, null, null));
        }

        rollups.states().forEach((stateId, snapshot) ->
                scanState(stateId, snapshot, simulationTimeSeconds, rewound, fresh));
        scanNational(rollups.national(), simulationTimeSeconds, fresh);

        for (NewsroomEvent event : fresh) {
            recent.addFirst(event);
            log.info("Newsroom [{}] t={}s: {}", event.severity().getValue(), event.simulationTimeSeconds(), event.headline());
        }
        while (recent.size() > settings.maxEvents()) {
            recent.removeLast();
        }
        return fresh;
    }

    /** Retained events, newest first. */
    public synchronized List<NewsroomEvent> events() {
        return List.copyOf(recent);
    }

    public synchronized void reset() {
        calledStates.clear();
        swungStates.clear();
        leadSigns.clear();
        announcedLeadChanges.clear();
        milestonesReached.clear();
        recent.clear();
        planAnnounced = false;
        lastProcessedTime = Double.NEGATIVE_INFINITY;
    }

    /**
     * Resets and stops producing events; later calls to {@link #process} return nothing.
     */
    public synchronized void dispose() {
        reset();
        disposed = true;
    }

    private void scanState(String stateId, AggregateSnapshot snapshot, double time, boolean rewound,
                           List<NewsroomEvent> out) {
        if (snapshot.totalVotes() <= 0) {
            return;
        }
        String label = stateLabel(stateId);
        double margin = snapshot.marginPercent();

        if (!calledStates.contains(stateId)
                && snapshot.reportingPercent() >= settings.callReportingPercent()
                && snapshot.voteReportingPercent() >= settings.callReportingPercent()
                && Math.abs(margin) > settings.callMarginPercent()) {
            calledStates.add(stateId);
            out.add(NewsroomEvent.create(RACE_CALL, time,
                    label + " called for " + partyName(snapshot.leader()),
                    String.format("%s leads by %.1f points with %.1f%% of the expected vote in",
                            partyName(snapshot.leader()), Math.abs(margin), snapshot.voteReportingPercent()),
                    Severity.SUCCESS, stateId, margin, snapshot.reportingPercent()));
        }

        int sign = Long.signum(snapshot.marginAbsolute());
        if (sign != 0) {
            Integer previous = leadSigns.put(stateId, sign);
            if (previous != null && previous != sign && !rewound
                    && announcedLeadChanges.add(leadChangeKey(stateId, sign, snapshot))) {
                out.add(NewsroomEvent.create(LEAD_CHANGE, time,
                        partyName(snapshot.leader()) + " takes the lead in " + label,
                        String.format("Margin now %+.1f points with %.1f%% of counties reporting",
                                margin, snapshot.reportingPercent()),
                        calledStates.contains(stateId) ? Severity.WARNING : Severity.INFO,
                        stateId, margin, snapshot.reportingPercent()));
            }
        }

        if (!swungStates.contains(stateId)
                && snapshot.voteReportingPercent() >= settings.swingReportingFloor()
                && Math.abs(snapshot.marginShiftPercent()) >= settings.swingPercent()) {
            swungStates.add(stateId);
            out.add(NewsroomEvent.create(SWING, time,
                    String.format("%s swings %.1f points toward %s", label,
                            Math.abs(snapshot.marginShiftPercent()),
                            snapshot.marginShiftPercent() > 0 ? "Republicans" : "Democrats"),
                    String.format("Margin %+.1f vs baseline %+.1f", margin, snapshot.baselineMarginPercent()),
                    Severity.WARNING, stateId, margin, snapshot.reportingPercent()));
        }
    }

    private void scanNational(AggregateSnapshot national, double time, List<NewsroomEvent> out) {
        for (int milestone : COVERAGE_MILESTONES) {
            if (national.reportingPercent() >= milestone && milestonesReached.add(milestone)) {
                out.add(NewsroomEvent.create(MILESTONE, time,
                        milestone == 100 ? "All counties reporting" : milestone + "% of counties reporting",
                        String.format("%d of %d counties have posted results", national.countiesReporting(),
                                national.totalCounties()),
                        Severity.INFO, null, national.marginPercent(), national.reportingPercent()));
            }
        }
    }

    private static String leadChangeKey(String stateId, int sign, AggregateSnapshot snapshot) {
        return stateId + ':' + sign + ':' + snapshot.demVotes() + ':' + snapshot.gopVotes() + ':' + snapshot.otherVotes();
    }

    private String stateLabel(String stateId) {
        for (BaselineEntity county : catalog.countiesInState(stateId)) {
            if (county.stateCode() != null && !county.stateCode().isBlank()) {
                return county.stateCode().trim().toUpperCase();
            }
        }
        return "State " + stateId;
    }

    private static String partyName(Leader leader) {
        return switch (leader) {
            case GOP -> "Republicans";
            case DEM -> "Democrats";
            default -> "Neither party";
        };
    }
}
