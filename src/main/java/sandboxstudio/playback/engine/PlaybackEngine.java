package sandboxstudio.playback.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sandboxstudio.playback.domain.AggregateSnapshot;
import sandboxstudio.playback.domain.CountyOverride;
import sandboxstudio.playback.domain.CountyState;
import sandboxstudio.playback.domain.EntityIds;
import sandboxstudio.playback.domain.Frame;
import sandboxstudio.playback.domain.NewsroomEvent;
import sandboxstudio.playback.domain.PlaybackStatus;
import sandboxstudio.playback.domain.Rollups;
import sandboxstudio.playback.domain.Scenario;
import sandboxstudio.playback.exception.InvalidOverrideException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.LongSupplier;

/**
 * Playback and aggregation for one loaded scenario.
 *
 * <p>Frames are buffered on arrival and never applied directly. County state is rebuilt from the
 * buffer whenever the cursor moves (tick or seek), on an override, or on the next tick after new
 * frames arrived; each rebuild recomputes the rollups and scans them for newsroom events. Readers
 * only see the latest complete rebuild.
 *
 * <p>Disposing the engine is final: ticks and seeks stop, and a rebuild still running when
 * disposal happens is not published.
 */
public class PlaybackEngine {

    private static final Logger log = LoggerFactory.getLogger(PlaybackEngine.class);

    private final Scenario scenario;
    private final BaselineCatalog catalog;
    private final FrameBuffer buffer;
    private final CountyStateStore store;
    private final AggregationEngine aggregation;
    private final NewsroomEventGenerator newsroom;
    private final TimelineController timeline;

    private final List<NewsroomEvent> unpublishedEvents = new ArrayList<>();
    private Rollups rollups;
    private long derivedAtIngest = -1;
    private boolean dirty;
    private boolean disposed;

    public PlaybackEngine(Scenario scenario, EngineSettings settings, WinProbabilityEstimator winProbability,
                          LongSupplier nanoClock) {
        this.scenario = scenario;
        this.catalog = new BaselineCatalog(scenario.counties());
        this.buffer = new FrameBuffer();
        this.store = new CountyStateStore(catalog, buffer);
        this.aggregation = new AggregationEngine(catalog, winProbability, settings.noiseFloorPercent());
        this.newsroom = new NewsroomEventGenerator(settings.newsroom(), catalog, scenario.reportingConfig());
        this.timeline = new TimelineController(scenario.totalDurationSeconds(), nanoClock, this::deriveAt);
        timeline.rederive();
        log.info("Scenario {} loaded: {} counties in {} states, duration {}s",
                scenario.scenarioId(), catalog.size(), catalog.stateIds().size(), scenario.totalDurationSeconds());
    }

    // Feed

    /**
     * Buffers a frame. State is not touched until the next tick or seek.
     */
    public void ingest(Frame frame) {
        buffer.ingest(frame);
    }

    public void markFeedCompleted() {
        buffer.markFeedCompleted();
        log.info("Feed completed for scenario {} with {} frames", scenario.scenarioId(), buffer.ingestedFrames());
    }

    public void updateTotalDuration(double seconds) {
        timeline.updateTotalDuration(seconds);
    }

    public void fail(String message) {
        log.warn("Scenario {} feed failed: {}", scenario.scenarioId(), message);
        timeline.fail(message);
    }

    // Playback

    /**
     * Advances playback by one scheduler tick. When the cursor did not move but frames arrived
     * since the last rebuild, the state at the current cursor is rebuilt instead.
     */
    public boolean tick() {
        boolean moved = timeline.tick();
        if (!moved && hasUnderivedFrames() && acceptsRederive()) {
            timeline.rederive();
        }
        return moved;
    }

    public void play() {
        timeline.play();
    }

    public void pause() {
        timeline.pause();
    }

    public void setSpeed(double multiplier) {
        timeline.setSpeed(multiplier);
    }

    public void seekToTime(double seconds) {
        timeline.seekToTime(seconds);
    }

    public void seekToPercent(double percent) {
        timeline.seekToPercent(percent);
    }

    // Overrides

    public CountyState setManualOverride(String countyId, CountyOverride fields) {
        String id = requireCountyId(countyId);
        CountyState overridden = store.setManualOverride(id, fields, timeline.cursor());
        timeline.rederive();
        return overridden;
    }

    public boolean clearOverride(String countyId) {
        String id = requireCountyId(countyId);
        boolean cleared = store.clearOverride(id);
        if (cleared) {
            timeline.rederive();
        }
        return cleared;
    }

    public boolean isOverridden(String countyId) {
        String id = EntityIds.normalize(countyId);
        return id != null && store.isOverridden(id);
    }

    public Set<String> editedCounties() {
        return store.editedCounties();
    }

    // Reads

    public Map<String, CountyState> getCurrentCountyState() {
        return store.snapshot();
    }

    public Optional<CountyState> getCounty(String countyId) {
        String id = EntityIds.normalize(countyId);
        return id == null ? Optional.empty() : store.get(id);
    }

    public boolean hasCounty(String countyId) {
        String id = EntityIds.normalize(countyId);
        return id != null && store.isKnown(id);
    }

    public synchronized Rollups getRollups() {
        return rollups;
    }

    public Optional<AggregateSnapshot> getAggregate(String scope) {
        Rollups current = getRollups();
        return current == null ? Optional.empty() : current.scope(scope);
    }

    /** Newest first. */
    public List<NewsroomEvent> getNewsroomEvents() {
        return newsroom.events();
    }

    /**
     * Whether the buffer holds enough to scrub: a known duration and at least one frame.
     * Independent of whether playback is running.
     */
    public boolean isPlaybackReady() {
        PlaybackStatus status = timeline.status();
        return status != PlaybackStatus.IDLE
                && status != PlaybackStatus.ERROR
                && timeline.totalDuration() > 0
                && !buffer.isEmpty();
    }

    public boolean isPlaying() {
        return timeline.status() == PlaybackStatus.RUNNING;
    }

    public PlaybackStatus status() {
        return timeline.status();
    }

    public double cursor() {
        return timeline.cursor();
    }

    public double speed() {
        return timeline.speed();
    }

    public double totalDuration() {
        return timeline.totalDuration();
    }

    public double progressPercent() {
        return timeline.progressPercent();
    }

    public String errorMessage() {
        return timeline.errorMessage();
    }

    public int framesBuffered() {
        return buffer.size();
    }

    public boolean isFeedCompleted() {
        return buffer.isFeedCompleted();
    }

    public Set<String> unknownCounties() {
        return store.unknownCounties();
    }

    public int invariantCorrections() {
        return store.invariantCorrections();
    }

    public Scenario scenario() {
        return scenario;
    }

    public BaselineCatalog catalog() {
        return catalog;
    }

    // Broadcast support

    /**
     * Whether a rebuild was published since the last call.
     */
    public synchronized boolean isDirtyAndClear() {
        boolean wasDirty = dirty;
        dirty = false;
        return wasDirty;
    }

    /**
     * Events produced since the last call, oldest first.
     */
    public synchronized List<NewsroomEvent> drainNewEvents() {
        List<NewsroomEvent> drained = List.copyOf(unpublishedEvents);
        unpublishedEvents.clear();
        return drained;
    }

    public void dispose() {
        synchronized (this) {
            if (disposed) {
                return;
            }
            disposed = true;
            unpublishedEvents.clear();
        }
        timeline.dispose();
        store.dispose();
        buffer.dispose();
        newsroom.dispose();
        log.info("Scenario {} disposed", scenario.scenarioId());
    }

    public synchronized boolean isDisposed() {
        return disposed;
    }

    private void deriveAt(double cursorSeconds) {
        long ingested = buffer.ingestedFrames();
        Map<String, CountyState> states = store.applyUpToCursor(cursorSeconds);
        Rollups next = aggregation.compute(states, store.fingerprint(), cursorSeconds);
        List<NewsroomEvent> fresh = newsroom.process(next, cursorSeconds);

        synchronized (this) {
            if (disposed) {
                log.debug("Discarding rebuild at {}s for disposed scenario {}", cursorSeconds, scenario.scenarioId());
                return;
            }
            rollups = next;
            derivedAtIngest = ingested;
            unpublishedEvents.addAll(fresh);
            dirty = true;
        }
        log.trace("Rebuilt {} counties at {}s", states.size(), cursorSeconds);
    }

    private synchronized boolean hasUnderivedFrames() {
        return buffer.ingestedFrames() != derivedAtIngest;
    }

    private boolean acceptsRederive() {
        PlaybackStatus status = timeline.status();
        return status != PlaybackStatus.IDLE && status != PlaybackStatus.ERROR;
    }

    private String requireCountyId(String countyId) {
        String id = EntityIds.normalize(countyId);
        if (id == null) {
            throw new InvalidOverrideException(String.valueOf(countyId), "malformed county id");
        }
        return id;
    }
}
