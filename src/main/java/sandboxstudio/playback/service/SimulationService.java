package sandboxstudio.playback.service;

import io.micrometer.core.instrument.Counter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import sandboxstudio.playback.domain.BaselineEntity;
import sandboxstudio.playback.domain.CountyOverride;
import sandboxstudio.playback.domain.CountyState;
import sandboxstudio.playback.domain.CountyUpdate;
import sandboxstudio.playback.domain.EntityIds;
import sandboxstudio.playback.domain.Frame;
import sandboxstudio.playback.domain.ReportingConfig;
import sandboxstudio.playback.domain.Scenario;
import sandboxstudio.playback.dto.BaselineCountyRequest;
import sandboxstudio.playback.dto.FramePayload;
import sandboxstudio.playback.dto.ScenarioLoadRequest;
import sandboxstudio.playback.engine.EngineSettings;
import sandboxstudio.playback.engine.PlaybackEngine;
import sandboxstudio.playback.engine.WinProbabilityEstimator;
import sandboxstudio.playback.exception.ScenarioNotLoadedException;
import sandboxstudio.playback.exception.TransportException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongSupplier;

/**
 * Holds the single active scenario and routes commands to its engine.
 */
@Service
public class SimulationService {

    private static final Logger log = LoggerFactory.getLogger(SimulationService.class);

    private final EngineSettings settings;
    private final WinProbabilityEstimator winProbability;
    private final LongSupplier playbackClock;
    private final Counter framesIngestedCounter;
    private final Counter overridesCounter;

    private final AtomicReference<PlaybackEngine> active = new AtomicReference<>();

    public SimulationService(
            EngineSettings settings,
            WinProbabilityEstimator winProbability,
            LongSupplier playbackClock,
            @Qualifier("framesIngestedCounter") Counter framesIngestedCounter,
            @Qualifier("overridesCounter") Counter overridesCounter
    ) {
        this.settings = settings;
        this.winProbability = winProbability;
        this.playbackClock = playbackClock;
        this.framesIngestedCounter = framesIngestedCounter;
        this.overridesCounter = overridesCounter;
    }

    /**
     * Replaces the active scenario. The previous engine, if any, is disposed first so that its
     * in-flight work never reaches the new scenario's state.
     */
    public PlaybackEngine loadScenario(ScenarioLoadRequest request) {
        List<BaselineEntity> counties = request.counties().stream()
                .map(BaselineCountyRequest::toEntity)
                .toList();

        Scenario scenario = new Scenario(
                UUID.randomUUID().toString(),
                request.name(),
                counties,
                request.totalDurationSeconds(),
                new ReportingConfig(request.reportingConfig()),
                Instant.now()
        );

        PlaybackEngine engine = new PlaybackEngine(scenario, settings, winProbability, playbackClock);
        PlaybackEngine previous = active.getAndSet(engine);
        if (previous != null) {
            previous.dispose();
        }
        return engine;
    }

    /**
     * Disposes the active scenario, if any.
     */
    public boolean reset() {
        PlaybackEngine previous = active.getAndSet(null);
        if (previous == null) {
            return false;
        }
        previous.dispose();
        log.info("Scenario {} reset", previous.scenario().scenarioId());
        return true;
    }

    public Optional<PlaybackEngine> currentEngine() {
        return Optional.ofNullable(active.get());
    }

    public PlaybackEngine requireEngine() {
        PlaybackEngine engine = active.get();
        if (engine == null) {
            throw new ScenarioNotLoadedException();
        }
        return engine;
    }

    /**
     * Buffers one frame from the feed. Entries with a blank or malformed FIPS are skipped.
     *
     * @throws TransportException when the frame has no usable timestamp
     */
    public void ingestFrame(FramePayload payload) {
        PlaybackEngine engine = requireEngine();
        if (payload == null || payload.simulationTimeSeconds() == null) {
            throw new TransportException("Frame is missing simulationTimeSeconds");
        }
        double timestamp = payload.simulationTimeSeconds();
        if (!Double.isFinite(timestamp) || timestamp < 0) {
            throw new TransportException("Frame timestamp must be a non-negative number: " + timestamp);
        }

        Map<String, CountyUpdate> updates = new LinkedHashMap<>();
        List<CountyUpdate> counties = payload.counties() == null ? List.of() : payload.counties();
        for (CountyUpdate update : counties) {
            String id = update == null ? null : EntityIds.normalize(update.fips());
            if (id == null) {
                log.warn("Skipping county update with invalid FIPS at t={}s: {}", timestamp,
                        update == null ? null : update.fips());
                continue;
            }
            updates.put(id, update.withFips(id));
        }

        engine.ingest(new Frame(timestamp, updates));
        framesIngestedCounter.increment();
        log.debug("Frame buffered: t={}s, counties={}", timestamp, updates.size());
    }

    public void updateTotalDuration(double seconds) {
        requireEngine().updateTotalDuration(seconds);
    }

    public void markFeedCompleted() {
        requireEngine().markFeedCompleted();
    }

    public void failFeed(String message) {
        currentEngine().ifPresent(engine -> engine.fail(message));
    }

    /**
     * Advances the active scenario by one scheduler tick. No-op when nothing is loaded.
     */
    public void tick() {
        PlaybackEngine engine = active.get();
        if (engine != null && !engine.isDisposed()) {
            engine.tick();
        }
    }

    public PlaybackEngine play() {
        PlaybackEngine engine = requireEngine();
        engine.play();
        return engine;
    }

    public PlaybackEngine pause() {
        PlaybackEngine engine = requireEngine();
        engine.pause();
        return engine;
    }

    public PlaybackEngine setSpeed(double multiplier) {
        PlaybackEngine engine = requireEngine();
        engine.setSpeed(multiplier);
        return engine;
    }

    public PlaybackEngine seekToTime(double seconds) {
        PlaybackEngine engine = requireEngine();
        engine.seekToTime(seconds);
        return engine;
    }

    public PlaybackEngine seekToPercent(double percent) {
        PlaybackEngine engine = requireEngine();
        engine.seekToPercent(percent);
        return engine;
    }

    public CountyState setManualOverride(String countyId, CountyOverride fields) {
        CountyState overridden = requireEngine().setManualOverride(countyId, fields);
        overridesCounter.increment();
        return overridden;
    }

    public boolean clearOverride(String countyId) {
        return requireEngine().clearOverride(countyId);
    }
}
