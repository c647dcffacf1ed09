package sandboxstudio.playback.controller;

import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import sandboxstudio.playback.domain.AggregateSnapshot;
import sandboxstudio.playback.domain.CountyState;
import sandboxstudio.playback.domain.NewsroomEvent;
import sandboxstudio.playback.domain.Rollups;
import sandboxstudio.playback.dto.ErrorResponse;
import sandboxstudio.playback.dto.FramePayload;
import sandboxstudio.playback.dto.OverrideRequest;
import sandboxstudio.playback.dto.PlaybackStateResponse;
import sandboxstudio.playback.dto.ScenarioLoadRequest;
import sandboxstudio.playback.dto.ScenarioResponse;
import sandboxstudio.playback.dto.SeekRequest;
import sandboxstudio.playback.dto.SpeedRequest;
import sandboxstudio.playback.dto.WarningsResponse;
import sandboxstudio.playback.engine.PlaybackEngine;
import sandboxstudio.playback.service.SimulationService;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/simulation")
public class SimulationController {

    private static final Logger log = LoggerFactory.getLogger(SimulationController.class);

    private final SimulationService simulationService;

    public SimulationController(SimulationService simulationService) {
        this.simulationService = simulationService;
    }

    // Scenario

    @PostMapping("/scenario")
    public ResponseEntity<ScenarioResponse> loadScenario(@Valid @RequestBody ScenarioLoadRequest request) {
        log.info("Loading scenario '{}' with {} counties", request.name(), request.counties().size());

        PlaybackEngine engine = simulationService.loadScenario(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ScenarioResponse.from(engine));
    }

    @GetMapping("/scenario")
    public ScenarioResponse getScenario() {
        return ScenarioResponse.from(simulationService.requireEngine());
    }

    @DeleteMapping("/scenario")
    public ResponseEntity<Void> resetScenario() {
        simulationService.reset();
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/frames")
    public ResponseEntity<PlaybackStateResponse> ingestFrame(@RequestBody FramePayload payload) {
        simulationService.ingestFrame(payload);
        return ResponseEntity.accepted().body(PlaybackStateResponse.from(simulationService.requireEngine()));
    }

    // Playback

    @PostMapping("/play")
    public PlaybackStateResponse play() {
        return PlaybackStateResponse.from(simulationService.play());
    }

    @PostMapping("/pause")
    public PlaybackStateResponse pause() {
        return PlaybackStateResponse.from(simulationService.pause());
    }

    @PostMapping("/speed")
    public PlaybackStateResponse setSpeed(@Valid @RequestBody SpeedRequest request) {
        return PlaybackStateResponse.from(simulationService.setSpeed(request.speed()));
    }

    @PostMapping("/seek")
    public ResponseEntity<?> seek(@Valid @RequestBody SeekRequest request) {
        if (request.seconds() != null) {
            return ResponseEntity.ok(PlaybackStateResponse.from(simulationService.seekToTime(request.seconds())));
        }
        if (request.percent() != null) {
            return ResponseEntity.ok(PlaybackStateResponse.from(simulationService.seekToPercent(request.percent())));
        }
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of("Bad Request", "Either seconds or percent is required"));
    }

    @GetMapping("/status")
    public PlaybackStateResponse getStatus() {
        return simulationService.currentEngine()
                .map(PlaybackStateResponse::from)
                .orElseGet(PlaybackStateResponse::idle);
    }

    // Counties

    @GetMapping("/counties")
    public Map<String, CountyState> getCounties() {
        return simulationService.requireEngine().getCurrentCountyState();
    }

    @GetMapping("/counties/{fips}")
    public ResponseEntity<CountyState> getCounty(@PathVariable String fips) {
        return simulationService.requireEngine().getCounty(fips)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PutMapping("/counties/{fips}/override")
    public ResponseEntity<CountyState> setOverride(@PathVariable String fips,
                                                   @Valid @RequestBody OverrideRequest request) {
        PlaybackEngine engine = simulationService.requireEngine();
        if (!engine.hasCounty(fips)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(simulationService.setManualOverride(fips, request.toOverride()));
    }

    @DeleteMapping("/counties/{fips}/override")
    public ResponseEntity<Void> clearOverride(@PathVariable String fips) {
        if (!simulationService.clearOverride(fips)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }

    // Aggregates

    @GetMapping("/aggregates/national")
    public ResponseEntity<AggregateSnapshot> getNational() {
        return simulationService.requireEngine().getAggregate(AggregateSnapshot.NATIONAL)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/aggregates/states")
    public Map<String, AggregateSnapshot> getStates() {
        Rollups rollups = simulationService.requireEngine().getRollups();
        return rollups == null ? Map.of() : rollups.states();
    }

    @GetMapping("/aggregates/states/{stateId}")
    public ResponseEntity<AggregateSnapshot> getState(@PathVariable String stateId) {
        if (AggregateSnapshot.NATIONAL.equalsIgnoreCase(stateId)) {
            return ResponseEntity.notFound().build();
        }
        return simulationService.requireEngine().getAggregate(stateId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    // Newsroom and diagnostics

    @GetMapping("/events")
    public List<NewsroomEvent> getEvents() {
        return simulationService.requireEngine().getNewsroomEvents();
    }

    @GetMapping("/warnings")
    public WarningsResponse getWarnings() {
        PlaybackEngine engine = simulationService.requireEngine();
        return new WarningsResponse(engine.unknownCounties(), engine.invariantCorrections(), engine.editedCounties());
    }
}
