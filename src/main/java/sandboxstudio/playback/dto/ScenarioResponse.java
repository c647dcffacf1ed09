package sandboxstudio.playback.dto;

import sandboxstudio.playback.domain.PlaybackStatus;
import sandboxstudio.playback.engine.PlaybackEngine;

import java.time.Instant;

public record ScenarioResponse(
        String scenarioId,
        String name,
        int counties,
        int states,
        double totalDurationSeconds,
        boolean hasReportingConfig,
        PlaybackStatus status,
        String topic,
        Instant createdAt
) {
    public static ScenarioResponse from(PlaybackEngine engine) {
        var scenario = engine.scenario();
        return new ScenarioResponse(
                scenario.scenarioId(),
                scenario.name(),
                engine.catalog().size(),
                engine.catalog().stateIds().size(),
                engine.totalDuration(),
                scenario.reportingConfig().isPresent(),
                engine.status(),
                "/topic/simulation/" + scenario.scenarioId(),
                scenario.createdAt()
        );
    }
}
