package sandboxstudio.playback.domain;

import java.time.Instant;
import java.util.UUID;

/**
 * Discrete newsroom moment raised while the aggregates evolve.
 */
public record NewsroomEvent(
        String id,
        String type,
        double simulationTimeSeconds,
        String headline,
        String detail,
        Severity severity,
        String stateId,
        Double marginPercent,
        Double reportingPercent,
        Instant timestamp
) {
    public static NewsroomEvent create(String type, double simulationTimeSeconds, String headline, String detail,
                                       Severity severity, String stateId, Double marginPercent, Double reportingPercent) {
        return new NewsroomEvent(UUID.randomUUID().toString(), type, simulationTimeSeconds, headline, detail,
                severity, stateId, marginPercent, reportingPercent, Instant.now());
    }
}
