package sandboxstudio.playback.domain;

import java.time.Instant;
import java.util.List;

public record Scenario(
        String scenarioId,
        String name,
        List<BaselineEntity> counties,
        double totalDurationSeconds,
        ReportingConfig reportingConfig,
        Instant createdAt
) {
    public Scenario {
        counties = List.copyOf(counties);
        reportingConfig = reportingConfig == null ? ReportingConfig.none() : reportingConfig;
    }
}
