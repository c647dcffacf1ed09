package sandboxstudio.playback.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.Map;

/**
 * Scenario bootstrap: baseline catalog plus total simulated duration.
 */
public record ScenarioLoadRequest(
        @Size(max = 120, message = "Name must be at most 120 characters")
        String name,

        @NotNull(message = "Total duration is required")
        @Positive(message = "Total duration must be positive")
        Double totalDurationSeconds,

        @NotEmpty(message = "At least one county is required")
        List<@Valid BaselineCountyRequest> counties,

        Map<String, Object> reportingConfig
) {
    public ScenarioLoadRequest {
        if (name == null || name.isBlank()) {
            name = "Sandbox Scenario";
        }
    }
}
