package sandboxstudio.playback.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record SpeedRequest(
        @NotNull(message = "Speed is required")
        @Positive(message = "Speed must be positive")
        Double speed
) {}
