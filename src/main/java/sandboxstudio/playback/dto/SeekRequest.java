package sandboxstudio.playback.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;

/**
 * Seek target, either absolute seconds or percent of the scenario duration.
 * Out-of-range seconds are clamped by the timeline.
 */
public record SeekRequest(
        Double seconds,

        @DecimalMin(value = "0.0", message = "Percent must be between 0 and 100")
        @DecimalMax(value = "100.0", message = "Percent must be between 0 and 100")
        Double percent
) {}
